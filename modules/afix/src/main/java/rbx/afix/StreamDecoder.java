// ******************************************************************************
//
// Title:       RBX.
// Description: RBX - Rigid-Body constraint eXchange for SHELXL and CIF.
// Copyright:   Copyright (c) RBX developers 2023.
//
// This file is part of RBX.
//
// RBX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// RBX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// RBX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package rbx.afix;

import static java.lang.String.format;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import rbx.afix.graph.AtomRecord;
import rbx.afix.graph.ConstraintDef;
import rbx.afix.graph.ConstraintGraph;
import rbx.afix.parsers.AfixLine;
import rbx.afix.parsers.AtomLine;
import rbx.afix.parsers.InsLine;
import rbx.utilities.StringUtils;

/**
 * The StreamDecoder class turns a sequence of AFIX directives and atom lines into a constraint
 * graph.
 * <p>
 * Open groups are kept on a stack. A closing directive (n in {0, 1, 2, 5, 6, 9}) pops the
 * innermost group, which resumes the enclosing one. A continuation (n = 5) restarts the group
 * it closed, or the enclosing group of the same shape, with a new anchor and the same
 * constraint definition. Hydrogen atoms inside a rigid body do not belong to the body.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class StreamDecoder {

  private static final Logger logger = Logger.getLogger(StreamDecoder.class.getName());

  /**
   * Decode an atom table.
   *
   * @param lines the classified lines; opaque lines are skipped.
   * @param types resolves SFAC indices.
   * @return the ConstraintGraph.
   * @throws UnsupportedShapeCodeException if a directive names an unknown shape.
   * @throws UnsupportedDofCodeException   if a group with an unsupported n receives an atom.
   * @throws MalformedDirectiveException   if an atom cannot be placed.
   */
  public ConstraintGraph decode(List<? extends InsLine> lines, AtomTypeLookup types)
      throws UnsupportedShapeCodeException, UnsupportedDofCodeException, MalformedDirectiveException {
    Deque<DirectiveStackFrame> stack = new ArrayDeque<>();
    Map<String, ConstraintDef> catalogue = new LinkedHashMap<>();
    List<AtomRecord> atoms = new ArrayList<>();
    Set<String> labels = new HashSet<>();
    String lastAtomLabel = null;

    for (InsLine line : lines) {
      if (line instanceof AfixLine afixLine) {
        applyDirective(afixLine, stack);
      } else if (line instanceof AtomLine atomLine) {
        String element = types.element(atomLine.typeIndex());
        if (element == null) {
          throw new MalformedDirectiveException(atomLine.lineNumber(), atomLine.text(),
              format("Scattering type %d is not defined by SFAC.", atomLine.typeIndex()));
        }
        String label = StringUtils.normalizeLabel(atomLine.label(), element);
        if (!labels.add(label)) {
          throw new MalformedDirectiveException(atomLine.lineNumber(), atomLine.text(),
              format("Atom label %s is used more than once.", label));
        }
        AtomRecord atom = AtomRecord.unconstrained(label, element, atomLine.typeIndex(), atomLine.x(),
            atomLine.y(), atomLine.z(), atomLine.occupancy(), atomLine.displacement());

        DirectiveStackFrame top = stack.peek();
        if (top == null) {
          atoms.add(atom);
          lastAtomLabel = label;
          continue;
        }
        if (top.category == ShapeCategory.WHOLE_BODY && types.isHydrogen(atomLine.typeIndex())) {
          // Riding hydrogens are not part of the rigid body.
          atoms.add(atom);
          continue;
        }

        ConstraintDef def = catalogue.get(top.code.constraintId());
        if (def == null) {
          def = DirectiveCodeTable.constraintDef(top.code);
          catalogue.put(def.id(), def);
        }

        String attachedTo;
        int positionIndex;
        if (top.memberCount == 0) {
          if (top.category == ShapeCategory.WHOLE_BODY) {
            attachedTo = null;
            top.anchorLabel = label;
          } else {
            if (lastAtomLabel == null) {
              throw new MalformedDirectiveException(atomLine.lineNumber(), atomLine.text(),
                  format("%s has no preceding atom to attach to.", top.code));
            }
            attachedTo = lastAtomLabel;
            top.anchorLabel = lastAtomLabel;
          }
          top.memberCount = 1;
          positionIndex = 1;
        } else {
          attachedTo = top.anchorLabel;
          positionIndex = ++top.memberCount;
        }
        atoms.add(atom.withConstraint(attachedTo, def.id(), positionIndex));
        lastAtomLabel = label;
      }
    }

    ConstraintGraph graph = new ConstraintGraph(atoms, catalogue.values());
    if (logger.isLoggable(Level.FINE)) {
      int constrained = 0;
      for (AtomRecord atom : atoms) {
        if (atom.isConstrained()) {
          constrained++;
        }
      }
      logger.fine(format(" Decoded %d atoms (%d constrained) with %d constraint definitions.",
          atoms.size(), constrained, catalogue.size()));
    }
    return graph;
  }

  private static void applyDirective(AfixLine afixLine, Deque<DirectiveStackFrame> stack)
      throws UnsupportedShapeCodeException {
    AfixCode code = afixLine.code();
    if (code.dofCode() != 0) {
      DirectiveCodeTable.shapeDescription(code.shapeCode());
    }
    DirectiveStackFrame popped = null;
    if (code.isClosing() && !stack.isEmpty()) {
      popped = stack.pop();
    }
    if (code.dofCode() == 0) {
      log(code, popped, null);
      return;
    }
    if (code.isContinuation()) {
      DirectiveStackFrame source = null;
      if (popped != null && popped.code.shapeCode() == code.shapeCode()) {
        source = popped;
      } else if (!stack.isEmpty() && stack.peek().code.shapeCode() == code.shapeCode()) {
        source = stack.pop();
      }
      DirectiveStackFrame pushed = null;
      if (source != null) {
        pushed = new DirectiveStackFrame(source.code);
        stack.push(pushed);
      }
      log(code, popped, pushed);
      return;
    }
    DirectiveStackFrame pushed = new DirectiveStackFrame(code);
    stack.push(pushed);
    log(code, popped, pushed);
  }

  private static void log(AfixCode code, DirectiveStackFrame popped, DirectiveStackFrame pushed) {
    if (logger.isLoggable(Level.FINER)) {
      logger.finer(format(" %-9s closes %-9s opens %s", code,
          popped == null ? "-" : popped.code, pushed == null ? "-" : pushed.code));
    }
  }

  /**
   * An open constraint group.
   */
  private static class DirectiveStackFrame {

    private final AfixCode code;
    private final ShapeCategory category;
    private String anchorLabel;
    private int memberCount;

    DirectiveStackFrame(AfixCode code) {
      this.code = code;
      this.category = DirectiveCodeTable.category(code);
    }
  }
}
