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
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;

import rbx.afix.graph.AtomRecord;
import rbx.afix.graph.ConstraintDef;
import rbx.afix.graph.ConstraintGraph;
import rbx.afix.graph.Displacement;
import rbx.utilities.RBXProperties;
import rbx.utilities.StringUtils;

/**
 * The GraphEncoder class writes a constraint graph as the atom table of a SHELXL instruction file,
 * with AFIX directives nested so that {@link StreamDecoder} reads back the same graph.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class GraphEncoder {

  private static final Logger logger = Logger.getLogger(GraphEncoder.class.getName());

  private static final String CLOSE = "AFIX 0";
  /**
   * Opens a group that no atom is written into.
   */
  private static final AfixCode PLACEHOLDER = new AfixCode(0, 3);

  private final int lineWidth;

  /**
   * Constructor for GraphEncoder using the default line width.
   */
  public GraphEncoder() {
    this(RBXProperties.DEFAULT_INS_LINE_WIDTH);
  }

  /**
   * Constructor for GraphEncoder.
   *
   * @param properties reads <code>ins-line-width</code>.
   */
  public GraphEncoder(CompositeConfiguration properties) {
    this(properties.getInt(RBXProperties.INS_LINE_WIDTH, RBXProperties.DEFAULT_INS_LINE_WIDTH));
  }

  /**
   * Constructor for GraphEncoder.
   *
   * @param lineWidth width at which atom lines are wrapped.
   */
  public GraphEncoder(int lineWidth) {
    if (lineWidth < 20) {
      throw new IllegalArgumentException(format(" Instruction line width %d is too small.", lineWidth));
    }
    this.lineWidth = lineWidth;
  }

  public int getLineWidth() {
    return lineWidth;
  }

  /**
   * Encode a constraint graph.
   *
   * @param graph the ConstraintGraph.
   * @return the atom table lines; a long atom line is wrapped with the " =" continuation and so
   *     may span several physical lines.
   * @throws UnsupportedShapeCodeException if a definition names an unknown shape.
   * @throws UnsupportedDofCodeException   if a definition names an unsupported n.
   * @throws AttachmentCycleException      if attached atoms form a cycle.
   * @throws UnencodableGraphException     if AFIX instructions cannot express the graph.
   */
  public List<String> encode(ConstraintGraph graph) throws UnsupportedShapeCodeException,
      UnsupportedDofCodeException, AttachmentCycleException, UnencodableGraphException {
    Map<String, AfixCode> codes = checkCatalogue(graph);
    checkReferences(graph);
    checkCycles(graph);
    Groups groups = collectGroups(graph, codes);

    Emitter emitter = new Emitter(groups, codes);
    for (AtomRecord atom : graph.getAtoms()) {
      if (!atom.isAttached()) {
        emitter.emitRoot(atom);
      }
    }
    emitter.closeAll();

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Encoded %d atoms as %d instruction lines.", graph.size(), emitter.lines.size()));
    }
    return emitter.lines;
  }

  /**
   * Format an atom line: <code>LABEL TYPE X Y Z OCC U...</code>, wrapped at the line width.
   *
   * @param atom the atom.
   * @return the formatted line.
   */
  public String atomLine(AtomRecord atom) {
    StringBuilder sb = new StringBuilder();
    sb.append(atom.label()).append(' ').append(atom.typeIndex());
    sb.append(StringUtils.fwDecOrExact(atom.x(), 10, 5));
    sb.append(StringUtils.fwDecOrExact(atom.y(), 10, 5));
    sb.append(StringUtils.fwDecOrExact(atom.z(), 10, 5));
    sb.append(StringUtils.fwDecOrExact(atom.occupancy(), 10, 5));
    Displacement displacement = atom.displacement();
    if (displacement instanceof Displacement.Anisotropic aniso) {
      for (double u : aniso.values()) {
        sb.append(StringUtils.fwDecOrExact(u, 10, 5));
      }
    } else if (displacement instanceof Displacement.MultiplierOf multiplier) {
      sb.append(" -").append(StringUtils.decOrExact(multiplier.factor(), 2));
    } else if (displacement instanceof Displacement.Independent independent) {
      sb.append(StringUtils.fwDecOrExact(independent.uIso(), 10, 5));
    }
    return StringUtils.wrapInstruction(sb.toString(), lineWidth);
  }

  private static Map<String, AfixCode> checkCatalogue(ConstraintGraph graph)
      throws UnsupportedShapeCodeException, UnsupportedDofCodeException, UnencodableGraphException {
    Map<String, AfixCode> codes = new HashMap<>();
    for (ConstraintDef def : graph.getCatalogue().values()) {
      if (!AfixCode.isConstraintId(def.id())) {
        throw new UnencodableGraphException(def.id(), "Only SXL constraint ids can be written as AFIX.");
      }
      AfixCode code = AfixCode.fromConstraintId(def.id());
      if (code.shapeCode() != def.shapeCode() || code.dofCode() != def.dofCode()) {
        throw new UnencodableGraphException(def.id(),
            format("The id does not match m=%d n=%d.", def.shapeCode(), def.dofCode()));
      }
      DirectiveCodeTable.shapeDescription(code.shapeCode());
      DirectiveCodeTable.dofPolicy(code.dofCode());
      codes.put(def.id(), code);
    }
    return codes;
  }

  private static void checkReferences(ConstraintGraph graph) throws UnencodableGraphException {
    for (AtomRecord atom : graph.getAtoms()) {
      String label = atom.label();
      if (atom.isAttached() && !graph.hasAtom(atom.attachedTo())) {
        throw new UnencodableGraphException(label, format("Attached atom %s does not exist.", atom.attachedTo()));
      }
      if (atom.isConstrained() && graph.getConstraint(atom.constraintId()) == null) {
        throw new UnencodableGraphException(label,
            format("Constraint %s is not in the catalogue.", atom.constraintId()));
      }
      if (atom.isAttached() && !atom.isConstrained()) {
        throw new UnencodableGraphException(label, "An attached atom needs a constraint id.");
      }
      if (atom.isConstrained() && atom.positionIndex() < 1) {
        throw new UnencodableGraphException(label,
            format("Position index %d is not positive.", atom.positionIndex()));
      }
    }
  }

  private static void checkCycles(ConstraintGraph graph) throws AttachmentCycleException {
    int n = graph.size();
    for (AtomRecord atom : graph.getAtoms()) {
      List<String> path = new ArrayList<>();
      path.add(atom.label());
      AtomRecord current = atom;
      int steps = 0;
      while (current != null && current.isAttached()) {
        if (++steps > n) {
          throw new AttachmentCycleException(atom.label(), path);
        }
        path.add(current.attachedTo());
        current = graph.getAtom(current.attachedTo());
      }
    }
  }

  /**
   * Split the atoms attached to each parent into the rigid-body members it anchors and the single
   * group that hangs off it.
   */
  private static Groups collectGroups(ConstraintGraph graph, Map<String, AfixCode> codes)
      throws UnencodableGraphException {
    Groups groups = new Groups();
    for (AtomRecord atom : graph.getAtoms()) {
      if (atom.isAnchor()) {
        AfixCode code = codes.get(atom.constraintId());
        if (DirectiveCodeTable.category(code) != ShapeCategory.WHOLE_BODY) {
          throw new UnencodableGraphException(atom.label(),
              format("%s places atoms relative to a preceding atom and cannot anchor a group.", code));
        }
        if (atom.isHydrogen()) {
          throw new UnencodableGraphException(atom.label(), "A hydrogen cannot anchor a rigid body.");
        }
        if (atom.positionIndex() != 1) {
          throw new UnencodableGraphException(atom.label(),
              format("Anchor position index is %d rather than 1.", atom.positionIndex()));
        }
      }
    }

    Comparator<AtomRecord> byPosition = Comparator.comparingInt(AtomRecord::positionIndex);
    for (AtomRecord parent : graph.getAtoms()) {
      List<AtomRecord> body = new ArrayList<>();
      List<AtomRecord> hanging = new ArrayList<>();
      for (AtomRecord child : graph.getAttached(parent.label())) {
        if (parent.isAnchor() && parent.constraintId().equals(child.constraintId())) {
          body.add(child);
        } else {
          hanging.add(child);
        }
      }
      body.sort(byPosition);
      hanging.sort(byPosition);

      if (!body.isEmpty()) {
        for (AtomRecord member : body) {
          if (member.isHydrogen()) {
            throw new UnencodableGraphException(member.label(),
                "A hydrogen inside a rigid body is not a member of the body.");
          }
        }
        checkContiguous(body, 2);
        groups.body.put(parent.label(), body);
      }
      if (!hanging.isEmpty()) {
        String id = hanging.get(0).constraintId();
        for (AtomRecord member : hanging) {
          if (!id.equals(member.constraintId())) {
            throw new UnencodableGraphException(parent.label(),
                format("Both %s and %s hang off the same atom.", id, member.constraintId()));
          }
        }
        AfixCode code = codes.get(id);
        if (DirectiveCodeTable.category(code) != ShapeCategory.HYDROGEN_PLACEMENT) {
          throw new UnencodableGraphException(parent.label(),
              format("The rigid body %s cannot hang off another atom.", code));
        }
        checkContiguous(hanging, 1);
        groups.hanging.put(parent.label(), hanging);
      }
    }
    return groups;
  }

  private static void checkContiguous(List<AtomRecord> members, int first) throws UnencodableGraphException {
    int expected = first;
    for (AtomRecord member : members) {
      if (member.positionIndex() != expected) {
        throw new UnencodableGraphException(member.label(),
            format("Position index %d where %d was expected.", member.positionIndex(), expected));
      }
      expected++;
    }
  }

  private static class Groups {

    /**
     * Rigid-body members keyed by anchor label.
     */
    private final Map<String, List<AtomRecord>> body = new LinkedHashMap<>();
    /**
     * The group hanging off an atom, keyed by that atom's label.
     */
    private final Map<String, List<AtomRecord>> hanging = new LinkedHashMap<>();
  }

  private static class Frame {

    private final AfixCode code;
    private boolean closed;
    /**
     * Members still to be written into this group.
     */
    private int pending;

    Frame(AfixCode code) {
      this.code = code;
    }
  }

  /**
   * Writes lines while tracking the groups the decoder will have open at each point.
   */
  private class Emitter {

    private final Groups groups;
    private final Map<String, AfixCode> codes;
    private final Deque<Frame> open = new ArrayDeque<>();
    private final List<String> lines = new ArrayList<>();

    Emitter(Groups groups, Map<String, AfixCode> codes) {
      this.groups = groups;
      this.codes = codes;
    }

    void emitRoot(AtomRecord atom) throws UnencodableGraphException {
      if (!atom.isConstrained()) {
        closeAll();
        emitAtom(atom, null);
        return;
      }
      AfixCode code = codes.get(atom.constraintId());
      AfixCode directive;
      if (canContinue(code)) {
        directive = new AfixCode(code.shapeCode(), 5);
        // The continuation closes the frames it resumes.
        while (!open.isEmpty()) {
          open.pop().closed = true;
        }
      } else {
        closeAll();
        directive = code;
      }
      directive(directive);
      Frame frame = new Frame(code);
      List<AtomRecord> body = groups.body.get(atom.label());
      frame.pending = body == null ? 0 : body.size();
      open.push(frame);
      emitAtom(atom, frame);
    }

    /**
     * The decoder restarts a group from an n = 5 directive when the open group has the same code,
     * or when it sits directly below a group of another shape.
     */
    private boolean canContinue(AfixCode code) {
      if (open.size() == 1) {
        return open.peek().code.equals(code);
      }
      if (open.size() == 2) {
        Frame top = open.peekFirst();
        Frame below = open.peekLast();
        return below.code.equals(code) && top.code.shapeCode() != code.shapeCode();
      }
      return false;
    }

    private void emitAtom(AtomRecord atom, Frame own) throws UnencodableGraphException {
      lines.add(atomLine(atom));

      List<AtomRecord> hanging = groups.hanging.get(atom.label());
      if (hanging != null) {
        AfixCode code = codes.get(hanging.get(0).constraintId());
        if (code.isClosing() && !open.isEmpty()) {
          if (open.peek().pending > 0) {
            // The closing directive pops this empty group instead of the unfinished one.
            directive(PLACEHOLDER);
            open.push(new Frame(PLACEHOLDER));
          }
          open.pop().closed = true;
        }
        directive(code);
        Frame frame = new Frame(code);
        frame.pending = hanging.size();
        open.push(frame);
        for (AtomRecord member : hanging) {
          closeTo(frame, member);
          frame.pending--;
          emitAtom(member, frame);
        }
      }

      List<AtomRecord> body = groups.body.get(atom.label());
      if (body != null) {
        for (AtomRecord member : body) {
          closeTo(own, member);
          own.pending--;
          emitAtom(member, own);
        }
      }
    }

    private void closeTo(Frame frame, AtomRecord member) throws UnencodableGraphException {
      if (frame.closed) {
        throw new UnencodableGraphException(member.label(),
            format("The %s group was closed by a later directive and cannot be resumed.", frame.code));
      }
      while (open.peek() != frame) {
        lines.add(CLOSE);
        open.pop().closed = true;
      }
    }

    void closeAll() {
      while (!open.isEmpty()) {
        lines.add(CLOSE);
        open.pop().closed = true;
      }
    }

    private void directive(AfixCode code) {
      lines.add(code.directive());
      if (logger.isLoggable(Level.FINER)) {
        logger.finer(format(" %s with %d open groups.", code, open.size()));
      }
    }
  }
}
