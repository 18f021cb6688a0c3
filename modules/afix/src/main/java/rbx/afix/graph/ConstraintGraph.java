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
package rbx.afix.graph;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Atoms with their constraint assignments in discovery order, together with the catalogue of
 * constraint definitions they reference.
 * <p>
 * Two graphs are equal when they hold the same atoms, matched by label, and the same catalogue,
 * regardless of order.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ConstraintGraph {

  private final List<AtomRecord> atoms;
  private final Map<String, AtomRecord> atomsByLabel;
  private final Map<String, ConstraintDef> catalogue;

  /**
   * Constructor for ConstraintGraph.
   *
   * @param atoms     the atoms, labels must be unique.
   * @param catalogue the constraint definitions.
   */
  public ConstraintGraph(List<AtomRecord> atoms, Collection<ConstraintDef> catalogue) {
    Map<String, AtomRecord> byLabel = new LinkedHashMap<>();
    for (AtomRecord atom : atoms) {
      if (byLabel.put(atom.label(), atom) != null) {
        throw new IllegalArgumentException(format(" Atom label %s is not unique.", atom.label()));
      }
    }
    Map<String, ConstraintDef> defs = new LinkedHashMap<>();
    for (ConstraintDef def : catalogue) {
      if (defs.put(def.id(), def) != null) {
        throw new IllegalArgumentException(format(" Constraint id %s is not unique.", def.id()));
      }
    }
    this.atoms = List.copyOf(atoms);
    this.atomsByLabel = Collections.unmodifiableMap(byLabel);
    this.catalogue = Collections.unmodifiableMap(defs);
  }

  public List<AtomRecord> getAtoms() {
    return atoms;
  }

  public AtomRecord getAtom(String label) {
    return atomsByLabel.get(label);
  }

  public boolean hasAtom(String label) {
    return atomsByLabel.containsKey(label);
  }

  /**
   * Constraint definitions keyed by id, in insertion order.
   */
  public Map<String, ConstraintDef> getCatalogue() {
    return catalogue;
  }

  public ConstraintDef getConstraint(String id) {
    return catalogue.get(id);
  }

  public int size() {
    return atoms.size();
  }

  /**
   * Atoms attached to the given atom, in discovery order.
   *
   * @param label the parent label.
   * @return the attached atoms.
   */
  public List<AtomRecord> getAttached(String label) {
    List<AtomRecord> attached = new ArrayList<>();
    for (AtomRecord atom : atoms) {
      if (label.equals(atom.attachedTo())) {
        attached.add(atom);
      }
    }
    return attached;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConstraintGraph other)) {
      return false;
    }
    return atomsByLabel.equals(other.atomsByLabel) && catalogue.equals(other.catalogue);
  }

  @Override
  public int hashCode() {
    return 31 * atomsByLabel.hashCode() + catalogue.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" Constraint graph with %d atoms and %d definitions",
        atoms.size(), catalogue.size()));
    for (AtomRecord atom : atoms) {
      sb.append(format("\n  %s", atom));
    }
    return sb.toString();
  }
}
