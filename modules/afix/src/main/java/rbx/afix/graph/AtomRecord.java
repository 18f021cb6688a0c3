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

/**
 * One atom of a constraint graph.
 *
 * @param label         unique atom label.
 * @param element       element symbol of the scattering type.
 * @param typeIndex     1-based SFAC index.
 * @param attachedTo    label of the atom this one rides on, or null.
 * @param constraintId  id of the ConstraintDef, or null when unconstrained.
 * @param positionIndex 1-based position within the group; 0 when unconstrained.
 * @param x             fractional x.
 * @param y             fractional y.
 * @param z             fractional z.
 * @param occupancy     SHELXL occupancy, including the fixed/free flag.
 * @param displacement  displacement parameters.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record AtomRecord(String label, String element, int typeIndex, String attachedTo,
                         String constraintId, int positionIndex, double x, double y, double z,
                         double occupancy, Displacement displacement) {

  public AtomRecord {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException(" An atom label is required.");
    }
    if (displacement == null) {
      throw new IllegalArgumentException(format(" Atom %s has no displacement parameters.", label));
    }
  }

  /**
   * An atom outside of every constraint group.
   */
  public static AtomRecord unconstrained(String label, String element, int typeIndex,
                                         double x, double y, double z, double occupancy,
                                         Displacement displacement) {
    return new AtomRecord(label, element, typeIndex, null, null, 0, x, y, z, occupancy, displacement);
  }

  public boolean isConstrained() {
    return constraintId != null;
  }

  public boolean isAttached() {
    return attachedTo != null;
  }

  /**
   * An anchor carries a constraint but is attached to nothing.
   */
  public boolean isAnchor() {
    return constraintId != null && attachedTo == null;
  }

  public boolean isHydrogen() {
    return "H".equalsIgnoreCase(element) || "D".equalsIgnoreCase(element);
  }

  /**
   * A copy of this atom with a different constraint assignment.
   */
  public AtomRecord withConstraint(String attachedTo, String constraintId, int positionIndex) {
    return new AtomRecord(label, element, typeIndex, attachedTo, constraintId, positionIndex,
        x, y, z, occupancy, displacement);
  }

  @Override
  public String toString() {
    if (constraintId == null) {
      return label;
    }
    return format("%s (%s %d, attached to %s)", label, constraintId, positionIndex,
        attachedTo == null ? "." : attachedTo);
  }
}
