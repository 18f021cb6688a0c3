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

import java.util.Map;
import java.util.Set;

import rbx.afix.graph.ConstraintDef;

/**
 * Static catalogue of the AFIX shape codes (m) and degrees-of-freedom codes (n) that can be
 * converted to constraint definitions.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DirectiveCodeTable {

  /**
   * Largest directive code accepted on an AFIX line.
   */
  public static final int MAX_DIRECTIVE_CODE = 169;

  /**
   * Largest supported shape code.
   */
  public static final int MAX_SHAPE_CODE = 16;

  private static final String POSN_INDEX = "_atom_site.qcrbox_constraint_posn_index";

  private static final Map<Integer, String> SHAPES = Map.ofEntries(
      Map.entry(0, "Relative positioning of the atoms was kept fixed."),
      Map.entry(1, "Idealized tertiary C-H with all equal X-C-H angles for all three substituents of C."),
      Map.entry(2, "Idealized secondary CH2 with equal X-C-H and Y-C-H angles and H-C-H adapted to X-C-Y."),
      Map.entry(3, "Idealized CH3 group with tetrahedral angles, staggered with respect to the shortest"
          + " bond to the attached atom."),
      Map.entry(4, "Aromatic C-H or amide N-H with hydrogen on the external bisector of the X-C-Y or"
          + " X-N-Y angle."),
      Map.entry(5, "Atoms are fitted to a regular pentagon."),
      Map.entry(6, "Atoms are fitted to a regular hexagon."),
      Map.entry(7, "Atoms are fitted to a regular hexagon."),
      Map.entry(8, "Idealized OH group with tetrahedral X-O-H angle, choosing hydrogen position based"
          + " on best hydrogen bonding."),
      Map.entry(9, "Idealized terminal X=CH2 or X=NH2+ with hydrogens in the plane of the nearest"
          + " substituent."),
      Map.entry(10, "Atoms are fitted to generate an idealized pentamethylcyclopentadienyl anion. Atoms"
          + " with " + POSN_INDEX + " 1 to 5 form the cyclopentadienyl ring while atoms with "
          + POSN_INDEX + " 6 to 10 are the methyl groups."),
      Map.entry(11, "Atoms are fitted to generate an idealized naphthalene molecule. The values for "
          + POSN_INDEX + " follow a symmetrical figure of eight starting with the alpha and then the"
          + " beta carbon atoms."),
      Map.entry(12, "Idealized disordered methyl group with two positions rotated by 60 degrees."),
      Map.entry(13, "Idealized CH3 group with tetrahedral angles. The atom position with "
          + POSN_INDEX + " 1 defines the torsion angle."),
      Map.entry(14, "Idealized OH group with tetrahedral X-O-H angle. The atom position with "
          + POSN_INDEX + " 1 defines the torsion angle."),
      Map.entry(15, "BH group with hydrogen placed along the negative sum vector of unit vectors of the"
          + " other bonds to boron."),
      Map.entry(16, "Acetylenic C-H with linear X-C-H."));

  // R: rigid group, D: distances, O: orientation, T: torsion.
  private static final Map<Integer, String> DOF_POLICIES = Map.of(
      1, ".",
      3, "R",
      4, "RD",
      6, "RO",
      7, "RT",
      8, "RDT",
      9, "RDO");

  private static final Set<Integer> WHOLE_BODY_SHAPES = Set.of(5, 6, 7, 10, 11);

  private static final Set<Integer> CLOSING_DOFS = Set.of(0, 1, 2, 5, 6, 9);

  private DirectiveCodeTable() {
  }

  /**
   * Description of the idealized geometry selected by a shape code.
   *
   * @param shapeCode the AFIX m.
   * @return the description.
   * @throws UnsupportedShapeCodeException for m outside 0..16.
   */
  public static String shapeDescription(int shapeCode) throws UnsupportedShapeCodeException {
    String description = SHAPES.get(shapeCode);
    if (description == null) {
      throw new UnsupportedShapeCodeException(shapeCode);
    }
    return description;
  }

  /**
   * Refinement policy tag of a degrees-of-freedom code.
   *
   * @param dofCode the AFIX n.
   * @return one of ".", "R", "RD", "RO", "RT", "RDT" or "RDO".
   * @throws UnsupportedDofCodeException for n in {0, 2, 5} or outside 0..9.
   */
  public static String dofPolicy(int dofCode) throws UnsupportedDofCodeException {
    String policy = DOF_POLICIES.get(dofCode);
    if (policy == null) {
      throw new UnsupportedDofCodeException(dofCode);
    }
    return policy;
  }

  public static boolean isSupportedShape(int shapeCode) {
    return SHAPES.containsKey(shapeCode);
  }

  static boolean isClosingDof(int dofCode) {
    return CLOSING_DOFS.contains(dofCode);
  }

  /**
   * Rigid bodies use shape codes {5, 6, 7, 10, 11} together with a closing n; every other
   * combination places atoms relative to the preceding atom.
   *
   * @param shapeCode the AFIX m.
   * @param dofCode   the AFIX n.
   * @return the ShapeCategory.
   */
  public static ShapeCategory category(int shapeCode, int dofCode) {
    if (WHOLE_BODY_SHAPES.contains(shapeCode) && CLOSING_DOFS.contains(dofCode)) {
      return ShapeCategory.WHOLE_BODY;
    }
    return ShapeCategory.HYDROGEN_PLACEMENT;
  }

  public static ShapeCategory category(AfixCode code) {
    return category(code.shapeCode(), code.dofCode());
  }

  /**
   * Build the constraint definition for a directive code. Both lookups must succeed.
   *
   * @param code the directive code.
   * @return the ConstraintDef.
   * @throws UnsupportedShapeCodeException if m is unknown.
   * @throws UnsupportedDofCodeException   if n has no refinement policy.
   */
  public static ConstraintDef constraintDef(AfixCode code)
      throws UnsupportedShapeCodeException, UnsupportedDofCodeException {
    return new ConstraintDef(code.constraintId(), code.shapeCode(), code.dofCode(),
        shapeDescription(code.shapeCode()), dofPolicy(code.dofCode()));
  }
}
