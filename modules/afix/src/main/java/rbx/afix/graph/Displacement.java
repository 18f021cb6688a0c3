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

/**
 * Displacement parameters of an atom: an independent isotropic U, six anisotropic Uij, or a
 * multiple of the equivalent isotropic U of the attached atom.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface Displacement {

  /**
   * An isotropic U refined on its own.
   *
   * @param uIso the isotropic displacement parameter.
   */
  record Independent(double uIso) implements Displacement {
  }

  /**
   * Anisotropic displacement parameters in SHELXL order.
   */
  record Anisotropic(double u11, double u22, double u33, double u23, double u13, double u12)
      implements Displacement {

    /**
     * The parameters in SHELXL order: U11 U22 U33 U23 U13 U12.
     *
     * @return a new array of six values.
     */
    public double[] values() {
      return new double[] {u11, u22, u33, u23, u13, u12};
    }
  }

  /**
   * Uiso = factor * Ueq of the attached atom. SHELXL stores it as the negative number -factor.
   *
   * @param factor the positive multiplier.
   */
  record MultiplierOf(double factor) implements Displacement {
  }
}
