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

import rbx.afix.AfixCode;

/**
 * A constraint definition shared by every group that uses the same AFIX code.
 *
 * @param id               the synthetic id, SXL followed by m and n.
 * @param shapeCode        the AFIX m.
 * @param dofCode          the AFIX n.
 * @param shapeDescription description of the idealized geometry.
 * @param dofPolicy        which refinement parameters stay free.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record ConstraintDef(String id, int shapeCode, int dofCode, String shapeDescription, String dofPolicy) {

  public AfixCode code() {
    return new AfixCode(shapeCode, dofCode);
  }
}
