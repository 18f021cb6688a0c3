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

import java.util.List;

/**
 * Thrown when following attached-atom references from an atom never reaches an unattached atom.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class AttachmentCycleException extends AfixException {

  /**
   * Atom whose attachment chain does not terminate.
   */
  public final String label;
  /**
   * The labels visited before giving up.
   */
  public final List<String> path;

  public AttachmentCycleException(String label, List<String> path) {
    super(format(" The attached atoms of %s form a cycle: %s", label, String.join(" -> ", path)));
    this.label = label;
    this.path = List.copyOf(path);
  }
}
