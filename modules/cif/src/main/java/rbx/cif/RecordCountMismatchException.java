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
package rbx.cif;

import static java.lang.String.format;

import java.util.List;

import rbx.afix.AfixException;

/**
 * Thrown when the atoms of a CIF table do not match the atoms of the SHELXL instructions.
 *
 * @author Aaron J. Nessler
 * @since 1.0
 */
public class RecordCountMismatchException extends AfixException {

  /**
   * The CIF category that was compared.
   */
  public final String table;
  /**
   * Labels of instruction atoms with no row in the table.
   */
  public final List<String> missing;
  /**
   * Labels of table rows with no instruction atom.
   */
  public final List<String> unexpected;

  public RecordCountMismatchException(String table, List<String> missing, List<String> unexpected) {
    super(format(" The atoms in the SHELXL instructions do not match the %s table (missing %s, unexpected %s).",
        table, missing, unexpected));
    this.table = table;
    this.missing = List.copyOf(missing);
    this.unexpected = List.copyOf(unexpected);
  }
}
