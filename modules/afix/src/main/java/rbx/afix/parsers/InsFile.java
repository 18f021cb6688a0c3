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
package rbx.afix.parsers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import rbx.afix.SfacTable;

/**
 * The parts of a SHELXL instruction file needed to convert its AFIX constraints: the atom table,
 * the scattering types and the overall scale factor.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class InsFile {

  private final String text;
  private final SfacTable sfacTable;
  private final String scaleFactor;
  private final List<InsLine> atomTable;
  private final List<String> unrepresentable;

  InsFile(String text, SfacTable sfacTable, String scaleFactor, List<InsLine> atomTable,
          List<String> unrepresentable) {
    this.text = text;
    this.sfacTable = sfacTable;
    this.scaleFactor = scaleFactor;
    this.atomTable = List.copyOf(atomTable);
    this.unrepresentable = List.copyOf(unrepresentable);
  }

  /**
   * The instruction text as given.
   */
  public String getText() {
    return text;
  }

  public SfacTable getSfacTable() {
    return sfacTable;
  }

  /**
   * First value of the last FVAR line, as written.
   *
   * @return the overall scale factor, or null without FVAR.
   */
  public String getScaleFactor() {
    return scaleFactor;
  }

  /**
   * Directive, atom and opaque lines between the last FVAR and the first HKLF.
   */
  public List<InsLine> getAtomTable() {
    return atomTable;
  }

  public List<AtomLine> getAtomLines() {
    List<AtomLine> atoms = new ArrayList<>();
    for (InsLine line : atomTable) {
      if (line instanceof AtomLine atomLine) {
        atoms.add(atomLine);
      }
    }
    return Collections.unmodifiableList(atoms);
  }

  /**
   * Instructions present in the file that have no CIF representation.
   *
   * @return the instruction names, in order of first appearance.
   */
  public List<String> getUnrepresentableInstructions() {
    return unrepresentable;
  }

  /**
   * The instruction text must be kept alongside the converted tables when it uses instructions
   * without a CIF representation.
   */
  public boolean hasUnrepresentableInstructions() {
    return !unrepresentable.isEmpty();
  }
}
