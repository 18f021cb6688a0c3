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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import rbx.utilities.StringUtils;

/**
 * The ordered scattering types of an instruction file.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SfacTable implements AtomTypeLookup {

  private final List<String> elements = new ArrayList<>();

  public SfacTable() {
  }

  public SfacTable(Collection<String> elements) {
    for (String element : elements) {
      add(element);
    }
  }

  /**
   * Append a scattering type.
   *
   * @param element the element symbol in any case.
   * @return the 1-based index of the new type.
   */
  public int add(String element) {
    elements.add(StringUtils.capitalizeElement(element));
    return elements.size();
  }

  /**
   * Index of the first scattering type with this element.
   *
   * @param element the element symbol in any case.
   * @return the 1-based index, or 0 if absent.
   */
  public int indexOf(String element) {
    for (int i = 0; i < elements.size(); i++) {
      if (elements.get(i).equalsIgnoreCase(element)) {
        return i + 1;
      }
    }
    return 0;
  }

  @Override
  public String element(int typeIndex) {
    if (typeIndex < 1 || typeIndex > elements.size()) {
      return null;
    }
    return elements.get(typeIndex - 1);
  }

  public List<String> getElements() {
    return Collections.unmodifiableList(elements);
  }

  public int size() {
    return elements.size();
  }

  /**
   * The short form SFAC instruction.
   *
   * @return for example "SFAC C H Pt".
   */
  public String toSfacLine() {
    return "SFAC " + String.join(" ", elements);
  }

  @Override
  public String toString() {
    return toSfacLine();
  }
}
