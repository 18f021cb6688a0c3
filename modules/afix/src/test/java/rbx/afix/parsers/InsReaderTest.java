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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.Test;

import rbx.afix.AfixCode;
import rbx.afix.MalformedDirectiveException;
import rbx.afix.graph.Displacement;
import rbx.utilities.BaseRBXTest;

/**
 * @author Michael J. Schnieders
 */
public class InsReaderTest extends BaseRBXTest {

  private final InsReader reader = new InsReader();

  @Test
  public void testLogicalLines() {
    String text = "TITL a title\n  more title\nCELL 1 2 3 =\n   90 90 90\n\nREM done =\nEND\n";
    assertEquals(List.of("CELL 1 2 3 90 90 90", "REM done =", "END"), InsReader.logicalLines(text));
  }

  @Test
  public void testReferenceStructure() throws IOException, MalformedDirectiveException {
    InsFile insFile = reader.read(readResource("/rbx/afix/minimal.ins"));

    assertEquals(List.of("C", "H", "Pt"), insFile.getSfacTable().getElements());
    assertEquals("0.1234", insFile.getScaleFactor());
    assertEquals(19, insFile.getAtomTable().size());
    assertEquals(14, insFile.getAtomLines().size());
    assertFalse(insFile.hasUnrepresentableInstructions());

    AtomLine pt1 = insFile.getAtomLines().get(0);
    assertEquals("PT1", pt1.label());
    assertEquals(3, pt1.typeIndex());
    assertEquals(new Displacement.Anisotropic(0.4321, 0.3210, 0.2109, 0.1098, 0.0987, 0.9876),
        pt1.displacement());

    InsLine afix = insFile.getAtomTable().get(2);
    assertTrue(afix instanceof AfixLine);
    assertEquals(AfixCode.of(137), ((AfixLine) afix).code());
  }

  @Test
  public void testUnrepresentableInstructions() throws IOException, MalformedDirectiveException {
    String ins = readResource("/rbx/afix/minimal.ins").replace("FVAR", "ABIN\nDFIX 1.5 C1 C2\nFVAR");
    InsFile insFile = reader.read(ins);
    assertTrue(insFile.hasUnrepresentableInstructions());
    assertEquals(List.of("ABIN", "DFIX"), insFile.getUnrepresentableInstructions());
  }

  @Test
  public void testLongSfacAndOpaqueLines() throws MalformedDirectiveException {
    String ins = "SFAC C\nSFAC H 0.493 10.511 0.323 26.126 0.140 3.142 0.041 57.800 0.003\n"
        + "C1 1 0.1 0.2 0.3\nPART 1\nQ1 1 0.5 0.5 0.5 11.0 0.05 1.23\nPART 0\nEND\n";
    InsFile insFile = reader.read(ins);

    assertEquals(List.of("C", "H"), insFile.getSfacTable().getElements());
    assertNull(insFile.getScaleFactor());
    // Without FVAR the atom table starts at the first line.
    List<InsLine> table = insFile.getAtomTable();
    assertEquals(6, table.size());
    assertTrue(table.get(0) instanceof OpaqueLine);
    assertTrue(table.get(3) instanceof OpaqueLine);
    assertTrue(table.get(5) instanceof OpaqueLine);

    AtomLine c1 = (AtomLine) table.get(2);
    assertEquals(11.0, c1.occupancy(), 0.0);
    assertEquals(new Displacement.Independent(0.05), c1.displacement());
    AtomLine q1 = (AtomLine) table.get(4);
    assertEquals(new Displacement.Independent(0.05), q1.displacement());
    assertTrue(insFile.hasUnrepresentableInstructions());
  }

  @Test
  public void testMultiplier() throws MalformedDirectiveException {
    AtomLine h1 = InsReader.readAtom(1, "H1 2 0.1 0.2 0.3 11.0 -1.5");
    assertEquals(new Displacement.MultiplierOf(1.5), h1.displacement());
  }

  @Test
  public void testMalformedLines() {
    assertMalformed("C1 1 0.1 0.2");
    assertMalformed("C1 x 0.1 0.2 0.3");
    assertMalformed("C1 1 0.1 0.2 0.3 11.0 0.01 0.02 0.03");
    assertMalformed("AFIX");
    assertMalformed("AFIX six");
    assertMalformed("AFIX 170");
    assertMalformed("AFIX -1");
  }

  private void assertMalformed(String line) {
    try {
      reader.read("SFAC C H\nFVAR 1.0\n" + line + "\nHKLF 4\n");
    } catch (MalformedDirectiveException e) {
      assertEquals(line, e.line);
      assertEquals(3, e.lineNumber);
      return;
    }
    throw new AssertionError(line + " should be rejected.");
  }
}
