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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import rbx.afix.AfixException;
import rbx.afix.MissingRefineInstructionsException;
import rbx.afix.UnencodableGraphException;
import rbx.utilities.BaseRBXTest;
import rbx.utilities.RBXProperties;

/**
 * Converts the reference structure with its instructions stored under either data name.
 *
 * @author Aaron J. Nessler
 */
@RunWith(Parameterized.class)
public class AfixCifFilterTest extends BaseRBXTest {

  private static final List<String> LABELS = List.of("Pt1", "C1", "H1A", "H1B", "H1C", "C1A", "C2A",
      "H2A", "C3A", "C4A", "H4A", "C5A", "C6A", "CISO");
  private static final List<String> ANISO_LABELS = List.of("Pt1", "C1", "C1A", "C2A", "C3A", "C4A",
      "C5A", "C6A");

  private final String instructionItem;
  private String ins;
  private RecordBlock block;

  public AfixCifFilterTest(String instructionItem) {
    this.instructionItem = instructionItem;
  }

  @Parameters(name = "{0}")
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {AfixCifFilter.REFINE_INSTRUCTIONS},
        {AfixCifFilter.RES_FILE}
    });
  }

  @Before
  public void setUp() throws IOException {
    ins = readResource("/rbx/cif/minimal.ins");
    block = referenceBlock(ins, LABELS, ANISO_LABELS);
  }

  private RecordBlock referenceBlock(String text, List<String> labels, List<String> anisoLabels) {
    RecordBlock block = new RecordBlock("minimal");
    RecordTable atomSite = new RecordTable(AfixCifFilter.ATOM_SITE);
    atomSite.setColumn("label", labels);
    atomSite.setColumn("fract_x", Collections.nCopies(labels.size(), "0.0"));
    atomSite.setColumn("fract_y", Collections.nCopies(labels.size(), "0.0"));
    atomSite.setColumn("fract_z", Collections.nCopies(labels.size(), "0.0"));
    atomSite.setColumn("occupancy", Collections.nCopies(labels.size(), "1.0"));
    atomSite.setColumn("u_iso_or_equiv", Collections.nCopies(labels.size(), "2.0"));
    block.putTable(atomSite);
    if (anisoLabels != null) {
      RecordTable aniso = new RecordTable(AfixCifFilter.ATOM_SITE_ANISO);
      aniso.setColumn("label", anisoLabels);
      for (String uij : new String[] {"u_11", "u_22", "u_33"}) {
        aniso.setColumn(uij, Collections.nCopies(anisoLabels.size(), "1.0"));
      }
      for (String uij : new String[] {"u_12", "u_13", "u_23"}) {
        aniso.setColumn(uij, Collections.nCopies(anisoLabels.size(), "0.0"));
      }
      block.putTable(aniso);
    }
    block.setItem(instructionItem, text);
    return block;
  }

  @Test
  public void testUpdateTables() throws AfixException {
    new AfixCifFilter(new CompositeConfiguration()).afixToCif(block);
    assertEquals("0.1234", block.getItem(AfixCifFilter.SCALE_FACTOR));

    RecordTable atomSite = block.getTable(AfixCifFilter.ATOM_SITE);
    for (String column : new String[] {"fract_x", "fract_y", "fract_z"}) {
      for (String value : atomSite.getColumn(column)) {
        assertNotEquals(column, 0.0, Double.parseDouble(value), 0.0);
      }
    }
    assertEquals("0.1234", atomSite.getValue("fract_x", 1));
    assertEquals("-0.2345", atomSite.getValue("fract_y", 2));
    assertEquals("0.4444", atomSite.getValue("u_iso_or_equiv", 13));
    assertEquals("2.0", atomSite.getValue("u_iso_or_equiv", 2));
    assertEquals("1.0", atomSite.getValue("occupancy", 0));

    RecordTable aniso = block.getTable(AfixCifFilter.ATOM_SITE_ANISO);
    for (String column : new String[] {"u_11", "u_22", "u_33", "u_12", "u_13", "u_23"}) {
      for (String value : aniso.getColumn(column)) {
        assertNotEquals(column, 1.0, Double.parseDouble(value), 0.0);
        assertNotEquals(column, 0.0, Double.parseDouble(value), 0.0);
      }
    }
    assertEquals("0.5678", aniso.getValue("u_11", 1));
    assertEquals("0.3456", aniso.getValue("u_12", 2));
    assertEquals("0.9012", aniso.getValue("u_13", 1));
  }

  @Test
  public void testAddColumns() throws AfixException {
    new AfixCifFilter(new CompositeConfiguration()).afixToCif(block);
    RecordTable atomSite = block.getTable(AfixCifFilter.ATOM_SITE);
    assertEquals(List.of(".", ".", "C1", "C1", "C1", ".", "C1A", "C2A", ".", "C3A", ".", "C3A", "C3A", "."),
        atomSite.getColumn(AfixCifFilter.ATTACHED_ATOM));
    assertEquals(List.of(".", ".", "SXL137", "SXL137", "SXL137", "SXL66", "SXL66", "SXL43", "SXL66", "SXL66",
        ".", "SXL66", "SXL66", "."), atomSite.getColumn(AfixCifFilter.CONSTRAINT_ID));
    assertEquals(List.of(".", ".", "1", "2", "3", "1", "2", "1", "1", "2", ".", "3", "4", "."),
        atomSite.getColumn(AfixCifFilter.CONSTRAINT_INDEX));
    assertEquals(List.of(".", ".", "1.500", "1.500", "1.500", ".", ".", "1.200", ".", ".", "1.200", ".", ".", "."),
        atomSite.getColumn(AfixCifFilter.UISO_MULTIPLIER));

    RecordTable constraints = block.getTable(AfixCifFilter.CONSTRAINT_POSN);
    assertEquals(List.of("SXL137", "SXL66", "SXL43"), constraints.getColumn("id"));
    assertEquals(List.of("RT", "RO", "R"), constraints.getColumn("refined_pars"));
    for (String instruction : constraints.getColumn("instruction")) {
      for (String line : instruction.split("\n")) {
        assertTrue(line, line.length() < 80);
      }
    }
  }

  @Test
  public void testInstructionsRemoved() throws AfixException {
    new AfixCifFilter(new CompositeConfiguration()).afixToCif(block);
    assertNull(block.getItem(instructionItem));
    assertNull(AfixCifFilter.instructionText(block));
  }

  @Test
  public void testUnrepresentableInstructionsKept() throws AfixException {
    String text = ins.replace("FVAR 0.1234", "ABIN\nFVAR 0.1234");
    RecordBlock abinBlock = referenceBlock(text, LABELS, ANISO_LABELS);
    new AfixCifFilter(new CompositeConfiguration()).afixToCif(abinBlock);
    assertEquals(text, abinBlock.getItem(instructionItem));
    assertTrue(abinBlock.hasTable(AfixCifFilter.CONSTRAINT_POSN));
  }

  @Test
  public void testKeepInstructionsProperty() throws AfixException {
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addProperty(RBXProperties.KEEP_INSTRUCTIONS, true);
    new AfixCifFilter(properties).afixToCif(block);
    assertEquals(ins, block.getItem(instructionItem));
  }

  @Test
  public void testMultiplierDecimalsProperty() throws AfixException {
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addProperty(RBXProperties.UISO_MULTIPLIER_DECIMALS, 1);
    new AfixCifFilter(properties).afixToCif(block);
    assertEquals("1.5", block.getTable(AfixCifFilter.ATOM_SITE).getValue(AfixCifFilter.UISO_MULTIPLIER, 2));
  }

  @Test
  public void testMissingInstructions() {
    block.removeItem(instructionItem);
    try {
      new AfixCifFilter(new CompositeConfiguration()).afixToCif(block);
      fail("A block without instructions should not convert.");
    } catch (MissingRefineInstructionsException e) {
      assertTrue(e.getMessage().contains(AfixCifFilter.REFINE_INSTRUCTIONS));
    } catch (AfixException e) {
      fail(e.toString());
    }
  }

  @Test
  public void testAtomSiteMismatch() throws AfixException {
    List<String> labels = new ArrayList<>(LABELS);
    labels.set(1, "C99");
    RecordBlock mismatch = referenceBlock(ins, labels, ANISO_LABELS);
    try {
      new AfixCifFilter(new CompositeConfiguration()).afixToCif(mismatch);
      fail("Mismatched atom_site labels should not convert.");
    } catch (RecordCountMismatchException e) {
      assertEquals(AfixCifFilter.ATOM_SITE, e.table);
      assertEquals(List.of("C1"), e.missing);
      assertEquals(List.of("C99"), e.unexpected);
    }
  }

  @Test
  public void testAnisoMismatch() throws AfixException {
    List<String> anisoLabels = new ArrayList<>(ANISO_LABELS);
    anisoLabels.add("CISO");
    RecordBlock mismatch = referenceBlock(ins, LABELS, anisoLabels);
    try {
      new AfixCifFilter(new CompositeConfiguration()).afixToCif(mismatch);
      fail("Mismatched atom_site_aniso labels should not convert.");
    } catch (RecordCountMismatchException e) {
      assertEquals(AfixCifFilter.ATOM_SITE_ANISO, e.table);
      assertTrue(e.missing.isEmpty());
      assertEquals(List.of("CISO"), e.unexpected);
    }
  }

  @Test
  public void testAnisoTableCreated() throws AfixException {
    RecordBlock noAniso = referenceBlock(ins, LABELS, null);
    new AfixCifFilter(new CompositeConfiguration()).afixToCif(noAniso);
    RecordTable aniso = noAniso.getTable(AfixCifFilter.ATOM_SITE_ANISO);
    assertEquals(ANISO_LABELS, aniso.getColumn("label"));
    assertEquals("0.4321", aniso.getValue("u_11", 0));
  }

  @Test
  public void testEmbeddedInstructionsReturned() throws AfixException {
    assertEquals(ins, new AfixCifFilter(new CompositeConfiguration()).cifToInstructions(block));
  }

  @Test
  public void testRebuiltInstructions() throws AfixException {
    AfixCifFilter filter = new AfixCifFilter(new CompositeConfiguration());
    filter.afixToCif(block);
    String rebuilt = filter.cifToInstructions(block);
    assertTrue(rebuilt.contains("SFAC C H Pt\n"));
    assertTrue(rebuilt.contains("FVAR 0.1234\n"));
    assertTrue(rebuilt.contains("AFIX 137\n"));
    assertTrue(rebuilt.contains("\nPt1 3 "));

    RecordBlock again = referenceBlock(rebuilt, LABELS, ANISO_LABELS);
    filter.afixToCif(again);
    for (String column : block.getTable(AfixCifFilter.ATOM_SITE).getColumnNames()) {
      assertEquals(column, block.getTable(AfixCifFilter.ATOM_SITE).getColumn(column),
          again.getTable(AfixCifFilter.ATOM_SITE).getColumn(column));
    }
    assertEquals(block.getTable(AfixCifFilter.CONSTRAINT_POSN).getColumn("id"),
        again.getTable(AfixCifFilter.CONSTRAINT_POSN).getColumn("id"));
    assertFalse(again.hasItem(instructionItem));
  }

  @Test
  public void testUnreferencedConstraintRowsIgnored() throws AfixException {
    AfixCifFilter filter = new AfixCifFilter(new CompositeConfiguration());
    filter.afixToCif(block);
    RecordTable constraints = block.getTable(AfixCifFilter.CONSTRAINT_POSN);
    RecordTable extended = new RecordTable(AfixCifFilter.CONSTRAINT_POSN);
    for (String column : constraints.getColumnNames()) {
      List<String> values = new ArrayList<>(constraints.getColumn(column));
      values.add(column.equals("id") ? "OLEX1" : "Olex2 riding group");
      values.add(column.equals("id") ? "SXL172" : "?");
      extended.setColumn(column, values);
    }
    block.putTable(extended);

    String rebuilt = filter.cifToInstructions(block);
    assertTrue(rebuilt.contains("AFIX 137\n"));
    assertFalse(rebuilt.contains("AFIX 172"));
    RecordBlock again = referenceBlock(rebuilt, LABELS, ANISO_LABELS);
    filter.afixToCif(again);
    assertEquals(List.of("SXL137", "SXL66", "SXL43"),
        again.getTable(AfixCifFilter.CONSTRAINT_POSN).getColumn("id"));
  }

  @Test
  public void testFractionalPositionIndexRejected() throws AfixException {
    AfixCifFilter filter = new AfixCifFilter(new CompositeConfiguration());
    filter.afixToCif(block);
    block.getTable(AfixCifFilter.ATOM_SITE).setValue(AfixCifFilter.CONSTRAINT_INDEX, 3, "2.7");
    try {
      filter.cifToInstructions(block);
      fail("A fractional position index should not be truncated.");
    } catch (UnencodableGraphException e) {
      assertEquals("H1B", e.label);
    }
  }

  @Test
  public void testNonPositiveMultiplierRejected() throws AfixException {
    AfixCifFilter filter = new AfixCifFilter(new CompositeConfiguration());
    filter.afixToCif(block);
    RecordTable atomSite = block.getTable(AfixCifFilter.ATOM_SITE);
    for (String factor : new String[] {"-1.2", "0.000", "-0.00"}) {
      atomSite.setValue(AfixCifFilter.UISO_MULTIPLIER, 7, factor);
      try {
        filter.cifToInstructions(block);
        fail("A multiplier of " + factor + " should not be written.");
      } catch (UnencodableGraphException e) {
        assertEquals("H2A", e.label);
      }
    }
  }
}
