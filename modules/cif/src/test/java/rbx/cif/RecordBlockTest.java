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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import rbx.utilities.BaseRBXTest;

public class RecordBlockTest extends BaseRBXTest {

  @Test
  public void testTableColumns() {
    RecordTable table = new RecordTable("_ATOM_SITE");
    assertEquals("atom_site", table.getName());
    table.setColumn("label", List.of("C1", "H1"));
    table.setColumn("fract_x", List.of("0.1", "?"));
    assertEquals(2, table.getRowCount());
    assertEquals(List.of("label", "fract_x"), table.getColumnNames());
    assertEquals(1, table.rowIndex("label", "H1"));
    assertEquals(-1, table.rowIndex("label", "O1"));
    assertEquals("0.1", table.getValue("FRACT_X", 0));
    assertNull(table.getColumn("fract_y"));
    assertFalse(RecordTable.isPresent(table.getValue("fract_x", 1)));
    assertFalse(RecordTable.isPresent(RecordTable.NOT_PRESENT));
    assertTrue(RecordTable.isPresent("0.1"));
    assertEquals("_atom_site.fract_x", table.dataName("fract_x"));

    table.setValue("fract_x", 1, "0.2");
    assertEquals("0.2", table.getColumn("fract_x").get(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testColumnLengthMismatch() {
    RecordTable table = new RecordTable("atom_site");
    table.setColumn("label", List.of("C1", "H1"));
    table.setColumn("fract_x", List.of("0.1"));
  }

  @Test
  public void testReplaceOnlyColumn() {
    RecordTable table = new RecordTable("atom_site");
    table.setColumn("label", List.of("C1", "H1"));
    table.setColumn("label", List.of("C1"));
    assertEquals(1, table.getRowCount());
    assertTrue(table.removeColumn("label"));
    assertTrue(table.isEmpty());
    assertEquals(0, table.getRowCount());
  }

  @Test
  public void testItems() {
    RecordBlock block = new RecordBlock("test");
    assertNull(block.getItem("_shelx.res_file"));
    block.setItem("_shelx.res_file", "TITL");
    block.setItem("_qcrbox.shelx.scale_factor", "0.1234");
    assertTrue(block.hasTable("shelx"));
    assertEquals("TITL", block.getItem("_SHELX.res_file"));
    assertEquals("0.1234", block.getTable("qcrbox").getValue("shelx.scale_factor", 0));

    assertTrue(block.removeItem("_shelx.res_file"));
    assertFalse(block.removeItem("_shelx.res_file"));
    assertFalse(block.hasTable("shelx"));
    assertTrue(block.hasItem("_qcrbox.shelx.scale_factor"));
  }

  @Test
  public void testUndottedName() {
    RecordBlock block = new RecordBlock("test");
    RecordTable shelx = new RecordTable("shelx");
    shelx.setColumn("res_file", List.of("TITL"));
    block.putTable(shelx);
    assertEquals("TITL", block.getItem("_shelx_res_file"));

    block.setItem("_diffrn_ambient_temperature", "100");
    assertEquals("100", block.getItem("_diffrn_ambient_temperature"));
    assertEquals("_diffrn_ambient_temperature",
        block.getTable("diffrn_ambient_temperature").dataName(""));
  }

  @Test
  public void testLoopIsNotAnItem() {
    RecordBlock block = new RecordBlock("test");
    RecordTable table = new RecordTable("atom_site");
    table.setColumn("label", List.of("C1", "H1"));
    block.putTable(table);
    assertNull(block.getItem("_atom_site.label"));
    assertFalse(block.removeItem("_atom_site.label"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testItemInLoop() {
    RecordBlock block = new RecordBlock("test");
    RecordTable table = new RecordTable("atom_site");
    table.setColumn("label", List.of("C1", "H1"));
    block.putTable(table);
    block.setItem("_atom_site.type_symbol", "C");
  }
}
