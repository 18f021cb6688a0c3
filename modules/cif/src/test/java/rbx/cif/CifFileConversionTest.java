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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import rbx.afix.AfixException;
import rbx.afix.MissingRefineInstructionsException;
import rbx.utilities.BaseRBXTest;

/**
 * Converts CIF files read from disk.
 */
public class CifFileConversionTest extends BaseRBXTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final AfixCifFilter filter = new AfixCifFilter(new CompositeConfiguration());

  @Test
  public void testConvertAndWrite() throws IOException, AfixException {
    List<RecordBlock> blocks = filter.readCif(getResourceFile("/rbx/cif/minimal.cif"));
    RecordBlock block = filter.afixToCif(blocks.get(0));
    assertNull(block.getItem(AfixCifFilter.REFINE_INSTRUCTIONS));
    assertEquals("1.2345", block.getItem("_cell.length_a"));

    File out = folder.newFile("converted.cif");
    new CifBlockWriter().write(blocks, out);
    RecordBlock read = new CifBlockReader().read(out.toPath()).get(0);
    assertEquals("0.1234", read.getItem(AfixCifFilter.SCALE_FACTOR));
    RecordTable atomSite = read.getTable(AfixCifFilter.ATOM_SITE);
    assertEquals("SXL137", atomSite.getValue(AfixCifFilter.CONSTRAINT_ID, 2));
    assertEquals("C1A", atomSite.getValue(AfixCifFilter.ATTACHED_ATOM, 6));
    assertEquals(RecordTable.NOT_PRESENT, atomSite.getValue(AfixCifFilter.ATTACHED_ATOM, 0));
    assertEquals(3, read.getTable(AfixCifFilter.CONSTRAINT_POSN).getRowCount());

    String rebuilt = filter.cifToInstructions(read);
    assertEquals(filter.cifToInstructions(block), rebuilt);
  }

  @Test
  public void testSiblingResFile() throws IOException, AfixException {
    RecordBlock block = filter.readCif(getResourceFile("/rbx/cif/sibling.cif")).get(0);
    String text = block.getItem(AfixCifFilter.RES_FILE);
    assertNotNull(text);
    assertEquals(readResource("/rbx/cif/sibling.res"), text);
    filter.afixToCif(block);
    assertEquals("0.1234", block.getItem(AfixCifFilter.SCALE_FACTOR));
  }

  @Test(expected = MissingRefineInstructionsException.class)
  public void testNoInstructionsAnywhere() throws IOException, AfixException {
    RecordBlock block = filter.readCif(getResourceFile("/rbx/cif/orphan.cif")).get(0);
    assertNull(AfixCifFilter.instructionText(block));
    filter.afixToCif(block);
  }

  @Test(expected = MissingRefineInstructionsException.class)
  public void testNothingToRebuild() throws AfixException {
    RecordBlock block = new RecordBlock("empty");
    block.setItem("_cell.length_a", "1.2345");
    filter.cifToInstructions(block);
  }
}
