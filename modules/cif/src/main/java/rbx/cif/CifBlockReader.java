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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rcsb.cif.CifIO;
import org.rcsb.cif.model.Block;
import org.rcsb.cif.model.Category;
import org.rcsb.cif.model.CifFile;
import org.rcsb.cif.model.Column;
import org.rcsb.cif.model.ValueKind;

/**
 * Reads CIF text into {@link RecordBlock}s with the ciftools-java parser. Fields marked as not
 * present or unknown are stored as "." and "?".
 *
 * @author Aaron J. Nessler
 * @since 1.0
 */
public class CifBlockReader {

  private static final Logger logger = Logger.getLogger(CifBlockReader.class.getName());

  /**
   * Read every data block of a CIF file.
   *
   * @param path the CIF file.
   * @return the data blocks in file order.
   * @throws IOException if the file cannot be read or parsed.
   */
  public List<RecordBlock> read(Path path) throws IOException {
    logger.info(format(" Reading CIF file %s", path));
    return toBlocks(CifIO.readFromPath(path));
  }

  /**
   * Read every data block from a stream.
   *
   * @param stream CIF content.
   * @return the data blocks in file order.
   * @throws IOException if the content cannot be read or parsed.
   */
  public List<RecordBlock> read(InputStream stream) throws IOException {
    return toBlocks(CifIO.readFromInputStream(stream));
  }

  /**
   * Read every data block from CIF text.
   *
   * @param text CIF content.
   * @return the data blocks in file order.
   * @throws IOException if the text cannot be parsed.
   */
  public List<RecordBlock> readText(String text) throws IOException {
    try (InputStream stream = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8))) {
      return read(stream);
    }
  }

  private List<RecordBlock> toBlocks(CifFile cifFile) {
    List<RecordBlock> blocks = new ArrayList<>();
    for (Block block : cifFile.getBlocks()) {
      RecordBlock recordBlock = new RecordBlock(block.getBlockHeader());
      for (Category category : block.getCategories().values()) {
        RecordTable table = new RecordTable(category.getCategoryName());
        for (Column<?> column : category.getColumns().values()) {
          table.setColumn(column.getColumnName(), values(column));
        }
        recordBlock.putTable(table);
      }
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Block %s: %d categories", recordBlock.getName(),
            recordBlock.getTables().size()));
      }
      blocks.add(recordBlock);
    }
    return blocks;
  }

  private static List<String> values(Column<?> column) {
    int rows = column.getRowCount();
    List<String> values = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      ValueKind kind = column.getValueKind(i);
      if (kind == ValueKind.NOT_PRESENT) {
        values.add(RecordTable.NOT_PRESENT);
      } else if (kind == ValueKind.UNKNOWN) {
        values.add(RecordTable.UNKNOWN);
      } else {
        values.add(column.getStringData(i));
      }
    }
    return values;
  }
}
