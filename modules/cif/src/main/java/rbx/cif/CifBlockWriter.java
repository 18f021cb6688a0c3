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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;

/**
 * Writes {@link RecordBlock}s as CIF text. Single-row categories are written as data items,
 * larger ones as loops.
 *
 * @author Aaron J. Nessler
 * @since 1.0
 */
public class CifBlockWriter {

  private static final Logger logger = Logger.getLogger(CifBlockWriter.class.getName());

  /**
   * Write blocks to a file, replacing its contents.
   *
   * @param blocks the blocks to write.
   * @param file   the destination.
   * @throws IOException if the file cannot be written.
   */
  public void write(List<RecordBlock> blocks, File file) throws IOException {
    logger.info(format(" Writing CIF file %s", file.getAbsolutePath()));
    FileUtils.writeStringToFile(file, toCif(blocks), StandardCharsets.UTF_8);
  }

  public String toCif(List<RecordBlock> blocks) {
    StringBuilder sb = new StringBuilder();
    for (RecordBlock block : blocks) {
      sb.append(toCif(block)).append("\n");
    }
    return sb.toString();
  }

  /**
   * CIF text of one block.
   *
   * @param block the block.
   * @return the CIF text, ending with a newline.
   */
  public String toCif(RecordBlock block) {
    StringBuilder sb = new StringBuilder();
    sb.append("data_").append(block.getName()).append("\n");
    for (RecordTable table : block.getTables()) {
      if (table.isEmpty()) {
        continue;
      }
      sb.append("\n");
      if (table.getRowCount() == 1) {
        appendItems(sb, table);
      } else {
        appendLoop(sb, table);
      }
    }
    return sb.toString();
  }

  private static void appendItems(StringBuilder sb, RecordTable table) {
    int width = 0;
    for (String column : table.getColumnNames()) {
      width = Math.max(width, table.dataName(column).length());
    }
    for (String column : table.getColumnNames()) {
      String value = quote(table.getValue(column, 0));
      if (value.startsWith("\n")) {
        sb.append(table.dataName(column)).append(value).append("\n");
      } else {
        sb.append(format("%-" + width + "s %s\n", table.dataName(column), value));
      }
    }
  }

  private static void appendLoop(StringBuilder sb, RecordTable table) {
    List<String> columns = table.getColumnNames();
    sb.append("loop_\n");
    for (String column : columns) {
      sb.append(" ").append(table.dataName(column)).append("\n");
    }
    for (int row = 0; row < table.getRowCount(); row++) {
      StringBuilder line = new StringBuilder();
      for (String column : columns) {
        String value = quote(table.getValue(column, row));
        if (value.startsWith("\n")) {
          line.append(value).append("\n");
        } else {
          if (line.length() > 0 && line.charAt(line.length() - 1) != '\n') {
            line.append(" ");
          }
          line.append(value);
        }
      }
      sb.append(line.toString().stripLeading()).append("\n");
    }
  }

  /**
   * Value as a CIF token: bare when possible, otherwise quoted, or a semicolon text field that
   * starts with a newline.
   *
   * @param value a field value.
   * @return the token.
   */
  static String quote(String value) {
    if (value == null) {
      return RecordTable.UNKNOWN;
    }
    if (value.contains("\n") || (value.contains("'") && value.contains("\""))) {
      return "\n;\n" + value.stripTrailing() + "\n;";
    }
    if (isBare(value)) {
      return value;
    }
    if (!value.contains("'")) {
      return "'" + value + "'";
    }
    return "\"" + value + "\"";
  }

  private static boolean isBare(String value) {
    if (value.isEmpty()) {
      return false;
    }
    if (RecordTable.NOT_PRESENT.equals(value) || RecordTable.UNKNOWN.equals(value)) {
      return true;
    }
    char first = value.charAt(0);
    if ("_#$'\"[];".indexOf(first) >= 0) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isWhitespace(value.charAt(i))) {
        return false;
      }
    }
    String lower = value.toLowerCase(Locale.ROOT);
    return !(lower.startsWith("data_") || lower.startsWith("save_") || lower.equals("loop_")
        || lower.equals("global_") || lower.equals("stop_"));
  }
}
