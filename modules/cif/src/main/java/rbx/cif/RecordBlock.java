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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named CIF data block: record tables keyed by their category name. Data items are the fields
 * of single-row tables, addressed by their full data name ("_shelx.res_file").
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class RecordBlock {

  private final String name;
  private final Map<String, RecordTable> tables = new LinkedHashMap<>();

  public RecordBlock(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public List<RecordTable> getTables() {
    return new ArrayList<>(tables.values());
  }

  public boolean hasTable(String category) {
    return tables.containsKey(RecordTable.categoryKey(category));
  }

  /**
   * Table of a category.
   *
   * @param category the category name.
   * @return the table, or null.
   */
  public RecordTable getTable(String category) {
    return tables.get(RecordTable.categoryKey(category));
  }

  /**
   * Add a table, replacing any table of the same category.
   *
   * @param table the table to add.
   */
  public void putTable(RecordTable table) {
    tables.put(table.getName(), table);
  }

  /**
   * Value of a data item.
   *
   * @param dataName the full data name.
   * @return the value, or null when the block has no such item.
   */
  public String getItem(String dataName) {
    String[] name = locate(dataName);
    RecordTable table = tables.get(name[0]);
    if (table == null || !table.hasColumn(name[1]) || table.getRowCount() != 1) {
      return null;
    }
    return table.getValue(name[1], 0);
  }

  public boolean hasItem(String dataName) {
    return getItem(dataName) != null;
  }

  /**
   * Add or replace a data item.
   *
   * @param dataName the full data name.
   * @param value    the value.
   * @throws IllegalArgumentException if the category is a loop of more than one row.
   */
  public void setItem(String dataName, String value) {
    String[] name = locate(dataName);
    RecordTable table = tables.computeIfAbsent(name[0], RecordTable::new);
    if (table.getRowCount() > 1) {
      throw new IllegalArgumentException(format(" %s belongs to the loop %s.", dataName, table.getName()));
    }
    table.setColumn(name[1], List.of(value));
  }

  /**
   * Remove a data item. A category left without items is removed.
   *
   * @param dataName the full data name.
   * @return true if the item existed.
   */
  public boolean removeItem(String dataName) {
    if (!hasItem(dataName)) {
      return false;
    }
    String[] name = locate(dataName);
    RecordTable table = tables.get(name[0]);
    table.removeColumn(name[1]);
    if (table.isEmpty()) {
      tables.remove(name[0]);
    }
    return true;
  }

  /**
   * Split a data name into category and column at the first '.'.
   *
   * @param dataName a data name such as "_atom_site.label".
   * @return the category and column names.
   */
  static String[] splitName(String dataName) {
    String key = RecordTable.categoryKey(dataName);
    int dot = key.indexOf('.');
    if (dot < 0) {
      return new String[] {key, ""};
    }
    return new String[] {key.substring(0, dot), key.substring(dot + 1)};
  }

  /**
   * Names with several dots ("_qcrbox.shelx.scale_factor") match the table that holds them at any
   * dot. Undotted names ("_shelx_res_file") match any table whose category and column joined by an
   * underscore give the same name.
   */
  private String[] locate(String dataName) {
    String[] name = splitName(dataName);
    if (!name[1].isEmpty()) {
      String key = name[0] + "." + name[1];
      for (int dot = key.indexOf('.'); dot > 0; dot = key.indexOf('.', dot + 1)) {
        RecordTable table = tables.get(key.substring(0, dot));
        if (table != null && table.hasColumn(key.substring(dot + 1))) {
          return new String[] {key.substring(0, dot), key.substring(dot + 1)};
        }
      }
      return name;
    }
    if (tables.containsKey(name[0])) {
      return name;
    }
    for (RecordTable table : tables.values()) {
      for (String column : table.getColumnNames()) {
        if (name[0].equals(table.getName() + "_" + column)) {
          return new String[] {table.getName(), column};
        }
      }
    }
    return name;
  }

  @Override
  public String toString() {
    return format("data_%s (%d categories)", name, tables.size());
  }
}
