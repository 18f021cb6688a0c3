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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One CIF category: ordered, named columns of string values that all have the same length.
 * A single-row table holds the data items of the category.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class RecordTable {

  /** Value of a field that is not present. */
  public static final String NOT_PRESENT = ".";
  /** Value of a field whose value is unknown. */
  public static final String UNKNOWN = "?";

  private final String name;
  private final Map<String, List<String>> columns = new LinkedHashMap<>();
  private int rowCount = 0;

  /**
   * Create an empty table.
   *
   * @param name the category name, with or without the leading underscore.
   */
  public RecordTable(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException(" A category name is required.");
    }
    this.name = categoryKey(name);
  }

  /**
   * Lower-case category name without the leading underscore.
   *
   * @param name a category name.
   * @return the normalized name.
   */
  static String categoryKey(String name) {
    String key = name.strip().toLowerCase(Locale.ROOT);
    return key.startsWith("_") ? key.substring(1) : key;
  }

  /**
   * True for a value other than "." and "?".
   *
   * @param value a field value.
   * @return true if the value is present.
   */
  public static boolean isPresent(String value) {
    return value != null && !NOT_PRESENT.equals(value) && !UNKNOWN.equals(value);
  }

  public String getName() {
    return name;
  }

  public int getRowCount() {
    return rowCount;
  }

  public List<String> getColumnNames() {
    return List.copyOf(columns.keySet());
  }

  public boolean hasColumn(String column) {
    return columns.containsKey(columnKey(column));
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  /**
   * Values of a column.
   *
   * @param column the column name.
   * @return an unmodifiable view of the values, or null if the column does not exist.
   */
  public List<String> getColumn(String column) {
    List<String> values = columns.get(columnKey(column));
    return values == null ? null : Collections.unmodifiableList(values);
  }

  /**
   * Value of one field.
   *
   * @param column the column name.
   * @param row    the row index.
   * @return the value, or null if the column does not exist.
   */
  public String getValue(String column, int row) {
    List<String> values = columns.get(columnKey(column));
    return values == null ? null : values.get(row);
  }

  /**
   * Add or replace a column. The first column of an empty table fixes the row count.
   *
   * @param column the column name.
   * @param values the column values.
   * @throws IllegalArgumentException if the number of values differs from the row count.
   */
  public void setColumn(String column, List<String> values) {
    if (values == null) {
      throw new IllegalArgumentException(format(" Column %s of %s has no values.", column, name));
    }
    String key = columnKey(column);
    boolean onlyColumn = columns.isEmpty() || (columns.size() == 1 && columns.containsKey(key));
    if (!onlyColumn && values.size() != rowCount) {
      throw new IllegalArgumentException(format(" Column %s of %s has %d values for %d rows.",
          column, name, values.size(), rowCount));
    }
    columns.put(key, new ArrayList<>(values));
    rowCount = values.size();
  }

  /**
   * Set one field of an existing column.
   *
   * @param column the column name.
   * @param row    the row index.
   * @param value  the new value.
   */
  public void setValue(String column, int row, String value) {
    List<String> values = columns.get(columnKey(column));
    if (values == null) {
      throw new IllegalArgumentException(format(" Category %s has no column %s.", name, column));
    }
    values.set(row, value);
  }

  /**
   * Remove a column. Removing the last column resets the row count.
   *
   * @param column the column name.
   * @return true if the column existed.
   */
  public boolean removeColumn(String column) {
    boolean removed = columns.remove(columnKey(column)) != null;
    if (columns.isEmpty()) {
      rowCount = 0;
    }
    return removed;
  }

  /**
   * Index of the first row whose column holds the value.
   *
   * @param column the column name.
   * @param value  the value to find.
   * @return the row index, or -1.
   */
  public int rowIndex(String column, String value) {
    List<String> values = columns.get(columnKey(column));
    return values == null ? -1 : values.indexOf(value);
  }

  /**
   * Full CIF data name of a column of this table.
   *
   * @param column the column name.
   * @return the data name, for example "_atom_site.label".
   */
  public String dataName(String column) {
    String key = columnKey(column);
    return key.isEmpty() ? "_" + name : "_" + name + "." + key;
  }

  @Override
  public String toString() {
    return format("%s (%d columns, %d rows)", name, columns.size(), rowCount);
  }

  private static String columnKey(String column) {
    return column.strip().toLowerCase(Locale.ROOT);
  }
}
