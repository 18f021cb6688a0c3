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

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import rbx.afix.AfixCode;
import rbx.afix.DirectiveCodeTable;
import rbx.afix.MalformedDirectiveException;
import rbx.afix.SfacTable;
import rbx.afix.graph.Displacement;

/**
 * The InsReader class reads the text of a SHELXL .ins or .res file into the classified atom table
 * consumed by the AFIX decoder.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class InsReader {

  private static final Logger logger = Logger.getLogger(InsReader.class.getName());

  /**
   * SHELXL default occupancy: fixed at 1.0.
   */
  public static final double DEFAULT_OCCUPANCY = 11.0;
  /**
   * SHELXL default isotropic U.
   */
  public static final double DEFAULT_UISO = 0.05;

  /**
   * SHELXL instructions, matched on the first four characters of a line.
   */
  static final Set<String> SHELXL_INSTRUCTIONS = Set.of(
      "ABIN", "ACTA", "AFIX", "ANIS", "ANSC", "ANSR", "BASF", "BIND", "BLOC", "BOND", "BUMP", "CELL",
      "CGLS", "CHIV", "CONF", "CONN", "DAMP", "DANG", "DEFS", "DELU", "DFIX", "DISP", "EADP", "END",
      "EQIV", "EXTI", "EXYZ", "FEND", "FLAT", "FMAP", "FRAG", "FREE", "FVAR", "GRID", "HFIX", "HKLF",
      "HTAB", "ISOR", "LATT", "LAUE", "LIST", "L.S.", "MERG", "MORE", "MOVE", "MPLA", "NCSY", "NEUT",
      "OMIT", "PART", "PLAN", "PRIG", "REM", "RESI", "RIGU", "RTAB", "SADI", "SAME", "SFAC", "SHEL",
      "SIMU", "SIZE", "SPEC", "STIR", "SUMP", "SWAT", "SYMM", "TEMP", "TITL", "TWIN", "TWST", "UNIT",
      "WGHT", "WIGL", "WPDB", "XNPD", "ZERR", "BEDE", "LONE");

  /**
   * Instructions whose restraints or settings cannot be expressed by the CIF constraint tables.
   */
  static final List<String> UNREPRESENTABLE_INSTRUCTIONS = List.of(
      "ABIN", "ANSC", "ANSR", "BASF", "BLOC", "BUMP", "CHIV", "DAMP", "DANG", "DEFS", "DELU", "DFIX",
      "DISP", "EADP", "EXTI", "EXYZ", "FEND", "FLAT", "FRAG", "HFIX", "ISOR", "LAUE", "MOVE", "NCSY",
      "NEUT", "OMIT", "PART", "PRIG", "RESI", "RIGU", "SADI", "SAME", "SHEL", "SIMU", "STIR", "SUMP",
      "SWAT", "TWIN", "TWST", "WIGL", "XNPD");

  /**
   * Read instruction text.
   *
   * @param text the content of a .ins or .res file.
   * @return the InsFile.
   * @throws MalformedDirectiveException if an atom-table line cannot be read.
   */
  public InsFile read(String text) throws MalformedDirectiveException {
    List<String> lines = logicalLines(text);

    SfacTable sfacTable = new SfacTable();
    String scaleFactor = null;
    int lastFvar = -1;
    int end = -1;
    int endFallback = -1;
    List<String> unrepresentable = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      String instruction = instructionOf(line);
      if (instruction == null) {
        continue;
      }
      switch (instruction) {
        case "SFAC" -> readSfac(line, sfacTable);
        case "FVAR" -> {
          lastFvar = i;
          String[] tokens = line.split("\\s+");
          if (tokens.length > 1) {
            scaleFactor = tokens[1];
          }
        }
        case "HKLF" -> end = end < 0 ? i : end;
        case "END" -> endFallback = endFallback < 0 ? i : endFallback;
        default -> {
          if (UNREPRESENTABLE_INSTRUCTIONS.contains(instruction) && !unrepresentable.contains(instruction)) {
            unrepresentable.add(instruction);
          }
        }
      }
    }
    if (end < 0) {
      end = endFallback < 0 ? lines.size() : endFallback;
    }
    int start = lastFvar + 1;

    List<InsLine> atomTable = new ArrayList<>();
    for (int i = start; i < end; i++) {
      String line = lines.get(i);
      int lineNumber = i + 1;
      String instruction = instructionOf(line);
      if (instruction == null) {
        atomTable.add(readAtom(lineNumber, line));
      } else if (instruction.equals("AFIX")) {
        atomTable.add(readAfix(lineNumber, line));
      } else {
        atomTable.add(new OpaqueLine(lineNumber, line));
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Read %d atom table lines (%s, FVAR %s).", atomTable.size(), sfacTable, scaleFactor));
    }
    if (!unrepresentable.isEmpty() && logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Instructions without a CIF representation: %s", String.join(" ", unrepresentable)));
    }
    return new InsFile(text, sfacTable, scaleFactor, atomTable, unrepresentable);
  }

  /**
   * Join "=" continuation lines, drop the title and blank lines, and trim.
   *
   * @param text instruction text.
   * @return the logical lines.
   */
  static List<String> logicalLines(String text) {
    String[] physical = text.replace("\r\n", "\n").replace('\r', '\n').split("\n");
    List<String> lines = new ArrayList<>();
    StringBuilder pending = null;
    boolean inTitle = false;
    for (String raw : physical) {
      if (pending == null) {
        // Title continuation lines are indented.
        if (inTitle && !raw.isEmpty() && Character.isWhitespace(raw.charAt(0))) {
          continue;
        }
        inTitle = raw.toUpperCase(Locale.ROOT).startsWith("TITL");
        if (inTitle) {
          continue;
        }
      }
      String trimmed = raw.strip();
      boolean continues = trimmed.endsWith("=") && !isRemark(pending, trimmed);
      if (continues) {
        trimmed = trimmed.substring(0, trimmed.length() - 1).stripTrailing();
      }
      if (pending == null) {
        pending = new StringBuilder(trimmed);
      } else {
        pending.append(' ').append(trimmed);
      }
      if (!continues) {
        String line = pending.toString().strip();
        if (!line.isEmpty()) {
          lines.add(line);
        }
        pending = null;
      }
    }
    if (pending != null && !pending.toString().isBlank()) {
      lines.add(pending.toString().strip());
    }
    return lines;
  }

  private static boolean isRemark(StringBuilder pending, String trimmed) {
    return pending == null && trimmed.toUpperCase(Locale.ROOT).startsWith("REM");
  }

  /**
   * The SHELXL instruction named by the first four characters of a line, or null for atom lines.
   */
  static String instructionOf(String line) {
    String first = line.split("\\s+", 2)[0].toUpperCase(Locale.ROOT);
    String key = first.length() > 4 ? first.substring(0, 4) : first;
    return SHELXL_INSTRUCTIONS.contains(key) ? key : null;
  }

  private static void readSfac(String line, SfacTable sfacTable) {
    String[] tokens = line.split("\\s+");
    if (tokens.length < 2) {
      return;
    }
    // The long form gives one element followed by its scattering factor coefficients.
    if (tokens.length > 2 && isNumber(tokens[2])) {
      sfacTable.add(tokens[1]);
      return;
    }
    for (int i = 1; i < tokens.length; i++) {
      sfacTable.add(tokens[i]);
    }
  }

  private static boolean isNumber(String token) {
    try {
      Double.parseDouble(token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  static AfixLine readAfix(int lineNumber, String line) throws MalformedDirectiveException {
    String[] tokens = line.split("\\s+");
    if (tokens.length < 2) {
      throw new MalformedDirectiveException(lineNumber, line, "AFIX without a code.");
    }
    int code;
    try {
      code = Integer.parseInt(tokens[1]);
    } catch (NumberFormatException e) {
      throw new MalformedDirectiveException(lineNumber, line, format("AFIX code %s is not an integer.", tokens[1]), e);
    }
    if (code < 0 || code > DirectiveCodeTable.MAX_DIRECTIVE_CODE) {
      throw new MalformedDirectiveException(lineNumber, line,
          format("AFIX code %d is outside [0, %d].", code, DirectiveCodeTable.MAX_DIRECTIVE_CODE));
    }
    return new AfixLine(lineNumber, line, AfixCode.of(code));
  }

  static AtomLine readAtom(int lineNumber, String line) throws MalformedDirectiveException {
    String[] tokens = line.split("\\s+");
    if (tokens.length < 5) {
      throw new MalformedDirectiveException(lineNumber, line,
          format("Atom lines need at least 5 fields, found %d.", tokens.length));
    }
    if (tokens.length > 12 || (tokens.length > 8 && tokens.length < 12)) {
      throw new MalformedDirectiveException(lineNumber, line,
          format("Atom lines have 5 to 8 or 12 fields, found %d.", tokens.length));
    }
    try {
      String label = tokens[0];
      int typeIndex = Integer.parseInt(tokens[1]);
      double x = Double.parseDouble(tokens[2]);
      double y = Double.parseDouble(tokens[3]);
      double z = Double.parseDouble(tokens[4]);
      double occupancy = tokens.length > 5 ? Double.parseDouble(tokens[5]) : DEFAULT_OCCUPANCY;
      Displacement displacement;
      if (tokens.length == 12) {
        displacement = new Displacement.Anisotropic(
            Double.parseDouble(tokens[6]), Double.parseDouble(tokens[7]), Double.parseDouble(tokens[8]),
            Double.parseDouble(tokens[9]), Double.parseDouble(tokens[10]), Double.parseDouble(tokens[11]));
      } else if (tokens.length > 6) {
        // A trailing eighth field (Q peak height) is ignored.
        double u = Double.parseDouble(tokens[6]);
        displacement = u < 0 ? new Displacement.MultiplierOf(-u) : new Displacement.Independent(u);
      } else {
        displacement = new Displacement.Independent(DEFAULT_UISO);
      }
      return new AtomLine(lineNumber, line, label, typeIndex, x, y, z, occupancy, displacement);
    } catch (NumberFormatException e) {
      throw new MalformedDirectiveException(lineNumber, line, "Atom line has a non-numeric field.", e);
    }
  }
}
