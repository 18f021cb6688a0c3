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

import static java.lang.String.format;

/**
 * Thrown when an instruction line cannot be read as a directive or an atom, or when a directive
 * cannot be applied where it appears.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MalformedDirectiveException extends AfixException {

  /**
   * Line number in the instruction text, or -1 when unknown.
   */
  public final int lineNumber;
  /**
   * The offending line.
   */
  public final String line;
  /**
   * What is wrong with the line.
   */
  public final String reason;

  public MalformedDirectiveException(int lineNumber, String line, String reason) {
    super(describe(lineNumber, line, reason));
    this.lineNumber = lineNumber;
    this.line = line;
    this.reason = reason;
  }

  public MalformedDirectiveException(int lineNumber, String line, String reason, Throwable cause) {
    super(describe(lineNumber, line, reason), cause);
    this.lineNumber = lineNumber;
    this.line = line;
    this.reason = reason;
  }

  private static String describe(int lineNumber, String line, String reason) {
    StringBuilder sb = new StringBuilder(format(" %s", reason));
    if (line != null) {
      sb.append(format("\n Line %d: %s", lineNumber, line));
    }
    return sb.toString();
  }
}
