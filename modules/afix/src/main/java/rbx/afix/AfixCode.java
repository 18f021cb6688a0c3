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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An AFIX directive code <code>10*m + n</code>, split into its shape code <code>m</code> and its
 * degrees-of-freedom code <code>n</code>.
 *
 * @param shapeCode the shape code m.
 * @param dofCode   the degrees-of-freedom code n, a single digit.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record AfixCode(int shapeCode, int dofCode) {

  /**
   * Prefix of constraint ids derived from AFIX codes.
   */
  public static final String ID_PREFIX = "SXL";

  private static final Pattern ID_PATTERN = Pattern.compile(ID_PREFIX + "(\\d{1,2})(\\d)");

  public AfixCode {
    if (shapeCode < 0 || dofCode < 0 || dofCode > 9) {
      throw new IllegalArgumentException(format(" Invalid AFIX code m=%d n=%d.", shapeCode, dofCode));
    }
  }

  /**
   * Split a directive code into m and n.
   *
   * @param code the directive code.
   * @return the AfixCode.
   */
  public static AfixCode of(int code) {
    if (code < 0) {
      throw new IllegalArgumentException(format(" Invalid AFIX code %d.", code));
    }
    return new AfixCode(code / 10, code % 10);
  }

  /**
   * Parse a constraint id of the form <code>SXL&lt;m&gt;&lt;n&gt;</code>.
   *
   * @param constraintId the id, for example SXL137.
   * @return the AfixCode.
   * @throws IllegalArgumentException if the id does not have the SXL form.
   */
  public static AfixCode fromConstraintId(String constraintId) {
    if (constraintId == null) {
      throw new IllegalArgumentException(" A constraint id is required.");
    }
    Matcher matcher = ID_PATTERN.matcher(constraintId);
    if (!matcher.matches()) {
      throw new IllegalArgumentException(format(" %s is not an AFIX constraint id.", constraintId));
    }
    return new AfixCode(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
  }

  /**
   * True for ids that {@link #fromConstraintId(String)} accepts.
   *
   * @param constraintId a constraint id.
   * @return true if the id has the SXL form.
   */
  public static boolean isConstraintId(String constraintId) {
    return constraintId != null && ID_PATTERN.matcher(constraintId).matches();
  }

  /**
   * The directive code.
   *
   * @return 10*m + n.
   */
  public int code() {
    return 10 * shapeCode + dofCode;
  }

  /**
   * Directives with n in {0, 1, 2, 5, 6, 9} close the innermost open group.
   *
   * @return true for a closing code.
   */
  public boolean isClosing() {
    return DirectiveCodeTable.isClosingDof(dofCode);
  }

  /**
   * n = 5 continues a previously declared group.
   *
   * @return true for a continuation code.
   */
  public boolean isContinuation() {
    return dofCode == 5;
  }

  /**
   * The synthetic constraint id, <code>SXL&lt;m&gt;&lt;n&gt;</code>.
   *
   * @return the constraint id.
   */
  public String constraintId() {
    return ID_PREFIX + shapeCode + dofCode;
  }

  /**
   * The directive line for this code.
   *
   * @return for example "AFIX 137".
   */
  public String directive() {
    return "AFIX " + code();
  }

  @Override
  public String toString() {
    return directive();
  }
}
