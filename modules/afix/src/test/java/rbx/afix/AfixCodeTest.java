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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import rbx.utilities.BaseRBXTest;

/**
 * @author Michael J. Schnieders
 */
public class AfixCodeTest extends BaseRBXTest {

  @Test
  public void testSplit() {
    assertEquals(new AfixCode(0, 6), AfixCode.of(6));
    assertEquals(new AfixCode(2, 3), AfixCode.of(23));
    assertEquals(new AfixCode(13, 7), AfixCode.of(137));
    assertEquals(137, AfixCode.of(137).code());
    assertEquals("AFIX 66", AfixCode.of(66).directive());
  }

  @Test
  public void testConstraintId() {
    assertEquals("SXL137", AfixCode.of(137).constraintId());
    assertEquals("SXL01", AfixCode.of(1).constraintId());
    assertEquals(new AfixCode(13, 7), AfixCode.fromConstraintId("SXL137"));
    assertEquals(new AfixCode(6, 6), AfixCode.fromConstraintId("SXL66"));
    assertEquals(new AfixCode(0, 1), AfixCode.fromConstraintId("SXL01"));
    assertTrue(AfixCode.isConstraintId("SXL43"));
    assertFalse(AfixCode.isConstraintId("SXL4"));
    assertFalse(AfixCode.isConstraintId("RIGID1"));
    assertFalse(AfixCode.isConstraintId(null));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testForeignId() {
    AfixCode.fromConstraintId("QCR66");
  }

  @Test
  public void testClosingCodes() {
    for (int n : new int[] {0, 1, 2, 5, 6, 9}) {
      assertTrue(new AfixCode(6, n).isClosing());
    }
    for (int n : new int[] {3, 4, 7, 8}) {
      assertFalse(new AfixCode(6, n).isClosing());
    }
    assertTrue(AfixCode.of(65).isContinuation());
    assertFalse(AfixCode.of(66).isContinuation());
  }

  @Test
  public void testUnsupportedShape() {
    try {
      DirectiveCodeTable.shapeDescription(17);
    } catch (UnsupportedShapeCodeException e) {
      assertEquals(17, e.shapeCode);
      return;
    }
    throw new AssertionError(" Shape code 17 should be rejected.");
  }

  @Test(expected = UnsupportedDofCodeException.class)
  public void testUnsupportedDof() throws UnsupportedDofCodeException {
    DirectiveCodeTable.dofPolicy(2);
  }
}
