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

import rbx.afix.graph.Displacement;

/**
 * An atom line: <code>LABEL TYPE X Y Z OCC [U | U11 U22 U33 U23 U13 U12]</code>.
 *
 * @param lineNumber   line number in the instruction text.
 * @param text         the line as read.
 * @param label        the atom label as written.
 * @param typeIndex    the 1-based SFAC index.
 * @param x            fractional x.
 * @param y            fractional y.
 * @param z            fractional z.
 * @param occupancy    SHELXL occupancy.
 * @param displacement displacement parameters.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record AtomLine(int lineNumber, String text, String label, int typeIndex, double x, double y,
                       double z, double occupancy, Displacement displacement) implements InsLine {
}
