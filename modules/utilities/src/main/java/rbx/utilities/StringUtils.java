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
package rbx.utilities;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.commons.math3.util.FastMath;

/**
 * <p>StringUtils class.</p>
 *
 * @author Michael Schnieders
 */
public class StringUtils {

    /**
     * The SHELXL continuation marker appended to a wrapped line.
     */
    public static final String CONTINUATION = " =";
    /**
     * Indent of the line that continues a wrapped line.
     */
    public static final String CONTINUATION_INDENT = "  ";

    private StringUtils() {
    }

    /**
     * Prints a fixed-width decimal using String.format conventions when the value survives the
     * rounding to <code>prec</code> decimals and fits the width. Otherwise the shortest exact
     * decimal representation of the value is returned, right aligned to the width.
     *
     * @param val   Value to print
     * @param width Width of field
     * @param prec  Number of decimal places
     * @return Formatted string
     * @throws java.lang.IllegalArgumentException if the width or precision is invalid.
     */
    public static String fwDecOrExact(double val, int width, int prec) throws IllegalArgumentException {
        if (width < 1 || prec < 0) {
            throw new IllegalArgumentException(" Must have width >= 1 and precision >= 0");
        }
        String exact = exactDecimal(val);
        double maxVal = FastMath.pow(10.0, width - prec - 1);
        if (Double.isFinite(val) && FastMath.abs(val) < maxVal && isExactAt(val, prec)) {
            return String.format(Locale.ROOT, "%" + width + "." + prec + "f", val);
        }
        return padLeft(exact, width);
    }

    /**
     * Format a value with <code>prec</code> decimals when that is lossless, otherwise return the
     * shortest exact representation.
     *
     * @param val  Value to print.
     * @param prec Number of decimal places.
     * @return Formatted string without padding.
     */
    public static String decOrExact(double val, int prec) {
        if (Double.isFinite(val) && isExactAt(val, prec)) {
            return String.format(Locale.ROOT, "%." + prec + "f", val);
        }
        return exactDecimal(val);
    }

    /**
     * Shortest decimal text that parses back to the same double, never in scientific notation.
     *
     * @param val a double.
     * @return a {@link java.lang.String} object.
     */
    public static String exactDecimal(double val) {
        if (!Double.isFinite(val)) {
            return Double.toString(val);
        }
        String plain = BigDecimal.valueOf(val).stripTrailingZeros().toPlainString();
        if (!plain.contains(".")) {
            plain = plain + ".0";
        }
        return plain;
    }

    /**
     * True when rounding the value to <code>prec</code> decimals loses no information.
     *
     * @param val  a double.
     * @param prec a int.
     * @return true if the value has at most <code>prec</code> significant decimals.
     */
    public static boolean isExactAt(double val, int prec) {
        if (!Double.isFinite(val)) {
            return false;
        }
        return BigDecimal.valueOf(val).stripTrailingZeros().scale() <= prec;
    }

    /**
     * Wrap an instruction line on whitespace so that no segment exceeds the width. Segments are
     * joined with the SHELXL continuation " =" and a two-space indent.
     *
     * @param line  the line to wrap.
     * @param width the maximum segment width.
     * @return the wrapped line, which may contain newlines.
     */
    public static String wrapInstruction(String line, int width) {
        return String.join(CONTINUATION + "\n" + CONTINUATION_INDENT, wrap(line, width));
    }

    /**
     * Split text on whitespace into segments of at most <code>width</code> characters. A single
     * word longer than the width is kept whole. Spacing inside a segment is preserved.
     *
     * @param text  the text to wrap.
     * @param width the maximum segment width.
     * @return the list of segments; empty for blank text.
     */
    public static List<String> wrap(String text, int width) {
        if (width < 1) {
            throw new IllegalArgumentException(String.format(" Wrap width must be positive (%d)", width));
        }
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        List<String> segments = new ArrayList<>();
        String rest = text.strip();
        while (rest.length() > width) {
            int cut = lastWhitespace(rest, width);
            if (cut <= 0) {
                cut = firstWhitespace(rest, width);
                if (cut < 0) {
                    break;
                }
            }
            segments.add(rest.substring(0, cut).stripTrailing());
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty()) {
            segments.add(rest);
        }
        return segments;
    }

    /**
     * Element symbol in element capitalization ("PT" becomes "Pt").
     *
     * @param symbol an element symbol in any case.
     * @return the capitalized symbol.
     */
    public static String capitalizeElement(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return symbol;
        }
        return symbol.substring(0, 1).toUpperCase(Locale.ROOT) + symbol.substring(1).toLowerCase(Locale.ROOT);
    }

    /**
     * Rewrite the element prefix of an atom label in element capitalization when the label starts
     * with the element symbol, ignoring case ("PT1" with element "Pt" becomes "Pt1").
     *
     * @param label   the atom label.
     * @param element the element symbol of the atom's scattering type.
     * @return the normalized label.
     */
    public static String normalizeLabel(String label, String element) {
        if (label == null || element == null || element.isEmpty()) {
            return label;
        }
        if (label.toUpperCase(Locale.ROOT).startsWith(element.toUpperCase(Locale.ROOT))) {
            return capitalizeElement(element) + label.substring(element.length());
        }
        return label;
    }

    /**
     * <p>
     * padLeft</p>
     *
     * @param s a {@link java.lang.String} object.
     * @param n a int.
     * @return a {@link java.lang.String} object.
     */
    public static String padLeft(String s, int n) {
        return String.format("%" + n + "s", s);
    }

    private static int lastWhitespace(String s, int width) {
        for (int i = FastMath.min(width, s.length() - 1); i > 0; i--) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static int firstWhitespace(String s, int from) {
        for (int i = from; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
