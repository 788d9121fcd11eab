// RasterValues.java

package com.openathena.insar.raster;

import java.util.Locale;

/** Parsing of cell and no-data values written as text. */
final class RasterValues
{
    private RasterValues() { }

    /**
     * Like {@link Double#parseDouble(String)} but also accepts the spellings
     * GDAL and numpy write for non-finite cells: nan, -nan, inf, -inf,
     * infinity, in any case.
     *
     * @throws NumberFormatException if the token is not a number
     */
    static double parse(String token)
    {
        String t = token.trim();
        String lower = t.toLowerCase(Locale.ROOT);
        boolean negative = lower.startsWith("-");
        String magnitude = (negative || lower.startsWith("+")) ? lower.substring(1) : lower;
        switch (magnitude) {
        case "nan":
        case "1.#qnan":
            return Double.NaN;
        case "inf":
        case "infinity":
        case "1.#inf":
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        default:
            return Double.parseDouble(t);
        }
    }
}
