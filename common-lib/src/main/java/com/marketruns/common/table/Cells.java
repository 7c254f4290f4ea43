package com.marketruns.common.table;

/**
 * Parsing of raw export cells. Exports written through a dataframe render integer
 * columns with missing values as floats ({@code "3.0"}) and missing values as
 * {@code "nan"}; both are accepted.
 */
public final class Cells {

    private Cells() {}

    public static boolean isMissing(String cell) {
        if (cell == null || cell.isBlank()) return true;
        String c = cell.trim();
        return c.equalsIgnoreCase("nan") || c.equalsIgnoreCase("none") || c.equalsIgnoreCase("null");
    }

    /**
     * @return the value, or {@code null} for a missing cell
     * @throws IllegalArgumentException if the cell is present but not a number
     */
    public static Double toDouble(String cell) {
        if (isMissing(cell)) return null;
        String c = cell.trim();
        if (c.equalsIgnoreCase("true")) return 1.0;
        if (c.equalsIgnoreCase("false")) return 0.0;
        try {
            return Double.valueOf(c);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: '" + cell + "'", e);
        }
    }

    /**
     * @return the value, or {@code null} for a missing cell
     * @throws IllegalArgumentException if the cell is present but not a whole number
     */
    public static Integer toInteger(String cell) {
        Double d = toDouble(cell);
        if (d == null) return null;
        if (d.isInfinite() || d.isNaN() || d != Math.rint(d)) {
            throw new IllegalArgumentException("not a whole number: '" + cell + "'");
        }
        return d.intValue();
    }

    /** Like {@link #toInteger(String)} but returns {@code fallback} for a missing cell. */
    public static int toInteger(String cell, int fallback) {
        Integer v = toInteger(cell);
        return v != null ? v : fallback;
    }
}
