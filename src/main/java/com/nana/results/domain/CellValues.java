package com.nana.results.domain;

/**
 * CellValues - Raw Spreadsheet Cell Coercion
 *
 * <p>Decoded mark sheets deliver each cell as a {@link String}, a
 * {@link Number} or {@code null}. Everything downstream of the readers goes
 * through these helpers so that coercion rules live in one place:
 * <ul>
 *   <li>blank means {@code null}, an empty or whitespace-only string, or a
 *       {@code NaN} number;</li>
 *   <li>non-numeric text coerces to {@code 0.0} and never throws;</li>
 *   <li>thousands separators ({@code "1,250"}) are tolerated.</li>
 * </ul>
 */
public final class CellValues {

    private CellValues() {
        throw new UnsupportedOperationException("CellValues is a static utility class.");
    }

    /**
     * Returns true if the cell carries no value.
     *
     * @param value raw cell value
     * @return true for null, blank text or NaN
     */
    public static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Number n) {
            return Double.isNaN(n.doubleValue());
        }
        return value.toString().isBlank();
    }

    /**
     * Returns true if the cell holds a parseable number.
     *
     * @param value raw cell value
     * @return true for finite numbers and numeric text
     */
    public static boolean isNumeric(Object value) {
        if (isBlank(value)) {
            return false;
        }
        if (value instanceof Number n) {
            return !Double.isInfinite(n.doubleValue());
        }
        return parse(value.toString()) != null;
    }

    /**
     * Coerces a cell to a number, mapping blank and non-numeric cells to 0.
     *
     * @param value raw cell value
     * @return numeric value, or 0.0
     */
    public static double toNumber(Object value) {
        Double parsed = toOptionalNumber(value);
        return parsed == null ? 0.0 : parsed;
    }

    /**
     * Coerces a cell to a number while keeping "no value" distinguishable.
     *
     * @param value raw cell value
     * @return {@code null} for blank cells, 0.0 for non-numeric text,
     *         otherwise the numeric value
     */
    public static Double toOptionalNumber(Object value) {
        if (isBlank(value)) {
            return null;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isInfinite(d) ? 0.0 : d;
        }
        Double parsed = parse(value.toString());
        return parsed == null ? 0.0 : parsed;
    }

    /**
     * Renders a cell as trimmed text. Integral numbers lose their
     * fractional part so that an identifier read as {@code 1001.0} from a
     * workbook prints as {@code 1001}.
     *
     * @param value raw cell value
     * @return text form, never null
     */
    public static String toText(Object value) {
        if (isBlank(value)) {
            return "";
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        return value.toString().trim();
    }

    private static Double parse(String text) {
        String cleaned = text.trim().replace(",", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            double d = Double.parseDouble(cleaned);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
