package com.nana.results.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * SubjectMarks - One Student's Marks in One Subject
 *
 * <p>Numeric fields are {@code null} when the column does not exist on the
 * sheet or the cell is blank; non-numeric text has already been coerced to
 * 0 by {@link CellValues}. {@code resultRaw} is the trimmed, upper-cased
 * Result text and is empty when there is no Result column or cell.
 */
public final class SubjectMarks {

    private final String code;
    private final Double internal;
    private final Double external;
    private final Double total;
    private final String resultRaw;

    public SubjectMarks(String code,
                        Double internal,
                        Double external,
                        Double total,
                        String resultRaw) {
        this.code      = Objects.requireNonNull(code, "code");
        this.internal  = internal;
        this.external  = external;
        this.total     = total;
        this.resultRaw = resultRaw == null ? "" : resultRaw.trim().toUpperCase(Locale.ROOT);
    }

    // -----------------------------------------------------------------------
    // RAW ACCESSORS
    // -----------------------------------------------------------------------

    public String getCode()       { return code; }

    /** @return internal marks, or null if absent from the sheet */
    public Double getInternal()   { return internal; }

    /** @return external marks, or null if absent from the sheet */
    public Double getExternal()   { return external; }

    /** @return total marks, or null if absent from the sheet */
    public Double getTotal()      { return total; }

    /** @return normalised result text, never null */
    public String getResultRaw()  { return resultRaw; }

    // -----------------------------------------------------------------------
    // DERIVED VIEWS
    // -----------------------------------------------------------------------

    public double internalOrZero() { return internal == null ? 0.0 : internal; }

    public double externalOrZero() { return external == null ? 0.0 : external; }

    public double totalOrZero()    { return total == null ? 0.0 : total; }

    /** @return true if the student has any Internal or External mark */
    public boolean hasMarks() {
        return internal != null || external != null;
    }

    /** @return true if the Total mark is a positive number */
    public boolean isAttempted() {
        return total != null && total > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubjectMarks other)) return false;
        return code.equals(other.code)
               && Objects.equals(internal, other.internal)
               && Objects.equals(external, other.external)
               && Objects.equals(total, other.total)
               && resultRaw.equals(other.resultRaw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, internal, external, total, resultRaw);
    }

    @Override
    public String toString() {
        return code + "{int=" + internal + ", ext=" + external
               + ", tot=" + total + ", res='" + resultRaw + "'}";
    }
}
