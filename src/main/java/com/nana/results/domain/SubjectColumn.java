package com.nana.results.domain;

import java.util.Objects;

/**
 * SubjectColumn - A Column Recognised as Part of a Subject Group
 *
 * <p>Derived from a header such as {@code "CS301 External"}: the subject
 * code {@code CS301}, the role {@link SubjectSuffix#EXTERNAL}, and the
 * original header text used to read the cells.
 */
public final class SubjectColumn {

    private final String code;
    private final SubjectSuffix suffix;
    private final String columnName;

    public SubjectColumn(String code, SubjectSuffix suffix, String columnName) {
        this.code       = Objects.requireNonNull(code, "code");
        this.suffix     = Objects.requireNonNull(suffix, "suffix");
        this.columnName = Objects.requireNonNull(columnName, "columnName");
    }

    public String getCode()          { return code; }

    public SubjectSuffix getSuffix() { return suffix; }

    public String getColumnName()    { return columnName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubjectColumn other)) return false;
        return code.equals(other.code)
               && suffix == other.suffix
               && columnName.equals(other.columnName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, suffix, columnName);
    }

    @Override
    public String toString() {
        return code + "/" + suffix + " <- '" + columnName + "'";
    }
}
