package com.nana.results.service;

/**
 * SectionBreakdown - Category Counts of One Section
 *
 * <p>The four tier counts cover passing students only; {@code failed} and
 * {@code absent} count overall results F and A. The tallies always add up
 * to {@code total}.
 */
public final class SectionBreakdown {

    /** Pseudo-section covering every student. */
    public static final String OVERALL = "Overall";

    private final String section;
    private final int fcd;
    private final int firstClass;
    private final int secondClass;
    private final int passClass;
    private final int failed;
    private final int absent;

    public SectionBreakdown(String section, int fcd, int firstClass, int secondClass,
                            int passClass, int failed, int absent) {
        this.section     = section;
        this.fcd         = fcd;
        this.firstClass  = firstClass;
        this.secondClass = secondClass;
        this.passClass   = passClass;
        this.failed      = failed;
        this.absent      = absent;
    }

    public String getSection()   { return section; }

    public int getFcd()          { return fcd; }

    public int getFirstClass()   { return firstClass; }

    public int getSecondClass()  { return secondClass; }

    public int getPassClass()    { return passClass; }

    public int getFailed()       { return failed; }

    public int getAbsent()       { return absent; }

    public int getPassed()       { return fcd + firstClass + secondClass + passClass; }

    public int getTotal()        { return getPassed() + failed + absent; }

    public boolean isOverall()   { return OVERALL.equals(section); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SectionBreakdown other)) return false;
        return section.equals(other.section) && fcd == other.fcd
               && firstClass == other.firstClass && secondClass == other.secondClass
               && passClass == other.passClass && failed == other.failed
               && absent == other.absent;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(section, fcd, firstClass, secondClass, passClass, failed, absent);
    }

    @Override
    public String toString() {
        return String.format("%-12s FCD=%d FC=%d SC=%d Pass=%d Failed=%d Absent=%d Total=%d",
                section, fcd, firstClass, secondClass, passClass, failed, absent, getTotal());
    }
}
