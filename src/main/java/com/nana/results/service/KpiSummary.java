package com.nana.results.service;

import java.util.Objects;

/**
 * KpiSummary - Headline Figures of a Result Sheet
 *
 * <p>{@code present} counts students who were not absent in every subject.
 * {@code resultPercentage} is passed over total, in percent, two decimals,
 * and 0 for an empty sheet.
 */
public final class KpiSummary {

    private final int totalStudents;
    private final int presentStudents;
    private final int passedStudents;
    private final double resultPercentage;

    public KpiSummary(int totalStudents, int presentStudents, int passedStudents,
                      double resultPercentage) {
        this.totalStudents    = totalStudents;
        this.presentStudents  = presentStudents;
        this.passedStudents   = passedStudents;
        this.resultPercentage = resultPercentage;
    }

    public int getTotalStudents()        { return totalStudents; }

    public int getPresentStudents()      { return presentStudents; }

    public int getPassedStudents()       { return passedStudents; }

    public int getFailedStudents()       { return totalStudents - passedStudents; }

    public double getResultPercentage()  { return resultPercentage; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KpiSummary other)) return false;
        return totalStudents == other.totalStudents
               && presentStudents == other.presentStudents
               && passedStudents == other.passedStudents
               && Double.compare(resultPercentage, other.resultPercentage) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalStudents, presentStudents, passedStudents, resultPercentage);
    }

    @Override
    public String toString() {
        return "Total=" + totalStudents + ", Present=" + presentStudents
               + ", Passed=" + passedStudents + ", Result=" + resultPercentage + "%";
    }
}
