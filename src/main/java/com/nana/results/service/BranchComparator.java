package com.nana.results.service;

import com.nana.results.domain.StudentRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * BranchComparator - Pass Percentage Across Branches
 *
 * <p>Each branch is one analysed mark sheet. The best branch has the
 * highest pass percentage and the weakest the lowest, first branch wins
 * ties. With one branch or none there is nothing to compare and both are
 * reported as {@link #NOT_AVAILABLE}.
 */
public class BranchComparator {

    public static final String NOT_AVAILABLE = "N/A";

    /**
     * @param branches branch name to its records, in display order
     * @return the comparison
     */
    public BranchComparison compare(Map<String, List<StudentRecord>> branches) {
        List<BranchStats> rows = new ArrayList<>();
        branches.forEach((branch, records) -> {
            int passed = (int) records.stream().filter(StudentRecord::isPassed).count();
            rows.add(new BranchStats(branch, records.size(), passed));
        });

        if (rows.size() <= 1) {
            return new BranchComparison(rows, NOT_AVAILABLE, NOT_AVAILABLE);
        }
        BranchStats best = rows.get(0);
        BranchStats weak = rows.get(0);
        for (BranchStats row : rows) {
            if (row.getPassPercentage() > best.getPassPercentage()) {
                best = row;
            }
            if (row.getPassPercentage() < weak.getPassPercentage()) {
                weak = row;
            }
        }
        return new BranchComparison(rows, best.getBranch(), weak.getBranch());
    }

    // -----------------------------------------------------------------------
    // VALUE OBJECTS
    // -----------------------------------------------------------------------

    public static final class BranchStats {

        private final String branch;
        private final int students;
        private final int passed;

        public BranchStats(String branch, int students, int passed) {
            this.branch   = branch;
            this.students = students;
            this.passed   = passed;
        }

        public String getBranch()  { return branch; }

        public int getStudents()   { return students; }

        public int getPassed()     { return passed; }

        public int getFailed()     { return students - passed; }

        /** @return passed over students in percent, two decimals */
        public double getPassPercentage() {
            return students == 0 ? 0.0 : MetricsCalculator.round2(passed * 100.0 / students);
        }

        @Override
        public String toString() {
            return branch + ": students=" + students + ", passed=" + passed
                   + ", pass%=" + getPassPercentage();
        }
    }

    public static final class BranchComparison {

        private final List<BranchStats> branches;
        private final String bestBranch;
        private final String weakBranch;

        public BranchComparison(List<BranchStats> branches, String bestBranch, String weakBranch) {
            this.branches   = Collections.unmodifiableList(new ArrayList<>(branches));
            this.bestBranch = bestBranch;
            this.weakBranch = weakBranch;
        }

        public List<BranchStats> getBranches() { return branches; }

        public String getBestBranch()          { return bestBranch; }

        public String getWeakBranch()          { return weakBranch; }

        /** @return students across all branches */
        public int getTotalStudents() {
            return branches.stream().mapToInt(BranchStats::getStudents).sum();
        }

        /** @return pass percentage across all branches, two decimals */
        public double getOverallPassPercentage() {
            int total = getTotalStudents();
            int passed = branches.stream().mapToInt(BranchStats::getPassed).sum();
            return total == 0 ? 0.0 : MetricsCalculator.round2(passed * 100.0 / total);
        }
    }
}
