package com.nana.results.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * StudentRecord - Normalised, Classified Result of One Student
 *
 * <p>One record is produced per data row of a {@link Dataset}. The record
 * starts life in the classification stage (marks, statuses, totals,
 * category) and is then copied via {@link #toBuilder()} by the later stages
 * that add optional SGPA and rank fields. Instances are never mutated.
 *
 * <p>FIELD GROUPS:
 * <ul>
 *   <li>identity: row index, student id, name, section</li>
 *   <li>per subject: raw marks and {@link SubjectStatus}, in schema order</li>
 *   <li>aggregate: overall result, fail/absent tallies, totals, percentage,
 *       category</li>
 *   <li>optional: SGPA and its result label, class and section ranks</li>
 * </ul>
 */
public final class StudentRecord {

    private final int rowIndex;
    private final String studentId;
    private final String name;
    private final String section;

    private final Map<String, SubjectMarks> subjects;
    private final Map<String, SubjectStatus> subjectStatuses;

    private final OverallResult overallResult;
    private final int absentSubjectCount;
    private final int failedSubjectCount;
    private final List<String> failedSubjectNames;

    private final double totalMarks;
    private final double totalInternal;
    private final double totalExternal;
    private final int attemptedSubjectCount;
    private final double percentage;
    private final Category category;

    private final Double sgpa;
    private final SgpaResult sgpaResult;
    private final Integer classRank;
    private final Integer sectionRank;

    private StudentRecord(Builder builder) {
        this.rowIndex              = builder.rowIndex;
        this.studentId             = builder.studentId == null ? "" : builder.studentId;
        this.name                  = builder.name == null ? "" : builder.name;
        this.section               = builder.section == null ? "" : builder.section;
        this.subjects              = Collections.unmodifiableMap(new LinkedHashMap<>(builder.subjects));
        this.subjectStatuses       = Collections.unmodifiableMap(new LinkedHashMap<>(builder.subjectStatuses));
        this.overallResult         = Objects.requireNonNull(builder.overallResult, "overallResult");
        this.absentSubjectCount    = builder.absentSubjectCount;
        this.failedSubjectCount    = builder.failedSubjectCount;
        this.failedSubjectNames    = Collections.unmodifiableList(new ArrayList<>(builder.failedSubjectNames));
        this.totalMarks            = builder.totalMarks;
        this.totalInternal         = builder.totalInternal;
        this.totalExternal         = builder.totalExternal;
        this.attemptedSubjectCount = builder.attemptedSubjectCount;
        this.percentage            = builder.percentage;
        this.category              = Objects.requireNonNull(builder.category, "category");
        this.sgpa                  = builder.sgpa;
        this.sgpaResult            = builder.sgpaResult;
        this.classRank             = builder.classRank;
        this.sectionRank           = builder.sectionRank;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder pre-filled with every field of this record */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.rowIndex              = rowIndex;
        b.studentId             = studentId;
        b.name                  = name;
        b.section               = section;
        b.subjects              = new LinkedHashMap<>(subjects);
        b.subjectStatuses       = new LinkedHashMap<>(subjectStatuses);
        b.overallResult         = overallResult;
        b.absentSubjectCount    = absentSubjectCount;
        b.failedSubjectCount    = failedSubjectCount;
        b.failedSubjectNames    = new ArrayList<>(failedSubjectNames);
        b.totalMarks            = totalMarks;
        b.totalInternal         = totalInternal;
        b.totalExternal         = totalExternal;
        b.attemptedSubjectCount = attemptedSubjectCount;
        b.percentage            = percentage;
        b.category              = category;
        b.sgpa                  = sgpa;
        b.sgpaResult            = sgpaResult;
        b.classRank             = classRank;
        b.sectionRank           = sectionRank;
        return b;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public int getRowIndex()                              { return rowIndex; }

    public String getStudentId()                          { return studentId; }

    public String getName()                               { return name; }

    public String getSection()                            { return section; }

    /** @return subject code to raw marks, in schema order */
    public Map<String, SubjectMarks> getSubjects()        { return subjects; }

    /** @return subject code to status, in schema order */
    public Map<String, SubjectStatus> getSubjectStatuses() { return subjectStatuses; }

    public SubjectStatus statusOf(String code)            { return subjectStatuses.get(code); }

    public OverallResult getOverallResult()               { return overallResult; }

    public boolean isPassed()                             { return overallResult == OverallResult.P; }

    public int getAbsentSubjectCount()                    { return absentSubjectCount; }

    public int getFailedSubjectCount()                    { return failedSubjectCount; }

    /** @return failed subject codes, in schema order */
    public List<String> getFailedSubjectNames()           { return failedSubjectNames; }

    public double getTotalMarks()                         { return totalMarks; }

    public double getTotalInternal()                      { return totalInternal; }

    public double getTotalExternal()                      { return totalExternal; }

    /** @return number of subjects with a Total above zero */
    public int getAttemptedSubjectCount()                 { return attemptedSubjectCount; }

    public double getPercentage()                         { return percentage; }

    public Category getCategory()                         { return category; }

    /** @return SGPA, or null when SGPA was not computed */
    public Double getSgpa()                               { return sgpa; }

    /** @return SGPA result label, or null when SGPA was not computed */
    public SgpaResult getSgpaResult()                     { return sgpaResult; }

    public boolean hasSgpa()                              { return sgpa != null; }

    /** @return class-wide rank, or null for unranked students */
    public Integer getClassRank()                         { return classRank; }

    /** @return rank within the section, or null for unranked students */
    public Integer getSectionRank()                       { return sectionRank; }

    // -----------------------------------------------------------------------
    // OBJECT CONTRACT
    // -----------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StudentRecord other)) return false;
        return rowIndex == other.rowIndex
               && absentSubjectCount == other.absentSubjectCount
               && failedSubjectCount == other.failedSubjectCount
               && attemptedSubjectCount == other.attemptedSubjectCount
               && Double.compare(totalMarks, other.totalMarks) == 0
               && Double.compare(totalInternal, other.totalInternal) == 0
               && Double.compare(totalExternal, other.totalExternal) == 0
               && Double.compare(percentage, other.percentage) == 0
               && studentId.equals(other.studentId)
               && name.equals(other.name)
               && section.equals(other.section)
               && subjects.equals(other.subjects)
               && subjectStatuses.equals(other.subjectStatuses)
               && overallResult == other.overallResult
               && failedSubjectNames.equals(other.failedSubjectNames)
               && category == other.category
               && Objects.equals(sgpa, other.sgpa)
               && sgpaResult == other.sgpaResult
               && Objects.equals(classRank, other.classRank)
               && Objects.equals(sectionRank, other.sectionRank);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowIndex, studentId, name, section, subjects, subjectStatuses,
                overallResult, failedSubjectNames, totalMarks, percentage, category,
                sgpa, sgpaResult, classRank, sectionRank);
    }

    @Override
    public String toString() {
        return "StudentRecord{id='" + studentId + "', section='" + section
               + "', result=" + overallResult + ", total=" + totalMarks
               + ", pct=" + percentage + ", category=" + category
               + (sgpa != null ? ", sgpa=" + sgpa : "")
               + (classRank != null ? ", rank=" + classRank : "") + "}";
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    public static final class Builder {

        private int rowIndex;
        private String studentId = "";
        private String name = "";
        private String section = "";
        private Map<String, SubjectMarks> subjects = new LinkedHashMap<>();
        private Map<String, SubjectStatus> subjectStatuses = new LinkedHashMap<>();
        private OverallResult overallResult = OverallResult.P;
        private int absentSubjectCount;
        private int failedSubjectCount;
        private List<String> failedSubjectNames = new ArrayList<>();
        private double totalMarks;
        private double totalInternal;
        private double totalExternal;
        private int attemptedSubjectCount;
        private double percentage;
        private Category category = Category.PASS_CLASS;
        private Double sgpa;
        private SgpaResult sgpaResult;
        private Integer classRank;
        private Integer sectionRank;

        private Builder() {
        }

        public Builder rowIndex(int rowIndex)       { this.rowIndex = rowIndex; return this; }

        public Builder studentId(String studentId)  { this.studentId = studentId; return this; }

        public Builder name(String name)            { this.name = name; return this; }

        public Builder section(String section)      { this.section = section; return this; }

        /**
         * Adds one subject's marks and status. Call in schema order.
         *
         * @param marks  raw marks
         * @param status classified status
         * @return this builder
         */
        public Builder subject(SubjectMarks marks, SubjectStatus status) {
            this.subjects.put(marks.getCode(), marks);
            this.subjectStatuses.put(marks.getCode(), status);
            return this;
        }

        public Builder overallResult(OverallResult overallResult) {
            this.overallResult = overallResult;
            return this;
        }

        public Builder absentSubjectCount(int count) { this.absentSubjectCount = count; return this; }

        public Builder failedSubjectCount(int count) { this.failedSubjectCount = count; return this; }

        public Builder failedSubjectNames(List<String> names) {
            this.failedSubjectNames = names == null ? new ArrayList<>() : new ArrayList<>(names);
            return this;
        }

        public Builder totalMarks(double totalMarks)       { this.totalMarks = totalMarks; return this; }

        public Builder totalInternal(double totalInternal) { this.totalInternal = totalInternal; return this; }

        public Builder totalExternal(double totalExternal) { this.totalExternal = totalExternal; return this; }

        public Builder attemptedSubjectCount(int count)    { this.attemptedSubjectCount = count; return this; }

        public Builder percentage(double percentage)       { this.percentage = percentage; return this; }

        public Builder category(Category category)         { this.category = category; return this; }

        public Builder sgpa(Double sgpa)                   { this.sgpa = sgpa; return this; }

        public Builder sgpaResult(SgpaResult sgpaResult)   { this.sgpaResult = sgpaResult; return this; }

        public Builder classRank(Integer classRank)        { this.classRank = classRank; return this; }

        public Builder sectionRank(Integer sectionRank)    { this.sectionRank = sectionRank; return this; }

        public StudentRecord build() {
            return new StudentRecord(this);
        }
    }
}
