package com.nana.results.service;

import com.nana.results.domain.SectionConfig;
import com.nana.results.domain.SectionRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SectionAssigner - Resolves a Student's Section
 *
 * <p>PRIORITY:
 * <ol>
 *   <li>Explicit table entry, matched after upper-casing and removing
 *       whitespace from both sides.</li>
 *   <li>Range rules, in declaration order. The last digit run of the id is
 *       compared with the last digit run of each rule's bounds; the first
 *       rule whose inclusive interval contains it wins. Reversed bounds are
 *       swapped. A rule whose bounds carry no digits never matches.</li>
 *   <li>{@link #UNASSIGNED}.</li>
 * </ol>
 *
 * <p>Digit runs are compared as {@link BigInteger} so long registration
 * numbers cannot overflow.
 */
public class SectionAssigner {

    private static final Logger log = LoggerFactory.getLogger(SectionAssigner.class);

    /** Section of students matched by no rule. */
    public static final String UNASSIGNED = "Unassigned";

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");

    /**
     * Resolves the section of one student.
     *
     * @param studentId raw student identifier
     * @param config    section rules
     * @return section name, never null
     */
    public String assignSection(String studentId, SectionConfig config) {
        if (config == null) {
            return UNASSIGNED;
        }
        String explicit = config.explicitSectionFor(studentId);
        if (explicit != null) {
            return explicit;
        }
        BigInteger number = lastDigitRun(studentId);
        if (number == null) {
            return UNASSIGNED;
        }
        for (SectionRange range : config.getRanges()) {
            if (contains(range, number)) {
                return range.getSectionName();
            }
        }
        return UNASSIGNED;
    }

    /**
     * Convenience overload taking the explicit table separately.
     *
     * @param studentId raw student identifier
     * @param ranges    range rules (explicit entries inside are honoured too)
     * @param explicit  additional explicit table, id to section
     * @return section name, never null
     */
    public String assignSection(String studentId, SectionConfig ranges, Map<String, String> explicit) {
        SectionConfig.Builder merged = SectionConfig.builder();
        if (ranges != null) {
            ranges.getRanges().forEach(r -> merged.range(r.getSectionName(), r.getStartId(), r.getEndId()));
            merged.assignAll(ranges.getExplicitMapping());
        }
        merged.assignAll(explicit);
        return assignSection(studentId, merged.build());
    }

    /**
     * Checks range rules for missing section names.
     *
     * @param config section rules
     * @throws ValidationException with key {@code "sections.<n>"} (1-based
     *         rule position) for every rule without a name
     */
    public void validate(SectionConfig config) throws ValidationException {
        Map<String, String> errors = new LinkedHashMap<>();
        List<SectionRange> ranges = config.getRanges();
        for (int i = 0; i < ranges.size(); i++) {
            if (ranges.get(i).getSectionName().isBlank()) {
                errors.put("sections." + (i + 1),
                        "Section rule " + (i + 1) + " (" + ranges.get(i).getStartId() + " to "
                        + ranges.get(i).getEndId() + ") has no section name and was ignored.");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * @param config section rules
     * @return the same rules without range rules that have a blank name
     */
    public SectionConfig withoutUnnamedRules(SectionConfig config) {
        SectionConfig.Builder builder = SectionConfig.builder().assignAll(config.getExplicitMapping());
        config.getRanges().stream()
              .filter(r -> !r.getSectionName().isBlank())
              .forEach(r -> builder.range(r.getSectionName(), r.getStartId(), r.getEndId()));
        return builder.build();
    }

    /**
     * Returns true if a range rule contains the given id number.
     *
     * @param range  rule
     * @param number last digit run of a student id
     * @return true when {@code min(start,end) <= number <= max(start,end)}
     */
    boolean contains(SectionRange range, BigInteger number) {
        BigInteger start = lastDigitRun(range.getStartId());
        BigInteger end = lastDigitRun(range.getEndId());
        if (start == null || end == null) {
            log.debug("Section rule {} has a bound without digits; skipped.", range);
            return false;
        }
        BigInteger low = start.min(end);
        BigInteger high = start.max(end);
        return number.compareTo(low) >= 0 && number.compareTo(high) <= 0;
    }

    /**
     * @param text identifier text
     * @return value of the last contiguous digit run, or null if none
     */
    static BigInteger lastDigitRun(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = DIGIT_RUN.matcher(text);
        String last = null;
        while (matcher.find()) {
            last = matcher.group();
        }
        return last == null ? null : new BigInteger(last);
    }
}
