package com.nana.results.service;

import com.nana.results.domain.StudentRecord;
import com.nana.results.domain.SubjectSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * NormalizedSnapshot - Cached Schema and Classified Records
 *
 * <p>Output of the first pipeline stages (schema detection, section
 * assignment, classification, metrics). Records carry no SGPA or rank.
 */
public final class NormalizedSnapshot {

    private final SubjectSchema schema;
    private final List<StudentRecord> records;

    public NormalizedSnapshot(SubjectSchema schema, List<StudentRecord> records) {
        this.schema  = schema;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public SubjectSchema getSchema()        { return schema; }

    public List<StudentRecord> getRecords() { return records; }
}
