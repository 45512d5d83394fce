package com.logstuff.search;

import java.util.List;
import java.util.Map;

/**
 * Most frequent values per document key over a sample of the most recent matches.
 */
public class TopFields {
    private final Map<String, List<FieldValueShare>> fields;
    private final int sampleCount;

    public TopFields(Map<String, List<FieldValueShare>> fields, int sampleCount) {
        this.fields = fields;
        this.sampleCount = sampleCount;
    }

    /**
     * Keys in alphabetical order, values most frequent first.
     */
    public Map<String, List<FieldValueShare>> getFields() {
        return fields;
    }

    public int getSampleCount() {
        return sampleCount;
    }
}
