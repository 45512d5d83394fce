package com.logstuff.search;

/**
 * One value of a document key and the share of sampled events carrying it, in percent.
 */
public class FieldValueShare {
    private final String value;
    private final long count;
    private final double percentage;

    public FieldValueShare(String value, long count, double percentage) {
        this.value = value;
        this.count = count;
        this.percentage = percentage;
    }

    public String getValue() {
        return value;
    }

    public long getCount() {
        return count;
    }

    public double getPercentage() {
        return percentage;
    }

    @Override
    public String toString() {
        return value + "=" + count + " (" + percentage + "%)";
    }
}
