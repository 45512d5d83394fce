package com.logstuff.query;

import java.util.Objects;

/**
 * A bare quoted string, matched against the derived search column rather than a document field.
 */
public class FullTextSearchExpression implements Expression {
    private final String text;

    public FullTextSearchExpression(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FullTextSearchExpression)) return false;
        return text.equals(((FullTextSearchExpression) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "FTS(" + text + ")";
    }
}
