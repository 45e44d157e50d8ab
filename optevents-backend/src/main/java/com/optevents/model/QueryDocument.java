package com.optevents.model;

import java.util.Objects;

/**
 * A fully rendered query. Immutable; the text is never parsed again by this service.
 */
public final class QueryDocument {
    private final String label;
    private final String text;

    public QueryDocument(String label, String text) {
        this.label = Objects.requireNonNull(label, "label");
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * Short name of the query used in log lines and error messages (e.g. {@code events}).
     *
     * @return label
     */
    public String getLabel() {
        return label;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryDocument other)) {
            return false;
        }
        return label.equals(other.label) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
