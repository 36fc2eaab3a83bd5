package org.bloodmatch.engine.domain.model;

/**
 * How a match was requested.
 */
public enum MatchKind {
    NORMAL("Normal"),
    EMERGENCY("Emergency");

    private final String label;

    MatchKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
