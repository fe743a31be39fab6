package com.cyclomatic.connectors;

import java.util.List;

/**
 * Thrown when the frontend cannot produce a tree for a unit.
 */
public class SourceParseException extends Exception {

    private final String unitName;
    private final List<String> problems;

    public SourceParseException(final String unitName, final List<String> problems) {
        super("Unable to parse " + unitName + (problems.isEmpty() ? "" : ": " + problems.get(0)));
        this.unitName = unitName;
        this.problems = List.copyOf(problems);
    }

    public String getUnitName() {
        return unitName;
    }

    public List<String> getProblems() {
        return problems;
    }
}
