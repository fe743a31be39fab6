package com.cyclomatic.model;

/**
 * 1-based line and column of a node in the analysed unit.
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
