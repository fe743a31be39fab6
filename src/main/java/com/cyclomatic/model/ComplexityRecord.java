package com.cyclomatic.model;

import java.util.Objects;

/**
 * One report line: declaration line, function name and its cyclomatic complexity.
 */
public record ComplexityRecord(int line, String functionName, int complexity) {

    public ComplexityRecord {
        Objects.requireNonNull(functionName, "functionName");
    }
}
