package com.cyclomatic.model;

public record SourceToken(String spelling) {

    @Override
    public String toString() {
        return spelling;
    }
}
