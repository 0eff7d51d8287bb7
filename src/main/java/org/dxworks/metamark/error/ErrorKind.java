package org.dxworks.metamark.error;

public enum ErrorKind {
    LEX("lex"),
    PARSER("parser"),
    METADATA("metadata");

    private final String name;

    ErrorKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
