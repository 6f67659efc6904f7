package com.yerin.readingq.global.exception.code;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
