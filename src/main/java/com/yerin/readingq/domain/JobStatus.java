package com.yerin.readingq.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    @JsonProperty("DLQ")
    DLQ;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == DLQ;
    }
}
