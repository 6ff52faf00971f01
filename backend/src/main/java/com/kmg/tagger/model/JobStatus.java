package com.kmg.tagger.model;

public enum JobStatus {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED
}
