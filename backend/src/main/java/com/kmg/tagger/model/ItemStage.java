package com.kmg.tagger.model;

public enum ItemStage {
    PENDING,
    PREPARING,
    PREPARED,
    PROCESSING,
    DONE
}
