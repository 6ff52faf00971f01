package com.kmg.tagger.repo;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class StateTime {
    private StateTime() {
    }

    public static String nowText() {
        return OffsetDateTime.now(ZoneOffset.UTC).toString();
    }

    public static OffsetDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(value);
    }
}
