package com.kmg.tagger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Profile {
    RACING_PORSCHE("racing-porsche"),
    RACING_GENERAL("racing-general"),
    RACING_NASCAR("racing-nascar"),
    RACING_IMSA("racing-imsa"),
    RACING_WORLD_CHALLENGE("racing-world-challenge"),
    RACING_INDYCAR("racing-indycar"),
    COLLEGE_SPORTS("college-sports");

    private final String id;

    Profile(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static Profile fromId(String value) {
        return Arrays.stream(values())
                .filter(profile -> profile.id.equalsIgnoreCase(value) || profile.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown profile: " + value));
    }
}
