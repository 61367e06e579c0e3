package com.elssolution.greenguard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Where a context field came from. */
public enum Provenance {
    API,
    SYNTHETIC;

    @JsonValue
    public String label() { return name().toLowerCase(Locale.ROOT); }
}
