package com.elssolution.greenguard.domain;

/** Per-field provenance: weather covers temperature, condition and humidity. */
public record SourceProvenance(Provenance weather, Provenance grid) {}
