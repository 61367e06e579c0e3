package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import com.elssolution.greenguard.domain.Severity;

/** Chosen verdict plus the one that lost, kept for the trace. */
public record Reconciliation(ClassifierVerdict chosen, ClassifierVerdict discarded) {

    public Severity severity() { return chosen.severity(); }
    public int confidence()    { return chosen.confidence(); }
    public String reasoning()  { return chosen.reasoning(); }
}
