package com.elssolution.greenguard.domain;

public class HumanActionAlreadySetException extends RuntimeException {
    public HumanActionAlreadySetException(String auditId, HumanAction existing) {
        super("Audit " + auditId + " already reviewed: " + existing);
    }
}
