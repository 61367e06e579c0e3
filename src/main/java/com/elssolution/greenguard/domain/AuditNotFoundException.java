package com.elssolution.greenguard.domain;

public class AuditNotFoundException extends RuntimeException {
    public AuditNotFoundException(String auditId) {
        super("Audit verdict not found: " + auditId);
    }
}
