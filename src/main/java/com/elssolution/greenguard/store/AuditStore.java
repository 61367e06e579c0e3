package com.elssolution.greenguard.store;

import com.elssolution.greenguard.domain.AuditVerdict;
import com.elssolution.greenguard.domain.HumanAction;
import com.elssolution.greenguard.domain.TraceEntry;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for final verdicts. Single-record create/update is atomic.
 */
public interface AuditStore {

    /** @return id assigned to the new record */
    String createAuditVerdict(AuditVerdict verdict);

    /**
     * Sets the reviewer decision.
     *
     * @throws com.elssolution.greenguard.domain.AuditNotFoundException if the id is unknown
     * @throws com.elssolution.greenguard.domain.HumanActionAlreadySetException if a decision exists
     */
    AuditVerdict setHumanAction(String auditId, HumanAction action);

    /** Appends entries to the stored trace, keeping order. */
    void appendTrace(String auditId, List<TraceEntry> entries);

    Optional<AuditVerdict> findById(String auditId);

    List<AuditVerdict> findAll();
}
