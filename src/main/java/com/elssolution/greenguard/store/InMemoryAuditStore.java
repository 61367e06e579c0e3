package com.elssolution.greenguard.store;

import com.elssolution.greenguard.domain.AuditNotFoundException;
import com.elssolution.greenguard.domain.AuditVerdict;
import com.elssolution.greenguard.domain.HumanAction;
import com.elssolution.greenguard.domain.HumanActionAlreadySetException;
import com.elssolution.greenguard.domain.TraceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed verdict store. Updates go through {@link Map#compute}, so each record
 * changes atomically; records themselves are immutable snapshots.
 */
@Slf4j
@Repository
public class InMemoryAuditStore implements AuditStore {

    private final Map<String, AuditVerdict> verdicts = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryAuditStore() {
        this(Clock.systemUTC());
    }

    InMemoryAuditStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String createAuditVerdict(AuditVerdict verdict) {
        Objects.requireNonNull(verdict, "verdict");
        String id = UUID.randomUUID().toString();
        AuditVerdict stored = verdict.toBuilder()
                .id(id)
                .createdAt(verdict.getCreatedAt() != null ? verdict.getCreatedAt() : clock.instant())
                .build();
        verdicts.put(id, stored);
        log.debug("audit_created id={} telemetry={} severity={}", id, stored.getTelemetryId(), stored.getSeverity());
        return id;
    }

    @Override
    public AuditVerdict setHumanAction(String auditId, HumanAction action) {
        Objects.requireNonNull(action, "action");
        AuditVerdict updated = verdicts.compute(auditId == null ? "" : auditId, (id, current) -> {
            if (current == null) throw new AuditNotFoundException(auditId);
            if (current.getHumanAction() != null) {
                throw new HumanActionAlreadySetException(auditId, current.getHumanAction());
            }
            return current.toBuilder().humanAction(action).humanActionAt(clock.instant()).build();
        });
        log.info("audit_reviewed id={} action={}", auditId, action);
        return updated;
    }

    @Override
    public void appendTrace(String auditId, List<TraceEntry> entries) {
        if (entries == null || entries.isEmpty()) return;
        verdicts.compute(auditId == null ? "" : auditId, (id, current) -> {
            if (current == null) throw new AuditNotFoundException(auditId);
            return current.toBuilder().trace(entries).build();
        });
    }

    @Override
    public Optional<AuditVerdict> findById(String auditId) {
        if (auditId == null) return Optional.empty();
        return Optional.ofNullable(verdicts.get(auditId));
    }

    @Override
    public List<AuditVerdict> findAll() {
        return verdicts.values().stream()
                .sorted(Comparator.comparing(AuditVerdict::getCreatedAt).reversed())
                .toList();
    }
}
