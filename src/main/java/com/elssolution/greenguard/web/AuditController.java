package com.elssolution.greenguard.web;

import com.elssolution.greenguard.domain.AuditVerdict;
import com.elssolution.greenguard.domain.HumanAction;
import com.elssolution.greenguard.service.AuditReviewService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/audits")
public class AuditController {

    private final AuditReviewService reviews;

    public AuditController(AuditReviewService reviews) {
        this.reviews = reviews;
    }

    @GetMapping
    public List<AuditVerdict> all() {
        return reviews.all();
    }

    @GetMapping("/pending")
    public List<AuditVerdict> pending() {
        return reviews.pendingReviews();
    }

    @GetMapping("/{id}")
    public AuditVerdict get(@PathVariable("id") String id) {
        return reviews.find(id);
    }

    /** Body: {@code {"action": "APPROVED" | "FLAGGED"}}. */
    @PostMapping("/{id}/human-action")
    public AuditVerdict humanAction(@PathVariable("id") String id, @RequestBody Map<String, String> body) {
        String raw = body == null ? null : body.get("action");
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("action is required (APPROVED or FLAGGED)");
        }
        HumanAction action;
        try {
            action = HumanAction.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + raw);
        }
        return reviews.recordHumanAction(id, action);
    }
}
