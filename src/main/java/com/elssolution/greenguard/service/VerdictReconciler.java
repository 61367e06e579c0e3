package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Higher severity wins; on a tie the AI side supplies confidence and reasoning.
 * The result is never below the rule engine's severity.
 */
@Component
public class VerdictReconciler {

    public Reconciliation reconcile(ClassifierVerdict rule, ClassifierVerdict ai) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(ai, "ai");
        return rule.severity().isHigherThan(ai.severity())
                ? new Reconciliation(rule, ai)
                : new Reconciliation(ai, rule);
    }
}
