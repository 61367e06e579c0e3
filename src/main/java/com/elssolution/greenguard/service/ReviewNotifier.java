package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.AuditVerdict;

/** Outbound "please review" message for WARNING and ANOMALY verdicts. */
public interface ReviewNotifier {

    boolean isEnabled();

    /** @return true if the message was delivered */
    boolean notifyReviewRequired(AuditVerdict verdict);
}
