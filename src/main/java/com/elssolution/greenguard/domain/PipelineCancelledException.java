package com.elssolution.greenguard.domain;

/** Raised inside a run once its worker was interrupted. */
public class PipelineCancelledException extends RuntimeException {
    public PipelineCancelledException(String message) {
        super(message);
    }
}
