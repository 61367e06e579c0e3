package com.elssolution.greenguard.domain;

public enum TraceLevel {
    INFO, SUCCESS, WARNING, ERROR
}
