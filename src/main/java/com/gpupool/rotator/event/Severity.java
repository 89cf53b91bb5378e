package com.gpupool.rotator.event;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
