package com.tx.insights.scoring;

public enum EffortLevel {
    LOW,
    MEDIUM,
    HIGH
}
