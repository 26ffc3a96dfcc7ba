package com.tx.insights.config;

public enum OutputFormat {
    TEXT,
    CSV,
    JSON
}
