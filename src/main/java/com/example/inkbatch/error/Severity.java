package com.example.inkbatch.error;

public enum Severity {
    WARNING,
    ERROR,
    CRITICAL
}
