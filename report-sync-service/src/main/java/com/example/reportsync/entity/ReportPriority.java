package com.example.reportsync.entity;

public enum ReportPriority {
    LOWEST,
    LOW,
    MEDIUM,
    HIGH,
    HIGHEST
}
