package com.example.reportsync.entity;

public enum FileType {
    SCREENSHOT,
    VIDEO,
    ATTACHMENT
}
