package dev.autoapply.entity;

public enum JobLinkStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED,
    SKIPPED,
    APPLIED
}
