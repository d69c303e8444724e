package io.cronwarden.core;

public enum ScheduleKind {
    CRON,
    INTERVAL
}
