package com.newsintel.curator.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum ExecutionStatus {
    PENDING, RUNNING, COMPLETED, PARTIAL, FAILED;

    public static final Set<ExecutionStatus> ACTIVE = EnumSet.of(PENDING, RUNNING);
    public static final Set<ExecutionStatus> RESUMABLE = EnumSet.of(FAILED, PARTIAL);
    public static final Set<ExecutionStatus> FINAL = EnumSet.of(COMPLETED, PARTIAL, FAILED);

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExecutionStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
