package com.newsintel.curator.model;

import java.util.Locale;

public enum StageStatus {
    PENDING, RUNNING, COMPLETED, FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StageStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
