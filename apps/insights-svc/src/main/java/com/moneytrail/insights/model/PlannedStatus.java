package com.moneytrail.insights.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum PlannedStatus {
    PENDING,
    COMPLETED,
    CANCELLED,
    SKIPPED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
