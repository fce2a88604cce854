package com.moneytrail.insights.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Recurrence {
    NONE,
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
