package com.moneytrail.insights.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Granularity {
    DAILY,
    WEEKLY,
    MONTHLY;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Granularity fromCode(String code) {
        if (code != null) {
            for (Granularity granularity : values()) {
                if (granularity.code().equalsIgnoreCase(code.trim())) {
                    return granularity;
                }
            }
        }
        throw new IllegalArgumentException("granularity must be one of daily, weekly, monthly");
    }
}
