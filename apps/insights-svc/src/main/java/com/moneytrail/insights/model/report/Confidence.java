package com.moneytrail.insights.model.report;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
