package com.moneytrail.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TransactionType {
    INCOME,
    EXPENSE,
    TRANSFER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a wire code. {@code "all"} maps to {@code null}, meaning "no type constraint" in filter criteria.
     */
    @JsonCreator
    public static TransactionType fromCode(String code) {
        if (code == null || code.isBlank() || "all".equalsIgnoreCase(code.trim())) {
            return null;
        }
        for (TransactionType type : values()) {
            if (type.code().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + code);
    }
}
