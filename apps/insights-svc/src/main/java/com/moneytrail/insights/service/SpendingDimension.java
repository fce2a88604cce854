package com.moneytrail.insights.service;

import java.util.Locale;

public enum SpendingDimension {
    CATEGORY,
    ACCOUNT,
    LABEL;

    public static SpendingDimension fromPath(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            // accept the plural form used in report URLs
            if (normalized.endsWith("IES")) {
                normalized = normalized.substring(0, normalized.length() - 3) + "Y";
            } else if (normalized.endsWith("S")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            for (SpendingDimension dimension : values()) {
                if (dimension.name().equals(normalized)) {
                    return dimension;
                }
            }
        }
        throw new IllegalArgumentException("dimension must be one of category, account, label");
    }
}
