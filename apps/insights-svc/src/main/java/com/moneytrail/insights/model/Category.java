package com.moneytrail.insights.model;

public record Category(String id, String name, String icon, String color, CategoryType type) {

    public static final String UNCATEGORIZED_NAME = "Uncategorized";
    public static final String PLACEHOLDER_ICON = "💰";
    public static final String PLACEHOLDER_COLOR = "#999999";

    /** Stand-in for a category id that no longer resolves. */
    public static Category placeholder(String id) {
        return new Category(id, UNCATEGORIZED_NAME, PLACEHOLDER_ICON, PLACEHOLDER_COLOR, CategoryType.EXPENSE);
    }
}
