package com.moneytrail.insights.model;

public record Label(String id, String name, String color) {

    public static final String UNKNOWN_NAME = "Unknown Label";

    public static Label placeholder(String id) {
        return new Label(id, UNKNOWN_NAME, Category.PLACEHOLDER_COLOR);
    }
}
