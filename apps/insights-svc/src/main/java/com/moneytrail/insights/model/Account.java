package com.moneytrail.insights.model;

import java.math.BigDecimal;

public record Account(String id, String name, AccountType type, BigDecimal balance, String color) {

    public static final String UNKNOWN_NAME = "Unknown Account";

    public Account {
        balance = Amounts.orZero(balance);
        type = type == null ? AccountType.OTHER : type;
    }

    public static Account placeholder(String id) {
        return new Account(id, UNKNOWN_NAME, AccountType.OTHER, BigDecimal.ZERO, Category.PLACEHOLDER_COLOR);
    }
}
