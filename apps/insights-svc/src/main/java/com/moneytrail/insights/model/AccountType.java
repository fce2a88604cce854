package com.moneytrail.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AccountType {
    CASH("Cash", false),
    DIGITAL_WALLET("Digital Wallet", false),
    SAVINGS_ACCOUNT("Savings Account", false),
    CURRENT_ACCOUNT("Current Account", false),
    FIXED_DEPOSIT("Fixed Deposit (FD)", true),
    RECURRING_DEPOSIT("Recurring Deposit (RD)", true),
    PUBLIC_PROVIDENT_FUND("Public Provident Fund (PPF)", true),
    MONTHLY_INCOME_SCHEME("Monthly Income Scheme (MIS)", true),
    NATIONAL_PENSION_SYSTEM("National Pension System (NPS)", true),
    MUTUAL_FUND("Mutual Fund", true),
    STOCKS("Stocks", true),
    BONDS("Bonds", true),
    GOLD("Gold", true),
    CREDIT_CARD("Credit Card", false),
    LOAN("Loan", false),
    OTHER("Other", false);

    private final String label;
    private final boolean investment;

    AccountType(String label, boolean investment) {
        this.label = label;
        this.investment = investment;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean investment() {
        return investment;
    }

    @JsonCreator
    public static AccountType fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        String trimmed = label.trim();
        for (AccountType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return OTHER;
    }
}
