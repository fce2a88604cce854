package com.moneytrail.insights.model.report;

import com.moneytrail.insights.model.AccountType;
import java.math.BigDecimal;

public record InvestmentHolding(
        String accountId,
        String accountName,
        AccountType accountType,
        BigDecimal balance,
        BigDecimal percentage
) {
}
