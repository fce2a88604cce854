package com.moneytrail.insights.model.report;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CashFlowPoint(LocalDate date, String dateLabel, BigDecimal income, BigDecimal expense, BigDecimal net) {
}
