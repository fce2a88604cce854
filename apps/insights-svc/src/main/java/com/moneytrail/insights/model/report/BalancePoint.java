package com.moneytrail.insights.model.report;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Reconstructed total balance at the end of {@code date}. */
public record BalancePoint(LocalDate date, String dateLabel, BigDecimal balance) {
}
