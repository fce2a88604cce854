package com.moneytrail.insights.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;

record DatedAmount(LocalDate date, BigDecimal amount) {
}
