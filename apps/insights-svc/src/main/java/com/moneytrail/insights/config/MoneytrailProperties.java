package com.moneytrail.insights.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "moneytrail")
public record MoneytrailProperties(
        String zoneId,
        Dashboard dashboard,
        Reports reports
) {

    @ConstructorBinding
    public MoneytrailProperties {
        if (zoneId == null || zoneId.isBlank()) {
            zoneId = "UTC";
        }
        try {
            ZoneId.of(zoneId);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("zoneId must be a valid time zone: " + zoneId, ex);
        }
        // both sections are optional; missing ones fall back to the built-in limits
        dashboard = dashboard != null ? dashboard : new Dashboard(null, null, null, null, null);
        reports = reports != null ? reports : new Reports(null, null, null, null, null, null);
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    /**
     * How much of each series the dashboard keeps.
     */
    public record Dashboard(
            Integer dailyBuckets,
            Integer weeklyBuckets,
            Integer monthlyBuckets,
            Integer topCategories,
            Integer topAccounts
    ) {
        public Dashboard {
            dailyBuckets = positive(dailyBuckets, 30, "dailyBuckets");
            weeklyBuckets = positive(weeklyBuckets, 12, "weeklyBuckets");
            monthlyBuckets = positive(monthlyBuckets, 12, "monthlyBuckets");
            topCategories = positive(topCategories, 10, "topCategories");
            topAccounts = positive(topAccounts, 10, "topAccounts");
        }
    }

    /**
     * Defaults for report parameters the caller leaves out.
     */
    public record Reports(
            Integer balanceTrendDays,
            Integer cashFlowDays,
            Integer monthlyTrendMonths,
            Integer predictionMonths,
            Integer plannedPaymentMonths,
            Integer categoryTrendLimit
    ) {
        public Reports {
            balanceTrendDays = positive(balanceTrendDays, 30, "balanceTrendDays");
            cashFlowDays = positive(cashFlowDays, 30, "cashFlowDays");
            monthlyTrendMonths = positive(monthlyTrendMonths, 12, "monthlyTrendMonths");
            predictionMonths = positive(predictionMonths, 3, "predictionMonths");
            plannedPaymentMonths = positive(plannedPaymentMonths, 6, "plannedPaymentMonths");
            categoryTrendLimit = positive(categoryTrendLimit, 5, "categoryTrendLimit");
        }
    }

    private static Integer positive(Integer value, int fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
