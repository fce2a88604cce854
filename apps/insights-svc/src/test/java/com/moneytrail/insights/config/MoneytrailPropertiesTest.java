package com.moneytrail.insights.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class MoneytrailPropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        MoneytrailProperties props = new MoneytrailProperties(null, null, null);

        assertEquals(ZoneId.of("UTC"), props.zone());
        assertEquals(30, props.dashboard().dailyBuckets());
        assertEquals(12, props.dashboard().weeklyBuckets());
        assertEquals(10, props.dashboard().topAccounts());
        assertEquals(3, props.reports().predictionMonths());
        assertEquals(5, props.reports().categoryTrendLimit());
    }

    @Test
    void partialSectionsKeepExplicitValues() {
        MoneytrailProperties props = new MoneytrailProperties(
                "Asia/Kolkata",
                new MoneytrailProperties.Dashboard(7, null, null, null, null),
                new MoneytrailProperties.Reports(90, null, null, null, null, null));

        assertEquals(7, props.dashboard().dailyBuckets());
        assertEquals(12, props.dashboard().monthlyBuckets());
        assertEquals(90, props.reports().balanceTrendDays());
        assertEquals(30, props.reports().cashFlowDays());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MoneytrailProperties("Mars/Olympus", null, null));
        assertThrows(IllegalArgumentException.class, () -> new MoneytrailProperties.Dashboard(0, null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new MoneytrailProperties.Reports(null, -1, null, null, null, null));
    }
}
