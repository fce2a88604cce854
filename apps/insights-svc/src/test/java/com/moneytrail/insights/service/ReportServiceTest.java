package com.moneytrail.insights.service;

import static com.moneytrail.insights.support.LedgerFixtures.between;
import static com.moneytrail.insights.support.LedgerFixtures.expense;
import static com.moneytrail.insights.support.LedgerFixtures.income;
import static com.moneytrail.insights.support.LedgerFixtures.ledgerOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.moneytrail.insights.analytics.ComparativeAnalyzer;
import com.moneytrail.insights.analytics.DashboardCalculator;
import com.moneytrail.insights.analytics.FilterCriteria;
import com.moneytrail.insights.analytics.PeriodStatisticsCalculator;
import com.moneytrail.insights.analytics.PlannedPaymentsCalculator;
import com.moneytrail.insights.analytics.SpendingAggregator;
import com.moneytrail.insights.analytics.SpendingForecaster;
import com.moneytrail.insights.analytics.TransactionFilter;
import com.moneytrail.insights.config.MoneytrailProperties;
import com.moneytrail.insights.model.Granularity;
import com.moneytrail.insights.model.LedgerSnapshot;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.TransactionType;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ReportServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Mock
    private SpendingAggregator spendingAggregator;

    @Mock
    private PeriodStatisticsCalculator periodStatistics;

    @Mock
    private ComparativeAnalyzer comparativeAnalyzer;

    @Mock
    private SpendingForecaster spendingForecaster;

    @Mock
    private DashboardCalculator dashboardCalculator;

    @Mock
    private PlannedPaymentsCalculator plannedPayments;

    private ReportService reportService;

    private final Transaction january = expense("10", "2024-01-10", "food");
    private final Transaction march = expense("20", "2024-03-10", "food");
    private final Transaction salary = income("100", "2024-03-01");
    private final LedgerSnapshot ledger = ledgerOf(List.of(january, march, salary));

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
        MoneytrailProperties properties = new MoneytrailProperties("UTC", null, null);
        reportService = new ReportService(
                new TransactionFilter(),
                spendingAggregator,
                periodStatistics,
                comparativeAnalyzer,
                spendingForecaster,
                dashboardCalculator,
                plannedPayments,
                properties,
                clock);
    }

    @Test
    void filteredReportsOnlySeeMatchingTransactions() {
        FilterCriteria marchOnly = between(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

        reportService.summary(ledger, marchOnly);

        verify(spendingAggregator).summary(List.of(march, salary));
    }

    @Test
    void spendingDefaultsToExpenseAndResolvesThePluralDimension() {
        reportService.spending(ledger, null, "categories", null);

        verify(spendingAggregator).categorySpending(ledger.transactions(), ledger.categories(), TransactionType.EXPENSE);
    }

    @Test
    void spendingRejectsTransfersAndUnknownDimensions() {
        assertThatThrownBy(() -> reportService.spending(ledger, null, "category", "transfer"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reportService.spending(ledger, null, "merchant", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("category, account, label");
        verifyNoInteractions(spendingAggregator);
    }

    @Test
    void relativeReportsUseTheClockAndConfiguredDefaults() {
        reportService.balanceTrend(ledger, null);
        reportService.monthlyTrends(ledger, null, null);
        reportService.plannedPayments(ledger, 2);

        verify(comparativeAnalyzer).balanceTrend(ledger.transactions(), ledger.accounts(), 30, TODAY);
        verify(periodStatistics).monthlyTrends(ledger.transactions(), 12, TODAY);
        verify(plannedPayments).plannedPayments(ledger.plannedTransactions(), 2, TODAY);
    }

    @Test
    void yearOverYearReadsTheWholeLedger() {
        reportService.yearOverYear(ledger, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        verify(comparativeAnalyzer).yearOverYear(ledger.transactions(), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
    }

    @Test
    void invertedRangesAreRejected() {
        assertThatThrownBy(() -> reportService.periods(ledger, null, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1), "daily"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("startDate must not be after endDate");
        verify(periodStatistics, never()).bucketize(any(), any(), any(), any());
    }

    @Test
    void categoryTrendsDefaultToMonthlyAndRejectDaily() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 3, 31);

        reportService.categoryTrends(ledger, null, start, end, null, null);

        verify(comparativeAnalyzer).categoryTrends(ledger.transactions(), ledger.categories(), start, end, Granularity.MONTHLY, 5);
        assertThatThrownBy(() -> reportService.categoryTrends(ledger, null, start, end, "daily", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyForecastIsPassedThrough() {
        when(spendingForecaster.predict(any(), any(), any(), anyInt())).thenReturn(List.of());

        assertThat(reportService.predictions(ledger, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31), null)).isEmpty();
        verify(spendingForecaster).predict(eq(ledger.transactions()), any(), any(), eq(3));
    }

    @Test
    void searchReturnsNewestFirstAndHonoursTheLimit() {
        assertThat(reportService.search(ledger, null, null)).containsExactly(march, salary, january);
        assertThat(reportService.search(ledger, null, 1)).containsExactly(march);
        assertThatThrownBy(() -> reportService.search(ledger, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
