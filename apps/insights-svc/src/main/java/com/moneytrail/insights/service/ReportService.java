package com.moneytrail.insights.service;

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
import com.moneytrail.insights.model.report.BalancePoint;
import com.moneytrail.insights.model.report.BudgetProgress;
import com.moneytrail.insights.model.report.CashFlowPoint;
import com.moneytrail.insights.model.report.CategoryTrend;
import com.moneytrail.insights.model.report.DashboardStatistics;
import com.moneytrail.insights.model.report.DimensionSpending;
import com.moneytrail.insights.model.report.DuePlannedTransaction;
import com.moneytrail.insights.model.report.InvestmentHolding;
import com.moneytrail.insights.model.report.LedgerSummary;
import com.moneytrail.insights.model.report.PeriodStat;
import com.moneytrail.insights.model.report.PlannedPaymentMonth;
import com.moneytrail.insights.model.report.SpendingPrediction;
import com.moneytrail.insights.model.report.YearOverYearComparison;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for every report. Resolves defaults and "today", applies request filters where the report honours
 * them, and delegates to the analytics components.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final TransactionFilter transactionFilter;
    private final SpendingAggregator spendingAggregator;
    private final PeriodStatisticsCalculator periodStatistics;
    private final ComparativeAnalyzer comparativeAnalyzer;
    private final SpendingForecaster spendingForecaster;
    private final DashboardCalculator dashboardCalculator;
    private final PlannedPaymentsCalculator plannedPayments;
    private final MoneytrailProperties.Reports defaults;
    private final Clock clock;

    public ReportService(
            TransactionFilter transactionFilter,
            SpendingAggregator spendingAggregator,
            PeriodStatisticsCalculator periodStatistics,
            ComparativeAnalyzer comparativeAnalyzer,
            SpendingForecaster spendingForecaster,
            DashboardCalculator dashboardCalculator,
            PlannedPaymentsCalculator plannedPayments,
            MoneytrailProperties properties,
            Clock clock
    ) {
        this.transactionFilter = transactionFilter;
        this.spendingAggregator = spendingAggregator;
        this.periodStatistics = periodStatistics;
        this.comparativeAnalyzer = comparativeAnalyzer;
        this.spendingForecaster = spendingForecaster;
        this.dashboardCalculator = dashboardCalculator;
        this.plannedPayments = plannedPayments;
        this.defaults = properties.reports();
        this.clock = clock;
    }

    public List<Transaction> search(LedgerSnapshot ledger, FilterCriteria filters, Integer limit) {
        List<Transaction> matches = filtered(ledger, filters);
        log.debug("Search matched {} of {} transactions", matches.size(), ledger.transactions().size());
        if (limit == null) {
            return transactionFilter.sortByDate(matches, true);
        }
        return transactionFilter.mostRecent(matches, requirePositive(limit, "limit"));
    }

    public LedgerSummary summary(LedgerSnapshot ledger, FilterCriteria filters) {
        return spendingAggregator.summary(filtered(ledger, filters));
    }

    public List<DimensionSpending> spending(LedgerSnapshot ledger, FilterCriteria filters, String dimension, String type) {
        SpendingDimension resolved = SpendingDimension.fromPath(dimension);
        TransactionType transactionType = spendingType(type);
        List<Transaction> transactions = filtered(ledger, filters);
        log.info("Computing {} spending for {} over {} transactions", resolved.name().toLowerCase(), transactionType.code(), transactions.size());
        return switch (resolved) {
            case CATEGORY -> spendingAggregator.categorySpending(transactions, ledger.categories(), transactionType);
            case ACCOUNT -> spendingAggregator.accountSpending(transactions, ledger.accounts(), transactionType);
            case LABEL -> spendingAggregator.labelSpending(transactions, ledger.labels(), transactionType);
        };
    }

    public List<PeriodStat> periods(LedgerSnapshot ledger, FilterCriteria filters, LocalDate startDate, LocalDate endDate, String granularity) {
        requireRange(startDate, endDate);
        Granularity resolved = Granularity.fromCode(granularity);
        return periodStatistics.bucketize(filtered(ledger, filters), startDate, endDate, resolved);
    }

    public List<PeriodStat> monthlyTrends(LedgerSnapshot ledger, FilterCriteria filters, Integer months) {
        int count = orDefault(months, defaults.monthlyTrendMonths(), "months");
        return periodStatistics.monthlyTrends(filtered(ledger, filters), count, today());
    }

    public List<CashFlowPoint> cashFlow(LedgerSnapshot ledger, FilterCriteria filters, Integer days) {
        int count = orDefault(days, defaults.cashFlowDays(), "days");
        return periodStatistics.cashFlow(filtered(ledger, filters), count, today());
    }

    public List<BalancePoint> balanceTrend(LedgerSnapshot ledger, Integer days) {
        int count = orDefault(days, defaults.balanceTrendDays(), "days");
        LocalDate today = today();
        log.info("Reconstructing balance for {} days up to {} from current total {}", count, today, ledger.totalBalance());
        return comparativeAnalyzer.balanceTrend(ledger.transactions(), ledger.accounts(), count, today);
    }

    public YearOverYearComparison yearOverYear(LedgerSnapshot ledger, LocalDate startDate, LocalDate endDate) {
        requireRange(startDate, endDate);
        return comparativeAnalyzer.yearOverYear(ledger.transactions(), startDate, endDate);
    }

    public List<CategoryTrend> categoryTrends(
            LedgerSnapshot ledger,
            FilterCriteria filters,
            LocalDate startDate,
            LocalDate endDate,
            String granularity,
            Integer limit
    ) {
        requireRange(startDate, endDate);
        Granularity resolved = granularity == null ? Granularity.MONTHLY : Granularity.fromCode(granularity);
        if (resolved == Granularity.DAILY) {
            throw new IllegalArgumentException("category trends support weekly or monthly granularity");
        }
        int top = orDefault(limit, defaults.categoryTrendLimit(), "limit");
        return comparativeAnalyzer.categoryTrends(filtered(ledger, filters), ledger.categories(), startDate, endDate, resolved, top);
    }

    public List<SpendingPrediction> predictions(LedgerSnapshot ledger, LocalDate startDate, LocalDate endDate, Integer months) {
        requireRange(startDate, endDate);
        int ahead = orDefault(months, defaults.predictionMonths(), "months");
        List<SpendingPrediction> forecast = spendingForecaster.predict(ledger.transactions(), startDate, endDate, ahead);
        if (forecast.isEmpty()) {
            log.info("Not enough monthly history between {} and {} for a forecast", startDate, endDate);
        }
        return forecast;
    }

    public DashboardStatistics dashboard(LedgerSnapshot ledger, FilterCriteria filters, LocalDate startDate, LocalDate endDate) {
        requireRange(startDate, endDate);
        List<Transaction> transactions = filtered(ledger, filters);
        log.info("Composing dashboard for {} to {} over {} transactions", startDate, endDate, transactions.size());
        return dashboardCalculator.compose(transactions, ledger.accounts(), ledger.categories(), startDate, endDate);
    }

    public List<BudgetProgress> budgets(LedgerSnapshot ledger) {
        return spendingAggregator.budgetProgress(ledger.budgets(), ledger.transactions());
    }

    public List<PlannedPaymentMonth> plannedPayments(LedgerSnapshot ledger, Integer months) {
        int count = orDefault(months, defaults.plannedPaymentMonths(), "months");
        return plannedPayments.plannedPayments(ledger.plannedTransactions(), count, today());
    }

    public List<DuePlannedTransaction> duePlannedTransactions(LedgerSnapshot ledger) {
        return plannedPayments.due(ledger.plannedTransactions(), today());
    }

    public List<InvestmentHolding> investments(LedgerSnapshot ledger) {
        return spendingAggregator.investmentPortfolio(ledger.accounts());
    }

    LocalDate today() {
        return LocalDate.now(clock);
    }

    private List<Transaction> filtered(LedgerSnapshot ledger, FilterCriteria filters) {
        return transactionFilter.filter(ledger.transactions(), filters != null ? filters : FilterCriteria.none());
    }

    private static TransactionType spendingType(String type) {
        if (type == null || type.isBlank()) {
            return TransactionType.EXPENSE;
        }
        TransactionType resolved = TransactionType.fromCode(type);
        if (resolved != TransactionType.INCOME && resolved != TransactionType.EXPENSE) {
            throw new IllegalArgumentException("type must be income or expense");
        }
        return resolved;
    }

    private static void requireRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate must be provided");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }
    }

    private static int orDefault(Integer value, int fallback, String name) {
        return value == null ? fallback : requirePositive(value, name);
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
