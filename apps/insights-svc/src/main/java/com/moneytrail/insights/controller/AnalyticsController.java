package com.moneytrail.insights.controller;

import com.moneytrail.insights.controller.dto.ReportRequestDto;
import com.moneytrail.insights.model.Transaction;
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
import com.moneytrail.insights.service.ReportService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/analytics")
@Validated
public class AnalyticsController {

    private final ReportService reportService;

    public AnalyticsController(ReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping("/transactions/search")
    public ResponseEntity<List<Transaction>> search(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam(value = "limit", required = false) @Min(1) Integer limit
    ) {
        return ResponseEntity.ok(reportService.search(request.ledger(), request.filtersOrNone(), limit));
    }

    @PostMapping("/summary")
    public ResponseEntity<LedgerSummary> summary(@Valid @RequestBody ReportRequestDto request) {
        return ResponseEntity.ok(reportService.summary(request.ledger(), request.filtersOrNone()));
    }

    @PostMapping("/spending/{dimension}")
    public ResponseEntity<List<DimensionSpending>> spending(
            @PathVariable("dimension") String dimension,
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam(value = "type", required = false) String type
    ) {
        return ResponseEntity.ok(reportService.spending(request.ledger(), request.filtersOrNone(), dimension, type));
    }

    @PostMapping("/periods")
    public ResponseEntity<List<PeriodStat>> periods(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam("granularity") String granularity
    ) {
        return ResponseEntity.ok(reportService.periods(request.ledger(), request.filtersOrNone(), startDate, endDate, granularity));
    }

    @PostMapping("/monthly-trends")
    public ResponseEntity<List<PeriodStat>> monthlyTrends(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam(value = "months", required = false) @Min(1) Integer months
    ) {
        return ResponseEntity.ok(reportService.monthlyTrends(request.ledger(), request.filtersOrNone(), months));
    }

    @PostMapping("/cash-flow")
    public ResponseEntity<List<CashFlowPoint>> cashFlow(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam(value = "days", required = false) @Min(1) Integer days
    ) {
        return ResponseEntity.ok(reportService.cashFlow(request.ledger(), request.filtersOrNone(), days));
    }

    @PostMapping("/balance-trend")
    public ResponseEntity<List<BalancePoint>> balanceTrend(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam(value = "days", required = false) @Min(1) Integer days
    ) {
        return ResponseEntity.ok(reportService.balanceTrend(request.ledger(), days));
    }

    @PostMapping("/year-over-year")
    public ResponseEntity<YearOverYearComparison> yearOverYear(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        return ResponseEntity.ok(reportService.yearOverYear(request.ledger(), startDate, endDate));
    }

    @PostMapping("/category-trends")
    public ResponseEntity<List<CategoryTrend>> categoryTrends(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "granularity", required = false) String granularity,
            @RequestParam(value = "limit", required = false) @Min(1) Integer limit
    ) {
        return ResponseEntity.ok(reportService.categoryTrends(
                request.ledger(), request.filtersOrNone(), startDate, endDate, granularity, limit));
    }

    @PostMapping("/predictions")
    public ResponseEntity<List<SpendingPrediction>> predictions(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "months", required = false) @Min(1) Integer months
    ) {
        return ResponseEntity.ok(reportService.predictions(request.ledger(), startDate, endDate, months));
    }

    @PostMapping("/dashboard")
    public ResponseEntity<DashboardStatistics> dashboard(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        return ResponseEntity.ok(reportService.dashboard(request.ledger(), request.filtersOrNone(), startDate, endDate));
    }

    @PostMapping("/budgets")
    public ResponseEntity<List<BudgetProgress>> budgets(@Valid @RequestBody ReportRequestDto request) {
        return ResponseEntity.ok(reportService.budgets(request.ledger()));
    }

    @PostMapping("/planned-payments")
    public ResponseEntity<List<PlannedPaymentMonth>> plannedPayments(
            @Valid @RequestBody ReportRequestDto request,
            @RequestParam(value = "months", required = false) @Min(1) Integer months
    ) {
        return ResponseEntity.ok(reportService.plannedPayments(request.ledger(), months));
    }

    @PostMapping("/planned-payments/due")
    public ResponseEntity<List<DuePlannedTransaction>> duePlannedTransactions(@Valid @RequestBody ReportRequestDto request) {
        return ResponseEntity.ok(reportService.duePlannedTransactions(request.ledger()));
    }

    @PostMapping("/investments")
    public ResponseEntity<List<InvestmentHolding>> investments(@Valid @RequestBody ReportRequestDto request) {
        return ResponseEntity.ok(reportService.investments(request.ledger()));
    }
}
