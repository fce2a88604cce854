package com.moneytrail.insights.controller.dto;

import com.moneytrail.insights.analytics.FilterCriteria;
import com.moneytrail.insights.model.LedgerSnapshot;
import jakarta.validation.constraints.NotNull;

/**
 * Body of every report call: the ledger to analyse and, for reports that honour them, the user's filters.
 */
public record ReportRequestDto(@NotNull LedgerSnapshot ledger, FilterCriteria filters) {

    public FilterCriteria filtersOrNone() {
        return filters != null ? filters : FilterCriteria.none();
    }
}
