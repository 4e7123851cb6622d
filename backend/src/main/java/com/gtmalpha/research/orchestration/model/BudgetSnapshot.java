package com.gtmalpha.research.orchestration.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BudgetSnapshot(
    String costClass,
    LocalDate day,
    BigDecimal dailyCap,
    BigDecimal committed,
    BigDecimal reserved,
    BigDecimal remaining
) {
    public double utilization() {
        if (dailyCap == null || dailyCap.signum() <= 0) {
            return dailyCap == null ? 0.0 : 1.0;
        }
        return committed.doubleValue() / dailyCap.doubleValue();
    }
}
