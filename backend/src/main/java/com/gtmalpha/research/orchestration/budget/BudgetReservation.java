package com.gtmalpha.research.orchestration.budget;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;

public final class BudgetReservation {
    private final BudgetLedger ledger;
    private final String costClass;
    private final BigDecimal amount;
    private final LocalDate day;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    BudgetReservation(BudgetLedger ledger, String costClass, BigDecimal amount, LocalDate day) {
        this.ledger = ledger;
        this.costClass = costClass;
        this.amount = amount;
        this.day = day;
    }

    /**
     * Charges {@code actualCost}, capped at the reserved amount, and returns what was charged.
     * Returns zero when the reservation was already settled.
     */
    public BigDecimal commit(BigDecimal actualCost) {
        if (!settled.compareAndSet(false, true)) {
            return BigDecimal.ZERO;
        }
        BigDecimal charged = actualCost == null || actualCost.signum() < 0 ? BigDecimal.ZERO : actualCost.min(amount);
        ledger.settle(costClass, day, amount, charged);
        return charged;
    }

    public void release() {
        if (settled.compareAndSet(false, true)) {
            ledger.settle(costClass, day, amount, null);
        }
    }

    public boolean isSettled() {
        return settled.get();
    }

    public String costClass() {
        return costClass;
    }

    public BigDecimal amount() {
        return amount;
    }
}
