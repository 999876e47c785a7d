package org.rescueswarm.engine.domain.service;

import java.util.function.LongSupplier;

/**
 * Wall-clock ceiling for one planning pass.
 */
public final class PlanningDeadline {

    private static final PlanningDeadline NONE = new PlanningDeadline(Long.MAX_VALUE, System::nanoTime);

    private final long deadlineNanos;
    private final LongSupplier nanoClock;

    private PlanningDeadline(long deadlineNanos, LongSupplier nanoClock) {
        this.deadlineNanos = deadlineNanos;
        this.nanoClock = nanoClock;
    }

    /**
     * Deadline {@code budgetMillis} from now. Non-positive budgets mean no deadline.
     */
    public static PlanningDeadline afterMillis(long budgetMillis) {
        return afterMillis(budgetMillis, System::nanoTime);
    }

    static PlanningDeadline afterMillis(long budgetMillis, LongSupplier nanoClock) {
        if (budgetMillis <= 0) {
            return NONE;
        }
        long start = nanoClock.getAsLong();
        return new PlanningDeadline(start + budgetMillis * 1_000_000L, nanoClock);
    }

    public static PlanningDeadline none() {
        return NONE;
    }

    public boolean isExpired() {
        if (deadlineNanos == Long.MAX_VALUE) {
            return false;
        }
        return nanoClock.getAsLong() - deadlineNanos >= 0;
    }
}
