package com.dubbi.screentrail.explore.engine;

/** 깊이 또는 시간 예산 초과. 세션은 Aborted가 된다. */
public class BudgetExceededException extends ExplorationException {
    public enum Limit {
        DEPTH,
        TIME
    }

    private final Limit limit;

    public BudgetExceededException(Limit limit, String message) {
        super(message);
        this.limit = limit;
    }

    public Limit getLimit() {
        return limit;
    }
}
