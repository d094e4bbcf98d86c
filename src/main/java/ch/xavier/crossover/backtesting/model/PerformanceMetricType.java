package ch.xavier.crossover.backtesting.model;

public enum PerformanceMetricType {
    SHARPE_RATIO,
    SORTINO_RATIO,
    CALMAR_RATIO,
    WIN_RATE,
    TOTAL_RETURN,
    PROFIT_FACTOR,
    MAXIMUM_DRAWDOWN;

    /**
     * Higher is better for every metric, so drawdown is negated.
     */
    public double extract(BacktestResult result) {
        return switch (this) {
            case SHARPE_RATIO -> result.getSharpeRatio();
            case SORTINO_RATIO -> result.getSortinoRatio();
            case CALMAR_RATIO -> result.getCalmarRatio();
            case WIN_RATE -> result.getWinRate();
            case TOTAL_RETURN -> result.getTotalReturn();
            case PROFIT_FACTOR -> result.getProfitFactor();
            case MAXIMUM_DRAWDOWN -> -result.getMaxDrawdownPct();
        };
    }
}
