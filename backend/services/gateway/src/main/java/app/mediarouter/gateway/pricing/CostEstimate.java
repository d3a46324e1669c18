package app.mediarouter.gateway.pricing;

import java.math.BigDecimal;

public record CostEstimate(
        BigDecimal estimatedCost,
        BigDecimal perSecondRate,
        double durationSeconds,
        String resolution,
        Breakdown breakdown
) {
    public record Breakdown(
            BigDecimal base,
            BigDecimal durationCost
    ) {
    }
}
