package app.mediarouter.gateway.pricing;

import java.math.BigDecimal;

public record ModelPricing(
        BigDecimal perSecond,
        BigDecimal baseCost
) {
}
