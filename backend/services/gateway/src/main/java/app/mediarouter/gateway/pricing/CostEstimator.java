package app.mediarouter.gateway.pricing;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * USD pricing per provider and model. Unknown pairs are priced at zero.
 */
@Component
public class CostEstimator {

    static final int SCALE = 4;
    static final String BASE_RESOLUTION = "1280x720";
    private static final double BASE_PIXELS = 1280.0 * 720.0;
    private static final double MIN_MULTIPLIER = 0.5;
    private static final double MAX_MULTIPLIER = 2.0;

    private static final Map<String, String> ASPECT_RATIO_RESOLUTIONS = Map.of(
            "16:9", "1280x720",
            "9:16", "720x1280",
            "1:1", "1024x1024"
    );

    private static final Map<String, Map<String, ModelPricing>> PRICING = buildPricing();

    public BigDecimal calculateCost(String provider, String model, double durationSeconds) {
        return calculateCost(provider, model, durationSeconds, null);
    }

    public BigDecimal calculateCost(String provider, String model, double durationSeconds, String resolution) {
        ModelPricing pricing = lookup(provider, model);
        if (pricing == null) {
            return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_EVEN);
        }
        BigDecimal total = pricing.baseCost().add(durationCost(pricing, durationSeconds));
        if (resolution != null && !resolution.isBlank()) {
            total = total.multiply(BigDecimal.valueOf(resolutionMultiplier(resolution)));
        }
        return total.setScale(SCALE, RoundingMode.HALF_EVEN);
    }

    public CostEstimate estimateCost(String provider, String model, double durationSeconds, String aspectRatio) {
        String resolution = resolutionForAspectRatio(aspectRatio);
        BigDecimal cost = calculateCost(provider, model, durationSeconds, resolution);
        ModelPricing pricing = lookup(provider, model);
        BigDecimal rate = pricing == null ? BigDecimal.ZERO : pricing.perSecond();
        BigDecimal base = pricing == null ? BigDecimal.ZERO : pricing.baseCost();
        BigDecimal durationCost = pricing == null
                ? BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_EVEN)
                : durationCost(pricing, durationSeconds).setScale(SCALE, RoundingMode.HALF_EVEN);
        return new CostEstimate(
                cost,
                rate,
                durationSeconds,
                resolution,
                new CostEstimate.Breakdown(base, durationCost)
        );
    }

    public Map<String, Map<String, ModelPricing>> pricingTable() {
        return PRICING;
    }

    /**
     * Pixel count relative to 1280x720, clamped to [0.5, 2.0]; unparsable values yield 1.0.
     */
    public static double resolutionMultiplier(String resolution) {
        if (resolution == null || resolution.isBlank()) {
            return 1.0;
        }
        String[] parts = resolution.split("x", -1);
        if (parts.length != 2) {
            return 1.0;
        }
        try {
            long width = Long.parseLong(parts[0].trim());
            long height = Long.parseLong(parts[1].trim());
            double multiplier = (width * height) / BASE_PIXELS;
            return Math.max(MIN_MULTIPLIER, Math.min(multiplier, MAX_MULTIPLIER));
        } catch (NumberFormatException ex) {
            return 1.0;
        }
    }

    public static String resolutionForAspectRatio(String aspectRatio) {
        if (aspectRatio == null) {
            return BASE_RESOLUTION;
        }
        return ASPECT_RATIO_RESOLUTIONS.getOrDefault(aspectRatio, BASE_RESOLUTION);
    }

    private BigDecimal durationCost(ModelPricing pricing, double durationSeconds) {
        double duration = Double.isFinite(durationSeconds) ? Math.max(durationSeconds, 0.0) : 0.0;
        return pricing.perSecond().multiply(BigDecimal.valueOf(duration));
    }

    private ModelPricing lookup(String provider, String model) {
        if (provider == null || model == null) {
            return null;
        }
        Map<String, ModelPricing> models = PRICING.get(provider);
        return models == null ? null : models.get(model);
    }

    private static Map<String, Map<String, ModelPricing>> buildPricing() {
        Map<String, ModelPricing> openai = new LinkedHashMap<>();
        openai.put("sora-2", perSecond("0.10"));
        openai.put("sora-1", perSecond("0.10"));

        // runway and kling bill in credits; rates are approximate USD
        Map<String, ModelPricing> runway = new LinkedHashMap<>();
        runway.put("runway-gen3", perSecond("0.05"));
        runway.put("runway-gen4", perSecond("0.075"));

        Map<String, ModelPricing> kling = new LinkedHashMap<>();
        kling.put("kling-1.5", perSecond("0.04"));
        kling.put("kling-1.0", perSecond("0.03"));

        Map<String, Map<String, ModelPricing>> pricing = new LinkedHashMap<>();
        pricing.put("openai", Collections.unmodifiableMap(openai));
        pricing.put("runway", Collections.unmodifiableMap(runway));
        pricing.put("kling", Collections.unmodifiableMap(kling));
        return Collections.unmodifiableMap(pricing);
    }

    private static ModelPricing perSecond(String rate) {
        return new ModelPricing(new BigDecimal(rate), BigDecimal.ZERO);
    }
}
