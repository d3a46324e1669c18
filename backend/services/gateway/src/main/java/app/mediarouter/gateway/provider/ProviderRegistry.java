package app.mediarouter.gateway.provider;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class ProviderRegistry {

    public static final String DEFAULT_PROVIDER = "openai";

    private static final List<String> DISPLAY_ORDER = List.of("openai", "runway", "kling");

    private static final Map<String, String> MODEL_PROVIDERS = Map.of(
            "sora-2", "openai",
            "sora-1", "openai",
            "runway-gen3", "runway",
            "runway-gen4", "runway",
            "kling-1.5", "kling",
            "kling-1.0", "kling"
    );

    private final Map<String, VideoProviderAdapter> adapters;

    public ProviderRegistry(List<VideoProviderAdapter> adapters) {
        List<VideoProviderAdapter> sorted = new ArrayList<>(adapters);
        sorted.sort(Comparator.comparingInt(adapter -> displayRank(adapter.name())));
        Map<String, VideoProviderAdapter> byName = new LinkedHashMap<>();
        for (VideoProviderAdapter adapter : sorted) {
            byName.putIfAbsent(normalizeProvider(adapter.name()), adapter);
        }
        this.adapters = byName;
    }

    /**
     * Provider owning the model; unrecognized models fall back to {@link #DEFAULT_PROVIDER}.
     */
    public static String providerForModel(String model) {
        if (model == null) {
            return DEFAULT_PROVIDER;
        }
        return MODEL_PROVIDERS.getOrDefault(model, DEFAULT_PROVIDER);
    }

    public Optional<VideoProviderAdapter> find(String provider) {
        return Optional.ofNullable(adapters.get(normalizeProvider(provider)));
    }

    public VideoProviderAdapter require(String provider) {
        return find(provider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + provider));
    }

    public List<VideoProviderAdapter> adapters() {
        return List.copyOf(adapters.values());
    }

    public static String normalizeProvider(String provider) {
        if (provider == null) {
            return "";
        }
        return provider.trim().toLowerCase(Locale.ROOT);
    }

    private static int displayRank(String provider) {
        int index = DISPLAY_ORDER.indexOf(normalizeProvider(provider));
        return index < 0 ? DISPLAY_ORDER.size() : index;
    }
}
