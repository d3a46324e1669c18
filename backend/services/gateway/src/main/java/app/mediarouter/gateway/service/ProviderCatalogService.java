package app.mediarouter.gateway.service;

import app.mediarouter.gateway.controller.dto.CostEstimateRequest;
import app.mediarouter.gateway.controller.dto.ProviderInfoResponse;
import app.mediarouter.gateway.domain.entity.ProviderCredentialEntity;
import app.mediarouter.gateway.domain.type.CredentialStatus;
import app.mediarouter.gateway.pricing.CostEstimate;
import app.mediarouter.gateway.pricing.CostEstimator;
import app.mediarouter.gateway.pricing.ModelPricing;
import app.mediarouter.gateway.provider.ProviderRegistry;
import app.mediarouter.gateway.provider.VideoProviderAdapter;
import app.mediarouter.gateway.vault.CredentialVault;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class ProviderCatalogService {

    private static final Map<String, String> DISPLAY_NAMES = Map.of(
            "openai", "OpenAI",
            "runway", "Runway",
            "kling", "Kling"
    );
    private static final double DEFAULT_ESTIMATE_SECONDS = 5;

    private final ProviderRegistry providerRegistry;
    private final CredentialVault credentialVault;
    private final CostEstimator costEstimator;

    public ProviderCatalogService(ProviderRegistry providerRegistry,
                                  CredentialVault credentialVault,
                                  CostEstimator costEstimator) {
        this.providerRegistry = providerRegistry;
        this.credentialVault = credentialVault;
        this.costEstimator = costEstimator;
    }

    /**
     * Registered providers with their key state. An ACTIVE key wins over any other stored key.
     */
    public List<ProviderInfoResponse> listProviders() {
        Map<String, CredentialStatus> keyStatus = new HashMap<>();
        for (ProviderCredentialEntity credential : credentialVault.listKeys()) {
            keyStatus.merge(credential.getProvider(), credential.getStatus(),
                    (current, next) -> current == CredentialStatus.active ? current : next);
        }
        List<ProviderInfoResponse> providers = new ArrayList<>();
        for (VideoProviderAdapter adapter : providerRegistry.adapters()) {
            CredentialStatus status = keyStatus.get(adapter.name());
            providers.add(new ProviderInfoResponse(
                    adapter.name(),
                    DISPLAY_NAMES.getOrDefault(adapter.name(), adapter.name()),
                    adapter.models(),
                    adapter.supportedFeatures(),
                    status != null,
                    status
            ));
        }
        return providers;
    }

    public Map<String, Map<String, ModelPricing>> pricing() {
        return costEstimator.pricingTable();
    }

    public CostEstimate estimate(CostEstimateRequest request) {
        String provider = request.provider() == null || request.provider().isBlank()
                ? ProviderRegistry.providerForModel(request.model())
                : ProviderRegistry.normalizeProvider(request.provider());
        double duration = request.duration() == null ? DEFAULT_ESTIMATE_SECONDS : request.duration();
        return costEstimator.estimateCost(provider, request.model(), duration, request.aspectRatio());
    }
}
