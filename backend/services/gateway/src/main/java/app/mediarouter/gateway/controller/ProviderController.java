package app.mediarouter.gateway.controller;

import app.mediarouter.gateway.controller.dto.CostEstimateRequest;
import app.mediarouter.gateway.controller.dto.ProviderInfoResponse;
import app.mediarouter.gateway.pricing.CostEstimate;
import app.mediarouter.gateway.pricing.ModelPricing;
import app.mediarouter.gateway.service.ProviderCatalogService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class ProviderController {

    private final ProviderCatalogService catalogService;

    public ProviderController(ProviderCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping("/providers")
    public List<ProviderInfoResponse> providers() {
        return catalogService.listProviders();
    }

    @GetMapping("/pricing")
    public Map<String, Map<String, ModelPricing>> pricing() {
        return catalogService.pricing();
    }

    @PostMapping("/pricing/estimate")
    public CostEstimate estimate(@Valid @RequestBody CostEstimateRequest request) {
        return catalogService.estimate(request);
    }
}
