package app.mediarouter.gateway.controller;

import app.mediarouter.gateway.controller.dto.CreateProviderKeyRequest;
import app.mediarouter.gateway.controller.dto.KeyValidationResponse;
import app.mediarouter.gateway.controller.dto.ProviderKeyResponse;
import app.mediarouter.gateway.service.ProviderCredentialService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/keys")
public class ProviderKeyController {

    private final ProviderCredentialService credentialService;

    public ProviderKeyController(ProviderCredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProviderKeyResponse create(@Valid @RequestBody CreateProviderKeyRequest request) {
        return credentialService.addKey(request);
    }

    @GetMapping
    public List<ProviderKeyResponse> list() {
        return credentialService.listKeys();
    }

    @PostMapping("/{id}/validate")
    public KeyValidationResponse validate(@PathVariable UUID id) {
        return credentialService.validateKey(id);
    }

    @PostMapping("/{id}/revoke")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revoke(@PathVariable UUID id) {
        credentialService.revokeKey(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id) {
        credentialService.deleteKey(id);
    }
}
