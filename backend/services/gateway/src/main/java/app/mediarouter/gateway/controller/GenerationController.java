package app.mediarouter.gateway.controller;

import app.mediarouter.gateway.controller.dto.CreateGenerationRequest;
import app.mediarouter.gateway.controller.dto.GenerationResponse;
import app.mediarouter.gateway.service.VideoGenerationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/video/generations")
public class GenerationController {

    private final VideoGenerationService generationService;

    public GenerationController(VideoGenerationService generationService) {
        this.generationService = generationService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public GenerationResponse create(@Valid @RequestBody CreateGenerationRequest request) {
        return generationService.create(request);
    }

    @GetMapping
    public List<GenerationResponse> list(@RequestParam(required = false) String provider,
                                         @RequestParam(required = false) String status,
                                         @RequestParam(defaultValue = "0") int skip,
                                         @RequestParam(defaultValue = "50") int limit) {
        return generationService.list(provider, status, skip, limit);
    }

    @GetMapping("/{id}")
    public GenerationResponse get(@PathVariable String id) {
        return generationService.get(id);
    }

    @PostMapping("/{id}/cancel")
    public GenerationResponse cancel(@PathVariable String id) {
        return generationService.cancel(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        generationService.delete(id);
    }
}
