package com.bko.team.api;

import com.bko.team.completion.CompletionClient;
import com.bko.team.completion.CompletionConnectionException;
import com.bko.team.completion.ModelDescriptor;
import com.bko.team.config.AgentTeamProperties;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/models")
@RequiredArgsConstructor
public class ModelController {

    private final CompletionClient completionClient;
    private final AgentTeamProperties properties;

    @GetMapping
    public ModelListResponse getModels() {
        try {
            return new ModelListResponse(properties.getCompletion().getDefaultModel(), completionClient.listModels());
        } catch (CompletionConnectionException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex);
        }
    }

    @PostMapping("/pull")
    public PullModelResponse pull(@Valid @RequestBody PullModelRequest request) {
        boolean available = completionClient.pullModel(request.name());
        return new PullModelResponse(request.name(), available);
    }

    public record ModelListResponse(String defaultModel, List<ModelDescriptor> models) {}
    public record PullModelResponse(String name, boolean available) {}
}
