package com.example.reportsync.store;

import com.example.reportsync.entity.Integration;
import com.example.reportsync.entity.IntegrationType;
import com.example.reportsync.model.GithubIntegrationConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decodes the JSON config column into the variant class selected by the integration type.
 */
@Component
@RequiredArgsConstructor
public class IntegrationConfigMapper {

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the integration is not a GitHub integration
     * @throws IllegalStateException if the stored JSON cannot be read
     */
    public GithubIntegrationConfig readGithub(Integration integration) {
        if (integration.getType() != IntegrationType.GITHUB) {
            throw new IllegalArgumentException("Integration " + integration.getId() + " is of type " + integration.getType());
        }
        try {
            GithubIntegrationConfig config = objectMapper.readValue(integration.getConfig(), GithubIntegrationConfig.class);
            return config != null ? config : new GithubIntegrationConfig();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable config for integration " + integration.getId(), e);
        }
    }

    public String write(GithubIntegrationConfig config) {
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize integration config", e);
        }
    }
}
