package com.example.reportsync.support;

import com.example.reportsync.entity.Integration;
import com.example.reportsync.store.IntegrationStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemoryIntegrationStore implements IntegrationStore {

    private final Map<String, Integration> integrations = new LinkedHashMap<>();

    @Override
    public Optional<Integration> findById(String integrationId) {
        return Optional.ofNullable(integrations.get(integrationId));
    }

    @Override
    public List<Integration> findByProject(String projectId) {
        return integrations.values().stream()
                .filter(i -> projectId.equals(i.getProjectId()))
                .collect(Collectors.toList());
    }

    @Override
    public Integration create(Integration integration) {
        integrations.put(integration.getId(), integration);
        return integration;
    }

    @Override
    public void updateConfig(String integrationId, String configJson) {
        integrations.get(integrationId).setConfig(configJson);
    }

    @Override
    public void updateLastUsed(String integrationId) {
        integrations.get(integrationId).markUsed(Instant.now());
    }
}
