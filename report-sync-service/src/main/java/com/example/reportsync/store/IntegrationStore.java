package com.example.reportsync.store;

import com.example.reportsync.entity.Integration;

import java.util.List;
import java.util.Optional;

/**
 * Integration persistence as seen by the sync engine.
 */
public interface IntegrationStore {

    Optional<Integration> findById(String integrationId);

    List<Integration> findByProject(String projectId);

    Integration create(Integration integration);

    /**
     * Replace the JSON config of an integration.
     */
    void updateConfig(String integrationId, String configJson);

    void updateLastUsed(String integrationId);
}
