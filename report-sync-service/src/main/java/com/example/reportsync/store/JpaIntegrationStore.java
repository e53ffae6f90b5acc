package com.example.reportsync.store;

import com.example.reportsync.entity.Integration;
import com.example.reportsync.exception.IntegrationNotFoundException;
import com.example.reportsync.repository.IntegrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * JPA backed integration store.
 *
 * Transactions are short and never wrap a remote call; callers talk to the
 * tracker first and write the outcome afterwards.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaIntegrationStore implements IntegrationStore {

    private final IntegrationRepository integrationRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Integration> findById(String integrationId) {
        return integrationRepository.findById(integrationId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Integration> findByProject(String projectId) {
        return integrationRepository.findByProjectIdOrderByCreatedAtAsc(projectId);
    }

    @Override
    @Transactional
    public Integration create(Integration integration) {
        Integration saved = integrationRepository.save(integration);
        log.info("Created integration id={} projectId={} type={}", saved.getId(), saved.getProjectId(), saved.getType());
        return saved;
    }

    @Override
    @Transactional
    public void updateConfig(String integrationId, String configJson) {
        Integration integration = integrationRepository.findById(integrationId)
                .orElseThrow(() -> new IntegrationNotFoundException(integrationId));
        integration.setConfig(configJson);
        integrationRepository.save(integration);
        log.debug("Updated config of integration id={}", integrationId);
    }

    @Override
    @Transactional
    public void updateLastUsed(String integrationId) {
        int updated = integrationRepository.markUsed(integrationId, clock.instant());
        if (updated == 0) {
            log.warn("Integration id={} vanished before its usage could be recorded", integrationId);
        }
    }
}
