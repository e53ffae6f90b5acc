package com.example.reportsync.store;

import java.util.Optional;

public interface SettingsProvider {

    /**
     * Externally reachable base URL of this deployment, without trailing slash.
     */
    Optional<String> getPublicBaseUrl();
}
