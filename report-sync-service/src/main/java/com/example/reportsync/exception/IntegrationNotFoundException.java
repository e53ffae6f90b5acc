package com.example.reportsync.exception;

/**
 * Thrown when an integration id does not resolve.
 * Maps to 404 INTEGRATION_NOT_FOUND
 */
public class IntegrationNotFoundException extends RuntimeException {

    private final String integrationId;

    public IntegrationNotFoundException(String integrationId) {
        super("Integration not found: " + integrationId);
        this.integrationId = integrationId;
    }

    public String getIntegrationId() {
        return integrationId;
    }
}
