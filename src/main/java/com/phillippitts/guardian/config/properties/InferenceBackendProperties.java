package com.phillippitts.guardian.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Endpoint of the protected inference backend, used by the health gate.
 *
 * @param baseUrl base URL of the backend
 * @param healthPath path of the basic health endpoint
 * @param generatePath path of the generate endpoint used for the smoke test and model unloads
 * @param psPath path listing models currently loaded by the backend
 * @param timeout connect and read timeout for health gate calls
 */
@ConfigurationProperties(prefix = "guardian.backend")
@Validated
public record InferenceBackendProperties(
        @NotBlank String baseUrl,
        @NotBlank String healthPath,
        @NotBlank String generatePath,
        @NotBlank String psPath,
        @NotNull Duration timeout
) {
    public InferenceBackendProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:11434";
        }
        if (healthPath == null || healthPath.isBlank()) {
            healthPath = "/api/health";
        }
        if (generatePath == null || generatePath.isBlank()) {
            generatePath = "/api/generate";
        }
        if (psPath == null || psPath.isBlank()) {
            psPath = "/api/ps";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(10);
        }
    }
}
