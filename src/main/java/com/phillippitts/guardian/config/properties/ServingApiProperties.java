package com.phillippitts.guardian.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Endpoint of the serving system that receives intake and brownout commands.
 *
 * <p>Example application.properties:
 * <pre>
 * guardian.serving.base-url=http://localhost:8000
 * guardian.serving.timeout=5s
 * </pre>
 *
 * @param baseUrl base URL of the serving API
 * @param timeout connect and read timeout applied to every call
 */
@ConfigurationProperties(prefix = "guardian.serving")
@Validated
public record ServingApiProperties(
        @NotBlank(message = "Serving base URL must not be blank")
        String baseUrl,

        @NotNull
        Duration timeout
) {
    public ServingApiProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8000";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(5);
        }
    }
}
