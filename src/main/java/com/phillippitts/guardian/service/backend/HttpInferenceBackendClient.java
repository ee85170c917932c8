package com.phillippitts.guardian.service.backend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.phillippitts.guardian.config.properties.InferenceBackendProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link InferenceBackendClient} for an Ollama-compatible HTTP API.
 */
public class HttpInferenceBackendClient implements InferenceBackendClient {

    private static final Logger LOG = LogManager.getLogger(HttpInferenceBackendClient.class);

    private final RestClient restClient;
    private final InferenceBackendProperties props;

    public HttpInferenceBackendClient(RestClient restClient, InferenceBackendProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public boolean isHealthy() {
        try {
            int status = restClient.get()
                    .uri(props.healthPath())
                    .exchange((request, response) -> response.getStatusCode().value());
            if (status / 100 != 2) {
                LOG.warn("Backend health check failed: status={}", status);
                return false;
            }
            return true;
        } catch (RestClientException e) {
            LOG.warn("Backend health check error: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean smokeTest(String model, String prompt) {
        Map<String, Object> request = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", Map.of("temperature", 0, "num_predict", 5));
        try {
            int status = restClient.post()
                    .uri(props.generatePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .exchange((req, response) -> response.getStatusCode().value());
            if (status / 100 != 2) {
                LOG.debug("Smoke test returned status={}", status);
                return false;
            }
            return true;
        } catch (RestClientException e) {
            LOG.debug("Smoke test error: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> runningModels() {
        try {
            ResponseEntity<PsResponse> response = restClient.get()
                    .uri(props.psPath())
                    .retrieve()
                    .toEntity(PsResponse.class);
            PsResponse body = response.getBody();
            if (body == null || body.models() == null) {
                return List.of();
            }
            return body.models().stream()
                    .map(RunningModel::name)
                    .filter(Objects::nonNull)
                    .toList();
        } catch (RestClientException e) {
            LOG.debug("Listing running models failed: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean unloadModel(String model) {
        try {
            int status = restClient.post()
                    .uri(props.generatePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", model, "keep_alive", 0))
                    .exchange((req, response) -> response.getStatusCode().value());
            return status / 100 == 2;
        } catch (RestClientException e) {
            LOG.debug("Unloading model {} failed: {}", model, e.getMessage());
            return false;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PsResponse(List<RunningModel> models) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RunningModel(String name) {
    }
}
