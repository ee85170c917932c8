package com.phillippitts.guardian.service.serving;

import com.phillippitts.guardian.exception.ServingApiException;
import com.phillippitts.guardian.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ServingApiClient} over HTTP using Spring's {@link RestClient}.
 *
 * <p>The client is expected to carry the base URL and fixed connect/read timeouts
 * (see {@code GuardianConfig}); a stalled serving system therefore delays a tick but never
 * blocks it indefinitely.
 */
public class HttpServingApiClient implements ServingApiClient {

    private static final Logger LOG = LogManager.getLogger(HttpServingApiClient.class);

    static final String STOP_INTAKE = "/api/guard/stop-intake";
    static final String RESUME_INTAKE = "/api/guard/resume-intake";
    static final String MODEL_SWITCH = "/api/brain/model/switch";
    static final String CONTEXT_SET = "/api/brain/context/set";
    static final String RAG_SET = "/api/brain/rag/set";
    static final String TOOLS_DISABLE = "/api/brain/tools/disable";
    static final String TOOLS_ENABLE_ALL = "/api/brain/tools/enable-all";

    private static final int BODY_PREVIEW_CHARS = 200;

    private final RestClient restClient;

    public HttpServingApiClient(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    public boolean stopIntake() {
        return post("stop-intake", STOP_INTAKE, Map.of());
    }

    @Override
    public boolean resumeIntake() {
        return post("resume-intake", RESUME_INTAKE, Map.of());
    }

    @Override
    public boolean switchModel(String model) {
        return post("switch-model", MODEL_SWITCH, Map.of("model", model));
    }

    @Override
    public boolean setContextWindow(int contextWindow) {
        return post("set-context-window", CONTEXT_SET, Map.of("context_window", contextWindow));
    }

    @Override
    public boolean setRagTopK(int topK) {
        return post("set-rag-top-k", RAG_SET, Map.of("top_k", topK));
    }

    @Override
    public boolean disableTools(List<String> tools) {
        return post("disable-tools", TOOLS_DISABLE, Map.of("tools", List.copyOf(tools)));
    }

    @Override
    public boolean enableAllTools() {
        return post("enable-all-tools", TOOLS_ENABLE_ALL, Map.of());
    }

    private boolean post(String action, String path, Object body) {
        try {
            exchange(action, path, body);
            LOG.debug("Serving action {} succeeded", action);
            return true;
        } catch (ServingApiException e) {
            LOG.warn("Serving action failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Performs the POST and throws on anything other than a 2xx response.
     */
    private void exchange(String action, String path, Object body) {
        try {
            restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .exchange((request, response) -> {
                        HttpStatusCode status = response.getStatusCode();
                        if (!status.is2xxSuccessful()) {
                            String preview = LogSanitizer.truncate(
                                    new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8),
                                    BODY_PREVIEW_CHARS);
                            throw new ServingApiException(action,
                                    "Unexpected status " + status.value() + " body='" + preview + "'");
                        }
                        return status;
                    });
        } catch (ServingApiException e) {
            throw e;
        } catch (RestClientException e) {
            throw new ServingApiException(action, "Transport error: " + e.getMessage(), e);
        }
    }
}
