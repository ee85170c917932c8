package com.phillippitts.guardian.service.backend;

import java.util.List;

/**
 * Port to the protected inference backend.
 *
 * <p>Implementations never throw; failures are logged and reported through return values.
 */
public interface InferenceBackendClient {

    /**
     * Calls the backend's basic health endpoint.
     *
     * @return true only on a 2xx response
     */
    boolean isHealthy();

    /**
     * Issues a minimal, non-streaming generate request.
     *
     * @return true on a 2xx response
     */
    boolean smokeTest(String model, String prompt);

    /**
     * Lists models currently loaded by the backend.
     *
     * @return model names, empty if none or if the listing failed
     */
    List<String> runningModels();

    /**
     * Asks the backend to unload a model, ending its sessions.
     *
     * @return true on a 2xx response
     */
    boolean unloadModel(String model);
}
