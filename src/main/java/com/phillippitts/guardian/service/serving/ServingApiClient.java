package com.phillippitts.guardian.service.serving;

import java.util.List;

/**
 * Port to the serving system protected by the guardian.
 *
 * <p>Every action is idempotent on the remote side and verified by response status only.
 * Implementations never throw: transport failures, timeouts and non-2xx responses are logged
 * and reported as {@code false}. Callers decide whether a failure matters.
 */
public interface ServingApiClient {

    /** Ask the serving system to refuse new requests. */
    boolean stopIntake();

    /** Clear the refuse-new-requests flag. */
    boolean resumeIntake();

    boolean switchModel(String model);

    boolean setContextWindow(int contextWindow);

    boolean setRagTopK(int topK);

    boolean disableTools(List<String> tools);

    boolean enableAllTools();
}
