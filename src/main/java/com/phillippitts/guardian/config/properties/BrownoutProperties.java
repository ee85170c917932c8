package com.phillippitts.guardian.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for staged degradation (prefix {@code guardian.brownout}).
 */
@ConfigurationProperties(prefix = "guardian.brownout")
@Validated
public class BrownoutProperties {

    @NotBlank(message = "Primary model must not be blank")
    private String modelPrimary = "gpt-oss:20b";

    @NotBlank(message = "Fallback model must not be blank")
    private String modelFallback = "gpt-oss:7b";

    @Positive
    private int contextWindowNormal = 8;

    @Positive
    private int contextWindowReduced = 3;

    @Positive
    private int ragTopKNormal = 8;

    @Positive
    private int ragTopKReduced = 3;

    /** Tools disabled from MODERATE upwards. */
    @NotNull
    private List<String> moderateTools = new ArrayList<>(List.of(
            "code_interpreter", "file_search", "web_search"));

    /** Additional tools disabled at HEAVY. */
    @NotNull
    private List<String> heavyTools = new ArrayList<>(List.of(
            "code_interpreter", "file_search", "web_search", "calendar", "email"));

    /**
     * Tool list sent at HEAVY: the moderate list followed by every configured heavy tool not
     * already in it. Always a superset of {@link #getModerateTools()}, whatever is configured.
     */
    public List<String> heavyDisabledTools() {
        Set<String> union = new LinkedHashSet<>(moderateTools);
        union.addAll(heavyTools);
        return List.copyOf(union);
    }

    public String getModelPrimary() {
        return modelPrimary;
    }

    public void setModelPrimary(String modelPrimary) {
        this.modelPrimary = modelPrimary;
    }

    public String getModelFallback() {
        return modelFallback;
    }

    public void setModelFallback(String modelFallback) {
        this.modelFallback = modelFallback;
    }

    public int getContextWindowNormal() {
        return contextWindowNormal;
    }

    public void setContextWindowNormal(int contextWindowNormal) {
        this.contextWindowNormal = contextWindowNormal;
    }

    public int getContextWindowReduced() {
        return contextWindowReduced;
    }

    public void setContextWindowReduced(int contextWindowReduced) {
        this.contextWindowReduced = contextWindowReduced;
    }

    public int getRagTopKNormal() {
        return ragTopKNormal;
    }

    public void setRagTopKNormal(int ragTopKNormal) {
        this.ragTopKNormal = ragTopKNormal;
    }

    public int getRagTopKReduced() {
        return ragTopKReduced;
    }

    public void setRagTopKReduced(int ragTopKReduced) {
        this.ragTopKReduced = ragTopKReduced;
    }

    public List<String> getModerateTools() {
        return moderateTools;
    }

    public void setModerateTools(List<String> moderateTools) {
        this.moderateTools = moderateTools;
    }

    public List<String> getHeavyTools() {
        return heavyTools;
    }

    public void setHeavyTools(List<String> heavyTools) {
        this.heavyTools = heavyTools;
    }
}
