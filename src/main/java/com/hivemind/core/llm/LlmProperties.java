package com.hivemind.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for one-shot planner calls made through {@link LlmService}.
 */
@Component
@ConfigurationProperties(prefix = "hivemind.llm")
public class LlmProperties {

    private String plannerModel = "";
    private String plannerSystemPrompt = "";

    public String getPlannerModel() {
        return plannerModel;
    }

    public void setPlannerModel(String plannerModel) {
        this.plannerModel = plannerModel;
    }

    public String getPlannerSystemPrompt() {
        return plannerSystemPrompt;
    }

    public void setPlannerSystemPrompt(String plannerSystemPrompt) {
        this.plannerSystemPrompt = plannerSystemPrompt;
    }

    public boolean hasPlannerModel() {
        return plannerModel != null && !plannerModel.isBlank();
    }

    public boolean hasPlannerSystemPrompt() {
        return plannerSystemPrompt != null && !plannerSystemPrompt.isBlank();
    }
}
