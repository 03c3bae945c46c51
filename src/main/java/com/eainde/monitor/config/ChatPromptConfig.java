package com.eainde.monitor.config;

/**
 * Model settings applied to every chat request.
 */
public interface ChatPromptConfig {
    String getModelName();
    Double getTemperature();
    Double getTopP();
    Integer getMaxOutputTokens();
}
