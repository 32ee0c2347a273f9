package com.phillippitts.holderbot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Connection settings of the OpenAI-compatible vision oracle.
 *
 * <p>The API key is passed here explicitly; without one the oracle reports itself unavailable
 * and decisions proceed without the aggregator.
 */
@ConfigurationProperties(prefix = "holderbot.oracle")
public class OracleProperties {

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final long timeoutMs;

    @ConstructorBinding
    public OracleProperties(String baseUrl, String apiKey, String model, Integer maxTokens,
                            Double temperature, Long timeoutMs) {
        this.baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com/v1" : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model == null || model.isBlank() ? "gpt-4o" : model;
        this.maxTokens = maxTokens == null ? 150 : maxTokens;
        this.temperature = temperature == null ? 0.05 : temperature;
        this.timeoutMs = timeoutMs == null || timeoutMs <= 0 ? 30_000L : timeoutMs;
        if (this.maxTokens <= 0) {
            throw new IllegalArgumentException("holderbot.oracle.max-tokens must be > 0");
        }
        if (this.temperature < 0.0 || this.temperature > 2.0) {
            throw new IllegalArgumentException("holderbot.oracle.temperature must be in [0,2]");
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    public String getModel() {
        return model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public String toString() {
        // never print the key
        return "OracleProperties{baseUrl=" + baseUrl + ", model=" + model + ", apiKey="
                + (hasApiKey() ? "***" : "<none>") + "}";
    }
}
