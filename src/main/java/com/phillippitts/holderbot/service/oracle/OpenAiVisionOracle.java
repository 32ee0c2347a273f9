package com.phillippitts.holderbot.service.oracle;

import com.phillippitts.holderbot.config.properties.OracleProperties;
import com.phillippitts.holderbot.exception.VisionOracleException;
import com.phillippitts.holderbot.exception.VisionOracleExceptionBuilder;
import com.phillippitts.holderbot.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Base64;
import java.util.Objects;

/**
 * {@link VisionOracle} backed by an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>The region is sent inline as a {@code data:image/png;base64} URL next to the
 * instruction. Without an API key the oracle reports itself unavailable and refuses calls.
 */
@Component
public class OpenAiVisionOracle implements VisionOracle {
    private static final Logger LOG = LogManager.getLogger(OpenAiVisionOracle.class);

    private final RestClient client;
    private final OracleProperties properties;

    public OpenAiVisionOracle(@Qualifier("oracleRestClient") RestClient client, OracleProperties properties) {
        this.client = Objects.requireNonNull(client);
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public boolean isAvailable() {
        return properties.hasApiKey();
    }

    @Override
    public String analyze(RegionImage image, String instruction) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(instruction, "instruction");
        if (!isAvailable()) {
            throw VisionOracleExceptionBuilder.create("Vision oracle has no API key configured")
                    .region(image.region())
                    .build();
        }

        long t0 = System.nanoTime();
        String body;
        try {
            body = client.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bearer " + properties.getApiKey())
                    .body(payload(image, instruction).toString())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw VisionOracleExceptionBuilder.create("Vision oracle returned error status")
                    .region(image.region())
                    .status(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("model", properties.getModel())
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw VisionOracleExceptionBuilder.create("Vision oracle unreachable")
                    .region(image.region())
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw VisionOracleExceptionBuilder.create("Vision oracle call failed")
                    .region(image.region())
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        }

        String content = extractContent(body, image.region());
        LOG.debug("Oracle answered region={} in {} ms ({} chars)",
                image.region(), TimeUtils.elapsedMillis(t0), content.length());
        return content;
    }

    JSONObject payload(RegionImage image, String instruction) {
        String dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(image.png());
        JSONArray content = new JSONArray()
                .put(new JSONObject().put("type", "text").put("text", instruction))
                .put(new JSONObject().put("type", "image_url")
                        .put("image_url", new JSONObject().put("url", dataUrl).put("detail", "high")));
        JSONArray messages = new JSONArray()
                .put(new JSONObject().put("role", "user").put("content", content));
        return new JSONObject()
                .put("model", properties.getModel())
                .put("max_tokens", properties.getMaxTokens())
                .put("temperature", properties.getTemperature())
                .put("messages", messages);
    }

    static String extractContent(String body, String region) {
        if (body == null || body.isBlank()) {
            throw VisionOracleExceptionBuilder.create("Vision oracle returned an empty body").region(region).build();
        }
        try {
            JSONArray choices = new JSONObject(body).getJSONArray("choices");
            if (choices.isEmpty()) {
                throw VisionOracleExceptionBuilder.create("Vision oracle returned no choices").region(region).build();
            }
            String text = choices.getJSONObject(0).getJSONObject("message").optString("content", "");
            if (text.isBlank()) {
                throw VisionOracleExceptionBuilder.create("Vision oracle returned an empty reply").region(region).build();
            }
            return text.trim();
        } catch (JSONException e) {
            throw new VisionOracleException("Malformed vision oracle response", region, -1, e);
        }
    }
}
