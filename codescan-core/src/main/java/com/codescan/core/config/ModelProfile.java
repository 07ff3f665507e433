package com.codescan.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings for one analysis provider.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * models:
 *   default:
 *     provider: deepseek
 *     model: deepseek-chat
 *     api_key: sk-...
 *     base_url: https://api.deepseek.com
 *     max_tokens: 8192
 *   local:
 *     provider: custom
 *     api_url: http://localhost:8080/generate
 *     headers:
 *       X-Team: security
 *     params:
 *       temperature: 0
 * }</pre>
 *
 * @param provider provider name ({@code openai}, {@code deepseek}, {@code anthropic}, {@code custom})
 * @param model model identifier
 * @param apiKey API key, may be empty
 * @param baseUrl base URL for OpenAI-compatible and Anthropic providers, may be null
 * @param maxTokens completion token limit
 * @param timeoutSeconds request timeout, or null to use {@code scan.timeout_seconds}
 * @param extraBody extra top-level request fields for OpenAI-compatible providers
 * @param apiUrl endpoint of a custom provider
 * @param headers extra headers of a custom provider
 * @param params extra request fields of a custom provider
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ModelProfile(
    @JsonProperty("provider") String provider,
    @JsonProperty("model") String model,
    @JsonProperty("api_key") String apiKey,
    @JsonProperty("base_url") String baseUrl,
    @JsonProperty("max_tokens") Integer maxTokens,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds,
    @JsonProperty("extra_body") Map<String, Object> extraBody,
    @JsonProperty("api_url") String apiUrl,
    @JsonProperty("headers") Map<String, String> headers,
    @JsonProperty("params") Map<String, Object> params
) {
    public static final int DEFAULT_MAX_TOKENS = 8192;
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    public ModelProfile {
        if (provider == null || provider.isBlank()) {
            provider = "openai";
        }
        if (model == null) {
            model = "";
        }
        if (apiKey == null) {
            apiKey = "";
        }
        if (maxTokens == null || maxTokens <= 0) {
            maxTokens = DEFAULT_MAX_TOKENS;
        }
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            timeoutSeconds = null;
        }
        extraBody = copy(extraBody);
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        params = copy(params);
    }

    /**
     * Creates a profile for an OpenAI-compatible or Anthropic provider.
     *
     * @param provider provider name
     * @param model model identifier
     * @param apiKey API key
     * @param baseUrl base URL, or null for the provider default
     * @return profile with default limits
     */
    public static ModelProfile of(String provider, String model, String apiKey, String baseUrl) {
        return new ModelProfile(provider, model, apiKey, baseUrl, null, null, null, null, null, null);
    }

    /**
     * Creates a profile for a custom HTTP provider.
     *
     * @param apiUrl endpoint
     * @param apiKey API key, may be null
     * @param headers extra headers
     * @param params extra request fields
     * @return custom provider profile
     */
    public static ModelProfile custom(String apiUrl, String apiKey, Map<String, String> headers, Map<String, Object> params) {
        return new ModelProfile("custom", "", apiKey, null, null, null, null, apiUrl, headers, params);
    }

    /**
     * Returns a copy of this profile with another request timeout.
     *
     * @param seconds timeout in seconds
     * @return adjusted profile
     */
    public ModelProfile withTimeoutSeconds(int seconds) {
        return new ModelProfile(provider, model, apiKey, baseUrl, maxTokens, seconds, extraBody, apiUrl, headers, params);
    }

    /**
     * Fills in the request timeout when this profile does not set its own.
     *
     * @param seconds fallback timeout in seconds
     * @return this profile if it has a timeout, otherwise a copy using {@code seconds}
     */
    public ModelProfile withDefaultTimeout(int seconds) {
        return timeoutSeconds != null ? this : withTimeoutSeconds(seconds);
    }

    /**
     * Returns the request timeout, {@value #DEFAULT_TIMEOUT_SECONDS} seconds when unset.
     *
     * @return request timeout
     */
    public Duration requestTimeout() {
        return Duration.ofSeconds(timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Returns true if an API key is configured.
     *
     * @return true when the key is not blank
     */
    public boolean hasApiKey() {
        return !apiKey.isBlank();
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
