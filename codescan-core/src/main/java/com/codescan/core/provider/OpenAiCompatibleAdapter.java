package com.codescan.core.provider;

import com.codescan.core.config.ModelProfile;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for the OpenAI chat completions protocol, also spoken by DeepSeek.
 *
 * <p>Request body:
 * <pre>{@code
 * {"model": "...", "messages": [{"role": "user", "content": "<prompt>"}],
 *  "temperature": 0.1, "max_tokens": 8192, ...extra_body}
 * }</pre>
 * The completion is read from {@code choices[0].message.content}.
 */
public class OpenAiCompatibleAdapter extends HttpAnalysisAdapter {

    static final double TEMPERATURE = 0.1;

    private final ModelProfile profile;
    private final String baseUrl;

    public OpenAiCompatibleAdapter(ModelProfile profile, ProviderKind kind) {
        super(displayName(kind), profile.requestTimeout());
        this.profile = profile;
        this.baseUrl = resolveBaseUrl(profile, kind);
    }

    OpenAiCompatibleAdapter(ModelProfile profile, ProviderKind kind, HttpClient httpClient) {
        super(displayName(kind), profile.requestTimeout(), httpClient);
        this.profile = profile;
        this.baseUrl = resolveBaseUrl(profile, kind);
    }

    @Override
    protected void checkReady() throws ProviderException {
        if (!profile.hasApiKey()) {
            throw new ProviderException(ProviderException.Kind.AUTH, displayName() + " API key is not configured");
        }
    }

    @Override
    protected URI endpoint() throws ProviderException {
        return join(baseUrl, "/chat/completions");
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("Authorization", "Bearer " + profile.apiKey());
    }

    @Override
    protected Object requestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", profile.model());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("temperature", TEMPERATURE);
        body.put("max_tokens", profile.maxTokens());
        body.putAll(profile.extraBody());
        return body;
    }

    @Override
    protected String extractText(JsonNode root) throws ProviderException {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ProviderException(ProviderException.Kind.OTHER,
                displayName() + " response has no choices[0].message.content");
        }
        return content.asText();
    }

    String baseUrl() {
        return baseUrl;
    }

    private static String resolveBaseUrl(ModelProfile profile, ProviderKind kind) {
        if (profile.baseUrl() != null && !profile.baseUrl().isBlank()) {
            return profile.baseUrl();
        }
        return kind.defaultBaseUrl();
    }

    private static String displayName(ProviderKind kind) {
        return kind == ProviderKind.DEEPSEEK ? "DeepSeek" : "OpenAI";
    }
}
