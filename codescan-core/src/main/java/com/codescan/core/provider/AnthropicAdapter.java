package com.codescan.core.provider;

import com.codescan.core.config.ModelProfile;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for the Anthropic messages API.
 *
 * <p>The completion is the concatenation of all {@code text} blocks of {@code content}.
 */
public class AnthropicAdapter extends HttpAnalysisAdapter {

    static final String API_VERSION = "2023-06-01";

    private final ModelProfile profile;
    private final String baseUrl;

    public AnthropicAdapter(ModelProfile profile) {
        super("Anthropic", profile.requestTimeout());
        this.profile = profile;
        this.baseUrl = resolveBaseUrl(profile);
    }

    AnthropicAdapter(ModelProfile profile, HttpClient httpClient) {
        super("Anthropic", profile.requestTimeout(), httpClient);
        this.profile = profile;
        this.baseUrl = resolveBaseUrl(profile);
    }

    @Override
    protected void checkReady() throws ProviderException {
        if (!profile.hasApiKey()) {
            throw new ProviderException(ProviderException.Kind.AUTH, "Anthropic API key is not configured");
        }
    }

    @Override
    protected URI endpoint() throws ProviderException {
        return join(baseUrl, "/v1/messages");
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of(
            "x-api-key", profile.apiKey(),
            "anthropic-version", API_VERSION
        );
    }

    @Override
    protected Object requestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", profile.model());
        body.put("max_tokens", profile.maxTokens());
        body.put("temperature", OpenAiCompatibleAdapter.TEMPERATURE);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        return body;
    }

    @Override
    protected String extractText(JsonNode root) throws ProviderException {
        JsonNode content = root.path("content");
        if (!content.isArray() || content.isEmpty()) {
            throw new ProviderException(ProviderException.Kind.OTHER, "Anthropic response has no content array");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.toString();
    }

    private static String resolveBaseUrl(ModelProfile profile) {
        if (profile.baseUrl() != null && !profile.baseUrl().isBlank()) {
            return profile.baseUrl();
        }
        return ProviderKind.ANTHROPIC.defaultBaseUrl();
    }
}
