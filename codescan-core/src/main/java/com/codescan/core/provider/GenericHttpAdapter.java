package com.codescan.core.provider;

import com.codescan.core.config.ModelProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for a self-hosted endpoint that accepts {@code {"prompt": ..., ...params}}.
 *
 * <p>The completion is the first present field of {@code response}, {@code output} and
 * {@code result}; when none is present the whole payload is returned as JSON text.
 * A bearer {@code Authorization} header is added when an API key is configured and the
 * profile does not set that header itself.
 */
public class GenericHttpAdapter extends HttpAnalysisAdapter {

    private static final List<String> RESULT_FIELDS = List.of("response", "output", "result");

    private final ModelProfile profile;

    public GenericHttpAdapter(ModelProfile profile) {
        super("Custom API", profile.requestTimeout());
        this.profile = profile;
    }

    GenericHttpAdapter(ModelProfile profile, HttpClient httpClient) {
        super("Custom API", profile.requestTimeout(), httpClient);
        this.profile = profile;
    }

    @Override
    protected void checkReady() throws ProviderException {
        if (profile.apiUrl() == null || profile.apiUrl().isBlank()) {
            throw new ProviderException(ProviderException.Kind.OTHER, "Custom API URL is not configured");
        }
    }

    @Override
    protected URI endpoint() throws ProviderException {
        try {
            return URI.create(profile.apiUrl());
        } catch (IllegalArgumentException e) {
            throw new ProviderException(ProviderException.Kind.OTHER, "Invalid custom API URL: " + profile.apiUrl(), e);
        }
    }

    @Override
    protected Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>(profile.headers());
        boolean hasAuthorization = headers.keySet().stream().anyMatch("Authorization"::equalsIgnoreCase);
        if (profile.hasApiKey() && !hasAuthorization) {
            headers.put("Authorization", "Bearer " + profile.apiKey());
        }
        headers.keySet().removeIf("Content-Type"::equalsIgnoreCase);
        return headers;
    }

    @Override
    protected Object requestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", prompt);
        body.putAll(profile.params());
        return body;
    }

    @Override
    protected String extractText(JsonNode root) throws ProviderException {
        for (String field : RESULT_FIELDS) {
            JsonNode value = root.get(field);
            if (value != null && !value.isNull()) {
                return value.isTextual() ? value.asText() : toJson(value);
            }
        }
        return root.isTextual() ? root.asText() : toJson(root);
    }

    private String toJson(JsonNode node) throws ProviderException {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.OTHER, "Custom API payload could not be rendered", e);
        }
    }
}
