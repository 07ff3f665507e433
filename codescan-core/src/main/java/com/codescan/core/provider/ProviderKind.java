package com.codescan.core.provider;

import java.util.Locale;

/**
 * Supported provider protocols.
 */
public enum ProviderKind {
    /** OpenAI chat completions. */
    OPENAI("https://api.openai.com/v1"),
    /** DeepSeek, OpenAI-compatible. */
    DEEPSEEK("https://api.deepseek.com"),
    /** Anthropic messages API. */
    ANTHROPIC("https://api.anthropic.com"),
    /** Arbitrary HTTP endpoint taking {@code {"prompt": ...}}. */
    CUSTOM(null);

    private final String defaultBaseUrl;

    ProviderKind(String defaultBaseUrl) {
        this.defaultBaseUrl = defaultBaseUrl;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    /**
     * Resolves a configured provider name.
     *
     * @param name provider name, any case
     * @return provider kind
     * @throws IllegalArgumentException if the name is not supported
     */
    public static ProviderKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported provider: " + name, e);
        }
    }
}
