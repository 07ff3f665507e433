package com.codescan.core.provider;

import com.codescan.core.config.ModelProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@link AnalysisAdapter} for a configured provider profile.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModelProfile profile = config.model("default").orElseThrow();
 * AnalysisAdapter adapter = AnalysisAdapterFactory.create(profile);
 * String completion = adapter.analyze(prompt);
 * }</pre>
 */
public final class AnalysisAdapterFactory {

    private static final Logger log = LoggerFactory.getLogger(AnalysisAdapterFactory.class);

    private AnalysisAdapterFactory() {
    }

    /**
     * Creates an adapter for a profile.
     *
     * @param profile provider profile
     * @return adapter speaking the profile's protocol
     * @throws IllegalArgumentException if the provider is not supported
     */
    public static AnalysisAdapter create(ModelProfile profile) {
        ProviderKind kind = ProviderKind.fromName(profile.provider());
        log.debug("Creating {} adapter for model '{}'", kind, profile.model());
        return switch (kind) {
            case OPENAI, DEEPSEEK -> new OpenAiCompatibleAdapter(profile, kind);
            case ANTHROPIC -> new AnthropicAdapter(profile);
            case CUSTOM -> new GenericHttpAdapter(profile);
        };
    }
}
