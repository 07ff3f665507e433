package com.codescan.core.provider;

import com.codescan.core.config.ModelProfile;
import com.codescan.core.testing.StubHttpServer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OpenAiCompatibleAdapter}.
 */
class OpenAiCompatibleAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    @Test
    void analyze_sendsChatCompletionRequest() throws Exception {
        try (StubHttpServer server = StubHttpServer.start()) {
            // Given
            server.respond("/chat/completions", 200,
                "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"[{}]\"}}]}");
            ModelProfile profile = new ModelProfile("deepseek", "deepseek-chat", "sk-123", server.url("/"),
                1024, null, Map.of("stream", false), null, null, null);
            OpenAiCompatibleAdapter adapter = new OpenAiCompatibleAdapter(profile, ProviderKind.DEEPSEEK, httpClient);

            // When
            String completion = adapter.analyze("find bugs");

            // Then
            assertThat(completion).isEqualTo("[{}]");
            StubHttpServer.RecordedRequest request = server.lastRequest();
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.path()).isEqualTo("/chat/completions");
            assertThat(request.headers()).containsEntry("authorization", "Bearer sk-123");
            JsonNode body = MAPPER.readTree(request.body());
            assertThat(body.get("model").asText()).isEqualTo("deepseek-chat");
            assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("user");
            assertThat(body.get("messages").get(0).get("content").asText()).isEqualTo("find bugs");
            assertThat(body.get("temperature").asDouble()).isEqualTo(0.1);
            assertThat(body.get("max_tokens").asInt()).isEqualTo(1024);
            assertThat(body.get("stream").asBoolean(true)).isFalse();
        }
    }

    @Test
    void analyze_responseWithoutChoices_failsWithOther() throws Exception {
        try (StubHttpServer server = StubHttpServer.start()) {
            server.respond("/chat/completions", 200, "{\"choices\": []}");
            OpenAiCompatibleAdapter adapter = new OpenAiCompatibleAdapter(
                ModelProfile.of("openai", "gpt", "sk", server.url("")), ProviderKind.OPENAI, httpClient);

            assertThatThrownBy(() -> adapter.analyze("p"))
                .isInstanceOfSatisfying(ProviderException.class,
                    e -> assertThat(e.kind()).isEqualTo(ProviderException.Kind.OTHER));
        }
    }

    @Test
    void baseUrl_defaultsPerProvider() {
        assertThat(new OpenAiCompatibleAdapter(ModelProfile.of("openai", "gpt", "k", null), ProviderKind.OPENAI)
            .baseUrl()).isEqualTo("https://api.openai.com/v1");
        assertThat(new OpenAiCompatibleAdapter(ModelProfile.of("deepseek", "chat", "k", " "), ProviderKind.DEEPSEEK)
            .baseUrl()).isEqualTo("https://api.deepseek.com");
    }
}
