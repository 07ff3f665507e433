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
 * Tests for {@link GenericHttpAdapter}.
 */
class GenericHttpAdapterTest {

    private final HttpClient httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    @Test
    void analyze_sendsPromptWithParamsAndHeaders() throws Exception {
        try (StubHttpServer server = StubHttpServer.start()) {
            // Given
            server.respond("/generate", 200, "{\"output\": \"[]\", \"result\": \"ignored\"}");
            ModelProfile profile = ModelProfile.custom(server.url("/generate"), "key-1",
                Map.of("X-Team", "security"), Map.of("temperature", 0));
            GenericHttpAdapter adapter = new GenericHttpAdapter(profile, httpClient);

            // When
            String completion = adapter.analyze("scan me");

            // Then
            assertThat(completion).isEqualTo("[]");
            StubHttpServer.RecordedRequest request = server.lastRequest();
            assertThat(request.headers())
                .containsEntry("x-team", "security")
                .containsEntry("authorization", "Bearer key-1");
            JsonNode body = new ObjectMapper().readTree(request.body());
            assertThat(body.get("prompt").asText()).isEqualTo("scan me");
            assertThat(body.get("temperature").asInt()).isZero();
        }
    }

    @Test
    void analyze_explicitAuthorizationHeader_isKept() throws Exception {
        try (StubHttpServer server = StubHttpServer.start()) {
            server.respond("/generate", 200, "{\"response\": \"ok\"}");
            ModelProfile profile = ModelProfile.custom(server.url("/generate"), "key-1",
                Map.of("authorization", "Token abc"), Map.of());

            new GenericHttpAdapter(profile, httpClient).analyze("p");

            assertThat(server.lastRequest().headers()).containsEntry("authorization", "Token abc");
        }
    }

    @Test
    void analyze_unknownPayloadShape_returnsWholeJson() throws Exception {
        try (StubHttpServer server = StubHttpServer.start()) {
            server.respond("/generate", 200, "{\"findings\": [1, 2]}");
            GenericHttpAdapter adapter = new GenericHttpAdapter(
                ModelProfile.custom(server.url("/generate"), null, null, null), httpClient);

            assertThat(adapter.analyze("p")).isEqualTo("{\"findings\":[1,2]}");
            assertThat(server.lastRequest().headers()).doesNotContainKey("authorization");
        }
    }

    @Test
    void analyze_structuredResultField_isRenderedAsJson() throws Exception {
        try (StubHttpServer server = StubHttpServer.start()) {
            server.respond("/generate", 200, "{\"result\": [{\"severity\": \"high\"}]}");
            GenericHttpAdapter adapter = new GenericHttpAdapter(
                ModelProfile.custom(server.url("/generate"), null, null, null), httpClient);

            assertThat(adapter.analyze("p")).isEqualTo("[{\"severity\":\"high\"}]");
        }
    }

    @Test
    void analyze_missingUrl_failsWithOther() {
        GenericHttpAdapter adapter = new GenericHttpAdapter(ModelProfile.custom(" ", null, null, null), httpClient);

        assertThatThrownBy(() -> adapter.analyze("p"))
            .isInstanceOfSatisfying(ProviderException.class,
                e -> assertThat(e.kind()).isEqualTo(ProviderException.Kind.OTHER));
    }
}
