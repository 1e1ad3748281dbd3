package com.phillippitts.whisperwriter.service.transcription.api;

import com.phillippitts.whisperwriter.domain.AudioBuffer;
import com.phillippitts.whisperwriter.exception.BackendInvocationException;
import com.phillippitts.whisperwriter.service.transcription.DecodingOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ApiWhisperBackendTest {

    private static final String URL = "https://api.example.test/v1/audio/transcriptions";

    private RestClient.Builder builder;
    private MockRestServiceServer server;
    private final AudioBuffer buffer = new AudioBuffer(new short[1600], 16000);

    @BeforeEach
    void setUp() {
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
    }

    @Test
    void postsMultipartFormWithBearerTokenAndParsesText() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andExpect(content().string(allOf(
                        containsString("name=\"file\"; filename=\"audio.wav\""),
                        containsString("audio/wav"),
                        containsString("RIFF"),
                        containsString("whisper-1"),
                        containsString("name=\"language\""),
                        containsString("name=\"prompt\""),
                        containsString("0.20"))))
                .andRespond(withSuccess("{\"text\":\"Hello from the API.\"}", MediaType.APPLICATION_JSON));
        ApiWhisperBackend backend = ApiWhisperBackend.create(builder, "https://api.example.test/v1/", "sk-test",
                "whisper-1");

        String text = backend.transcribe(buffer, new DecodingOptions("en", "Names: Zoë", 0.2));

        assertThat(text).isEqualTo("Hello from the API.");
        assertThat(backend.name()).isEqualTo("api");
        server.verify();
    }

    @Test
    void omitsAuthorizationLanguageAndPromptWhenUnset() {
        server.expect(requestTo(URL))
                .andExpect(headerDoesNotExist("Authorization"))
                .andExpect(content().string(allOf(
                        not(containsString("name=\"language\"")),
                        not(containsString("name=\"prompt\"")))))
                .andRespond(withSuccess("{\"text\":\"\"}", MediaType.APPLICATION_JSON));
        ApiWhisperBackend backend = ApiWhisperBackend.create(builder, "https://api.example.test/v1", null, "whisper-1");

        assertThat(backend.transcribe(buffer, DecodingOptions.defaults())).isEmpty();
        server.verify();
    }

    @Test
    void httpErrorBecomesBackendInvocationExceptionWithStatus() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"Incorrect API key\"}}"));
        ApiWhisperBackend backend = ApiWhisperBackend.create(builder, "https://api.example.test/v1", "bad", "whisper-1");

        assertThatThrownBy(() -> backend.transcribe(buffer, DecodingOptions.defaults()))
                .isInstanceOf(BackendInvocationException.class)
                .hasMessageContaining("exitCode=401")
                .hasMessageContaining("Incorrect API key")
                .hasMessageContaining("(backend: api)");
    }

    @Test
    void serverErrorBecomesBackendInvocationException() {
        server.expect(requestTo(URL)).andRespond(withServerError());
        ApiWhisperBackend backend = ApiWhisperBackend.create(builder, "https://api.example.test/v1", "k", "whisper-1");

        assertThatThrownBy(() -> backend.transcribe(buffer, DecodingOptions.defaults()))
                .isInstanceOf(BackendInvocationException.class)
                .hasMessageContaining("exitCode=500");
    }

    @Test
    void malformedOrIncompleteBodiesAreRejected() {
        assertThatThrownBy(() -> ApiWhisperBackend.parseText("not json"))
                .isInstanceOf(BackendInvocationException.class)
                .hasMessageContaining("malformed");
        assertThatThrownBy(() -> ApiWhisperBackend.parseText("{\"duration\":1.0}"))
                .isInstanceOf(BackendInvocationException.class)
                .hasMessageContaining("no 'text'");
        assertThatThrownBy(() -> ApiWhisperBackend.parseText(""))
                .isInstanceOf(BackendInvocationException.class);
    }

    @Test
    void parsesUnicodeText() {
        assertThat(ApiWhisperBackend.parseText("{\"text\":\"Gr\\u00fc\\u00dfe\"}")).isEqualTo("Grüße");
    }
}
