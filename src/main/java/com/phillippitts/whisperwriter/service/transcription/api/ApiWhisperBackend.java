package com.phillippitts.whisperwriter.service.transcription.api;

import com.phillippitts.whisperwriter.domain.AudioBuffer;
import com.phillippitts.whisperwriter.exception.BackendInvocationExceptionBuilder;
import com.phillippitts.whisperwriter.service.audio.WavWriter;
import com.phillippitts.whisperwriter.service.transcription.DecodingOptions;
import com.phillippitts.whisperwriter.service.transcription.TranscriptionBackend;
import com.phillippitts.whisperwriter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Locale;
import java.util.Objects;

/**
 * Transcribes through an OpenAI-compatible {@code /audio/transcriptions} endpoint.
 *
 * <p>The recording is sent as a 16-bit PCM WAV named {@code audio.wav} in a multipart form along
 * with {@code model}, {@code temperature} and, when set, {@code language} and {@code prompt}.
 * The response's {@code text} field is the transcript.
 */
public class ApiWhisperBackend implements TranscriptionBackend {

    public static final String NAME = "api";
    static final String TRANSCRIPTIONS_PATH = "/audio/transcriptions";
    private static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");

    private static final Logger LOG = LogManager.getLogger(ApiWhisperBackend.class);

    private final RestClient restClient;
    private final String model;

    /**
     * @param restClient client already configured with the base URL and authorization header
     * @param model remote model name, e.g. "whisper-1"
     */
    public ApiWhisperBackend(RestClient restClient, String model) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    /**
     * Builds the client for a base URL and optional API key.
     */
    public static ApiWhisperBackend create(RestClient.Builder builder, String baseUrl, String apiKey, String model) {
        RestClient.Builder configured = builder.baseUrl(stripTrailingSlash(baseUrl));
        if (apiKey != null && !apiKey.isBlank()) {
            configured = configured.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        return new ApiWhisperBackend(configured.build(), model);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String transcribe(AudioBuffer buffer, DecodingOptions options) {
        byte[] wav = WavWriter.pcm16ToBytes(buffer.samples(), buffer.sampleRate());
        MultipartBodyBuilder form = new MultipartBodyBuilder();
        form.part("file", new NamedByteArrayResource(wav, "audio.wav")).contentType(AUDIO_WAV);
        form.part("model", model);
        form.part("temperature", String.format(Locale.ROOT, "%.2f", options.temperature()));
        if (!options.autoDetectLanguage()) {
            form.part("language", options.language());
        }
        if (options.initialPrompt() != null) {
            form.part("prompt", options.initialPrompt());
        }

        long start = System.nanoTime();
        String body;
        try {
            body = restClient.post()
                    .uri(TRANSCRIPTIONS_PATH)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form.build())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw BackendInvocationExceptionBuilder.create("Transcription API returned an error")
                    .backend(NAME)
                    .exitCode(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("model", model)
                    .metadata("body", abbreviate(e.getResponseBodyAsString()))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw BackendInvocationExceptionBuilder.create("Transcription API request failed")
                    .backend(NAME)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("model", model)
                    .cause(e)
                    .build();
        }
        LOG.debug("Transcription API answered in {} ms ({} bytes of WAV sent)", TimeUtils.elapsedMillis(start), wav.length);
        return parseText(body);
    }

    static String parseText(String body) {
        if (body == null || body.isBlank()) {
            throw BackendInvocationExceptionBuilder.create("Transcription API returned an empty body")
                    .backend(NAME)
                    .build();
        }
        try {
            JSONObject json = new JSONObject(body);
            if (!json.has("text")) {
                throw BackendInvocationExceptionBuilder.create("Transcription API response has no 'text' field")
                        .backend(NAME)
                        .metadata("body", abbreviate(body))
                        .build();
            }
            return json.optString("text", "");
        } catch (JSONException e) {
            throw BackendInvocationExceptionBuilder.create("Transcription API returned malformed JSON")
                    .backend(NAME)
                    .metadata("body", abbreviate(body))
                    .cause(e)
                    .build();
        }
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /** Multipart file parts need a filename; a plain ByteArrayResource has none. */
    private static final class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        NamedByteArrayResource(byte[] bytes, String filename) {
            super(bytes);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
