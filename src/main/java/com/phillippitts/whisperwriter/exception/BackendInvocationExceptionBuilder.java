package com.phillippitts.whisperwriter.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link BackendInvocationException} carrying diagnostic context.
 *
 * <pre>
 * throw BackendInvocationExceptionBuilder.create("whisper.cpp exited with error")
 *         .backend("local")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class BackendInvocationExceptionBuilder {

    private final String message;
    private String backendName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private BackendInvocationExceptionBuilder(String message) {
        this.message = message;
    }

    public static BackendInvocationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new BackendInvocationExceptionBuilder(message);
    }

    public BackendInvocationExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    public BackendInvocationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public BackendInvocationExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public BackendInvocationExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key/value pair to the message. Null keys or values are ignored.
     */
    public BackendInvocationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * {@code {message} (exitCode=.., durationMs=.., key=value, ...) (backend: name)}.
     */
    public BackendInvocationException build() {
        String detailed = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";
        if (cause != null) {
            return new BackendInvocationException(detailed, backend, cause);
        }
        return new BackendInvocationException(detailed, backend);
    }

    private String buildDetailedMessage() {
        StringBuilder details = new StringBuilder();
        if (exitCode != null) {
            details.append("exitCode=").append(exitCode);
        }
        if (durationMs != null) {
            appendSeparator(details);
            details.append("durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            appendSeparator(details);
            details.append(entry.getKey()).append('=').append(entry.getValue());
        }
        if (details.length() == 0) {
            return message;
        }
        return message + " (" + details + ")";
    }

    private static void appendSeparator(StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append(", ");
        }
    }
}
