package com.phillippitts.whisperwriter.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendInvocationExceptionBuilderTest {

    @Test
    void buildsMessageWithAllDetailsInOrder() {
        BackendInvocationException e = BackendInvocationExceptionBuilder.create("whisper.cpp failed")
                .backend("local")
                .exitCode(3)
                .durationMs(1200)
                .metadata("stderr", "bad model")
                .build();

        assertThat(e.getMessage())
                .isEqualTo("whisper.cpp failed (exitCode=3, durationMs=1200, stderr=bad model) (backend: local)");
        assertThat(e.getBackendName()).isEqualTo("local");
        assertThat(e.getCause()).isNull();
    }

    @Test
    void keepsCauseAndDefaultsBackendToUnknown() {
        IOException cause = new IOException("pipe closed");
        BackendInvocationException e = BackendInvocationExceptionBuilder.create("read failed").cause(cause).build();

        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.getBackendName()).isEqualTo("unknown");
        assertThat(e.getMessage()).isEqualTo("read failed (backend: unknown)");
    }

    @Test
    void ignoresNullMetadata() {
        BackendInvocationException e = BackendInvocationExceptionBuilder.create("m")
                .backend("api")
                .metadata("status", null)
                .metadata(null, "x")
                .build();

        assertThat(e.getMessage()).isEqualTo("m (backend: api)");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> BackendInvocationExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
