package com.phillippitts.whisperwriter.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionResultTest {

    @Test
    void factoriesProduceEmptyText() {
        assertThat(SessionResult.cancelled("s1").text()).isEmpty();
        assertThat(SessionResult.failed("s1").outcome()).isEqualTo(SessionResult.Outcome.FAILED);
        assertThat(SessionResult.captureFailed("s1").outcome()).isEqualTo(SessionResult.Outcome.CAPTURE_FAILED);
    }

    @Test
    void onlyCancelledIsCancelled() {
        assertThat(SessionResult.cancelled("s1").isCancelled()).isTrue();
        assertThat(SessionResult.failed("s1").isCancelled()).isFalse();
        assertThat(new SessionResult("s1", "hi", SessionResult.Outcome.COMPLETED, false).isCancelled()).isFalse();
    }

    @Test
    void activeStatesAreRecordingAndTranscribing() {
        assertThat(SessionState.RECORDING.isActive()).isTrue();
        assertThat(SessionState.TRANSCRIBING.isActive()).isTrue();
        assertThat(SessionState.IDLE.isActive()).isFalse();
        assertThat(SessionState.STOPPED.isActive()).isFalse();
    }
}
