package com.phillippitts.whisperwriter.service.audio.capture;

/**
 * Creates a fresh {@link AudioSource} for each recording session.
 */
@FunctionalInterface
public interface AudioSourceFactory {

    AudioSource create();
}
