/**
 * Transcription dispatch.
 *
 * <p>{@link com.phillippitts.whisperwriter.service.transcription.TranscriptionEngine} owns exactly
 * one {@link com.phillippitts.whisperwriter.service.transcription.TranscriptionBackend}, selected
 * from {@code model-options.use-api} when the context starts: the local whisper.cpp model under
 * {@code local}, or an OpenAI-compatible HTTP endpoint under {@code api}.
 */
package com.phillippitts.whisperwriter.service.transcription;
