/**
 * Application-specific exception hierarchy.
 *
 * <ul>
 *   <li>{@link com.phillippitts.whisperwriter.exception.WhisperWriterException} - base type</li>
 *   <li>{@link com.phillippitts.whisperwriter.exception.BackendInitException} - model or device
 *       setup failed; triggers the CPU fallback</li>
 *   <li>{@link com.phillippitts.whisperwriter.exception.BackendInvocationException} - a backend
 *       failed on a buffer; the session yields an empty transcript</li>
 *   <li>{@link com.phillippitts.whisperwriter.exception.CommandHandlerException} - a voice
 *       command side effect failed; the text passes through unchanged</li>
 *   <li>{@link com.phillippitts.whisperwriter.exception.AudioCaptureException} - the microphone
 *       could not be opened or read; the session yields an empty transcript</li>
 *   <li>{@link com.phillippitts.whisperwriter.exception.ConfigurationException} - fatal startup
 *       error</li>
 * </ul>
 *
 * <p>All exceptions are unchecked. No single dictation cycle's failure prevents later cycles.
 */
package com.phillippitts.whisperwriter.exception;
