/**
 * Local whisper.cpp backend: model loading with CPU fallback, process execution and the
 * float WAV hand-off.
 */
package com.phillippitts.whisperwriter.service.transcription.local;
