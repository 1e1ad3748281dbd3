/**
 * Remote transcription over an OpenAI-compatible HTTP API.
 */
package com.phillippitts.whisperwriter.service.transcription.api;
