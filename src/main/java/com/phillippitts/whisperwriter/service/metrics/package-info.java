/**
 * Micrometer meters for transcription latency, session outcomes and voice commands.
 */
package com.phillippitts.whisperwriter.service.metrics;
