/**
 * Immutable domain types shared by the activation, session, transcription and text pipeline.
 */
package com.phillippitts.whisperwriter.domain;
