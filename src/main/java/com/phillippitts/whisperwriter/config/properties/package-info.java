/**
 * Typed configuration bound from {@code application.properties}. Keys accept kebab-case or
 * underscores through relaxed binding, e.g. {@code recording-options.recording-mode=continuous}.
 */
package com.phillippitts.whisperwriter.config.properties;
