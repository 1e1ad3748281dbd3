/**
 * Voice command detection.
 *
 * <p>{@link com.phillippitts.whisperwriter.service.command.CommandRegistry} is an explicit ordered
 * list built once at startup; {@link com.phillippitts.whisperwriter.service.command.CommandProcessor}
 * scans it first-match-wins against the sanitized transcript.
 */
package com.phillippitts.whisperwriter.service.command;
