/**
 * Spring wiring and externalized configuration.
 *
 * <ul>
 *   <li>{@link com.phillippitts.whisperwriter.config.ThreadPoolConfig} - session worker executor
 *       with ThreadContext propagation</li>
 *   <li>{@code config.transcription} - backend selection and engine</li>
 *   <li>{@code config.command} - voice command registry</li>
 *   <li>{@code config.orchestration} - pipeline, sessions and the activation controller</li>
 *   <li>{@code config.hotkey} - global key hook</li>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 * </ul>
 *
 * <p>{@code DictationConfigurationValidator} fails startup with a
 * {@link com.phillippitts.whisperwriter.exception.ConfigurationException} on settings that
 * cannot work.
 */
package com.phillippitts.whisperwriter.config;
