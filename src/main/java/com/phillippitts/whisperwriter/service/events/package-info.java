/**
 * Listeners that report recoverable failures (microphone, hotkey, typing) to the user via logs.
 */
package com.phillippitts.whisperwriter.service.events;
