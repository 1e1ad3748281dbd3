/**
 * Hotkey-driven activation: decides, per recording mode, when sessions start and stop and
 * delivers their text.
 */
package com.phillippitts.whisperwriter.service.activation;
