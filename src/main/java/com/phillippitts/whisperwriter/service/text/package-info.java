/**
 * Transcript formatting that runs after voice command detection.
 */
package com.phillippitts.whisperwriter.service.text;
