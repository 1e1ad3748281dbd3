/**
 * Recording sessions: microphone capture on a worker thread, cooperative cancellation, and the
 * transcribe, command, format pipeline that runs when capture ends.
 */
package com.phillippitts.whisperwriter.service.session;
