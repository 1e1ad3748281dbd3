/**
 * User feedback: status reporting and the completion chime.
 */
package com.phillippitts.whisperwriter.service.feedback;
