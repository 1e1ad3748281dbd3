/**
 * Text injection into the focused window: Robot-driven paste with a clipboard-only fallback.
 */
package com.phillippitts.whisperwriter.service.typing;
