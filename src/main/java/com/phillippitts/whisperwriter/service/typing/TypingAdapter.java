package com.phillippitts.whisperwriter.service.typing;

/** One strategy for delivering text to the focused application. */
interface TypingAdapter {

    /** @return true if this strategy can run in the current environment */
    boolean canType();

    /** @return true on success */
    boolean type(String text);

    String name();
}
