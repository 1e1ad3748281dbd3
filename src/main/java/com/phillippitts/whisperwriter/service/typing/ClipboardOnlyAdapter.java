package com.phillippitts.whisperwriter.service.typing;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.awt.GraphicsEnvironment;
import java.util.Objects;

/** Tier 2: leave the text on the clipboard for the user to paste manually. */
@Component
@Order(2)
class ClipboardOnlyAdapter implements TypingAdapter {

    private final ClipboardFacade clipboard;
    private final boolean available;

    @Autowired
    ClipboardOnlyAdapter() {
        this(new ClipboardFacade.Awt(), !GraphicsEnvironment.isHeadless());
    }

    ClipboardOnlyAdapter(ClipboardFacade clipboard, boolean available) {
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard must not be null");
        this.available = available;
    }

    @Override
    public boolean canType() {
        return available;
    }

    @Override
    public boolean type(String text) {
        clipboard.setText(text);
        return true;
    }

    @Override
    public String name() {
        return "clipboard";
    }
}
