package com.phillippitts.whisperwriter.service.typing;

import java.util.ArrayList;
import java.util.List;

class InMemoryClipboard implements ClipboardFacade {
    String text;
    final List<String> history = new ArrayList<>();

    InMemoryClipboard(String initial) {
        this.text = initial;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public void setText(String text) {
        this.text = text;
        history.add(text);
    }
}
