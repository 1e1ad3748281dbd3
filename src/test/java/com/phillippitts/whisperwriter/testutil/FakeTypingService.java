package com.phillippitts.whisperwriter.testutil;

import com.phillippitts.whisperwriter.service.typing.TypingService;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for TypingService that records every paste, including empty ones.
 */
public class FakeTypingService implements TypingService {
    public final List<String> typedTexts = new CopyOnWriteArrayList<>();

    @Override
    public boolean paste(String text) {
        typedTexts.add(text);
        return true;
    }
}
