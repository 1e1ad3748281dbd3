package com.phillippitts.whisperwriter.service.typing;

import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;

/**
 * Minimal string view of the system clipboard; replaced by an in-memory fake in tests.
 */
interface ClipboardFacade {

    /** @return current text contents, or null if the clipboard holds no text */
    String getText();

    void setText(String text);

    final class Awt implements ClipboardFacade {
        @Override
        public String getText() {
            try {
                Clipboard cb = Toolkit.getDefaultToolkit().getSystemClipboard();
                if (cb.isDataFlavorAvailable(DataFlavor.stringFlavor)) {
                    return (String) cb.getData(DataFlavor.stringFlavor);
                }
                return null;
            } catch (UnsupportedFlavorException | IOException | IllegalStateException e) {
                return null;
            }
        }

        @Override
        public void setText(String text) {
            Toolkit.getDefaultToolkit().getSystemClipboard().setContents(new StringSelection(text), null);
        }
    }
}
