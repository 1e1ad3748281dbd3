package com.phillippitts.whisperwriter.service.typing;

import com.phillippitts.whisperwriter.config.properties.TypingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Robot;
import java.awt.event.KeyEvent;
import java.util.Locale;
import java.util.Objects;

/**
 * Tier 1: put the text on the clipboard and press the paste shortcut with {@link Robot}.
 * Keyboard-layout agnostic. The previous clipboard text is restored afterwards when enabled.
 */
@Component
@Order(1)
class RobotPasteAdapter implements TypingAdapter {

    private static final Logger LOG = LogManager.getLogger(RobotPasteAdapter.class);

    interface RobotFacade {
        void keyPress(int keyCode);

        void keyRelease(int keyCode);

        void delay(int ms);
    }

    static final class AwtRobotFacade implements RobotFacade {
        private final Robot robot;

        AwtRobotFacade() throws AWTException {
            this.robot = new Robot();
        }

        @Override
        public void keyPress(int keyCode) {
            robot.keyPress(keyCode);
        }

        @Override
        public void keyRelease(int keyCode) {
            robot.keyRelease(keyCode);
        }

        @Override
        public void delay(int ms) {
            robot.delay(ms);
        }
    }

    private final TypingProperties props;
    private final RobotFacade robot;
    private final ClipboardFacade clipboard;

    @Autowired
    RobotPasteAdapter(TypingProperties props) {
        this(props, createRobotFacade(), new ClipboardFacade.Awt());
    }

    RobotPasteAdapter(TypingProperties props, RobotFacade robot, ClipboardFacade clipboard) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.robot = robot;
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard must not be null");
    }

    private static RobotFacade createRobotFacade() {
        if (GraphicsEnvironment.isHeadless()) {
            return null;
        }
        try {
            return new AwtRobotFacade();
        } catch (AWTException | SecurityException e) {
            LOG.warn("java.awt.Robot unavailable: {}", e.toString());
            return null;
        }
    }

    @Override
    public boolean canType() {
        return props.isEnableRobot() && robot != null;
    }

    @Override
    public boolean type(String text) {
        if (!canType()) {
            return false;
        }
        String prior = props.isRestoreClipboard() ? clipboard.getText() : null;
        clipboard.setText(text);
        if (props.getFocusDelayMs() > 0) {
            robot.delay(props.getFocusDelayMs());
        }
        pasteShortcut(robot, props.getPasteShortcut());
        if (prior != null) {
            robot.delay(props.getRestoreDelayMs());
            clipboard.setText(prior);
        }
        return true;
    }

    @Override
    public String name() {
        return "robot";
    }

    static void pasteShortcut(RobotFacade robot, String mode) {
        boolean mac = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
        int modKey = mac ? KeyEvent.VK_META : KeyEvent.VK_CONTROL;
        if ("META+V".equalsIgnoreCase(mode)) {
            modKey = KeyEvent.VK_META;
        } else if ("CONTROL+V".equalsIgnoreCase(mode)) {
            modKey = KeyEvent.VK_CONTROL;
        }
        robot.keyPress(modKey);
        robot.keyPress(KeyEvent.VK_V);
        robot.keyRelease(KeyEvent.VK_V);
        robot.keyRelease(modKey);
    }
}
