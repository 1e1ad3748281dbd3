package com.phillippitts.whisperwriter.service.hotkey;

import com.phillippitts.whisperwriter.service.hotkey.event.HotkeyCancelEvent;
import com.phillippitts.whisperwriter.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.whisperwriter.service.hotkey.event.HotkeyPressedEvent;
import com.phillippitts.whisperwriter.service.hotkey.event.HotkeyReleasedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Installs the global key hook and translates matching key events into
 * {@link HotkeyPressedEvent} / {@link HotkeyReleasedEvent} application events. A press of the
 * optional cancel key is published as {@link HotkeyCancelEvent}.
 *
 * <p>A refused hook is logged and reported as {@link HotkeyPermissionDeniedEvent}; the
 * application keeps running.
 */
public class HotkeyManager implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HotkeyManager.class);

    private final GlobalKeyHook hook;
    private final HotkeyTrigger trigger;
    private final HotkeyTrigger cancelTrigger;
    private final ApplicationEventPublisher publisher;

    private volatile boolean running;

    public HotkeyManager(GlobalKeyHook hook, HotkeyTrigger trigger, ApplicationEventPublisher publisher) {
        this(hook, trigger, null, publisher);
    }

    /**
     * @param cancelTrigger cancel key, or {@code null} for none
     */
    public HotkeyManager(GlobalKeyHook hook, HotkeyTrigger trigger, HotkeyTrigger cancelTrigger,
                         ApplicationEventPublisher publisher) {
        this.hook = Objects.requireNonNull(hook, "hook must not be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        this.cancelTrigger = cancelTrigger;
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        try {
            hook.addListener(dispatcher());
            hook.register();
            running = true;
            LOG.info("HotkeyManager started with trigger={} cancel={}", trigger.name(),
                    cancelTrigger == null ? "none" : cancelTrigger.name());
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.toString());
            publisher.publishEvent(new HotkeyPermissionDeniedEvent(Instant.now()));
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            hook.unregister();
        } catch (RuntimeException e) {
            LOG.debug("Error unregistering key hook: {}", e.toString());
        }
        running = false;
        LOG.info("HotkeyManager stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private Consumer<NormalizedKeyEvent> dispatcher() {
        return e -> {
            if (cancelTrigger != null) {
                dispatchCancel(e);
            }
            boolean matched = switch (e.type()) {
                case PRESSED -> trigger.onKeyPressed(e);
                case RELEASED -> trigger.onKeyReleased(e);
            };
            if (!matched) {
                return;
            }
            if (e.type() == NormalizedKeyEvent.Type.PRESSED) {
                publisher.publishEvent(new HotkeyPressedEvent(Instant.now()));
            } else {
                publisher.publishEvent(new HotkeyReleasedEvent(Instant.now()));
            }
        };
    }

    // both triggers see every event so a shared modifier release reaches each of them
    private void dispatchCancel(NormalizedKeyEvent e) {
        boolean matched = switch (e.type()) {
            case PRESSED -> cancelTrigger.onKeyPressed(e);
            case RELEASED -> cancelTrigger.onKeyReleased(e);
        };
        if (matched && e.type() == NormalizedKeyEvent.Type.PRESSED) {
            publisher.publishEvent(new HotkeyCancelEvent(Instant.now()));
        }
    }
}
