package com.phillippitts.whisperwriter.service.typing;

import com.phillippitts.whisperwriter.service.typing.event.AllTypingFallbacksFailedEvent;
import com.phillippitts.whisperwriter.service.typing.event.TypingFallbackEvent;
import com.phillippitts.whisperwriter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Tries adapters in {@link org.springframework.core.annotation.Order} order (Robot paste, then
 * clipboard only) until one succeeds.
 */
@Service
public class StrategyChainTypingService implements TypingService {

    private static final Logger LOG = LogManager.getLogger(StrategyChainTypingService.class);

    private final List<TypingAdapter> chain;
    private final ApplicationEventPublisher publisher;

    StrategyChainTypingService(List<TypingAdapter> adapters, ApplicationEventPublisher publisher) {
        this.chain = List.copyOf(adapters);
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public boolean paste(String text) {
        if (text == null || text.isEmpty()) {
            LOG.debug("Nothing to type");
            return true;
        }
        for (TypingAdapter a : chain) {
            if (!a.canType()) {
                LOG.debug("Skipping adapter {}: unavailable", a.name());
                continue;
            }
            try {
                if (a.type(text)) {
                    LOG.info("Typed via {} (chars={})", a.name(), text.length());
                    LOG.debug("Typed preview='{}'", LogSanitizer.truncate(text, 40));
                    return true;
                }
                publisher.publishEvent(new TypingFallbackEvent(a.name(), "type returned false", Instant.now()));
            } catch (RuntimeException e) {
                LOG.warn("Adapter {} failed: {}", a.name(), e.toString());
                publisher.publishEvent(new TypingFallbackEvent(a.name(), e.getClass().getSimpleName(), Instant.now()));
            }
        }
        LOG.warn("No typing adapter succeeded (chars={})", text.length());
        publisher.publishEvent(new AllTypingFallbacksFailedEvent(text.length(), Instant.now()));
        return false;
    }
}
