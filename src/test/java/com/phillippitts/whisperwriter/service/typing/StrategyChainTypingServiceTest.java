package com.phillippitts.whisperwriter.service.typing;

import com.phillippitts.whisperwriter.service.typing.event.AllTypingFallbacksFailedEvent;
import com.phillippitts.whisperwriter.service.typing.event.TypingFallbackEvent;
import com.phillippitts.whisperwriter.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyChainTypingServiceTest {

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();

    @Test
    void firstAvailableAdapterWins() {
        StubAdapter robot = new StubAdapter("robot", true, true);
        StubAdapter clipboard = new StubAdapter("clipboard", true, true);
        StrategyChainTypingService service = new StrategyChainTypingService(List.of(robot, clipboard), publisher);

        assertThat(service.paste("hello")).isTrue();

        assertThat(robot.typed).containsExactly("hello");
        assertThat(clipboard.typed).isEmpty();
        assertThat(publisher.events).isEmpty();
    }

    @Test
    void unavailableAdapterIsSkippedSilently() {
        StubAdapter robot = new StubAdapter("robot", false, true);
        StubAdapter clipboard = new StubAdapter("clipboard", true, true);
        StrategyChainTypingService service = new StrategyChainTypingService(List.of(robot, clipboard), publisher);

        assertThat(service.paste("hello")).isTrue();

        assertThat(robot.typed).isEmpty();
        assertThat(clipboard.typed).containsExactly("hello");
        assertThat(publisher.events).isEmpty();
    }

    @Test
    void failingAdapterFallsBackAndPublishesEvent() {
        StubAdapter robot = new StubAdapter("robot", true, true);
        robot.failure = new IllegalStateException("no display");
        StubAdapter clipboard = new StubAdapter("clipboard", true, true);
        StrategyChainTypingService service = new StrategyChainTypingService(List.of(robot, clipboard), publisher);

        assertThat(service.paste("hello")).isTrue();

        assertThat(clipboard.typed).containsExactly("hello");
        assertThat(publisher.ofType(TypingFallbackEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.adapter()).isEqualTo("robot");
                    assertThat(e.reason()).isEqualTo("IllegalStateException");
                });
    }

    @Test
    void allAdaptersFailingPublishesSummaryWithoutText() {
        StubAdapter robot = new StubAdapter("robot", true, false);
        StubAdapter clipboard = new StubAdapter("clipboard", true, false);
        StrategyChainTypingService service = new StrategyChainTypingService(List.of(robot, clipboard), publisher);

        assertThat(service.paste("secret words")).isFalse();

        assertThat(publisher.ofType(TypingFallbackEvent.class)).hasSize(2);
        assertThat(publisher.ofType(AllTypingFallbacksFailedEvent.class))
                .singleElement()
                .extracting(AllTypingFallbacksFailedEvent::chars)
                .isEqualTo(12);
    }

    @Test
    void emptyTextIsSuccessfulNoOp() {
        StubAdapter robot = new StubAdapter("robot", true, true);
        StrategyChainTypingService service = new StrategyChainTypingService(List.of(robot), publisher);

        assertThat(service.paste("")).isTrue();
        assertThat(service.paste(null)).isTrue();
        assertThat(robot.typed).isEmpty();
    }

    private static final class StubAdapter implements TypingAdapter {
        private final String name;
        private final boolean available;
        private final boolean result;
        private final List<String> typed = new ArrayList<>();
        private RuntimeException failure;

        StubAdapter(String name, boolean available, boolean result) {
            this.name = name;
            this.available = available;
            this.result = result;
        }

        @Override
        public boolean canType() {
            return available;
        }

        @Override
        public boolean type(String text) {
            if (failure != null) {
                throw failure;
            }
            typed.add(text);
            return result;
        }

        @Override
        public String name() {
            return name;
        }
    }
}
