package com.phillippitts.whisperwriter.service.command;

import com.phillippitts.whisperwriter.domain.CommandOutcome;
import com.phillippitts.whisperwriter.exception.CommandHandlerException;
import com.phillippitts.whisperwriter.service.metrics.DictationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommandProcessorTest {

    private SimpleMeterRegistry registry;
    private DictationMetrics metrics;
    private final List<String> invoked = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DictationMetrics(registry);
        invoked.clear();
    }

    private CommandHandler recording(String name) {
        return text -> {
            invoked.add(name + ":" + text);
            return new CommandOutcome(true, "");
        };
    }

    @Test
    void firstRegisteredMatchWins() {
        CommandRegistry commands = CommandRegistry.builder()
                .register("wiz open edge", recording("edge"))
                .register("wiz open", recording("open"))
                .build();
        CommandProcessor processor = new CommandProcessor(commands, metrics);

        CommandOutcome outcome = processor.execute("Wiz open edge");

        assertThat(outcome.executed()).isTrue();
        assertThat(invoked).containsExactly("edge:Wiz open edge");
    }

    @Test
    void laterEntryMatchesWhenEarlierDoesNot() {
        CommandRegistry commands = CommandRegistry.builder()
                .register("wiz open edge", recording("edge"))
                .register("wiz open", recording("open"))
                .build();
        CommandProcessor processor = new CommandProcessor(commands, metrics);

        processor.execute("wiz open chrome");

        assertThat(invoked).containsExactly("open:wiz open chrome");
    }

    @Test
    void handlerReceivesOriginalTextNotSanitized() {
        CommandRegistry commands = CommandRegistry.builder().register("wiz open edge", recording("edge")).build();
        CommandProcessor processor = new CommandProcessor(commands, metrics);

        processor.execute("Hey, WIZ... open Edge!");

        assertThat(invoked).containsExactly("edge:Hey, WIZ... open Edge!");
    }

    @Test
    void noMatchReturnsRawTextUnchanged() {
        CommandRegistry commands = CommandRegistry.builder().register("wiz open edge", recording("edge")).build();
        CommandProcessor processor = new CommandProcessor(commands, metrics);

        CommandOutcome outcome = processor.execute("Just dictating.");

        assertThat(outcome).isEqualTo(new CommandOutcome(false, "Just dictating."));
        assertThat(invoked).isEmpty();
    }

    @Test
    void failingHandlerYieldsOriginalTextAndNotExecuted() {
        CommandRegistry commands = CommandRegistry.builder()
                .register("wiz open edge", text -> {
                    throw new CommandHandlerException("wiz open edge", "boom", null);
                })
                .build();
        CommandProcessor processor = new CommandProcessor(commands, metrics);

        CommandOutcome outcome = processor.execute("wiz open edge please");

        assertThat(outcome.executed()).isFalse();
        assertThat(outcome.text()).isEqualTo("wiz open edge please");
        assertThat(registry.find("whisperwriter.command.executed").counter()).isNull();
    }

    @Test
    void substringMatchAlsoFiresInsideOrdinarySpeech() {
        CommandRegistry commands = CommandRegistry.builder().register("open", recording("open")).build();
        CommandProcessor processor = new CommandProcessor(commands, metrics);

        assertThat(processor.execute("the door is reopened").executed()).isTrue();
    }

    @Test
    void emptyOrNullInputIsUnchangedEmpty() {
        CommandProcessor processor = new CommandProcessor(
                CommandRegistry.builder().register("go", recording("go")).build(), metrics);

        assertThat(processor.execute("")).isEqualTo(CommandOutcome.unchanged(""));
        assertThat(processor.execute(null)).isEqualTo(CommandOutcome.unchanged(""));
        assertThat(invoked).isEmpty();
    }

    @Test
    void executedCommandIsCountedByPhrase() {
        CommandRegistry commands = CommandRegistry.builder().register("wiz open edge", recording("edge")).build();
        new CommandProcessor(commands, metrics).execute("wiz open edge");

        assertThat(registry.find("whisperwriter.command.executed").tag("phrase", "wiz open edge")
                .counter().count()).isEqualTo(1.0);
    }
}
