package org.stackmac.cli;

import org.jline.terminal.impl.DumbTerminal;
import org.stackmac.runtime.StepController.Decision;
import org.stackmac.runtime.TraceEvent;
import org.stackmac.runtime.model.Instruction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConsoleStepControllerTest {

    private static final TraceEvent EVENT = new TraceEvent(0, Instruction.of("PUSH", 1), List.of(), 0);

    private static ConsoleStepController controller(String input, ByteArrayOutputStream output) throws IOException {
        DumbTerminal terminal = new DumbTerminal(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), output);
        return new ConsoleStepController(terminal);
    }

    @Test
    void enterContinuesAndQuitInterrupts() throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ConsoleStepController controller = controller("\n\nquit\n", output)) {
            assertThat(controller.awaitStep(EVENT)).isEqualTo(Decision.CONTINUE);
            assertThat(controller.awaitStep(EVENT)).isEqualTo(Decision.CONTINUE);
            assertThat(controller.awaitStep(EVENT)).isEqualTo(Decision.INTERRUPT);
        }
        assertThat(output.toString(StandardCharsets.UTF_8)).contains(ConsoleStepController.PROMPT);
    }

    @Test
    void upperCaseQInterrupts() throws IOException {
        try (ConsoleStepController controller = controller("  Q\n", new ByteArrayOutputStream())) {
            assertThat(controller.awaitStep(EVENT)).isEqualTo(Decision.INTERRUPT);
        }
    }

    @Test
    void otherInputContinues() throws IOException {
        try (ConsoleStepController controller = controller("next\n", new ByteArrayOutputStream())) {
            assertThat(controller.awaitStep(EVENT)).isEqualTo(Decision.CONTINUE);
        }
    }

    @Test
    void endOfInputInterrupts() throws IOException {
        try (ConsoleStepController controller = controller("", new ByteArrayOutputStream())) {
            assertThat(controller.awaitStep(EVENT)).isEqualTo(Decision.INTERRUPT);
        }
    }
}
