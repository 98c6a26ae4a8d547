package org.stackmac.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.stackmac.runtime.StepController;
import org.stackmac.runtime.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;

/**
 * Pauses a stepping machine until the user presses Enter. Typing {@code q}, Ctrl+C or closing
 * the input stops the run.
 */
public class ConsoleStepController implements StepController, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleStepController.class);

    static final String PROMPT = "Press Enter to continue (q or Ctrl+C to stop)... ";

    private final Terminal terminal;
    private final LineReader lineReader;

    public ConsoleStepController(Terminal terminal) {
        this.terminal = terminal;
        this.lineReader = LineReaderBuilder.builder().terminal(terminal).build();
    }

    /**
     * Opens a controller on the system terminal, or on a dumb terminal where no system terminal
     * is available (IDE consoles, redirected input).
     *
     * @return The controller; close it after the run.
     * @throws IOException if no terminal can be created.
     */
    public static ConsoleStepController open() throws IOException {
        Terminal terminal;
        try {
            terminal = TerminalBuilder.builder().system(true).build();
        } catch (IOException | IllegalStateException e) {
            LOG.debug("System terminal not available, falling back to dumb terminal: {}", e.getMessage());
            terminal = TerminalBuilder.builder().dumb(true).build();
        }
        return new ConsoleStepController(terminal);
    }

    @Override
    public Decision awaitStep(TraceEvent event) {
        try {
            String line = lineReader.readLine(PROMPT);
            if (line != null && line.strip().toLowerCase(Locale.ROOT).startsWith("q")) {
                return Decision.INTERRUPT;
            }
            return Decision.CONTINUE;
        } catch (UserInterruptException | EndOfFileException e) {
            return Decision.INTERRUPT;
        }
    }

    @Override
    public void close() throws IOException {
        terminal.close();
    }
}
