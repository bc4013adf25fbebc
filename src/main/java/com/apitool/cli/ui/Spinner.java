package com.apitool.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

/**
 * Shows a spinning cursor in the console while a tool call runs in the background.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = {'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Runs the task on a worker thread and redraws the spinner every 100ms until it finishes.
     *
     * @param label Text shown next to the spinner.
     * @param task  The work to run.
     * @param <T>   The type of the result.
     * @return The result of the task.
     * @throws RuntimeException the task's own exception, unwrapped.
     */
    public <T> T spin(String label, Supplier<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        String line = "\r\u001B[33m" + label + " ";
        int frame = 0;

        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clear(writer, line.length() + 2);
                    return result;
                } catch (TimeoutException e) {
                    writer.print(line + FRAMES[frame++ % FRAMES.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (ExecutionException e) {
            clear(writer, line.length() + 2);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            clear(writer, line.length() + 2);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the task.", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private void clear(PrintWriter writer, int width) {
        writer.print("\r" + " ".repeat(width) + "\r");
        writer.flush();
    }
}
