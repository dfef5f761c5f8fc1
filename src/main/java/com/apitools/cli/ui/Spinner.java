package com.apitools.cli.ui;

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
 * Shows a spinning cursor with a label while a blocking task, such as fetching a large remote
 * document, runs on a background thread.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = {'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Runs {@code task} and returns its result, animating {@code label} until it completes.
     * Runtime exceptions thrown by the task are rethrown unchanged.
     */
    public <T> T spin(String label, Supplier<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        int frame = 0;
        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clear(writer, label);
                    return result;
                } catch (TimeoutException e) {
                    writer.print("\r\u001B[33m" + label + " " + FRAMES[frame++ % FRAMES.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (ExecutionException e) {
            clear(writer, label);
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(e.getCause());
        } catch (InterruptedException e) {
            clear(writer, label);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for: " + label, e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void clear(PrintWriter writer, String label) {
        writer.print("\r" + " ".repeat(label.length() + 2) + "\r");
        writer.flush();
    }
}
