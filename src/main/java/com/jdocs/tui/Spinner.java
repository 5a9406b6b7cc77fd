package com.jdocs.tui;

import java.io.PrintWriter;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Animated spinner showing which step of the turn is running.
 */
public class Spinner {

    private static final String[] FRAMES = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};

    private final PrintWriter out;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile String label = "";
    private Thread thread;

    public Spinner(PrintWriter out) {
        this.out = out;
    }

    /**
     * Show the spinner with the given label, or just switch the label if it is already spinning.
     */
    public void start(String label) {
        this.label = label;
        if (running.getAndSet(true)) return;

        thread = new Thread(() -> {
            int frame = 0;
            try {
                while (running.get()) {
                    out.print("\r  \u001b[1;35m" + FRAMES[frame % FRAMES.length] + " " + this.label
                            + "...\u001b[0m\u001b[K");
                    out.flush();
                    frame++;
                    Thread.sleep(80);
                }
            } catch (InterruptedException ignored) {
                // stop() interrupts the sleep
            } finally {
                out.print("\r\u001b[K");
                out.flush();
            }
        }, "jdocs-spinner");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stop the spinner and clear the line.
     */
    public void stop() {
        if (!running.getAndSet(false)) return;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
