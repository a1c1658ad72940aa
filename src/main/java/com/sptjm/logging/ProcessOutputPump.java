package com.sptjm.logging;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains an external process stream into the shared logger, one line per record,
 * and remembers the tail so failures can quote what the process printed.
 */
public final class ProcessOutputPump implements Runnable {
    private static final int TAIL_LINES = 20;

    private final InputStream source;
    private final Logger logger;
    private final Level level;
    private final String prefix;
    private final Deque<String> tail = new ArrayDeque<>();
    private Thread thread;

    public ProcessOutputPump(InputStream source, Logger logger, Level level, String prefix) {
        this.source = source;
        this.logger = logger;
        this.level = level;
        this.prefix = prefix;
    }

    /**
     * Starts a daemon thread that pumps until the stream closes.
     */
    public static ProcessOutputPump start(InputStream source, Logger logger, Level level, String prefix) {
        ProcessOutputPump pump = new ProcessOutputPump(source, logger, level, prefix);
        Thread thread = new Thread(pump, "process-output-" + prefix);
        thread.setDaemon(true);
        pump.thread = thread;
        thread.start();
        return pump;
    }

    /**
     * Waits for the pump thread to reach end of stream.
     */
    public void await(long millis) throws InterruptedException {
        if (thread != null) {
            thread.join(millis);
        }
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(source, Charset.defaultCharset()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                remember(line);
                String message = prefix + ": " + line;
                logger.log(level, message);
            }
        } catch (IOException ex) {
            // stream closes abruptly when the process is destroyed
            logger.log(Level.FINE, prefix + " stream closed: " + ex.getMessage());
        }
    }

    public synchronized String tail() {
        return String.join(System.lineSeparator(), tail);
    }

    private synchronized void remember(String line) {
        if (tail.size() == TAIL_LINES) {
            tail.removeFirst();
        }
        tail.addLast(line);
    }
}
