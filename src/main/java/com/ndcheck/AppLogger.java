package com.ndcheck;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Checker session log. Entries go to the log file and, in dev mode, to stdout. Until
 * {@link #initialize} runs, {@link #get()} returns a logger that writes nowhere, so the
 * kernel can log from tests without setup.
 */
public class AppLogger {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "-".repeat(48);
    private static final AppLogger SILENT = new AppLogger(List.of());

    private static AppLogger instance;

    private final List<PrintStream> sinks;
    private final PrintStream file;

    private AppLogger(List<PrintStream> sinks) {
        this.sinks = sinks;
        this.file = null;
    }

    AppLogger(Path logFile, boolean echo) throws IOException {
        this.file = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);
        List<PrintStream> targets = new ArrayList<>();
        targets.add(file);
        if (echo) {
            targets.add(System.out);
        }
        this.sinks = List.copyOf(targets);
        file.println(RULE);
        file.println("fitch-checker session opened " + LocalDateTime.now().format(STAMP));
        file.println(RULE);
    }

    public static synchronized void initialize(Path logFile, boolean echo) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, echo);
        }
    }

    public static synchronized AppLogger get() {
        return instance != null ? instance : SILENT;
    }

    public void info(String message) {
        write("info ", message);
    }

    public void warn(String message) {
        write("warn ", message);
    }

    public void error(String message) {
        write("error", message);
    }

    public void error(String message, Throwable cause) {
        write("error", message);
        for (PrintStream sink : sinks) {
            cause.printStackTrace(sink);
        }
    }

    /**
     * Unstamped text, used for the startup banner.
     */
    public void console(String message) {
        for (PrintStream sink : sinks) {
            sink.println(message);
        }
    }

    public void close() {
        if (file != null) {
            file.println("fitch-checker session closed " + LocalDateTime.now().format(STAMP));
            file.close();
        }
    }

    private void write(String level, String message) {
        if (sinks.isEmpty()) {
            return;
        }
        String entry = LocalDateTime.now().format(STAMP) + " " + level + " | " + message;
        for (PrintStream sink : sinks) {
            sink.println(entry);
        }
    }
}
