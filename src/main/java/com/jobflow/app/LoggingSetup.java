package com.jobflow.app;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Console logging of the worker process: one line per record, INFO by default, FINE in debug mode.
 */
public final class LoggingSetup {

    static final String FORMAT = "%1$tF %1$tT.%1$tL %4$-7s [%3$s] %5$s%6$s%n";

    // Held so the level set below is not lost when the logger is garbage collected
    private static final Logger h2Logger = Logger.getLogger("org.h2");

    private LoggingSetup() {
    }

    public static void configure(boolean debug) {
        if (System.getProperty("java.util.logging.SimpleFormatter.format") == null) {
            System.setProperty("java.util.logging.SimpleFormatter.format", FORMAT);
        }
        Level level = debug ? Level.FINE : Level.INFO;

        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler handler : root.getHandlers()) {
            root.removeHandler(handler);
        }
        ConsoleHandler console = new ConsoleHandler();
        console.setFormatter(new SimpleFormatter());
        console.setLevel(level);
        root.addHandler(console);
        root.setLevel(level);

        // H2 logs through its own trace system; keep its JDBC pool chatter out of debug output
        h2Logger.setLevel(Level.INFO);
    }
}
