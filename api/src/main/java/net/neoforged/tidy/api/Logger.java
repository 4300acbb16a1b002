package net.neoforged.tidy.api;

import org.jetbrains.annotations.Nullable;

import java.io.PrintStream;
import java.util.Locale;

public class Logger {
    private final PrintStream infoOut;
    private final PrintStream debugOut;
    private final PrintStream errorOut;

    public Logger(@Nullable PrintStream infoOut, @Nullable PrintStream debugOut, @Nullable PrintStream errorOut) {
        this.infoOut = infoOut;
        this.debugOut = debugOut;
        this.errorOut = errorOut;
    }

    public void info(String message, Object... args) {
        if (infoOut != null) {
            infoOut.printf(Locale.ROOT, message + "\n", args);
        }
    }

    public void error(String message, Object... args) {
        if (errorOut != null) {
            errorOut.printf(Locale.ROOT, message + "\n", args);
        }
    }

    public void debug(String message, Object... args) {
        if (debugOut != null) {
            debugOut.printf(Locale.ROOT, message + "\n", args);
        }
    }

    public boolean isDebugEnabled() {
        return debugOut != null;
    }
}
