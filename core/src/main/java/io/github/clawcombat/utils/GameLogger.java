package io.github.clawcombat.utils;

import com.badlogic.gdx.Gdx;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;

public class GameLogger {
    private static final String TAG = "Arena";
    public static boolean isInfoEnabled;
    public static boolean isErrorEnabled;

    private static PrintWriter fileWriter;

    static {
        isInfoEnabled = !Boolean.getBoolean("arena.log.info.disabled");
        isErrorEnabled = !Boolean.getBoolean("arena.log.error.disabled");
    }

    public static void info(String message) {
        if (isInfoEnabled) {
            if (Gdx.app != null) {
                Gdx.app.log(TAG, message);
            } else {
                System.out.println("INFO: " + message);
            }
            logToFile("INFO: " + message);
        }
    }

    public static void error(String message) {
        if (isErrorEnabled) {
            if (Gdx.app != null) {
                Gdx.app.error(TAG, message);
            } else {
                System.err.println("ERROR: " + message);
            }
            logToFile("ERROR: " + message);
        }
    }

    public static void error(String message, Throwable cause) {
        error(message + (cause != null ? " (" + cause.getClass().getSimpleName() + ": " + cause.getMessage() + ")" : ""));
    }

    /**
     * Appends every subsequent log line to the given file. Passing null stops file logging.
     */
    public static synchronized void setLogFile(String path) {
        close();
        if (path == null || path.isEmpty()) {
            return;
        }
        try {
            fileWriter = new PrintWriter(new FileWriter(path, true));
        } catch (IOException e) {
            System.err.println("Unable to open log file: " + e.getMessage());
        }
    }

    private static synchronized void logToFile(String logMessage) {
        if (fileWriter != null) {
            fileWriter.println(logMessage);
            fileWriter.flush();
        }
    }

    public static void setLogging(boolean infoEnabled, boolean errorEnabled) {
        isInfoEnabled = infoEnabled;
        isErrorEnabled = errorEnabled;
    }

    public static synchronized void close() {
        if (fileWriter != null) {
            fileWriter.close();
            fileWriter = null;
        }
    }
}
