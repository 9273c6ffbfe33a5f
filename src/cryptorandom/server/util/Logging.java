package cryptorandom.server.util;

import java.io.*;
import java.nio.file.*;
import java.util.logging.*;

public class Logging {
    private static final Logger LOG = Logger.getGlobal();

    private static boolean isInitialised = false;
    public static Logger LOG() {
        return LOG;
    }

    /**
     * Initialise logging to a rotating file, configured by:
     * log-name, log-limit, log-count, log-append, log-to-console, log-to-file and log-level
     */
    public static synchronized void init(Args a) {
        Path logPath = Paths.get(a.getArg("log-name", "cryptorandom.%g.log"));
        int logLimit = a.getInt("log-limit", 1024 * 1024);
        int logCount = a.getInt("log-count", 10);
        boolean logAppend = a.getBoolean("log-append", true);
        boolean logToConsole = a.getBoolean("log-to-console", false);
        boolean logToFile = a.getBoolean("log-to-file", true);
        Level level = Level.parse(a.getArg("log-level", "INFO"));

        init(logPath, logLimit, logCount, logAppend, logToConsole, logToFile, level);
    }

    public static synchronized void init(Path logPath,
                                         int logLimit,
                                         int logCount,
                                         boolean logAppend,
                                         boolean logToConsole,
                                         boolean logToFile,
                                         Level level) {
        if (isInitialised)
            return;

        try {
            LOG().setLevel(level);
            if (! logToConsole)
                LOG().setUseParentHandlers(false);

            Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
                String msg = "Uncaught Exception in thread " + thread.getId() + ":" + thread.getName();
                LOG().log(Level.SEVERE, msg, throwable);
            });

            if (! logToFile)
                return;

            Path parent = logPath.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            String logPathS = logPath.toString();
            FileHandler fileHandler = new FileHandler(logPathS, logLimit, logCount, logAppend);
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(level);
            LOG().addHandler(fileHandler);
            LOG().info("Logging to " + logPathS.replace("%g", "0"));
        } catch (IOException ioe) {
            throw new IllegalStateException(ioe.getMessage(), ioe);
        } finally {
            isInitialised = true;
        }
    }
}
