package ideavalidator.domain.logging;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Keeps the command line output readable by only showing warnings and errors.
 */
public final class LogConfig {
    private LogConfig() {
    }

    public static void init() {
        final Logger rootLogger = LogManager.getLogManager().getLogger("");
        rootLogger.setLevel(Level.WARNING);
        for (final Handler handler : rootLogger.getHandlers()) {
            handler.setLevel(Level.WARNING);
        }
    }
}
