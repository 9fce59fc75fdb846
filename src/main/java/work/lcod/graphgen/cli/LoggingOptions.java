package work.lcod.graphgen.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.graphgen.api.LogLevel;

/**
 * {@code --log-level} shared by every subcommand; applied to the Logback root logger before work starts.
 */
final class LoggingOptions {
    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off); falls back to GRAPHGEN_LOG_LEVEL, then warn.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    /**
     * Level asked for on the command line or in the environment, if any.
     */
    Optional<LogLevel> requested() {
        return LogLevel.firstOf(logLevelRaw, System.getenv(LogLevel.ENVIRONMENT_VARIABLE));
    }

    LogLevel apply() {
        return apply(requested().orElse(LogLevel.WARN));
    }

    static LogLevel apply(LogLevel level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level.name(), Level.WARN));
        }
        return level;
    }
}
