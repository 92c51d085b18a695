package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ErrorReporter} that writes reports to the log. Used when no external error
 * tracker is configured.
 */
public class LoggingErrorReporter implements ErrorReporter {

	private static final Logger logger = LoggerFactory.getLogger(LoggingErrorReporter.class);

	@Override
	public void captureException(Throwable error, @Nullable String dependencyGroupName) {
		logger.error("Captured error for group '{}': {}", dependencyGroupName != null ? dependencyGroupName : "unknown",
				error.getMessage(), error);
	}

}
