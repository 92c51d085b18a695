package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

/**
 * Observability collaborator receiving every error the updater encounters, recovered or
 * not.
 */
@FunctionalInterface
public interface ErrorReporter {

	/**
	 * Report an error.
	 * @param error the error
	 * @param dependencyGroupName the group being refreshed, if known
	 */
	void captureException(Throwable error, @Nullable String dependencyGroupName);

}
