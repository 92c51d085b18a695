package org.springaicommunity.dependency.updater;

import java.nio.file.Path;
import java.util.List;

/**
 * Repository interface for loading job documents and persisting refresh results.
 *
 * <p>
 * Abstracts file system operations to enable testability and alternative storage
 * implementations.
 */
public interface JobRepository {

	/**
	 * Load a job document.
	 * @param jobFile path of the JSON job document
	 * @return the parsed document
	 * @throws IllegalArgumentException if the file is missing or cannot be parsed
	 */
	JobDocument loadJob(Path jobFile);

	/**
	 * Write the outcome of a refresh and the gateway actions it produced.
	 * @param outputFile path of the JSON file to write
	 * @param outcome the refresh outcome
	 * @param actions the gateway actions, in order
	 * @param openPullRequests the pull requests open after the refresh
	 * @param dryRun if true, don't actually write the file
	 * @return the path that was (or would be) written
	 */
	Path saveResult(Path outputFile, RefreshOutcome outcome, List<GatewayAction> actions,
			List<ExistingPullRequest> openPullRequests, boolean dryRun);

}
