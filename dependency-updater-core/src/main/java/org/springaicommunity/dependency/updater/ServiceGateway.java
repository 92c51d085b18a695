package org.springaicommunity.dependency.updater;

import java.util.List;
import java.util.Optional;

/**
 * Interface to the service that owns pull requests on the hosting provider.
 *
 * <p>
 * Gateway calls are the only externally visible commit points of a refresh. The updater
 * never retries them; implementations may (see {@link RetryingServiceGateway}).
 * Implementations signal failures with {@link ServiceGatewayException}.
 */
public interface ServiceGateway {

	/**
	 * Open a new pull request for a change.
	 * @param change a change with at least one updated dependency
	 * @param baseCommitSha the commit the change was computed against
	 */
	void createPullRequest(DependencyChange change, String baseCommitSha);

	/**
	 * Replace the content of the existing pull request of the change's group.
	 * @param change a change with at least one updated dependency
	 * @param baseCommitSha the commit the change was computed against
	 */
	void updatePullRequest(DependencyChange change, String baseCommitSha);

	/**
	 * Close the pull request carrying the given dependencies.
	 * @param dependencyNames names of the dependencies of the pull request
	 * @param reason why the pull request is closed
	 */
	void closePullRequest(List<String> dependencyNames, ClosureReason reason);

	/**
	 * Look up the open pull request of a group.
	 * @param dependencyGroupName the group name
	 * @return the open pull request, or empty if the group has none
	 */
	Optional<ExistingPullRequest> findExistingPullRequest(String dependencyGroupName);

}
