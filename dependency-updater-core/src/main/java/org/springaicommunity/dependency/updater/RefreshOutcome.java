package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

/**
 * Result of refreshing one group's pull request.
 *
 * @param dependencyGroupName the refreshed group, null if the job named none
 * @param decision the action that was applied
 * @param change the merged change the decision was based on
 */
public record RefreshOutcome(@Nullable String dependencyGroupName, PullRequestDecision decision,
		DependencyChange change) {
}
