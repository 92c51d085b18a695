package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides what happens to a group's pull request, given the group's freshly compiled change
 * and the pull request currently open for it.
 *
 * <p>
 * The decision is a pure function of its inputs; the decider performs no I/O.
 * <ul>
 * <li>empty change, group without members: close, the group is empty</li>
 * <li>empty change, group with members: close, no update is possible any more</li>
 * <li>no open pull request: create</li>
 * <li>different dependency names: replace (close, then create)</li>
 * <li>same names and versions: update in place</li>
 * <li>same names, different versions: supersede (create only)</li>
 * </ul>
 */
public class PullRequestLifecycleDecider {

	/**
	 * Decide the pull request action.
	 * @param change the merged change of the group
	 * @param existing the open pull request of the group, null if there is none
	 * @param groupMemberCount number of dependencies currently eligible for the group
	 * @return the decision
	 */
	public PullRequestDecision decide(DependencyChange change, @Nullable ExistingPullRequest existing,
			int groupMemberCount) {
		if (change.isEmpty()) {
			return groupMemberCount == 0 ? PullRequestDecision.close(ClosureReason.DEPENDENCY_GROUP_EMPTY)
					: PullRequestDecision.close(ClosureReason.UPDATE_NO_LONGER_POSSIBLE);
		}
		if (existing == null) {
			return PullRequestDecision.create();
		}
		if (!new HashSet<>(change.dependencyNames()).equals(existing.dependencyNames())) {
			return PullRequestDecision.replace();
		}
		return targetVersionsMatch(change.updatedDependencies(), existing) ? PullRequestDecision.updateInPlace()
				: PullRequestDecision.supersede();
	}

	/**
	 * Every dependency of the change targets the version the pull request records for it.
	 * A pull request listing one name in several directories matches only when all of its
	 * entries for that name agree with the change.
	 */
	private boolean targetVersionsMatch(List<Dependency> dependencies, ExistingPullRequest existing) {
		Map<String, Set<String>> recordedVersions = new HashMap<>();
		for (PullRequestDependency claimed : existing.dependencies()) {
			recordedVersions.computeIfAbsent(claimed.dependencyName(), name -> new HashSet<>())
				.add(String.valueOf(claimed.dependencyVersion()));
		}
		for (Dependency dependency : dependencies) {
			Set<String> versions = recordedVersions.get(dependency.name());
			if (versions == null || !versions.equals(Set.of(String.valueOf(dependency.version())))) {
				return false;
			}
		}
		return true;
	}

}
