package org.springaicommunity.dependency.updater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ServiceGateway} that keeps pull requests in memory and records every action it
 * receives, instead of talking to a hosting provider.
 *
 * <p>
 * Open pull requests are seeded from a job document and follow the recorded actions: a
 * create opens (or replaces) the group's pull request, an update rewrites it and a close
 * removes the pull request carrying exactly the given dependencies.
 */
public class RecordingServiceGateway implements ServiceGateway {

	private static final Logger logger = LoggerFactory.getLogger(RecordingServiceGateway.class);

	private final Map<String, ExistingPullRequest> openPullRequests = new LinkedHashMap<>();

	private final List<GatewayAction> actions = new ArrayList<>();

	public RecordingServiceGateway(List<ExistingPullRequest> openPullRequests) {
		for (ExistingPullRequest pullRequest : openPullRequests) {
			this.openPullRequests.put(pullRequest.dependencyGroupName(), pullRequest);
		}
	}

	@Override
	public void createPullRequest(DependencyChange change, String baseCommitSha) {
		requireUpdates(change);
		GatewayAction action = GatewayAction.forChange(GatewayAction.CREATE, change, baseCommitSha);
		record(action);
		if (action.dependencyGroupName() != null) {
			openPullRequests.put(action.dependencyGroupName(),
					new ExistingPullRequest(action.dependencyGroupName(), action.dependencies()));
		}
	}

	@Override
	public void updatePullRequest(DependencyChange change, String baseCommitSha) {
		requireUpdates(change);
		GatewayAction action = GatewayAction.forChange(GatewayAction.UPDATE, change, baseCommitSha);
		record(action);
		if (action.dependencyGroupName() != null) {
			openPullRequests.put(action.dependencyGroupName(),
					new ExistingPullRequest(action.dependencyGroupName(), action.dependencies()));
		}
	}

	@Override
	public void closePullRequest(List<String> dependencyNames, ClosureReason reason) {
		record(GatewayAction.forClose(dependencyNames, reason));
		openPullRequests.values()
			.removeIf(pullRequest -> pullRequest.dependencyNames().equals(new HashSet<>(dependencyNames)));
	}

	@Override
	public Optional<ExistingPullRequest> findExistingPullRequest(String dependencyGroupName) {
		return Optional.ofNullable(openPullRequests.get(dependencyGroupName));
	}

	/**
	 * Actions received so far, in order.
	 */
	public List<GatewayAction> actions() {
		return List.copyOf(actions);
	}

	/**
	 * Pull requests open after the recorded actions.
	 */
	public List<ExistingPullRequest> openPullRequests() {
		return List.copyOf(openPullRequests.values());
	}

	private void record(GatewayAction action) {
		logger.info("Recorded {} for {} ({})", action.type(),
				action.dependencyGroupName() != null ? action.dependencyGroupName() : "pull request",
				action.dependencies().stream().map(PullRequestDependency::dependencyName).toList());
		actions.add(action);
	}

	private static void requireUpdates(DependencyChange change) {
		if (change.isEmpty()) {
			throw new ServiceGatewayException("A pull request needs at least one updated dependency", 422);
		}
	}

}
