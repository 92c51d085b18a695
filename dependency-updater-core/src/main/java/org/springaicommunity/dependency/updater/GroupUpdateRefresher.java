package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Refreshes the single pull request that updates every outdated dependency of one
 * {@link DependencyGroup}, across all directories of the job.
 *
 * <p>
 * The refresh recomputes the group's change on the current state of the project and
 * compares it with the pull request the group already has:
 * <ul>
 * <li>the same dependencies move to the same versions: the existing pull request is
 * updated</li>
 * <li>dependencies were added or removed: the existing pull request is closed and a new
 * one created</li>
 * <li>the same dependencies move to new versions: a new pull request is created and the
 * service marks the old one as superseded</li>
 * </ul>
 * Before compiling, dependencies claimed by the open pull requests of every other group
 * are marked as handled so that two groups never update the same dependency.
 *
 * <p>
 * A refresher performs no retries. A gateway failure propagates as
 * {@link ServiceGatewayException}; any other failure aborts the refresh with a
 * {@link GroupRefreshException}. Both are reported to the {@link ErrorReporter} first.
 * Only other groups' pull requests are claimed, so refreshing twice against the same
 * snapshot yields the same decision.
 */
public class GroupUpdateRefresher {

	private static final Logger logger = LoggerFactory.getLogger(GroupUpdateRefresher.class);

	/**
	 * Experiment that turns grouped pull requests off for security-only jobs.
	 */
	public static final String GROUPED_SECURITY_UPDATES_DISABLED = "grouped_security_updates_disabled";

	private final DependencySnapshot snapshot;

	private final DependencyChangeCompiler changeCompiler;

	private final DependencyChangeMerger changeMerger;

	private final PullRequestLifecycleDecider lifecycleDecider;

	private final ServiceGateway serviceGateway;

	private final ErrorReporter errorReporter;

	public GroupUpdateRefresher(DependencySnapshot snapshot, DependencyChangeCompiler changeCompiler,
			DependencyChangeMerger changeMerger, PullRequestLifecycleDecider lifecycleDecider,
			ServiceGateway serviceGateway, ErrorReporter errorReporter) {
		this.snapshot = snapshot;
		this.changeCompiler = changeCompiler;
		this.changeMerger = changeMerger;
		this.lifecycleDecider = lifecycleDecider;
		this.serviceGateway = serviceGateway;
		this.errorReporter = errorReporter;
	}

	/**
	 * Whether a job should be handled by refreshing a group pull request.
	 * @param job the job configuration
	 * @return true if the job carries the dependencies of a group pull request to refresh
	 */
	public static boolean appliesTo(JobDefinition job) {
		// Without the dependencies of the pull request and the group that created it
		// there is nothing to refresh.
		if (job.dependencies().isEmpty() || job.dependencyGroupToRefresh() == null) {
			return false;
		}
		if (job.securityUpdatesOnly() && job.isExperimentEnabled(GROUPED_SECURITY_UPDATES_DISABLED)) {
			return false;
		}
		if (job.isMultiDirectory()) {
			return true;
		}
		if (job.securityUpdatesOnly()) {
			return job.dependencies().size() > 1
					|| job.dependencyGroups().stream().anyMatch(DependencyGroup::isSecurityGroup);
		}
		return job.updatingAPullRequest();
	}

	/**
	 * Refresh the pull request of the job's group and apply the resulting decision through
	 * the service gateway.
	 * @return the applied decision and the change it was based on
	 * @throws GroupRefreshException if a collaborator fails while computing or applying the
	 * change
	 * @throws ServiceGatewayException if the service gateway fails
	 */
	public RefreshOutcome refresh() {
		JobDefinition job = snapshot.job();
		Optional<DependencyGroup> jobGroup = snapshot.jobGroup();
		if (jobGroup.isEmpty()) {
			return closeMissingGroup(job.dependencyGroupToRefresh());
		}

		DependencyGroup group = jobGroup.get();
		logger.info("Starting PR update job for {}", job.repository() != null ? job.repository() : "(unnamed)");
		try {
			List<Dependency> members = snapshot.eligibleMembers(group);
			ExistingPullRequest existing = serviceGateway.findExistingPullRequest(group.name()).orElse(null);

			DependencyChange change;
			if (members.isEmpty()) {
				// Whatever matched this group has been removed from the project or is no
				// longer allowed by the configuration.
				logger.warn("Skipping update group for '{}' as it does not match any allowed dependencies.",
						group.name());
				change = DependencyChange.empty(group);
			}
			else {
				logger.info("Updating the '{}' group", group.name());
				claimDependenciesOfOtherGroups(group);
				change = compileChange(group);
			}

			PullRequestDecision decision = lifecycleDecider.decide(change, existing, members.size());
			apply(decision, change, group.name(), existing);
			return new RefreshOutcome(group.name(), decision, change);
		}
		catch (ServiceGatewayException e) {
			logger.error("Service call failed while refreshing group '{}': {}", group.name(), e.getMessage());
			errorReporter.captureException(e, group.name());
			throw e;
		}
		catch (GroupRefreshException e) {
			logger.error("Refresh of group '{}' aborted: {}", group.name(), e.getMessage());
			errorReporter.captureException(e.getCause() != null ? e.getCause() : e, group.name());
			throw e;
		}
		catch (RuntimeException e) {
			logger.error("Refresh of group '{}' failed: {}", group.name(), e.getMessage());
			errorReporter.captureException(e, group.name());
			throw new GroupRefreshException(group.name(), e);
		}
	}

	/**
	 * Mark as handled every dependency claimed by the open pull request of another group.
	 */
	private void claimDependenciesOfOtherGroups(DependencyGroup group) {
		for (DependencyGroup other : snapshot.groups()) {
			if (other.name().equals(group.name())) {
				continue;
			}
			serviceGateway.findExistingPullRequest(other.name()).ifPresent(pullRequest -> {
				logger.info("Group '{}' has an open pull request for {}", other.name(), pullRequest.dependencyNames());
				snapshot.addHandledDependencies(pullRequest.dependencyNames());
			});
		}
	}

	/**
	 * Compile the group in every directory, in configured order, and merge the results.
	 * Nothing is merged unless every directory compiles.
	 */
	private DependencyChange compileChange(DependencyGroup group) {
		List<DependencyChange> changes = new ArrayList<>();
		for (String directory : snapshot.directories()) {
			snapshot.setCurrentDirectory(directory);
			try {
				changes.add(changeCompiler.compile(group, snapshot));
			}
			catch (ServiceGatewayException | GroupRefreshException e) {
				throw e;
			}
			catch (RuntimeException e) {
				throw new GroupRefreshException(group.name(), e);
			}
		}
		return changeMerger.merge(changes);
	}

	private void apply(PullRequestDecision decision, DependencyChange change, String groupName,
			@Nullable ExistingPullRequest existing) {
		String baseCommitSha = snapshot.baseCommitSha(snapshot.directories().get(0));
		switch (decision.action()) {
			case CREATE -> {
				logger.info("Creating a new pull request for '{}'", groupName);
				serviceGateway.createPullRequest(change, baseCommitSha);
			}
			case UPDATE_IN_PLACE -> {
				logger.info("Updating pull request for '{}'", groupName);
				serviceGateway.updatePullRequest(change, baseCommitSha);
			}
			case REPLACE -> {
				logger.info("Dependencies have changed, closing existing Pull Request");
				closePullRequest(groupName, existing, ClosureReason.DEPENDENCIES_CHANGED);
				logger.info("Creating a new pull request for '{}'", groupName);
				serviceGateway.createPullRequest(change, baseCommitSha);
			}
			case SUPERSEDE -> {
				logger.info("Target versions have changed, existing Pull Request should be superseded");
				logger.info("Creating a new pull request for '{}'", groupName);
				serviceGateway.createPullRequest(change, baseCommitSha);
			}
			case CLOSE -> {
				if (decision.closureReason() == ClosureReason.UPDATE_NO_LONGER_POSSIBLE) {
					logger.info("No updated dependencies, closing existing Pull Request");
				}
				closePullRequest(groupName, existing, decision.closureReason());
			}
		}
	}

	private RefreshOutcome closeMissingGroup(@Nullable String groupName) {
		logger.warn("The '{}' group has been removed from the update config.",
				groupName != null ? groupName : "unknown");
		errorReporter.captureException(new MissingDependencyGroupException(groupName), groupName);

		PullRequestDecision decision = PullRequestDecision.close(ClosureReason.DEPENDENCY_GROUP_EMPTY);
		if (groupName == null && snapshot.job().dependencies().isEmpty()) {
			logger.warn("No group and no dependencies named by the job, there is no pull request to close");
			return new RefreshOutcome(null, decision, DependencyChange.empty(null));
		}
		try {
			ExistingPullRequest existing = groupName != null
					? serviceGateway.findExistingPullRequest(groupName).orElse(null) : null;
			closePullRequest(groupName != null ? groupName : "unknown", existing, decision.closureReason());
		}
		catch (ServiceGatewayException e) {
			logger.error("Service call failed while closing missing group '{}': {}", groupName, e.getMessage());
			errorReporter.captureException(e, groupName);
			throw e;
		}
		catch (RuntimeException e) {
			logger.error("Closing missing group '{}' failed: {}", groupName, e.getMessage());
			errorReporter.captureException(e, groupName);
			throw new GroupRefreshException(groupName != null ? groupName : "unknown", e);
		}
		return new RefreshOutcome(groupName, decision, DependencyChange.empty(null));
	}

	private void closePullRequest(String groupName, @Nullable ExistingPullRequest existing,
			@Nullable ClosureReason reason) {
		ClosureReason closureReason = reason != null ? reason : ClosureReason.DEPENDENCY_GROUP_EMPTY;
		List<String> dependencyNames = existing != null ? List.copyOf(existing.dependencyNames())
				: snapshot.job().dependencies();
		logger.info("Telling backend to close pull request for the {} group ({}) - {}", groupName,
				String.join(", ", dependencyNames), closureReason.description());
		serviceGateway.closePullRequest(dependencyNames, closureReason);
	}

}
