package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builder wiring the collaborators of a group pull request refresh.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Against real ecosystem collaborators
 * GroupUpdateRefresher refresher = DependencyUpdaterBuilder.create()
 *     .job(job)
 *     .fileFetcher(fetcher)
 *     .dependencyParser(parser)
 *     .updateCheckerFactory(checkers)
 *     .fileUpdater(updater)
 *     .serviceGateway(gateway)
 *     .buildRefresher();
 *
 * // Replaying a job document offline
 * RecordingServiceGateway gateway = new RecordingServiceGateway(document.existingGroupPullRequests());
 * GroupUpdateRefresher refresher = DependencyUpdaterBuilder.create()
 *     .jobDocument(document)
 *     .serviceGateway(gateway)
 *     .buildRefresher();
 * }
 * </pre>
 *
 * <p>
 * When {@link UpdaterProperties#getMaxRetries()} is positive the gateway is wrapped in a
 * {@link RetryingServiceGateway}.
 */
public class DependencyUpdaterBuilder {

	private static final Logger logger = LoggerFactory.getLogger(DependencyUpdaterBuilder.class);

	private UpdaterProperties properties;

	private JobDefinition job;

	private FileFetcher fileFetcher;

	private DependencyParser dependencyParser;

	private UpdateCheckerFactory updateCheckerFactory;

	private FileUpdater fileUpdater;

	private ServiceGateway serviceGateway;

	private ErrorReporter errorReporter;

	private DependencySnapshot snapshot;

	private DependencyUpdaterBuilder() {
		this.properties = new UpdaterProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new DependencyUpdaterBuilder
	 */
	public static DependencyUpdaterBuilder create() {
		return new DependencyUpdaterBuilder();
	}

	/**
	 * Set updater properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public DependencyUpdaterBuilder properties(@Nullable UpdaterProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public DependencyUpdaterBuilder job(JobDefinition job) {
		this.job = job;
		return this;
	}

	public DependencyUpdaterBuilder fileFetcher(FileFetcher fileFetcher) {
		this.fileFetcher = fileFetcher;
		return this;
	}

	public DependencyUpdaterBuilder dependencyParser(DependencyParser dependencyParser) {
		this.dependencyParser = dependencyParser;
		return this;
	}

	public DependencyUpdaterBuilder updateCheckerFactory(UpdateCheckerFactory updateCheckerFactory) {
		this.updateCheckerFactory = updateCheckerFactory;
		return this;
	}

	public DependencyUpdaterBuilder fileUpdater(FileUpdater fileUpdater) {
		this.fileUpdater = fileUpdater;
		return this;
	}

	public DependencyUpdaterBuilder serviceGateway(ServiceGateway serviceGateway) {
		this.serviceGateway = serviceGateway;
		return this;
	}

	/**
	 * Set the error reporter.
	 * @param errorReporter error reporter (null to log errors only)
	 * @return this builder
	 */
	public DependencyUpdaterBuilder errorReporter(@Nullable ErrorReporter errorReporter) {
		this.errorReporter = errorReporter;
		return this;
	}

	/**
	 * Use an already built snapshot instead of fetching and parsing the job's directories.
	 * Lets a caller refresh several groups of one job against the same handled set.
	 * @param snapshot the job snapshot (null to build one)
	 * @return this builder
	 */
	public DependencyUpdaterBuilder snapshot(@Nullable DependencySnapshot snapshot) {
		this.snapshot = snapshot;
		return this;
	}

	/**
	 * Take the job and every ecosystem collaborator from a job document.
	 * @param document the job document
	 * @return this builder
	 */
	public DependencyUpdaterBuilder jobDocument(JobDocument document) {
		FixtureEcosystem ecosystem = new FixtureEcosystem(document);
		this.job = document.job();
		this.fileFetcher = ecosystem;
		this.dependencyParser = ecosystem;
		this.updateCheckerFactory = ecosystem;
		this.fileUpdater = ecosystem;
		return this;
	}

	/**
	 * Fetch and parse every directory of the job into a snapshot.
	 * @return the snapshot
	 * @throws GroupRefreshException if fetching or parsing fails
	 */
	public DependencySnapshot buildSnapshot() {
		if (snapshot != null) {
			return snapshot;
		}
		require(job, "job");
		require(fileFetcher, "fileFetcher");
		require(dependencyParser, "dependencyParser");
		try {
			return DependencySnapshot.create(job, fileFetcher, dependencyParser);
		}
		catch (RuntimeException e) {
			String groupName = job.dependencyGroupToRefresh();
			logger.error("Failed to read the project for group '{}': {}", groupName, e.getMessage());
			buildErrorReporter().captureException(e, groupName);
			throw new GroupRefreshException(groupName != null ? groupName : "unknown", e);
		}
	}

	/**
	 * Build a refresher for the job's group.
	 * @return configured GroupUpdateRefresher
	 */
	public GroupUpdateRefresher buildRefresher() {
		require(updateCheckerFactory, "updateCheckerFactory");
		require(fileUpdater, "fileUpdater");
		require(serviceGateway, "serviceGateway");
		DependencySnapshot builtSnapshot = buildSnapshot();
		return new GroupUpdateRefresher(builtSnapshot, new DependencyChangeCompiler(updateCheckerFactory, fileUpdater),
				new DependencyChangeMerger(), new PullRequestLifecycleDecider(), buildServiceGateway(),
				buildErrorReporter());
	}

	private ErrorReporter buildErrorReporter() {
		return errorReporter != null ? errorReporter : new LoggingErrorReporter();
	}

	private ServiceGateway buildServiceGateway() {
		if (properties.getMaxRetries() <= 0) {
			return serviceGateway;
		}
		return RetryingServiceGateway.builder()
			.wrapping(serviceGateway)
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryDelayMs())
			.build();
	}

	private static void require(@Nullable Object value, String name) {
		if (value == null) {
			throw new IllegalStateException(name + " is required. Call " + name + "() first.");
		}
	}

}
