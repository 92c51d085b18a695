package org.springaicommunity.dependency.updater.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.dependency.updater.*;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Dependency Updater CLI Application
 *
 * Plain Java command-line application that refreshes the grouped dependency update pull
 * request described by a job file and writes the resulting service actions to a JSON
 * result file. Uses DependencyUpdaterBuilder for service wiring.
 *
 * Usage: java -jar dependency-updater-cli.jar [OPTIONS]
 *
 * Environment Variables: DEPENDENCY_UPDATER_JOB - job file used when --job is not given
 *
 * Examples: java -jar dependency-updater-cli.jar --job job.json java -jar
 * dependency-updater-cli.jar --job job.json --group backend --dry-run java -jar
 * dependency-updater-cli.jar --job job.json --directories /api,/web -o result.json
 */
public class DependencyUpdaterCli {

	private static final Logger logger = LoggerFactory.getLogger(DependencyUpdaterCli.class);

	static final int EXIT_NOT_APPLICABLE = 2;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Refresh failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		// Create argument parser with default properties
		UpdaterProperties defaults = new UpdaterProperties();
		ArgumentParser argumentParser = new ArgumentParser(defaults);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		argumentParser.validateEnvironment(config);
		logConfiguration(config);

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		JobRepository jobRepository = new FileSystemJobRepository(objectMapper);
		JobDocument document = jobRepository.loadJob(Paths.get(config.jobFile));
		JobDefinition job = applyOverrides(document.job(), config);

		if (!GroupUpdateRefresher.appliesTo(job)) {
			if (!config.force) {
				logger.warn("Job is not a group pull request refresh, nothing to do (use --force to refresh anyway)");
				return EXIT_NOT_APPLICABLE;
			}
			logger.info("Job is not a group pull request refresh, refreshing anyway (--force)");
		}

		RecordingServiceGateway gateway = new RecordingServiceGateway(document.existingGroupPullRequests());
		GroupUpdateRefresher refresher = DependencyUpdaterBuilder.create()
			.properties(config.toProperties(defaults))
			.jobDocument(document)
			.job(job)
			.serviceGateway(gateway)
			.buildRefresher();

		RefreshOutcome outcome = refresher.refresh();
		Path resultFile = jobRepository.saveResult(Paths.get(config.outputFile), outcome, gateway.actions(),
				gateway.openPullRequests(), config.dryRun);

		logResults(outcome, gateway, resultFile, config.verbose);
		return 0;
	}

	private static JobDefinition applyOverrides(JobDefinition job, ParsedConfiguration config) {
		JobDefinition result = job;
		if (config.groupName != null) {
			result = result.withDependencyGroupToRefresh(config.groupName);
		}
		if (!config.directories.isEmpty()) {
			result = result.withDirectories(config.directories);
		}
		return result;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Job file: {}", config.jobFile);
		logger.info("  Group: {}", config.groupName != null ? config.groupName : "(from job)");
		logger.info("  Directories: {}", config.directories.isEmpty() ? "(from job)" : config.directories);
		logger.info("  Output file: {}", config.outputFile);
		logger.info("  Dry run: {}", config.dryRun);
		logger.info("  Verbose: {}", config.verbose);
		logger.info("  Force: {}", config.force);
		logger.info("  Max retries: {}", config.maxRetries);
	}

	private static void logResults(RefreshOutcome outcome, RecordingServiceGateway gateway, Path resultFile,
			boolean verbose) {
		logger.info("Refresh completed successfully!");
		logger.info("Group: {}", outcome.dependencyGroupName());
		logger.info("Decision: {}", outcome.decision().action());
		if (outcome.decision().closureReason() != null) {
			logger.info("Closure reason: {}", outcome.decision().closureReason().description());
		}
		logger.info("Updated dependencies: {}", outcome.change().dependencyNames());
		logger.info("Service actions: {}", gateway.actions().size());
		logger.info("Result file: {}", resultFile);

		if (verbose) {
			for (GatewayAction action : gateway.actions()) {
				logger.info("  - {} {} {}", action.type(), action.dependencyGroupName(), action.dependencies());
			}
			for (DependencyFile file : outcome.change().updatedDependencyFiles()) {
				logger.info("  ~ {}{}", file.directory(), file.name());
			}
		}
	}

}
