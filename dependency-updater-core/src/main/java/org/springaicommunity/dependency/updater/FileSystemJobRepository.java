package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File system implementation of {@link JobRepository}.
 */
public class FileSystemJobRepository implements JobRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemJobRepository.class);

	private final ObjectMapper objectMapper;

	public FileSystemJobRepository(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public JobDocument loadJob(Path jobFile) {
		if (!Files.isRegularFile(jobFile)) {
			throw new IllegalArgumentException("Job file not found: " + jobFile);
		}
		try {
			JobDocument document = objectMapper.readValue(jobFile.toFile(), JobDocument.class);
			if (document.job() == null) {
				throw new IllegalArgumentException("Job file " + jobFile + " has no 'job' section");
			}
			logger.info("Loaded job from {} ({} directories, {} open group pull requests)", jobFile,
					document.directories().size(), document.existingGroupPullRequests().size());
			return document;
		}
		catch (IOException e) {
			throw new IllegalArgumentException("Failed to read job file " + jobFile + ": " + e.getMessage(), e);
		}
	}

	@Override
	public Path saveResult(Path outputFile, RefreshOutcome outcome, List<GatewayAction> actions,
			List<ExistingPullRequest> openPullRequests, boolean dryRun) {
		if (dryRun) {
			logger.info("DRY RUN: Would write {} actions to {}", actions.size(), outputFile);
			return outputFile;
		}

		Map<String, Object> result = new LinkedHashMap<>();
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("dependency-group", outcome.dependencyGroupName());
		metadata.put("action", outcome.decision().action().name().toLowerCase());
		if (outcome.decision().closureReason() != null) {
			metadata.put("closure-reason", outcome.decision().closureReason());
		}
		metadata.put("updated-dependencies", outcome.change().dependencyNames());
		metadata.put("timestamp", LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
		result.put("metadata", metadata);
		result.put("actions", actions);
		result.put("open-pull-requests", openPullRequests);

		try {
			Path parent = outputFile.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), result);
			logger.info("Wrote {} actions to {}", actions.size(), outputFile);
			return outputFile;
		}
		catch (IOException e) {
			throw new RuntimeException("Failed to write refresh result: " + outputFile, e);
		}
	}

}
