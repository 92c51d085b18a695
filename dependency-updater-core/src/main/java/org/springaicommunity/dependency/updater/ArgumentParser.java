package org.springaicommunity.dependency.updater;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line argument parser for the dependency updater. Pure Java implementation with
 * no framework dependencies for maximum testability.
 */
public class ArgumentParser {

	private final UpdaterProperties defaultProperties;

	public ArgumentParser(UpdaterProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-j", "--job":
					config.jobFile = getRequiredValue(args, i, "job");
					i++; // Skip next argument since we consumed it
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "-g", "--group":
					config.groupName = getRequiredValue(args, i, "group");
					i++;
					break;

				case "--directories":
					String directoryStr = getRequiredValue(args, i, "directories");
					config.directories = Arrays.stream(directoryStr.split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
					i++;
					break;

				case "--max-retries":
					String maxRetriesStr = getRequiredValue(args, i, "max-retries");
					try {
						config.maxRetries = Integer.parseInt(maxRetriesStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid max retries '" + maxRetriesStr + "': must be a non-negative integer");
					}
					i++;
					break;

				case "-d", "--dry-run":
					config.dryRun = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "--force":
					config.force = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					break;
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: refresh.java [OPTIONS]\n");
		help.append("\n");
		help.append("Refresh the grouped dependency update pull request described by a job file.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -j, --job <file>        Job file (default: $")
			.append(UpdaterProperties.JOB_FILE_VARIABLE)
			.append(")\n");
		help.append("    -o, --output <file>     Result file (default: ")
			.append(defaultProperties.getOutputFile())
			.append(")\n");
		help.append("    -g, --group <name>      Refresh this group instead of the job's group\n");
		help.append("    --directories <dirs>    Comma-separated directories replacing the job's directories\n");
		help.append("    -d, --dry-run           Compute and log the actions without writing the result\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("    --max-retries <count>   Retries of a failed service call, 0 disables (default: ")
			.append(defaultProperties.getMaxRetries())
			.append(")\n");
		help.append("    --force                 Refresh even if the job is not a group pull request refresh\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ")
			.append(UpdaterProperties.JOB_FILE_VARIABLE)
			.append("  Job file used when --job is not given (also read from .env)\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  refresh applied\n");
		help.append("    1  invalid arguments or refresh failed\n");
		help.append("    2  job is not a group pull request refresh\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    ./refresh.java --job job.json\n");
		help.append("    ./refresh.java --job job.json --group backend --dry-run\n");
		help.append("    ./refresh.java --job job.json --directories /api,/web -o result.json\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (job file present and readable).
	 * @param config the parsed configuration
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment(ParsedConfiguration config) {
		Path jobFile = Path.of(config.jobFile);
		if (!Files.isRegularFile(jobFile) || !Files.isReadable(jobFile)) {
			throw new IllegalStateException("Job file not found or not readable: " + jobFile.toAbsolutePath());
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		if (config.jobFile == null || config.jobFile.trim().isEmpty()) {
			errors.add("Job file is required (use --job or set " + UpdaterProperties.JOB_FILE_VARIABLE + ")");
		}

		if (config.outputFile == null || config.outputFile.trim().isEmpty()) {
			errors.add("Output file cannot be empty");
		}

		if (config.groupName != null && config.groupName.trim().isEmpty()) {
			errors.add("Group name cannot be empty");
		}

		if (config.maxRetries < 0) {
			errors.add("Max retries cannot be negative (got: " + config.maxRetries + ")");
		}
		else if (config.maxRetries > 10) {
			errors.add("Max retries too large (got: " + config.maxRetries + ", max: 10)");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
