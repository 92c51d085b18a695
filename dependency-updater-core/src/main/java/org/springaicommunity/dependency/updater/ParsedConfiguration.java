package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Job input
	public @Nullable String jobFile;

	public @Nullable String groupName = null; // overrides the job's group to refresh

	public List<String> directories = new ArrayList<>(); // overrides the job's directories

	// Output
	public String outputFile;

	// Mode flags
	public boolean dryRun = false;

	public boolean verbose = false;

	public boolean force = false;

	public boolean helpRequested = false;

	// Gateway retries
	public int maxRetries;

	public ParsedConfiguration(UpdaterProperties defaultProperties) {
		this.jobFile = EnvironmentSupport.get(UpdaterProperties.JOB_FILE_VARIABLE);
		this.outputFile = defaultProperties.getOutputFile();
		this.verbose = defaultProperties.isVerbose();
		this.force = defaultProperties.isForce();
		this.maxRetries = defaultProperties.getMaxRetries();
	}

	/**
	 * Properties for the builder, with the parsed values applied over the defaults.
	 * @param defaultProperties the defaults
	 * @return new properties instance
	 */
	public UpdaterProperties toProperties(UpdaterProperties defaultProperties) {
		UpdaterProperties properties = new UpdaterProperties();
		properties.setRetryDelayMs(defaultProperties.getRetryDelayMs());
		properties.setMaxRetries(maxRetries);
		properties.setOutputFile(outputFile);
		properties.setVerbose(verbose);
		properties.setForce(force);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "jobFile='" + jobFile + '\'' + ", groupName='" + groupName + '\''
				+ ", directories=" + directories + ", outputFile='" + outputFile + '\'' + ", dryRun=" + dryRun
				+ ", verbose=" + verbose + ", force=" + force + ", helpRequested=" + helpRequested + ", maxRetries="
				+ maxRetries + '}';
	}

}
