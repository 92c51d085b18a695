package org.springaicommunity.dependency.updater;

/**
 * Configuration properties for the dependency updater.
 *
 * <p>
 * Properties can be set directly via setters or passed to
 * {@link DependencyUpdaterBuilder}. Default values suit most jobs.
 */
public class UpdaterProperties {

	/**
	 * Environment variable (or {@code .env} entry) naming the default job file.
	 */
	public static final String JOB_FILE_VARIABLE = "DEPENDENCY_UPDATER_JOB";

	/**
	 * Maximum number of retries of a failed service gateway call. Zero disables retrying.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay in milliseconds between gateway retries, doubled on each retry.
	 */
	private long retryDelayMs = 1000;

	/**
	 * File the refresh result is written to.
	 */
	private String outputFile = "refresh-result.json";

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	/**
	 * Run the refresh even when the job does not describe a group pull request refresh.
	 */
	private boolean force = false;

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(long retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public String getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	public boolean isForce() {
		return force;
	}

	public void setForce(boolean force) {
		this.force = force;
	}

}
