package org.springaicommunity.dependency.updater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Decorator that retries transient failures of a {@link ServiceGateway} with exponential
 * backoff.
 *
 * <p>
 * Only {@link ServiceGatewayException}s reporting a transient failure (no response, 429,
 * 5xx) are retried; every other exception is rethrown immediately. Retrying belongs here,
 * in the gateway layer: the refresh itself never retries.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * ServiceGateway gateway = RetryingServiceGateway.builder()
 *     .wrapping(httpGateway)
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingServiceGateway implements ServiceGateway {

	private static final Logger logger = LoggerFactory.getLogger(RetryingServiceGateway.class);

	private final ServiceGateway delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingServiceGateway(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void createPullRequest(DependencyChange change, String baseCommitSha) {
		executeWithRetry(() -> {
			delegate.createPullRequest(change, baseCommitSha);
			return null;
		}, "create pull request " + change.dependencyNames());
	}

	@Override
	public void updatePullRequest(DependencyChange change, String baseCommitSha) {
		executeWithRetry(() -> {
			delegate.updatePullRequest(change, baseCommitSha);
			return null;
		}, "update pull request " + change.dependencyNames());
	}

	@Override
	public void closePullRequest(List<String> dependencyNames, ClosureReason reason) {
		executeWithRetry(() -> {
			delegate.closePullRequest(dependencyNames, reason);
			return null;
		}, "close pull request " + dependencyNames);
	}

	@Override
	public Optional<ExistingPullRequest> findExistingPullRequest(String dependencyGroupName) {
		return executeWithRetry(() -> delegate.findExistingPullRequest(dependencyGroupName),
				"find pull request of group " + dependencyGroupName);
	}

	private <T> T executeWithRetry(GatewayCall<T> call, String description) {
		long delay = initialDelayMs;
		for (int attempt = 0;; attempt++) {
			try {
				return call.execute();
			}
			catch (ServiceGatewayException e) {
				if (!e.isTransient() || attempt >= maxRetries) {
					if (e.isTransient()) {
						logger.error("{} failed after {} attempts", description, attempt + 1);
					}
					throw e;
				}
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
						maxRetries + 1, e.getMessage(), delay);
				sleep(delay);
				delay *= 2;
			}
		}
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ServiceGatewayException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface GatewayCall<T> {

		T execute();

	}

	/**
	 * Builder for {@link RetryingServiceGateway}.
	 *
	 * <p>
	 * Defaults: 3 retries, 1 second initial delay.
	 */
	public static class Builder {

		private ServiceGateway delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		/**
		 * Set the gateway to wrap with retry logic.
		 * @param gateway the ServiceGateway to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(ServiceGateway gateway) {
			this.delegate = gateway;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the initial delay between retries in milliseconds.
		 * @param delayMs initial delay in milliseconds (default: 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingServiceGateway.
		 * @return configured RetryingServiceGateway
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingServiceGateway build() {
			if (delegate == null) {
				throw new IllegalStateException("A ServiceGateway to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingServiceGateway(this);
		}

	}

}
