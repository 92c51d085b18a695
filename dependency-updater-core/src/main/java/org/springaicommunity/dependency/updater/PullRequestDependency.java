package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

/**
 * A dependency claimed by an open pull request.
 *
 * @param dependencyName the dependency name
 * @param dependencyVersion the version the pull request updates to
 * @param directory the directory the update applies to, null for single-directory jobs
 */
public record PullRequestDependency(String dependencyName, @Nullable String dependencyVersion,
		@Nullable String directory) {
}
