package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The dependency upgrades and the resulting file edits computed for one pull request.
 *
 * <p>
 * A change with no updated dependencies means nothing could be updated. Such a change is
 * only ever used to decide that a pull request should be closed; it is never sent to the
 * service as a pull request to create or update.
 *
 * @param updatedDependencies the dependencies being updated, in compilation order
 * @param updatedDependencyFiles the files that changed, in compilation order
 * @param dependencyGroup the group the change was compiled for, null for a single
 * dependency update
 */
public record DependencyChange(List<Dependency> updatedDependencies, List<DependencyFile> updatedDependencyFiles,
		@Nullable DependencyGroup dependencyGroup) {

	public DependencyChange {
		updatedDependencies = List.copyOf(updatedDependencies);
		updatedDependencyFiles = List.copyOf(updatedDependencyFiles);
	}

	/**
	 * An empty change for the given group.
	 */
	public static DependencyChange empty(@Nullable DependencyGroup group) {
		return new DependencyChange(List.of(), List.of(), group);
	}

	/**
	 * Whether the change was compiled for a dependency group.
	 */
	@JsonIgnore
	public boolean isGroupedUpdate() {
		return dependencyGroup != null;
	}

	/**
	 * Whether the change updates no dependency at all.
	 */
	@JsonIgnore
	public boolean isEmpty() {
		return updatedDependencies.isEmpty();
	}

	/**
	 * Names of the updated dependencies, in order.
	 */
	public List<String> dependencyNames() {
		return updatedDependencies.stream().map(Dependency::name).toList();
	}

}
