package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A named, rule-defined subset of a project's dependencies that is updated together in a
 * single pull request.
 *
 * <p>
 * Groups come from the job configuration and do not change for the duration of a job.
 * Rules of different groups may overlap; a dependency is kept out of two pull requests
 * by the snapshot's handled set, not by the group definitions.
 *
 * @param name the group name, unique within a job
 * @param appliesTo whether the group is used for version or security updates
 * @param rules the membership rules
 */
public record DependencyGroup(String name, AppliesTo appliesTo, DependencyGroupRules rules) {

	public DependencyGroup {
		Objects.requireNonNull(name, "name");
		appliesTo = appliesTo == null ? AppliesTo.VERSION_UPDATES : appliesTo;
		rules = rules == null ? DependencyGroupRules.matchAll() : rules;
	}

	/**
	 * Membership predicate of the group.
	 * @param dependency the dependency to test
	 * @return true if the dependency belongs to this group
	 */
	public boolean contains(Dependency dependency) {
		return rules.matches(dependency);
	}

	/**
	 * Whether this group is used for security updates.
	 */
	@JsonIgnore
	public boolean isSecurityGroup() {
		return appliesTo == AppliesTo.SECURITY_UPDATES;
	}

}
