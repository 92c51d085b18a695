package org.springaicommunity.dependency.updater;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * What to do with a group's pull request.
 *
 * @param action the action to take
 * @param closureReason why the existing pull request is closed, for {@link Action#CLOSE}
 * and {@link Action#REPLACE}; null otherwise
 */
public record PullRequestDecision(Action action, @Nullable ClosureReason closureReason) {

	public PullRequestDecision {
		Objects.requireNonNull(action, "action");
		if ((action == Action.CLOSE || action == Action.REPLACE) && closureReason == null) {
			throw new IllegalArgumentException(action + " requires a closure reason");
		}
	}

	public static PullRequestDecision create() {
		return new PullRequestDecision(Action.CREATE, null);
	}

	public static PullRequestDecision updateInPlace() {
		return new PullRequestDecision(Action.UPDATE_IN_PLACE, null);
	}

	public static PullRequestDecision replace() {
		return new PullRequestDecision(Action.REPLACE, ClosureReason.DEPENDENCIES_CHANGED);
	}

	public static PullRequestDecision supersede() {
		return new PullRequestDecision(Action.SUPERSEDE, null);
	}

	public static PullRequestDecision close(ClosureReason reason) {
		return new PullRequestDecision(Action.CLOSE, reason);
	}

	/**
	 * Pull request actions.
	 */
	public enum Action {

		/**
		 * Open a new pull request; the group has none.
		 */
		CREATE,

		/**
		 * Rewrite the existing pull request; same dependencies, same target versions.
		 */
		UPDATE_IN_PLACE,

		/**
		 * Close the existing pull request and open a new one; the dependencies changed.
		 */
		REPLACE,

		/**
		 * Open a new pull request and leave the existing one for the service to mark as
		 * superseded; same dependencies, new target versions.
		 */
		SUPERSEDE,

		/**
		 * Close the existing pull request.
		 */
		CLOSE

	}

}
