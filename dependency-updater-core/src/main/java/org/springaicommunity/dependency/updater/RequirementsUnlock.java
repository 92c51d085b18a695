package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How far declared requirements must be loosened for a dependency to be updated.
 */
public enum RequirementsUnlock {

	/**
	 * The update fits within the declared requirements.
	 */
	NONE("none"),

	/**
	 * Only the dependency's own requirement is loosened.
	 */
	OWN("own"),

	/**
	 * Requirements of related dependencies are loosened as well.
	 */
	ALL("all"),

	/**
	 * No update is achievable.
	 */
	UPDATE_NOT_POSSIBLE("update_not_possible");

	private final String value;

	RequirementsUnlock(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	@JsonCreator
	public static RequirementsUnlock fromValue(String value) {
		for (RequirementsUnlock unlock : values()) {
			if (unlock.value.equalsIgnoreCase(value)) {
				return unlock;
			}
		}
		throw new IllegalArgumentException(
				"Invalid requirements unlock '" + value + "': must be 'none', 'own', 'all' or 'update_not_possible'");
	}

	/**
	 * Pick the level at which the checker updates its dependency. Locked requirements allow
	 * only {@code none}; otherwise {@code own} is tried before {@code all}, so touching only
	 * the dependency itself wins over touching its requirement graph.
	 * @param checker the checker of the dependency
	 * @return the level to update at, or {@link #UPDATE_NOT_POSSIBLE}
	 */
	public static RequirementsUnlock requiredFor(UpdateChecker checker) {
		if (!checker.requirementsUnlockedOrCanBe()) {
			return checker.canUpdate(NONE) ? NONE : UPDATE_NOT_POSSIBLE;
		}
		if (checker.canUpdate(OWN)) {
			return OWN;
		}
		if (checker.canUpdate(ALL)) {
			return ALL;
		}
		return UPDATE_NOT_POSSIBLE;
	}

}
