package org.springaicommunity.dependency.updater;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DependencyGroupRules Tests")
class DependencyGroupRulesTest {

	private static Dependency dependency(String name, String... groups) {
		return new Dependency(name, "1.0", List.of(new DependencyRequirement("package.json", "^1.0", List.of(groups))));
	}

	@ParameterizedTest
	@CsvSource({ "'@aws-sdk/*', @aws-sdk/client-s3, true", "'@aws-sdk/*', aws-sdk, false", "'*eslint*', ESLint-plugin, true",
			"'rails', rails, true", "'rails', railties, false", "'a.b', axb, false" })
	@DisplayName("Should match names against globs")
	void shouldMatchGlobs(String glob, String name, boolean expected) {
		assertThat(DependencyGroupRules.globMatches(glob, name)).isEqualTo(expected);
	}

	@Test
	@DisplayName("Should match every dependency without patterns")
	void shouldMatchAll() {
		assertThat(new DependencyGroup("all", null, null).contains(dependency("anything"))).isTrue();
	}

	@Test
	@DisplayName("Should apply exclude patterns after include patterns")
	void shouldExclude() {
		DependencyGroupRules rules = new DependencyGroupRules(List.of("lib-*"), List.of("lib-legacy*"), null);

		assertThat(rules.matches(dependency("lib-core"))).isTrue();
		assertThat(rules.matches(dependency("lib-legacy-io"))).isFalse();
	}

	@Test
	@DisplayName("Should select by dependency type")
	void shouldSelectByDependencyType() {
		DependencyGroupRules development = new DependencyGroupRules(List.of(), List.of(),
				DependencyGroupRules.DEVELOPMENT);
		DependencyGroupRules production = new DependencyGroupRules(List.of(), List.of(),
				DependencyGroupRules.PRODUCTION);

		assertThat(development.matches(dependency("jest", "devDependencies"))).isTrue();
		assertThat(development.matches(dependency("react", "dependencies"))).isFalse();
		assertThat(production.matches(dependency("react", "dependencies"))).isTrue();
		assertThat(production.matches(dependency("jest", "devDependencies"))).isFalse();
	}

	@Test
	@DisplayName("Should reject an unknown dependency type")
	void shouldRejectUnknownDependencyType() {
		assertThatThrownBy(() -> new DependencyGroupRules(List.of(), List.of(), "optional"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("optional");
	}

}
