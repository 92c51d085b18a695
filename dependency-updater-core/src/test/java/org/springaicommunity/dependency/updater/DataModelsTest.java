package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the data records: defaults, derived values and their JSON form.
 */
@DisplayName("DataModels Tests")
class DataModelsTest {

	private ObjectMapper objectMapper;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
	}

	@Nested
	@DisplayName("Dependency Tests")
	class DependencyTest {

		@Test
		@DisplayName("Should carry the previous state in an updated dependency")
		void shouldCreateUpdatedDependency() {
			// Given
			DependencyRequirement requirement = new DependencyRequirement("Gemfile", "~> 7.0", List.of("default"));
			Dependency rails = new Dependency("rails", "7.0.1", List.of(requirement));

			// When
			Dependency updated = rails.updatedTo("7.1.0",
					List.of(new DependencyRequirement("Gemfile", "~> 7.1", List.of("default"))));

			// Then
			assertThat(updated.version()).isEqualTo("7.1.0");
			assertThat(updated.previousVersion()).isEqualTo("7.0.1");
			assertThat(updated.previousRequirements()).containsExactly(requirement);
			assertThat(updated.topLevel()).isTrue();
			assertThat(updated.isVersionUnchanged()).isFalse();
			assertThat(rails.isVersionUnchanged()).isFalse();
		}

		@Test
		@DisplayName("Should recognise development-only dependencies")
		void shouldRecogniseDevelopmentOnly() {
			Dependency rspec = new Dependency("rspec", "3.0",
					List.of(new DependencyRequirement("Gemfile", "3.0", List.of("development", "test"))));
			Dependency mixed = new Dependency("pry", "1.0",
					List.of(new DependencyRequirement("Gemfile", "1.0", List.of("development", "default"))));
			Dependency ungrouped = new Dependency("rake", "13.0",
					List.of(new DependencyRequirement("Gemfile", "13.0", List.of())));

			assertThat(rspec.isDevelopmentOnly()).isTrue();
			assertThat(mixed.isDevelopmentOnly()).isFalse();
			assertThat(ungrouped.isDevelopmentOnly()).isFalse();
		}

		@Test
		@DisplayName("Should serialize without derived properties")
		void shouldSerializeDependency() throws JsonProcessingException {
			Dependency dependency = new Dependency("rails", "7.0.1", List.of()).updatedTo("7.1.0", List.of());

			JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(dependency));

			assertThat(json.path("previous-version").asText()).isEqualTo("7.0.1");
			assertThat(json.path("top-level").asBoolean()).isTrue();
			assertThat(json.has("development-only")).isFalse();
			assertThat(json.has("version-unchanged")).isFalse();
		}

	}

	@Nested
	@DisplayName("Change Tests")
	class ChangeTest {

		@Test
		@DisplayName("Should identify files by directory and name")
		void shouldKeyFilesByDirectoryAndName() {
			DependencyFile file = new DependencyFile("/api", "package.json", "{}");

			assertThat(file.withContent("{ }").key()).isEqualTo(file.key());
			assertThat(new DependencyFile("/web", "package.json", "{}").key()).isNotEqualTo(file.key());
		}

		@Test
		@DisplayName("Should report an empty grouped change")
		void shouldCreateEmptyChange() {
			DependencyChange change = DependencyChange.empty(new DependencyGroup("libs", null, null));

			assertThat(change.isEmpty()).isTrue();
			assertThat(change.isGroupedUpdate()).isTrue();
			assertThat(change.dependencyNames()).isEmpty();
		}

		@Test
		@DisplayName("Should list distinct dependency names of a pull request")
		void shouldListDistinctNames() {
			ExistingPullRequest pullRequest = new ExistingPullRequest("libs",
					List.of(new PullRequestDependency("b", "1.0", "/api"), new PullRequestDependency("a", "1.0", "/api"),
							new PullRequestDependency("b", "1.0", "/web")));

			assertThat(pullRequest.dependencyNames()).containsExactly("b", "a");
		}

	}

	@Nested
	@DisplayName("Job Tests")
	class JobTest {

		@Test
		@DisplayName("Should apply defaults to a minimal job")
		void shouldApplyDefaults() throws JsonProcessingException {
			JobDefinition job = objectMapper.readValue("{ \"dependency-group-to-refresh\": \"libs\" }",
					JobDefinition.class);

			assertThat(job.directory()).isEqualTo(JobDefinition.DEFAULT_DIRECTORY);
			assertThat(job.directoriesToProcess()).containsExactly("/");
			assertThat(job.isMultiDirectory()).isFalse();
			assertThat(job.allowedUpdates()).isEqualTo(AllowedUpdates.DIRECT);
			assertThat(job.dependencies()).isEmpty();
			assertThat(job.experiments()).isEmpty();
		}

		@Test
		@DisplayName("Should process configured directories in order")
		void shouldProcessDirectoriesInOrder() {
			JobDefinition job = JobDefinition.forGroupRefresh("libs", List.of("a"), List.of())
				.withDirectories(List.of("/web", "/api"));

			assertThat(job.directoriesToProcess()).containsExactly("/web", "/api");
			assertThat(job.isMultiDirectory()).isTrue();
			assertThat(job.withDependencyGroupToRefresh("tools").dependencyGroupToRefresh()).isEqualTo("tools");
		}

		@Test
		@DisplayName("Should read experiments and find groups by name")
		void shouldReadExperimentsAndGroups() {
			DependencyGroup libs = new DependencyGroup("libs", AppliesTo.SECURITY_UPDATES, null);
			JobDefinition job = new JobDefinition(null, List.of(), "libs", List.of(libs), "/", null, true, false,
					AllowedUpdates.ALL, Map.of("some_experiment", true));

			assertThat(job.isExperimentEnabled("some_experiment")).isTrue();
			assertThat(job.isExperimentEnabled("other")).isFalse();
			assertThat(job.findGroup("libs")).hasValueSatisfying(group -> assertThat(group.isSecurityGroup()).isTrue());
			assertThat(job.findGroup(null)).isEmpty();
		}

	}

	@Nested
	@DisplayName("Wire Value Tests")
	class WireValueTest {

		@Test
		@DisplayName("Should write closure reasons as their wire values")
		void shouldWriteClosureReasons() throws JsonProcessingException {
			assertThat(objectMapper.writeValueAsString(ClosureReason.DEPENDENCY_GROUP_EMPTY))
				.isEqualTo("\"dependency_group_empty\"");
			assertThat(ClosureReason.UPDATE_NO_LONGER_POSSIBLE.description()).isEqualTo("update no longer possible");
		}

		@Test
		@DisplayName("Should read applies-to and allowed-updates values")
		void shouldReadEnums() throws JsonProcessingException {
			assertThat(objectMapper.readValue("\"security-updates\"", AppliesTo.class))
				.isEqualTo(AppliesTo.SECURITY_UPDATES);
			assertThat(objectMapper.readValue("\"all\"", AllowedUpdates.class)).isEqualTo(AllowedUpdates.ALL);
		}

	}

}
