package org.springaicommunity.dependency.updater;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for ArgumentParser using plain JUnit only.
 */
@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private UpdaterProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new UpdaterProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@Test
		@DisplayName("Should parse job and output arguments")
		void shouldParseJobAndOutput() {
			String[] args = { "--job", "job.json", "-o", "out/result.json" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.jobFile).isEqualTo("job.json");
			assertThat(config.outputFile).isEqualTo("out/result.json");
		}

		@Test
		@DisplayName("Should use defaults when options are absent")
		void shouldUseDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "-j", "job.json" });

			assertThat(config.outputFile).isEqualTo("refresh-result.json");
			assertThat(config.maxRetries).isEqualTo(3);
			assertThat(config.groupName).isNull();
			assertThat(config.directories).isEmpty();
			assertThat(config.dryRun).isFalse();
			assertThat(config.force).isFalse();
		}

		@Test
		@DisplayName("Should parse boolean flags correctly")
		void shouldParseBooleanFlags() {
			String[] args = { "-j", "job.json", "--dry-run", "--verbose", "--force" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.dryRun).isTrue();
			assertThat(config.verbose).isTrue();
			assertThat(config.force).isTrue();
		}

		@Test
		@DisplayName("Should parse group and directory overrides")
		void shouldParseOverrides() {
			String[] args = { "-j", "job.json", "-g", "backend", "--directories", "/api, /web,," };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.groupName).isEqualTo("backend");
			assertThat(config.directories).containsExactly("/api", "/web");
		}

		@Test
		@DisplayName("Should carry parsed values into properties")
		void shouldBuildProperties() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "-j", "job.json", "--max-retries", "0", "-o", "r.json" });

			UpdaterProperties properties = config.toProperties(defaultProperties);

			assertThat(properties.getMaxRetries()).isZero();
			assertThat(properties.getOutputFile()).isEqualTo("r.json");
			assertThat(properties.getRetryDelayMs()).isEqualTo(defaultProperties.getRetryDelayMs());
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@ParameterizedTest
		@ValueSource(strings = { "-1", "11" })
		@DisplayName("Should reject out-of-range max retries")
		void shouldRejectOutOfRangeRetries(String value) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-j", "job.json", "--max-retries", value }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Max retries");
		}

		@Test
		@DisplayName("Should reject a non-numeric max retries")
		void shouldRejectNonNumericRetries() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-j", "job.json", "--max-retries", "many" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid max retries 'many'");
		}

		@Test
		@DisplayName("Should reject unknown options")
		void shouldRejectUnknownOptions() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--repo", "a/b" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown option: --repo");
		}

		@Test
		@DisplayName("Should reject an option without its value")
		void shouldRejectMissingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--job" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Missing value for job option");
		}

		@Test
		@DisplayName("Should require a job file when none is configured")
		void shouldRequireJobFile() {
			assumeTrue(EnvironmentSupport.get(UpdaterProperties.JOB_FILE_VARIABLE) == null);

			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--dry-run" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Job file is required");
		}

		@Test
		@DisplayName("Should reject a blank group name")
		void shouldRejectBlankGroup() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-j", "job.json", "-g", " " }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Group name cannot be empty");
		}

	}

	@Nested
	@DisplayName("Environment Tests")
	class EnvironmentTest {

		@TempDir
		Path tempDir;

		@Test
		@DisplayName("Should accept an existing job file")
		void shouldAcceptExistingJobFile() throws IOException {
			Path jobFile = Files.writeString(tempDir.resolve("job.json"), "{}");
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "-j", jobFile.toString() });

			assertThatCode(() -> argumentParser.validateEnvironment(config)).doesNotThrowAnyException();
		}

		@Test
		@DisplayName("Should reject a missing job file")
		void shouldRejectMissingJobFile() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "-j", tempDir.resolve("nope.json").toString() });

			assertThatThrownBy(() -> argumentParser.validateEnvironment(config)).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("nope.json");
		}

	}

	@Nested
	@DisplayName("Help Tests")
	class HelpTest {

		@Test
		@DisplayName("Should detect help without full parsing")
		void shouldDetectHelp() {
			assertThat(argumentParser.isHelpRequested(new String[] { "--bogus", "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "-j", "job.json" })).isFalse();
		}

		@Test
		@DisplayName("Should describe every option and the job variable")
		void shouldGenerateHelpText() {
			String help = argumentParser.generateHelpText();

			assertThat(help).contains("--job", "--output", "--group", "--directories", "--dry-run", "--verbose",
					"--max-retries", "--force", UpdaterProperties.JOB_FILE_VARIABLE, "refresh-result.json");
		}

	}

}
