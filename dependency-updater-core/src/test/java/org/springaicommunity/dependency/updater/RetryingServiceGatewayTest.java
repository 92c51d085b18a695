package org.springaicommunity.dependency.updater;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingServiceGateway}.
 *
 * Tests retry logic and error classification.
 */
@DisplayName("RetryingServiceGateway Tests")
@ExtendWith(MockitoExtension.class)
class RetryingServiceGatewayTest {

	private static final DependencyChange CHANGE = new DependencyChange(
			List.of(new Dependency("lib-a", "1.0", List.of()).updatedTo("2.0", List.of())), List.of(),
			new DependencyGroup("libs", null, null));

	@Mock
	private ServiceGateway mockDelegate;

	private RetryingServiceGateway retryingGateway;

	@BeforeEach
	void setUp() {
		// Use minimal delay for fast tests
		retryingGateway = RetryingServiceGateway.builder().wrapping(mockDelegate).maxRetries(3).initialDelayMs(1).build();
	}

	@Nested
	@DisplayName("Delegation Tests")
	class DelegationTest {

		@Test
		@DisplayName("Should delegate findExistingPullRequest() to wrapped gateway")
		void shouldDelegateFind() {
			ExistingPullRequest pullRequest = new ExistingPullRequest("libs", List.of());
			when(mockDelegate.findExistingPullRequest("libs")).thenReturn(Optional.of(pullRequest));

			assertThat(retryingGateway.findExistingPullRequest("libs")).contains(pullRequest);
			verify(mockDelegate, times(1)).findExistingPullRequest("libs");
		}

		@Test
		@DisplayName("Should delegate closePullRequest() to wrapped gateway")
		void shouldDelegateClose() {
			retryingGateway.closePullRequest(List.of("lib-a"), ClosureReason.DEPENDENCIES_CHANGED);

			verify(mockDelegate).closePullRequest(List.of("lib-a"), ClosureReason.DEPENDENCIES_CHANGED);
		}

	}

	@Nested
	@DisplayName("Retry Tests")
	class RetryTest {

		@Test
		@DisplayName("Should retry transient failures until success")
		void shouldRetryTransientFailures() {
			doThrow(new ServiceGatewayException("Bad gateway", 502))
				.doThrow(new ServiceGatewayException("Too many requests", 429))
				.doNothing()
				.when(mockDelegate)
				.createPullRequest(CHANGE, "sha");

			retryingGateway.createPullRequest(CHANGE, "sha");

			verify(mockDelegate, times(3)).createPullRequest(CHANGE, "sha");
		}

		@Test
		@DisplayName("Should retry connection failures")
		void shouldRetryConnectionFailures() {
			doThrow(new ServiceGatewayException("Connection reset", new java.io.IOException("reset"))).doNothing()
				.when(mockDelegate)
				.updatePullRequest(CHANGE, "sha");

			retryingGateway.updatePullRequest(CHANGE, "sha");

			verify(mockDelegate, times(2)).updatePullRequest(CHANGE, "sha");
		}

		@Test
		@DisplayName("Should not retry client errors")
		void shouldNotRetryClientErrors() {
			doThrow(new ServiceGatewayException("Unprocessable", 422)).when(mockDelegate).createPullRequest(CHANGE, "sha");

			assertThatThrownBy(() -> retryingGateway.createPullRequest(CHANGE, "sha"))
				.isInstanceOf(ServiceGatewayException.class)
				.extracting(e -> ((ServiceGatewayException) e).getStatusCode())
				.isEqualTo(422);
			verify(mockDelegate, times(1)).createPullRequest(CHANGE, "sha");
		}

		@Test
		@DisplayName("Should give up after max retries")
		void shouldGiveUpAfterMaxRetries() {
			doThrow(new ServiceGatewayException("Unavailable", 503)).when(mockDelegate).createPullRequest(CHANGE, "sha");

			assertThatThrownBy(() -> retryingGateway.createPullRequest(CHANGE, "sha"))
				.isInstanceOf(ServiceGatewayException.class);
			verify(mockDelegate, times(4)).createPullRequest(CHANGE, "sha");
		}

		@Test
		@DisplayName("Should not retry non-gateway exceptions")
		void shouldNotRetryOtherExceptions() {
			when(mockDelegate.findExistingPullRequest("libs")).thenThrow(new IllegalStateException("bug"));

			assertThatThrownBy(() -> retryingGateway.findExistingPullRequest("libs"))
				.isInstanceOf(IllegalStateException.class);
			verify(mockDelegate, times(1)).findExistingPullRequest("libs");
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should require a delegate")
		void shouldRequireDelegate() {
			assertThatThrownBy(() -> RetryingServiceGateway.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping()");
		}

		@Test
		@DisplayName("Should reject negative max retries")
		void shouldRejectNegativeRetries() {
			assertThatThrownBy(() -> RetryingServiceGateway.builder().wrapping(mockDelegate).maxRetries(-1).build())
				.isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should reject non-positive delay")
		void shouldRejectNonPositiveDelay() {
			assertThatThrownBy(() -> RetryingServiceGateway.builder().wrapping(mockDelegate).initialDelayMs(0).build())
				.isInstanceOf(IllegalStateException.class);
		}

	}

}
