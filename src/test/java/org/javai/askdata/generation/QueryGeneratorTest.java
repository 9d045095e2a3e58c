package org.javai.askdata.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.javai.askdata.prompt.GenerationRequest;
import org.javai.askdata.prompt.PromptComposer;
import org.javai.askdata.schema.SchemaDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryGeneratorTest {

	private final PromptComposer composer = new PromptComposer();
	private final SchemaDescriptor schema = SchemaDescriptor.builder()
			.addColumn("transactions", "amount", "REAL")
			.build();
	private final GenerationRequest request = composer.compose("What is the total amount?", schema);
	private final CountDownLatch release = new CountDownLatch(1);

	@AfterEach
	void releaseBlockedOracles() {
		release.countDown();
	}

	private static ScriptedOracle answering(String... responses) {
		return new ScriptedOracle(List.of(responses));
	}

	@Nested
	@DisplayName("Successful generation")
	class Success {

		@Test
		@DisplayName("returns the extracted statement after one call")
		void singleCall() {
			ScriptedOracle oracle = answering("SELECT SUM(amount) FROM transactions");

			GenerationResult result = new QueryGenerator(oracle, composer).generate(request);

			assertThat(result.candidate().sql()).contains("SELECT SUM(amount) FROM transactions");
			assertThat(result.metrics().totalAttempts()).isEqualTo(1);
			assertThat(result.metrics().succeeded()).isTrue();
			assertThat(result.metrics().modelId()).isEqualTo("scripted");
			assertThat(oracle.requests).hasSize(1);
			assertThat(oracle.requests.get(0).temperature()).isEqualTo(PromptComposer.DEFAULT_TEMPERATURE);
			assertThat(oracle.requests.get(0).maxTokens()).isEqualTo(PromptComposer.DEFAULT_MAX_TOKENS);
		}

		@Test
		@DisplayName("retries an empty response with the strict prompt")
		void retriesWithStrictPrompt() {
			ScriptedOracle oracle = answering("Sorry, I cannot help.", "SELECT 1");

			GenerationResult result = new QueryGenerator(oracle, composer).generate(request);

			assertThat(result.candidate().hasStatement()).isTrue();
			assertThat(result.metrics().attempts())
					.extracting(GenerationAttempt::outcome)
					.containsExactly(AttemptOutcome.EMPTY, AttemptOutcome.SUCCESS);
			assertThat(result.metrics().attempts().get(1).strict()).isTrue();
			assertThat(oracle.requests.get(0).prompt()).doesNotContain("RETRY:");
			assertThat(oracle.requests.get(1).prompt()).contains("RETRY:");
		}
	}

	@Nested
	@DisplayName("Retry budget")
	class RetryBudget {

		@Test
		@DisplayName("never calls the oracle more than maxRetries + 1 times")
		void capsRetries() {
			for (int maxRetries = 0; maxRetries <= QueryGenerator.RETRY_LIMIT; maxRetries++) {
				ScriptedOracle oracle = answering("nothing", "nothing", "nothing", "nothing", "nothing");
				QueryGenerator generator = new QueryGenerator(oracle, composer, Duration.ofSeconds(5), maxRetries);

				GenerationResult result = generator.generate(request);

				assertThat(result.candidate().hasStatement()).isFalse();
				assertThat(oracle.requests).hasSize(maxRetries + 1);
				assertThat(result.metrics().totalAttempts()).isEqualTo(maxRetries + 1);
				assertThat(result.metrics().succeeded()).isFalse();
			}
		}

		@Test
		@DisplayName("rejects a retry budget above the limit")
		void rejectsLargeBudget() {
			assertThatThrownBy(() -> new QueryGenerator(answering(), composer, Duration.ofSeconds(1), 3))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new QueryGenerator(answering(), composer, Duration.ofSeconds(1), -1))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("does not retry a refusal")
		void refusalNotRetried() {
			ScriptedOracle oracle = answering(PromptComposer.REFUSAL_SENTINEL, "SELECT 1");

			GenerationResult result = new QueryGenerator(oracle, composer).generate(request);

			assertThat(result.candidate().refused()).isTrue();
			assertThat(oracle.requests).hasSize(1);
			assertThat(result.metrics().finalAttempt().outcome()).isEqualTo(AttemptOutcome.REFUSED);
		}
	}

	@Nested
	@DisplayName("Failures")
	class Failures {

		@Test
		@DisplayName("times out without retrying")
		void timeoutNotRetried() {
			List<OracleRequest> calls = new ArrayList<>();
			Oracle blocking = req -> {
				synchronized (calls) {
					calls.add(req);
				}
				try {
					release.await(10, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return new OracleResponse("SELECT 1");
			};
			QueryGenerator generator = new QueryGenerator(blocking, composer, Duration.ofMillis(100), 2);

			OracleTimeoutException thrown = catchThrowableOfType(() -> generator.generate(request),
					OracleTimeoutException.class);

			assertThat(thrown).isNotNull();
			assertThat(thrown.timeout()).isEqualTo(Duration.ofMillis(100));
			assertThat(thrown.metrics().totalAttempts()).isEqualTo(1);
			assertThat(thrown.metrics().finalAttempt().outcome()).isEqualTo(AttemptOutcome.TIMEOUT);
			synchronized (calls) {
				assertThat(calls).hasSize(1);
			}
		}

		@Test
		@DisplayName("reports transport errors without retrying")
		void transportErrorNotRetried() {
			List<OracleRequest> calls = new ArrayList<>();
			Oracle failing = req -> {
				calls.add(req);
				throw new OracleUnavailableException("connection refused");
			};

			OracleUnavailableException thrown = catchThrowableOfType(
					() -> new QueryGenerator(failing, composer).generate(request), OracleUnavailableException.class);

			assertThat(thrown).hasMessageContaining("connection refused");
			assertThat(thrown.metrics().finalAttempt().outcome()).isEqualTo(AttemptOutcome.TRANSPORT_ERROR);
			assertThat(calls).hasSize(1);
		}

		@Test
		@DisplayName("wraps unexpected oracle exceptions as unavailability")
		void wrapsUnexpectedExceptions() {
			Oracle broken = req -> {
				throw new IllegalStateException("bad state");
			};

			assertThatThrownBy(() -> new QueryGenerator(broken, composer).generate(request))
					.isInstanceOf(OracleUnavailableException.class)
					.hasMessageContaining("bad state");
		}

		@Test
		@DisplayName("abandons the call when the calling thread is interrupted")
		void interrupted() {
			Oracle blocking = req -> {
				try {
					release.await(10, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return new OracleResponse("SELECT 1");
			};
			QueryGenerator generator = new QueryGenerator(blocking, composer, Duration.ofSeconds(5), 1);

			Thread.currentThread().interrupt();
			try {
				assertThatThrownBy(() -> generator.generate(request))
						.isInstanceOf(GenerationCancelledException.class);
				assertThat(Thread.currentThread().isInterrupted()).isTrue();
			}
			finally {
				Thread.interrupted();
			}
		}
	}

	private static final class ScriptedOracle implements Oracle {

		private final Iterator<String> responses;
		private final List<OracleRequest> requests = new ArrayList<>();

		ScriptedOracle(List<String> responses) {
			this.responses = responses.iterator();
		}

		@Override
		public synchronized OracleResponse complete(OracleRequest request) {
			requests.add(request);
			return new OracleResponse(responses.hasNext() ? responses.next() : "");
		}

		@Override
		public String modelId() {
			return "scripted";
		}
	}
}
