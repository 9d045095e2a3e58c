package org.javai.askdata.generation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.askdata.prompt.ConversationHistory;
import org.javai.askdata.prompt.GenerationRequest;
import org.javai.askdata.prompt.PromptComposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains a candidate query from the oracle.
 *
 * <p>Each oracle call runs on a worker thread so the wait can be bounded and abandoned.
 * When a response yields no statement, the request is re-composed in its strict form and
 * retried, at most {@code maxRetries} times. Refusals, timeouts and transport errors end
 * generation immediately. Every call is recorded in the returned {@link GenerationMetrics}.</p>
 */
public final class QueryGenerator {

	private static final Logger logger = LoggerFactory.getLogger(QueryGenerator.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
	public static final int DEFAULT_MAX_RETRIES = 1;
	public static final int RETRY_LIMIT = 2;

	private static final ExecutorService SHARED_EXECUTOR = Executors.newCachedThreadPool(new OracleThreadFactory());

	private final Oracle oracle;
	private final PromptComposer composer;
	private final Duration timeout;
	private final int maxRetries;
	private final ExecutorService executor;

	public QueryGenerator(Oracle oracle, PromptComposer composer) {
		this(oracle, composer, DEFAULT_TIMEOUT, DEFAULT_MAX_RETRIES);
	}

	public QueryGenerator(Oracle oracle, PromptComposer composer, Duration timeout, int maxRetries) {
		this(oracle, composer, timeout, maxRetries, SHARED_EXECUTOR);
	}

	public QueryGenerator(Oracle oracle, PromptComposer composer, Duration timeout, int maxRetries,
			ExecutorService executor) {
		this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
		this.composer = Objects.requireNonNull(composer, "composer must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		if (timeout == null || timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		if (maxRetries < 0 || maxRetries > RETRY_LIMIT) {
			throw new IllegalArgumentException("maxRetries must be within [0, " + RETRY_LIMIT + "]");
		}
		this.timeout = timeout;
		this.maxRetries = maxRetries;
	}

	public GenerationResult generate(GenerationRequest request) {
		return generate(request, ConversationHistory.empty());
	}

	/**
	 * Generates a candidate query for the request.
	 *
	 * @param request the composed request
	 * @param history the history the request was composed with, reused for strict retries
	 * @return the candidate, possibly without a statement, and the attempts made
	 * @throws OracleUnavailableException if the oracle reports a transport error
	 * @throws OracleTimeoutException if the oracle does not answer in time
	 * @throws GenerationCancelledException if the calling thread is interrupted
	 */
	public GenerationResult generate(GenerationRequest request, ConversationHistory history) {
		Objects.requireNonNull(request, "request must not be null");
		List<GenerationAttempt> attempts = new ArrayList<>();
		GenerationRequest current = request;
		CandidateQuery candidate = null;

		for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
			if (attempt > 1) {
				current = composer.composeStrict(request, history);
				logger.warn("No SQL statement in oracle response; retrying with strict prompt (attempt {} of {})",
						attempt, maxRetries + 1);
			}
			long started = System.nanoTime();
			String text;
			try {
				text = callWithTimeout(OracleRequest.from(current));
			}
			catch (OracleTimeoutException e) {
				attempts.add(attempt(attempt, current, AttemptOutcome.TIMEOUT, started, e.getMessage()));
				logger.warn("Oracle timed out after {} ms", timeout.toMillis());
				throw new OracleTimeoutException(timeout, metrics(attempts));
			}
			catch (OracleUnavailableException e) {
				attempts.add(attempt(attempt, current, AttemptOutcome.TRANSPORT_ERROR, started, e.getMessage()));
				logger.warn("Oracle unavailable: {}", e.getMessage());
				throw new OracleUnavailableException(e.getMessage(), e.getCause() != null ? e.getCause() : e,
						metrics(attempts));
			}
			catch (GenerationCancelledException e) {
				attempts.add(attempt(attempt, current, AttemptOutcome.CANCELLED, started, e.getMessage()));
				throw new GenerationCancelledException(e.getMessage(), e.getCause(), metrics(attempts));
			}

			candidate = SqlExtractor.toCandidate(text);
			if (candidate.refused()) {
				attempts.add(attempt(attempt, current, AttemptOutcome.REFUSED, started, candidate.rawText()));
				logger.info("Oracle refused the question: {}", candidate.rawText());
				return new GenerationResult(candidate, metrics(attempts));
			}
			if (candidate.hasStatement()) {
				attempts.add(attempt(attempt, current, AttemptOutcome.SUCCESS, started, null));
				return new GenerationResult(candidate, metrics(attempts));
			}
			attempts.add(attempt(attempt, current, AttemptOutcome.EMPTY, started, "no SQL statement found"));
		}

		logger.warn("Oracle produced no SQL statement after {} attempt(s)", attempts.size());
		return new GenerationResult(candidate, metrics(attempts));
	}

	private String callWithTimeout(OracleRequest request) {
		Future<OracleResponse> future = executor.submit(() -> oracle.complete(request));
		try {
			OracleResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
			return response != null ? response.text() : "";
		}
		catch (TimeoutException e) {
			future.cancel(true);
			throw new OracleTimeoutException(timeout);
		}
		catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new GenerationCancelledException("Interrupted while waiting for the oracle", e);
		}
		catch (CancellationException e) {
			throw new GenerationCancelledException("Oracle call was cancelled", e);
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof OracleUnavailableException unavailable) {
				throw unavailable;
			}
			throw new OracleUnavailableException("Oracle call failed: " + cause.getMessage(), cause);
		}
	}

	private GenerationAttempt attempt(int number, GenerationRequest request, AttemptOutcome outcome,
			long startedNanos, String details) {
		long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
		return new GenerationAttempt(oracle.modelId(), number, request.strict(), outcome, millis, details);
	}

	private GenerationMetrics metrics(List<GenerationAttempt> attempts) {
		return new GenerationMetrics(oracle.modelId(), attempts);
	}

	public Duration timeout() {
		return timeout;
	}

	public int maxRetries() {
		return maxRetries;
	}

	private static final class OracleThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "oracle-call-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
