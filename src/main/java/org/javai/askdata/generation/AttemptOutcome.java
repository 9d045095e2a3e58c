package org.javai.askdata.generation;

/**
 * Outcome of a single oracle call.
 *
 * <p>Used by the retry mechanism to decide whether another attempt is worthwhile.</p>
 */
public enum AttemptOutcome {
	/**
	 * A statement was extracted from the response.
	 */
	SUCCESS,

	/**
	 * The response contained no recognisable statement. Retried with the strict prompt.
	 */
	EMPTY,

	/**
	 * The oracle answered with the read-only refusal sentinel. Not retried.
	 */
	REFUSED,

	/**
	 * The bounded wait expired. Not retried.
	 */
	TIMEOUT,

	/**
	 * Network or API error prevented the call. Not retried.
	 */
	TRANSPORT_ERROR,

	/**
	 * The waiting thread was interrupted.
	 */
	CANCELLED
}
