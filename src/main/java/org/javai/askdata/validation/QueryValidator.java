package org.javai.askdata.validation;

import java.util.Optional;
import org.javai.askdata.generation.CandidateQuery;
import org.javai.askdata.schema.SchemaDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The safety gate between the oracle and the database.
 *
 * <p>Classifies a candidate query without changing it. Rules are applied in order and the
 * first one that matches decides the verdict:</p>
 * <ol>
 *   <li>no statement was extracted: {@link ReasonCode#NO_STATEMENT_FOUND}</li>
 *   <li>the statement does not begin with {@code SELECT}: {@link ReasonCode#NOT_READ_ONLY}</li>
 *   <li>a denylisted keyword appears anywhere in the raw or normalized text, or a terminator is
 *       followed by more text: {@link ReasonCode#DENYLIST_MATCH}</li>
 *   <li>more than one terminator: {@link ReasonCode#MULTI_STATEMENT}</li>
 *   <li>the statement does not parse as a SELECT ({@link ReasonCode#UNPARSEABLE}) or names a
 *       table missing from the schema ({@link ReasonCode#UNKNOWN_TABLE}), when the parse check is on</li>
 * </ol>
 *
 * <p>Validation is a pure function of the candidate text and the schema: identical input always
 * gives an identical verdict. Instances are immutable and safe to share between threads.</p>
 */
public final class QueryValidator {

	private static final Logger logger = LoggerFactory.getLogger(QueryValidator.class);

	private static final String READ_ONLY_KEYWORD = "select";

	private final SchemaDescriptor schema;
	private final ValidatorPolicy policy;
	private final Denylist denylist;
	private final StatementInspector inspector;

	public QueryValidator(SchemaDescriptor schema) {
		this(schema, ValidatorPolicy.defaults());
	}

	public QueryValidator(SchemaDescriptor schema, ValidatorPolicy policy) {
		this.schema = schema != null ? schema : SchemaDescriptor.empty();
		this.policy = policy != null ? policy : ValidatorPolicy.defaults();
		this.denylist = Denylist.withExtras(this.policy.extraDeniedKeywords());
		this.inspector = new StatementInspector(this.schema);
	}

	public ValidationVerdict validate(CandidateQuery candidate) {
		ValidationVerdict verdict = classify(candidate);
		if (verdict.admitted()) {
			logger.debug("Admitted: {}", verdict.admittedQuery().sql());
		}
		else {
			logger.warn("Rejected candidate query: reason={} matched={} detail={}",
					verdict.reasonCode(), verdict.matchedPattern(), verdict.detail());
		}
		return verdict;
	}

	private ValidationVerdict classify(CandidateQuery candidate) {
		if (candidate == null || !candidate.hasStatement()) {
			return ValidationVerdict.reject(ReasonCode.NO_STATEMENT_FOUND, null,
					"No SQL statement was found in the generated text");
		}
		String sql = candidate.extractedSql();

		String leading = SqlNormalizer.leadingWord(sql);
		if (!READ_ONLY_KEYWORD.equals(leading)) {
			return ValidationVerdict.reject(ReasonCode.NOT_READ_ONLY, leading.isEmpty() ? null : leading,
					"Only SELECT queries are allowed; statement begins with '" + leading + "'");
		}

		String normalized = SqlNormalizer.normalize(sql);
		Optional<Denylist.Match> match = denylist.firstMatch(sql);
		if (match.isEmpty()) {
			match = denylist.firstMatch(normalized);
		}
		if (match.isPresent()) {
			Denylist.Match found = match.get();
			return ValidationVerdict.reject(ReasonCode.DENYLIST_MATCH, found.keyword(),
					"Forbidden keyword '" + found.keyword() + "' (" + found.category() + ")");
		}
		if (SqlNormalizer.hasTextAfterTerminator(normalized)) {
			return ValidationVerdict.reject(ReasonCode.DENYLIST_MATCH, ";",
					"A statement separator is followed by further statement text");
		}

		if (SqlNormalizer.terminatorCount(normalized) > 1) {
			return ValidationVerdict.reject(ReasonCode.MULTI_STATEMENT, ";",
					"More than one statement terminator");
		}

		String statement = SqlNormalizer.withoutTrailingTerminator(normalized);
		if (policy.parseCheck()) {
			Optional<ValidationVerdict> rejection = inspector.inspect(statement);
			if (rejection.isPresent()) {
				return rejection.get();
			}
		}
		return ValidationVerdict.admit(new AdmittedQuery(statement, sql));
	}

	public SchemaDescriptor schema() {
		return schema;
	}

	public ValidatorPolicy policy() {
		return policy;
	}
}
