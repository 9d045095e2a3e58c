package org.javai.askdata.execution;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.askdata.result.ColumnType;
import org.javai.askdata.result.QueryResult;
import org.javai.askdata.result.ResultColumn;
import org.javai.askdata.store.ReadOnlyConnectionFactory;
import org.javai.askdata.validation.AdmittedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes admitted queries over JDBC.
 *
 * <p>Every execution opens its own connection from a {@link ReadOnlyConnectionFactory}, so the
 * store refuses writes even if one slipped past validation. The query runs on a worker thread and
 * the caller waits at most the configured timeout; past that the statement is cancelled. Not every
 * driver honours {@link Statement#setQueryTimeout(int)} for a single long-running step, so the
 * wait is bounded here as well. One row beyond the limit is fetched to detect truncation.</p>
 */
public final class JdbcQueryExecutor implements QueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

	private static final ExecutorService SHARED_EXECUTOR = Executors.newCachedThreadPool(new QueryThreadFactory());

	private final ReadOnlyConnectionFactory connections;
	private final ExecutorService executor;

	public JdbcQueryExecutor(ReadOnlyConnectionFactory connections) {
		this(connections, SHARED_EXECUTOR);
	}

	public JdbcQueryExecutor(ReadOnlyConnectionFactory connections, ExecutorService executor) {
		this.connections = Objects.requireNonNull(connections, "connections must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
	}

	@Override
	public QueryResult execute(AdmittedQuery query, ExecutionLimits limits) {
		Objects.requireNonNull(query, "query must not be null");
		ExecutionLimits effective = limits != null ? limits : ExecutionLimits.defaults();
		long started = System.nanoTime();
		try (Connection connection = connections.open();
				Statement statement = connection.createStatement()) {
			statement.setQueryTimeout(effective.timeoutSeconds());
			statement.setMaxRows(effective.fetchLimit());
			QueryResult result = await(statement, query, effective);
			logger.info("Query returned {} row(s){} in {} ms", result.rowCount(),
					result.truncated() ? " (truncated)" : "", elapsedMillis(started));
			return result;
		}
		catch (SQLException e) {
			long elapsed = elapsedMillis(started);
			if (e instanceof SQLTimeoutException || elapsed >= effective.timeout().toMillis()) {
				logger.warn("Query timed out after {} ms: {}", elapsed, query.sql());
				throw new ExecutionTimeoutException(effective.timeout(), e);
			}
			logger.warn("Query failed: {} ({})", e.getMessage(), query.sql());
			throw new QueryExecutionException(e.getMessage(), e);
		}
	}

	private QueryResult await(Statement statement, AdmittedQuery query, ExecutionLimits limits) throws SQLException {
		Future<QueryResult> future = executor.submit(() -> {
			try (ResultSet resultSet = statement.executeQuery(query.sql())) {
				return read(resultSet, limits.maxRows());
			}
		});
		try {
			return future.get(limits.timeout().toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			cancel(statement, future);
			logger.warn("Query exceeded {} ms and was cancelled: {}", limits.timeout().toMillis(), query.sql());
			throw new ExecutionTimeoutException(limits.timeout(), e);
		}
		catch (InterruptedException e) {
			cancel(statement, future);
			Thread.currentThread().interrupt();
			logger.info("Query cancelled by caller: {}", query.sql());
			throw new ExecutionCancelledException(e);
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof SQLException sqlException) {
				throw sqlException;
			}
			if (cause instanceof RuntimeException runtimeException) {
				throw runtimeException;
			}
			throw new QueryExecutionException(String.valueOf(cause.getMessage()), cause);
		}
	}

	private static void cancel(Statement statement, Future<?> future) {
		try {
			statement.cancel();
		}
		catch (SQLException e) {
			logger.warn("Statement cancel failed: {}", e.getMessage());
		}
		future.cancel(true);
	}

	private static QueryResult read(ResultSet resultSet, int maxRows) throws SQLException {
		ResultSetMetaData metaData = resultSet.getMetaData();
		int columnCount = metaData.getColumnCount();
		List<String> labels = new ArrayList<>(columnCount);
		List<String> declaredTypes = new ArrayList<>(columnCount);
		for (int i = 1; i <= columnCount; i++) {
			labels.add(metaData.getColumnLabel(i));
			declaredTypes.add(metaData.getColumnTypeName(i));
		}

		List<List<Object>> rows = new ArrayList<>();
		boolean truncated = false;
		while (resultSet.next()) {
			if (rows.size() == maxRows) {
				truncated = true;
				break;
			}
			List<Object> row = new ArrayList<>(columnCount);
			for (int i = 1; i <= columnCount; i++) {
				row.add(resultSet.getObject(i));
			}
			rows.add(row);
		}

		List<ResultColumn> columns = new ArrayList<>(columnCount);
		for (int i = 0; i < columnCount; i++) {
			List<Object> values = new ArrayList<>(rows.size());
			for (List<Object> row : rows) {
				values.add(row.get(i));
			}
			ColumnType type = ColumnTypeInference.infer(declaredTypes.get(i), values);
			columns.add(new ResultColumn(labels.get(i), type));
		}
		return new QueryResult(columns, rows, truncated);
	}

	private static long elapsedMillis(long startedNanos) {
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
	}

	private static final class QueryThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "query-exec-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
