package org.lnwatch.repository.hsqldb;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lnwatch.repository.DataException;
import org.lnwatch.repository.Repository;
import org.lnwatch.repository.SweepRepository;
import org.lnwatch.settings.Settings;

/**
 * One HSQLDB session borrowed from the factory's pool, holding a single open transaction at a time.
 */
public class HSQLDBRepository implements Repository {

	private static final Logger LOGGER = LogManager.getLogger(HSQLDBRepository.class);

	private static final String SESSION_STATE_SQL = "SELECT transaction_size FROM information_schema.system_sessions WHERE session_id = ?";

	private Connection connection;
	private final long sessionId;
	private final Long slowQueryThreshold;
	/** SQL run in current transaction, only kept when slow queries are being reported. */
	private List<String> transactionSql;
	private final Map<String, PreparedStatement> statementCache = new HashMap<>();

	private final SweepRepository sweepRepository = new HSQLDBSweepRepository(this);

	/* package */ HSQLDBRepository(Connection connection) throws DataException {
		this.connection = connection;

		this.slowQueryThreshold = Settings.getInstance().getSlowQueryThreshold();
		if (this.slowQueryThreshold != null)
			this.transactionSql = new ArrayList<>();

		try (Statement stmt = this.connection.createStatement();
				ResultSet resultSet = stmt.executeQuery("SELECT SESSION_ID()")) {
			if (!resultSet.next())
				throw new DataException("Repository didn't report a session ID");

			this.sessionId = resultSet.getLong(1);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch session ID from repository", e);
		}

		this.warnIfTransactionOpen("opening session");
	}

	@Override
	public SweepRepository getSweepRepository() {
		return this.sweepRepository;
	}

	// Transaction boundaries

	@Override
	public void saveChanges() throws DataException {
		long start = System.currentTimeMillis();

		try {
			this.connection.commit();
		} catch (SQLException e) {
			throw new DataException("commit error", e);
		} finally {
			this.reportIfSlow("COMMIT", start);
			this.endTransaction("commit");
		}
	}

	@Override
	public void discardChanges() throws DataException {
		try {
			this.connection.rollback();
		} catch (SQLException e) {
			throw new DataException("rollback error", e);
		} finally {
			this.endTransaction("rollback");
		}
	}

	private void endTransaction(String context) throws DataException {
		// Checked before clearing SQL log so any leftovers can be reported
		this.warnIfTransactionOpen(context);

		if (this.transactionSql != null)
			this.transactionSql.clear();
	}

	/** Uncommitted changes are discarded and the connection returned to the pool. */
	@Override
	public void close() throws DataException {
		if (this.connection == null) {
			LOGGER.warn(() -> String.format("[Session %d] repository already closed", this.sessionId));
			return;
		}

		try {
			if (this.hasUncommittedChanges()) {
				LOGGER.warn(() -> String.format("[Session %d] discarding uncommitted changes on close", this.sessionId));
				this.logTransactionSql();
				this.connection.rollback();
			}

			this.statementCache.clear();
			this.transactionSql = null;

			this.connection.close();
			this.connection = null;
		} catch (SQLException e) {
			throw new DataException("Error while closing repository", e);
		}
	}

	// SQL helpers used by sub-repositories

	private PreparedStatement prepare(String sql) throws SQLException {
		if (this.transactionSql != null)
			this.transactionSql.add(sql);

		return this.cachedStatement(sql);
	}

	private PreparedStatement cachedStatement(String sql) throws SQLException {
		// Cached statements are never closed, so HSQLDB can reuse their compiled form
		PreparedStatement statement = this.statementCache.get(sql);
		if (statement != null && !statement.isClosed()) {
			statement.clearParameters();
			return statement;
		}

		statement = this.connection.prepareStatement(sql);
		this.statementCache.put(sql, statement);
		return statement;
	}

	private static void bind(PreparedStatement statement, Object... params) throws SQLException {
		for (int i = 0; i < params.length; ++i)
			statement.setObject(i + 1, params[i]);
	}

	/**
	 * Runs query, returning its ResultSet already positioned on the first row.
	 *
	 * @return ResultSet, or null if query matched no rows
	 */
	/* package */ ResultSet checkedExecute(String sql, Object... params) throws SQLException {
		PreparedStatement statement = this.prepare(sql);
		bind(statement, params);

		long start = System.currentTimeMillis();
		boolean hasResultSet = statement.execute();
		this.reportIfSlow(sql, start);

		if (!hasResultSet)
			throw new SQLException("Query produced no ResultSet: " + sql);

		ResultSet resultSet = statement.getResultSet();
		if (!resultSet.next())
			return null;

		return resultSet;
	}

	/** Runs INSERT/UPDATE/DELETE/MERGE, returning changed row count. */
	/* package */ int executeCheckedUpdate(String sql, Object... params) throws SQLException {
		PreparedStatement statement = this.prepare(sql);
		bind(statement, params);

		long start = System.currentTimeMillis();
		int rowCount = statement.executeUpdate();
		this.reportIfSlow(sql, start);

		if (rowCount < 0)
			throw new SQLException("Database returned invalid row count");

		return rowCount;
	}

	/** Whether any row of <tt>tableName</tt> matches <tt>whereClause</tt>, which may contain "?" placeholders. */
	/* package */ boolean exists(String tableName, String whereClause, Object... params) throws SQLException {
		String sql = "SELECT TRUE FROM " + tableName + " WHERE " + whereClause + " LIMIT 1";

		try (ResultSet resultSet = this.checkedExecute(sql, params)) {
			return resultSet != null;
		}
	}

	/* package */ int delete(String tableName, String whereClause, Object... params) throws SQLException {
		return this.executeCheckedUpdate("DELETE FROM " + tableName + " WHERE " + whereClause, params);
	}

	// Diagnostics

	private void reportIfSlow(String what, long start) {
		if (this.slowQueryThreshold == null)
			return;

		long elapsed = System.currentTimeMillis() - start;
		if (elapsed <= this.slowQueryThreshold)
			return;

		LOGGER.info(() -> String.format("[Session %d] HSQLDB took %d ms: %s", this.sessionId, elapsed, what));
		this.logTransactionSql();
	}

	private void logTransactionSql() {
		if (this.transactionSql == null || this.transactionSql.isEmpty())
			return;

		LOGGER.info(() -> String.format("[Session %d] SQL in this transaction:", this.sessionId));
		for (String sql : this.transactionSql)
			LOGGER.info(() -> String.format("[Session %d] %s", this.sessionId, sql));
	}

	private boolean hasUncommittedChanges() throws SQLException {
		PreparedStatement statement = this.cachedStatement(SESSION_STATE_SQL);
		statement.setLong(1, this.sessionId);

		try (ResultSet resultSet = statement.executeQuery()) {
			return resultSet.next() && resultSet.getInt(1) != 0;
		}
	}

	private void warnIfTransactionOpen(String context) throws DataException {
		try {
			if (!this.hasUncommittedChanges())
				return;
		} catch (SQLException e) {
			throw new DataException("Error checking repository state after " + context, e);
		}

		LOGGER.warn(() -> String.format("[Session %d] uncommitted changes after %s", this.sessionId, context));
		this.logTransactionSql();
	}

}
