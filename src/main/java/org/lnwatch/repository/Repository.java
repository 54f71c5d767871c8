package org.lnwatch.repository;

public interface Repository extends AutoCloseable {

	public SweepRepository getSweepRepository();

	public void saveChanges() throws DataException;

	public void discardChanges() throws DataException;

	/** Returns session to its pool, discarding any uncommitted changes. */
	@Override
	public void close() throws DataException;

}
