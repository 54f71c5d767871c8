package org.lnwatch.repository;

import java.util.List;
import java.util.Set;

import org.bitcoinj.core.Transaction;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.data.ChannelInfoData;

/**
 * Watchtower storage: pre-signed sweep transactions, per channel and prevout,
 * plus the channels (funding outpoint and address) we watch on behalf of clients.
 */
public interface SweepRepository {

	// Sweep transactions

	/** Returns all stored sweep transactions spending <tt>prevout</tt> for channel <tt>fundingOutpoint</tt>, across all commitment numbers. */
	public List<Transaction> getSweepTransactions(Outpoint fundingOutpoint, Outpoint prevout) throws DataException;

	/** Returns funding outpoints that have at least one stored sweep transaction. */
	public Set<Outpoint> getSweepFundingOutpoints() throws DataException;

	public void addSweepTransaction(Outpoint fundingOutpoint, int ctn, Outpoint prevout, byte[] rawTransaction) throws DataException;

	public int countSweepTransactions(Outpoint fundingOutpoint) throws DataException;

	/** Returns highest commitment number stored for channel, or 0 if none. */
	public int getTurnNumber(Outpoint fundingOutpoint) throws DataException;

	public int deleteSweepTransactions(Outpoint fundingOutpoint) throws DataException;

	// Channels

	public boolean channelExists(Outpoint fundingOutpoint) throws DataException;

	public void saveChannel(ChannelInfoData channelInfoData) throws DataException;

	/** Returns address of channel, or null if unknown. */
	public String getChannelAddress(Outpoint fundingOutpoint) throws DataException;

	public List<ChannelInfoData> getAllChannels() throws DataException;

	public int deleteChannel(Outpoint fundingOutpoint) throws DataException;

}
