package org.lnwatch.test.common;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.lnwatch.chain.ChainIndex;
import org.lnwatch.chain.ChainIndexException;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.chain.TxMinedInfo;

/** In-memory chain index, driven entirely by the test. */
public class TestChainIndex extends ChainIndex {

	private final NetworkParameters params;

	private final Map<String, Transaction> transactions = new HashMap<>();
	private final Map<String, TxMinedInfo> minedInfos = new HashMap<>();
	private final Map<Outpoint, String> spenders = new HashMap<>();
	private final Set<String> addresses = new HashSet<>();

	private boolean isUpToDate = true;
	private boolean isSynchronizing = true;
	private ChainIndexException failure = null;
	private int addAddressCount = 0;

	public TestChainIndex() {
		this.params = TransactionUtils.PARAMS;
	}

	// Test set-up

	/** Adds <tt>transaction</tt> as mined with <tt>confirmations</tt>, recording which outpoints it spends. */
	public void addMined(Transaction transaction, int confirmations) {
		this.add(transaction, new TxMinedInfo(confirmations > 0 ? 1000 : TxMinedInfo.TX_HEIGHT_UNCONFIRMED, confirmations));
	}

	/** Adds <tt>transaction</tt> as sitting in the mempool. */
	public void addUnconfirmed(Transaction transaction) {
		this.add(transaction, new TxMinedInfo(TxMinedInfo.TX_HEIGHT_UNCONFIRMED, 0));
	}

	/** Adds <tt>transaction</tt> as only known locally, i.e. never broadcast. */
	public void addLocal(Transaction transaction) {
		this.add(transaction, TxMinedInfo.local());
	}

	public synchronized void add(Transaction transaction, TxMinedInfo minedInfo) {
		String txid = transaction.getTxId().toString();

		this.transactions.put(txid, transaction);
		this.minedInfos.put(txid, minedInfo);

		for (TransactionInput input : transaction.getInputs())
			this.spenders.put(Outpoint.fromTransactionOutPoint(input.getOutpoint()), txid);
	}

	public synchronized void setMinedInfo(String txid, TxMinedInfo minedInfo) {
		this.minedInfos.put(txid, minedInfo);
	}

	/** Sets confirmations of already added transaction. */
	public void setConfirmations(Transaction transaction, int confirmations) {
		this.setMinedInfo(transaction.getTxId().toString(), new TxMinedInfo(1000, confirmations));
	}

	/** Forgets transaction body, but not who spends what. */
	public synchronized void forgetTransaction(String txid) {
		this.transactions.remove(txid);
	}

	public void setUpToDate(boolean isUpToDate) {
		this.isUpToDate = isUpToDate;
	}

	public void setSynchronizing(boolean isSynchronizing) {
		this.isSynchronizing = isSynchronizing;
	}

	/** Makes lookups throw <tt>failure</tt>, or succeed again if null. */
	public void setFailure(ChainIndexException failure) {
		this.failure = failure;
	}

	public synchronized Set<String> getAddresses() {
		return new HashSet<>(this.addresses);
	}

	public synchronized int getAddAddressCount() {
		return this.addAddressCount;
	}

	// ChainIndex

	@Override
	public NetworkParameters getNetworkParameters() {
		return this.params;
	}

	@Override
	public synchronized TxMinedInfo getTxHeight(String txid) throws ChainIndexException {
		this.maybeFail();

		return this.minedInfos.getOrDefault(txid, TxMinedInfo.local());
	}

	@Override
	public synchronized String getSpentOutpoint(String txid, int index) throws ChainIndexException {
		this.maybeFail();

		return this.spenders.get(new Outpoint(txid, index));
	}

	@Override
	public synchronized Transaction getTransaction(String txid) throws ChainIndexException {
		this.maybeFail();

		return this.transactions.get(txid);
	}

	@Override
	public synchronized boolean isMine(String address) {
		return this.addresses.contains(address);
	}

	@Override
	public synchronized void addAddress(String address) {
		++this.addAddressCount;
		this.addresses.add(address);
	}

	@Override
	public boolean isUpToDate() {
		return this.isUpToDate;
	}

	@Override
	public boolean isSynchronizing() {
		return this.isSynchronizing;
	}

	private void maybeFail() throws ChainIndexException {
		if (this.failure != null)
			throw this.failure;
	}

}
