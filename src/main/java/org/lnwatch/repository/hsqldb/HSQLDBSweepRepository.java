package org.lnwatch.repository.hsqldb;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.ProtocolException;
import org.bitcoinj.core.Transaction;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.data.ChannelInfoData;
import org.lnwatch.repository.DataException;
import org.lnwatch.repository.SweepRepository;
import org.lnwatch.settings.Settings;

public class HSQLDBSweepRepository implements SweepRepository {

	protected HSQLDBRepository repository;

	public HSQLDBSweepRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	// Sweep transactions

	@Override
	public List<Transaction> getSweepTransactions(Outpoint fundingOutpoint, Outpoint prevout) throws DataException {
		String sql = "SELECT raw_tx FROM SweepTransactions WHERE funding_outpoint = ? AND prevout = ? ORDER BY ctn";

		NetworkParameters params = Settings.getInstance().getBitcoinNet().getParams();
		List<Transaction> transactions = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, fundingOutpoint.toString(), prevout.toString())) {
			if (resultSet == null)
				return transactions;

			do {
				byte[] rawTransaction = resultSet.getBytes(1);

				transactions.add(new Transaction(params, rawTransaction));
			} while (resultSet.next());

			return transactions;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch sweep transactions from repository", e);
		} catch (ProtocolException e) {
			throw new DataException("Unable to parse stored sweep transaction for " + fundingOutpoint, e);
		}
	}

	@Override
	public Set<Outpoint> getSweepFundingOutpoints() throws DataException {
		String sql = "SELECT DISTINCT funding_outpoint FROM SweepTransactions ORDER BY funding_outpoint";

		Set<Outpoint> fundingOutpoints = new LinkedHashSet<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql)) {
			if (resultSet == null)
				return fundingOutpoints;

			do {
				fundingOutpoints.add(Outpoint.fromString(resultSet.getString(1)));
			} while (resultSet.next());

			return fundingOutpoints;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch sweep funding outpoints from repository", e);
		}
	}

	@Override
	public void addSweepTransaction(Outpoint fundingOutpoint, int ctn, Outpoint prevout, byte[] rawTransaction) throws DataException {
		String sql = "INSERT INTO SweepTransactions (funding_outpoint, ctn, prevout, raw_tx) VALUES (?, ?, ?, ?)";

		try {
			this.repository.executeCheckedUpdate(sql, fundingOutpoint.toString(), ctn, prevout.toString(), rawTransaction);
		} catch (SQLException e) {
			throw new DataException("Unable to save sweep transaction into repository", e);
		}
	}

	@Override
	public int countSweepTransactions(Outpoint fundingOutpoint) throws DataException {
		String sql = "SELECT COUNT(*) FROM SweepTransactions WHERE funding_outpoint = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, fundingOutpoint.toString())) {
			if (resultSet == null)
				return 0;

			return resultSet.getInt(1);
		} catch (SQLException e) {
			throw new DataException("Unable to count sweep transactions in repository", e);
		}
	}

	@Override
	public int getTurnNumber(Outpoint fundingOutpoint) throws DataException {
		String sql = "SELECT MAX(ctn) FROM SweepTransactions WHERE funding_outpoint = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, fundingOutpoint.toString())) {
			if (resultSet == null)
				return 0;

			// MAX() over no rows is NULL, which getInt() maps to 0
			return resultSet.getInt(1);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch turn number from repository", e);
		}
	}

	@Override
	public int deleteSweepTransactions(Outpoint fundingOutpoint) throws DataException {
		try {
			return this.repository.delete("SweepTransactions", "funding_outpoint = ?", fundingOutpoint.toString());
		} catch (SQLException e) {
			throw new DataException("Unable to delete sweep transactions from repository", e);
		}
	}

	// Channels

	@Override
	public boolean channelExists(Outpoint fundingOutpoint) throws DataException {
		try {
			return this.repository.exists("ChannelInfo", "outpoint = ?", fundingOutpoint.toString());
		} catch (SQLException e) {
			throw new DataException("Unable to check for channel in repository", e);
		}
	}

	@Override
	public void saveChannel(ChannelInfoData channelInfoData) throws DataException {
		String sql = "INSERT INTO ChannelInfo (outpoint, address) VALUES (?, ?) "
				+ "ON DUPLICATE KEY UPDATE address = VALUES(address)";

		try {
			this.repository.executeCheckedUpdate(sql, channelInfoData.getOutpoint().toString(), channelInfoData.getAddress());
		} catch (SQLException e) {
			throw new DataException("Unable to save channel info into repository", e);
		}
	}

	@Override
	public String getChannelAddress(Outpoint fundingOutpoint) throws DataException {
		String sql = "SELECT address FROM ChannelInfo WHERE outpoint = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, fundingOutpoint.toString())) {
			if (resultSet == null)
				return null;

			return resultSet.getString(1);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch channel address from repository", e);
		}
	}

	@Override
	public List<ChannelInfoData> getAllChannels() throws DataException {
		String sql = "SELECT outpoint, address FROM ChannelInfo ORDER BY outpoint";

		List<ChannelInfoData> channels = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql)) {
			if (resultSet == null)
				return channels;

			do {
				Outpoint outpoint = Outpoint.fromString(resultSet.getString(1));
				String address = resultSet.getString(2);

				channels.add(new ChannelInfoData(outpoint, address));
			} while (resultSet.next());

			return channels;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch channels from repository", e);
		}
	}

	@Override
	public int deleteChannel(Outpoint fundingOutpoint) throws DataException {
		try {
			return this.repository.delete("ChannelInfo", "outpoint = ?", fundingOutpoint.toString());
		} catch (SQLException e) {
			throw new DataException("Unable to delete channel info from repository", e);
		}
	}

}
