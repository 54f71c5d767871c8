package org.lnwatch.test.repository;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.bitcoinj.core.Transaction;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.data.ChannelInfoData;
import org.lnwatch.repository.DataException;
import org.lnwatch.repository.Repository;
import org.lnwatch.repository.RepositoryManager;
import org.lnwatch.repository.SweepRepository;
import org.lnwatch.repository.hsqldb.HSQLDBRepositoryFactory;
import org.lnwatch.settings.Settings;
import org.lnwatch.test.common.Common;
import org.lnwatch.test.common.TransactionUtils;

public class SweepRepositoryTests extends Common {

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettingsAndDb();
	}

	@After
	public void afterTest() {
		Common.useDefaultSettings();
	}

	@Test
	public void testSweepsOrderedByCommitmentNumber() throws DataException {
		Outpoint fundingOutpoint = TransactionUtils.randomOutpoint();
		Outpoint prevout = TransactionUtils.randomOutpoint();

		Transaction laterSweep = TransactionUtils.spend(prevout, TransactionUtils.newAddress());
		Transaction earlierSweep = TransactionUtils.spend(prevout, TransactionUtils.newAddress());
		Transaction otherPrevoutSweep = TransactionUtils.spend(TransactionUtils.randomOutpoint(), TransactionUtils.newAddress());

		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			sweepRepository.addSweepTransaction(fundingOutpoint, 9, prevout, laterSweep.bitcoinSerialize());
			sweepRepository.addSweepTransaction(fundingOutpoint, 2, prevout, earlierSweep.bitcoinSerialize());
			sweepRepository.addSweepTransaction(fundingOutpoint, 5, TransactionUtils.randomOutpoint(), otherPrevoutSweep.bitcoinSerialize());
			repository.saveChanges();

			List<Transaction> sweeps = sweepRepository.getSweepTransactions(fundingOutpoint, prevout);
			assertEquals(2, sweeps.size());
			assertEquals(TransactionUtils.txid(earlierSweep), TransactionUtils.txid(sweeps.get(0)));
			assertEquals(TransactionUtils.txid(laterSweep), TransactionUtils.txid(sweeps.get(1)));

			assertTrue(sweepRepository.getSweepTransactions(TransactionUtils.randomOutpoint(), prevout).isEmpty());
		}
	}

	@Test
	public void testTurnNumberAndCounts() throws DataException {
		Outpoint fundingOutpoint = TransactionUtils.randomOutpoint();
		Outpoint otherFundingOutpoint = TransactionUtils.randomOutpoint();

		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			assertEquals(0, sweepRepository.getTurnNumber(fundingOutpoint));
			assertEquals(0, sweepRepository.countSweepTransactions(fundingOutpoint));
			assertTrue(sweepRepository.getSweepFundingOutpoints().isEmpty());

			for (int ctn = 1; ctn <= 4; ++ctn)
				this.addSweep(sweepRepository, fundingOutpoint, ctn);

			this.addSweep(sweepRepository, otherFundingOutpoint, 12);
			repository.saveChanges();

			assertEquals(4, sweepRepository.getTurnNumber(fundingOutpoint));
			assertEquals(12, sweepRepository.getTurnNumber(otherFundingOutpoint));
			assertEquals(4, sweepRepository.countSweepTransactions(fundingOutpoint));

			assertEquals(2, sweepRepository.getSweepFundingOutpoints().size());
			assertTrue(sweepRepository.getSweepFundingOutpoints().containsAll(Arrays.asList(fundingOutpoint, otherFundingOutpoint)));
		}
	}

	@Test
	public void testDeleteSweeps() throws DataException {
		Outpoint fundingOutpoint = TransactionUtils.randomOutpoint();
		Outpoint otherFundingOutpoint = TransactionUtils.randomOutpoint();

		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			this.addSweep(sweepRepository, fundingOutpoint, 1);
			this.addSweep(sweepRepository, fundingOutpoint, 2);
			this.addSweep(sweepRepository, otherFundingOutpoint, 1);
			repository.saveChanges();

			assertEquals(2, sweepRepository.deleteSweepTransactions(fundingOutpoint));
			repository.saveChanges();

			assertEquals(0, sweepRepository.countSweepTransactions(fundingOutpoint));
			assertEquals(1, sweepRepository.countSweepTransactions(otherFundingOutpoint));
			assertEquals(0, sweepRepository.deleteSweepTransactions(fundingOutpoint));
		}
	}

	@Test
	public void testDiscardedChangesNotStored() throws DataException {
		Outpoint fundingOutpoint = TransactionUtils.randomOutpoint();

		try (final Repository repository = RepositoryManager.getRepository()) {
			this.addSweep(repository.getSweepRepository(), fundingOutpoint, 1);
			repository.discardChanges();
		}

		try (final Repository repository = RepositoryManager.getRepository()) {
			assertEquals(0, repository.getSweepRepository().countSweepTransactions(fundingOutpoint));
		}
	}

	@Test
	public void testCloseDiscardsUncommittedChanges() throws DataException {
		Outpoint fundingOutpoint = TransactionUtils.randomOutpoint();
		Outpoint savedFundingOutpoint = TransactionUtils.randomOutpoint();

		try (final Repository repository = RepositoryManager.getRepository()) {
			this.addSweep(repository.getSweepRepository(), savedFundingOutpoint, 1);
			repository.saveChanges();

			// Never saved
			this.addSweep(repository.getSweepRepository(), fundingOutpoint, 1);
			repository.getSweepRepository().saveChannel(new ChannelInfoData(fundingOutpoint, TransactionUtils.newAddress()));
		}

		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			assertEquals(0, sweepRepository.countSweepTransactions(fundingOutpoint));
			assertFalse(sweepRepository.channelExists(fundingOutpoint));
			assertEquals(1, sweepRepository.countSweepTransactions(savedFundingOutpoint));
		}
	}

	@Test
	public void testSlowQueryReportingKeepsTransactionsWorking() throws DataException {
		// These settings set a slow query threshold, so each session keeps its transaction's SQL
		Common.useSettings(Common.settleOnchainSettingsFilename);
		Common.resetRepository();
		assertNotNull(Settings.getInstance().getSlowQueryThreshold());

		Outpoint fundingOutpoint = TransactionUtils.randomOutpoint();

		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			this.addSweep(sweepRepository, fundingOutpoint, 1);
			repository.discardChanges();

			this.addSweep(sweepRepository, fundingOutpoint, 2);
			repository.saveChanges();

			assertEquals(1, sweepRepository.countSweepTransactions(fundingOutpoint));
			assertEquals(2, sweepRepository.getTurnNumber(fundingOutpoint));
		}
	}

	@Test
	public void testChannels() throws DataException {
		Outpoint fundingOutpoint = TransactionUtils.randomOutpoint();
		String address = TransactionUtils.newAddress();
		String newAddress = TransactionUtils.newAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			SweepRepository sweepRepository = repository.getSweepRepository();

			assertFalse(sweepRepository.channelExists(fundingOutpoint));
			assertNull(sweepRepository.getChannelAddress(fundingOutpoint));

			sweepRepository.saveChannel(new ChannelInfoData(fundingOutpoint, address));
			repository.saveChanges();

			assertTrue(sweepRepository.channelExists(fundingOutpoint));
			assertEquals(address, sweepRepository.getChannelAddress(fundingOutpoint));

			// Saving again updates address
			sweepRepository.saveChannel(new ChannelInfoData(fundingOutpoint, newAddress));
			repository.saveChanges();

			List<ChannelInfoData> channels = sweepRepository.getAllChannels();
			assertEquals(1, channels.size());
			assertEquals(new ChannelInfoData(fundingOutpoint, newAddress), channels.get(0));

			assertEquals(1, sweepRepository.deleteChannel(fundingOutpoint));
			repository.saveChanges();

			assertFalse(sweepRepository.channelExists(fundingOutpoint));
			assertTrue(sweepRepository.getAllChannels().isEmpty());
		}
	}

	@Test
	public void testFileRepositoryPersists() throws DataException {
		Outpoint fundingOutpoint = TransactionUtils.randomOutpoint();
		String address = TransactionUtils.newAddress();

		HSQLDBRepositoryFactory repositoryFactory = HSQLDBRepositoryFactory.fromSettings(Settings.getInstance());
		try (final Repository repository = repositoryFactory.getRepository()) {
			repository.getSweepRepository().saveChannel(new ChannelInfoData(fundingOutpoint, address));
			repository.saveChanges();
		} finally {
			repositoryFactory.close();
		}

		// Reopen, e.g. after restart
		repositoryFactory = HSQLDBRepositoryFactory.fromSettings(Settings.getInstance());
		try (final Repository repository = repositoryFactory.getRepository()) {
			assertFalse(repositoryFactory.wasPristineAtOpen());
			assertEquals(address, repository.getSweepRepository().getChannelAddress(fundingOutpoint));

			repository.getSweepRepository().deleteChannel(fundingOutpoint);
			repository.saveChanges();
		} finally {
			repositoryFactory.close();
		}
	}

	private void addSweep(SweepRepository sweepRepository, Outpoint fundingOutpoint, int ctn) throws DataException {
		Outpoint prevout = TransactionUtils.randomOutpoint();
		Transaction sweep = TransactionUtils.spend(prevout, TransactionUtils.newAddress());

		sweepRepository.addSweepTransaction(fundingOutpoint, ctn, prevout, sweep.bitcoinSerialize());
	}

}
