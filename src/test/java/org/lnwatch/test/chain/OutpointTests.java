package org.lnwatch.test.chain;

import static org.junit.Assert.*;

import org.bitcoinj.core.Transaction;
import org.junit.Test;
import org.lnwatch.chain.Outpoint;
import org.lnwatch.test.common.TransactionUtils;

public class OutpointTests {

	private static final String TXID = "6e0b9b5f2c1f1b0cf7b1d3e8a0a7d8a3c4b2f1e0d9c8b7a6f5e4d3c2b1a09f8e";

	@Test
	public void testParsing() {
		Outpoint outpoint = Outpoint.fromString(TXID + ":3");

		assertEquals(TXID, outpoint.getTxid());
		assertEquals(3, outpoint.getIndex());
		assertEquals(TXID + ":3", outpoint.toString());
		assertEquals(new Outpoint(TXID, 3), outpoint);
		assertNotEquals(new Outpoint(TXID, 2), outpoint);
	}

	@Test
	public void testMalformed() {
		String[] malformed = new String[] { TXID, TXID + ":", ":1", TXID + ":x" };

		for (String outpoint : malformed)
			try {
				Outpoint.fromString(outpoint);
				fail("Parsing '" + outpoint + "' should have thrown");
			} catch (IllegalArgumentException e) {
				// expected
			}
	}

	@Test
	public void testMatchesTransactionInput() {
		Outpoint prevout = TransactionUtils.randomOutpoint();
		Transaction transaction = TransactionUtils.spend(prevout, TransactionUtils.newAddress());

		assertTrue(prevout.matches(transaction.getInput(0).getOutpoint()));
		assertFalse(new Outpoint(prevout.getTxid(), 1).matches(transaction.getInput(0).getOutpoint()));
		assertEquals(prevout, Outpoint.fromTransactionOutPoint(transaction.getInput(0).getOutpoint()));
	}

}
