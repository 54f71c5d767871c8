package org.lnwatch.chain;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.params.TestNet3Params;

public enum BitcoinNet {
	MAIN {
		@Override
		public NetworkParameters getParams() {
			return MainNetParams.get();
		}

		@Override
		public String getGenesisHash() {
			return "000000000019d6689c085ae165831e934ff763ae46a2a6c172b3f1b60a8ce26f";
		}
	},
	TEST3 {
		@Override
		public NetworkParameters getParams() {
			return TestNet3Params.get();
		}

		@Override
		public String getGenesisHash() {
			return "000000000933ea01ad0ee984209779baaec3ced90fa3f408719526f8d77f4943";
		}
	},
	REGTEST {
		@Override
		public NetworkParameters getParams() {
			return RegTestParams.get();
		}

		@Override
		public String getGenesisHash() {
			// This is unique to each regtest instance
			return null;
		}
	};

	public abstract NetworkParameters getParams();

	/** Genesis block hash that ElectrumX servers must report, or null if it can't be known in advance. */
	public abstract String getGenesisHash();
}
