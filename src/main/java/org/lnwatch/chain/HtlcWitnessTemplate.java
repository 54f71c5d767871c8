package org.lnwatch.chain;

import static org.bitcoinj.script.ScriptOpCodes.*;

import java.util.List;

import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionWitness;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptChunk;
import org.bitcoinj.script.ScriptException;

/**
 * BOLT-3 HTLC witness scripts, as found in the last witness element of an input spending an HTLC output.
 * <p>
 * Keys, hashes and expiries vary per HTLC so appear as generic data pushes.
 */
public enum HtlcWitnessTemplate {

	/*
	 * OP_DUP OP_HASH160 <RIPEMD160(SHA256(revocationpubkey))> OP_EQUAL
	 * OP_IF
	 * 	OP_CHECKSIG
	 * OP_ELSE
	 * 	<remote_htlcpubkey> OP_SWAP OP_SIZE 32 OP_EQUAL
	 * 	OP_NOTIF
	 * 		OP_DROP 2 OP_SWAP <local_htlcpubkey> 2 OP_CHECKMULTISIG
	 * 	OP_ELSE
	 * 		OP_HASH160 <RIPEMD160(payment_hash)> OP_EQUALVERIFY OP_CHECKSIG
	 * 	OP_ENDIF
	 * OP_ENDIF
	 */
	OFFERED(OP_DUP, OP_HASH160, Element.ANY_PUSH, OP_EQUAL,
			OP_IF,
				OP_CHECKSIG,
			OP_ELSE,
				Element.ANY_PUSH, OP_SWAP, OP_SIZE, Element.ONE_BYTE_PUSH, OP_EQUAL,
				OP_NOTIF,
					OP_DROP, OP_2, OP_SWAP, Element.ANY_PUSH, OP_2, OP_CHECKMULTISIG,
				OP_ELSE,
					OP_HASH160, Element.ANY_PUSH, OP_EQUALVERIFY, OP_CHECKSIG,
				OP_ENDIF,
			OP_ENDIF),

	/*
	 * OP_DUP OP_HASH160 <RIPEMD160(SHA256(revocationpubkey))> OP_EQUAL
	 * OP_IF
	 * 	OP_CHECKSIG
	 * OP_ELSE
	 * 	<remote_htlcpubkey> OP_SWAP OP_SIZE 32 OP_EQUAL
	 * 	OP_IF
	 * 		OP_HASH160 <RIPEMD160(payment_hash)> OP_EQUALVERIFY 2 OP_SWAP <local_htlcpubkey> 2 OP_CHECKMULTISIG
	 * 	OP_ELSE
	 * 		OP_DROP <cltv_expiry> OP_CHECKLOCKTIMEVERIFY OP_DROP OP_CHECKSIG
	 * 	OP_ENDIF
	 * OP_ENDIF
	 */
	RECEIVED(OP_DUP, OP_HASH160, Element.ANY_PUSH, OP_EQUAL,
			OP_IF,
				OP_CHECKSIG,
			OP_ELSE,
				Element.ANY_PUSH, OP_SWAP, OP_SIZE, Element.ONE_BYTE_PUSH, OP_EQUAL,
				OP_IF,
					OP_HASH160, Element.ANY_PUSH, OP_EQUALVERIFY, OP_2, OP_SWAP, Element.ANY_PUSH, OP_2, OP_CHECKMULTISIG,
				OP_ELSE,
					OP_DROP, Element.ANY_PUSH, OP_CHECKLOCKTIMEVERIFY, OP_DROP, OP_CHECKSIG,
				OP_ENDIF,
			OP_ENDIF);

	/** Template entries that aren't plain opcodes. Negative so they can't clash with real opcodes. */
	private static class Element {
		/** Any data push, of any length. */
		static final int ANY_PUSH = -1;
		/** Data push of exactly one byte, e.g. the "32" in OP_SIZE 32 OP_EQUAL. */
		static final int ONE_BYTE_PUSH = -2;
	}

	private final int[] elements;

	private HtlcWitnessTemplate(int... elements) {
		this.elements = elements;
	}

	/** Returns whether <tt>scriptBytes</tt> parses and matches this template exactly. */
	public boolean matches(byte[] scriptBytes) {
		if (scriptBytes == null)
			return false;

		List<ScriptChunk> chunks;
		try {
			chunks = new Script(scriptBytes).getChunks();
		} catch (ScriptException e) {
			return false;
		}

		if (chunks.size() != this.elements.length)
			return false;

		for (int i = 0; i < this.elements.length; ++i)
			if (!matchesElement(this.elements[i], chunks.get(i)))
				return false;

		return true;
	}

	/** Returns template matched by <tt>scriptBytes</tt>, or null if none. */
	public static HtlcWitnessTemplate match(byte[] scriptBytes) {
		for (HtlcWitnessTemplate template : values())
			if (template.matches(scriptBytes))
				return template;

		return null;
	}

	/**
	 * Returns HTLC template matched by the witness script (last witness element) of <tt>input</tt>,
	 * or null if input has no witness or the witness script isn't an HTLC script.
	 */
	public static HtlcWitnessTemplate matchInput(TransactionInput input) {
		if (!input.hasWitness())
			return null;

		TransactionWitness witness = input.getWitness();
		if (witness.getPushCount() == 0)
			return null;

		return match(witness.getPush(witness.getPushCount() - 1));
	}

	private static boolean matchesElement(int element, ScriptChunk chunk) {
		switch (element) {
			case Element.ANY_PUSH:
				return isDataPush(chunk);

			case Element.ONE_BYTE_PUSH:
				return isDataPush(chunk) && chunk.data != null && chunk.data.length == 1;

			default:
				return chunk.equalsOpCode(element);
		}
	}

	// bitcoinj's ScriptChunk.isPushData() also counts OP_1..OP_16, which we want to match as opcodes
	private static boolean isDataPush(ScriptChunk chunk) {
		return chunk.opcode <= OP_PUSHDATA4;
	}

}
