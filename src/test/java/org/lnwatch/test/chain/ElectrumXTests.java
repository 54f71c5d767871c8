package org.lnwatch.test.chain;

import static org.junit.Assert.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.google.common.hash.HashCode;
import org.bitcoinj.core.Transaction;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.lnwatch.chain.BitcoinNet;
import org.lnwatch.chain.ChainIndexException;
import org.lnwatch.chain.ElectrumX;
import org.lnwatch.chain.ElectrumX.Server;
import org.lnwatch.settings.Settings;
import org.lnwatch.test.common.Common;
import org.lnwatch.test.common.TransactionUtils;

public class ElectrumXTests extends Common {

	private static final String GENESIS_HASH = BitcoinNet.TEST3.getGenesisHash();

	private FakeElectrumServer fakeServer;
	private ElectrumX electrumX;

	@Before
	public void beforeTest() throws IOException {
		this.fakeServer = new FakeElectrumServer();
		this.fakeServer.start();
	}

	@After
	public void afterTest() throws IOException {
		if (this.electrumX != null)
			this.electrumX.shutdown();

		this.fakeServer.close();
	}

	@Test
	public void testServerFromString() {
		Server server = Server.fromString("electrum.example.com:50002:ssl");
		assertEquals(new Server("electrum.example.com", Server.ConnectionType.SSL, 50002), server);

		try {
			Server.fromString("electrum.example.com:50002");
			fail("Missing connection type should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}

		try {
			Server.fromString("electrum.example.com:port:TCP");
			fail("Non-numeric port should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void testFromSettings() {
		ElectrumX fromSettings = ElectrumX.fromSettings(Settings.getInstance());

		assertEquals(Collections.singleton(new Server("localhost", Server.ConnectionType.TCP, 50001)), fromSettings.getServers());
		assertNull(fromSettings.getCurrentServer());
	}

	@Test
	public void testBroadcast() throws ChainIndexException {
		this.electrumX = this.newElectrumX(GENESIS_HASH);
		Transaction transaction = TransactionUtils.spend(TransactionUtils.randomOutpoint(), TransactionUtils.newAddress());

		assertEquals(TransactionUtils.txid(transaction), this.electrumX.broadcastTransaction(transaction));
		assertEquals(this.fakeServer.asServer(), this.electrumX.getCurrentServer());

		// Peers learned from server: TCP on custom port and SSL on default port
		assertEquals(3, this.electrumX.getServers().size());
		assertTrue(this.electrumX.getServers().contains(new Server("peer.example.com", Server.ConnectionType.TCP, 50011)));
		assertTrue(this.electrumX.getServers().contains(new Server("peer.example.com", Server.ConnectionType.SSL, 50002)));
	}

	@Test
	public void testBroadcastRejected() {
		this.electrumX = this.newElectrumX(GENESIS_HASH);
		this.fakeServer.rejectBroadcasts = true;

		try {
			this.electrumX.broadcastTransaction(TransactionUtils.spend(TransactionUtils.randomOutpoint(), TransactionUtils.newAddress()));
			fail("Rejected broadcast should throw");
		} catch (ChainIndexException.NetworkException e) {
			assertEquals(Integer.valueOf(-26), e.getDaemonErrorCode());
		} catch (ChainIndexException e) {
			fail("Expected NetworkException, not " + e.getClass().getSimpleName());
		}
	}

	@Test
	public void testGenesisHashMismatch() {
		this.electrumX = this.newElectrumX(BitcoinNet.MAIN.getGenesisHash());

		try {
			this.electrumX.broadcastTransaction(TransactionUtils.spend(TransactionUtils.randomOutpoint(), TransactionUtils.newAddress()));
			fail("Server on wrong network shouldn't be used");
		} catch (ChainIndexException e) {
			assertTrue(e instanceof ChainIndexException.NetworkException);
			assertNull(((ChainIndexException.NetworkException) e).getDaemonErrorCode());
		}

		assertNull(this.electrumX.getCurrentServer());
	}

	@Test
	public void testNoServers() {
		this.electrumX = new ElectrumX(GENESIS_HASH, Collections.emptyList(), defaultPorts());

		try {
			this.electrumX.broadcastTransaction(TransactionUtils.spend(TransactionUtils.randomOutpoint(), TransactionUtils.newAddress()));
			fail("Broadcast without servers should fail");
		} catch (ChainIndexException e) {
			assertTrue(e instanceof ChainIndexException.NetworkException);
		}
	}

	private ElectrumX newElectrumX(String genesisHash) {
		return new ElectrumX(genesisHash, Arrays.asList(this.fakeServer.asServer()), defaultPorts());
	}

	private static Map<Server.ConnectionType, Integer> defaultPorts() {
		Map<Server.ConnectionType, Integer> defaultPorts = new EnumMap<>(Server.ConnectionType.class);
		defaultPorts.put(Server.ConnectionType.TCP, 50001);
		defaultPorts.put(Server.ConnectionType.SSL, 50002);
		return defaultPorts;
	}

	/** Answers just enough ElectrumX protocol, one line-delimited JSON-RPC request at a time. */
	private static class FakeElectrumServer extends Thread {
		private final ServerSocket serverSocket;
		volatile boolean rejectBroadcasts = false;

		FakeElectrumServer() throws IOException {
			super("FakeElectrumServer");
			this.setDaemon(true);
			this.serverSocket = new ServerSocket(0, 5, InetAddress.getLoopbackAddress());
		}

		Server asServer() {
			return new Server(this.serverSocket.getInetAddress().getHostAddress(), Server.ConnectionType.TCP, this.serverSocket.getLocalPort());
		}

		void close() throws IOException {
			this.serverSocket.close();
		}

		@Override
		public void run() {
			while (!this.serverSocket.isClosed()) {
				try (Socket socket = this.serverSocket.accept()) {
					this.serve(socket);
				} catch (IOException e) {
					// Server socket closed, or client went away
				}
			}
		}

		private void serve(Socket socket) throws IOException {
			BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
			OutputStream output = socket.getOutputStream();

			String line;
			while ((line = reader.readLine()) != null) {
				JSONObject request = (JSONObject) JSONValue.parse(line);
				String response = this.respond(request).toJSONString() + "\n";
				output.write(response.getBytes(StandardCharsets.UTF_8));
				output.flush();
			}
		}

		@SuppressWarnings("unchecked")
		private JSONObject respond(JSONObject request) {
			JSONObject response = new JSONObject();
			response.put("jsonrpc", "2.0");
			response.put("id", request.get("id"));

			String method = (String) request.get("method");
			JSONArray params = (JSONArray) request.get("params");

			switch (method) {
				case "server.version": {
					JSONArray result = new JSONArray();
					result.add("FakeElectrumX 1.16");
					result.add("1.4");
					response.put("result", result);
					break;
				}

				case "server.features": {
					JSONObject result = new JSONObject();
					result.put("protocol_min", "1.4");
					result.put("protocol_max", "1.4.2");
					result.put("genesis_hash", GENESIS_HASH);
					response.put("result", result);
					break;
				}

				case "server.peers.subscribe": {
					JSONArray features = new JSONArray();
					features.addAll(Arrays.asList("v1.4", "s", "t50011"));

					JSONArray peer = new JSONArray();
					peer.addAll(Arrays.asList("192.0.2.1", "peer.example.com", features));

					JSONArray result = new JSONArray();
					result.add(peer);
					response.put("result", result);
					break;
				}

				case "blockchain.transaction.broadcast": {
					if (this.rejectBroadcasts) {
						JSONObject error = new JSONObject();
						error.put("code", 1);
						error.put("message", "the transaction was rejected by network rules.\n\n"
								+ "DaemonError({'code': -26, 'message': 'txn-mempool-conflict'})");
						response.put("error", error);
						break;
					}

					String rawTransactionHex = (String) params.get(0);
					Transaction transaction = new Transaction(TransactionUtils.PARAMS, hexToBytes(rawTransactionHex));
					response.put("result", transaction.getTxId().toString());
					break;
				}

				default: {
					JSONObject error = new JSONObject();
					error.put("code", -32601);
					error.put("message", "unknown method " + method);
					response.put("error", error);
					break;
				}
			}

			return response;
		}

		private static byte[] hexToBytes(String hex) {
			return HashCode.fromString(hex).asBytes();
		}
	}

}
