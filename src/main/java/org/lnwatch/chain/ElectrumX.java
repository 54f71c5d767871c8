package org.lnwatch.chain;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.text.DecimalFormat;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.Transaction;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.lnwatch.settings.Settings;

import com.google.common.hash.HashCode;

/** Broadcasts transactions via ElectrumX servers, rotating between servers as needed. */
public class ElectrumX implements TransactionBroadcaster {

	private static final Logger LOGGER = LogManager.getLogger(ElectrumX.class);
	private static final Random RANDOM = new Random();

	// See: https://electrumx.readthedocs.io/en/latest/protocol-changes.html
	private static final double MIN_PROTOCOL_VERSION = 1.2;
	private static final double MAX_PROTOCOL_VERSION = 2.0; // Higher than current latest, for hopeful future-proofing
	private static final String CLIENT_NAME = "lnwatch";

	private static final int CONNECT_TIMEOUT = 5000; // ms

	// "message": "daemon error: DaemonError({'code': -26, 'message': 'non-mandatory-script-verify-flag'})"
	private static final Pattern DAEMON_ERROR_REGEX = Pattern.compile("DaemonError\\(\\{.*'code': ?(-?[0-9]+).*\\}\\)\\z"); // Capture 'code' inside curly-brace content

	private static final int RESPONSE_TIME_READINGS = 5;
	private static final long MAX_AVG_RESPONSE_TIME = 1000L; // ms

	public static class Server {
		final String hostname;

		public enum ConnectionType { TCP, SSL }
		final ConnectionType connectionType;

		final int port;
		private final List<Long> responseTimes = new ArrayList<>();

		public Server(String hostname, ConnectionType connectionType, int port) {
			this.hostname = hostname;
			this.connectionType = connectionType;
			this.port = port;
		}

		/**
		 * Parses <tt>hostname:port:TCP|SSL</tt>.
		 *
		 * @throws IllegalArgumentException if <tt>server</tt> is malformed
		 */
		public static Server fromString(String server) {
			String[] parts = server.split(":");
			if (parts.length != 3)
				throw new IllegalArgumentException(String.format("Expected hostname:port:type, not '%s'", server));

			try {
				return new Server(parts[0], ConnectionType.valueOf(parts[2].toUpperCase(Locale.ROOT)), Integer.parseInt(parts[1]));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException(String.format("Malformed ElectrumX server '%s'", server), e);
			}
		}

		public void addResponseTime(long responseTime) {
			while (this.responseTimes.size() > RESPONSE_TIME_READINGS)
				this.responseTimes.remove(0);

			this.responseTimes.add(responseTime);
		}

		public long averageResponseTime() {
			if (this.responseTimes.size() < RESPONSE_TIME_READINGS)
				// Not enough readings yet
				return 0L;

			OptionalDouble average = this.responseTimes.stream().mapToDouble(a -> a).average();
			if (average.isPresent())
				return Double.valueOf(average.getAsDouble()).longValue();

			return 0L;
		}

		@Override
		public boolean equals(Object other) {
			if (other == this)
				return true;

			if (!(other instanceof Server))
				return false;

			Server otherServer = (Server) other;

			return this.connectionType == otherServer.connectionType
					&& this.port == otherServer.port
					&& this.hostname.equals(otherServer.hostname);
		}

		@Override
		public int hashCode() {
			return this.hostname.hashCode() ^ this.port;
		}

		@Override
		public String toString() {
			return String.format("%s:%s:%d", this.connectionType.name(), this.hostname, this.port);
		}
	}

	private final Set<Server> servers = new HashSet<>();
	private final List<Server> remainingServers = new ArrayList<>();

	private final String expectedGenesisHash;
	private final Map<Server.ConnectionType, Integer> defaultPorts = new EnumMap<>(Server.ConnectionType.class);

	private final Object serverLock = new Object();
	private Server currentServer;
	private Socket socket;
	private Scanner scanner;
	private int nextId = 1;

	// Constructors

	public ElectrumX(String genesisHash, Collection<Server> initialServerList, Map<Server.ConnectionType, Integer> defaultPorts) {
		this.expectedGenesisHash = genesisHash;
		this.servers.addAll(initialServerList);
		this.defaultPorts.putAll(defaultPorts);
	}

	/** Builds broadcaster using servers and genesis hash from settings, with Bitcoin's default ElectrumX ports. */
	public static ElectrumX fromSettings(Settings settings) {
		List<Server> initialServers = new ArrayList<>();
		for (String server : settings.getElectrumServers())
			initialServers.add(Server.fromString(server));

		Map<Server.ConnectionType, Integer> defaultPorts = new EnumMap<>(Server.ConnectionType.class);
		defaultPorts.put(Server.ConnectionType.TCP, 50001);
		defaultPorts.put(Server.ConnectionType.SSL, 50002);

		return new ElectrumX(settings.getElectrumGenesisHash(), initialServers, defaultPorts);
	}

	// Methods for use by other classes

	public Set<Server> getServers() {
		synchronized (this.serverLock) {
			return new HashSet<>(this.servers);
		}
	}

	public Server getCurrentServer() {
		return this.currentServer;
	}

	/**
	 * Broadcasts transaction to network, returning txid as reported by server.
	 * <p>
	 * @throws ChainIndexException.NetworkException if no server is reachable or the transaction is rejected
	 */
	@Override
	public String broadcastTransaction(Transaction transaction) throws ChainIndexException {
		Object rawBroadcastResult = this.rpc("blockchain.transaction.broadcast", HashCode.fromBytes(transaction.bitcoinSerialize()).toString());

		// We're expecting a simple string that is the transaction hash
		if (!(rawBroadcastResult instanceof String))
			throw new ChainIndexException.NetworkException("Unexpected response from ElectrumX blockchain.transaction.broadcast RPC");

		return (String) rawBroadcastResult;
	}

	/** Closes connection to current server, if any. */
	@Override
	public void shutdown() {
		this.closeServer();
	}

	// Class-private utility methods

	/**
	 * Query current server for its list of peer servers, and return those we can parse.
	 * <p>
	 * @throws ChainIndexException
	 * @throws ClassCastException to be handled by caller
	 */
	private Set<Server> serverPeersSubscribe() throws ChainIndexException {
		Set<Server> newServers = new HashSet<>();

		Object peers = this.connectedRpc("server.peers.subscribe");
		if (peers == null)
			return newServers;

		for (Object rawPeer : (JSONArray) peers) {
			JSONArray peer = (JSONArray) rawPeer;
			if (peer.size() < 3)
				// We're expecting at least 3 fields for each peer entry: IP, hostname, features
				continue;

			String hostname = (String) peer.get(1);
			JSONArray features = (JSONArray) peer.get(2);

			for (Object rawFeature : features) {
				String feature = (String) rawFeature;
				Server.ConnectionType connectionType = null;

				switch (feature.charAt(0)) {
					case 's':
						connectionType = Server.ConnectionType.SSL;
						break;

					case 't':
						connectionType = Server.ConnectionType.TCP;
						break;

					default:
						// e.g. could be 'v' for protocol version, or 'p' for pruning limit
						break;
				}

				if (connectionType == null)
					continue;

				Integer port = this.defaultPorts.get(connectionType);

				// Possible non-default port?
				if (feature.length() > 1)
					try {
						port = Integer.parseInt(feature.substring(1));
					} catch (NumberFormatException e) {
						continue;
					}

				if (port == null)
					continue;

				newServers.add(new Server(hostname, connectionType, port));
			}
		}

		return newServers;
	}

	/**
	 * Performs RPC call, with automatic reconnection to different server if needed.
	 * <p>
	 * @return "result" object from within JSON output
	 * @throws ChainIndexException if server returns error or something goes wrong
	 */
	private Object rpc(String method, Object...params) throws ChainIndexException {
		synchronized (this.serverLock) {
			if (this.remainingServers.isEmpty())
				this.remainingServers.addAll(this.servers);

			while (haveConnection()) {
				Object response = connectedRpc(method, params);

				// If we have more servers and this one replied slowly, try another
				if (!this.remainingServers.isEmpty()) {
					long averageResponseTime = this.currentServer.averageResponseTime();
					if (averageResponseTime > MAX_AVG_RESPONSE_TIME) {
						LOGGER.info("Slow average response time {}ms from {} - trying another server...", averageResponseTime, this.currentServer.hostname);
						this.closeServer();
						break;
					}
				}

				if (response != null)
					return response;

				// Didn't work, try another server...
				this.closeServer();
			}

			LOGGER.info("No connected ElectrumX servers when trying to make RPC call {}", method);
			throw new ChainIndexException.NetworkException(String.format("Failed to perform ElectrumX RPC %s", method));
		}
	}

	/** Returns true if we have, or create, a connection to an ElectrumX server. */
	private boolean haveConnection() throws ChainIndexException {
		if (this.currentServer != null)
			return true;

		while (!this.remainingServers.isEmpty()) {
			Server server = this.remainingServers.remove(RANDOM.nextInt(this.remainingServers.size()));
			LOGGER.trace(() -> String.format("Connecting to %s", server));

			try {
				SocketAddress endpoint = new InetSocketAddress(server.hostname, server.port);

				this.socket = new Socket();
				this.socket.connect(endpoint, CONNECT_TIMEOUT);
				this.socket.setTcpNoDelay(true);

				if (server.connectionType == Server.ConnectionType.SSL)
					this.socket = trustlessSocketFactory().createSocket(this.socket, server.hostname, server.port, true);

				this.scanner = new Scanner(this.socket.getInputStream());
				this.scanner.useDelimiter("\n");

				// All connections need to start with a version negotiation
				this.connectedRpc("server.version");

				// Check connection is suitable by asking for server features, including genesis block hash
				JSONObject featuresJson = (JSONObject) this.connectedRpc("server.features");

				if (featuresJson == null || Double.valueOf((String) featuresJson.get("protocol_min")) < MIN_PROTOCOL_VERSION) {
					closeSocket();
					continue;
				}

				if (this.expectedGenesisHash != null && !this.expectedGenesisHash.equals(featuresJson.get("genesis_hash"))) {
					LOGGER.debug(() -> String.format("Skipping %s due to genesis hash mismatch", server));
					closeSocket();
					continue;
				}

				// Ask for more servers
				Set<Server> moreServers = serverPeersSubscribe();
				// Discard duplicate servers we already know
				moreServers.removeAll(this.servers);
				// Add to both lists
				this.remainingServers.addAll(moreServers);
				this.servers.addAll(moreServers);

				LOGGER.debug(() -> String.format("Connected to %s", server));
				this.currentServer = server;
				return true;
			} catch (IOException | GeneralSecurityException | ChainIndexException | ClassCastException | NullPointerException | NumberFormatException e) {
				LOGGER.debug(() -> String.format("Unable to use %s: %s", server, e.getMessage()));
				closeSocket();
			}
		}

		return false;
	}

	/**
	 * Perform RPC using currently connected server.
	 * <p>
	 * @param method
	 * @param params
	 * @return response Object, or null if server fails to respond
	 * @throws ChainIndexException if server returns error
	 */
	@SuppressWarnings("unchecked")
	private Object connectedRpc(String method, Object...params) throws ChainIndexException {
		JSONObject requestJson = new JSONObject();
		requestJson.put("id", this.nextId++);
		requestJson.put("method", method);
		requestJson.put("jsonrpc", "2.0");

		JSONArray requestParams = new JSONArray();
		requestParams.addAll(Arrays.asList(params));

		// server.version needs additional params to negotiate a version
		if (method.equals("server.version")) {
			requestParams.add(CLIENT_NAME);
			List<String> versions = new ArrayList<>();
			DecimalFormat df = new DecimalFormat("#.#");
			versions.add(df.format(MIN_PROTOCOL_VERSION));
			versions.add(df.format(MAX_PROTOCOL_VERSION));
			requestParams.add(versions);
		}

		requestJson.put("params", requestParams);

		String request = requestJson.toJSONString() + "\n";
		LOGGER.trace(() -> String.format("Request: %s", request));

		long startTime = System.currentTimeMillis();
		final String response;

		try {
			this.socket.getOutputStream().write(request.getBytes());
			response = this.scanner.next();
		} catch (IOException | NoSuchElementException e) {
			// Unable to send, or receive, so try another server?
			return null;
		}

		long responseTime = System.currentTimeMillis() - startTime;

		LOGGER.trace(() -> String.format("Response: %s", response));

		if (response.isEmpty())
			// Empty response - try another server?
			return null;

		Object responseObj = JSONValue.parse(response);
		if (!(responseObj instanceof JSONObject))
			// Unexpected response - try another server?
			return null;

		if (this.currentServer != null)
			this.currentServer.addResponseTime(responseTime);

		JSONObject responseJson = (JSONObject) responseObj;

		Object errorObj = responseJson.get("error");
		if (errorObj != null) {
			if (!(errorObj instanceof JSONObject)) {
				LOGGER.debug("Unexpected error response from ElectrumX server {} for RPC method {}: {}", this.currentServer, method, errorObj);
				// Try another server
				return null;
			}

			Object messageObj = ((JSONObject) errorObj).get("message");

			if (!(messageObj instanceof String)) {
				LOGGER.debug("Missing/invalid message in error response from ElectrumX server {} for RPC method {}", this.currentServer, method);
				// Try another server
				return null;
			}

			String message = (String) messageObj;

			// Some error 'messages' are actually wrapped upstream bitcoind errors,
			// e.g. transaction rejected by policy. We extract the upstream error code for caller's use.
			Matcher messageMatcher = DAEMON_ERROR_REGEX.matcher(message);
			if (messageMatcher.find())
				try {
					int daemonErrorCode = Integer.parseInt(messageMatcher.group(1));
					throw new ChainIndexException.NetworkException(daemonErrorCode, message, this.currentServer);
				} catch (NumberFormatException e) {
					// Fall-through to generic exception
					LOGGER.debug(() -> String.format("Unparseable daemon error code in: %s", message));
				}

			throw new ChainIndexException.NetworkException(message, this.currentServer);
		}

		return responseJson.get("result");
	}

	/** Closes connection to currently connected server (if any). */
	private void closeServer() {
		synchronized (this.serverLock) {
			closeSocket();
			this.currentServer = null;
		}
	}

	private void closeSocket() {
		if (this.socket != null && !this.socket.isClosed())
			try {
				this.socket.close();
			} catch (IOException e) {
				LOGGER.trace(() -> String.format("Ignoring error closing ElectrumX socket: %s", e.getMessage()));
			}

		this.socket = null;
		this.scanner = null;
	}

	/** ElectrumX servers mostly use self-signed certificates, so we skip certificate chain validation. */
	private static SSLSocketFactory trustlessSocketFactory() throws GeneralSecurityException {
		TrustManager[] trustAll = new TrustManager[] {
			new X509TrustManager() {
				@Override
				public X509Certificate[] getAcceptedIssuers() {
					return new X509Certificate[0];
				}

				@Override
				public void checkClientTrusted(X509Certificate[] certs, String authType) {
				}

				@Override
				public void checkServerTrusted(X509Certificate[] certs, String authType) {
				}
			}
		};

		SSLContext sslContext = SSLContext.getInstance("TLS");
		sslContext.init(null, trustAll, new SecureRandom());
		return sslContext.getSocketFactory();
	}

}
