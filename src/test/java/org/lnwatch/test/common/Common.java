package org.lnwatch.test.common;

import static org.junit.Assert.*;

import java.net.URL;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.AfterClass;
import org.lnwatch.repository.DataException;
import org.lnwatch.repository.RepositoryFactory;
import org.lnwatch.repository.RepositoryManager;
import org.lnwatch.repository.hsqldb.HSQLDBRepositoryFactory;
import org.lnwatch.settings.Settings;

public class Common {

	private static final Logger LOGGER = LogManager.getLogger(Common.class);

	public static final String testConnectionUrlMemory = "jdbc:hsqldb:mem:testdb";

	public static final String testSettingsFilename = "test-settings.json";
	/** Same as default test settings, but allows settling HTLCs on-chain without timelock. */
	public static final String settleOnchainSettingsFilename = "test-settings-settle-onchain.json";

	static {
		// Load/check settings
		useSettings(testSettingsFilename);
	}

	public static void useSettings(String settingsFilename) {
		LOGGER.debug(String.format("Using setting file: %s", settingsFilename));
		URL testSettingsUrl = Common.class.getClassLoader().getResource(settingsFilename);
		assertNotNull("Test settings JSON file not found", testSettingsUrl);
		Settings.fileInstance(testSettingsUrl.getPath());
	}

	public static void useDefaultSettings() {
		useSettings(testSettingsFilename);
	}

	/** Loads default settings and a fresh, empty in-memory repository. */
	public static void useDefaultSettingsAndDb() throws DataException {
		useDefaultSettings();
		resetRepository();
	}

	public static void resetRepository() throws DataException {
		closeRepository();

		RepositoryFactory repositoryFactory = new HSQLDBRepositoryFactory(testConnectionUrlMemory);
		RepositoryManager.setRepositoryFactory(repositoryFactory);
	}

	@AfterClass
	public static void closeRepository() throws DataException {
		// Closing shuts down in-memory database, discarding everything
		RepositoryManager.closeRepositoryFactory();
	}

}
