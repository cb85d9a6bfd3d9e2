package fla;

import java.io.*;
import java.util.*;
import java.util.logging.*;

/**
 * Global defaults, overridable by a <code>config.ini</code> file in the working directory.
 *
 * The analysis functions never read these values themselves, budgets are always passed explicitly.
 */
public class Config {

	public static final String configFile = "config.ini";

	public static final Logger LOG = Logger.getLogger("Config");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("pdaStepBudget", "10000");
		put("tmStepBudget", "10000");
		put("batchThreads", Runtime.getRuntime().availableProcessors() + "");
		put("logLevel", "INFO");
	}};

	/** Default number of configurations a pushdown automaton search may explore */
	public static int pdaStepBudget(){
		return getInt("pdaStepBudget");
	}

	/** Default number of steps a Turing machine may run */
	public static int tmStepBudget(){
		return getInt("tmStepBudget");
	}

	public static int batchThreads(){
		return Math.max(1, getInt("batchThreads"));
	}

	public static Level logLevel(){
		try {
			return Level.parse(get("logLevel").trim());
		} catch (IllegalArgumentException e) {
			throw new FLAException(String.format("Config key \"logLevel\" has no valid log level: %s", config.get("logLevel")), e);
		}
	}

	public static String get(String key){
		if (!config.containsKey(key)){
			throw new FLAException("Unknown config key \"" + key + "\"");
		}
		return config.get(key);
	}

	private static int getInt(String key){
		try {
			return Integer.parseInt(get(key).trim());
		} catch (NumberFormatException e) {
			throw new FLAException(String.format("Config key \"%s\" has no integer value: %s", key, config.get(key)), e);
		}
	}

	static void parse(BufferedReader reader) throws IOException {
		String line;
		while ((line = reader.readLine()) != null){
			if (line.contains(" = ")){
				String[] parts = line.split(" = ", 2);
				String key = parts[0].trim();
				if (config.containsKey(key)){
					config.put(key, parts[1].trim());
				} else {
					LOG.warning("Unknown config key \"" + key + "\"");
				}
			}
		}
	}

	private static void loadLoggingConfig(){
		try (InputStream in = Config.class.getResourceAsStream("/logging.properties")) {
			if (in != null) {
				LogManager.getLogManager().readConfiguration(in);
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read logging.properties", e);
		}
	}

	private static void loadConfig(){
		File file = new File(configFile);
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			parse(reader);
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile, e);
		}
	}

	static {
		loadLoggingConfig();
		loadConfig();
		try {
			Logger.getLogger("").setLevel(logLevel());
		} catch (FLAException e) {
			LOG.log(Level.WARNING, "Keeping the default log level", e);
		}
	}
}
