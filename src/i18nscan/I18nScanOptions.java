package i18nscan;

import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class I18nScanOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	@Option(value = "-p command running the Ruby parser, overrides the configuration file")
	public String parserCommandLine;

	public List<String> inputFilePaths;

	// fields extracted from the JSON configuration file, or defaults
	public ScannerOptions scanner;
	public List<String> parserCommand;

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public I18nScanOptions(String[] args) {
		plumeOptions = new Options("i18nscan [options] file...", this);
		remainingArgs = plumeOptions.parse(true, args);
	}

	/**
	 * @return true when the command line only asks for help or the version and there is nothing to scan
	 */
	public boolean isInformational() {
		return help || version;
	}

	public void parse() throws I18nScanOptionException {
		if (isInformational()) {
			inputFilePaths = Collections.emptyList();
			return;
		}

		if (remainingArgs.length == 0) {
			throw new I18nScanOptionException("At least one input file is required");
		}
		inputFilePaths = Arrays.asList(remainingArgs);

		if (configFilePath == null || configFilePath.isEmpty()) {
			scanner = ScannerOptions.defaults();
		} else {
			String s;

			try {
				byte[] jsonBytes = Files.readAllBytes(Paths.get(configFilePath));
				s = new String(jsonBytes, StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new I18nScanOptionException("Error reading configuration file: " + ex.getMessage());
			}

			try {
				scanner = new ScannerOptions(new JSONObject(s));
			} catch (JSONException e) {
				throw new I18nScanOptionException(configFilePath + ": parsing error: " + e.getMessage());
			}
		}

		if (parserCommandLine != null && !parserCommandLine.trim().isEmpty()) {
			parserCommand = Arrays.asList(parserCommandLine.trim().split("\\s+"));
		} else {
			parserCommand = scanner.getParserCommand();
		}
		if (parserCommand.isEmpty()) {
			throw new I18nScanOptionException(
					"A parser command is required, either with -p or as parser.command in the configuration file");
		}
	}
}
