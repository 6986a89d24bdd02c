package i18nscan;

import i18nscan.trans.CallNames;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Options read from the JSON configuration file. Both sections are optional:
//
//   "parser":  { "command": ["ruby", "dump_tree.rb"] }
//   "scanner": { "translation_calls": [...], "visibility_calls": [...] }
//
// A list of names replaces the corresponding defaults instead of extending them. Fields of the wrong type make
// org.json throw a JSONException, which the option parser reports as an option error.
public class ScannerOptions {

	public static final String PARSER_FIELD = "parser";
	public static final String SCANNER_FIELD = "scanner";

	private final CallNames callNames;
	private final List<String> parserCommand;

	public ScannerOptions(JSONObject config) {
		List<String> translationCalls = new ArrayList<>(CallNames.DEFAULT_TRANSLATION_CALLS);
		List<String> visibilityCalls = new ArrayList<>(CallNames.DEFAULT_VISIBILITY_CALLS);
		if (config.has(SCANNER_FIELD)) {
			JSONObject scanner = config.getJSONObject(SCANNER_FIELD);
			if (scanner.has("translation_calls")) {
				translationCalls = readStrings(scanner.getJSONArray("translation_calls"));
			}
			if (scanner.has("visibility_calls")) {
				visibilityCalls = readStrings(scanner.getJSONArray("visibility_calls"));
			}
		}
		this.callNames = new CallNames(translationCalls, visibilityCalls);

		if (config.has(PARSER_FIELD) && config.getJSONObject(PARSER_FIELD).has("command")) {
			this.parserCommand = Collections.unmodifiableList(
					readStrings(config.getJSONObject(PARSER_FIELD).getJSONArray("command")));
		} else {
			this.parserCommand = Collections.emptyList();
		}
	}

	public static ScannerOptions defaults() {
		return new ScannerOptions(new JSONObject());
	}

	private static List<String> readStrings(JSONArray array) {
		List<String> strings = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			strings.add(array.getString(i));
		}
		return strings;
	}

	public CallNames getCallNames() {
		return callNames;
	}

	/**
	 * @return the parser command from the configuration, or an empty list when none was given
	 */
	public List<String> getParserCommand() {
		return parserCommand;
	}
}
