package i18nscan.parser;

import i18nscan.model.ruby.*;
import i18nscan.util.SourceLocation;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the JSON tree dump written by the parser process.
 *
 * The dump is an object {@code {"value": <node>, "comments": [...], "errors": [...]}}. Nodes are objects with a
 * Prism-style {@code "type"}, a {@code "location"} and one field per child. Types without a dedicated raw node
 * are read as {@link RubyOther} from their {@code "child_nodes"}.
 */
public class RubyTreeJsonReader {

	private RubyTreeJsonReader() {}

	public static RubyParseResult read(String json) throws RubyParseException {
		JSONObject dump;
		try {
			dump = new JSONObject(json);
		} catch (JSONException e) {
			throw new RubyParseException("malformed tree dump: " + e.getMessage(), e);
		}
		try {
			JSONArray errors = dump.optJSONArray("errors");
			if (errors != null && errors.length() > 0) {
				List<String> messages = new ArrayList<>();
				for (int i = 0; i < errors.length(); i++) {
					messages.add(errors.get(i).toString());
				}
				throw new RubyParseException(String.join("; ", messages));
			}
			RubyNode root = readNode(dump.getJSONObject("value"));
			if (!(root instanceof RubyProgram)) {
				throw new RubyParseException("expected program_node at the root, found " +
						dump.getJSONObject("value").optString("type"));
			}
			List<RubyComment> comments = new ArrayList<>();
			JSONArray commentArray = dump.optJSONArray("comments");
			if (commentArray != null) {
				for (int i = 0; i < commentArray.length(); i++) {
					JSONObject comment = commentArray.getJSONObject(i);
					comments.add(new RubyComment(readLocation(comment), comment.getString("text")));
				}
			}
			return new RubyParseResult((RubyProgram) root, comments);
		} catch (JSONException | NumberFormatException e) {
			throw new RubyParseException("unexpected tree dump contents: " + e.getMessage(), e);
		}
	}

	private static SourceLocation readLocation(JSONObject obj) {
		JSONObject location = obj.optJSONObject("location");
		if (location == null) {
			return SourceLocation.unknown();
		}
		return new SourceLocation(
				null,
				location.optInt("start_offset", -1),
				location.optInt("end_offset", -1),
				location.getInt("start_line"),
				location.optInt("end_line", location.getInt("start_line")),
				location.optInt("start_column", 0),
				location.optInt("end_column", 0));
	}

	private static RubyNode readOptional(JSONObject obj, String field) {
		JSONObject child = obj.optJSONObject(field);
		if (child == null) {
			return null;
		}
		return readNode(child);
	}

	private static RubyNode readRequired(JSONObject obj, String field) {
		return readNode(obj.getJSONObject(field));
	}

	private static List<RubyNode> readList(JSONObject obj, String field) {
		List<RubyNode> nodes = new ArrayList<>();
		JSONArray array = obj.optJSONArray(field);
		if (array == null) {
			return nodes;
		}
		for (int i = 0; i < array.length(); i++) {
			JSONObject child = array.optJSONObject(i);
			if (child != null) {
				nodes.add(readNode(child));
			}
		}
		return nodes;
	}

	private static RubyStatements readStatements(JSONObject obj, String field) {
		RubyNode node = readOptional(obj, field);
		if (node == null) {
			return null;
		}
		if (node instanceof RubyStatements) {
			return (RubyStatements) node;
		}
		// some bodies come as a begin_node or a lone expression; keep them as a one-statement body
		return new RubyStatements(node.getLocation(), Collections.singletonList(node));
	}

	private static String readText(JSONObject obj, String... fields) {
		for (String field : fields) {
			if (obj.has(field) && !obj.isNull(field)) {
				return obj.get(field).toString();
			}
		}
		throw new JSONException(obj.optString("type") + " has none of the fields " + String.join(", ", fields));
	}

	static RubyNode readNode(JSONObject obj) {
		String type = obj.getString("type");
		SourceLocation location = readLocation(obj);
		switch (type) {
			case "program_node":
				return new RubyProgram(location, readStatements(obj, "statements"));
			case "statements_node":
				return new RubyStatements(location, readList(obj, "body"));
			case "embedded_statements_node":
				return new RubyEmbeddedStatements(location, readStatements(obj, "statements"));
			case "module_node":
				return new RubyModule(location, readRequired(obj, "constant_path"), readStatements(obj, "body"));
			case "class_node":
				return new RubyClass(location, readRequired(obj, "constant_path"), readOptional(obj, "superclass"),
						readStatements(obj, "body"));
			case "instance_variable_write_node":
				return new RubyInstanceVariableWrite(location, obj.getString("name"), readRequired(obj, "value"));
			case "local_variable_write_node":
				return new RubyLocalVariableWrite(location, obj.getString("name"), readRequired(obj, "value"));
			case "local_variable_target_node":
				return new RubyLocalVariableTarget(location, obj.getString("name"));
			case "multi_write_node": {
				List<RubyNode> targets;
				if (obj.has("targets")) {
					targets = readList(obj, "targets");
				} else {
					targets = readList(obj, "lefts");
					RubyNode rest = readOptional(obj, "rest");
					if (rest != null) {
						targets.add(rest);
					}
					targets.addAll(readList(obj, "rights"));
				}
				return new RubyMultiWrite(location, targets, readRequired(obj, "value"));
			}
			case "def_node":
				return new RubyDef(location, obj.getString("name"), readOptional(obj, "receiver"),
						readOptional(obj, "body"));
			case "if_node": {
				// older dumps call the subsequent branch "consequent"
				String subsequent = obj.has("subsequent") ? "subsequent" : "consequent";
				return new RubyIf(location, readRequired(obj, "predicate"), readStatements(obj, "statements"),
						readOptional(obj, subsequent));
			}
			case "else_node":
				return new RubyElse(location, readStatements(obj, "statements"));
			case "and_node":
				return new RubyAnd(location, readRequired(obj, "left"), readRequired(obj, "right"));
			case "or_node":
				return new RubyOr(location, readRequired(obj, "left"), readRequired(obj, "right"));
			case "lambda_node":
				return new RubyLambda(location, readOptional(obj, "body"));
			case "block_node":
				return new RubyBlock(location, readOptional(obj, "body"));
			case "call_node": {
				RubyNode arguments = readOptional(obj, "arguments");
				if (arguments != null && !(arguments instanceof RubyArguments)) {
					throw new JSONException("call_node arguments must be an arguments_node");
				}
				return new RubyCall(location, readOptional(obj, "receiver"), obj.getString("name"),
						(RubyArguments) arguments, readOptional(obj, "block"));
			}
			case "assoc_node":
				return new RubyAssoc(location, readRequired(obj, "key"), readRequired(obj, "value"));
			case "symbol_node":
				return new RubySymbol(location, readText(obj, "value", "unescaped"));
			case "string_node":
				return new RubyString(location, readText(obj, "content", "unescaped"));
			case "interpolated_string_node":
				return new RubyInterpolatedString(location, readList(obj, "parts"));
			case "integer_node":
				return new RubyInteger(location, new BigInteger(readText(obj, "value")));
			case "float_node":
			case "decimal_node":
				return new RubyDecimal(location, new BigDecimal(readText(obj, "value")));
			case "constant_read_node":
				return new RubyConstantRead(location, obj.getString("name"));
			case "arguments_node":
				return new RubyArguments(location, readList(obj, "arguments"));
			case "array_node":
				return new RubyArray(location, readList(obj, "elements"));
			case "keyword_hash_node":
				return new RubyKeywordHash(location, readList(obj, "elements"));
			default:
				return new RubyOther(location, type, readList(obj, "child_nodes"));
		}
	}

}
