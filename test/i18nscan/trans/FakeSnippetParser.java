package i18nscan.trans;

import i18nscan.model.ruby.RubyComment;
import i18nscan.model.ruby.RubyParseResult;
import i18nscan.model.ruby.RubyProgram;
import i18nscan.parser.RubyParseException;
import i18nscan.parser.RubySourceParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stands in for the external parser: answers with prepared trees for known snippets and fails on anything else.
 */
public class FakeSnippetParser implements RubySourceParser {

	private final Map<String, RubyParseResult> results = new HashMap<>();
	private final List<String> requested = new ArrayList<>();

	public FakeSnippetParser on(String source, RubyProgram program) {
		return on(source, program, Collections.emptyList());
	}

	public FakeSnippetParser on(String source, RubyProgram program, List<RubyComment> comments) {
		results.put(source, new RubyParseResult(program, comments));
		return this;
	}

	public List<String> getRequested() {
		return requested;
	}

	@Override
	public RubyParseResult parse(String source) throws RubyParseException {
		requested.add(source);
		RubyParseResult result = results.get(source);
		if (result == null) {
			throw new RubyParseException("unexpected token in " + source);
		}
		return result;
	}

}
