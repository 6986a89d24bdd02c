package i18nscan.model.ruby;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The output of the external parser for one source text: the program node and every comment token.
 */
public class RubyParseResult {

	private final RubyProgram program;
	private final List<RubyComment> comments;

	public RubyParseResult(RubyProgram program, List<RubyComment> comments) {
		this.program = program;
		this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
	}

	public RubyProgram getProgram() {
		return program;
	}

	public List<RubyComment> getComments() {
		return comments;
	}

}
