package i18nscan.parser;

import i18nscan.errors.Issue;
import i18nscan.errors.IssueVisitor;

public class ParsingIssue extends Issue {
	private final RubyParseException error;

	public ParsingIssue(RubyParseException error) {
		initCause(error);
		this.error = error;
	}

	public RubyParseException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
