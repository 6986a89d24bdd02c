package i18nscan.trans;

import i18nscan.errors.Issue;
import i18nscan.errors.IssueVisitor;
import i18nscan.model.ruby.RubyKeywordHash;
import i18nscan.model.ruby.RubyNode;

/**
 * A keyword argument list holds something other than {@code key: value} pairs, such as a {@code **splat}. The
 * options of the call cannot be built, so normalization of the whole tree is abandoned.
 */
public class UnsupportedOptionsEntryIssue extends Issue {

	private final RubyKeywordHash keywordHash;
	private final RubyNode entry;

	public UnsupportedOptionsEntryIssue(RubyKeywordHash keywordHash, RubyNode entry) {
		this.keywordHash = keywordHash;
		this.entry = entry;
	}

	public RubyKeywordHash getKeywordHash() {
		return keywordHash;
	}

	public RubyNode getEntry() {
		return entry;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
