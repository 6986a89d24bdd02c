package i18nscan.trans;

import i18nscan.model.normalized.TranslationCallNode;

/**
 * A translation call together with the line of the file it was found on. For calls read from a magic comment this
 * is the comment's line, not the line inside the snippet.
 */
public class LocatedTranslationCall {

	private final TranslationCallNode call;
	private final int line;

	public LocatedTranslationCall(TranslationCallNode call, int line) {
		this.call = call;
		this.line = line;
	}

	public TranslationCallNode getCall() {
		return call;
	}

	public int getLine() {
		return line;
	}

	@Override
	public String toString() {
		return line + ": " + call;
	}

}
