package i18nscan.errors;

import i18nscan.Unreachable;
import i18nscan.formatters.IndentingWriter;
import i18nscan.formatters.IssueFormattingVisitor;
import i18nscan.trans.NormalizationException;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found while scanning. Issues are exceptions so that fatal ones can abort a traversal, and are collected
 * in an {@link IssueContext} once caught.
 */
public abstract class Issue extends NormalizationException {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
