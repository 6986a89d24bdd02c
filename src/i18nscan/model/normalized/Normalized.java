package i18nscan.model.normalized;

import i18nscan.Unreachable;
import i18nscan.formatters.IndentingWriter;
import i18nscan.formatters.NormalizedFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * The result of normalizing one raw node.
 *
 * Every result has exactly one {@link Shape}: a structural {@link NormalizedNode}, a {@link NormalizedList} of
 * further results, or a {@link Primitive} value. Callers either branch on {@link #getShape()} or dispatch with a
 * {@link NormalizedVisitor}. Equality is structural and never looks at the originating raw nodes.
 */
public abstract class Normalized {

	public enum Shape {
		NODE,
		LIST,
		PRIMITIVE,
	}

	public abstract Shape getShape();

	public abstract <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new NormalizedFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
