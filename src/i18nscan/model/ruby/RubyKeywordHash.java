package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Keyword arguments written without braces, as in {@code t(:title, scope: 'home')}.
 */
public class RubyKeywordHash extends RubyNode {

	private final List<RubyNode> elements;

	public RubyKeywordHash(SourceLocation location, List<RubyNode> elements) {
		super(location);
		this.elements = frozen(elements);
	}

	public List<RubyNode> getElements() {
		return elements;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyKeywordHash other = (RubyKeywordHash) obj;
		return Objects.equals(elements, other.elements);
	}

}
