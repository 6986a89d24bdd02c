package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyArray extends RubyNode {

	private final List<RubyNode> elements;

	public RubyArray(SourceLocation location, List<RubyNode> elements) {
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
		RubyArray other = (RubyArray) obj;
		return Objects.equals(elements, other.elements);
	}

}
