package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A {@code key => value} or {@code key: value} pair inside a hash or keyword argument list.
 */
public class RubyAssoc extends RubyNode {

	private final RubyNode key;
	private final RubyNode value;

	public RubyAssoc(SourceLocation location, RubyNode key, RubyNode value) {
		super(location);
		this.key = key;
		this.value = value;
	}

	public RubyNode getKey() {
		return key;
	}

	public RubyNode getValue() {
		return value;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(key, value);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyAssoc other = (RubyAssoc) obj;
		return Objects.equals(key, other.key) && Objects.equals(value, other.value);
	}

}
