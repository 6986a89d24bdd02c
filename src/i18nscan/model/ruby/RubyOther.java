package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Any node kind the normalizer has no dedicated rule for (parentheses, returns, hash literals, ...). Only the
 * parser's type name and the children are kept.
 */
public class RubyOther extends RubyNode {

	private final String type;
	private final List<RubyNode> childNodes;

	public RubyOther(SourceLocation location, String type, List<RubyNode> childNodes) {
		super(location);
		this.type = type;
		this.childNodes = frozen(childNodes);
	}

	public String getType() {
		return type;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return childNodes;
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, childNodes);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyOther other = (RubyOther) obj;
		return Objects.equals(type, other.type) && Objects.equals(childNodes, other.childNodes);
	}

	@Override
	public String toString() {
		return "RubyOther[" + type + "]" + childNodes;
	}

}
