package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyOr extends RubyNode {

	private final RubyNode left;
	private final RubyNode right;

	public RubyOr(SourceLocation location, RubyNode left, RubyNode right) {
		super(location);
		this.left = left;
		this.right = right;
	}

	public RubyNode getLeft() {
		return left;
	}

	public RubyNode getRight() {
		return right;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(left, right);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyOr other = (RubyOr) obj;
		return Objects.equals(left, other.left) && Objects.equals(right, other.right);
	}

}
