package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyMultiWrite extends RubyNode {

	private final List<RubyNode> targets;
	private final RubyNode value;

	public RubyMultiWrite(SourceLocation location, List<RubyNode> targets, RubyNode value) {
		super(location);
		this.targets = frozen(targets);
		this.value = value;
	}

	public List<RubyNode> getTargets() {
		return targets;
	}

	public RubyNode getValue() {
		return value;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(targets, value);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(targets, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyMultiWrite other = (RubyMultiWrite) obj;
		return Objects.equals(targets, other.targets) && Objects.equals(value, other.value);
	}

}
