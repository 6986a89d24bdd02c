package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A local variable on the left hand side of a multiple assignment.
 */
public class RubyLocalVariableTarget extends RubyNode {

	private final String name;

	public RubyLocalVariableTarget(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return Collections.emptyList();
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyLocalVariableTarget other = (RubyLocalVariableTarget) obj;
		return Objects.equals(name, other.name);
	}

}
