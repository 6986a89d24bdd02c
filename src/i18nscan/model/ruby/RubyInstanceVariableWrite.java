package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyInstanceVariableWrite extends RubyNode {

	private final String name;
	private final RubyNode value;

	public RubyInstanceVariableWrite(SourceLocation location, String name, RubyNode value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public RubyNode getValue() {
		return value;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(value);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyInstanceVariableWrite other = (RubyInstanceVariableWrite) obj;
		return Objects.equals(name, other.name) && Objects.equals(value, other.value);
	}

}
