package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RubyConstantRead extends RubyNode {

	private final String name;

	public RubyConstantRead(SourceLocation location, String name) {
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
		RubyConstantRead other = (RubyConstantRead) obj;
		return Objects.equals(name, other.name);
	}

	@Override
	public String toString() {
		return name;
	}

}
