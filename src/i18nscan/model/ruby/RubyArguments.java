package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyArguments extends RubyNode {

	private final List<RubyNode> arguments;

	public RubyArguments(SourceLocation location, List<RubyNode> arguments) {
		super(location);
		this.arguments = frozen(arguments);
	}

	public List<RubyNode> getArguments() {
		return arguments;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyArguments other = (RubyArguments) obj;
		return Objects.equals(arguments, other.arguments);
	}

}
