package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyInterpolatedString extends RubyNode {

	private final List<RubyNode> parts;

	public RubyInterpolatedString(SourceLocation location, List<RubyNode> parts) {
		super(location);
		this.parts = frozen(parts);
	}

	public List<RubyNode> getParts() {
		return parts;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return parts;
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parts);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyInterpolatedString other = (RubyInterpolatedString) obj;
		return Objects.equals(parts, other.parts);
	}

}
