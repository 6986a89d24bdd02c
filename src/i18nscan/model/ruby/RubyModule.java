package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyModule extends RubyNode {

	private final RubyNode constantPath;
	private final RubyStatements body;

	public RubyModule(SourceLocation location, RubyNode constantPath, RubyStatements body) {
		super(location);
		this.constantPath = constantPath;
		this.body = body;
	}

	public RubyNode getConstantPath() {
		return constantPath;
	}

	/**
	 * @return the module body, or null for an empty module
	 */
	public RubyStatements getBody() {
		return body;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(constantPath, body);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constantPath, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyModule other = (RubyModule) obj;
		return Objects.equals(constantPath, other.constantPath) && Objects.equals(body, other.body);
	}

}
