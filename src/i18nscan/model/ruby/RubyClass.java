package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyClass extends RubyNode {

	private final RubyNode constantPath;
	private final RubyNode superclass;
	private final RubyStatements body;

	public RubyClass(SourceLocation location, RubyNode constantPath, RubyNode superclass, RubyStatements body) {
		super(location);
		this.constantPath = constantPath;
		this.superclass = superclass;
		this.body = body;
	}

	public RubyNode getConstantPath() {
		return constantPath;
	}

	public RubyNode getSuperclass() {
		return superclass;
	}

	/**
	 * @return the class body, or null for an empty class
	 */
	public RubyStatements getBody() {
		return body;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(constantPath, superclass, body);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constantPath, superclass, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyClass other = (RubyClass) obj;
		return Objects.equals(constantPath, other.constantPath) && Objects.equals(superclass, other.superclass) &&
				Objects.equals(body, other.body);
	}

}
