package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyLambda extends RubyNode {

	private final RubyNode body;

	public RubyLambda(SourceLocation location, RubyNode body) {
		super(location);
		this.body = body;
	}

	/**
	 * @return the lambda body (usually {@link RubyStatements}), or null for {@code -> {}}
	 */
	public RubyNode getBody() {
		return body;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(body);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyLambda other = (RubyLambda) obj;
		return Objects.equals(body, other.body);
	}

}
