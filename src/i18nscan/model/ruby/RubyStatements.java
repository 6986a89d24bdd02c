package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyStatements extends RubyNode {

	private final List<RubyNode> body;

	public RubyStatements(SourceLocation location, List<RubyNode> body) {
		super(location);
		this.body = frozen(body);
	}

	public List<RubyNode> getBody() {
		return body;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return body;
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
		RubyStatements other = (RubyStatements) obj;
		return Objects.equals(body, other.body);
	}

}
