package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An if, elsif, or modifier if. The subsequent branch is either another {@link RubyIf} (an elsif) or a
 * {@link RubyElse}.
 */
public class RubyIf extends RubyNode {

	private final RubyNode predicate;
	private final RubyStatements statements;
	private final RubyNode subsequent;

	public RubyIf(SourceLocation location, RubyNode predicate, RubyStatements statements, RubyNode subsequent) {
		super(location);
		this.predicate = predicate;
		this.statements = statements;
		this.subsequent = subsequent;
	}

	public RubyNode getPredicate() {
		return predicate;
	}

	public RubyStatements getStatements() {
		return statements;
	}

	public RubyNode getSubsequent() {
		return subsequent;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(predicate, statements, subsequent);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(predicate, statements, subsequent);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyIf other = (RubyIf) obj;
		return Objects.equals(predicate, other.predicate) && Objects.equals(statements, other.statements) &&
				Objects.equals(subsequent, other.subsequent);
	}

}
