package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyProgram extends RubyNode {

	private final RubyStatements statements;

	public RubyProgram(SourceLocation location, RubyStatements statements) {
		super(location);
		this.statements = statements;
	}

	public RubyStatements getStatements() {
		return statements;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(statements);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(statements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyProgram other = (RubyProgram) obj;
		return Objects.equals(statements, other.statements);
	}

}
