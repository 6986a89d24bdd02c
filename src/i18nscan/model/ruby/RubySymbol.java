package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RubySymbol extends RubyNode {

	private final String value;

	public RubySymbol(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	/**
	 * @return the symbol name without the leading colon
	 */
	public String getValue() {
		return value;
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
		return Objects.hash(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubySymbol other = (RubySymbol) obj;
		return Objects.equals(value, other.value);
	}

	@Override
	public String toString() {
		return ":" + value;
	}

}
