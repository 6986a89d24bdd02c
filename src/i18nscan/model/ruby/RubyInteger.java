package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RubyInteger extends RubyNode {

	private final BigInteger value;

	public RubyInteger(SourceLocation location, BigInteger value) {
		super(location);
		this.value = value;
	}

	public BigInteger getValue() {
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
		RubyInteger other = (RubyInteger) obj;
		return Objects.equals(value, other.value);
	}

	@Override
	public String toString() {
		return value.toString();
	}

}
