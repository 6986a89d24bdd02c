package i18nscan.model.normalized;

import java.math.BigInteger;
import java.util.Objects;

public class IntegerPrimitive extends Primitive {

	private final BigInteger value;

	public IntegerPrimitive(BigInteger value) {
		this.value = value;
	}

	public BigInteger getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
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
		IntegerPrimitive other = (IntegerPrimitive) obj;
		return Objects.equals(value, other.value);
	}

}
