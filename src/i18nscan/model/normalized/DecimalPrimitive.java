package i18nscan.model.normalized;

import java.math.BigDecimal;

/**
 * A decimal literal. Values compare numerically, so {@code 1.5} equals {@code 1.50}.
 */
public class DecimalPrimitive extends Primitive {

	private final BigDecimal value;

	public DecimalPrimitive(BigDecimal value) {
		this.value = value;
	}

	public BigDecimal getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return value.stripTrailingZeros().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		DecimalPrimitive other = (DecimalPrimitive) obj;
		return value.compareTo(other.value) == 0;
	}

}
