package i18nscan.model.normalized;

import java.util.Objects;

/**
 * A symbol, by name without the leading colon. Constant references normalize to symbols as well.
 */
public class SymbolPrimitive extends Primitive {

	private final String value;

	public SymbolPrimitive(String value) {
		this.value = value;
	}

	public String getValue() {
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
		SymbolPrimitive other = (SymbolPrimitive) obj;
		return Objects.equals(value, other.value);
	}

}
