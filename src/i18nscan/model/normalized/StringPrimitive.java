package i18nscan.model.normalized;

import java.util.Objects;

public class StringPrimitive extends Primitive {

	private final String value;

	public StringPrimitive(String value) {
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
		StringPrimitive other = (StringPrimitive) obj;
		return Objects.equals(value, other.value);
	}

}
