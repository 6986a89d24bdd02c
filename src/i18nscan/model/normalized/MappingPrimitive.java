package i18nscan.model.normalized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The options mapping of a call, built from its keyword arguments. Insertion order is kept; a repeated key keeps
 * its first position and its last value.
 */
public class MappingPrimitive extends Primitive {

	private static final MappingPrimitive EMPTY = new MappingPrimitive(Collections.emptyMap());

	private final Map<Normalized, Normalized> entries;

	public MappingPrimitive(Map<Normalized, Normalized> entries) {
		this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
	}

	public static MappingPrimitive empty() {
		return EMPTY;
	}

	public Map<Normalized, Normalized> getEntries() {
		return entries;
	}

	public Normalized get(Normalized key) {
		return entries.get(key);
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		MappingPrimitive other = (MappingPrimitive) obj;
		return entries.equals(other.entries);
	}

}
