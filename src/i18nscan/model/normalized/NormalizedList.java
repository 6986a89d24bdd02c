package i18nscan.model.normalized;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ordered sequence of results. Used both for statement sequences that produce no node of their own and for
 * array literal values. The empty list means "nothing to collect".
 */
public class NormalizedList extends Normalized {

	private static final NormalizedList EMPTY = new NormalizedList(Collections.emptyList());

	private final List<Normalized> elements;

	public NormalizedList(List<Normalized> elements) {
		this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
	}

	public static NormalizedList empty() {
		return EMPTY;
	}

	public static NormalizedList of(Normalized... elements) {
		return new NormalizedList(Arrays.asList(elements));
	}

	/**
	 * Splices nested lists into a single list, recursively, keeping order. The result contains nodes and primitives
	 * only. Mappings are primitives, so their contents are left alone.
	 */
	public static NormalizedList flatten(List<Normalized> results) {
		List<Normalized> flat = new ArrayList<>();
		for (Normalized result : results) {
			spliceInto(flat, result);
		}
		return new NormalizedList(flat);
	}

	private static void spliceInto(List<Normalized> flat, Normalized result) {
		if (result.getShape() == Shape.LIST) {
			for (Normalized element : ((NormalizedList) result).elements) {
				spliceInto(flat, element);
			}
		} else {
			flat.add(result);
		}
	}

	public NormalizedList flatten() {
		return flatten(elements);
	}

	public List<Normalized> getElements() {
		return elements;
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	public int size() {
		return elements.size();
	}

	@Override
	public Shape getShape() {
		return Shape.LIST;
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		NormalizedList other = (NormalizedList) obj;
		return elements.equals(other.elements);
	}

}
