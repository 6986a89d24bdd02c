package i18nscan.model.ruby;

import i18nscan.util.SourceLocatable;
import i18nscan.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A node of the raw Ruby syntax tree, as handed over by the external parser.
 *
 * Raw nodes are immutable. Equality is structural and ignores source locations.
 */
public abstract class RubyNode extends SourceLocatable {

	private final SourceLocation location;

	public RubyNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the children of this node that are present, in source order
	 */
	public abstract List<RubyNode> getChildNodes();

	public abstract <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	static List<RubyNode> presentChildren(RubyNode... nodes) {
		List<RubyNode> result = new ArrayList<>();
		for (RubyNode node : nodes) {
			if (node != null) {
				result.add(node);
			}
		}
		return Collections.unmodifiableList(result);
	}

	static List<RubyNode> presentChildren(List<? extends RubyNode> first, RubyNode... rest) {
		List<RubyNode> result = new ArrayList<>(first);
		result.addAll(presentChildren(rest));
		return Collections.unmodifiableList(result);
	}

	static <N extends RubyNode> List<N> frozen(List<N> nodes) {
		return Collections.unmodifiableList(new ArrayList<>(nodes));
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + Arrays.toString(getChildNodes().toArray());
	}

}
