package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyClass;
import i18nscan.model.ruby.RubyConstantRead;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A class body. Children are appended one at a time while the body is normalized, in source order.
 */
public class ClassNode extends NormalizedNode {

	private final List<Normalized> children;

	public ClassNode(RubyClass origin) {
		super(origin);
		this.children = new ArrayList<>();
	}

	@Override
	public RubyClass getOrigin() {
		return (RubyClass) super.getOrigin();
	}

	/**
	 * @return the class name when it is a plain constant, otherwise null
	 */
	public String getName() {
		if (getOrigin().getConstantPath() instanceof RubyConstantRead) {
			return ((RubyConstantRead) getOrigin().getConstantPath()).getName();
		}
		return null;
	}

	/**
	 * Appends a normalized body statement. Lists are spliced, so children are always nodes or primitives.
	 */
	public void addChild(Normalized child) {
		children.addAll(NormalizedList.flatten(Collections.singletonList(child)).getElements());
	}

	public List<Normalized> getChildren() {
		return Collections.unmodifiableList(children);
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), children);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		ClassNode other = (ClassNode) obj;
		return Objects.equals(getName(), other.getName()) && children.equals(other.children);
	}

}
