package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyConstantRead;
import i18nscan.model.ruby.RubyModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class ModuleNode extends NormalizedNode {

	private final List<Normalized> children;

	public ModuleNode(RubyModule origin, List<Normalized> children) {
		super(origin);
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	@Override
	public RubyModule getOrigin() {
		return (RubyModule) super.getOrigin();
	}

	/**
	 * @return the module name when it is a plain constant, otherwise null
	 */
	public String getName() {
		if (getOrigin().getConstantPath() instanceof RubyConstantRead) {
			return ((RubyConstantRead) getOrigin().getConstantPath()).getName();
		}
		return null;
	}

	public List<Normalized> getChildren() {
		return children;
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
		ModuleNode other = (ModuleNode) obj;
		return Objects.equals(getName(), other.getName()) && children.equals(other.children);
	}

}
