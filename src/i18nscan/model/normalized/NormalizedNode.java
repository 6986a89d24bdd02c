package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyNode;
import i18nscan.util.SourceLocation;

/**
 * A structural node of the normalized tree. It keeps a read-only reference to the raw node it was built from, so
 * that later stages can slice the original source.
 */
public abstract class NormalizedNode extends Normalized {

	private final RubyNode origin;

	public NormalizedNode(RubyNode origin) {
		this.origin = origin;
	}

	public RubyNode getOrigin() {
		return origin;
	}

	public SourceLocation getLocation() {
		return origin.getLocation();
	}

	@Override
	public Shape getShape() {
		return Shape.NODE;
	}

}
