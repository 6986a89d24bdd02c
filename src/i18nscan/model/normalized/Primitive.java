package i18nscan.model.normalized;

/**
 * A literal value: string, symbol, integer, decimal or mapping. Sequences are {@link NormalizedList}s.
 */
public abstract class Primitive extends Normalized {

	@Override
	public Shape getShape() {
		return Shape.PRIMITIVE;
	}

}
