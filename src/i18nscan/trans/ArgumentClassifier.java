package i18nscan.trans;

import i18nscan.InternalScannerError;
import i18nscan.model.normalized.MappingPrimitive;
import i18nscan.model.normalized.Normalized;
import i18nscan.model.normalized.NormalizedList;
import i18nscan.model.ruby.RubyCall;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the arguments of a call into positional values and the options mapping.
 */
public class ArgumentClassifier {

	private ArgumentClassifier() {}

	/**
	 * Normalizes the call's argument list with the given normalizer. Positional values are every non-mapping
	 * result, in order; the options are the first mapping found, or an empty mapping. Any further mapping is
	 * ignored.
	 */
	public static ClassifiedArguments classify(RubyCall call, RubyNormalizingVisitor normalizer) {
		if (call == null || !call.hasArguments()) {
			return ClassifiedArguments.none();
		}
		Normalized normalized = normalizer.normalize(call.getArguments());
		if (normalized.getShape() != Normalized.Shape.LIST) {
			throw new InternalScannerError("argument list normalized to " + normalized.getShape());
		}
		List<Normalized> positional = new ArrayList<>();
		MappingPrimitive options = null;
		for (Normalized value : ((NormalizedList) normalized).getElements()) {
			if (value instanceof MappingPrimitive) {
				if (options == null) {
					options = (MappingPrimitive) value;
				}
			} else {
				positional.add(value);
			}
		}
		return new ClassifiedArguments(positional, options == null ? MappingPrimitive.empty() : options);
	}

}
