package i18nscan.trans;

import i18nscan.model.normalized.MappingPrimitive;
import i18nscan.model.normalized.Normalized;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ClassifiedArguments {

	private static final ClassifiedArguments NONE =
			new ClassifiedArguments(Collections.emptyList(), MappingPrimitive.empty());

	private final List<Normalized> positional;
	private final MappingPrimitive options;

	public ClassifiedArguments(List<Normalized> positional, MappingPrimitive options) {
		this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
		this.options = options;
	}

	public static ClassifiedArguments none() {
		return NONE;
	}

	public List<Normalized> getPositional() {
		return positional;
	}

	/**
	 * @return the first positional value, or null when there is none
	 */
	public Normalized getFirst() {
		return positional.isEmpty() ? null : positional.get(0);
	}

	public MappingPrimitive getOptions() {
		return options;
	}

}
