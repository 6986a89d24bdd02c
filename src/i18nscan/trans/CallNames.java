package i18nscan.trans;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The method names the normalizer gives special meaning to: translation lookups, whose first argument is a key,
 * and visibility toggles, after which method definitions are private.
 *
 * A derived engine may extend either set without touching the dispatch rules.
 */
public class CallNames {

	public static final Set<String> DEFAULT_TRANSLATION_CALLS = Collections.unmodifiableSet(
			new LinkedHashSet<>(Arrays.asList("t", "t!", "translate", "translate!")));
	public static final Set<String> DEFAULT_VISIBILITY_CALLS = Collections.singleton("private");

	private static final CallNames DEFAULTS = new CallNames(DEFAULT_TRANSLATION_CALLS, DEFAULT_VISIBILITY_CALLS);

	private final Set<String> translationCalls;
	private final Set<String> visibilityCalls;

	public CallNames(Collection<String> translationCalls, Collection<String> visibilityCalls) {
		this.translationCalls = Collections.unmodifiableSet(new LinkedHashSet<>(translationCalls));
		this.visibilityCalls = Collections.unmodifiableSet(new LinkedHashSet<>(visibilityCalls));
	}

	public static CallNames defaults() {
		return DEFAULTS;
	}

	public CallNames withTranslationCalls(String... extra) {
		Set<String> names = new LinkedHashSet<>(translationCalls);
		names.addAll(Arrays.asList(extra));
		return new CallNames(names, visibilityCalls);
	}

	public CallNames withVisibilityCalls(String... extra) {
		Set<String> names = new LinkedHashSet<>(visibilityCalls);
		names.addAll(Arrays.asList(extra));
		return new CallNames(translationCalls, names);
	}

	public boolean isTranslationCall(String name) {
		return translationCalls.contains(name);
	}

	public boolean isVisibilityToggle(String name) {
		return visibilityCalls.contains(name);
	}

	public Set<String> getTranslationCalls() {
		return translationCalls;
	}

	public Set<String> getVisibilityCalls() {
		return visibilityCalls;
	}

	@Override
	public String toString() {
		return "CallNames [translationCalls=" + translationCalls + ", visibilityCalls=" + visibilityCalls + "]";
	}

}
