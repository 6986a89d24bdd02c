package i18nscan.trans;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import static i18nscan.model.ruby.RubyBuilder.*;

@RunWith(Parameterized.class)
public class MagicCommentsTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"# i18n-tasks-use t('a.b')", Optional.of("t('a.b')")},
				{"#i18n-tasks-use t(:x)", Optional.of("t(:x)")},
				{"#   i18n-tasks-use   t('spaced')   ", Optional.of("t('spaced')")},
				{"# i18n-tasks-use t('a') # with a note", Optional.of("t('a')  with a note")},
				{"# i18n-tasks-use t('one') t('two')", Optional.of("t('one') t('two')")},
				{"# just a comment", Optional.empty()},
				{"# i18n-tasks-use", Optional.empty()},
				{"# see i18n-tasks-use t('x')", Optional.empty()},
				{"  # i18n-tasks-use t('x')", Optional.empty()},
		});
	}

	private final String text;
	private final Optional<String> expected;

	public MagicCommentsTest(String text, Optional<String> expected) {
		this.text = text;
		this.expected = expected;
	}

	@Test
	public void testSnippet() {
		assertThat(MagicComments.snippetOf(text), is(expected));
	}

	@Test
	public void testSkipMarker() {
		assertFalse(MagicComments.hasSkipMarker(Collections.singletonList(comment(1, text))));
		assertTrue(MagicComments.hasSkipMarker(Arrays.asList(
				comment(1, text), comment(2, "# i18n-tasks-skip-prism"))));
		assertFalse(MagicComments.hasSkipMarker(null));
	}

}
