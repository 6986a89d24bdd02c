package i18nscan.trans;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import i18nscan.model.normalized.*;
import i18nscan.model.ruby.RubyComment;
import i18nscan.model.ruby.RubyParseResult;
import i18nscan.model.ruby.RubyProgram;

import static i18nscan.model.ruby.RubyBuilder.*;
import static i18nscan.trans.RubyNormalizingVisitorTest.lines;

public class NormalizationPassTest {

	private FakeSnippetParser parser;

	@Before
	public void setup() {
		parser = new FakeSnippetParser()
				.on("t('x.y')", program(call("t", str("x.y"))))
				.on("private", program(call("private")));
	}

	@Test
	public void testCommentTranslationAttachesToNextLine() {
		RubyProgram root = program(
				callAt(2, "render", sym("dynamic")),
				callAt(3, "render", sym("other")));
		Normalized result = NormalizationPass.perform(root,
				Collections.singletonList(comment(1, "# i18n-tasks-use t('x.y')")), parser, CallNames.defaults());

		NormalizedList calls = (NormalizedList) result;
		CallNode documented = (CallNode) calls.getElements().get(0);
		assertThat(documented.getCommentTranslations().size(), is(1));
		assertEquals(new StringPrimitive("x.y"), documented.getCommentTranslations().get(0).getKey());
		assertTrue(((CallNode) calls.getElements().get(1)).getCommentTranslations().isEmpty());
		assertThat(result.toString(), is(lines("[render(...)", "    # t(\"x.y\"), render(...)]")));
	}

	@Test
	public void testCommentTranslationOnTranslationCall() {
		RubyProgram root = program(callAt(8, "t", str("real")));
		Normalized result = NormalizationPass.perform(
				new RubyParseResult(root, Collections.singletonList(comment(7, "# i18n-tasks-use t('x.y')"))),
				parser, CallNames.defaults());
		TranslationCallNode call = (TranslationCallNode) ((NormalizedList) result).getElements().get(0);
		assertEquals(new StringPrimitive("real"), call.getKey());
		assertEquals(new StringPrimitive("x.y"), call.getCommentTranslations().get(0).getKey());
	}

	@Test
	public void testEveryCallOnTheNextLineCarriesTheCommentTranslations() {
		// x = foo || bar
		RubyProgram root = program(localWrite("x", or(callAt(2, "foo"), callAt(2, "bar"))));
		Normalized result = NormalizationPass.perform(root,
				Collections.singletonList(comment(1, "# i18n-tasks-use t('x.y')")), parser, CallNames.defaults());

		List<LocatedTranslationCall> located = TranslationCallCollector.collectLocated(result);
		assertThat(located.size(), is(2));
		for (LocatedTranslationCall call : located) {
			assertEquals(new StringPrimitive("x.y"), call.getCall().getKey());
			assertThat(call.getLine(), is(1));
		}
	}

	@Test
	public void testNoCommentsMeansNoAttachments() {
		RubyProgram root = program(callAt(2, "render"));
		Normalized result = NormalizationPass.perform(root, null, parser, CallNames.defaults());
		assertTrue(((CallNode) ((NormalizedList) result).getElements().get(0)).getCommentTranslations().isEmpty());
		assertTrue(parser.getRequested().isEmpty());
	}

	@Test
	public void testSnippetDoesNotChangeVisibilityOfTheFile() {
		RubyProgram root = program(classDef("Foo", callAt(3, "helper"), def("shown")));
		Normalized result = NormalizationPass.perform(root,
				Collections.singletonList(comment(2, "# i18n-tasks-use private")), parser, CallNames.defaults());
		ClassNode classNode = (ClassNode) ((NormalizedList) result).getElements().get(0);
		assertFalse(((DefNode) classNode.getChildren().get(1)).isPrivate());
	}

	@Test
	public void testSameInputGivesEqualTrees() {
		RubyProgram root = program(
				classDef("Foo", callAt(2, "render"), call("private"), def("a", call("t", str("a")))));
		List<RubyComment> comments = Arrays.asList(comment(1, "# i18n-tasks-use t('x.y')"));
		assertEquals(
				NormalizationPass.perform(root, comments, parser, CallNames.defaults()),
				NormalizationPass.perform(root, comments, parser, CallNames.defaults()));
	}

}
