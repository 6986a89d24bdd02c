package i18nscan.trans;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import i18nscan.model.normalized.StringPrimitive;
import i18nscan.model.normalized.TranslationCallNode;
import i18nscan.model.ruby.RubyNode;
import i18nscan.model.ruby.RubyProgram;
import i18nscan.model.ruby.RubyStatements;
import i18nscan.util.SourceLocation;

import static i18nscan.model.ruby.RubyBuilder.*;

public class CommentTranslationIndexTest {

	private FakeSnippetParser parser;
	private SnippetTranslationExtractor extractor;

	@Before
	public void setup() {
		parser = new FakeSnippetParser()
				.on("t('x.y')", program(call("t", str("x.y"))))
				.on("t('a') t('b')", program(call("t", str("a")), call("t", str("b"))))
				.on("t('first')", program(call("t", str("first"))))
				.on("t('second')", program(call("t", str("second"))))
				.on("helper(t('nested'))", program(call("helper", call("t", str("nested")))))
				.on("t('k', **opts)", program(call("t", str("k"), kwargs(other("assoc_splat_node", call("opts"))))))
				.on("private", program(call("private")))
				.on("broken()", new RubyProgram(SourceLocation.unknown(), brokenStatements()));
		extractor = new SnippetTranslationExtractor(parser, () -> new RubyNormalizingVisitor(CallNames.defaults()));
	}

	// a tree from a faulty parser that fails as soon as the normalizer reads it
	private static RubyStatements brokenStatements() {
		return new RubyStatements(SourceLocation.unknown(), Collections.emptyList()) {
			@Override
			public List<RubyNode> getBody() {
				throw new NullPointerException("statements were never read");
			}
		};
	}

	private static StringPrimitive keyOf(TranslationCallNode call) {
		return (StringPrimitive) call.getKey();
	}

	@Test
	public void testMagicCommentIsIndexedByItsLine() {
		CommentTranslationIndex index = CommentTranslationIndex.build(
				Collections.singletonList(comment(4, "# i18n-tasks-use t('x.y')")), extractor);
		List<TranslationCallNode> found = index.lookup(4);
		assertThat(found.size(), is(1));
		assertEquals("x.y", keyOf(found.get(0)).getValue());
		assertTrue(index.lookup(5).isEmpty());
		assertThat(index.asMap().keySet(), is(Collections.singleton(4)));
	}

	@Test
	public void testEveryTopLevelTranslationOfASnippet() {
		CommentTranslationIndex index = CommentTranslationIndex.build(
				Collections.singletonList(comment(1, "# i18n-tasks-use t('a') t('b')")), extractor);
		List<TranslationCallNode> found = index.lookup(1);
		assertThat(found.size(), is(2));
		assertEquals("a", keyOf(found.get(0)).getValue());
		assertEquals("b", keyOf(found.get(1)).getValue());
	}

	@Test
	public void testTranslationsNestedInOtherCallsAreNotIndexed() {
		CommentTranslationIndex index = CommentTranslationIndex.build(
				Collections.singletonList(comment(1, "# i18n-tasks-use helper(t('nested'))")), extractor);
		assertTrue(index.isEmpty());
	}

	@Test
	public void testOrdinaryCommentsAreIgnored() {
		CommentTranslationIndex index = CommentTranslationIndex.build(Arrays.asList(
				comment(1, "# frozen_string_literal: true"),
				comment(2, "# TODO translate this")), extractor);
		assertTrue(index.isEmpty());
		assertTrue(parser.getRequested().isEmpty());
	}

	@Test
	public void testFailingSnippetsContributeNothing() {
		CommentTranslationIndex index = CommentTranslationIndex.build(Arrays.asList(
				comment(1, "# i18n-tasks-use t("),
				comment(3, "# i18n-tasks-use t('k', **opts)"),
				comment(5, "# i18n-tasks-use t('x.y')")), extractor);
		assertThat(index.asMap().keySet(), is(Collections.singleton(5)));
		assertThat(parser.getRequested(), is(Arrays.asList("t(", "t('k', **opts)", "t('x.y')")));
	}

	@Test
	public void testRuntimeFailureInSnippetDropsOnlyThatSnippet() {
		CommentTranslationIndex index = CommentTranslationIndex.build(Arrays.asList(
				comment(1, "# i18n-tasks-use broken()"),
				comment(3, "# i18n-tasks-use t('x.y')")), extractor);
		assertThat(index.asMap().keySet(), is(Collections.singleton(3)));
		assertThat(parser.getRequested(), is(Arrays.asList("broken()", "t('x.y')")));
	}

	@Test
	public void testNullCommentsGiveEmptyIndex() {
		assertTrue(CommentTranslationIndex.build(null, extractor).isEmpty());
		assertTrue(CommentTranslationIndex.empty().lookup(1).isEmpty());
	}

	@Test
	public void testLastCommentOnALineWins() {
		CommentTranslationIndex index = CommentTranslationIndex.build(Arrays.asList(
				comment(2, "# i18n-tasks-use t('first')"),
				comment(2, "# i18n-tasks-use t('second')")), extractor);
		List<TranslationCallNode> found = index.lookup(2);
		assertThat(found.size(), is(1));
		assertEquals("second", keyOf(found.get(0)).getValue());
	}

	@Test
	public void testSnippetWithoutTranslationsIsNotIndexed() {
		CommentTranslationIndex index = CommentTranslationIndex.build(
				Collections.singletonList(comment(1, "# i18n-tasks-use private")), extractor);
		assertTrue(index.isEmpty());
	}

}
