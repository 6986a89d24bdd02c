package i18nscan.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.junit.Test;

import i18nscan.model.normalized.Normalized;
import i18nscan.model.normalized.StringPrimitive;
import i18nscan.model.ruby.*;
import i18nscan.trans.CallNames;
import i18nscan.trans.LocatedTranslationCall;
import i18nscan.trans.NormalizationPass;
import i18nscan.trans.TranslationCallCollector;

import static i18nscan.model.ruby.RubyBuilder.*;

public class RubyTreeJsonReaderTest {

	private static String fixture(String name) throws IOException {
		try (InputStream in = RubyTreeJsonReaderTest.class.getResourceAsStream("/dumps/" + name)) {
			assertNotNull("missing fixture " + name, in);
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
	}

	@Test
	public void testReadsTreeAndComments() throws IOException, RubyParseException {
		RubyParseResult result = RubyTreeJsonReader.read(fixture("greeter.json"));

		RubyProgram expected = program(
				classDef("Greeter",
						def("hello",
								call("t", str("greeting.hello"),
										kwargs(assoc("name", other("instance_variable_read_node")))),
								call("render", num(42), decimal("1.5")))));
		assertEquals(expected, result.getProgram());

		assertThat(result.getComments().size(), is(1));
		RubyComment comment = result.getComments().get(0);
		assertEquals("# i18n-tasks-use t('greeting.extra')", comment.getText());
		assertThat(comment.getLocation().getStartLine(), is(3));
	}

	@Test
	public void testLocationsAreKept() throws IOException, RubyParseException {
		RubyParseResult result = RubyTreeJsonReader.read(fixture("greeter.json"));
		RubyClass greeter = (RubyClass) result.getProgram().getStatements().getBody().get(0);
		RubyDef hello = (RubyDef) greeter.getBody().getBody().get(0);
		RubyCall t = (RubyCall) ((RubyStatements) hello.getBody()).getBody().get(0);
		assertThat(t.getLocation().getStartLine(), is(4));
		assertThat(t.getLocation().getStartColumn(), is(4));
		assertThat(t.getLocation().getEndOffset(), is(103));
	}

	@Test
	public void testDumpScansEndToEnd() throws IOException, RubyParseException {
		RubyParseResult result = RubyTreeJsonReader.read(fixture("greeter.json"));
		RubySourceParser snippets = source -> {
			assertEquals("t('greeting.extra')", source);
			return new RubyParseResult(program(call("t", str("greeting.extra"))), Collections.emptyList());
		};
		Normalized normalized = NormalizationPass.perform(result, snippets, CallNames.defaults());
		List<LocatedTranslationCall> found = TranslationCallCollector.collectLocated(normalized);

		assertThat(found.size(), is(2));
		assertEquals(new StringPrimitive("greeting.extra"), found.get(0).getCall().getKey());
		assertThat(found.get(0).getLine(), is(3));
		assertEquals(new StringPrimitive("greeting.hello"), found.get(1).getCall().getKey());
		assertThat(found.get(1).getLine(), is(4));
	}

	@Test
	public void testErrorsAreRejected() throws IOException {
		try {
			RubyTreeJsonReader.read(fixture("syntax_error.json"));
			fail("expected RubyParseException");
		} catch (RubyParseException e) {
			assertThat(e.getMessage(), containsString("unexpected end-of-input"));
		}
	}

	@Test(expected = RubyParseException.class)
	public void testMalformedJson() throws RubyParseException {
		RubyTreeJsonReader.read("{\"value\": ");
	}

	@Test(expected = RubyParseException.class)
	public void testRootMustBeProgram() throws RubyParseException {
		RubyTreeJsonReader.read("{\"value\": {\"type\": \"string_node\", \"location\": {\"start_line\": 1}, " +
				"\"unescaped\": \"x\"}, \"comments\": [], \"errors\": []}");
	}

	@Test(expected = RubyParseException.class)
	public void testMissingField() throws RubyParseException {
		RubyTreeJsonReader.read("{\"value\": {\"type\": \"program_node\", \"location\": {\"start_line\": 1}, " +
				"\"statements\": {\"type\": \"and_node\", \"location\": {\"start_line\": 1}}}}");
	}

	@Test
	public void testUnknownTypesKeepTheirChildren() throws RubyParseException {
		RubyParseResult result = RubyTreeJsonReader.read("{\"value\": {\"type\": \"program_node\", " +
				"\"statements\": {\"type\": \"statements_node\", \"body\": [" +
				"{\"type\": \"parentheses_node\", \"child_nodes\": [" +
				"{\"type\": \"symbol_node\", \"value\": \"x\"}, null]}]}}}");
		assertEquals(program(other("parentheses_node", sym("x"))), result.getProgram());
		assertTrue(result.getComments().isEmpty());
	}

	@Test
	public void testIfWithConsequent() throws RubyParseException {
		RubyParseResult result = RubyTreeJsonReader.read("{\"value\": {\"type\": \"program_node\", " +
				"\"statements\": {\"type\": \"statements_node\", \"body\": [" +
				"{\"type\": \"if_node\", \"predicate\": {\"type\": \"true_node\"}, " +
				"\"statements\": {\"type\": \"statements_node\", \"body\": []}, " +
				"\"consequent\": {\"type\": \"else_node\", " +
				"\"statements\": {\"type\": \"statements_node\", \"body\": []}}}]}}}");
		RubyIf rubyIf = (RubyIf) result.getProgram().getStatements().getBody().get(0);
		assertThat(rubyIf.getSubsequent(), instanceOf(RubyElse.class));
	}

}
