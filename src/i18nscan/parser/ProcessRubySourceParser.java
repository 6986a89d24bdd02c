package i18nscan.parser;

import i18nscan.model.ruby.RubyParseResult;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * Parses Ruby by running an external command that reads source text on standard input and writes a JSON tree dump
 * (see {@link RubyTreeJsonReader}) on standard output.
 */
public class ProcessRubySourceParser implements RubySourceParser {

	private static final Logger logger = Logger.getLogger("i18nscan.ProcessRubySourceParser");

	private final List<String> command;

	public ProcessRubySourceParser(List<String> command) {
		if (command.isEmpty()) {
			throw new IllegalArgumentException("parser command must not be empty");
		}
		this.command = Collections.unmodifiableList(new ArrayList<>(command));
	}

	public List<String> getCommand() {
		return command;
	}

	@Override
	public RubyParseResult parse(String source) throws RubyParseException {
		logger.fine("running parser " + command);
		Process process;
		try {
			process = new ProcessBuilder(command).start();
		} catch (IOException e) {
			throw new RubyParseException("could not start parser " + command + ": " + e.getMessage(), e);
		}
		try {
			// both output pipes are drained on the side so the parser never blocks on a full pipe while we write
			CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readQuietly(process.getErrorStream()));
			CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readStdout(process.getInputStream()));
			try (OutputStream stdin = process.getOutputStream()) {
				IOUtils.write(source, stdin, StandardCharsets.UTF_8);
			} catch (IOException e) {
				// the parser may exit without reading all of its input; its status and output decide the result
				logger.fine("parser " + command + " closed its input early: " + e.getMessage());
			}
			String dump;
			try {
				dump = stdout.get();
			} catch (ExecutionException e) {
				Throwable cause = e.getCause() instanceof UncheckedIOException ? e.getCause().getCause() : e.getCause();
				throw new IOException(cause.getMessage(), cause);
			}
			int exitCode = process.waitFor();
			if (exitCode != 0) {
				throw new RubyParseException("parser " + command + " exited with status " + exitCode + ": " +
						stderr.join().trim());
			}
			return RubyTreeJsonReader.read(dump);
		} catch (IOException e) {
			throw new RubyParseException("error communicating with parser " + command + ": " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RubyParseException("interrupted while waiting for parser " + command, e);
		} finally {
			process.destroy();
		}
	}

	private static String readStdout(InputStream in) {
		try (InputStream stream = in) {
			return IOUtils.toString(stream, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private static String readQuietly(InputStream in) {
		try (InputStream stream = in) {
			return IOUtils.toString(stream, StandardCharsets.UTF_8);
		} catch (IOException e) {
			return "(stderr unavailable: " + e.getMessage() + ")";
		}
	}

}
