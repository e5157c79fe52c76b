package org.javai.textgrid;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.javai.textgrid.check.ConsistencyChecker;
import org.javai.textgrid.grammar.FullGrammarStrategy;
import org.javai.textgrid.grammar.GrammarStrategy;
import org.javai.textgrid.grammar.MinimalGrammarStrategy;
import org.javai.textgrid.grammar.ParsedTextGrid;
import org.javai.textgrid.lexer.TextGridLexer;
import org.javai.textgrid.lexer.TextGridToken;
import org.javai.textgrid.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading Praat TextGrid documents.
 * <p>
 * Each call reads the whole input, tokenizes it for the selected encoding, runs the
 * matching grammar and, when requested, checks the declared metadata against the
 * tiers that were built. Any failure aborts the call; no partial result is returned.
 * <p>
 * Example usage:
 *
 * <pre>
 * TextGridParser parser = new TextGridParser();
 * List&lt;Tier&gt; tiers = parser.parse(Path.of("speech.TextGrid"), ParseOptions.of("full"));
 *
 * // positional encoding, metadata not verified
 * List&lt;Tier&gt; loose = parser.parse(text, "minimal", false);
 * </pre>
 *
 * A parser keeps no per-call state and may be shared between threads.
 */
public class TextGridParser {

	private static final Logger logger = LoggerFactory.getLogger(TextGridParser.class);

	private final TextGridSettings settings;
	private final ConsistencyChecker checker = new ConsistencyChecker();

	/**
	 * Creates a parser whose defaults come from {@value TextGridSettings#RESOURCE}, if present.
	 */
	public TextGridParser() {
		this(TextGridSettings.load(TextGridParser.class.getClassLoader()));
	}

	public TextGridParser(TextGridSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	/**
	 * Parses a document using the default options.
	 *
	 * @see #parse(Object, ParseOptions)
	 */
	public List<Tier> parse(Object source) {
		return parse(source, settings.toOptions());
	}

	/**
	 * Parses a document.
	 *
	 * @param source a {@link Path}, {@link File}, {@link Reader}, {@link InputStream} or
	 *               {@link CharSequence} holding the complete document
	 * @param format {@code full} or {@code minimal}
	 * @param checkConsistency whether declared metadata is verified
	 * @throws IllegalArgumentException if the format name is not supported
	 */
	public List<Tier> parse(Object source, String format, boolean checkConsistency) {
		ParseOptions options = settings.toOptions()
				.withFormat(TextGridFormat.fromName(format))
				.withConsistencyCheck(checkConsistency);
		return parse(source, options);
	}

	/**
	 * Parses a document.
	 *
	 * @param source a {@link Path}, {@link File}, {@link Reader}, {@link InputStream} or
	 *               {@link CharSequence} holding the complete document
	 * @param options the options of this call
	 * @return the tiers in file declaration order
	 * @throws UnsupportedInputException if the source is of any other type, or null
	 * @throws org.javai.textgrid.lexer.LexicalException if the text contains a character that starts no token
	 * @throws org.javai.textgrid.grammar.TextGridSyntaxException if the tokens do not form a document
	 * @throws org.javai.textgrid.check.ConsistencyException if checking is on and the declared metadata disagrees
	 * @throws UncheckedIOException if the source cannot be read
	 */
	public List<Tier> parse(Object source, ParseOptions options) {
		Objects.requireNonNull(options, "options must not be null");
		if (source instanceof Path path) {
			return parsePath(path, options);
		} else if (source instanceof File file) {
			return parsePath(file.toPath(), options);
		} else if (source instanceof Reader reader) {
			return parseReader(reader, options);
		} else if (source instanceof InputStream stream) {
			return parseStream(stream, options);
		} else if (source instanceof CharSequence text) {
			return parseText(text, options);
		}
		throw new UnsupportedInputException(source == null ? null : source.getClass());
	}

	public List<Tier> parsePath(Path path, ParseOptions options) {
		Objects.requireNonNull(path, "path must not be null");
		byte[] bytes;
		try {
			bytes = Files.readAllBytes(path);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read TextGrid from " + path, e);
		}
		logger.debug("Read {} bytes from {}", bytes.length, path);
		return parseText(decode(bytes, options.charset()), options);
	}

	/**
	 * Reads the stream to its end. The stream is not closed.
	 */
	public List<Tier> parseStream(InputStream stream, ParseOptions options) {
		Objects.requireNonNull(stream, "stream must not be null");
		byte[] bytes;
		try {
			bytes = stream.readAllBytes();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read TextGrid from input stream", e);
		}
		return parseText(decode(bytes, options.charset()), options);
	}

	/**
	 * Reads the reader to its end. The reader is not closed.
	 */
	public List<Tier> parseReader(Reader reader, ParseOptions options) {
		Objects.requireNonNull(reader, "reader must not be null");
		StringBuilder sb = new StringBuilder();
		char[] buffer = new char[8192];
		try {
			int read;
			while ((read = reader.read(buffer, 0, buffer.length)) != -1) {
				sb.append(buffer, 0, read);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read TextGrid from reader", e);
		}
		return parseText(sb, options);
	}

	public List<Tier> parseText(CharSequence text, ParseOptions options) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(options, "options must not be null");

		String input = text.toString();
		if (!input.isEmpty() && input.charAt(0) == '\uFEFF') {
			input = input.substring(1);
		}

		List<TextGridToken> tokens = new TextGridLexer(input, options.format()).tokenize();
		ParsedTextGrid parsed = grammarFor(options.format()).parse(tokens);
		if (options.checkConsistency()) {
			checker.check(parsed);
		}

		logger.debug("Parsed {} tiers from {} tokens ({} format, consistency check {})",
				parsed.tiers().size(), tokens.size(), options.format(), options.checkConsistency() ? "on" : "off");
		return parsed.tiers();
	}

	private GrammarStrategy grammarFor(TextGridFormat format) {
		return switch (format) {
			case FULL -> new FullGrammarStrategy();
			case MINIMAL -> new MinimalGrammarStrategy();
		};
	}

	/**
	 * Decodes file content, honouring a UTF-8 or UTF-16 byte-order mark before the fallback charset.
	 */
	static String decode(byte[] bytes, Charset fallback) {
		if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
			return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
		}
		if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
			return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
		}
		if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
			return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE);
		}
		return new String(bytes, fallback);
	}
}
