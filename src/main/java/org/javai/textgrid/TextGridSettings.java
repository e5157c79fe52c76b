package org.javai.textgrid;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Library-wide defaults for parse calls that do not pass their own {@link ParseOptions}.
 * <p>
 * Defaults are read from the classpath resource {@value #RESOURCE} when present:
 *
 * <pre>
 * default_format: full        # full | minimal
 * check_consistency: true
 * charset: UTF-8
 * </pre>
 *
 * Keys that are absent keep their built-in value.
 */
public record TextGridSettings(TextGridFormat defaultFormat, boolean checkConsistency, Charset charset) {

	public static final String RESOURCE = "META-INF/textgrid-parser.yml";

	private static final Logger logger = LoggerFactory.getLogger(TextGridSettings.class);

	public TextGridSettings {
		Objects.requireNonNull(defaultFormat, "defaultFormat must not be null");
		Objects.requireNonNull(charset, "charset must not be null");
	}

	public static TextGridSettings builtIn() {
		return new TextGridSettings(TextGridFormat.FULL, true, StandardCharsets.UTF_8);
	}

	/**
	 * Loads the settings resource from the given class loader, falling back to the
	 * built-in defaults when it is absent.
	 *
	 * @throws IllegalStateException if the resource exists but cannot be read
	 */
	public static TextGridSettings load(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(RESOURCE)) {
			if (is == null) {
				logger.debug("No {} on the classpath; using built-in defaults", RESOURCE);
				return builtIn();
			}
			return parse(is);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + RESOURCE, e);
		}
	}

	/**
	 * Parses settings from YAML.
	 *
	 * @throws IllegalStateException if the YAML is malformed or holds invalid values
	 */
	public static TextGridSettings parse(InputStream inputStream) {
		try {
			Map<String, Object> data = new Yaml().load(inputStream);
			return build(data);
		}
		catch (RuntimeException e) {
			throw new IllegalStateException("Invalid TextGrid parser settings in " + RESOURCE, e);
		}
	}

	/**
	 * Parses settings from a YAML string.
	 *
	 * @throws IllegalStateException if the YAML is malformed or holds invalid values
	 */
	public static TextGridSettings parseString(String yamlContent) {
		try {
			Map<String, Object> data = new Yaml().load(yamlContent);
			return build(data);
		}
		catch (RuntimeException e) {
			throw new IllegalStateException("Invalid TextGrid parser settings", e);
		}
	}

	public ParseOptions toOptions() {
		return new ParseOptions(defaultFormat, checkConsistency, charset);
	}

	private static TextGridSettings build(Map<String, Object> data) {
		TextGridSettings defaults = builtIn();
		if (data == null) {
			return defaults;
		}

		Object format = data.get("default_format");
		Object check = data.get("check_consistency");
		Object charset = data.get("charset");
		if (check != null && !(check instanceof Boolean)) {
			throw new IllegalArgumentException("check_consistency must be true or false, got: " + check);
		}

		return new TextGridSettings(
				format != null ? TextGridFormat.fromName(format.toString()) : defaults.defaultFormat(),
				check != null ? (Boolean) check : defaults.checkConsistency(),
				charset != null ? Charset.forName(charset.toString()) : defaults.charset()
		);
	}
}
