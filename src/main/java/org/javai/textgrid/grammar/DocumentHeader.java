package org.javai.textgrid.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document-level metadata as declared in the file, kept only until the
 * declared values have been checked against the parsed tiers.
 * <p>
 * Numeric fields are null when the full dialect omits the corresponding key.
 *
 * @param xmin declared start of the time domain
 * @param xmax declared end of the time domain
 * @param size declared number of tiers
 * @param tiersExist whether the file declares {@code <exists>} tiers
 * @param properties free-form {@code key = "value"} lines such as {@code File type}, in file order
 */
public record DocumentHeader(Double xmin, Double xmax, Integer size, boolean tiersExist,
		Map<String, String> properties) {

	public DocumentHeader {
		properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
	}
}
