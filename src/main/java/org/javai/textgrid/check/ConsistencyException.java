package org.javai.textgrid.check;

import org.javai.textgrid.TextGridException;

/**
 * Thrown when a well-formed document declares metadata that disagrees with the
 * tiers actually present in it.
 */
public class ConsistencyException extends TextGridException {

	/**
	 * The rule that was violated, in the order the rules are evaluated.
	 */
	public enum Check {
		TIER_COUNT,
		DOCUMENT_BOUNDS,
		ITEM_COUNT,
		TIER_BOUNDS
	}

	private final Check check;
	private final String tierName;
	private final String field;
	private final Number declared;
	private final Number actual;

	public ConsistencyException(String message, Check check, String tierName, String field,
			Number declared, Number actual) {
		super(message);
		this.check = check;
		this.tierName = tierName;
		this.field = field;
		this.declared = declared;
		this.actual = actual;
	}

	public Check check() {
		return check;
	}

	/**
	 * Name of the offending tier, or {@code null} when the document header itself is at fault.
	 */
	public String tierName() {
		return tierName;
	}

	/**
	 * The declared field that disagrees: {@code size}, {@code xmin} or {@code xmax}.
	 */
	public String field() {
		return field;
	}

	/**
	 * The declared value, or {@code null} when the header omits it.
	 */
	public Number declared() {
		return declared;
	}

	public Number actual() {
		return actual;
	}
}
