package org.splc.compiler.frontend.irgen;

/**
 * Source of fresh label and variable names for one compilation.
 * <p>
 * Both counters are monotonic and start at zero when the supply is created. Code generation and
 * inlining share one instance, so every generated name is unique across the whole compilation.
 * Generated names start with an upper-case letter, which SPL identifiers never do.
 */
public final class NameSupply {

	private int labelCounter;
	private int variableCounter;

	/**
	 * @param prefix The label prefix, e.g. {@code "T"} or {@code "WX"}.
	 * @return A new label name such as {@code T3}.
	 */
	public String freshLabel(String prefix) {
		return prefix + (++labelCounter);
	}

	/**
	 * Creates a fresh label with the same prefix as an existing generated label.
	 * @param original A label produced by {@link #freshLabel(String)}.
	 * @return A new, distinct label with the same prefix.
	 */
	public String freshLabelLike(String original) {
		int end = original.length();
		while (end > 0 && Character.isDigit(original.charAt(end - 1))) {
			end--;
		}
		return freshLabel(original.substring(0, end));
	}

	/**
	 * @param prefix The category prefix, e.g. {@code "P"} for parameters.
	 * @param base The original variable name.
	 * @return A new variable name such as {@code P4n}.
	 */
	public String freshVariable(String prefix, String base) {
		return prefix + (++variableCounter) + base;
	}
}
