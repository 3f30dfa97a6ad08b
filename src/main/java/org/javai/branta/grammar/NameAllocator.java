package org.javai.branta.grammar;

import java.util.Collection;

/**
 * Mints nonterminal names of the form {@code t<n>}.
 */
public final class NameAllocator {

	public static final String PREFIX = "t";

	private NameAllocator() {
	}

	public static String name(int index) {
		return PREFIX + index;
	}

	/**
	 * Returns a name that collides with none of {@code taken}.
	 */
	public static String fresh(Collection<String> taken) {
		int index = taken.size();
		while (taken.contains(name(index))) {
			index++;
		}
		return name(index);
	}
}
