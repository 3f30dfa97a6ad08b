package org.javai.branta.mutation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.branta.grammar.Symbol;

/**
 * Subsequence helpers for {@link BubbleMutation}.
 */
final class Subsequences {

	private Subsequences() {
	}

	/**
	 * All distinct strict subsequences of {@code body}: non-empty, order preserving, not
	 * necessarily contiguous, and different from the body itself. Bodies longer than
	 * {@code maxEnumeratedLength} only contribute their contiguous strict runs, since the full
	 * enumeration doubles with every symbol.
	 */
	static Set<List<Symbol>> strict(List<Symbol> body, int maxEnumeratedLength) {
		Set<List<Symbol>> result = new LinkedHashSet<>();
		int n = body.size();
		if (n < 2) {
			return result;
		}
		if (n <= maxEnumeratedLength) {
			int full = (1 << n) - 1;
			for (int mask = 1; mask < full; mask++) {
				List<Symbol> subsequence = new ArrayList<>(Integer.bitCount(mask));
				for (int i = 0; i < n; i++) {
					if ((mask & (1 << i)) != 0) {
						subsequence.add(body.get(i));
					}
				}
				result.add(List.copyOf(subsequence));
			}
		}
		else {
			for (int length = 1; length < n; length++) {
				for (int start = 0; start + length <= n; start++) {
					result.add(List.copyOf(body.subList(start, start + length)));
				}
			}
		}
		return result;
	}

	static boolean occursAsRun(List<Symbol> body, List<Symbol> run) {
		return Collections.indexOfSubList(body, run) >= 0;
	}

	/**
	 * Replaces the first contiguous occurrence of {@code run} with {@code replacement}. Returns
	 * the body unchanged when the run does not occur.
	 */
	static List<Symbol> replaceFirstRun(List<Symbol> body, List<Symbol> run, Symbol replacement) {
		int start = Collections.indexOfSubList(body, run);
		if (start < 0) {
			return body;
		}
		List<Symbol> replaced = new ArrayList<>(body.size() - run.size() + 1);
		replaced.addAll(body.subList(0, start));
		replaced.add(replacement);
		replaced.addAll(body.subList(start + run.size(), body.size()));
		return replaced;
	}
}
