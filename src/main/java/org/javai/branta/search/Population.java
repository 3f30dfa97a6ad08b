package org.javai.branta.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded population of scored grammars, sorted ascending by score.
 * <p>
 * Entries with equal scores stay in insertion order, so the older of two equally scored
 * grammars sits closer to the low end and is evicted first.
 */
public class Population {

	private final List<PopulationEntry> entries = new ArrayList<>();
	private final int capacity;

	public Population(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be positive");
		}
		this.capacity = capacity;
	}

	/**
	 * Inserts {@code entry} after every entry whose score is not greater, then evicts from the
	 * low end until the population fits its capacity.
	 *
	 * @return the evicted entries, lowest first
	 */
	public List<PopulationEntry> insert(PopulationEntry entry) {
		Objects.requireNonNull(entry, "entry must not be null");
		int index = 0;
		while (index < entries.size() && entries.get(index).score() <= entry.score()) {
			index++;
		}
		entries.add(index, entry);

		List<PopulationEntry> evicted = new ArrayList<>();
		while (entries.size() > capacity) {
			evicted.add(entries.remove(0));
		}
		return evicted;
	}

	public PopulationEntry get(int index) {
		return entries.get(index);
	}

	/**
	 * The lowest-scoring entry.
	 */
	public PopulationEntry weakest() {
		requireNotEmpty();
		return entries.get(0);
	}

	/**
	 * The highest-scoring entry; the newest one among equal scores.
	 */
	public PopulationEntry best() {
		requireNotEmpty();
		return entries.get(entries.size() - 1);
	}

	public double minimumScore() {
		return weakest().score();
	}

	public int size() {
		return entries.size();
	}

	public int capacity() {
		return capacity;
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/**
	 * Snapshot of the entries in ascending score order.
	 */
	public List<PopulationEntry> entries() {
		return List.copyOf(entries);
	}

	private void requireNotEmpty() {
		if (entries.isEmpty()) {
			throw new IllegalStateException("Population is empty");
		}
	}
}
