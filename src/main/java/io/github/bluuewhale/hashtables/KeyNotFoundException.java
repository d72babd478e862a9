package io.github.bluuewhale.hashtables;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link HashTable#lookup} and {@link HashTable#delete} when the table holds no mapping
 * for the requested key.
 */
public class KeyNotFoundException extends NoSuchElementException {

	private final transient Object key;

	public KeyNotFoundException(Object key) {
		super("Key not found: " + key);
		this.key = key;
	}

	public Object getKey() {
		return key;
	}
}
