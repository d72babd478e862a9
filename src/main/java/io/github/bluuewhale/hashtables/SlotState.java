package io.github.bluuewhale.hashtables;

/**
 * State of a single open-addressing slot.
 */
public enum SlotState {
	/** Never used since the storage was allocated. Ends every probe walk. */
	EMPTY,
	/** Held an entry that has since been deleted. Probe walks step over it. */
	TOMBSTONE,
	OCCUPIED
}
