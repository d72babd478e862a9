/**
 * Hash tables built over a fixed-size backing array, one per collision-resolution strategy:
 * {@link io.github.bluuewhale.hashtables.ChainingHashTable},
 * {@link io.github.bluuewhale.hashtables.LinearProbingHashTable} and
 * {@link io.github.bluuewhale.hashtables.QuadraticProbingHashTable}.
 */
@NullMarked
package io.github.bluuewhale.hashtables;

import org.jspecify.annotations.NullMarked;
