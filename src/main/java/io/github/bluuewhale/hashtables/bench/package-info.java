/**
 * Load-factor sweep benchmark for the hash tables: bulk insert, lookup, memory and delete
 * measurements, driven from the command line by {@link io.github.bluuewhale.hashtables.bench.BenchmarkMain}.
 */
@NullMarked
package io.github.bluuewhale.hashtables.bench;

import org.jspecify.annotations.NullMarked;
