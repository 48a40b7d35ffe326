/**
 * Per-namespace counters backing label numbering.
 * <p><strong>Role:</strong> Leaf state consumed by label scopes and the {@code uid} facade.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; no internal synchronization.</p>
 * <p><strong>Performance:</strong> Constant-time hash map updates.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.scopelabel.counter;
