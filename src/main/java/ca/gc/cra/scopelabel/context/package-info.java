/**
 * Keyed context stacks for scoped, globally visible state.
 * <p><strong>Role:</strong> Generic primitive; the label scope layer stores its active scopes here under a fixed key.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; callers own serialization.</p>
 * <p><strong>Observability:</strong> Empty lookups fail with {@link ca.gc.cra.scopelabel.context.NoContextException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.scopelabel.context;
