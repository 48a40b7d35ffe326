/**
 * Label scopes, label values and the label generator.
 * <p><strong>Role:</strong> Core of the labeling subsystem; scopes publish themselves on the context stack and
 * number their children through the counter registry.</p>
 * <p><strong>Concurrency:</strong> Single-threaded per {@link ca.gc.cra.scopelabel.label.LabelingContext}.</p>
 * <p><strong>Observability:</strong> SLF4J logger {@code ca.gc.cra.scopelabel.label.LabelScope} carries the
 * global-fallback warning.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.scopelabel.label;
