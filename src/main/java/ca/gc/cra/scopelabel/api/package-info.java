/**
 * Static facade over the default labeling context.
 * <p><strong>Role:</strong> Public API for collaborators that label entities without managing contexts.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; shares one process-wide context.</p>
 */
package ca.gc.cra.scopelabel.api;
