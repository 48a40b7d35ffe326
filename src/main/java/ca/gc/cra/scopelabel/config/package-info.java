/**
 * Labeling configuration and its file loaders.
 * <p><strong>Role:</strong> Bootstrap layer resolving the settings of the default labeling context.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Names are validated with {@code ca.gc.cra.scopelabel.validation} utilities.</p>
 */
package ca.gc.cra.scopelabel.config;
