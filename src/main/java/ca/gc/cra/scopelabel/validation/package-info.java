/**
 * <strong>Purpose:</strong> Validation helpers for label and scope names.
 * <p><strong>Pipeline role:</strong> Rejects malformed segments before they reach a scope path or label.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct logging; failures surface via
 * {@link ca.gc.cra.scopelabel.validation.LabelValidationException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scopelabel.validation;
