package ca.gc.cra.scopelabel.label;

import ca.gc.cra.scopelabel.validation.Segments;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Produces reproducible labels from an optional name and an optional scope.
 * <p><strong>Why:</strong> Entities can be labeled without every caller naming them explicitly, while repeated
 * runs of the same code still yield the same labels.</p>
 * <p><strong>Role:</strong> Entry point combining {@link LabelScope} resolution with per-scope counters.</p>
 * <p><strong>Thread-safety:</strong> Inherits the single-threaded contract of its {@link LabelingContext}.</p>
 * <p><strong>Observability:</strong> The global-fallback warning is logged by {@link LabelScope#enter()}.</p>
 *
 * <pre>{@code
 * generator.autoLabel("bar");          // bar
 * generator.autoLabel();               // global/1
 * try (var foo = LabelScope.fromBasename(context, "foo").enter()) {
 *   generator.autoLabel();             // foo/1
 * }
 * try (var another = LabelScope.fromBasename(context, "another").enter()) {
 *   generator.autoLabel();             // another/1
 *   generator.autoLabel("thing");      // another/thing
 *   generator.autoLabel();             // another/2
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class LabelGenerator {
  private final LabelingContext context;

  /**
   * Creates a generator bound to {@code context}.
   *
   * @param context labeling context providing scopes and counters
   */
  public LabelGenerator(LabelingContext context) {
    this.context = Objects.requireNonNull(context, "context");
  }

  /**
   * Generates a label numbered by the active scope, or by the global scope when none is active.
   *
   * @return generated label
   */
  public Label autoLabel() {
    return autoLabel(null, null);
  }

  /**
   * Generates a label for {@code name} beneath the active scope.
   *
   * @param name label name, an existing {@link Label}, or {@code null} to number automatically
   * @return generated label, or {@code name} itself when it already is a label
   */
  public Label autoLabel(CharSequence name) {
    return autoLabel(name, null);
  }

  /**
   * Generates a label.
   *
   * <ol>
   *   <li>A {@link Label} name is returned unchanged, so generating twice is a no-op.</li>
   *   <li>With an explicit {@code scope} the label is {@code scope.path + [name]}, numbering the name from the
   *   scope's counter when absent.</li>
   *   <li>Otherwise a transient scope named {@code name} is entered and exited around this call, and its
   *   resolved path becomes the label. This restarts the counter at that path.</li>
   * </ol>
   *
   * @param name label name, an existing {@link Label}, or {@code null} to number automatically
   * @param scope explicit scope that must already be entered, or {@code null} to use the active scope
   * @return generated label
   * @throws UnresolvedScopeException if {@code scope} was never entered
   * @throws ca.gc.cra.scopelabel.validation.LabelValidationException if {@code name} is not a valid segment
   */
  public Label autoLabel(CharSequence name, LabelScope scope) {
    if (name instanceof Label label) {
      return label;
    }
    String text = name == null ? null : name.toString();

    if (scope != null) {
      scope.checkEntered();
      String segment = text == null
          ? scope.nextLabel()
          : Segments.requireSegment(text, scope.context().config().forbidUnderscore());
      List<String> parts = new ArrayList<>(scope.segments());
      parts.add(segment);
      return Label.of(parts);
    }

    LabelScope transientScope = text == null
        ? LabelScope.unnamed(context)
        : LabelScope.fromBasename(context, text);
    try (LabelScope.Activation activation = transientScope.enter()) {
      return Label.of(activation.scope().segments());
    }
  }
}
