package ca.gc.cra.scopelabel.label;

import ca.gc.cra.scopelabel.validation.Segments;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Generated hierarchical identifier such as {@code model/cell/2}.
 * <p><strong>Why:</strong> Behaves like its string form while remembering its path segments, so the label
 * generator can recognize its own output and a label can be turned back into a scope.</p>
 * <p><strong>Role:</strong> Immutable value returned by {@link LabelGenerator}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Observability:</strong> {@link #toString()} is the canonical printable form.</p>
 *
 * <p>{@link #equals(Object)}, {@link #hashCode()} and {@link #compareTo(Label)} follow the canonical string,
 * and {@link #hashCode()} equals the string's hash code. Compare against a plain {@link String} with
 * {@link #contentEquals(CharSequence)}.</p>
 *
 * @since 0.1.0
 */
public final class Label implements CharSequence, Comparable<Label> {
  private final String value;
  private final List<String> parts;

  private Label(String value, List<String> parts) {
    this.value = value;
    this.parts = parts;
  }

  /**
   * Creates a single-part label whose printable value is {@code value} verbatim.
   *
   * @param value label text; must not be {@code null}
   * @return label with {@code parts() == [value]}
   */
  public static Label of(String value) {
    Objects.requireNonNull(value, "value");
    return new Label(value, List.of(value));
  }

  /**
   * Creates a label from ordered path segments joined with {@code /}.
   *
   * @param parts non-empty segment list without {@code null} elements
   * @return label whose printable value is the joined segments
   * @throws IllegalArgumentException if {@code parts} is empty
   */
  public static Label of(List<String> parts) {
    List<String> copy = List.copyOf(parts);
    if (copy.isEmpty()) {
      throw new IllegalArgumentException("label parts must not be empty");
    }
    return new Label(Segments.join(copy), copy);
  }

  /**
   * Reports whether {@code candidate} was already produced as a label.
   *
   * @param candidate any object, possibly {@code null}
   * @return {@code true} if {@code candidate} is a {@link Label}
   */
  public static boolean isLabel(Object candidate) {
    return candidate instanceof Label;
  }

  /**
   * Returns the ordered path segments.
   *
   * @return unmodifiable segment list
   */
  public List<String> parts() {
    return parts;
  }

  /**
   * Converts this label into a pre-resolved scope of the default labeling context.
   *
   * @return new scope whose path equals {@link #parts()}
   */
  public LabelScope asScope() {
    return LabelScope.fromLabel(this);
  }

  /**
   * Converts this label into a pre-resolved scope of {@code context}.
   *
   * @param context owning labeling context
   * @return new scope whose path equals {@link #parts()}
   */
  public LabelScope asScope(LabelingContext context) {
    return LabelScope.fromLabel(context, this);
  }

  /**
   * Compares the printable value with arbitrary text.
   *
   * @param other text to compare; {@code null} never matches
   * @return {@code true} if both have identical characters
   */
  public boolean contentEquals(CharSequence other) {
    return other != null && value.contentEquals(other);
  }

  @Override
  public int length() {
    return value.length();
  }

  @Override
  public char charAt(int index) {
    return value.charAt(index);
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    return value.subSequence(start, end);
  }

  @Override
  public int compareTo(Label other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Label other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
