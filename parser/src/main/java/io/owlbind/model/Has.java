package io.owlbind.model;

import java.util.List;
import java.util.Objects;

/**
 * An assertion without subject: a relation name and one or more values. The subject is the
 * {@link Individual} whose assertion list holds it.
 */
public final class Has {
  /** Relation name of a value that the owning element renames after itself. */
  public static final String VALUE_PLACEHOLDER = "@@value";

  private final String attribute;
  private final List<Value> values;

  public Has(String attribute, Value value) {
    this(attribute, List.of(value));
  }

  public Has(String attribute, List<? extends Value> values) {
    this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
    if (values.isEmpty()) {
      throw new IllegalArgumentException("An assertion needs at least one value: " + attribute);
    }
    this.values = List.copyOf(values);
  }

  /** Creates a placeholder assertion for a value whose relation name is not known yet. */
  public static Has placeholder(Value value) {
    return new Has(VALUE_PLACEHOLDER, value);
  }

  public String getAttribute() {
    return attribute;
  }

  public List<Value> getValues() {
    return values;
  }

  /** Returns the first value; single-valued assertions only have this one. */
  public Value getValue() {
    return values.get(0);
  }

  public boolean isMultiValued() {
    return values.size() > 1;
  }

  public boolean isPlaceholder() {
    return VALUE_PLACEHOLDER.equals(attribute);
  }

  /** Returns the same values under another relation name. */
  public Has renamed(String newAttribute) {
    return new Has(newAttribute, values);
  }

  @Override
  public String toString() {
    return "Has{" + attribute + "=" + (isMultiValued() ? values : getValue()) + "}";
  }
}
