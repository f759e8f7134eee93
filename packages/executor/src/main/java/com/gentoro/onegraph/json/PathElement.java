package com.gentoro.onegraph.json;

/**
 * One segment of a {@link ResponsePath}.
 *
 * <p>A segment is either a field {@link Key}, an array {@link Index}, or the {@link Flatten}
 * marker ({@code @}) that stands for every element of an array.
 */
public sealed interface PathElement {

  String FLATTEN_MARKER = "@";

  /** Value used when the element is written to JSON (a string or an integer). */
  Object toJsonValue();

  static PathElement key(String name) {
    return new Key(name);
  }

  static PathElement index(int index) {
    return new Index(index);
  }

  static PathElement flatten() {
    return Flatten.INSTANCE;
  }

  /**
   * Parse a textual segment: {@code @} is the flatten marker, a non-negative integer is an index,
   * anything else is a key.
   */
  static PathElement parse(String segment) {
    if (FLATTEN_MARKER.equals(segment)) {
      return Flatten.INSTANCE;
    }
    if (!segment.isEmpty() && segment.chars().allMatch(Character::isDigit)) {
      try {
        return new Index(Integer.parseInt(segment));
      } catch (NumberFormatException e) {
        return new Key(segment);
      }
    }
    return new Key(segment);
  }

  record Key(String name) implements PathElement {
    public Key {
      if (name == null) {
        throw new IllegalArgumentException("path key must not be null");
      }
    }

    @Override
    public Object toJsonValue() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  record Index(int value) implements PathElement {
    public Index {
      if (value < 0) {
        throw new IllegalArgumentException("path index must not be negative: " + value);
      }
    }

    @Override
    public Object toJsonValue() {
      return value;
    }

    @Override
    public String toString() {
      return Integer.toString(value);
    }
  }

  final class Flatten implements PathElement {
    static final Flatten INSTANCE = new Flatten();

    private Flatten() {}

    @Override
    public Object toJsonValue() {
      return FLATTEN_MARKER;
    }

    @Override
    public String toString() {
      return FLATTEN_MARKER;
    }
  }
}
