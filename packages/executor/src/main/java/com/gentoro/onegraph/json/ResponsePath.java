package com.gentoro.onegraph.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable location inside a response tree, e.g. {@code /topProducts/@/reviews/0}.
 *
 * <p>Paths are value objects: two paths with the same elements are equal and share a hash code,
 * so they can be used as map keys. On the wire a path is a JSON array of strings and integers,
 * such as {@code ["topProducts", "@", "reviews", 0]}.
 */
public final class ResponsePath implements Iterable<PathElement> {

  private static final ResponsePath EMPTY = new ResponsePath(List.of());

  private final List<PathElement> elements;

  private ResponsePath(List<PathElement> elements) {
    this.elements = elements;
  }

  public static ResponsePath empty() {
    return EMPTY;
  }

  public static ResponsePath of(PathElement... elements) {
    return elements.length == 0 ? EMPTY : new ResponsePath(List.of(elements));
  }

  public static ResponsePath of(List<PathElement> elements) {
    return elements.isEmpty() ? EMPTY : new ResponsePath(List.copyOf(elements));
  }

  /**
   * Parse a slash separated path such as {@code "obj/arr/@/name"}. A leading slash is allowed.
   * Numeric segments become indices and {@code @} becomes the flatten marker.
   */
  public static ResponsePath parse(String text) {
    if (text == null || text.isEmpty() || "/".equals(text)) {
      return EMPTY;
    }
    String body = text.startsWith("/") ? text.substring(1) : text;
    List<PathElement> out = new ArrayList<>();
    for (String segment : body.split("/", -1)) {
      out.add(PathElement.parse(segment));
    }
    return new ResponsePath(List.copyOf(out));
  }

  /**
   * Build a path from its JSON form. Integers become indices; strings are parsed with {@link
   * PathElement#parse(String)} so that {@code "@"} and numeric strings are recognised.
   *
   * @throws IllegalArgumentException when {@code node} is not an array of strings and integers
   */
  public static ResponsePath fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return EMPTY;
    }
    if (node.isTextual()) {
      return parse(node.asText());
    }
    if (!node.isArray()) {
      throw new IllegalArgumentException("path must be a JSON array, got " + node.getNodeType());
    }
    List<PathElement> out = new ArrayList<>(node.size());
    for (JsonNode segment : node) {
      if (segment.isIntegralNumber()) {
        out.add(PathElement.index(segment.asInt()));
      } else if (segment.isTextual()) {
        out.add(PathElement.parse(segment.asText()));
      } else {
        throw new IllegalArgumentException("invalid path segment: " + segment);
      }
    }
    return of(out);
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ResponsePath fromJsonValues(List<Object> segments) {
    if (segments == null || segments.isEmpty()) {
      return EMPTY;
    }
    List<PathElement> out = new ArrayList<>(segments.size());
    for (Object segment : segments) {
      if (segment instanceof Number number) {
        out.add(PathElement.index(number.intValue()));
      } else if (segment instanceof String text) {
        out.add(PathElement.parse(text));
      } else {
        throw new IllegalArgumentException("invalid path segment: " + segment);
      }
    }
    return of(out);
  }

  @JsonValue
  public List<Object> toJsonValues() {
    List<Object> out = new ArrayList<>(elements.size());
    for (PathElement element : elements) {
      out.add(element.toJsonValue());
    }
    return out;
  }

  public ResponsePath join(ResponsePath other) {
    if (other == null || other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    List<PathElement> joined = new ArrayList<>(elements.size() + other.elements.size());
    joined.addAll(elements);
    joined.addAll(other.elements);
    return new ResponsePath(List.copyOf(joined));
  }

  public ResponsePath append(PathElement element) {
    List<PathElement> joined = new ArrayList<>(elements.size() + 1);
    joined.addAll(elements);
    joined.add(element);
    return new ResponsePath(List.copyOf(joined));
  }

  public ResponsePath appendKey(String key) {
    return append(PathElement.key(key));
  }

  public ResponsePath appendIndex(int index) {
    return append(PathElement.index(index));
  }

  /** The path without its last element, or {@code null} for the empty path. */
  public ResponsePath parent() {
    if (isEmpty()) {
      return null;
    }
    return of(elements.subList(0, elements.size() - 1));
  }

  /** Elements from {@code fromIndex} (inclusive) to the end. */
  public ResponsePath subPath(int fromIndex) {
    if (fromIndex >= elements.size()) {
      return EMPTY;
    }
    return of(elements.subList(fromIndex, elements.size()));
  }

  public PathElement last() {
    return isEmpty() ? null : elements.get(elements.size() - 1);
  }

  public PathElement get(int index) {
    return elements.get(index);
  }

  public boolean startsWith(ResponsePath prefix) {
    if (prefix.size() > size()) {
      return false;
    }
    return elements.subList(0, prefix.size()).equals(prefix.elements);
  }

  public boolean containsFlatten() {
    return elements.stream().anyMatch(e -> e instanceof PathElement.Flatten);
  }

  /** Drops a trailing {@code @}; other flatten markers are kept. */
  public ResponsePath withoutTrailingFlatten() {
    return last() instanceof PathElement.Flatten ? parent() : this;
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public int size() {
    return elements.size();
  }

  public List<PathElement> elements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public Iterator<PathElement> iterator() {
    return elements.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResponsePath other)) return false;
    return elements.equals(other.elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    if (elements.isEmpty()) {
      return "/";
    }
    StringBuilder sb = new StringBuilder();
    for (PathElement element : elements) {
      sb.append('/').append(element);
    }
    return sb.toString();
  }
}
