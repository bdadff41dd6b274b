package com.presence.tracking.dto;

import java.util.List;
import java.util.Objects;

/**
 * A named polygonal region of the floor plan. Vertices are ordered and the polygon is assumed to
 * be simple.
 */
public record Zone(String id, String name, List<Coordinate> vertices, boolean enabled) {

  public static final int MIN_VERTICES = 3;

  public Zone {
    Objects.requireNonNull(id, "id");
    vertices = vertices == null ? List.of() : List.copyOf(vertices);
    name = Objects.requireNonNullElse(name, id);
  }

  public static Zone of(String id, List<Coordinate> vertices) {
    return new Zone(id, id, vertices, true);
  }

  /**
   * A polygon is usable when it has at least three finite vertices.
   */
  public boolean isValidPolygon() {
    return vertices.size() >= MIN_VERTICES && vertices.stream().allMatch(Coordinate::isFinite);
  }

  public Zone withEnabled(boolean newEnabled) {
    return new Zone(id, name, vertices, newEnabled);
  }
}
