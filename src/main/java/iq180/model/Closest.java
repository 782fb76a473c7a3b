package iq180.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * The candidate nearest to the target, with {@code distance = |value - target|}.
 * Serialized flat: the solution's fields next to {@code distance}.
 */
public record Closest(@JsonUnwrapped Solution solution, long distance) {
}
