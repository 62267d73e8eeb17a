package com.familygraph.layout;

/**
 * Engine-internal coordinate: {@code depth} along the generation axis,
 * {@code family} along the axis separating siblings and spouses.
 */
public record Placement(double depth, double family) {
}
