package com.familygraph.layout;

public record Position(double x, double y) {
}
