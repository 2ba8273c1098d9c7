package com.gentoro.usml.visualizer;

/** Directed derivation edge: field to unit, or unit to table. {@code kind} styles the edge. */
public record GraphEdge(String from, String to, UnitKind kind) {}
