package io.eligian.core.ast;

/** Marker for nodes that produce a value: literals, references and operator expressions. */
public interface Expression extends Node {}
