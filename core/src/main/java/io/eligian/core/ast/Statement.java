package io.eligian.core.ast;

/** Marker for nodes allowed inside an action body or a control-flow block. */
public interface Statement extends Node {}
