package io.eligian.core.library;

import io.eligian.core.ast.ActionDefinition;

/**
 * An action visible from some document.
 *
 * @param definition the action
 * @param documentUri URI of the document that defines it, or {@code null} for an in-memory entry
 *     document
 */
public record ResolvedAction(ActionDefinition definition, String documentUri) {}
