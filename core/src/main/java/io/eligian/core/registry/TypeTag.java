package io.eligian.core.registry;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Allowed type of an operation parameter, dependency or output. Either a union of primitive kinds
 * ({@code string | number}) or a union of literal constant values ({@code overwrite | append}),
 * never both.
 *
 * @param kinds primitive kinds, in declaration order; empty for constant tags
 * @param constants allowed literal values; empty for primitive tags
 */
public record TypeTag(List<Kind> kinds, List<String> constants) {

    /** Primitive value kinds understood by the runtime. */
    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        OBJECT,
        ARRAY;

        /** Lowercase name as written in registry files and messages. */
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Parses a lowercase kind label.
         *
         * @throws IllegalArgumentException if the label names no kind
         */
        public static Kind fromLabel(String label) {
            for (Kind kind : values()) {
                if (kind.label().equals(label)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown type '" + label + "'");
        }
    }

    public TypeTag {
        kinds = List.copyOf(kinds);
        constants = List.copyOf(constants);
        if (kinds.isEmpty() == constants.isEmpty()) {
            throw new IllegalArgumentException("A type tag needs either primitive kinds or constant values");
        }
    }

    public static TypeTag of(Kind... kinds) {
        return new TypeTag(List.of(kinds), List.of());
    }

    public static TypeTag constants(List<String> values) {
        return new TypeTag(List.of(), values);
    }

    /** Accepts every primitive kind. */
    public static TypeTag any() {
        return of(Kind.values());
    }

    public boolean isConstant() {
        return !constants.isEmpty();
    }

    public boolean allows(Kind kind) {
        return kinds.contains(kind);
    }

    /**
     * Renders the tag for messages: {@code string or number} for primitive unions, {@code one of:
     * overwrite, append} for constant unions.
     */
    public String format() {
        if (isConstant()) {
            return "one of: " + String.join(", ", constants);
        }
        return kinds.stream().map(Kind::label).collect(Collectors.joining(" or "));
    }

    @Override
    public String toString() {
        return format();
    }
}
