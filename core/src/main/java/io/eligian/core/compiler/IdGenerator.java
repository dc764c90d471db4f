package io.eligian.core.compiler;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.function.Supplier;

/** Produces ids for generated configuration entries. One instance per compilation. */
final class IdGenerator {

    private final Supplier<String> source;

    private IdGenerator(Supplier<String> source) {
        this.source = source;
    }

    static IdGenerator random() {
        return new IdGenerator(() -> UUID.randomUUID().toString());
    }

    /** Name-based UUIDs from a counter, so repeated compilations of one source emit the same ids. */
    static IdGenerator deterministic() {
        int[] counter = {0};
        return new IdGenerator(() -> UUID.nameUUIDFromBytes(
                        ("eligian-" + (++counter[0])).getBytes(StandardCharsets.UTF_8))
                .toString());
    }

    String next() {
        return source.get();
    }
}
