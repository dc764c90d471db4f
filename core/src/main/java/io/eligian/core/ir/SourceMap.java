package io.eligian.core.ir;

import io.eligian.core.ast.SourceLocation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Maps generated ids (actions, operations, timelines) back to the source that produced them. */
public final class SourceMap {

    private final SourceLocation root;
    private final Map<String, SourceLocation> locations;

    public SourceMap(SourceLocation root, Map<String, SourceLocation> locations) {
        this.root = root;
        this.locations = Collections.unmodifiableMap(new LinkedHashMap<>(locations));
    }

    public SourceLocation root() {
        return root;
    }

    public Optional<SourceLocation> locationOf(String id) {
        return Optional.ofNullable(locations.get(id));
    }

    public int size() {
        return locations.size();
    }
}
