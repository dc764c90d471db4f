package io.eligian.core.asset;

import io.eligian.core.ast.AssetImport;
import java.util.Locale;

/** Kind of file referenced by an asset import. */
public enum AssetKind {
    HTML,
    CSS,
    MEDIA;

    /** Kind implied by the import syntax, or by the file extension for named imports. */
    public static AssetKind of(AssetImport assetImport) {
        return switch (assetImport.form()) {
            case STYLES -> CSS;
            case LAYOUT -> HTML;
            case PROVIDER -> MEDIA;
            case NAMED -> fromPath(assetImport.path());
        };
    }

    static AssetKind fromPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".html") || lower.endsWith(".htm")) {
            return HTML;
        }
        if (lower.endsWith(".css")) {
            return CSS;
        }
        return MEDIA;
    }
}
