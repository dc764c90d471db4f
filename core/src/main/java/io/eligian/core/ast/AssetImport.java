package io.eligian.core.ast;

/**
 * An asset reference: {@code styles "./main.css"}, {@code layout "./layout.html"}, {@code provider
 * "./video.mp4"} or the named form {@code import intro from "./intro.html"}.
 *
 * @param form which syntax introduced the import
 * @param name binding name for {@link Form#NAMED} imports, otherwise {@code null}
 * @param path the path as written, relative to the importing document
 * @param location position of the import keyword
 */
public record AssetImport(Form form, String name, String path, SourceLocation location) implements Node {

    /** Syntax form of an asset import. */
    public enum Form {
        STYLES,
        LAYOUT,
        PROVIDER,
        NAMED
    }
}
