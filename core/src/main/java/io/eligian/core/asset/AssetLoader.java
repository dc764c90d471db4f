package io.eligian.core.asset;

import java.util.List;
import java.util.Optional;

/**
 * Loads and checks files referenced by asset imports. Called once per import during validation.
 */
public interface AssetLoader {

    /**
     * Checks one asset.
     *
     * @param kind what the file is expected to contain
     * @param absolutePath resolved path of the asset
     * @param sourcePath URI of the importing document
     * @param relativePath the path as written in the import
     * @return problems found, empty if the asset is usable
     */
    List<AssetError> loadAsset(AssetKind kind, String absolutePath, String sourcePath, String relativePath);

    /** Reads a text asset such as a layout template; empty if it cannot be read. */
    Optional<String> readText(String absolutePath);
}
