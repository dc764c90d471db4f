package io.eligian.core.validation;

import io.eligian.core.asset.AssetError;
import io.eligian.core.asset.AssetKind;
import io.eligian.core.asset.AssetLoader;
import io.eligian.core.ast.AssetImport;
import io.eligian.core.ast.Program;
import io.eligian.core.library.LibraryPathResolver;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks the asset imports of a program: at most one layout, unique import names, and every
 * referenced file accepted by the {@link AssetLoader}. Files are only checked when the program
 * has a URI to resolve relative paths against.
 */
public final class AssetValidator {

    private final AssetLoader loader;

    public AssetValidator(AssetLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
    }

    public List<Diagnostic> validate(Program program) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> names = new HashSet<>();
        boolean layoutSeen = false;
        for (AssetImport assetImport : program.assetImports()) {
            if (assetImport.form() == AssetImport.Form.LAYOUT) {
                if (layoutSeen) {
                    diagnostics.add(Diagnostic.error(
                            "duplicate_layout",
                            "Only one layout import is allowed",
                            assetImport.location(),
                            "Remove the extra layout import"));
                }
                layoutSeen = true;
            }
            if (assetImport.name() != null && !names.add(assetImport.name())) {
                diagnostics.add(Diagnostic.error(
                        "duplicate_import",
                        "Duplicate import name '" + assetImport.name() + "'",
                        assetImport.location(),
                        "Rename one of the imports"));
            }
            if (program.uri() == null) {
                continue;
            }
            String absolutePath = LibraryPathResolver.resolve(program.uri(), assetImport.path());
            List<AssetError> errors =
                    loader.loadAsset(AssetKind.of(assetImport), absolutePath, program.uri(), assetImport.path());
            for (AssetError error : errors) {
                diagnostics.add(Diagnostic.error("asset_error", error.message(), assetImport.location(), error.hint()));
            }
        }
        return diagnostics;
    }
}
