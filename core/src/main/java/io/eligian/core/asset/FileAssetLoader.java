package io.eligian.core.asset;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-system asset loader. Every asset must exist and be readable; stylesheets must also have
 * balanced braces.
 */
public final class FileAssetLoader implements AssetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FileAssetLoader.class);

    @Override
    public List<AssetError> loadAsset(AssetKind kind, String absolutePath, String sourcePath, String relativePath) {
        Path path = Paths.get(absolutePath);
        List<AssetError> errors = new ArrayList<>();
        if (!Files.isRegularFile(path)) {
            errors.add(new AssetError(
                    "Asset file not found: " + relativePath,
                    "Check that '" + relativePath + "' exists relative to " + sourcePath));
            return errors;
        }
        if (!Files.isReadable(path)) {
            errors.add(new AssetError("Asset file is not readable: " + relativePath, null));
            return errors;
        }
        if (kind == AssetKind.CSS) {
            readText(absolutePath).ifPresent(css -> checkBraces(css, relativePath, errors));
        }
        LOG.debug("Asset checked: kind={}, path={}, errors={}", kind, absolutePath, errors.size());
        return errors;
    }

    @Override
    public Optional<String> readText(String absolutePath) {
        try {
            return Optional.of(Files.readString(Paths.get(absolutePath), StandardCharsets.UTF_8));
        } catch (IOException | UncheckedIOException e) {
            LOG.debug("Asset not readable: path={}, reason={}", absolutePath, e.getMessage());
            return Optional.empty();
        }
    }

    private static void checkBraces(String css, String relativePath, List<AssetError> errors) {
        int depth = 0;
        boolean inComment = false;
        for (int i = 0; i < css.length(); i++) {
            char c = css.charAt(i);
            char next = i + 1 < css.length() ? css.charAt(i + 1) : '\0';
            if (inComment) {
                if (c == '*' && next == '/') {
                    inComment = false;
                    i++;
                }
            } else if (c == '/' && next == '*') {
                inComment = true;
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    break;
                }
            }
        }
        if (depth != 0) {
            errors.add(new AssetError(
                    "CSS syntax error in " + relativePath + ": unbalanced braces",
                    "Check that every '{' has a matching '}'"));
        }
    }
}
