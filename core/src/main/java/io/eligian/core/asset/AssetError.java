package io.eligian.core.asset;

/** Problem found while loading one asset. */
public record AssetError(String message, String hint) {}
