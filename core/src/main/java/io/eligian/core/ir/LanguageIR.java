package io.eligian.core.ir;

/** An entry of {@code availableLanguages}. */
public record LanguageIR(String code, String label) {}
