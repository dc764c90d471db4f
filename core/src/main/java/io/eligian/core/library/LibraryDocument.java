package io.eligian.core.library;

import io.eligian.core.ast.Library;

/** A parsed library together with the normalized URI it was loaded from. */
public record LibraryDocument(String uri, Library library) {}
