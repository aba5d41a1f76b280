package com.shortener.service;

/**
 * Produces candidate short codes. Uniqueness is not its concern; callers check
 * candidates against the record store.
 */
@FunctionalInterface
public interface CodeGenerator {

    String generate();
}
