package net.amphora.service;

/**
 * Produces time-ordered, URL-safe identifiers. No two calls in the process
 * return the same value, including calls racing on different threads.
 */
@FunctionalInterface
public interface IdentifierGenerator {

    String next();
}
