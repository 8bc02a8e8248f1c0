package net.amphora.domain.site;

import java.util.List;
import java.util.Optional;

/**
 * Source of the configured sites and the per-environment host aliases.
 * Implementations are built once at startup and never change afterwards.
 */
public interface SiteRegistry {

    /**
     * @return every configured site in registry order
     */
    List<Site> sites();

    /**
     * @return the distinct canonical hosts, in order of first appearance
     */
    List<String> hosts();

    /**
     * Looks up the host name this environment answers on for a canonical host
     * (for example {@code localhost} for {@code www.example.com} in development).
     *
     * @param host canonical host from a {@link Site}
     * @return the alias, or empty when the environment does not configure one
     */
    Optional<String> hostAlias(String host);
}
