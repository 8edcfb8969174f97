package com.router.service.api;

import com.router.model.Integration;
import java.util.List;

/**
 * Source of the display names and descriptions of namespaces.
 */
public interface IntegrationDirectory {

    /**
     * @return one entry per identifier, in the given order; unknown identifiers get an entry
     *         named after themselves
     */
    List<Integration> lookup(List<String> namespaces);
}
