package com.router.model;

/**
 * A namespace as presented to the integration selector.
 *
 * @param id          namespace identifier
 * @param name        human-readable name
 * @param description what the integration is for
 */
public record Integration(String id, String name, String description) {

    public static Integration unnamed(String id) {
        return new Integration(id, id, "");
    }
}
