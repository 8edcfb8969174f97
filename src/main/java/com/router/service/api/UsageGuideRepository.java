package com.router.service.api;

/**
 * Free-text usage guides keyed by namespace.
 */
public interface UsageGuideRepository {

    /**
     * @return the guide, or an empty string when the namespace has none
     */
    String load(String namespace);
}
