package com.router.model;

/**
 * One atomic, single-namespace action produced by planning.
 *
 * @param text      the instruction handed to the single-step pipeline
 * @param namespace the namespace chosen for it
 * @param reasoning why the planner produced it
 */
public record Step(String text, String namespace, String reasoning) {
}
