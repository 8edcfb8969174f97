package com.router.model;

/**
 * Why a dynamic planning session stopped.
 */
public enum TerminationReason {
    /** The generator reported the goal as satisfied. */
    GOAL_SATISFIED,
    /** The generator returned no further step without claiming completion. */
    NO_NEXT_STEP,
    /** The iteration cap was reached; the goal may be unfinished. */
    ITERATION_CAP,
    /** The consumer abandoned the session between two steps. */
    CANCELLED
}
