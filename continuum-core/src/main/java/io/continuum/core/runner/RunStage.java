package io.continuum.core.runner;

/**
 * Stages of one run, in order. Any stage may end in {@link #FAILED}.
 */
public enum RunStage {
    RESOLVE_SESSION,
    GATHER_CONTEXT,
    BUILD_PROMPT,
    INVOKE,
    PERSIST,
    DONE,
    FAILED
}
