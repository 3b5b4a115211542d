package io.runcoord.core;

public enum WindowMode {
    /**
     * Fixed-length window that slides forward with every run.
     */
    ROLLING,

    /**
     * Trailing N days ending at "now minus lag".
     */
    FIXED
}
