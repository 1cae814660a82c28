package io.topolang.slc;

/**
 * Tuning knobs for parsing and conversion.
 */
public class Settings {
    /**
     * Recursion ceiling for the parser and converter, counted once per nested
     * abstraction body or parenthesized expression. Each unit costs a few native
     * frames, so the default stays well inside a standard thread stack.
     */
    public int maxDepth = 2_000;
    /** Fail with "extra tokens" instead of ignoring input after the root expression. */
    public boolean rejectTrailingTokens = false;

    public static Settings defaults() {
        return new Settings();
    }
}
