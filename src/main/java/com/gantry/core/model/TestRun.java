package com.gantry.core.model;

import java.io.Serializable;

/**
 * A test command the executor ran and whether it passed.
 */
public record TestRun(
    String command,
    boolean passed
) implements Serializable {}
