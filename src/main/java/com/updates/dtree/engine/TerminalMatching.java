package com.updates.dtree.engine;

/**
 * How {@link TreeDiffer} pairs terminals across two graph versions.
 */
public enum TerminalMatching {
    /**
     * Same node id means same outcome. Renumbering a terminal between versions
     * therefore shows up as a loss and a gain of the same value.
     */
    BY_NODE_ID,

    /**
     * Terminals are grouped by value; the regions of all terminals serving a
     * value are united before comparing. Insensitive to renumbering.
     */
    BY_VALUE
}
