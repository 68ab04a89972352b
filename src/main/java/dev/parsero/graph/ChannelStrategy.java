package dev.parsero.graph;

/**
 * How the external engine merges a node's update into a flat-state key.
 */
public enum ChannelStrategy {
    /** The update replaces the stored value. */
    OVERWRITE,
    /** The update's elements are appended to the stored list. */
    APPEND
}
