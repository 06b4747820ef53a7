package org.Aayush.gridopt.topology;

/**
 * Role of a grid node.
 */
public enum NodeRole {
    /** Supply node: routing destination with no demand of its own. */
    GENERATOR,
    /** Load node with a constant power demand. */
    SUBSTATION
}
