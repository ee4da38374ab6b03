package com.astrepr.json;

import com.astrepr.tree.ReprNode;

/**
 * Writes parsed repr trees as JSON.
 */
public interface ReprJsonSerializer {

    /**
     * Serializes a node and its whole subtree to a compact JSON string.
     *
     * @param node the root of the subtree to serialize
     * @return the JSON representation of the node
     * @throws ReprJsonException if serialization fails
     */
    String serialize(ReprNode node) throws ReprJsonException;

    /**
     * Serializes a node and its whole subtree to an indented JSON string.
     *
     * @param node the root of the subtree to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws ReprJsonException if serialization fails
     */
    String serializePretty(ReprNode node) throws ReprJsonException;
}
