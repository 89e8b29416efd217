package org.kal.compiler.frontend.parser.ast;

import org.kal.compiler.api.SourceInfo;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Nodes are immutable records. Every child is owned by exactly one parent, so the
 * tree never contains shared subtrees or back references.
 */
public interface AstNode {

    /**
     * Returns a list of the direct child nodes, in source order.
     * This allows generic traversals without knowing the structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * @return The position in the source this node was parsed from.
     */
    SourceInfo source();
}
