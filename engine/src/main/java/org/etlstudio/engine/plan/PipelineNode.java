package org.etlstudio.engine.plan;

/**
 * Sealed interface representing nodes of a pipeline graph.
 * This is the intermediate representation shared by the optimizer, the
 * backend lowerers and the ground-truth interpreter.
 *
 * Nodes are immutable; rewrites produce new node values.
 */
public sealed interface PipelineNode
        permits LoadNode, SelectNode, FilterNode, AggregateNode, DeriveNode, SortNode, SampleNode,
        JoinNode, WriteNode, UnknownNode {

    /**
     * @return The node id, unique within a graph
     */
    String id();

    /**
     * @return The display label used to derive program identifiers
     */
    String label();

    /**
     * @return The kind tag of this node
     */
    NodeKind kind();

    /**
     * Accept method for the visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this node
     */
    <T> T accept(PipelineNodeVisitor<T> visitor);
}
