package org.etlstudio.engine.plan;

/**
 * Visitor over the closed set of pipeline node kinds.
 *
 * Every backend lowerer and the interpreter implement this interface, so a new
 * node kind cannot be added without handling it everywhere.
 *
 * @param <T> The return type of the visitor methods
 */
public interface PipelineNodeVisitor<T> {

    T visit(LoadNode load);

    T visit(SelectNode select);

    T visit(FilterNode filter);

    T visit(AggregateNode aggregate);

    T visit(DeriveNode derive);

    T visit(SortNode sort);

    T visit(SampleNode sample);

    T visit(JoinNode join);

    T visit(WriteNode write);

    T visit(UnknownNode unknown);
}
