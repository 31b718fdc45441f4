package com.librenovel.ast;

/**
 * Visitor interface for ATL (animation and transformation language) nodes.
 *
 * @param <T> The return type of the visit methods
 */
public interface AtlVisitor<T> {
    T visitBlock(AtlNode.Block node);
    T visitMultipurpose(AtlNode.Multipurpose node);
    T visitChild(AtlNode.Child node);
    T visitChoice(AtlNode.Choice node);
    T visitContainsExpr(AtlNode.ContainsExpr node);
    T visitEvent(AtlNode.Event node);
    T visitFunction(AtlNode.Function node);
    T visitOn(AtlNode.On node);
    T visitParallel(AtlNode.Parallel node);
    T visitRepeat(AtlNode.Repeat node);
    T visitTime(AtlNode.Time node);
    T visitUnknown(AtlNode.Unknown node);
}
