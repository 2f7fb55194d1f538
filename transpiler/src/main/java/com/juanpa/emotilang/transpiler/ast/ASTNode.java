package com.juanpa.emotilang.transpiler.ast;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable once built and own their children exclusively.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 * The context travels down the walk as an explicit argument, so a visitor
	 * needs no mutable fields to know where it is.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param context The visitor's context for this node (e.g. the current indentation).
	 * @param <R>     The return type of the visitor's visit methods.
	 * @param <C>     The type of the context passed down the walk.
	 * @return The result of the visitor's operation.
	 */
	<R, C> R accept(ASTVisitor<R, C> visitor, C context);
}
