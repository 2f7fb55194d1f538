package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTNode;

/**
 * Marker interface for all expression nodes in the AST.
 */
public interface Expression extends ASTNode
{
}
