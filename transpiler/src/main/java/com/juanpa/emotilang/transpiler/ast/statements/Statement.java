package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTNode;

/**
 * Marker interface for all statement nodes in the AST.
 * Statements perform actions but do not produce a value.
 */
public interface Statement extends ASTNode
{
}
