package com.juanpa.emotilang.transpiler.ast;

import com.juanpa.emotilang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.emotilang.transpiler.ast.declarations.Parameter;
import com.juanpa.emotilang.transpiler.ast.expressions.BinaryOp;
import com.juanpa.emotilang.transpiler.ast.expressions.BooleanLiteral;
import com.juanpa.emotilang.transpiler.ast.expressions.FunctionCall;
import com.juanpa.emotilang.transpiler.ast.expressions.Identifier;
import com.juanpa.emotilang.transpiler.ast.expressions.InputExpression;
import com.juanpa.emotilang.transpiler.ast.expressions.NumberLiteral;
import com.juanpa.emotilang.transpiler.ast.expressions.StringLiteral;
import com.juanpa.emotilang.transpiler.ast.expressions.UnaryOp;
import com.juanpa.emotilang.transpiler.ast.statements.Assignment;
import com.juanpa.emotilang.transpiler.ast.statements.Block;
import com.juanpa.emotilang.transpiler.ast.statements.ExpressionStatement;
import com.juanpa.emotilang.transpiler.ast.statements.IfStatement;
import com.juanpa.emotilang.transpiler.ast.statements.PrintStatement;
import com.juanpa.emotilang.transpiler.ast.statements.ReturnStatement;
import com.juanpa.emotilang.transpiler.ast.statements.ThrowStatement;
import com.juanpa.emotilang.transpiler.ast.statements.TryStatement;
import com.juanpa.emotilang.transpiler.ast.statements.VariableDeclaration;
import com.juanpa.emotilang.transpiler.ast.statements.WhileLoop;

/**
 * Interface for the Visitor design pattern over the EmotiLang AST.
 * There is one visit method per node kind, so a visitor that misses a kind does not compile.
 *
 * @param <R> The return type of the visit methods.
 * @param <C> The type of the context handed to each visit.
 */
public interface ASTVisitor<R, C>
{
	// Program Structure
	R visitProgram(Program program, C context);

	R visitTypeNode(TypeNode typeNode, C context);

	// Declarations
	R visitFunctionDeclaration(FunctionDeclaration declaration, C context);

	R visitParameter(Parameter parameter, C context);

	// Statements
	R visitBlock(Block block, C context);

	R visitVariableDeclaration(VariableDeclaration declaration, C context);

	R visitAssignment(Assignment assignment, C context);

	R visitPrintStatement(PrintStatement statement, C context);

	R visitReturnStatement(ReturnStatement statement, C context);

	R visitThrowStatement(ThrowStatement statement, C context);

	R visitExpressionStatement(ExpressionStatement statement, C context);

	R visitIfStatement(IfStatement statement, C context);

	R visitWhileLoop(WhileLoop loop, C context);

	R visitTryStatement(TryStatement statement, C context);

	// Expressions
	R visitNumberLiteral(NumberLiteral literal, C context);

	R visitStringLiteral(StringLiteral literal, C context);

	R visitBooleanLiteral(BooleanLiteral literal, C context);

	R visitIdentifier(Identifier identifier, C context);

	R visitBinaryOp(BinaryOp binaryOp, C context);

	R visitUnaryOp(UnaryOp unaryOp, C context);

	R visitFunctionCall(FunctionCall call, C context);

	R visitInputExpression(InputExpression input, C context);
}
