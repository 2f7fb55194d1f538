package com.juanpa.emotilang.transpiler.util;

import com.juanpa.emotilang.transpiler.ast.ASTNode;
import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.Program;
import com.juanpa.emotilang.transpiler.ast.TypeNode;
import com.juanpa.emotilang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.emotilang.transpiler.ast.declarations.Parameter;
import com.juanpa.emotilang.transpiler.ast.expressions.*;
import com.juanpa.emotilang.transpiler.ast.statements.*;
import com.juanpa.emotilang.transpiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders tokens and syntax trees as indented text for debugging. Each node prints its
 * kind and its own fields on one line, followed by its labelled children one level deeper.
 * The context is the depth of the node being printed.
 */
public class AstPrinter implements ASTVisitor<String, Integer>
{
	private static final String STEP = "  ";

	/**
	 * Lists tokens one per line as {@code KIND 'lexeme' line:N}.
	 */
	public static String listTokens(List<Token> tokens)
	{
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens)
		{
			sb.append(String.format("%-15s %-20s line:%d%n", token.getType(), "'" + token.getLexeme() + "'", token.getLine()));
		}
		return sb.toString();
	}

	public String print(ASTNode node)
	{
		return node.accept(this, 0);
	}

	@Override
	public String visitProgram(Program program, Integer depth)
	{
		return join(line(depth, "Program"), list(depth, "declarations", program.getDeclarations()));
	}

	@Override
	public String visitTypeNode(TypeNode typeNode, Integer depth)
	{
		return line(depth, "Type: " + typeNode.getName());
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration, Integer depth)
	{
		return join(line(depth, "FunctionDeclaration: " + declaration.getName() + " : return_type=" + declaration.getReturnType()),
				list(depth, "parameters", declaration.getParameters()),
				child(depth, "body", declaration.getBody()));
	}

	@Override
	public String visitParameter(Parameter parameter, Integer depth)
	{
		return line(depth, "Parameter: " + parameter.getName() + " : param_type=" + parameter.getType());
	}

	@Override
	public String visitBlock(Block block, Integer depth)
	{
		return join(line(depth, "Block"), list(depth, "statements", block.getStatements()));
	}

	@Override
	public String visitVariableDeclaration(VariableDeclaration declaration, Integer depth)
	{
		return join(line(depth, "VariableDeclaration: " + declaration.getIdentifier() + " : type=" + declaration.getDeclaredType()),
				child(depth, "initial_value", declaration.getInitialValue().orElse(null)));
	}

	@Override
	public String visitAssignment(Assignment assignment, Integer depth)
	{
		return join(line(depth, "Assignment: " + assignment.getIdentifier()),
				child(depth, "expression", assignment.getExpression()));
	}

	@Override
	public String visitPrintStatement(PrintStatement statement, Integer depth)
	{
		return join(line(depth, "PrintStatement"), child(depth, "expression", statement.getExpression()));
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement, Integer depth)
	{
		return join(line(depth, "ReturnStatement"), child(depth, "expression", statement.getValue().orElse(null)));
	}

	@Override
	public String visitThrowStatement(ThrowStatement statement, Integer depth)
	{
		return join(line(depth, "ThrowStatement"), child(depth, "expression", statement.getExpression()));
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement, Integer depth)
	{
		return join(line(depth, "ExpressionStatement"), child(depth, "expression", statement.getExpression()));
	}

	@Override
	public String visitIfStatement(IfStatement statement, Integer depth)
	{
		return join(line(depth, "IfStatement"),
				child(depth, "condition", statement.getCondition()),
				child(depth, "then_block", statement.getThenBlock()),
				child(depth, "else_block", statement.getElseBlock().orElse(null)));
	}

	@Override
	public String visitWhileLoop(WhileLoop loop, Integer depth)
	{
		return join(line(depth, "WhileLoop"),
				child(depth, "condition", loop.getCondition()),
				child(depth, "body", loop.getBody()));
	}

	@Override
	public String visitTryStatement(TryStatement statement, Integer depth)
	{
		return join(line(depth, "TryStatement: catch_var=" + statement.getCatchVariable()),
				child(depth, "try_block", statement.getTryBlock()),
				child(depth, "catch_block", statement.getCatchBlock()));
	}

	@Override
	public String visitNumberLiteral(NumberLiteral literal, Integer depth)
	{
		return line(depth, "NumberLiteral: " + literal.getValue());
	}

	@Override
	public String visitStringLiteral(StringLiteral literal, Integer depth)
	{
		return line(depth, "StringLiteral: '" + literal.getValue() + "'");
	}

	@Override
	public String visitBooleanLiteral(BooleanLiteral literal, Integer depth)
	{
		return line(depth, "BooleanLiteral: " + literal.getValue());
	}

	@Override
	public String visitIdentifier(Identifier identifier, Integer depth)
	{
		return line(depth, "Identifier: " + identifier.getName());
	}

	@Override
	public String visitBinaryOp(BinaryOp binaryOp, Integer depth)
	{
		return join(line(depth, "BinaryOp: " + binaryOp.getOperator().getSourceTag()),
				child(depth, "left", binaryOp.getLeft()),
				child(depth, "right", binaryOp.getRight()));
	}

	@Override
	public String visitUnaryOp(UnaryOp unaryOp, Integer depth)
	{
		return join(line(depth, "UnaryOp: " + unaryOp.getOperator().getSourceTag()),
				child(depth, "operand", unaryOp.getOperand()));
	}

	@Override
	public String visitFunctionCall(FunctionCall call, Integer depth)
	{
		return join(line(depth, "FunctionCall: " + call.getName()), list(depth, "arguments", call.getArguments()));
	}

	@Override
	public String visitInputExpression(InputExpression input, Integer depth)
	{
		return line(depth, "InputExpression");
	}

	// --- Helpers ---

	private static String line(int depth, String text)
	{
		return STEP.repeat(depth) + text;
	}

	private String child(int depth, String label, ASTNode node)
	{
		if (node == null)
		{
			return "";
		}
		return join(line(depth + 1, label + ":"), node.accept(this, depth + 2));
	}

	private String list(int depth, String label, List<? extends ASTNode> nodes)
	{
		if (nodes.isEmpty())
		{
			return "";
		}
		List<String> parts = new ArrayList<>();
		parts.add(line(depth + 1, label + ":"));
		for (int i = 0; i < nodes.size(); i++)
		{
			parts.add(line(depth + 2, "[" + i + "]:"));
			parts.add(nodes.get(i).accept(this, depth + 3));
		}
		return String.join("\n", parts);
	}

	private static String join(String... parts)
	{
		List<String> kept = new ArrayList<>();
		for (String part : parts)
		{
			if (!part.isEmpty())
			{
				kept.add(part);
			}
		}
		return String.join("\n", kept);
	}
}
