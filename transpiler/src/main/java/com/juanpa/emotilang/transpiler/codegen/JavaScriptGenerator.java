package com.juanpa.emotilang.transpiler.codegen;

import com.juanpa.emotilang.transpiler.ast.ASTNode;
import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.Program;
import com.juanpa.emotilang.transpiler.ast.TypeNode;
import com.juanpa.emotilang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.emotilang.transpiler.ast.declarations.Parameter;
import com.juanpa.emotilang.transpiler.ast.expressions.*;
import com.juanpa.emotilang.transpiler.ast.statements.*;
import com.juanpa.emotilang.transpiler.util.CompilerConfig;
import com.juanpa.emotilang.transpiler.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JavaScriptGenerator traverses the Abstract Syntax Tree (AST) and generates the
 * equivalent JavaScript source code.
 * <p>
 * Every visit returns the text for its node. Statements come back already indented for the
 * {@link Indentation} they were given, without a trailing newline; expressions ignore the
 * indentation. The generator keeps no state between calls, so one instance can serve any
 * number of compilations.
 */
public class JavaScriptGenerator implements ASTVisitor<String, Indentation>
{
	private final CompilerConfig config;

	public JavaScriptGenerator(CompilerConfig config)
	{
		this.config = config;
	}

	/**
	 * Generates the JavaScript for a whole program.
	 *
	 * @param program The root of the tree.
	 * @return The generated source text.
	 * @throws CodeGenerationException if the tree is malformed.
	 */
	public String generate(Program program)
	{
		String output = emit(program, Indentation.root(config.getIndentUnit()), "program");
		Debug.log("Generated %d line(s) of JavaScript", output.split("\n", -1).length);
		return output;
	}

	// --- Program Structure ---

	@Override
	public String visitProgram(Program program, Indentation indent)
	{
		List<String> lines = new ArrayList<>();
		lines.add(config.getHeader());
		lines.add("");
		for (Statement declaration : program.getDeclarations())
		{
			String code = emit(declaration, indent, "top-level statement");
			if (!code.isBlank())
			{
				lines.add(code);
			}
		}
		return String.join("\n", lines);
	}

	@Override
	public String visitTypeNode(TypeNode typeNode, Indentation indent)
	{
		return typeNode.getName();
	}

	// --- Declarations ---

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration, Indentation indent)
	{
		String params = declaration.getParameters().stream()
				.map(p -> emit(p, indent, "parameter"))
				.collect(Collectors.joining(", "));
		String returnType = emit(declaration.getReturnType(), indent, "return type");

		List<String> lines = new ArrayList<>();
		lines.add(indent.prefix() + "function " + declaration.getName() + "(" + params + ") /* -> " + returnType + " */ {");
		appendBody(lines, required(declaration.getBody(), "function body"), indent);
		lines.add(indent.prefix() + "}");
		return String.join("\n", lines);
	}

	@Override
	public String visitParameter(Parameter parameter, Indentation indent)
	{
		return parameter.getName() + " /* " + emit(parameter.getType(), indent, "parameter type") + " */";
	}

	// --- Statements ---

	@Override
	public String visitBlock(Block block, Indentation indent)
	{
		List<String> lines = new ArrayList<>();
		lines.add(indent.prefix() + "{");
		appendBody(lines, block, indent);
		lines.add(indent.prefix() + "}");
		return String.join("\n", lines);
	}

	@Override
	public String visitVariableDeclaration(VariableDeclaration declaration, Indentation indent)
	{
		String typeComment = " // " + emit(declaration.getDeclaredType(), indent, "declared type");
		String name = declaration.getIdentifier();
		return declaration.getInitialValue()
				.map(value -> indent.prefix() + "let " + name + " = " + emit(value, indent, "initial value") + ";" + typeComment)
				.orElseGet(() -> indent.prefix() + "let " + name + ";" + typeComment);
	}

	@Override
	public String visitAssignment(Assignment assignment, Indentation indent)
	{
		return indent.prefix() + assignment.getIdentifier() + " = " + emit(assignment.getExpression(), indent, "assigned value") + ";";
	}

	@Override
	public String visitPrintStatement(PrintStatement statement, Indentation indent)
	{
		return indent.prefix() + "console.log(" + emit(statement.getExpression(), indent, "printed value") + ");";
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement, Indentation indent)
	{
		return statement.getValue()
				.map(value -> indent.prefix() + "return " + emit(value, indent, "return value") + ";")
				.orElseGet(() -> indent.prefix() + "return;");
	}

	@Override
	public String visitThrowStatement(ThrowStatement statement, Indentation indent)
	{
		return indent.prefix() + "throw new Error(" + emit(statement.getExpression(), indent, "thrown value") + ");";
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement, Indentation indent)
	{
		return indent.prefix() + emit(statement.getExpression(), indent, "expression") + ";";
	}

	@Override
	public String visitIfStatement(IfStatement statement, Indentation indent)
	{
		List<String> lines = new ArrayList<>();
		lines.add(indent.prefix() + "if (" + emit(statement.getCondition(), indent, "if condition") + ") {");
		appendBody(lines, required(statement.getThenBlock(), "then block"), indent);
		statement.getElseBlock().ifPresent(elseBlock ->
		{
			lines.add(indent.prefix() + "} else {");
			appendBody(lines, elseBlock, indent);
		});
		lines.add(indent.prefix() + "}");
		return String.join("\n", lines);
	}

	@Override
	public String visitWhileLoop(WhileLoop loop, Indentation indent)
	{
		List<String> lines = new ArrayList<>();
		lines.add(indent.prefix() + "while (" + emit(loop.getCondition(), indent, "loop condition") + ") {");
		appendBody(lines, required(loop.getBody(), "loop body"), indent);
		lines.add(indent.prefix() + "}");
		return String.join("\n", lines);
	}

	@Override
	public String visitTryStatement(TryStatement statement, Indentation indent)
	{
		List<String> lines = new ArrayList<>();
		lines.add(indent.prefix() + "try {");
		appendBody(lines, required(statement.getTryBlock(), "try block"), indent);
		lines.add(indent.prefix() + "} catch (" + statement.getCatchVariable() + ") {");
		appendBody(lines, required(statement.getCatchBlock(), "catch block"), indent);
		lines.add(indent.prefix() + "}");
		return String.join("\n", lines);
	}

	// --- Expressions ---

	@Override
	public String visitNumberLiteral(NumberLiteral literal, Indentation indent)
	{
		return String.valueOf(required(literal.getValue(), "number value"));
	}

	@Override
	public String visitStringLiteral(StringLiteral literal, Indentation indent)
	{
		return quote(required(literal.getValue(), "string value"));
	}

	@Override
	public String visitBooleanLiteral(BooleanLiteral literal, Indentation indent)
	{
		return literal.getValue() ? "true" : "false";
	}

	@Override
	public String visitIdentifier(Identifier identifier, Indentation indent)
	{
		return identifier.getName();
	}

	@Override
	public String visitBinaryOp(BinaryOp binaryOp, Indentation indent)
	{
		String left = emit(binaryOp.getLeft(), indent, "left operand");
		String right = emit(binaryOp.getRight(), indent, "right operand");
		return "(" + left + " " + binaryOp.getOperator().getJavaScript() + " " + right + ")";
	}

	@Override
	public String visitUnaryOp(UnaryOp unaryOp, Indentation indent)
	{
		return "(" + unaryOp.getOperator().getJavaScript() + emit(unaryOp.getOperand(), indent, "operand") + ")";
	}

	@Override
	public String visitFunctionCall(FunctionCall call, Indentation indent)
	{
		String args = call.getArguments().stream()
				.map(arg -> emit(arg, indent, "argument"))
				.collect(Collectors.joining(", "));
		return call.getName() + "(" + args + ")";
	}

	@Override
	public String visitInputExpression(InputExpression input, Indentation indent)
	{
		return "prompt(" + quote(config.getInputPrompt()) + ")";
	}

	// --- Helpers ---

	/**
	 * Emits the statements of a block one level deeper than {@code indent}, skipping blank output.
	 */
	private void appendBody(List<String> lines, Block block, Indentation indent)
	{
		Indentation inner = indent.deeper();
		for (Statement statement : block.getStatements())
		{
			String code = emit(statement, inner, "statement");
			if (!code.isBlank())
			{
				lines.add(code);
			}
		}
	}

	private String emit(ASTNode node, Indentation indent, String what)
	{
		return required(node, what).accept(this, indent);
	}

	private static <T> T required(T value, String what)
	{
		if (value == null)
		{
			throw new CodeGenerationException("Malformed syntax tree: missing " + what);
		}
		return value;
	}

	/**
	 * Wraps text in double quotes, escaping it so the JavaScript string has the same content.
	 */
	static String quote(String text)
	{
		StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			switch (c)
			{
				case '\\':
					sb.append("\\\\");
					break;
				case '"':
					sb.append("\\\"");
					break;
				case '\n':
					sb.append("\\n");
					break;
				case '\r':
					sb.append("\\r");
					break;
				case '\t':
					sb.append("\\t");
					break;
				default:
					sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
