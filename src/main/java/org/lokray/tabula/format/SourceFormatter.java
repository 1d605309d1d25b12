package org.lokray.tabula.format;

import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.ast.Program;
import org.lokray.tabula.ast.expressions.*;
import org.lokray.tabula.ast.statements.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Pretty-prints an AST back to Tabula source in canonical layout: one statement per line, one
 * TAB per nesting level, single spaces between elements, and only the parentheses needed for the
 * output to parse back into the same tree.
 * <p>
 * Comments and blank lines are not part of the AST and do not survive formatting. Placeholder
 * nodes left by error recovery cannot be printed; format only trees parsed without errors.
 */
public class SourceFormatter implements ASTVisitor<String>
{
	private int depth = 0;

	/**
	 * @param program A tree parsed without errors.
	 * @return The formatted source, ending in a newline unless the program is empty.
	 * @throws IllegalArgumentException if the tree contains an {@link ErrorExpression}.
	 */
	public static String format(Program program)
	{
		return program.accept(new SourceFormatter());
	}

	@Override
	public String visitProgram(Program program)
	{
		return block(program.getStatements());
	}

	// --- Statements: each returns its complete lines, indentation and newline included ---

	@Override
	public String visitLetStatement(LetStatement statement)
	{
		return line("let " + statement.getName().getLexeme() + " " + statement.getValue().accept(this));
	}

	@Override
	public String visitFuncStatement(FuncStatement statement)
	{
		StringBuilder header = new StringBuilder("func ").append(statement.getName().getLexeme());
		for (String parameter : statement.getParameterNames())
		{
			header.append(' ').append(parameter);
		}
		return line(header.toString()) + nested(statement.getBody());
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		String text = line("if " + statement.getCondition().accept(this)) + nested(statement.getThenBranch());
		if (statement.hasElseBranch())
		{
			text += line("else") + nested(statement.getElseBranch());
		}
		return text;
	}

	@Override
	public String visitForStatement(ForStatement statement)
	{
		return line("for " + statement.getVariable().getLexeme() + " in " + statement.getIterable().accept(this))
				+ nested(statement.getBody());
	}

	@Override
	public String visitPrintStatement(PrintStatement statement)
	{
		List<Expression> arguments = statement.getArguments();
		StringBuilder sb = new StringBuilder("print");
		for (int i = 0; i < arguments.size(); i++)
		{
			Expression argument = arguments.get(i);
			String text = argument.accept(this);
			boolean last = i == arguments.size() - 1;
			// A following argument would otherwise be taken as a call argument or a binary operand
			if ((!last && !(argument instanceof LiteralExpression)) || (i > 0 && text.startsWith("-")))
			{
				text = parenthesize(text);
			}
			sb.append(' ').append(text);
		}
		return line(sb.toString());
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		return statement.getValue() == null ? line("return") : line("return " + statement.getValue().accept(this));
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		return line(statement.getExpression().accept(this));
	}

	@Override
	public String visitNoOpStatement(NoOpStatement statement)
	{
		return "";
	}

	// --- Expressions ---

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		return expression.toSourceText();
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return expression.getIdentifier();
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		String operand = expression.getOperand().accept(this);
		if (expression.getOperand() instanceof BinaryExpression)
		{
			operand = parenthesize(operand);
		}
		return expression.getOperator().getSymbol() + operand;
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		int precedence = expression.getOperator().getPrecedence();

		String left = expression.getLeft().accept(this);
		if (precedenceOf(expression.getLeft()) < precedence)
		{
			left = parenthesize(left);
		}

		String right = expression.getRight().accept(this);
		if (precedenceOf(expression.getRight()) <= precedence)
		{
			right = parenthesize(right);
		}

		return left + " " + expression.getOperator().getSymbol() + " " + right;
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		StringBuilder sb = new StringBuilder(expression.getCallee().accept(this));
		for (Expression argument : expression.getArguments())
		{
			String text = argument.accept(this);
			boolean atom = argument instanceof LiteralExpression || argument instanceof IdentifierExpression;
			sb.append(' ').append(atom ? text : parenthesize(text));
		}
		return sb.toString();
	}

	@Override
	public String visitErrorExpression(ErrorExpression expression)
	{
		throw new IllegalArgumentException("Cannot format an unparsed expression at line "
				+ expression.getLine() + ", column " + expression.getColumn());
	}

	// --- Helpers ---

	private String block(List<Statement> statements)
	{
		return statements.stream().map(s -> s.accept(this)).collect(Collectors.joining());
	}

	private String nested(List<Statement> body)
	{
		depth++;
		String text = block(body);
		depth--;
		return text;
	}

	private String line(String content)
	{
		return "\t".repeat(depth) + content + "\n";
	}

	/**
	 * Binding strength of an operand; anything that is not a binary expression binds tighter
	 * than every operator.
	 */
	private static int precedenceOf(Expression expression)
	{
		if (expression instanceof BinaryExpression)
		{
			return ((BinaryExpression) expression).getOperator().getPrecedence();
		}
		return Integer.MAX_VALUE;
	}

	private static String parenthesize(String text)
	{
		return "(" + text + ")";
	}
}
