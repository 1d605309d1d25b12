package org.lokray.tabula.ast;

import org.lokray.tabula.ast.expressions.*;
import org.lokray.tabula.ast.statements.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an AST as a single-line s-expression, e.g.
 * {@code (program (let x (binary + (number 2) (binary * (number 3) (number 4)))))}.
 * <p>
 * The rendering ignores positions, so two trees are structurally equal exactly when their
 * dumps are equal.
 */
public class AstDumper implements ASTVisitor<String>
{
	public static String dump(ASTNode node)
	{
		return node.accept(new AstDumper());
	}

	@Override
	public String visitProgram(Program program)
	{
		return "(program" + joinStatements(program.getStatements()) + ")";
	}

	@Override
	public String visitLetStatement(LetStatement statement)
	{
		return "(let " + statement.getName().getLexeme() + " " + statement.getValue().accept(this) + ")";
	}

	@Override
	public String visitFuncStatement(FuncStatement statement)
	{
		return "(func " + statement.getName().getLexeme()
				+ " (params" + statement.getParameterNames().stream().map(p -> " " + p).collect(Collectors.joining()) + ")"
				+ " (body" + joinStatements(statement.getBody()) + "))";
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		StringBuilder sb = new StringBuilder("(if ");
		sb.append(statement.getCondition().accept(this));
		sb.append(" (then").append(joinStatements(statement.getThenBranch())).append(')');
		if (statement.hasElseBranch())
		{
			sb.append(" (else").append(joinStatements(statement.getElseBranch())).append(')');
		}
		return sb.append(')').toString();
	}

	@Override
	public String visitForStatement(ForStatement statement)
	{
		return "(for " + statement.getVariable().getLexeme() + " " + statement.getIterable().accept(this)
				+ " (body" + joinStatements(statement.getBody()) + "))";
	}

	@Override
	public String visitPrintStatement(PrintStatement statement)
	{
		return "(print" + joinExpressions(statement.getArguments()) + ")";
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		return statement.getValue() == null ? "(return)" : "(return " + statement.getValue().accept(this) + ")";
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		return "(expr " + statement.getExpression().accept(this) + ")";
	}

	@Override
	public String visitNoOpStatement(NoOpStatement statement)
	{
		return "(noop)";
	}

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		return "(" + expression.getKind().name().toLowerCase() + " " + expression.toSourceText() + ")";
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return "(id " + expression.getIdentifier() + ")";
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		return "(neg " + expression.getOperand().accept(this) + ")";
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		return "(binary " + expression.getOperator().getSymbol() + " " + expression.getLeft().accept(this)
				+ " " + expression.getRight().accept(this) + ")";
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		return "(call " + expression.getCallee().accept(this) + joinExpressions(expression.getArguments()) + ")";
	}

	@Override
	public String visitErrorExpression(ErrorExpression expression)
	{
		return "(error)";
	}

	private String joinStatements(List<Statement> statements)
	{
		return statements.stream().map(s -> " " + s.accept(this)).collect(Collectors.joining());
	}

	private String joinExpressions(List<Expression> expressions)
	{
		return expressions.stream().map(e -> " " + e.accept(this)).collect(Collectors.joining());
	}
}
