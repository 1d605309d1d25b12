package org.lokray.tabula.ast;

import org.lokray.tabula.ast.expressions.*;
import org.lokray.tabula.ast.statements.*;

/**
 * A visitor whose every method walks the node's children in pre-order and returns
 * {@link #defaultResult()}. Override the variants of interest, do the work, and call
 * {@code super} to keep descending.
 */
public class BaseASTVisitor<R> implements ASTVisitor<R>
{
	protected R defaultResult()
	{
		return null;
	}

	/**
	 * Visits every child of {@code node} in source order.
	 */
	protected R visitChildren(ASTNode node)
	{
		for (ASTNode child : node.children())
		{
			child.accept(this);
		}
		return defaultResult();
	}

	@Override
	public R visitProgram(Program program)
	{
		return visitChildren(program);
	}

	@Override
	public R visitLetStatement(LetStatement statement)
	{
		return visitChildren(statement);
	}

	@Override
	public R visitFuncStatement(FuncStatement statement)
	{
		return visitChildren(statement);
	}

	@Override
	public R visitIfStatement(IfStatement statement)
	{
		return visitChildren(statement);
	}

	@Override
	public R visitForStatement(ForStatement statement)
	{
		return visitChildren(statement);
	}

	@Override
	public R visitPrintStatement(PrintStatement statement)
	{
		return visitChildren(statement);
	}

	@Override
	public R visitReturnStatement(ReturnStatement statement)
	{
		return visitChildren(statement);
	}

	@Override
	public R visitExpressionStatement(ExpressionStatement statement)
	{
		return visitChildren(statement);
	}

	@Override
	public R visitNoOpStatement(NoOpStatement statement)
	{
		return visitChildren(statement);
	}

	@Override
	public R visitLiteralExpression(LiteralExpression expression)
	{
		return visitChildren(expression);
	}

	@Override
	public R visitIdentifierExpression(IdentifierExpression expression)
	{
		return visitChildren(expression);
	}

	@Override
	public R visitUnaryExpression(UnaryExpression expression)
	{
		return visitChildren(expression);
	}

	@Override
	public R visitBinaryExpression(BinaryExpression expression)
	{
		return visitChildren(expression);
	}

	@Override
	public R visitCallExpression(CallExpression expression)
	{
		return visitChildren(expression);
	}

	@Override
	public R visitErrorExpression(ErrorExpression expression)
	{
		return visitChildren(expression);
	}
}
