package org.lokray.tabula.ast.expressions;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.lexer.Token;

import java.util.List;

/**
 * AST node for an infix operation such as {@code a + b} or {@code age > 30}.
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operatorToken;
	private final BinaryOperator operator;
	private final Expression right;

	public BinaryExpression(Expression left, Token operatorToken, BinaryOperator operator, Expression right)
	{
		this.left = left;
		this.operatorToken = operatorToken;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperatorToken()
	{
		return operatorToken;
	}

	public BinaryOperator getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken();
	}

	@Override
	public List<ASTNode> children()
	{
		return List.of(left, right);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
