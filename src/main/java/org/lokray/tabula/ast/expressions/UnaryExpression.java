package org.lokray.tabula.ast.expressions;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.lexer.Token;

import java.util.List;

/**
 * AST node for a prefix operator applied to one operand, e.g. {@code - x}.
 */
public class UnaryExpression implements Expression
{
	private final Token operatorToken;
	private final UnaryOperator operator;
	private final Expression operand;

	public UnaryExpression(Token operatorToken, UnaryOperator operator, Expression operand)
	{
		this.operatorToken = operatorToken;
		this.operator = operator;
		this.operand = operand;
	}

	public Token getOperatorToken()
	{
		return operatorToken;
	}

	public UnaryOperator getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return operatorToken;
	}

	@Override
	public List<ASTNode> children()
	{
		return List.of(operand);
	}
}
