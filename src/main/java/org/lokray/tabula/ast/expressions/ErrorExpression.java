package org.lokray.tabula.ast.expressions;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.lexer.Token;

import java.util.List;

/**
 * Placeholder for an expression that could not be parsed (or that came from an ERROR token).
 */
public class ErrorExpression implements Expression
{
	private final Token location;

	public ErrorExpression(Token location)
	{
		this.location = location;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitErrorExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return location;
	}

	@Override
	public List<ASTNode> children()
	{
		return List.of();
	}
}
