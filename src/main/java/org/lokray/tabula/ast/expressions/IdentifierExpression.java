package org.lokray.tabula.ast.expressions;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.lexer.Token;

import java.util.List;

/**
 * AST node for a bare name. Names are not resolved here; that is left to later phases.
 */
public class IdentifierExpression implements Expression
{
	private final Token name;

	public IdentifierExpression(Token name)
	{
		this.name = name;
	}

	public Token getName()
	{
		return name;
	}

	public String getIdentifier()
	{
		return name.getLexeme();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public List<ASTNode> children()
	{
		return List.of();
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
