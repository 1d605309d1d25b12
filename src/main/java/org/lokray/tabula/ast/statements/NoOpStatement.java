package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.lexer.Token;

import java.util.List;

/**
 * Placeholder the parser leaves where a statement could not be parsed. It does nothing;
 * the corresponding diagnostic explains what was wrong.
 */
public class NoOpStatement implements Statement
{
	private final Token location;

	public NoOpStatement(Token location)
	{
		this.location = location;
	}

	public Token getLocation()
	{
		return location;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitNoOpStatement(this);
	}

	@Override
	public int getLine()
	{
		return location.getLine();
	}

	@Override
	public int getColumn()
	{
		return location.getColumn();
	}

	@Override
	public List<ASTNode> children()
	{
		return List.of();
	}
}
