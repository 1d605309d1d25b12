package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.ast.expressions.Expression;
import org.lokray.tabula.lexer.Token;

import java.util.List;

/**
 * AST node for a binding: {@code let name expr}.
 */
public class LetStatement implements Statement
{
	private final Token keyword;
	private final Token name;
	private final Expression value;

	public LetStatement(Token keyword, Token name, Expression value)
	{
		this.keyword = keyword;
		this.name = name;
		this.value = value;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Token getName()
	{
		return name;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLetStatement(this);
	}

	@Override
	public int getLine()
	{
		return keyword.getLine();
	}

	@Override
	public int getColumn()
	{
		return keyword.getColumn();
	}

	@Override
	public List<ASTNode> children()
	{
		return List.of(value);
	}
}
