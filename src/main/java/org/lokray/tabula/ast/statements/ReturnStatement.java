package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.ast.expressions.Expression;
import org.lokray.tabula.lexer.Token;

import java.util.List;

/**
 * AST node representing a return statement.
 * Can optionally include an expression to be returned.
 */
public class ReturnStatement implements Statement
{
	private final Token keyword; // The 'return' keyword token
	private final Expression value; // Optional expression to return

	public ReturnStatement(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	/**
	 * @return the returned expression, or null for a bare {@code return}.
	 */
	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
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
		return value == null ? List.of() : List.of(value);
	}
}
