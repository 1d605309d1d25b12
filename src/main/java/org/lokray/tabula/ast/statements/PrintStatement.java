package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.ast.expressions.Expression;
import org.lokray.tabula.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for the variadic {@code print expr...} statement. Always holds at least one argument.
 */
public class PrintStatement implements Statement
{
	private final Token keyword;
	private final List<Expression> arguments;

	public PrintStatement(Token keyword, List<Expression> arguments)
	{
		if (arguments.isEmpty())
		{
			throw new IllegalArgumentException("print requires at least one expression");
		}
		this.keyword = keyword;
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPrintStatement(this);
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
		return Collections.unmodifiableList(new ArrayList<>(arguments));
	}
}
