package org.lokray.tabula.ast.expressions;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for a call written as a space-separated sequence: {@code compute x y z}.
 * The callee is the leading word; each following atom is one positional argument.
 */
public class CallExpression implements Expression
{
	private final Expression callee;
	private final List<Expression> arguments;

	public CallExpression(Expression callee, List<Expression> arguments)
	{
		this.callee = callee;
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public Expression getCallee()
	{
		return callee;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return callee.getFirstToken();
	}

	@Override
	public List<ASTNode> children()
	{
		List<ASTNode> children = new ArrayList<>();
		children.add(callee);
		children.addAll(arguments);
		return Collections.unmodifiableList(children);
	}
}
