package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.ast.expressions.Expression;
import org.lokray.tabula.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for a 'for' loop statement.
 * Syntax: for variable in iterable, followed by an indented body.
 */
public class ForStatement implements Statement
{
	private final Token forKeyword;
	private final Token variable;
	private final Expression iterable;
	private final List<Statement> body;

	public ForStatement(Token forKeyword, Token variable, Expression iterable, List<Statement> body)
	{
		this.forKeyword = forKeyword;
		this.variable = variable;
		this.iterable = iterable;
		this.body = Collections.unmodifiableList(new ArrayList<>(body));
	}

	public Token getForKeyword()
	{
		return forKeyword;
	}

	public Token getVariable()
	{
		return variable;
	}

	public Expression getIterable()
	{
		return iterable;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}

	@Override
	public int getLine()
	{
		return forKeyword.getLine();
	}

	@Override
	public int getColumn()
	{
		return forKeyword.getColumn();
	}

	@Override
	public List<ASTNode> children()
	{
		List<ASTNode> children = new ArrayList<>();
		children.add(iterable);
		children.addAll(body);
		return Collections.unmodifiableList(children);
	}
}
