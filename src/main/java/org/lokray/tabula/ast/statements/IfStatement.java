package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.ast.expressions.Expression;
import org.lokray.tabula.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing an if statement with an optional else branch.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;
	private final Expression condition;
	private final List<Statement> thenBranch;
	private final Token elseKeyword; // null when there is no else branch
	private final List<Statement> elseBranch; // null when there is no else branch

	public IfStatement(Token ifKeyword, Expression condition, List<Statement> thenBranch, Token elseKeyword, List<Statement> elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = Collections.unmodifiableList(new ArrayList<>(thenBranch));
		this.elseKeyword = elseKeyword;
		this.elseBranch = elseBranch == null ? null : Collections.unmodifiableList(new ArrayList<>(elseBranch));
	}

	public Token getIfKeyword()
	{
		return ifKeyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public List<Statement> getThenBranch()
	{
		return thenBranch;
	}

	public Token getElseKeyword()
	{
		return elseKeyword;
	}

	/**
	 * @return the else body, or null if the statement has no else branch.
	 */
	public List<Statement> getElseBranch()
	{
		return elseBranch;
	}

	public boolean hasElseBranch()
	{
		return elseBranch != null;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public int getLine()
	{
		return ifKeyword.getLine();
	}

	@Override
	public int getColumn()
	{
		return ifKeyword.getColumn();
	}

	@Override
	public List<ASTNode> children()
	{
		List<ASTNode> children = new ArrayList<>();
		children.add(condition);
		children.addAll(thenBranch);
		if (elseBranch != null)
		{
			children.addAll(elseBranch);
		}
		return Collections.unmodifiableList(children);
	}
}
