package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.ast.expressions.Expression;

import java.util.List;

/**
 * AST node for an expression used as a statement, typically a call: {@code greet name}.
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public int getLine()
	{
		return expression.getLine();
	}

	@Override
	public int getColumn()
	{
		return expression.getColumn();
	}

	@Override
	public List<ASTNode> children()
	{
		return List.of(expression);
	}
}
