package org.lokray.tabula.ast.expressions;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.lexer.Token;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions are parts of the program that produce a value.
 */
public interface Expression extends ASTNode
{
	/**
	 * Returns the first token that constitutes this expression.
	 * Useful for error reporting to pinpoint the exact location of a problem.
	 *
	 * @return The first Token of this expression.
	 */
	Token getFirstToken();

	@Override
	default int getLine()
	{
		return getFirstToken().getLine();
	}

	@Override
	default int getColumn()
	{
		return getFirstToken().getColumn();
	}
}
