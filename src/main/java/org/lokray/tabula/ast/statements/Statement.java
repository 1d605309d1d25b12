package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;

/**
 * Base interface for all statement nodes in the Abstract Syntax Tree.
 * Statements are the units a logical line (plus its indented body, if any) parses into.
 */
public interface Statement extends ASTNode
{
	// No common methods yet, but can be added later.
}
