package org.lokray.tabula.ast;

import java.util.List;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The tree is single-owner: every node owns its children exclusively and holds no
 * reference back to its parent. Nodes are immutable once the parser has built them.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);

	/**
	 * @return the 1-based line where this node starts.
	 */
	int getLine();

	/**
	 * @return the 1-based column where this node starts.
	 */
	int getColumn();

	/**
	 * Enumerates the direct children of this node in source order.
	 *
	 * @return An unmodifiable list, empty for leaves.
	 */
	List<ASTNode> children();
}
