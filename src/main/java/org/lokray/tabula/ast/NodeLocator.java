package org.lokray.tabula.ast;

import org.lokray.tabula.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Answers "where am I" questions without parent pointers: the enclosing context of a node is
 * the path from the root that a pre-order walk takes to reach it.
 */
public final class NodeLocator
{
	private NodeLocator()
	{
	}

	/**
	 * Finds the innermost statement starting on {@code line} and returns the path to it.
	 *
	 * @param program The tree to search.
	 * @param line    A 1-based source line.
	 * @return The nodes from {@code program} down to that statement (both included), or an empty
	 * list if no statement starts on that line.
	 */
	public static List<ASTNode> pathToStatement(Program program, int line)
	{
		List<ASTNode> path = new ArrayList<>();
		List<ASTNode> best = new ArrayList<>();
		search(program, line, path, best);
		return Collections.unmodifiableList(best);
	}

	/**
	 * @return the statement directly enclosing the innermost statement on {@code line}
	 * (a func, if or for header), or null if that statement is at top level or absent.
	 */
	public static Statement enclosingStatement(Program program, int line)
	{
		List<ASTNode> path = pathToStatement(program, line);
		for (int i = path.size() - 2; i >= 0; i--)
		{
			if (path.get(i) instanceof Statement)
			{
				return (Statement) path.get(i);
			}
		}
		return null;
	}

	private static void search(ASTNode node, int line, List<ASTNode> path, List<ASTNode> best)
	{
		path.add(node);
		if (node instanceof Statement && node.getLine() == line)
		{
			best.clear();
			best.addAll(path);
		}
		for (ASTNode child : node.children())
		{
			if (child instanceof Statement)
			{
				search(child, line, path, best);
			}
		}
		path.remove(path.size() - 1);
	}
}
