// File: src/main/java/org/lokray/tabula/ast/Program.java

package org.lokray.tabula.ast;

import org.lokray.tabula.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root AST node representing one Tabula source unit: its top-level statements in order.
 */
public class Program implements ASTNode
{
	private final List<Statement> statements;

	public Program(List<Statement> statements)
	{
		this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public int getLine()
	{
		return 1;
	}

	@Override
	public int getColumn()
	{
		return 1;
	}

	@Override
	public List<ASTNode> children()
	{
		return Collections.unmodifiableList(new ArrayList<>(statements));
	}
}
