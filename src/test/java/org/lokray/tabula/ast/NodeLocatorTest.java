package org.lokray.tabula.ast;

import org.junit.jupiter.api.Test;
import org.lokray.tabula.TabulaFrontend;
import org.lokray.tabula.ast.statements.FuncStatement;
import org.lokray.tabula.ast.statements.IfStatement;
import org.lokray.tabula.ast.statements.PrintStatement;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeLocatorTest
{
	private final Program program = TabulaFrontend.compile(
			"func f x\n"
					+ "\tif x\n"
					+ "\t\tprint x\n"
					+ "\treturn 0\n"
					+ "print 1\n").getProgram();

	@Test
	public void pathLeadsFromRootToInnermostStatement()
	{
		List<ASTNode> path = NodeLocator.pathToStatement(program, 3);

		assertEquals(4, path.size());
		assertSame(program, path.get(0));
		assertTrue(path.get(1) instanceof FuncStatement);
		assertTrue(path.get(2) instanceof IfStatement);
		assertTrue(path.get(3) instanceof PrintStatement);
	}

	@Test
	public void enclosingStatementIsTheHeaderOwningTheBlock()
	{
		assertTrue(NodeLocator.enclosingStatement(program, 3) instanceof IfStatement);
		assertTrue(NodeLocator.enclosingStatement(program, 4) instanceof FuncStatement);
		assertNull(NodeLocator.enclosingStatement(program, 5));
	}

	@Test
	public void lineWithoutStatementGivesEmptyPath()
	{
		assertTrue(NodeLocator.pathToStatement(program, 42).isEmpty());
		assertNull(NodeLocator.enclosingStatement(program, 42));
	}
}
