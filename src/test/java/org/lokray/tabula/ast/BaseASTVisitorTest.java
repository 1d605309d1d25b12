package org.lokray.tabula.ast;

import org.junit.jupiter.api.Test;
import org.lokray.tabula.TabulaFrontend;
import org.lokray.tabula.ast.expressions.IdentifierExpression;
import org.lokray.tabula.ast.expressions.LiteralExpression;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BaseASTVisitorTest
{
	@Test
	public void visitsIdentifiersInPreOrder()
	{
		Program program = TabulaFrontend.compile("let a f b + c\nif d\n\tprint e\nelse\n\tprint g\n").getProgram();
		List<String> names = new ArrayList<>();

		program.accept(new BaseASTVisitor<Void>()
		{
			@Override
			public Void visitIdentifierExpression(IdentifierExpression expression)
			{
				names.add(expression.getIdentifier());
				return super.visitIdentifierExpression(expression);
			}
		});

		assertEquals(List.of("f", "b", "c", "d", "e", "g"), names);
	}

	@Test
	public void overridingOneVariantStillDescendsThroughTheOthers()
	{
		Program program = TabulaFrontend.compile("func f\n\tfor i in xs\n\t\tprint 1 2\n\treturn 3\n").getProgram();
		int[] literals = {0};

		program.accept(new BaseASTVisitor<Void>()
		{
			@Override
			public Void visitLiteralExpression(LiteralExpression expression)
			{
				literals[0]++;
				return null;
			}
		});

		assertEquals(3, literals[0]);
	}
}
