package org.lokray.tabula.format;

import org.junit.jupiter.api.Test;
import org.lokray.tabula.CompilationUnit;
import org.lokray.tabula.TabulaFrontend;
import org.lokray.tabula.ast.AstDumper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceFormatterTest
{
	private static String format(String source)
	{
		CompilationUnit unit = TabulaFrontend.compile(source);
		assertFalse(unit.hasErrors(), () -> "unexpected errors: " + unit.getDiagnostics());
		return SourceFormatter.format(unit.getProgram());
	}

	private static void assertRoundTrip(String source)
	{
		CompilationUnit original = TabulaFrontend.compile(source);
		assertEquals(List.of(), original.getDiagnostics());

		String formatted = SourceFormatter.format(original.getProgram());
		CompilationUnit reparsed = TabulaFrontend.compile(formatted);
		assertEquals(List.of(), reparsed.getDiagnostics(), () -> "formatted source does not parse:\n" + formatted);
		assertEquals(AstDumper.dump(original.getProgram()), AstDumper.dump(reparsed.getProgram()), formatted);
		assertEquals(formatted, SourceFormatter.format(reparsed.getProgram()), "formatting is not idempotent");
	}

	private static String resource(String name) throws IOException
	{
		try (InputStream input = SourceFormatterTest.class.getResourceAsStream("/samples/" + name))
		{
			assertNotNull(input, "missing sample " + name);
			return new String(input.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	@Test
	public void hugeFloatsKeepTheirValue()
	{
		assertRoundTrip("let x " + "9".repeat(300) + ".5\n");
	}

	@Test
	public void floatOverflowIsADiagnosticNotACrash()
	{
		CompilationUnit unit = TabulaFrontend.compile("let x " + "9".repeat(400) + ".5\nprint 1.5\n");

		assertTrue(unit.hasErrors());
		assertEquals("(program (noop) (print (float 1.5)))", AstDumper.dump(unit.getProgram()));
	}

	@Test
	public void normalisesSpacing()
	{
		assertEquals("let x 2 + 3 * 4\n", format("let   x    2+3*4\n"));
		assertEquals("print \"a\" b\n", format("print  \"a\"   b"));
	}

	@Test
	public void indentsWithOneTabPerLevel()
	{
		assertEquals("func f x\n\tif x > 0\n\t\treturn x\n\telse\n\t\treturn 0\n",
				format("func  f x\n\n\tif x>0\n\t\treturn x\n\telse\n\t\treturn 0\n"));
	}

	@Test
	public void dropsCommentsAndBlankLines()
	{
		assertEquals("let x 1\nprint x\n", format("# comment\n\nlet x 1 # one\n\nprint x\n"));
	}

	@Test
	public void keepsOnlyNecessaryParentheses()
	{
		assertEquals("(1 + 2) * 3\n", format("(1 + 2) * 3\n"));
		assertEquals("1 + 2 * 3\n", format("1 + (2 * 3)\n"));
		assertEquals("a - b - c\n", format("(a - b) - c\n"));
		assertEquals("a - (b - c)\n", format("a - (b - c)\n"));
		assertEquals("-(x + 1)\n", format("-(x + 1)\n"));
		assertEquals("-x\n", format("-(x)\n"));
	}

	@Test
	public void parenthesisesCompoundCallArguments()
	{
		assertEquals("f (g x) (-1) (a + b) y 2\n", format("f (g x) (-1) (a + b) (y) 2\n"));
	}

	@Test
	public void separatesPrintArguments()
	{
		assertEquals("print (a) b\n", format("print (a) b\n"));
		assertEquals("print 1 (-2)\n", format("print 1 (-2)\n"));
		assertEquals("print a b\n", format("print a b\n"));
		assertEquals("print \"sum\" (a + b) c\n", format("print \"sum\" (a + b) c\n"));
	}

	@Test
	public void writesCanonicalLiterals()
	{
		assertEquals("let f 2.5\n", format("let f 2.50\n"));
		assertEquals("let s \"a\\tb\\\"c\\\\\"\n", format("let s \"a\\tb\\\"c\\\\\"\n"));
	}

	@Test
	public void roundTripsShowcaseSample() throws IOException
	{
		assertRoundTrip(resource("showcase.tab"));
	}

	@Test
	public void roundTripsTrickyExpressions()
	{
		assertRoundTrip("print -x y\n");
		assertRoundTrip("print a + b c\n");
		assertRoundTrip("print (f x) (g y) z\n");
		assertRoundTrip("let v - - f x * 2\n");
		assertRoundTrip("let w (a == b) == (c < d)\n");
		assertRoundTrip("if a\n\tfor i in xs\n\t\tprint i\nelse\n\treturn\n");
	}

	@Test
	public void emptyProgramFormatsToNothing()
	{
		assertEquals("", format("# only a comment\n"));
	}

	@Test
	public void refusesPlaceholderExpressions()
	{
		CompilationUnit unit = TabulaFrontend.compile("if )\n\tprint 1\n");

		assertThrows(IllegalArgumentException.class, () -> SourceFormatter.format(unit.getProgram()));
	}
}
