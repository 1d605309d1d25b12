package org.lokray.tabula;

import org.junit.jupiter.api.Test;
import org.lokray.tabula.lexer.Token;
import org.lokray.tabula.util.Diagnostic;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TabulaFrontendTest
{
	private static String resource(String name) throws IOException
	{
		try (InputStream input = TabulaFrontendTest.class.getResourceAsStream("/samples/" + name))
		{
			assertNotNull(input, "missing sample " + name);
			return new String(input.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	@Test
	public void cleanSourceHasNoDiagnostics() throws IOException
	{
		CompilationUnit unit = TabulaFrontend.compile(resource("showcase.tab"));

		assertEquals(List.of(), unit.getDiagnostics());
		assertFalse(unit.hasErrors());
		assertNull(unit.getPath());
		assertEquals("<input>", unit.getDisplayName());
	}

	@Test
	public void rawTokensHaveNoMarkers()
	{
		CompilationUnit unit = TabulaFrontend.compile("if x\n\tprint x\n");

		assertTrue(unit.getRawTokens().stream().noneMatch(t -> t.getType().isSynthetic()));
		assertEquals(2, unit.getResolvedTokens().getTokens().stream().filter(t -> t.getType().isSynthetic()).count());
	}

	@Test
	public void collectsDiagnosticsFromEveryPhaseInSourceOrder() throws IOException
	{
		CompilationUnit unit = TabulaFrontend.compile("broken.tab", resource("broken.tab"));

		List<Diagnostic.Category> categories = unit.getDiagnostics().stream()
				.map(Diagnostic::getCategory)
				.collect(Collectors.toList());
		assertEquals(List.of(
				Diagnostic.Category.LEX,     // let x = 5
				Diagnostic.Category.SYNTAX,  // print
				Diagnostic.Category.SYNTAX,  // func 1
				Diagnostic.Category.SYNTAX,  // if )
				Diagnostic.Category.INDENT,  // print 5
				Diagnostic.Category.LEX      // "open
		), categories);

		List<Integer> lines = unit.getDiagnostics().stream().map(Diagnostic::getLine).collect(Collectors.toList());
		assertEquals(List.of(1, 2, 3, 5, 9, 10), lines);
		assertTrue(unit.hasErrors());
		assertEquals("broken.tab", unit.getDisplayName());

		// Every line still ends up in the tree
		assertEquals(6, unit.getProgram().getStatements().size());
	}

	@Test
	public void invocationsAreIndependent() throws Exception
	{
		String good = "let x 1\n";
		String bad = "let x\n";
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try
		{
			List<Future<CompilationUnit>> futures = new ArrayList<>();
			for (int i = 0; i < 50; i++)
			{
				String source = i % 2 == 0 ? good : bad;
				futures.add(executor.submit(() -> TabulaFrontend.compile(source)));
			}
			for (int i = 0; i < futures.size(); i++)
			{
				CompilationUnit unit = futures.get(i).get();
				assertEquals(i % 2 == 0 ? 0 : 1, unit.getDiagnostics().size());
			}
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	@Test
	public void tokensKeepTheirSourcePositions()
	{
		List<Token> tokens = TabulaFrontend.compile("let x 1\n").getRawTokens();

		assertEquals("x", tokens.get(2).getLexeme());
		assertEquals(1, tokens.get(2).getLine());
		assertEquals(5, tokens.get(2).getColumn());
	}
}
