package org.lokray.tabula.indent;

import org.junit.jupiter.api.Test;
import org.lokray.tabula.lexer.Lexer;
import org.lokray.tabula.lexer.Token;
import org.lokray.tabula.lexer.TokenType;
import org.lokray.tabula.util.Diagnostic;
import org.lokray.tabula.util.ErrorReporter;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.lokray.tabula.lexer.TokenType.*;

public class BlockResolverTest
{
	private ErrorReporter reporter;

	private ResolvedTokens resolve(String source)
	{
		reporter = new ErrorReporter();
		List<Token> tokens = new Lexer(source, reporter).scanTokens();
		return new BlockResolver(tokens, reporter).resolve();
	}

	private static List<TokenType> types(ResolvedTokens resolved)
	{
		return resolved.getTokens().stream().map(Token::getType).collect(Collectors.toList());
	}

	private static long count(ResolvedTokens resolved, TokenType type)
	{
		return resolved.getTokens().stream().filter(t -> t.getType() == type).count();
	}

	private List<Diagnostic> indentErrors()
	{
		return reporter.getDiagnostics().stream()
				.filter(d -> d.getCategory() == Diagnostic.Category.INDENT)
				.collect(Collectors.toList());
	}

	@Test
	public void insertsMarkersAroundBody()
	{
		ResolvedTokens resolved = resolve("if x\n\tprint x\nprint y\n");

		assertEquals(List.of(
				WORD, SPACE, WORD, NEWLINE,
				BLOCK_ENTER, TAB, WORD, SPACE, WORD, NEWLINE,
				BLOCK_EXIT, WORD, SPACE, WORD, NEWLINE,
				EOF), types(resolved));
		assertEquals(0, reporter.count());
	}

	@Test
	public void markersTakeThePositionOfTheLine()
	{
		ResolvedTokens resolved = resolve("if x\n\n\tprint x\n\nprint y\n");

		Token enter = resolved.getTokens().stream().filter(t -> t.getType() == BLOCK_ENTER).findFirst().orElseThrow();
		Token exit = resolved.getTokens().stream().filter(t -> t.getType() == BLOCK_EXIT).findFirst().orElseThrow();
		assertEquals(3, enter.getLine());
		assertEquals(1, enter.getColumn());
		assertEquals(5, exit.getLine());
		assertTrue(enter.getType().isSynthetic());
	}

	@Test
	public void closesOpenBlocksAtEndOfInput()
	{
		ResolvedTokens resolved = resolve("func f\n\tif x\n\t\treturn 1");

		List<TokenType> types = types(resolved);
		assertEquals(List.of(BLOCK_EXIT, BLOCK_EXIT, EOF), types.subList(types.size() - 3, types.size()));
		assertEquals(2, count(resolved, BLOCK_ENTER));
	}

	@Test
	public void dedentCanCloseSeveralBlocks()
	{
		ResolvedTokens resolved = resolve("if a\n\tif b\n\t\tprint c\nprint d\n");

		assertEquals(2, count(resolved, BLOCK_ENTER));
		assertEquals(2, count(resolved, BLOCK_EXIT));
		IndentEvent last = resolved.getEvents().get(resolved.getEvents().size() - 1);
		assertEquals(4, last.getLine());
		assertEquals(0, last.getDepth());
		assertEquals(2, last.getBlockExits());
		assertEquals(0, reporter.count());
	}

	@Test
	public void recordsOneEventPerNonBlankLine()
	{
		ResolvedTokens resolved = resolve("if x\n\n\tprint x\n");

		assertEquals(2, resolved.getEvents().size());
		assertTrue(resolved.getEvents().get(1).isBlockEnter());
		assertEquals(1, resolved.getEvents().get(1).getDepth());
	}

	@Test
	public void indentWithoutHeaderIsReportedOnce()
	{
		ResolvedTokens resolved = resolve("let x 1\n\tlet y 2\n\tlet z 3\nprint x\n");

		assertEquals(1, indentErrors().size());
		assertEquals("unexpected indent", indentErrors().get(0).getMessage());
		assertEquals(2, indentErrors().get(0).getLine());
		assertEquals(0, count(resolved, BLOCK_ENTER));
		assertEquals(0, count(resolved, BLOCK_EXIT));
	}

	@Test
	public void indentJumpOpensExactlyOneBlock()
	{
		ResolvedTokens resolved = resolve("if x\n\t\tprint x\n\t\tprint y\n");

		assertEquals(1, indentErrors().size());
		assertTrue(indentErrors().get(0).getMessage().startsWith("unexpected indent"));
		assertEquals(1, count(resolved, BLOCK_ENTER));
		assertEquals(1, count(resolved, BLOCK_EXIT));
	}

	@Test
	public void unmatchedDedentIsReportedOnceAndRecovered()
	{
		ResolvedTokens resolved = resolve("if x\n\t\t\tprint x\n\t\tprint y\n\t\tprint z\nprint w\n");

		List<Diagnostic> mismatches = indentErrors().stream()
				.filter(d -> d.getMessage().equals("unindent does not match any outer indentation level"))
				.collect(Collectors.toList());
		assertEquals(1, mismatches.size());
		assertEquals(3, mismatches.get(0).getLine());
		// The jump that made the mismatch possible is the only other problem
		assertEquals(2, indentErrors().size());
		assertEquals(1, count(resolved, BLOCK_ENTER));
		assertEquals(1, count(resolved, BLOCK_EXIT));
	}

	@Test
	public void indentJumpOpensTheBlockOneLevelDeep()
	{
		ResolvedTokens resolved = resolve("func f\n\t\tx\n\ty\n");

		assertEquals(1, reporter.count());
		assertTrue(indentErrors().get(0).getMessage().startsWith("unexpected indent"));
		assertEquals(2, indentErrors().get(0).getLine());
		assertEquals(List.of(
				WORD, SPACE, WORD, NEWLINE,
				BLOCK_ENTER, TAB, TAB, WORD, NEWLINE,
				TAB, WORD, NEWLINE,
				BLOCK_EXIT, EOF), types(resolved));
	}

	@Test
	public void blankLinesCarryNoIndentation()
	{
		ResolvedTokens resolved = resolve("func f\n\tprint 1\n\n\n\tprint 2\n");

		assertEquals(1, count(resolved, BLOCK_ENTER));
		assertEquals(1, count(resolved, BLOCK_EXIT));
		assertEquals(0, reporter.count());
	}

	@Test
	public void emptyInputResolvesToEof()
	{
		ResolvedTokens resolved = resolve("");

		assertEquals(List.of(EOF), types(resolved));
		assertTrue(resolved.getEvents().isEmpty());
	}
}
