package org.lokray.tabula.indent;

import org.lokray.tabula.lexer.Token;
import org.lokray.tabula.lexer.TokenType;
import org.lokray.tabula.util.Debug;
import org.lokray.tabula.util.Diagnostic;
import org.lokray.tabula.util.ErrorReporter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Turns leading-TAB depth into explicit block structure.
 * <p>
 * The resolver walks the lexer's token stream one logical line at a time, keeping a stack of
 * open indentation levels that starts with depth 0. Whenever a line opens or closes blocks it
 * inserts BLOCK_ENTER / BLOCK_EXIT marker tokens in front of that line, so the parser never has
 * to count TABs itself. At end of input every open block is closed.
 * <p>
 * Bad indentation is reported and repaired, never fatal:
 * <ul>
 * <li>an indent without a preceding {@code func}/{@code if}/{@code else}/{@code for} header is
 * "unexpected indent"; the line stays in the current block,</li>
 * <li>an indent of more than one level after a header is "unexpected indent" but opens exactly one block,</li>
 * <li>a dedent to a depth that is not on the stack snaps to the nearest lower open level.</li>
 * </ul>
 * Repaired levels are remembered as silent levels (no marker) so the lines that follow at the
 * same depth do not repeat the diagnostic.
 */
public class BlockResolver
{
	/**
	 * Statement keywords whose line must be followed by an indented body.
	 */
	public static final Set<String> BODY_HEADERS = Set.of("func", "if", "else", "for");

	private final List<Token> input;
	private final ErrorReporter errorReporter;

	private final Deque<Level> stack = new ArrayDeque<>();
	private final List<Token> output = new ArrayList<>();
	private final List<IndentEvent> events = new ArrayList<>();

	/**
	 * One open indentation level. {@code opensBlock} is false for levels pushed only to
	 * recover from bad indentation; those never produce markers.
	 */
	private record Level(
			int depth,
			boolean opensBlock)
	{
	}

	/**
	 * @param input         The complete token list produced by the lexer, ending in EOF.
	 * @param errorReporter Receives indentation diagnostics.
	 */
	public BlockResolver(List<Token> input, ErrorReporter errorReporter)
	{
		this.input = input;
		this.errorReporter = errorReporter;
	}

	/**
	 * Resolves the whole token stream.
	 *
	 * @return The annotated stream and the per-line indentation events.
	 */
	public ResolvedTokens resolve()
	{
		stack.clear();
		output.clear();
		events.clear();
		stack.push(new Level(0, true));

		boolean headerRequiresBody = false;
		int index = 0;
		while (index < input.size() && input.get(index).getType() != TokenType.EOF)
		{
			int lineEnd = endOfLine(index);

			int depth = 0;
			while (input.get(index + depth).getType() == TokenType.TAB)
			{
				depth++;
			}
			Token content = input.get(index + depth);

			if (content.getType() == TokenType.NEWLINE || content.getType() == TokenType.EOF)
			{
				// Blank lines carry no indentation information.
				output.addAll(input.subList(index, lineEnd));
				index = lineEnd;
				continue;
			}

			resolveLine(depth, input.get(index), content, headerRequiresBody);
			output.addAll(input.subList(index, lineEnd));

			headerRequiresBody = content.getType() == TokenType.WORD && BODY_HEADERS.contains(content.getLexeme());
			index = lineEnd;
		}

		Token eof = input.isEmpty() ? new Token(TokenType.EOF, "", null, 1, 1) : input.get(input.size() - 1);
		int closed = 0;
		while (stack.size() > 1)
		{
			if (stack.pop().opensBlock())
			{
				output.add(marker(TokenType.BLOCK_EXIT, eof));
				closed++;
			}
		}
		output.add(eof);

		Debug.log("Resolved %d lines, closed %d block(s) at end of input", events.size(), closed);
		return new ResolvedTokens(new ArrayList<>(output), new ArrayList<>(events));
	}

	/**
	 * Compares the depth of one non-blank line with the open levels and emits the markers that
	 * belong in front of it.
	 *
	 * @param depth              Count of leading TAB tokens.
	 * @param first              First token of the line (where markers are positioned).
	 * @param content            First non-TAB token of the line.
	 * @param headerRequiresBody Whether the previous non-blank line was a body-requiring header.
	 */
	private void resolveLine(int depth, Token first, Token content, boolean headerRequiresBody)
	{
		int top = stack.peek().depth();
		boolean entered = false;
		int exits = 0;

		if (depth > top)
		{
			if (headerRequiresBody)
			{
				stack.push(new Level(top + 1, true));
				if (depth > top + 1)
				{
					indentError(content, "unexpected indent: indentation jumps from depth " + top + " to " + depth
							+ "; a block is indented by exactly one TAB");
					// Later lines at the jumped depth stay in the block without further errors
					stack.push(new Level(depth, false));
				}
				output.add(marker(TokenType.BLOCK_ENTER, first));
				entered = true;
			}
			else
			{
				indentError(content, "unexpected indent");
				stack.push(new Level(depth, false));
			}
		}
		else if (depth < top)
		{
			while (stack.peek().depth() > depth)
			{
				if (stack.pop().opensBlock())
				{
					output.add(marker(TokenType.BLOCK_EXIT, first));
					exits++;
				}
			}
			if (stack.peek().depth() != depth)
			{
				indentError(content, "unindent does not match any outer indentation level");
				stack.push(new Level(depth, false));
			}
		}

		events.add(new IndentEvent(content.getLine(), depth, entered, exits));
	}

	/**
	 * @return the index just past the NEWLINE closing the line that starts at {@code index},
	 * or the index of EOF if the line is the last one.
	 */
	private int endOfLine(int index)
	{
		int cursor = index;
		while (cursor < input.size())
		{
			TokenType type = input.get(cursor).getType();
			if (type == TokenType.NEWLINE)
			{
				return cursor + 1;
			}
			if (type == TokenType.EOF)
			{
				return cursor;
			}
			cursor++;
		}
		return cursor;
	}

	private static Token marker(TokenType type, Token at)
	{
		return new Token(type, "", null, at.getLine(), at.getColumn());
	}

	private void indentError(Token at, String message)
	{
		errorReporter.report(Diagnostic.Category.INDENT, at.getLine(), at.getColumn(), message);
	}
}
