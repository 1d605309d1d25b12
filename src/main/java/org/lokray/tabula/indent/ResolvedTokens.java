package org.lokray.tabula.indent;

import org.lokray.tabula.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * Output of the {@link BlockResolver}: the lexer's tokens with BLOCK_ENTER / BLOCK_EXIT
 * markers inserted, plus one {@link IndentEvent} per non-blank line.
 */
public final class ResolvedTokens
{
	private final List<Token> tokens;
	private final List<IndentEvent> events;

	public ResolvedTokens(List<Token> tokens, List<IndentEvent> events)
	{
		this.tokens = Collections.unmodifiableList(tokens);
		this.events = Collections.unmodifiableList(events);
	}

	public List<Token> getTokens()
	{
		return tokens;
	}

	public List<IndentEvent> getEvents()
	{
		return events;
	}
}
