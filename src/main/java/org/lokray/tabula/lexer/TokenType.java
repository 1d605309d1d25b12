package org.lokray.tabula.lexer;

/**
 * Defines the types of tokens recognized by the Tabula Lexer.
 * The set is deliberately small: keywords are plain {@link #WORD} tokens and are
 * told apart by lexeme, and every operator shares the {@link #OPERATOR} kind.
 */
public enum TokenType
{
	// --- Whitespace that carries structure ---
	TAB,        // one per leading indentation character
	SPACE,      // a collapsed run of spaces
	NEWLINE,    // end of a logical line

	// --- Words & literals ---
	WORD,       // identifiers and keywords
	NUMBER,     // 42
	FLOAT,      // 3.14
	STRING,     // "text"

	// --- Operators ---
	OPERATOR,   // + - * / > < == ( )

	// --- Special Tokens ---
	EOF,        // End Of File
	ERROR,      // Marks text the lexer could not tokenize

	// --- Block markers, inserted by the BlockResolver only ---
	BLOCK_ENTER,
	BLOCK_EXIT;

	/**
	 * @return true for the markers the resolver inserts; the lexer never produces them.
	 */
	public boolean isSynthetic()
	{
		return this == BLOCK_ENTER || this == BLOCK_EXIT;
	}
}
