package org.lokray.tabula.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the Tabula Lexer (or a block marker
 * inserted by the resolver). Each token encapsulates its type, the actual text
 * (lexeme), the decoded literal value and its position in the source for
 * error reporting. Tokens are immutable.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., WORD, NUMBER, OPERATOR)
	private final String lexeme;     // The actual text of the token (e.g., "total", "42", "==")
	private final Object literal;    // Long for NUMBER, Double for FLOAT, unescaped String for STRING
	private final int line;          // 1-based line where the token starts
	private final int column;        // 1-based column where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type    The TokenType of this token.
	 * @param lexeme  The raw text of the token from the source code.
	 * @param literal The decoded literal value for literal tokens, null otherwise.
	 * @param line    The line number where this token begins.
	 * @param column  The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, Object literal, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	// --- Getters for Token properties ---

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * @return true if this is a WORD whose lexeme is a reserved keyword.
	 */
	public boolean isKeyword()
	{
		return type == TokenType.WORD && Lexer.KEYWORDS.contains(lexeme);
	}

	/**
	 * @param keyword The keyword to compare against.
	 * @return true if this is a WORD token spelling exactly {@code keyword}.
	 */
	public boolean isKeyword(String keyword)
	{
		return type == TokenType.WORD && lexeme.equals(keyword);
	}

	/**
	 * @param symbol The operator text to compare against.
	 * @return true if this is an OPERATOR token spelling exactly {@code symbol}.
	 */
	public boolean isOperator(String symbol)
	{
		return type == TokenType.OPERATOR && lexeme.equals(symbol);
	}

	/**
	 * Provides a string representation of the Token, useful for debugging and for
	 * the token dump of the command line driver.
	 * Format: "TokenType 'Lexeme' [Literal] (Line:Column)"
	 */
	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + printable(lexeme) + "'" + literalStr + " (Line:" + line + ", Col:" + column + ")";
	}

	private static String printable(String text)
	{
		return text.replace("\t", "\\t").replace("\n", "\\n");
	}

	/**
	 * Equality compares type, lexeme and literal. Line/column are not included as
	 * tokens from different positions are still "the same" token.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;

		if (type != token.type)
			return false;
		if (!lexeme.equals(token.lexeme))
			return false;
		return Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		int result = type.hashCode();
		result = 31 * result + lexeme.hashCode();
		result = 31 * result + (literal != null ? literal.hashCode() : 0);
		return result;
	}
}
