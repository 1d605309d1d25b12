// File: src/main/java/org/lokray/tabula/lexer/Lexer.java

package org.lokray.tabula.lexer;

import org.lokray.tabula.util.Debug;
import org.lokray.tabula.util.Diagnostic;
import org.lokray.tabula.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw Tabula source code and converts it into a flat stream of positioned Tokens.
 * <p>
 * Whitespace is significant: every leading TAB of a line becomes its own {@link TokenType#TAB}
 * token so the block resolver can count them, a run of spaces collapses into one
 * {@link TokenType#SPACE} token, and each line ends with a {@link TokenType#NEWLINE}.
 * <p>
 * The lexer never gives up. Problems are reported to the {@link ErrorReporter} and scanning
 * continues, leaving an {@link TokenType#ERROR} token where text could not be tokenized.
 */
public class Lexer
{
	/**
	 * Reserved words. They are lexed as ordinary WORD tokens; the parser tells them apart by lexeme.
	 */
	public static final Set<String> KEYWORDS = Set.of(
			"let", "func", "if", "else", "for", "in", "return", "print");

	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens
	private final ErrorReporter errorReporter; // For reporting lexical errors

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;

	private boolean atLineStart = true; // True until the leading indentation of a line has been scanned

	/**
	 * Constructs a Lexer.
	 *
	 * @param source        The source code string to tokenize.
	 * @param errorReporter An instance of ErrorReporter for logging errors.
	 */
	public Lexer(String source, ErrorReporter errorReporter)
	{
		this.source = source;
		this.errorReporter = errorReporter;
	}

	/**
	 * Scans the entire source code and returns a list of tokens, always terminated by EOF.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd())
		{
			start = current; // Mark the beginning of the current token
			startLine = line;
			startColumn = column;

			if (atLineStart)
			{
				scanIndentation();
			}
			else
			{
				scanToken(); // Scan and add the next token
			}
		}

		tokens.add(new Token(TokenType.EOF, "", null, line, column));
		Debug.log("Lexed %d tokens over %d lines", tokens.size(), line);
		return tokens;
	}

	/**
	 * Scans the leading whitespace of a line. TABs before the first SPACE are emitted one token each;
	 * a SPACE anywhere in the run is an indentation error and ends the counted prefix.
	 * Lines holding nothing but whitespace (or a comment) produce no indentation tokens at all.
	 */
	private void scanIndentation()
	{
		atLineStart = false;

		int tabs = 0;
		boolean sawSpace = false;
		int spaceColumn = 0;

		while (peek() == '\t' || peek() == ' ' || peek() == '\r')
		{
			char c = advance();
			if (c == '\t' && !sawSpace)
			{
				tabs++;
			}
			else if (c == ' ' && !sawSpace)
			{
				sawSpace = true;
				spaceColumn = column - 1;
			}
		}

		if (isAtEnd() || peek() == '\n' || peek() == '#')
		{
			return; // Blank line: indentation is irrelevant
		}

		for (int i = 0; i < tabs; i++)
		{
			tokens.add(new Token(TokenType.TAB, "\t", null, startLine, startColumn + i));
		}

		if (sawSpace)
		{
			error(startLine, spaceColumn, "inconsistent indentation: SPACE in leading indentation (counted " + tabs + " TAB(s) before it)");
		}
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken()
	{
		char c = advance(); // Get and consume the current character

		switch (c)
		{
			// --- Operators ---
			case '+':
			case '-':
			case '*':
			case '/':
			case '>':
			case '<':
			case '(':
			case ')':
				addToken(TokenType.OPERATOR);
				break;
			case '=':
				if (match('='))
				{
					addToken(TokenType.OPERATOR);
				}
				else
				{
					error(startLine, startColumn, "unexpected character '='; did you mean '=='?");
					addToken(TokenType.ERROR);
				}
				break;

			// --- Whitespace ---
			case '\t':
				strayTab(startLine, startColumn);
				scanSpaces();
				break;
			case ' ':
				scanSpaces();
				break;
			case '\r':
				// Ignore carriage returns so CRLF sources lex exactly like LF sources.
				break;
			case '\n':
				addToken(TokenType.NEWLINE);
				atLineStart = true;
				break;

			// --- Comments ---
			case '#':
				while (peek() != '\n' && !isAtEnd())
				{
					advance();
				}
				break;

			// --- Literals and Words ---
			case '"':
				scanString();
				break;

			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (Character.isLetter(c) || c == '_')
				{
					scanWord();
				}
				else
				{
					error(startLine, startColumn, "unexpected character '" + c + "'");
					addToken(TokenType.ERROR); // Add an error token to continue parsing
				}
				break;
		}
	}

	/**
	 * Collapses a run of spaces (and, with an error each, stray TABs) into one SPACE token.
	 */
	private void scanSpaces()
	{
		while (peek() == ' ' || peek() == '\t')
		{
			int tabLine = line;
			int tabColumn = column;
			if (advance() == '\t')
			{
				strayTab(tabLine, tabColumn);
			}
		}
		addToken(TokenType.SPACE);
	}

	private void strayTab(int tabLine, int tabColumn)
	{
		error(tabLine, tabColumn, "TAB only valid as leading indentation");
	}

	/**
	 * Scans a string literal enclosed in double quotes. A string may not span lines:
	 * reaching the end of the line first reports the literal as unterminated and still
	 * emits the truncated STRING token so parsing can go on.
	 */
	private void scanString()
	{
		StringBuilder value = new StringBuilder();
		while (peek() != '"' && !isAtLineEnd())
		{
			int escapeLine = line;
			int escapeColumn = column;
			char c = advance();
			if (c != '\\')
			{
				value.append(c);
				continue;
			}

			if (isAtLineEnd())
			{
				break;
			}
			char escapeChar = advance(); // Consume the escaped character
			switch (escapeChar)
			{
				case 'n':
					value.append('\n');
					break;
				case 't':
					value.append('\t');
					break;
				case 'r':
					value.append('\r');
					break;
				case '0':
					value.append('\0');
					break;
				case '"':
					value.append('"');
					break;
				case '\\':
					value.append('\\');
					break;
				default:
					errorReporter.warn(Diagnostic.Category.LEX, escapeLine, escapeColumn,
							"unknown escape sequence '\\" + escapeChar + "' kept as written");
					value.append('\\').append(escapeChar); // Append as-is if invalid escape
					break;
			}
		}

		if (peek() != '"')
		{
			error(startLine, startColumn, "unterminated string literal");
			addToken(TokenType.STRING, value.toString());
			return;
		}

		advance(); // Consume the closing '"'
		addToken(TokenType.STRING, value.toString());
	}

	/**
	 * Scans a NUMBER (digits) or FLOAT (digits '.' digits) literal. Any other arrangement of
	 * digits and points is malformed and becomes an ERROR token covering the whole run.
	 */
	private void scanNumber()
	{
		int points = 0;
		while (isDigit(peek()) || peek() == '.')
		{
			if (advance() == '.')
			{
				points++;
			}
		}

		String text = source.substring(start, current);
		if (points == 0)
		{
			try
			{
				addToken(TokenType.NUMBER, Long.parseLong(text));
			}
			catch (NumberFormatException e)
			{
				error(startLine, startColumn, "malformed numeric literal '" + text + "': out of range");
				addToken(TokenType.ERROR);
			}
		}
		else if (points == 1 && !text.endsWith("."))
		{
			double value = Double.parseDouble(text);
			if (Double.isInfinite(value))
			{
				error(startLine, startColumn, "malformed numeric literal '" + text + "': out of range");
				addToken(TokenType.ERROR);
			}
			else
			{
				addToken(TokenType.FLOAT, value);
			}
		}
		else
		{
			error(startLine, startColumn, "malformed numeric literal '" + text + "'");
			addToken(TokenType.ERROR);
		}
	}

	/**
	 * Scans a word: an identifier or a keyword. Both use the WORD kind.
	 */
	private void scanWord()
	{
		while (Character.isLetterOrDigit(peek()) || peek() == '_')
		{
			advance();
		}
		addToken(TokenType.WORD);
	}

	/**
	 * Consumes the current character and returns it, also updates line/column.
	 *
	 * @return The consumed character.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
		return c;
	}

	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, startLine, startColumn));
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	/**
	 * Checks if the current character matches the expected character and consumes it if so.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		advance();
		return true;
	}

	/**
	 * Looks at the current character without consuming it.
	 *
	 * @return The current character, or '\0' if at the end of the source.
	 */
	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	/**
	 * ASCII digits only; other Unicode digits are not part of numeric literals.
	 */
	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private boolean isAtLineEnd()
	{
		return isAtEnd() || peek() == '\n' || (peek() == '\r' && peekNext() == '\n');
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private void error(int errorLine, int errorColumn, String message)
	{
		errorReporter.report(Diagnostic.Category.LEX, errorLine, errorColumn, message);
	}
}
