// File: src/main/java/org/lokray/tabula/parser/TabulaParser.java

package org.lokray.tabula.parser;

import org.lokray.tabula.ast.Program;
import org.lokray.tabula.ast.expressions.*;
import org.lokray.tabula.ast.statements.*;
import org.lokray.tabula.lexer.Token;
import org.lokray.tabula.lexer.TokenType;
import org.lokray.tabula.util.Debug;
import org.lokray.tabula.util.Diagnostic;
import org.lokray.tabula.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;

/**
 * The TabulaParser is responsible for performing syntactic analysis.
 * It takes the token stream annotated by the block resolver (with BLOCK_ENTER/BLOCK_EXIT
 * markers in place of indentation changes) and builds an Abstract Syntax Tree (AST).
 * This parser uses a recursive-descent approach for statements and precedence climbing
 * for binary expressions.
 * <p>
 * The statement states are carried by the call stack: {@link #statement()} expects a statement,
 * {@link #block(Token)} expects the BLOCK_ENTER of a header's body and {@link #blockBody()} runs
 * until the matching BLOCK_EXIT. {@code else} is accepted only by {@link #ifStatement(Token)}
 * right after the then-body; anywhere else it reaches {@link #danglingElse(Token)}.
 * <p>
 * The parser never stops at the first problem. A statement that cannot be parsed is reported,
 * replaced with a {@link NoOpStatement} and parsing resumes at the next line. A header
 * expression that cannot be parsed becomes an {@link ErrorExpression} so that the body of the
 * header is still parsed.
 */
public class TabulaParser
{
	private final List<Token> tokens; // The resolved token stream
	private final ErrorReporter errorReporter; // For reporting parsing errors
	private int current = 0; // Current position in the token list

	private int expressionDepth = 0; // Open groups and unary operators around the current position

	/**
	 * Deepest expression nesting accepted before the parser gives up on a statement.
	 */
	private static final int MAX_EXPRESSION_DEPTH = 256;

	/**
	 * Constructs a TabulaParser.
	 *
	 * @param tokens        The token list produced by the block resolver, ending in EOF.
	 * @param errorReporter An instance of ErrorReporter for handling parsing errors.
	 */
	public TabulaParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this.tokens = tokens;
		this.errorReporter = errorReporter;
	}

	/**
	 * Starts the parsing process for the entire Tabula program.
	 *
	 * @return The root of the parsed AST. Never null: unparseable statements are present as placeholders.
	 */
	public Program parse()
	{
		List<Statement> statements = new ArrayList<>();
		while (!isAtEnd())
		{
			if (match(TokenType.NEWLINE))
			{
				continue; // Blank line
			}
			if (match(TokenType.BLOCK_EXIT))
			{
				continue; // Only reachable when a block was already abandoned
			}
			if (check(TokenType.BLOCK_ENTER))
			{
				discardBlock();
				continue;
			}
			statements.add(statement());
		}

		Debug.log("Parsed %d top-level statement(s)", statements.size());
		return new Program(statements);
	}

	// --- Statements ---

	/**
	 * Parses one statement, dispatching on the keyword that starts the line.
	 * Anything that does not start with a keyword is an expression statement.
	 *
	 * @return The statement, or a NoOpStatement placeholder if it could not be parsed.
	 */
	private Statement statement()
	{
		while (match(TokenType.TAB))
		{
			// Indentation is already encoded by the block markers
		}

		Token start = peek();
		try
		{
			if (start.getType() == TokenType.WORD && start.isKeyword())
			{
				advance();
				switch (start.getLexeme())
				{
					case "let":
						return letStatement(start);
					case "func":
						return funcStatement(start);
					case "if":
						return ifStatement(start);
					case "for":
						return forStatement(start);
					case "print":
						return printStatement(start);
					case "return":
						return returnStatement(start);
					case "else":
						return danglingElse(start);
					default:
						throw error(start, "unexpected keyword '" + start.getLexeme() + "' at start of statement");
				}
			}
			return expressionStatement();
		}
		catch (SyntaxError e)
		{
			synchronize();
			return new NoOpStatement(start);
		}
	}

	/**
	 * Parses a variable binding.
	 * Grammar: {@code "let" SPACE WORD SPACE expr NEWLINE}
	 */
	private LetStatement letStatement(Token keyword) throws SyntaxError
	{
		requireSpace("expected variable name after 'let'");
		Token name = consumeName("expected variable name after 'let'");
		requireSpace("expected value after variable name '" + name.getLexeme() + "'");
		Expression value = expression();
		lineEnd();
		return new LetStatement(keyword, name, value);
	}

	/**
	 * Parses a function definition.
	 * Grammar: {@code "func" SPACE WORD (SPACE WORD)* NEWLINE block}
	 */
	private FuncStatement funcStatement(Token keyword) throws SyntaxError
	{
		requireSpace("expected function name after 'func'");
		Token name = consumeName("expected function name after 'func'");
		List<Token> parameters = new ArrayList<>();
		while (check(TokenType.SPACE) && !restOfLineIsJunk())
		{
			advance();
			parameters.add(consumeName("expected parameter name in definition of '" + name.getLexeme() + "'"));
		}
		lineEnd();

		List<Statement> body = block(keyword);
		return new FuncStatement(keyword, name, parameters, body);
	}

	/**
	 * Parses a conditional with its optional else branch.
	 * Grammar: {@code "if" SPACE expr NEWLINE block ("else" NEWLINE block)?}
	 */
	private IfStatement ifStatement(Token ifKeyword)
	{
		Expression condition = headerExpression("expected condition after 'if'");
		List<Statement> thenBranch = block(ifKeyword);

		Token elseKeyword = null;
		List<Statement> elseBranch = null;
		if (elseFollows())
		{
			while (match(TokenType.NEWLINE, TokenType.TAB))
			{
				// Skip to the 'else' keyword
			}
			elseKeyword = advance();
			recoverLineEnd();
			elseBranch = block(elseKeyword);
		}
		return new IfStatement(ifKeyword, condition, thenBranch, elseKeyword, elseBranch);
	}

	/**
	 * Parses a loop.
	 * Grammar: {@code "for" SPACE WORD SPACE "in" SPACE expr NEWLINE block}
	 */
	private ForStatement forStatement(Token keyword) throws SyntaxError
	{
		requireSpace("expected loop variable after 'for'");
		Token variable = consumeName("expected loop variable after 'for'");
		requireSpace("expected 'in' after loop variable '" + variable.getLexeme() + "'");
		if (!peek().isKeyword("in"))
		{
			throw error(peek(), "expected 'in' after loop variable '" + variable.getLexeme() + "', found " + describe(peek()));
		}
		advance();

		Expression iterable = headerExpression("expected expression after 'in'");
		List<Statement> body = block(keyword);
		return new ForStatement(keyword, variable, iterable, body);
	}

	/**
	 * Parses a print statement. {@code print} is variadic and needs at least one argument.
	 * Grammar: {@code "print" SPACE expr (SPACE expr)* NEWLINE}
	 */
	private Statement printStatement(Token keyword) throws SyntaxError
	{
		List<Expression> arguments = new ArrayList<>();
		while (check(TokenType.SPACE) && !restOfLineIsJunk())
		{
			advance();
			arguments.add(expression());
		}

		if (arguments.isEmpty())
		{
			Token next = peek(check(TokenType.SPACE) ? 1 : 0);
			if (next.getType() == TokenType.ERROR)
			{
				throw error(next, "expected expression after 'print'");
			}
			if (!check(TokenType.SPACE) && !isLineBoundary(peek()))
			{
				throw error(peek(), "expected space after 'print', found " + describe(peek()));
			}
			error(keyword, "print requires at least one expression");
			lineEnd();
			return new NoOpStatement(keyword);
		}

		lineEnd();
		return new PrintStatement(keyword, arguments);
	}

	/**
	 * Grammar: {@code "return" (SPACE expr)? NEWLINE}
	 */
	private ReturnStatement returnStatement(Token keyword) throws SyntaxError
	{
		Expression value = null;
		if (check(TokenType.SPACE) && !restOfLineIsJunk())
		{
			advance();
			value = expression();
		}
		lineEnd();
		return new ReturnStatement(keyword, value);
	}

	private ExpressionStatement expressionStatement() throws SyntaxError
	{
		Expression expression = expression();
		lineEnd();
		return new ExpressionStatement(expression);
	}

	/**
	 * An {@code else} that does not directly follow the body of an {@code if}. Its body is
	 * parsed so that later lines keep their structure, then dropped.
	 */
	private Statement danglingElse(Token elseKeyword)
	{
		error(elseKeyword, "else without matching if");
		recoverLineEnd();
		skipBlankLines();
		if (check(TokenType.BLOCK_ENTER))
		{
			discardBlock();
		}
		return new NoOpStatement(elseKeyword);
	}

	/**
	 * Parses the condition or iterable of a header line up to and including its NEWLINE.
	 * A failure is reported and yields an ErrorExpression, leaving the parser at the next
	 * line so that the body can still be parsed.
	 */
	private Expression headerExpression(String missingSpaceMessage)
	{
		Token location = peek();
		try
		{
			requireSpace(missingSpaceMessage);
			location = peek();
			Expression expression = expression();
			lineEnd();
			return expression;
		}
		catch (SyntaxError e)
		{
			synchronize();
			return new ErrorExpression(location);
		}
	}

	// --- Blocks ---

	/**
	 * Parses the indented body that must follow a header line.
	 * Grammar: {@code BLOCK_ENTER statement+ BLOCK_EXIT}
	 *
	 * @param header The keyword of the header that owns the block.
	 * @return The body statements; empty if the body is missing.
	 */
	private List<Statement> block(Token header)
	{
		skipBlankLines();
		if (!check(TokenType.BLOCK_ENTER))
		{
			error(header, "expected indented block after '" + header.getLexeme() + "'");
			return new ArrayList<>();
		}
		return blockBody();
	}

	/**
	 * Parses a block nobody asked for (the body of a header that failed to parse) and drops it.
	 * The statements inside still report their own problems.
	 */
	private void discardBlock()
	{
		List<Statement> dropped = blockBody();
		Debug.log("Discarded block of %d statement(s) at line %d", dropped.size(),
				dropped.isEmpty() ? previous().getLine() : dropped.get(0).getLine());
	}

	private List<Statement> blockBody()
	{
		advance(); // BLOCK_ENTER

		List<Statement> body = new ArrayList<>();
		while (!isAtEnd() && !check(TokenType.BLOCK_EXIT))
		{
			if (match(TokenType.NEWLINE))
			{
				continue;
			}
			if (check(TokenType.BLOCK_ENTER))
			{
				discardBlock();
				continue;
			}
			body.add(statement());
		}
		match(TokenType.BLOCK_EXIT);
		return body;
	}

	/**
	 * @return true if the next non-blank line of the current block starts with {@code else}.
	 */
	private boolean elseFollows()
	{
		int offset = 0;
		while (check(offset, TokenType.NEWLINE) || check(offset, TokenType.TAB))
		{
			offset++;
		}
		return peek(offset).isKeyword("else");
	}

	// --- Expressions ---

	/**
	 * Grammar: {@code expr = binary_expr}
	 */
	private Expression expression() throws SyntaxError
	{
		return binary(BinaryOperator.LOWEST_PRECEDENCE);
	}

	/**
	 * Precedence climbing: folds operators of at least {@code minPrecedence} into a
	 * left-associative tree. Spaces around an operator are optional.
	 */
	private Expression binary(int minPrecedence) throws SyntaxError
	{
		Expression left = unary();
		while (true)
		{
			int saved = current;
			match(TokenType.SPACE);
			BinaryOperator operator = peekBinaryOperator();
			if (operator == null || operator.getPrecedence() < minPrecedence)
			{
				current = saved; // The space belongs to whoever comes next
				return left;
			}
			Token operatorToken = advance();
			match(TokenType.SPACE);
			Expression right = binary(operator.getPrecedence() + 1);
			left = new BinaryExpression(left, operatorToken, operator, right);
		}
	}

	/**
	 * Grammar: {@code unary_expr = ("-" SPACE?)* primary_expr}
	 */
	private Expression unary() throws SyntaxError
	{
		if (peek().isOperator("-"))
		{
			Token operatorToken = advance();
			enterNested(operatorToken);
			try
			{
				match(TokenType.SPACE);
				Expression operand = unary();
				return new UnaryExpression(operatorToken, UnaryOperator.NEGATE, operand);
			}
			finally
			{
				expressionDepth--;
			}
		}
		return primary();
	}

	/**
	 * A WORD followed by space-separated atoms is a call; the atoms are its positional
	 * arguments. Collection stops at anything that is not an atom, so an operator always
	 * hands control back to {@link #binary(int)}.
	 * Grammar: {@code primary_expr = atom | WORD (SPACE atom)*}
	 */
	private Expression primary() throws SyntaxError
	{
		Token token = peek();
		if (token.getType() != TokenType.WORD || token.isKeyword())
		{
			return atom();
		}

		advance();
		Expression callee = new IdentifierExpression(token);
		List<Expression> arguments = new ArrayList<>();
		while (check(TokenType.SPACE) && startsAtom(peek(1)))
		{
			advance(); // SPACE
			arguments.add(atom());
		}
		return arguments.isEmpty() ? callee : new CallExpression(callee, arguments);
	}

	/**
	 * Grammar: {@code atom = NUMBER | FLOAT | STRING | WORD | "(" SPACE? expr SPACE? ")"}
	 */
	private Expression atom() throws SyntaxError
	{
		Token token = peek();
		switch (token.getType())
		{
			case NUMBER:
				advance();
				return new LiteralExpression(LiteralExpression.Kind.NUMBER, token.getLiteral(), token);
			case FLOAT:
				advance();
				return new LiteralExpression(LiteralExpression.Kind.FLOAT, token.getLiteral(), token);
			case STRING:
				advance();
				return new LiteralExpression(LiteralExpression.Kind.STRING, token.getLiteral(), token);
			case WORD:
				if (token.isKeyword())
				{
					throw error(token, "unexpected keyword '" + token.getLexeme() + "' in expression");
				}
				advance();
				return new IdentifierExpression(token);
			case OPERATOR:
				if (token.isOperator("("))
				{
					return group();
				}
				if (token.isOperator(")"))
				{
					throw error(token, "unbalanced expression: unexpected ')'");
				}
				throw error(token, "expected expression before operator '" + token.getLexeme() + "'");
			default:
				throw error(token, "expected expression, found " + describe(token));
		}
	}

	private Expression group() throws SyntaxError
	{
		Token open = advance();
		enterNested(open);
		try
		{
			match(TokenType.SPACE);
			Expression inner = expression();
			match(TokenType.SPACE);
			if (!peek().isOperator(")"))
			{
				throw error(open, "unbalanced expression: '(' is never closed");
			}
			advance();
			return inner;
		}
		finally
		{
			expressionDepth--;
		}
	}

	/**
	 * Counts one more level of expression nesting; the caller undoes it when the level closes.
	 */
	private void enterNested(Token token) throws SyntaxError
	{
		if (expressionDepth >= MAX_EXPRESSION_DEPTH)
		{
			throw error(token, "expression nested too deeply (more than " + MAX_EXPRESSION_DEPTH + " levels)");
		}
		expressionDepth++;
	}

	private boolean startsAtom(Token token)
	{
		switch (token.getType())
		{
			case NUMBER:
			case FLOAT:
			case STRING:
				return true;
			case WORD:
				return !token.isKeyword();
			case OPERATOR:
				return token.isOperator("(");
			default:
				return false;
		}
	}

	private BinaryOperator peekBinaryOperator()
	{
		Token token = peek();
		return token.getType() == TokenType.OPERATOR ? BinaryOperator.fromSymbol(token.getLexeme()) : null;
	}

	// --- Line structure ---

	/**
	 * Ends a logical line. Trailing spaces and ERROR tokens (already reported by the lexer)
	 * are skipped. A NEWLINE is consumed; EOF and BLOCK_EXIT are left for the caller.
	 *
	 * @throws SyntaxError if anything else is left on the line.
	 */
	private void lineEnd() throws SyntaxError
	{
		while (match(TokenType.SPACE, TokenType.ERROR))
		{
			// Nothing to do
		}
		if (match(TokenType.NEWLINE) || isLineBoundary(peek()))
		{
			return;
		}
		if (peek().isOperator(")"))
		{
			throw error(peek(), "unbalanced expression: unexpected ')'");
		}
		throw error(peek(), "unexpected " + describe(peek()) + "; expected end of line");
	}

	/**
	 * Like {@link #lineEnd()}, but reports leftovers and skips them instead of unwinding.
	 */
	private void recoverLineEnd()
	{
		try
		{
			lineEnd();
		}
		catch (SyntaxError e)
		{
			synchronize();
		}
	}

	private boolean isLineBoundary(Token token)
	{
		TokenType type = token.getType();
		return type == TokenType.NEWLINE || type == TokenType.EOF || type == TokenType.BLOCK_EXIT;
	}

	/**
	 * @return true if nothing but spaces and ERROR tokens is left before the end of the line.
	 */
	private boolean restOfLineIsJunk()
	{
		int offset = 0;
		while (check(offset, TokenType.SPACE) || check(offset, TokenType.ERROR))
		{
			offset++;
		}
		return isLineBoundary(peek(offset));
	}

	private void skipBlankLines()
	{
		while (match(TokenType.NEWLINE))
		{
			// Blank lines never open or close blocks
		}
	}

	private void requireSpace(String message) throws SyntaxError
	{
		if (!match(TokenType.SPACE))
		{
			throw error(peek(), message + ", found " + describe(peek()));
		}
	}

	/**
	 * Consumes a WORD that is usable as a name, i.e. not a keyword.
	 */
	private Token consumeName(String message) throws SyntaxError
	{
		Token token = peek();
		if (token.getType() == TokenType.WORD && token.isKeyword())
		{
			throw error(token, message + ", found keyword '" + token.getLexeme() + "'");
		}
		return consume(TokenType.WORD, message + ", found " + describe(token));
	}

	/**
	 * Human readable name of a token for diagnostics.
	 */
	private static String describe(Token token)
	{
		switch (token.getType())
		{
			case EOF:
				return "end of input";
			case NEWLINE:
				return "end of line";
			case BLOCK_EXIT:
				return "end of block";
			case BLOCK_ENTER:
				return "indented block";
			case SPACE:
				return "space";
			case TAB:
				return "TAB";
			default:
				return "'" + token.getLexeme() + "'";
		}
	}

	// --- Token stream helpers ---

	/**
	 * Consumes the current token if its type matches any of the given types.
	 *
	 * @param types The TokenType(s) to match against.
	 * @return True if a match was found and the token was consumed, false otherwise.
	 */
	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes the current token if it has the expected type, otherwise reports a syntax error.
	 *
	 * @param type    The expected TokenType.
	 * @param message The error message to report if the type doesn't match.
	 * @return The consumed Token.
	 * @throws SyntaxError if the current token's type does not match the expected type.
	 */
	private Token consume(TokenType type, String message) throws SyntaxError
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	/**
	 * Checks if the current token's type matches the given type without consuming it.
	 */
	private boolean check(TokenType type)
	{
		if (isAtEnd())
		{
			return false;
		}
		return peek().getType() == type;
	}

	/**
	 * Helper method to check a token type at a given offset from the current position.
	 *
	 * @param offset The offset from the current token (0 for current, 1 for next, etc.)
	 * @param type   The TokenType to check for.
	 * @return True if the token at the offset exists and matches the type, false otherwise.
	 */
	private boolean check(int offset, TokenType type)
	{
		if (current + offset >= tokens.size())
		{
			return false;
		}
		return tokens.get(current + offset).getType() == type;
	}

	/**
	 * Consumes the current token and returns it.
	 *
	 * @return The consumed Token.
	 */
	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	/**
	 * Looks at the token at a given offset from the current position without consuming it.
	 *
	 * @param offset The offset from the current token (0 for current, 1 for next, etc.).
	 * @return The Token at the specified offset, or EOF if past the end of the token list.
	 */
	private Token peek(int offset)
	{
		if (current + offset >= tokens.size())
		{
			return tokens.get(tokens.size() - 1);
		}
		return tokens.get(current + offset);
	}

	private Token peek()
	{
		return peek(0);
	}

	/**
	 * Looks at the previous token (the one just consumed).
	 */
	private Token previous()
	{
		return tokens.get(Math.max(current - 1, 0));
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	/**
	 * Reports a parsing error and creates a SyntaxError. Errors positioned on an ERROR token
	 * are not reported again since the lexer already did.
	 *
	 * @param token   The token where the error occurred.
	 * @param message The error message.
	 * @return A new SyntaxError instance.
	 */
	private SyntaxError error(Token token, String message)
	{
		if (token.getType() != TokenType.ERROR)
		{
			errorReporter.report(Diagnostic.Category.SYNTAX, token.getLine(), token.getColumn(), message);
		}
		return new SyntaxError();
	}

	/**
	 * Skips the rest of the current logical line after an error. Stops after a NEWLINE, or
	 * before a BLOCK_EXIT or EOF so that the enclosing block still sees its end.
	 */
	private void synchronize()
	{
		while (!isAtEnd())
		{
			if (check(TokenType.BLOCK_EXIT))
			{
				return;
			}
			if (advance().getType() == TokenType.NEWLINE)
			{
				return;
			}
		}
	}

	/**
	 * Unchecked exception used internally by the parser to unwind the stack to the
	 * enclosing statement when a syntax error is found.
	 */
	private static class SyntaxError extends RuntimeException
	{
		// No special fields or constructors needed for this basic error type
	}
}
