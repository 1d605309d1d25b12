package org.lokray.tabula.ast.expressions;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.lexer.Token;

import java.math.BigDecimal;
import java.util.List;

/**
 * AST node representing a literal value: an integer, a float or a string.
 * Holds the decoded value and the token it came from.
 */
public class LiteralExpression implements Expression
{
	public enum Kind
	{
		NUMBER, FLOAT, STRING
	}

	private final Kind kind;
	private final Object value; // Long, Double or String depending on kind
	private final Token literalToken;

	public LiteralExpression(Kind kind, Object value, Token literalToken)
	{
		this.kind = kind;
		this.value = value;
		this.literalToken = literalToken;
	}

	public Kind getKind()
	{
		return kind;
	}

	public Object getValue()
	{
		return value;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	/**
	 * Renders the value the way it would be written in source: strings quoted and escaped,
	 * floats always with a decimal point and never in exponent form.
	 */
	public String toSourceText()
	{
		switch (kind)
		{
			case STRING:
				return quote((String) value);
			case FLOAT:
				String text = BigDecimal.valueOf((Double) value).toPlainString();
				return text.indexOf('.') < 0 ? text + ".0" : text;
			default:
				return String.valueOf(value);
		}
	}

	/**
	 * Quotes a string value, escaping the characters the lexer decodes.
	 */
	public static String quote(String raw)
	{
		StringBuilder sb = new StringBuilder("\"");
		for (char c : raw.toCharArray())
		{
			switch (c)
			{
				case '\n':
					sb.append("\\n");
					break;
				case '\t':
					sb.append("\\t");
					break;
				case '\r':
					sb.append("\\r");
					break;
				case '\0':
					sb.append("\\0");
					break;
				case '"':
					sb.append("\\\"");
					break;
				case '\\':
					sb.append("\\\\");
					break;
				default:
					sb.append(c);
			}
		}
		return sb.append('"').toString();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return literalToken;
	}

	@Override
	public List<ASTNode> children()
	{
		return List.of();
	}

	@Override
	public String toString()
	{
		// For string literals, include quotes in the output for clarity
		if (kind == Kind.STRING)
		{
			return "\"" + value + "\"";
		}
		return String.valueOf(value);
	}
}
