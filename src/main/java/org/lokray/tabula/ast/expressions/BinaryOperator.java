package org.lokray.tabula.ast.expressions;

import java.util.HashMap;
import java.util.Map;

/**
 * The binary operators and their precedence. A higher level binds tighter; all of them are
 * left-associative.
 */
public enum BinaryOperator
{
	MULTIPLY("*", 3),
	DIVIDE("/", 3),
	ADD("+", 2),
	SUBTRACT("-", 2),
	GREATER(">", 1),
	LESS("<", 1),
	EQUAL("==", 1);

	/**
	 * The loosest precedence level; parsing a full expression starts here.
	 */
	public static final int LOWEST_PRECEDENCE = 1;

	private static final Map<String, BinaryOperator> BY_SYMBOL = new HashMap<>();

	static
	{
		for (BinaryOperator operator : values())
		{
			BY_SYMBOL.put(operator.symbol, operator);
		}
	}

	private final String symbol;
	private final int precedence;

	BinaryOperator(String symbol, int precedence)
	{
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public int getPrecedence()
	{
		return precedence;
	}

	/**
	 * @param symbol Operator text such as {@code "+"} or {@code "=="}.
	 * @return the matching operator, or null if {@code symbol} is not a binary operator.
	 */
	public static BinaryOperator fromSymbol(String symbol)
	{
		return BY_SYMBOL.get(symbol);
	}
}
