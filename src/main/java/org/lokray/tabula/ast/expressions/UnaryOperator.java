package org.lokray.tabula.ast.expressions;

public enum UnaryOperator
{
	NEGATE("-");

	private final String symbol;

	UnaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}
}
