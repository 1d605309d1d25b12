package org.lokray.tabula.util;

import java.util.Comparator;

/**
 * A non-fatal, position-tagged record of a lexical, indentation or syntax problem.
 * Diagnostics are collected by the {@link ErrorReporter} rather than thrown.
 */
public final class Diagnostic
{
	public enum Severity
	{
		ERROR, WARNING
	}

	/**
	 * The front-end phase that produced the diagnostic.
	 */
	public enum Category
	{
		LEX("Lexical Error"),
		INDENT("Indentation Error"),
		SYNTAX("Syntax Error");

		private final String label;

		Category(String label)
		{
			this.label = label;
		}

		public String getLabel()
		{
			return label;
		}
	}

	/**
	 * Orders diagnostics by source position; ties keep their reporting order when used with a stable sort.
	 */
	public static final Comparator<Diagnostic> BY_POSITION = Comparator
			.comparingInt(Diagnostic::getLine)
			.thenComparingInt(Diagnostic::getColumn);

	private final Severity severity;
	private final Category category;
	private final String message;
	private final int line;
	private final int column;

	public Diagnostic(Severity severity, Category category, String message, int line, int column)
	{
		this.severity = severity;
		this.category = category;
		this.message = message;
		this.line = line;
		this.column = column;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	public Category getCategory()
	{
		return category;
	}

	public String getMessage()
	{
		return message;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public boolean isError()
	{
		return severity == Severity.ERROR;
	}

	@Override
	public String toString()
	{
		String level = severity == Severity.ERROR ? "[Error]" : "[Warning]";
		return level + " Line " + line + ", Column " + column + ": [" + category.getLabel() + "] " + message;
	}
}
