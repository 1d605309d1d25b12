package org.lokray.tabula.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one compilation unit. Every phase reports into the same
 * reporter, so a single pass over a file yields all of its problems at once.
 * <p>
 * A reporter belongs to exactly one invocation of the front end and is not shared
 * between threads.
 */
public class ErrorReporter
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private boolean hasErrors = false; // Flag to indicate if any errors have been reported

	/**
	 * Reports an error.
	 *
	 * @param category The phase reporting the problem.
	 * @param line     The line number where the error occurred.
	 * @param column   The column number where the error occurred.
	 * @param message  The error message.
	 */
	public void report(Diagnostic.Category category, int line, int column, String message)
	{
		add(new Diagnostic(Diagnostic.Severity.ERROR, category, message, line, column));
		hasErrors = true;
	}

	/**
	 * Reports a warning. Warnings never make {@link #hasErrors()} true.
	 */
	public void warn(Diagnostic.Category category, int line, int column, String message)
	{
		add(new Diagnostic(Diagnostic.Severity.WARNING, category, message, line, column));
	}

	private void add(Diagnostic diagnostic)
	{
		diagnostics.add(diagnostic);
		Debug.log("%s", diagnostic);
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	/**
	 * @return the number of diagnostics reported so far, warnings included.
	 */
	public int count()
	{
		return diagnostics.size();
	}

	/**
	 * @return every diagnostic reported so far, ordered by source position.
	 */
	public List<Diagnostic> getDiagnostics()
	{
		List<Diagnostic> sorted = new ArrayList<>(diagnostics);
		sorted.sort(Diagnostic.BY_POSITION); // List.sort is stable
		return Collections.unmodifiableList(sorted);
	}
}
