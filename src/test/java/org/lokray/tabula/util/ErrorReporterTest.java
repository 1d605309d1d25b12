package org.lokray.tabula.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorReporterTest
{
	@Test
	public void ordersDiagnosticsByPosition()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.report(Diagnostic.Category.SYNTAX, 3, 1, "third");
		reporter.report(Diagnostic.Category.LEX, 1, 5, "second");
		reporter.report(Diagnostic.Category.INDENT, 1, 2, "first");

		List<Diagnostic> diagnostics = reporter.getDiagnostics();
		assertEquals("first", diagnostics.get(0).getMessage());
		assertEquals("second", diagnostics.get(1).getMessage());
		assertEquals("third", diagnostics.get(2).getMessage());
	}

	@Test
	public void keepsReportingOrderForSamePosition()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.report(Diagnostic.Category.LEX, 2, 2, "a");
		reporter.report(Diagnostic.Category.SYNTAX, 2, 2, "b");

		assertEquals("a", reporter.getDiagnostics().get(0).getMessage());
		assertEquals("b", reporter.getDiagnostics().get(1).getMessage());
	}

	@Test
	public void warningsAreNotErrors()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.warn(Diagnostic.Category.LEX, 1, 1, "odd escape");

		assertFalse(reporter.hasErrors());
		assertEquals(1, reporter.count());

		reporter.report(Diagnostic.Category.LEX, 1, 1, "bad");
		assertTrue(reporter.hasErrors());
		assertEquals(2, reporter.count());
	}

	@Test
	public void diagnosticListIsReadOnly()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.report(Diagnostic.Category.LEX, 1, 1, "bad");

		assertThrows(UnsupportedOperationException.class, () -> reporter.getDiagnostics().clear());
	}

	@Test
	public void formatsDiagnostic()
	{
		Diagnostic diagnostic = new Diagnostic(Diagnostic.Severity.ERROR, Diagnostic.Category.INDENT, "unexpected indent", 4, 2);

		assertEquals("[Error] Line 4, Column 2: [Indentation Error] unexpected indent", diagnostic.toString());
	}
}
