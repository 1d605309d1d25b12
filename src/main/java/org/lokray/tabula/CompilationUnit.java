package org.lokray.tabula;

import org.lokray.tabula.ast.Program;
import org.lokray.tabula.indent.ResolvedTokens;
import org.lokray.tabula.lexer.Token;
import org.lokray.tabula.util.Diagnostic;

import java.util.List;

/**
 * Everything the front end produced for one source text. Immutable; units from different
 * invocations share nothing.
 */
public final class CompilationUnit
{
	private final String path;
	private final String source;
	private final List<Token> rawTokens;
	private final ResolvedTokens resolvedTokens;
	private final Program program;
	private final List<Diagnostic> diagnostics;

	public CompilationUnit(String path, String source, List<Token> rawTokens, ResolvedTokens resolvedTokens,
						   Program program, List<Diagnostic> diagnostics)
	{
		this.path = path;
		this.source = source;
		this.rawTokens = List.copyOf(rawTokens);
		this.resolvedTokens = resolvedTokens;
		this.program = program;
		this.diagnostics = List.copyOf(diagnostics);
	}

	/**
	 * @return the file the source came from, or null for in-memory source.
	 */
	public String getPath()
	{
		return path;
	}

	public String getSource()
	{
		return source;
	}

	/**
	 * @return the lexer output, before block markers were inserted.
	 */
	public List<Token> getRawTokens()
	{
		return rawTokens;
	}

	public ResolvedTokens getResolvedTokens()
	{
		return resolvedTokens;
	}

	public Program getProgram()
	{
		return program;
	}

	/**
	 * @return lexical, indentation and syntax diagnostics ordered by source position.
	 */
	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	public boolean hasErrors()
	{
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	/**
	 * @return the path for display, or {@code <input>} for in-memory source.
	 */
	public String getDisplayName()
	{
		return path != null ? path : "<input>";
	}
}
