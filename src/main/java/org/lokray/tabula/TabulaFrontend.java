package org.lokray.tabula;

import org.lokray.tabula.ast.Program;
import org.lokray.tabula.indent.BlockResolver;
import org.lokray.tabula.indent.ResolvedTokens;
import org.lokray.tabula.lexer.Lexer;
import org.lokray.tabula.lexer.Token;
import org.lokray.tabula.parser.TabulaParser;
import org.lokray.tabula.util.Debug;
import org.lokray.tabula.util.ErrorReporter;

import java.util.List;

/**
 * Runs the three front-end phases over one source text: lexing, block resolution and parsing.
 * All phases report into one fresh {@link ErrorReporter}, so every call is independent and
 * the class can be used from many threads at once.
 */
public final class TabulaFrontend
{
	private TabulaFrontend()
	{
	}

	public static CompilationUnit compile(String source)
	{
		return compile(null, source);
	}

	/**
	 * @param path   Where the source came from, used only for display. May be null.
	 * @param source The complete source text.
	 * @return The tokens, the tree and every diagnostic. Never null, even for malformed input.
	 */
	public static CompilationUnit compile(String path, String source)
	{
		ErrorReporter errorReporter = new ErrorReporter();

		Debug.log("--- Lexing %s ---", path != null ? path : "<input>");
		Lexer lexer = new Lexer(source, errorReporter);
		List<Token> tokens = lexer.scanTokens();

		Debug.log("--- Resolving blocks ---");
		BlockResolver resolver = new BlockResolver(tokens, errorReporter);
		ResolvedTokens resolved = resolver.resolve();

		Debug.log("--- Parsing ---");
		TabulaParser parser = new TabulaParser(resolved.getTokens(), errorReporter);
		Program program = parser.parse();

		Debug.log("Finished with %d diagnostic(s)", errorReporter.count());
		return new CompilationUnit(path, source, tokens, resolved, program, errorReporter.getDiagnostics());
	}
}
