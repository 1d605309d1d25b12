package org.lokray.tabula.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.ast.Program;
import org.lokray.tabula.ast.expressions.*;
import org.lokray.tabula.ast.statements.*;
import org.lokray.tabula.lexer.Token;
import org.lokray.tabula.util.Diagnostic;

import java.util.List;

/**
 * Converts a parsed program and its diagnostics to JSON for external tools (editors, linters).
 * Every node becomes an object with a {@code "node"} discriminator and its {@code line} and
 * {@code column}; children are nested in source order.
 */
public class AstJsonSerializer implements ASTVisitor<JsonElement>
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().serializeNulls().create();

	public static JsonObject toJson(Program program)
	{
		return program.accept(new AstJsonSerializer()).getAsJsonObject();
	}

	public static JsonArray toJson(List<Diagnostic> diagnostics)
	{
		JsonArray array = new JsonArray();
		for (Diagnostic diagnostic : diagnostics)
		{
			JsonObject object = new JsonObject();
			object.addProperty("severity", diagnostic.getSeverity().name().toLowerCase());
			object.addProperty("category", diagnostic.getCategory().name().toLowerCase());
			object.addProperty("message", diagnostic.getMessage());
			object.addProperty("line", diagnostic.getLine());
			object.addProperty("column", diagnostic.getColumn());
			array.add(object);
		}
		return array;
	}

	public static JsonArray tokensToJson(List<Token> tokens)
	{
		JsonArray array = new JsonArray();
		for (Token token : tokens)
		{
			JsonObject object = new JsonObject();
			object.addProperty("type", token.getType().name());
			object.addProperty("lexeme", token.getLexeme());
			object.addProperty("line", token.getLine());
			object.addProperty("column", token.getColumn());
			array.add(object);
		}
		return array;
	}

	/**
	 * The document printed by {@code tabula ast --json}: the tree plus its diagnostics.
	 */
	public static JsonObject toDocument(String path, Program program, List<Diagnostic> diagnostics)
	{
		JsonObject document = new JsonObject();
		document.addProperty("path", path);
		document.add("program", toJson(program));
		document.add("diagnostics", toJson(diagnostics));
		return document;
	}

	public static String toPrettyString(JsonElement element)
	{
		return GSON.toJson(element);
	}

	@Override
	public JsonElement visitProgram(Program program)
	{
		JsonObject object = node("program", program.getLine(), program.getColumn());
		object.add("statements", statements(program.getStatements()));
		return object;
	}

	@Override
	public JsonElement visitLetStatement(LetStatement statement)
	{
		JsonObject object = node("let", statement.getLine(), statement.getColumn());
		object.addProperty("name", statement.getName().getLexeme());
		object.add("value", statement.getValue().accept(this));
		return object;
	}

	@Override
	public JsonElement visitFuncStatement(FuncStatement statement)
	{
		JsonObject object = node("func", statement.getLine(), statement.getColumn());
		object.addProperty("name", statement.getName().getLexeme());
		JsonArray parameters = new JsonArray();
		for (Token parameter : statement.getParameters())
		{
			parameters.add(parameter.getLexeme());
		}
		object.add("parameters", parameters);
		object.add("body", statements(statement.getBody()));
		return object;
	}

	@Override
	public JsonElement visitIfStatement(IfStatement statement)
	{
		JsonObject object = node("if", statement.getLine(), statement.getColumn());
		object.add("condition", statement.getCondition().accept(this));
		object.add("then", statements(statement.getThenBranch()));
		object.add("else", statement.hasElseBranch() ? statements(statement.getElseBranch()) : JsonNull.INSTANCE);
		return object;
	}

	@Override
	public JsonElement visitForStatement(ForStatement statement)
	{
		JsonObject object = node("for", statement.getLine(), statement.getColumn());
		object.addProperty("variable", statement.getVariable().getLexeme());
		object.add("iterable", statement.getIterable().accept(this));
		object.add("body", statements(statement.getBody()));
		return object;
	}

	@Override
	public JsonElement visitPrintStatement(PrintStatement statement)
	{
		JsonObject object = node("print", statement.getLine(), statement.getColumn());
		object.add("arguments", expressions(statement.getArguments()));
		return object;
	}

	@Override
	public JsonElement visitReturnStatement(ReturnStatement statement)
	{
		JsonObject object = node("return", statement.getLine(), statement.getColumn());
		object.add("value", statement.getValue() == null ? JsonNull.INSTANCE : statement.getValue().accept(this));
		return object;
	}

	@Override
	public JsonElement visitExpressionStatement(ExpressionStatement statement)
	{
		JsonObject object = node("expression", statement.getLine(), statement.getColumn());
		object.add("expression", statement.getExpression().accept(this));
		return object;
	}

	@Override
	public JsonElement visitNoOpStatement(NoOpStatement statement)
	{
		return node("noop", statement.getLine(), statement.getColumn());
	}

	@Override
	public JsonElement visitLiteralExpression(LiteralExpression expression)
	{
		JsonObject object = node("literal", expression.getLine(), expression.getColumn());
		object.addProperty("kind", expression.getKind().name().toLowerCase());
		Object value = expression.getValue();
		if (value instanceof Number)
		{
			object.addProperty("value", (Number) value);
		}
		else
		{
			object.addProperty("value", (String) value);
		}
		return object;
	}

	@Override
	public JsonElement visitIdentifierExpression(IdentifierExpression expression)
	{
		JsonObject object = node("identifier", expression.getLine(), expression.getColumn());
		object.addProperty("name", expression.getIdentifier());
		return object;
	}

	@Override
	public JsonElement visitUnaryExpression(UnaryExpression expression)
	{
		JsonObject object = node("unary", expression.getLine(), expression.getColumn());
		object.addProperty("operator", expression.getOperator().getSymbol());
		object.add("operand", expression.getOperand().accept(this));
		return object;
	}

	@Override
	public JsonElement visitBinaryExpression(BinaryExpression expression)
	{
		JsonObject object = node("binary", expression.getLine(), expression.getColumn());
		object.addProperty("operator", expression.getOperator().getSymbol());
		object.add("left", expression.getLeft().accept(this));
		object.add("right", expression.getRight().accept(this));
		return object;
	}

	@Override
	public JsonElement visitCallExpression(CallExpression expression)
	{
		JsonObject object = node("call", expression.getLine(), expression.getColumn());
		object.add("callee", expression.getCallee().accept(this));
		object.add("arguments", expressions(expression.getArguments()));
		return object;
	}

	@Override
	public JsonElement visitErrorExpression(ErrorExpression expression)
	{
		return node("error", expression.getLine(), expression.getColumn());
	}

	private static JsonObject node(String kind, int line, int column)
	{
		JsonObject object = new JsonObject();
		object.addProperty("node", kind);
		object.addProperty("line", line);
		object.addProperty("column", column);
		return object;
	}

	private JsonArray statements(List<Statement> statements)
	{
		JsonArray array = new JsonArray();
		statements.forEach(s -> array.add(s.accept(this)));
		return array;
	}

	private JsonArray expressions(List<Expression> expressions)
	{
		JsonArray array = new JsonArray();
		expressions.forEach(e -> array.add(e.accept(this)));
		return array;
	}
}
