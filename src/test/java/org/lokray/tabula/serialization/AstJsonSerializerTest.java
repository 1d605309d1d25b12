package org.lokray.tabula.serialization;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.lokray.tabula.CompilationUnit;
import org.lokray.tabula.TabulaFrontend;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonSerializerTest
{
	@Test
	public void serialisesStatementsAndExpressions()
	{
		JsonObject program = AstJsonSerializer.toJson(TabulaFrontend.compile("let x 1 + 2.5\n").getProgram());

		assertEquals("program", program.get("node").getAsString());
		JsonObject let = program.getAsJsonArray("statements").get(0).getAsJsonObject();
		assertEquals("let", let.get("node").getAsString());
		assertEquals("x", let.get("name").getAsString());
		assertEquals(1, let.get("line").getAsInt());
		assertEquals(1, let.get("column").getAsInt());

		JsonObject value = let.getAsJsonObject("value");
		assertEquals("binary", value.get("node").getAsString());
		assertEquals("+", value.get("operator").getAsString());
		assertEquals(1L, value.getAsJsonObject("left").get("value").getAsLong());
		assertEquals("float", value.getAsJsonObject("right").get("kind").getAsString());
		assertEquals(2.5, value.getAsJsonObject("right").get("value").getAsDouble());
		assertEquals(11, value.getAsJsonObject("right").get("column").getAsInt());
	}

	@Test
	public void missingElseAndReturnValueAreNull()
	{
		JsonObject program = AstJsonSerializer.toJson(TabulaFrontend.compile("func f\n\tif x\n\t\treturn\n").getProgram());

		JsonObject func = program.getAsJsonArray("statements").get(0).getAsJsonObject();
		assertEquals(0, func.getAsJsonArray("parameters").size());
		JsonObject ifStatement = func.getAsJsonArray("body").get(0).getAsJsonObject();
		assertTrue(ifStatement.get("else").isJsonNull());
		JsonObject returnStatement = ifStatement.getAsJsonArray("then").get(0).getAsJsonObject();
		assertTrue(returnStatement.get("value").isJsonNull());
	}

	@Test
	public void serialisesCallsAndPlaceholders()
	{
		JsonObject program = AstJsonSerializer.toJson(TabulaFrontend.compile("f \"a\" b\nprint\n").getProgram());

		JsonObject call = program.getAsJsonArray("statements").get(0).getAsJsonObject().getAsJsonObject("expression");
		assertEquals("call", call.get("node").getAsString());
		assertEquals("f", call.getAsJsonObject("callee").get("name").getAsString());
		assertEquals("a", call.getAsJsonArray("arguments").get(0).getAsJsonObject().get("value").getAsString());
		assertEquals("noop", program.getAsJsonArray("statements").get(1).getAsJsonObject().get("node").getAsString());
	}

	@Test
	public void serialisesDiagnostics()
	{
		CompilationUnit unit = TabulaFrontend.compile("print\n");

		JsonArray diagnostics = AstJsonSerializer.toJson(unit.getDiagnostics());

		assertEquals(1, diagnostics.size());
		JsonObject diagnostic = diagnostics.get(0).getAsJsonObject();
		assertEquals("error", diagnostic.get("severity").getAsString());
		assertEquals("syntax", diagnostic.get("category").getAsString());
		assertEquals("print requires at least one expression", diagnostic.get("message").getAsString());
		assertEquals(1, diagnostic.get("line").getAsInt());
		assertEquals(1, diagnostic.get("column").getAsInt());
	}

	@Test
	public void prettyDocumentParsesBack()
	{
		CompilationUnit unit = TabulaFrontend.compile("print \"<tag>\"\n");

		String text = AstJsonSerializer.toPrettyString(
				AstJsonSerializer.toDocument("demo.tab", unit.getProgram(), unit.getDiagnostics()));

		assertTrue(text.contains("\"node\": \"program\""));
		assertTrue(text.contains("<tag>"));
		JsonObject document = JsonParser.parseString(text).getAsJsonObject();
		assertEquals("demo.tab", document.get("path").getAsString());
		assertEquals(0, document.getAsJsonArray("diagnostics").size());
	}

	@Test
	public void serialisesTokens()
	{
		JsonArray tokens = AstJsonSerializer.tokensToJson(TabulaFrontend.compile("x\n").getResolvedTokens().getTokens());

		assertEquals(3, tokens.size());
		assertEquals("WORD", tokens.get(0).getAsJsonObject().get("type").getAsString());
		assertEquals("EOF", tokens.get(2).getAsJsonObject().get("type").getAsString());
	}
}
