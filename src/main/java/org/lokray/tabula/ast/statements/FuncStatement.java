package org.lokray.tabula.ast.statements;

import org.lokray.tabula.ast.ASTNode;
import org.lokray.tabula.ast.ASTVisitor;
import org.lokray.tabula.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node for a function definition: a {@code func name param...} header and its indented body.
 */
public class FuncStatement implements Statement
{
	private final Token keyword;
	private final Token name;
	private final List<Token> parameters;
	private final List<Statement> body;

	public FuncStatement(Token keyword, Token name, List<Token> parameters, List<Statement> body)
	{
		this.keyword = keyword;
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
		this.body = Collections.unmodifiableList(new ArrayList<>(body));
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Token getName()
	{
		return name;
	}

	public List<Token> getParameters()
	{
		return parameters;
	}

	public List<String> getParameterNames()
	{
		return parameters.stream().map(Token::getLexeme).collect(Collectors.toList());
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFuncStatement(this);
	}

	@Override
	public int getLine()
	{
		return keyword.getLine();
	}

	@Override
	public int getColumn()
	{
		return keyword.getColumn();
	}

	@Override
	public List<ASTNode> children()
	{
		return Collections.unmodifiableList(new ArrayList<>(body));
	}
}
