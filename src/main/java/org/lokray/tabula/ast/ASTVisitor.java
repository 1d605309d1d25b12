package org.lokray.tabula.ast;

import org.lokray.tabula.ast.expressions.*;
import org.lokray.tabula.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each {@code visit} method corresponds to one node variant, so adding a variant forces every
 * implementation to handle it. Consumers that only care about a few variants should extend
 * {@link BaseASTVisitor} instead, which keeps them compiling when variants are added.
 *
 * @param <R> The return value type of the {@code visit} methods.
 */
public interface ASTVisitor<R>
{
	R visitProgram(Program program);

	// --- Statements ---
	R visitLetStatement(LetStatement statement);

	R visitFuncStatement(FuncStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitForStatement(ForStatement statement);

	R visitPrintStatement(PrintStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitNoOpStatement(NoOpStatement statement);

	// --- Expressions ---
	R visitLiteralExpression(LiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitBinaryExpression(BinaryExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitErrorExpression(ErrorExpression expression);
}
