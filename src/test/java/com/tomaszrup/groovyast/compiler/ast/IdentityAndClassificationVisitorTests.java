////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovyast.compiler.ast;

import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.AnnotationNode;
import org.codehaus.groovy.ast.ClassHelper;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.MethodNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.AnnotationConstantExpression;
import org.codehaus.groovy.ast.expr.BinaryExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.EmptyStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.syntax.SyntaxException;
import org.codehaus.groovy.syntax.Token;
import org.codehaus.groovy.syntax.Types;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovyast.GroovyTestSources;

/**
 * Unit tests for {@link IdentityAndClassificationVisitor}: pre-order
 * numbering, kind tags, literal classification and declaration kinds.
 */
class IdentityAndClassificationVisitorTests {
	private static final String SOURCE = "class Foo { def run() { x = 5 } }";

	private ModuleNode module;
	private ClassNode foo;
	private MethodNode run;
	private BlockStatement block;
	private ExpressionStatement statement;
	private BinaryExpression assignment;
	private VariableExpression variable;
	private ConstantExpression literal;

	@BeforeEach
	void setup() {
		module = GroovyTestSources.newModule();
		foo = GroovyTestSources.addClass(module, "Foo");
		variable = new VariableExpression("x");
		literal = new ConstantExpression(5);
		assignment = new BinaryExpression(variable, Token.newSymbol(Types.ASSIGN, -1, -1), literal);
		statement = new ExpressionStatement(assignment);
		block = new BlockStatement();
		block.addStatement(statement);
		run = GroovyTestSources.addMethod(foo, "run", block);
	}

	private static ExpressionStatement statementOf(ConstantExpression value) {
		return new ExpressionStatement(value);
	}

	// --- Identity ---

	@Test
	void testIdsFollowPreOrder() {
		int count = new IdentityAndClassificationVisitor(SOURCE).decorate(module);

		Assertions.assertEquals(8, count);
		Assertions.assertEquals(0, NodeDecorations.getNodeId(module));
		Assertions.assertEquals(1, NodeDecorations.getNodeId(foo));
		Assertions.assertEquals(2, NodeDecorations.getNodeId(run));
		Assertions.assertEquals(3, NodeDecorations.getNodeId(block));
		Assertions.assertEquals(4, NodeDecorations.getNodeId(statement));
		Assertions.assertEquals(5, NodeDecorations.getNodeId(assignment));
		Assertions.assertEquals(6, NodeDecorations.getNodeId(variable));
		Assertions.assertEquals(7, NodeDecorations.getNodeId(literal));
	}

	@Test
	void testEveryNodeSharesTheSourceText() {
		new IdentityAndClassificationVisitor(SOURCE).decorate(module);

		for (ASTNode node : GroovyTestSources.collectNodes(module)) {
			Assertions.assertSame(SOURCE, NodeDecorations.getSourceCode(node));
		}
	}

	@Test
	void testAstKindIsTheNodeClassName() {
		new IdentityAndClassificationVisitor(SOURCE).decorate(module);

		Assertions.assertEquals("ModuleNode", NodeDecorations.getAstKind(module));
		Assertions.assertEquals("ClassNode", NodeDecorations.getAstKind(foo));
		Assertions.assertEquals("MethodNode", NodeDecorations.getAstKind(run));
		Assertions.assertEquals("BinaryExpression", NodeDecorations.getAstKind(assignment));
		Assertions.assertEquals("VariableExpression", NodeDecorations.getAstKind(variable));
	}

	@Test
	void testSharedInitialExpressionIsNumberedOnce() {
		ConstantExpression initial = new ConstantExpression(42);
		foo.addProperty("answer", Modifier.PUBLIC, ClassHelper.int_TYPE, initial, null, null);

		int count = new IdentityAndClassificationVisitor(SOURCE).decorate(module);

		List<ASTNode> nodes = GroovyTestSources.collectNodes(module);
		Assertions.assertEquals(nodes.size(), count);
		for (int i = 0; i < nodes.size(); i++) {
			Assertions.assertEquals(i, NodeDecorations.getNodeId(nodes.get(i)));
		}
		Assertions.assertEquals(1, nodes.stream().filter(n -> n == initial).count());
	}

	@Test
	void testRepeatedRunsStartAtZero() {
		ModuleNode other = GroovyTestSources.newModule();
		GroovyTestSources.addClass(other, "Other");
		IdentityAndClassificationVisitor visitor = new IdentityAndClassificationVisitor(SOURCE);

		visitor.decorate(module);
		int otherCount = visitor.decorate(other);

		Assertions.assertEquals(0, NodeDecorations.getNodeId(module));
		Assertions.assertEquals(0, NodeDecorations.getNodeId(other));
		Assertions.assertEquals(2, otherCount);
		Assertions.assertEquals(8, new IdentityAndClassificationVisitor(SOURCE).decorate(module));
		Assertions.assertEquals(7, NodeDecorations.getNodeId(literal));
	}

	@Test
	void testSharedEmptyStatementIsNotDecorated() {
		GroovyTestSources.addMethod(foo, "nothing", EmptyStatement.INSTANCE);

		new IdentityAndClassificationVisitor(SOURCE).decorate(module);

		Assertions.assertFalse(NodeDecorations.isDecorated(EmptyStatement.INSTANCE));
	}

	// --- Constants ---

	@Test
	void testNumericLiteralIsNum() {
		new IdentityAndClassificationVisitor(SOURCE).decorate(module);

		Assertions.assertEquals(ConstantKind.NUM, NodeDecorations.getConstantKind(literal));
		Assertions.assertEquals("Num", NodeDecorations.getAstKind(literal));
	}

	@Test
	void testLiteralKinds() {
		ConstantExpression yes = new ConstantExpression(Boolean.TRUE);
		ConstantExpression nothing = new ConstantExpression(null);
		ConstantExpression decimal = new ConstantExpression(1.5d);
		ConstantExpression text = new ConstantExpression("abc");
		ConstantExpression bytes = new ConstantExpression(new byte[] { 'a', 'b', 'c' });
		for (ConstantExpression value : Arrays.asList(yes, nothing, decimal, text, bytes)) {
			block.addStatement(statementOf(value));
		}

		new IdentityAndClassificationVisitor(SOURCE).decorate(module);

		Assertions.assertEquals(ConstantKind.NAME_CONSTANT, NodeDecorations.getConstantKind(yes));
		Assertions.assertEquals(ConstantKind.NAME_CONSTANT, NodeDecorations.getConstantKind(nothing));
		Assertions.assertEquals(ConstantKind.NUM, NodeDecorations.getConstantKind(decimal));
		Assertions.assertEquals(ConstantKind.STR, NodeDecorations.getConstantKind(text));
		Assertions.assertEquals(ConstantKind.BYTES, NodeDecorations.getConstantKind(bytes));
		Assertions.assertEquals("NameConstant", NodeDecorations.getAstKind(yes));
		Assertions.assertEquals("Bytes", NodeDecorations.getAstKind(bytes));
	}

	@Test
	void testUnsupportedLiteralThrows() {
		ConstantExpression list = new ConstantExpression(Arrays.asList(1, 2));
		block.addStatement(statementOf(list));

		UnsupportedLiteralKindException e = Assertions.assertThrows(UnsupportedLiteralKindException.class,
				() -> new IdentityAndClassificationVisitor(SOURCE).decorate(module));

		Assertions.assertSame(list, e.getNode());
		Assertions.assertEquals("unsupported literal value kind", e.getMessage());
	}

	@Test
	void testUnsupportedLiteralConvertsToSyntaxException() {
		ConstantExpression list = new ConstantExpression(Arrays.asList(1, 2));
		list.setLineNumber(3);
		list.setColumnNumber(5);
		list.setLastLineNumber(3);
		list.setLastColumnNumber(11);

		SyntaxException syntaxException = new UnsupportedLiteralKindException(list).toSyntaxException();

		Assertions.assertEquals(3, syntaxException.getLine());
		Assertions.assertEquals(5, syntaxException.getStartColumn());
		Assertions.assertEquals(11, syntaxException.getEndColumn());
		Assertions.assertTrue(syntaxException.getMessage().startsWith("unsupported literal value kind"));
	}

	@Test
	void testAnnotationConstantIsNotALiteral() {
		AnnotationNode outer = new AnnotationNode(ClassHelper.make("Outer"));
		AnnotationConstantExpression nested = new AnnotationConstantExpression(
				new AnnotationNode(ClassHelper.make("Inner")));
		outer.addMember("value", nested);
		foo.addAnnotation(outer);

		new IdentityAndClassificationVisitor(SOURCE).decorate(module);

		Assertions.assertTrue(NodeDecorations.isDecorated(outer));
		Assertions.assertEquals("AnnotationConstantExpression", NodeDecorations.getAstKind(nested));
		Assertions.assertNull(NodeDecorations.getConstantKind(nested));
	}

	// --- Declarations ---

	@Test
	void testDeclarationKindFromTable() {
		ClassNode bar = GroovyTestSources.addClass(module, "Bar");
		Map<String, String> kinds = Collections.singletonMap("Foo", "contract");

		new IdentityAndClassificationVisitor(SOURCE, kinds).decorate(module);

		Assertions.assertEquals("contract", NodeDecorations.getDeclarationKind(foo));
		Assertions.assertNull(NodeDecorations.getDeclarationKind(bar));
		Assertions.assertTrue(NodeDecorations.isDecorated(bar));
	}

	@Test
	void testDeclarationKindUsesSimpleName() {
		ModuleNode packaged = GroovyTestSources.newModule();
		ClassNode token = GroovyTestSources.addClass(packaged, "com.example.Token");

		new IdentityAndClassificationVisitor(SOURCE, Collections.singletonMap("Token", "struct")).decorate(packaged);

		Assertions.assertEquals("struct", NodeDecorations.getDeclarationKind(token));
	}

	@Test
	void testNullSourceIsRejected() {
		Assertions.assertThrows(NullPointerException.class, () -> new IdentityAndClassificationVisitor(null));
	}
}
