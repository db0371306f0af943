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

import java.util.List;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.BinaryExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.UnaryMinusExpression;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovyast.AstAnnotator;
import com.tomaszrup.groovyast.GroovyTestSources;

/**
 * Unit tests for {@link DecoratedNodeIndex}.
 */
class DecoratedNodeIndexTests {

	private static ModuleNode annotated(String source) {
		ModuleNode module = GroovyTestSources.parse(source);
		new AstAnnotator().annotate(module, source);
		return module;
	}

	@Test
	void testNodesAreInPreOrderById() {
		DecoratedNodeIndex index = DecoratedNodeIndex.build(annotated("x = 1\ny = 'two'\n"));

		List<ASTNode> nodes = index.getNodes();
		Assertions.assertFalse(nodes.isEmpty());
		for (int i = 1; i < nodes.size(); i++) {
			Assertions.assertTrue(NodeDecorations.getNodeId(nodes.get(i - 1)) < NodeDecorations.getNodeId(nodes.get(i)));
		}
	}

	@Test
	void testGetNodeById() {
		ModuleNode module = annotated("x = 1");
		DecoratedNodeIndex index = DecoratedNodeIndex.build(module);

		Assertions.assertSame(module, index.getNode(0));
		for (ASTNode node : index.getNodes()) {
			Assertions.assertSame(node, index.getNode(NodeDecorations.getNodeId(node)));
		}
		Assertions.assertNull(index.getNode(-1));
		Assertions.assertNull(index.getNode(index.getNodes().size() + 100));
	}

	@Test
	void testParentOfLiteralIsAssignment() {
		ModuleNode module = annotated("x = 1");
		DecoratedNodeIndex index = DecoratedNodeIndex.build(module);
		ConstantExpression literal = GroovyTestSources.collectNodes(module, ConstantExpression.class).stream()
				.filter(c -> Integer.valueOf(1).equals(c.getValue()))
				.findFirst()
				.orElseThrow(AssertionError::new);

		ASTNode parent = index.getParent(literal);

		Assertions.assertTrue(parent instanceof BinaryExpression);
		Assertions.assertTrue(index.contains(module, literal));
		Assertions.assertFalse(index.contains(literal, module));
		Assertions.assertNull(index.getParent(module));
		Assertions.assertNull(index.getParent(null));
	}

	@Test
	void testNodeAtPositionIsInnermost() {
		ModuleNode module = annotated("x = -3");
		DecoratedNodeIndex index = DecoratedNodeIndex.build(module);

		ASTNode node = index.getNodeAt(new Position(0, 5));

		Assertions.assertTrue(node instanceof ConstantExpression);
		Assertions.assertEquals(-3, ((ConstantExpression) node).getValue());
	}

	@Test
	void testNodeAtPositionOutsideAnySpan() {
		DecoratedNodeIndex index = DecoratedNodeIndex.build(annotated("x = 1"));

		Assertions.assertNull(index.getNodeAt(new Position(40, 0)));
		Assertions.assertNull(index.getNodeAt(new Position(-1, 0)));
		Assertions.assertNull(index.getNodeAt(null));
	}

	@Test
	void testFoldedUnaryIsNotIndexed() {
		ModuleNode module = GroovyTestSources.newModule();
		ClassNode foo = GroovyTestSources.addClass(module, "Foo");
		UnaryMinusExpression unary = new UnaryMinusExpression(new ConstantExpression(5));
		BlockStatement block = new BlockStatement();
		block.addStatement(new ExpressionStatement(unary));
		GroovyTestSources.addMethod(foo, "run", block);
		new AstAnnotator().annotate(module, "");
		int unaryId = NodeDecorations.getNodeId(unary);

		DecoratedNodeIndex index = DecoratedNodeIndex.build(module);

		Assertions.assertNull(index.getNode(unaryId));
		Assertions.assertNotNull(index.getNode(unaryId + 1));
		Assertions.assertEquals(6, index.getNodes().size());
	}
}
