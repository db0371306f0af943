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
package com.tomaszrup.groovyast.compiler.tokens;

import java.util.Optional;

import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.BinaryExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.syntax.Token;
import org.codehaus.groovy.syntax.Types;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovyast.GroovyTestSources;

/**
 * Unit tests for {@link SourcePositionTokenAssociationService}.
 */
class SourcePositionTokenAssociationServiceTests {
	private static final String SOURCE = "// header\nvalue = 'héllo'\n";

	private ModuleNode module;
	private VariableExpression variable;
	private ConstantExpression literal;
	private BinaryExpression assignment;

	private final SourcePositionTokenAssociationService service = new SourcePositionTokenAssociationService();

	@BeforeEach
	void setup() {
		module = GroovyTestSources.newModule();
		ClassNode script = GroovyTestSources.addClass(module, "Script1");
		variable = new VariableExpression("value");
		position(variable, 2, 1, 2, 6);
		literal = new ConstantExpression("héllo");
		position(literal, 2, 9, 2, 16);
		assignment = new BinaryExpression(variable, Token.newSymbol(Types.ASSIGN, 2, 7), literal);
		position(assignment, 2, 1, 2, 16);
		BlockStatement block = new BlockStatement();
		block.addStatement(new ExpressionStatement(assignment));
		GroovyTestSources.addMethod(script, "run", block);
	}

	private static void position(org.codehaus.groovy.ast.ASTNode node, int line, int column, int lastLine, int lastColumn) {
		node.setLineNumber(line);
		node.setColumnNumber(column);
		node.setLastLineNumber(lastLine);
		node.setLastColumnNumber(lastColumn);
	}

	@Test
	void testPositionedNodesAreAssociated() {
		TokenAssociation association = service.associate(SOURCE, module);

		Optional<TokenRange> range = association.find(variable);
		Assertions.assertTrue(range.isPresent());
		Assertions.assertEquals(new TokenRange(2, 1, 10, 2, 6, 15), range.get());
	}

	@Test
	void testByteOffsetsAccountForMultiByteCharacters() {
		TokenAssociation association = service.associate(SOURCE, module);

		TokenRange range = association.find(literal).get();
		Assertions.assertEquals(18, range.getStartByte());
		// 'héllo' including quotes is 7 characters and 8 bytes
		Assertions.assertEquals(8, range.getByteLength());
		Assertions.assertEquals(26, association.find(assignment).get().getEndByte());
	}

	@Test
	void testUnpositionedNodesAreNotAssociated() {
		TokenAssociation association = service.associate(SOURCE, module);

		Assertions.assertFalse(association.find(module).isPresent());
		Assertions.assertEquals(3, association.size());
	}

	@Test
	void testPositionOutsideTextIsNotAssociated() {
		position(literal, 7, 1, 7, 4);

		TokenAssociation association = service.associate(SOURCE, module);

		Assertions.assertFalse(association.find(literal).isPresent());
	}

	@Test
	void testEndBeforeStartIsNotAssociated() {
		position(literal, 2, 9, 2, 3);

		Assertions.assertFalse(service.associate(SOURCE, module).find(literal).isPresent());
	}

	@Test
	void testLookupIsByIdentity() {
		VariableExpression lookalike = new VariableExpression("value");
		position(lookalike, 2, 1, 2, 6);

		TokenAssociation association = service.associate(SOURCE, module);

		Assertions.assertFalse(association.find(lookalike).isPresent());
	}

	@Test
	void testTokenRangeRejectsNegativeLength() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new TokenRange(1, 5, 4, 1, 1, 0));
	}
}
