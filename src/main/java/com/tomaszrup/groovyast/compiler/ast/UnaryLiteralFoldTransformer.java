////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
//
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovyast.compiler.ast;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ClassCodeExpressionTransformer;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.CodeVisitorSupport;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.ElvisOperatorExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.UnaryMinusExpression;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.runtime.InvokerHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second annotation pass. Replaces every {@code -<numeric literal>} with a
 * single negated literal that starts at the minus sign.
 *
 * <p>Only a {@link UnaryMinusExpression} whose operand is itself an
 * unparenthesized numeric {@link ConstantExpression} is folded. The
 * replacement literal takes over the operand's metadata, so the id and
 * literal kind assigned by {@link IdentityAndClassificationVisitor} stay
 * with it while the id of the unary node is dropped.</p>
 *
 * <p>Expressions that contain no fold site are returned as they are. Those
 * on the path to one are rebuilt by Groovy and inherit the decorations of
 * the node they replace. Each expression is transformed at most once, so a
 * node the parser shares between two parents stays a single node.</p>
 */
public class UnaryLiteralFoldTransformer extends ClassCodeExpressionTransformer {
	private static final Logger logger = LoggerFactory.getLogger(UnaryLiteralFoldTransformer.class);

	// set by the Groovy parser on expressions written inside parentheses
	static final String INSIDE_PARENTHESES_LEVEL = "_INSIDE_PARENTHESES_LEVEL";

	private final Map<Expression, Expression> transformed = new IdentityHashMap<>();
	private SourceUnit sourceUnit;
	private int foldCount;

	@Override
	protected SourceUnit getSourceUnit() {
		return sourceUnit;
	}

	/**
	 * Folds negated literals in every class of the module.
	 *
	 * @return the number of folds performed
	 */
	public int fold(ModuleNode module) {
		Objects.requireNonNull(module, "module");
		sourceUnit = module.getContext();
		foldCount = 0;
		try {
			for (ClassNode classNode : module.getClasses()) {
				visitClass(classNode);
			}
		} finally {
			sourceUnit = null;
			transformed.clear();
		}
		logger.debug("Folded {} negated literals in {}", foldCount, module.getDescription());
		return foldCount;
	}

	@Override
	public Expression transform(Expression exp) {
		if (exp == null) {
			return null;
		}
		Expression result = transformed.get(exp);
		if (result == null) {
			result = transformOnce(exp);
			transformed.put(exp, result);
		}
		return result;
	}

	private Expression transformOnce(Expression exp) {
		if (exp instanceof UnaryMinusExpression) {
			ConstantExpression folded = foldNegatedLiteral((UnaryMinusExpression) exp);
			if (folded != null) {
				return folded;
			}
		}
		if (exp instanceof ClosureExpression) {
			ClosureExpression ce = (ClosureExpression) exp;
			ce.visit(this);
			return ce;
		}
		if (!FoldSiteFinder.contains(exp)) {
			return exp;
		}
		Expression result = super.transform(exp);
		if (result != exp) {
			adoptDecorations(exp, result);
			// the rebuilt elvis wraps its base in a fresh condition node
			if (exp instanceof ElvisOperatorExpression && result instanceof ElvisOperatorExpression) {
				adoptDecorations(((ElvisOperatorExpression) exp).getBooleanExpression(),
						((ElvisOperatorExpression) result).getBooleanExpression());
			}
		}
		return result;
	}

	private static void adoptDecorations(ASTNode original, ASTNode rebuilt) {
		if (rebuilt.getNodeMetaData(AnnotationMarker.NODE_ID) == null) {
			rebuilt.copyNodeMetaData(original);
		}
		if (rebuilt.getLineNumber() < 0) {
			rebuilt.setSourcePosition(original);
		}
	}

	private ConstantExpression foldNegatedLiteral(UnaryMinusExpression unary) {
		Expression operand = unary.getExpression();
		if (!isFoldableLiteral(operand)) {
			return null;
		}
		ConstantExpression literal = (ConstantExpression) operand;
		ConstantExpression result = new ConstantExpression(InvokerHelper.unaryMinus(literal.getValue()));
		result.setType(literal.getType());
		result.setSourcePosition(literal);
		result.copyNodeMetaData(literal);
		result.setColumnNumber(unary.getColumnNumber());
		foldCount++;
		return result;
	}

	static boolean isFoldableLiteral(Expression operand) {
		if (operand == null || operand.getClass() != ConstantExpression.class) {
			return false;
		}
		if (!(((ConstantExpression) operand).getValue() instanceof Number)) {
			return false;
		}
		return !isParenthesized(operand);
	}

	static boolean isParenthesized(Expression expression) {
		Object level = expression.getNodeMetaData(INSIDE_PARENTHESES_LEVEL);
		return level instanceof Number && ((Number) level).intValue() > 0;
	}

	/**
	 * Looks for a foldable negation, or a closure that may hold one, below an
	 * expression.
	 */
	private static class FoldSiteFinder extends CodeVisitorSupport {
		private boolean found;

		static boolean contains(Expression expression) {
			FoldSiteFinder finder = new FoldSiteFinder();
			expression.visit(finder);
			return finder.found;
		}

		@Override
		public void visitUnaryMinusExpression(UnaryMinusExpression expression) {
			if (isFoldableLiteral(expression.getExpression())) {
				found = true;
				return;
			}
			super.visitUnaryMinusExpression(expression);
		}

		@Override
		public void visitClosureExpression(ClosureExpression expression) {
			if (!found) {
				super.visitClosureExpression(expression);
			}
		}
	}
}
