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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.AnnotationConstantExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First annotation pass. Numbers every node of a module in pre-order
 * starting at 0 and attaches the source text, an AST kind tag, the literal
 * sub-kind of constants and the declaration kind of classes.
 *
 * <p>The id counter belongs to the visitor instance and restarts at 0 on
 * every call to {@link #decorate(ModuleNode)}.</p>
 */
public class IdentityAndClassificationVisitor extends ASTNodeVisitor {
	private static final Logger logger = LoggerFactory.getLogger(IdentityAndClassificationVisitor.class);

	private final String sourceCode;
	private final Map<String, String> declarationKinds;
	private int nextNodeId;

	public IdentityAndClassificationVisitor(String sourceCode) {
		this(sourceCode, Collections.emptyMap());
	}

	/**
	 * @param sourceCode       the full text the module was parsed from
	 * @param declarationKinds class simple name to semantic kind, e.g.
	 *                         {@code "Foo" -> "contract"}
	 */
	public IdentityAndClassificationVisitor(String sourceCode, Map<String, String> declarationKinds) {
		this.sourceCode = Objects.requireNonNull(sourceCode, "sourceCode");
		this.declarationKinds = declarationKinds != null ? declarationKinds : Collections.emptyMap();
	}

	/**
	 * Decorates every node of the module.
	 *
	 * @return the number of nodes that received an id
	 * @throws UnsupportedLiteralKindException if a constant holds a value of
	 *                                         no supported literal kind
	 */
	public int decorate(ModuleNode module) {
		Objects.requireNonNull(module, "module");
		nextNodeId = 0;
		visitModule(module);
		logger.debug("Numbered {} nodes of {}", nextNodeId, module.getDescription());
		return nextNodeId;
	}

	@Override
	protected void visitNode(ASTNode node, ASTNode parent) {
		node.putNodeMetaData(AnnotationMarker.NODE_ID, nextNodeId++);
		node.putNodeMetaData(AnnotationMarker.SOURCE_CODE, sourceCode);
		node.putNodeMetaData(AnnotationMarker.AST_KIND, node.getClass().getSimpleName());

		if (node instanceof ConstantExpression && !(node instanceof AnnotationConstantExpression)) {
			classifyConstant((ConstantExpression) node);
		} else if (node instanceof ClassNode) {
			tagDeclaration((ClassNode) node);
		}
	}

	private void classifyConstant(ConstantExpression node) {
		ConstantKind kind = ConstantKind.classify(node.getValue());
		if (kind == null) {
			throw new UnsupportedLiteralKindException(node);
		}
		node.putNodeMetaData(AnnotationMarker.CONSTANT_KIND, kind);
		node.putNodeMetaData(AnnotationMarker.AST_KIND, kind.getKindName());
	}

	private void tagDeclaration(ClassNode node) {
		String kind = declarationKinds.get(node.getNameWithoutPackage());
		if (kind != null) {
			node.putNodeMetaData(AnnotationMarker.DECLARATION_KIND, kind);
		} else {
			node.removeNodeMetaData(AnnotationMarker.DECLARATION_KIND);
		}
	}
}
