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

import org.codehaus.groovy.ast.ASTNode;

/**
 * Typed accessors for the metadata the annotator attaches to AST nodes.
 */
public class NodeDecorations {
	public static final int NO_NODE_ID = -1;

	private NodeDecorations() {
	}

	public static boolean isDecorated(ASTNode node) {
		return node != null && node.getNodeMetaData(AnnotationMarker.NODE_ID) != null;
	}

	/**
	 * Returns the pre-order id assigned to the node, or {@link #NO_NODE_ID}
	 * if the node was never numbered.
	 */
	public static int getNodeId(ASTNode node) {
		Integer id = node.getNodeMetaData(AnnotationMarker.NODE_ID);
		return id != null ? id : NO_NODE_ID;
	}

	public static String getSourceCode(ASTNode node) {
		return node.getNodeMetaData(AnnotationMarker.SOURCE_CODE);
	}

	public static String getAstKind(ASTNode node) {
		return node.getNodeMetaData(AnnotationMarker.AST_KIND);
	}

	public static ConstantKind getConstantKind(ASTNode node) {
		return node.getNodeMetaData(AnnotationMarker.CONSTANT_KIND);
	}

	/**
	 * Returns the semantic kind of a class declaration, or {@code null} if
	 * the declaration-kind table had no entry for it.
	 */
	public static String getDeclarationKind(ASTNode node) {
		return node.getNodeMetaData(AnnotationMarker.DECLARATION_KIND);
	}

	/**
	 * Returns the node's source span, or {@code null} if the node has no
	 * associated token range.
	 */
	public static SourceSpan getSpan(ASTNode node) {
		return node.getNodeMetaData(AnnotationMarker.SOURCE_SPAN);
	}
}
