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
import org.codehaus.groovy.syntax.SyntaxException;

/**
 * Thrown when a literal node holds a value that is none of the supported
 * literal kinds. Aborts the whole annotation run; the tree it was thrown
 * from must not be handed to later compiler phases.
 */
public class UnsupportedLiteralKindException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public static final String MESSAGE = "unsupported literal value kind";

	private final transient ASTNode node;

	public UnsupportedLiteralKindException(ASTNode node) {
		super(MESSAGE);
		this.node = node;
	}

	/**
	 * The offending literal node.
	 */
	public ASTNode getNode() {
		return node;
	}

	/**
	 * Converts this error into a Groovy {@link SyntaxException} positioned at
	 * the offending node, suitable for a compiler error collector.
	 */
	public SyntaxException toSyntaxException() {
		return new SyntaxException(getMessage(),
				node.getLineNumber(), node.getColumnNumber(),
				node.getLastLineNumber(), node.getLastColumnNumber());
	}
}
