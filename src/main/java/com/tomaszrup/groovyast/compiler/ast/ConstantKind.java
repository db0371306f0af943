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

import org.codehaus.groovy.ast.expr.ConstantExpression;

/**
 * Literal sub-kinds of a {@link ConstantExpression}. Every literal node is
 * assigned exactly one of these.
 */
public enum ConstantKind {
	NAME_CONSTANT("NameConstant"),
	NUM("Num"),
	STR("Str"),
	BYTES("Bytes");

	private final String kindName;

	ConstantKind(String kindName) {
		this.kindName = kindName;
	}

	/**
	 * The tag written as the node's AST kind, e.g. {@code "Num"}.
	 */
	public String getKindName() {
		return kindName;
	}

	/**
	 * Classifies a literal value. The checks run in a fixed order and the
	 * first match wins: {@code null} and booleans, then numbers, then
	 * character sequences, then byte arrays.
	 *
	 * @param value the literal value
	 * @return the kind, or {@code null} if the value is not a supported literal
	 */
	public static ConstantKind classify(Object value) {
		if (value == null || value instanceof Boolean) {
			return NAME_CONSTANT;
		}
		if (value instanceof Number) {
			return NUM;
		}
		if (value instanceof CharSequence) {
			return STR;
		}
		if (value instanceof byte[]) {
			return BYTES;
		}
		return null;
	}
}
