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

/**
 * Node metadata keys written by the annotator. Read them back through
 * {@link NodeDecorations} rather than directly.
 */
public enum AnnotationMarker {
	// pre-order identity of the node within one annotation run (Integer)
	NODE_ID,

	// the full source text the node was parsed from (String)
	SOURCE_CODE,

	// structural classification tag (String)
	AST_KIND,

	// literal sub-kind of a ConstantExpression (ConstantKind)
	CONSTANT_KIND,

	// semantic kind of a class declaration, may be absent (String)
	DECLARATION_KIND,

	// exact source span computed from the token association (SourceSpan)
	SOURCE_SPAN
}
