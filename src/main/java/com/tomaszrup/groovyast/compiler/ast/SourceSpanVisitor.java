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

import java.util.Objects;
import java.util.Optional;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovyast.compiler.tokens.TokenAssociation;
import com.tomaszrup.groovyast.compiler.tokens.TokenRange;

/**
 * Third annotation pass. Rewrites every node's position from its token
 * range and attaches a {@link SourceSpan}. Nodes without a token range get
 * Groovy's unknown position (-1 everywhere) and no span.
 */
public class SourceSpanVisitor extends ASTNodeVisitor {
	private static final Logger logger = LoggerFactory.getLogger(SourceSpanVisitor.class);

	private static final int UNKNOWN_POSITION = -1;

	private final TokenAssociation association;
	private final int sourceId;
	private int spanCount;
	private int unpositionedCount;

	public SourceSpanVisitor(TokenAssociation association, int sourceId) {
		this.association = Objects.requireNonNull(association, "association");
		this.sourceId = sourceId;
	}

	/**
	 * @return the number of nodes that received a span
	 */
	public int attachSpans(ModuleNode module) {
		Objects.requireNonNull(module, "module");
		spanCount = 0;
		unpositionedCount = 0;
		visitModule(module);
		logger.debug("Attached {} spans, {} nodes without tokens", spanCount, unpositionedCount);
		return spanCount;
	}

	@Override
	protected void visitNode(ASTNode node, ASTNode parent) {
		Optional<TokenRange> range = association.find(node);
		if (range.isPresent()) {
			applySpan(node, range.get());
		} else {
			clearSpan(node);
		}
	}

	private void applySpan(ASTNode node, TokenRange range) {
		node.setLineNumber(range.getStartLine());
		node.setColumnNumber(range.getStartColumn());
		node.setLastLineNumber(range.getEndLine());
		node.setLastColumnNumber(range.getEndColumn());
		node.putNodeMetaData(AnnotationMarker.SOURCE_SPAN, new SourceSpan(
				range.getStartLine(), range.getStartColumn(),
				range.getEndLine(), range.getEndColumn(),
				range.getStartByte(), range.getByteLength(), sourceId));
		spanCount++;
	}

	private void clearSpan(ASTNode node) {
		node.setLineNumber(UNKNOWN_POSITION);
		node.setColumnNumber(UNKNOWN_POSITION);
		node.setLastLineNumber(UNKNOWN_POSITION);
		node.setLastColumnNumber(UNKNOWN_POSITION);
		node.removeNodeMetaData(AnnotationMarker.SOURCE_SPAN);
		unpositionedCount++;
	}
}
