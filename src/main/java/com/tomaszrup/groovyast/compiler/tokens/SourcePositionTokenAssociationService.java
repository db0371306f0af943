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
package com.tomaszrup.groovyast.compiler.tokens;

import java.util.Objects;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovyast.compiler.ast.ASTNodeVisitor;

/**
 * Derives each node's token range from the start and end positions the
 * Groovy parser recorded on it. Nodes created without a source position
 * (line -1) or whose recorded range falls outside the text get no entry.
 */
public class SourcePositionTokenAssociationService implements TokenAssociationService {
	private static final Logger logger = LoggerFactory.getLogger(SourcePositionTokenAssociationService.class);

	@Override
	public TokenAssociation associate(String source, ModuleNode module) {
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(module, "module");
		SourceText text = new SourceText(source);
		TokenAssociation.Builder builder = TokenAssociation.builder();
		PositionCollector collector = new PositionCollector(text, builder);
		collector.visitModule(module);
		TokenAssociation association = builder.build();
		logger.debug("Associated {} of {} nodes with source tokens", association.size(), collector.getNodeCount());
		return association;
	}

	/**
	 * Converts a node's recorded Groovy position into a token range.
	 *
	 * @return the range, or {@code null} if the node has no usable position
	 */
	static TokenRange toTokenRange(ASTNode node, SourceText text) {
		int line = node.getLineNumber();
		int column = node.getColumnNumber();
		int lastLine = node.getLastLineNumber();
		int lastColumn = node.getLastColumnNumber();
		if (line < 1 || column < 1 || lastLine < line || lastColumn < 1) {
			return null;
		}
		int startByte = text.getByteOffset(line, column);
		int endByte = text.getByteOffset(lastLine, lastColumn);
		if (startByte < 0 || endByte < startByte) {
			return null;
		}
		return new TokenRange(line, column, startByte, lastLine, lastColumn, endByte);
	}

	private static class PositionCollector extends ASTNodeVisitor {
		private final SourceText text;
		private final TokenAssociation.Builder builder;

		PositionCollector(SourceText text, TokenAssociation.Builder builder) {
			this.text = text;
			this.builder = builder;
		}

		int getNodeCount() {
			return getVisitedCount();
		}

		@Override
		protected void visitNode(ASTNode node, ASTNode parent) {
			TokenRange range = toTokenRange(node, text);
			if (range != null) {
				builder.put(node, range);
			}
		}
	}
}
