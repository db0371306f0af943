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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.ConstructorNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.lsp.utils.Ranges;

/**
 * Lookup over an annotated module by node id, by parent and by position.
 * Nodes without an id, such as the unary nodes dropped by folding, are not
 * indexed.
 */
public class DecoratedNodeIndex {
	private final List<ASTNode> nodes = new ArrayList<>();
	private final Map<Integer, ASTNode> nodesById = new HashMap<>();
	private final Map<ASTNode, ASTNode> parents = new IdentityHashMap<>();

	private DecoratedNodeIndex() {
	}

	public static DecoratedNodeIndex build(ModuleNode module) {
		Objects.requireNonNull(module, "module");
		DecoratedNodeIndex index = new DecoratedNodeIndex();
		new ASTNodeVisitor() {
			@Override
			protected void visitNode(ASTNode node, ASTNode parent) {
				index.add(node, parent);
			}
		}.visitModule(module);
		return index;
	}

	private void add(ASTNode node, ASTNode parent) {
		if (!NodeDecorations.isDecorated(node)) {
			return;
		}
		nodes.add(node);
		nodesById.put(NodeDecorations.getNodeId(node), node);
		if (parent != null) {
			parents.put(node, parent);
		}
	}

	public ASTNode getNode(int id) {
		return nodesById.get(id);
	}

	/**
	 * All indexed nodes in pre-order.
	 */
	public List<ASTNode> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	public ASTNode getParent(ASTNode child) {
		if (child == null) {
			return null;
		}
		return parents.get(child);
	}

	public boolean contains(ASTNode ancestor, ASTNode descendant) {
		ASTNode current = getParent(descendant);
		while (current != null) {
			if (current == ancestor) {
				return true;
			}
			current = getParent(current);
		}
		return false;
	}

	/**
	 * Finds the innermost node whose span contains the given 0-based
	 * position.
	 *
	 * @return the node, or {@code null} if no span contains the position
	 */
	public ASTNode getNodeAt(Position position) {
		if (position == null || !Positions.valid(position)) {
			return null;
		}
		ASTNode best = null;
		Range bestRange = null;
		for (ASTNode node : nodes) {
			SourceSpan span = NodeDecorations.getSpan(node);
			if (span == null) {
				continue;
			}
			Range range = span.toRange();
			if (Ranges.contains(range, position) && isBetterNodeCandidate(best, bestRange, node, range)) {
				best = node;
				bestRange = range;
			}
		}
		return best;
	}

	private boolean isBetterNodeCandidate(ASTNode best, Range bestRange, ASTNode candidate, Range candidateRange) {
		if (best == null) {
			return true;
		}
		int startCmp = Positions.COMPARATOR.compare(candidateRange.getStart(), bestRange.getStart());
		if (startCmp != 0) {
			return startCmp > 0;
		}
		int endCmp = Positions.COMPARATOR.compare(candidateRange.getEnd(), bestRange.getEnd());
		if (endCmp != 0) {
			return endCmp < 0;
		}
		return contains(best, candidate)
				&& !(best instanceof ClassNode && candidate instanceof ConstructorNode);
	}
}
