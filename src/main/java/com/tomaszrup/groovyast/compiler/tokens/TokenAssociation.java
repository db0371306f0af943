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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

import org.codehaus.groovy.ast.ASTNode;

/**
 * Read-only lookup from AST nodes to the token range each one covers. Nodes
 * are matched by identity, never by {@code equals}.
 */
public class TokenAssociation {
	private static final TokenAssociation EMPTY = new TokenAssociation(Collections.emptyMap());

	private final Map<ASTNode, TokenRange> ranges;

	TokenAssociation(Map<ASTNode, TokenRange> ranges) {
		this.ranges = ranges;
	}

	public static TokenAssociation empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<TokenRange> find(ASTNode node) {
		return Optional.ofNullable(ranges.get(node));
	}

	public int size() {
		return ranges.size();
	}

	public static class Builder {
		private final Map<ASTNode, TokenRange> ranges = new IdentityHashMap<>();

		private Builder() {
		}

		public Builder put(ASTNode node, TokenRange range) {
			ranges.put(node, range);
			return this;
		}

		public TokenAssociation build() {
			return new TokenAssociation(new IdentityHashMap<>(ranges));
		}
	}
}
