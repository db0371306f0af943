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

/**
 * The source range covered by the tokens of one AST node: where its first
 * token starts and where its last token ends.
 *
 * <p>Lines and columns are 1-based and the end column is exclusive, the way
 * Groovy records node positions. Byte offsets are UTF-8 offsets from the
 * start of the source text; {@code endByte} is exclusive.</p>
 */
public final class TokenRange {
	private final int startLine;
	private final int startColumn;
	private final int startByte;
	private final int endLine;
	private final int endColumn;
	private final int endByte;

	public TokenRange(int startLine, int startColumn, int startByte,
			int endLine, int endColumn, int endByte) {
		if (endByte < startByte) {
			throw new IllegalArgumentException(
					"Token range ends at byte " + endByte + " before its start at byte " + startByte);
		}
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.startByte = startByte;
		this.endLine = endLine;
		this.endColumn = endColumn;
		this.endByte = endByte;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getStartByte() {
		return startByte;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndColumn() {
		return endColumn;
	}

	public int getEndByte() {
		return endByte;
	}

	public int getByteLength() {
		return endByte - startByte;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TokenRange)) return false;
		TokenRange other = (TokenRange) o;
		return startLine == other.startLine
				&& startColumn == other.startColumn
				&& startByte == other.startByte
				&& endLine == other.endLine
				&& endColumn == other.endColumn
				&& endByte == other.endByte;
	}

	@Override
	public int hashCode() {
		return Objects.hash(startLine, startColumn, startByte, endLine, endColumn, endByte);
	}

	@Override
	public String toString() {
		return "TokenRange[" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn
				+ ", bytes " + startByte + ".." + endByte + "]";
	}
}
