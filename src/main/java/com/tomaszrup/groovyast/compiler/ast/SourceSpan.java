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

import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Ranges;

/**
 * Exact source span of a decorated node.
 *
 * <p>Lines and columns use the Groovy convention: both are 1-based and the
 * end column is exclusive. Byte offsets are UTF-8 offsets into the source
 * text. {@link #toRange()} converts to the 0-based LSP convention.</p>
 */
public final class SourceSpan {
	private final int startLine;
	private final int startColumn;
	private final int endLine;
	private final int endColumn;
	private final int byteStart;
	private final int byteLength;
	private final int sourceId;

	public SourceSpan(int startLine, int startColumn, int endLine, int endColumn,
			int byteStart, int byteLength, int sourceId) {
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.endLine = endLine;
		this.endColumn = endColumn;
		this.byteStart = byteStart;
		this.byteLength = byteLength;
		this.sourceId = sourceId;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndColumn() {
		return endColumn;
	}

	public int getByteStart() {
		return byteStart;
	}

	public int getByteLength() {
		return byteLength;
	}

	public int getByteEnd() {
		return byteStart + byteLength;
	}

	public int getSourceId() {
		return sourceId;
	}

	/**
	 * The span identifier, {@code "<byteStart>:<byteLength>:<sourceId>"}.
	 */
	public String src() {
		return byteStart + ":" + byteLength + ":" + sourceId;
	}

	public Range toRange() {
		return Ranges.fromGroovy(startLine, startColumn, endLine, endColumn);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SourceSpan)) return false;
		SourceSpan other = (SourceSpan) o;
		return startLine == other.startLine
				&& startColumn == other.startColumn
				&& endLine == other.endLine
				&& endColumn == other.endColumn
				&& byteStart == other.byteStart
				&& byteLength == other.byteLength
				&& sourceId == other.sourceId;
	}

	@Override
	public int hashCode() {
		return Objects.hash(startLine, startColumn, endLine, endColumn, byteStart, byteLength, sourceId);
	}

	@Override
	public String toString() {
		return "SourceSpan[" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn
				+ ", src=" + src() + "]";
	}
}
