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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Line index over a source text that converts Groovy (line, column)
 * positions to character and UTF-8 byte offsets. Lines end at {@code \n},
 * {@code \r\n} or a lone {@code \r}.
 */
public class SourceText {
	private final String text;
	// char offset at which each line starts
	private final int[] lineStarts;
	// char offset at which each line's terminator starts
	private final int[] lineEnds;
	// UTF-8 byte offset at which each line starts
	private final int[] lineByteStarts;

	public SourceText(String text) {
		this.text = Objects.requireNonNull(text, "text");
		List<Integer> starts = new ArrayList<>();
		List<Integer> ends = new ArrayList<>();
		starts.add(0);
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\n' || c == '\r') {
				ends.add(i);
				if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
					i++;
				}
				starts.add(i + 1);
			}
			i++;
		}
		ends.add(text.length());

		int lineCount = starts.size();
		lineStarts = new int[lineCount];
		lineEnds = new int[lineCount];
		lineByteStarts = new int[lineCount];
		int byteOffset = 0;
		int previousStart = 0;
		for (int line = 0; line < lineCount; line++) {
			lineStarts[line] = starts.get(line);
			lineEnds[line] = ends.get(line);
			byteOffset += utf8Length(text, previousStart, lineStarts[line]);
			lineByteStarts[line] = byteOffset;
			previousStart = lineStarts[line];
		}
	}

	public String getText() {
		return text;
	}

	public int getLineCount() {
		return lineStarts.length;
	}

	/**
	 * Converts a 1-based line and 1-based column to a character offset. The
	 * column may point one past the last character of the line.
	 *
	 * @return the offset, or -1 if the position lies outside the text
	 */
	public int getCharOffset(int line, int column) {
		if (line < 1 || line > lineStarts.length || column < 1) {
			return -1;
		}
		int lineStart = lineStarts[line - 1];
		int lineLength = lineEnds[line - 1] - lineStart;
		if (column - 1 > lineLength) {
			return -1;
		}
		return lineStart + column - 1;
	}

	/**
	 * Converts a 1-based line and 1-based column to a UTF-8 byte offset.
	 *
	 * @return the offset, or -1 if the position lies outside the text
	 */
	public int getByteOffset(int line, int column) {
		int charOffset = getCharOffset(line, column);
		if (charOffset < 0) {
			return -1;
		}
		int lineStart = lineStarts[line - 1];
		return lineByteStarts[line - 1] + utf8Length(text, lineStart, charOffset);
	}

	static int utf8Length(CharSequence s, int from, int to) {
		int length = 0;
		for (int i = from; i < to; i++) {
			char c = s.charAt(i);
			if (c < 0x80) {
				length += 1;
			} else if (c < 0x800) {
				length += 2;
			} else if (Character.isHighSurrogate(c) && i + 1 < to && Character.isLowSurrogate(s.charAt(i + 1))) {
				length += 4;
				i++;
			} else {
				length += 3;
			}
		}
		return length;
	}
}
