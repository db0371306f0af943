////////////////////////////////////////////////////////////////////////////////
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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Ranges}: containment, conversion from Groovy AST
 * positions and validity.
 */
class RangesTests {

	private static Range range(int startLine, int startChar, int endLine, int endChar) {
		return new Range(new Position(startLine, startChar), new Position(endLine, endChar));
	}

	// ------------------------------------------------------------------
	// contains()
	// ------------------------------------------------------------------

	@Test
	void testContainsPositionAtStart() {
		Assertions.assertTrue(Ranges.contains(range(1, 2, 3, 4), new Position(1, 2)));
	}

	@Test
	void testContainsPositionAtEnd() {
		Assertions.assertTrue(Ranges.contains(range(1, 2, 3, 4), new Position(3, 4)));
	}

	@Test
	void testContainsPositionInMiddle() {
		Assertions.assertTrue(Ranges.contains(range(1, 2, 3, 4), new Position(2, 0)));
	}

	@Test
	void testContainsPositionSameLineBeforeStart() {
		Assertions.assertFalse(Ranges.contains(range(1, 2, 3, 4), new Position(1, 1)));
	}

	@Test
	void testContainsPositionSameLineAfterEnd() {
		Assertions.assertFalse(Ranges.contains(range(1, 2, 3, 4), new Position(3, 5)));
	}

	// ------------------------------------------------------------------
	// fromGroovy() and valid()
	// ------------------------------------------------------------------

	@Test
	void testFromGroovy() {
		Assertions.assertEquals(range(0, 4, 0, 6), Ranges.fromGroovy(1, 5, 1, 7));
	}

	@Test
	void testFromGroovyUnknownPositionIsNotValid() {
		Assertions.assertFalse(Ranges.valid(Ranges.fromGroovy(-1, -1, -1, -1)));
	}

	@Test
	void testValidRejectsEndBeforeStart() {
		Assertions.assertFalse(Ranges.valid(range(2, 0, 1, 0)));
	}

	@Test
	void testValidAcceptsEmptyRange() {
		Assertions.assertTrue(Ranges.valid(range(2, 3, 2, 3)));
	}
}
