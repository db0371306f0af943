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
package com.tomaszrup.groovyast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable settings for an {@link AstAnnotator} run.
 */
public final class AnnotatorOptions {
	private static final AnnotatorOptions DEFAULTS = new AnnotatorOptions(0, Collections.emptyMap(), null);

	private final int sourceId;
	private final Map<String, String> declarationKinds;
	private final String logLevel;

	/**
	 * @param sourceId         id embedded in every span, used to tell files
	 *                         apart
	 * @param declarationKinds class simple name to semantic kind
	 * @param logLevel         root log level to apply, or {@code null} to keep
	 *                         the configured one
	 */
	public AnnotatorOptions(int sourceId, Map<String, String> declarationKinds, String logLevel) {
		if (sourceId < 0) {
			throw new IllegalArgumentException("sourceId must not be negative: " + sourceId);
		}
		this.sourceId = sourceId;
		this.declarationKinds = declarationKinds == null || declarationKinds.isEmpty()
				? Collections.emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<>(declarationKinds));
		this.logLevel = logLevel;
	}

	public static AnnotatorOptions defaults() {
		return DEFAULTS;
	}

	public int getSourceId() {
		return sourceId;
	}

	public Map<String, String> getDeclarationKinds() {
		return declarationKinds;
	}

	public String getLogLevel() {
		return logLevel;
	}

	@Override
	public String toString() {
		return "AnnotatorOptions[sourceId=" + sourceId + ", declarationKinds=" + declarationKinds
				+ ", logLevel=" + logLevel + "]";
	}
}
