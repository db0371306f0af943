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

import org.codehaus.groovy.ast.ModuleNode;

/**
 * Maps the nodes of a parsed module back to the tokens of the source text
 * they were built from.
 */
public interface TokenAssociationService {
	/**
	 * @param source the text {@code module} was parsed from
	 * @param module the module, after any tree rewrites that should be
	 *               reflected in the result
	 * @return the association; nodes without original tokens have no entry
	 */
	TokenAssociation associate(String source, ModuleNode module);
}
