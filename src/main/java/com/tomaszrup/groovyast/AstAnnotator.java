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

import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.runtime.IOGroovyMethods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovyast.compiler.ast.IdentityAndClassificationVisitor;
import com.tomaszrup.groovyast.compiler.ast.SourceSpanVisitor;
import com.tomaszrup.groovyast.compiler.ast.UnaryLiteralFoldTransformer;
import com.tomaszrup.groovyast.compiler.ast.UnsupportedLiteralKindException;
import com.tomaszrup.groovyast.compiler.tokens.SourcePositionTokenAssociationService;
import com.tomaszrup.groovyast.compiler.tokens.TokenAssociation;
import com.tomaszrup.groovyast.compiler.tokens.TokenAssociationService;

/**
 * Decorates parsed Groovy modules before semantic analysis.
 *
 * <p>Each call runs three passes over the module, in order:</p>
 * <ol>
 * <li>{@link IdentityAndClassificationVisitor} numbers the nodes and tags
 * their kinds;</li>
 * <li>{@link UnaryLiteralFoldTransformer} folds {@code -<number>} into one
 * literal;</li>
 * <li>{@link SourceSpanVisitor} attaches spans from a token association
 * built over the folded tree.</li>
 * </ol>
 *
 * <p>The module is modified in place. If the first pass throws
 * {@link UnsupportedLiteralKindException}, the later passes do not run and
 * the module must not be compiled further. Annotating an already annotated
 * module renumbers its nodes.</p>
 */
public class AstAnnotator {
	private static final Logger logger = LoggerFactory.getLogger(AstAnnotator.class);

	private final TokenAssociationService tokenAssociationService;
	private final AnnotatorOptions options;

	public AstAnnotator() {
		this(AnnotatorOptions.defaults());
	}

	public AstAnnotator(AnnotatorOptions options) {
		this(new SourcePositionTokenAssociationService(), options);
	}

	public AstAnnotator(TokenAssociationService tokenAssociationService, AnnotatorOptions options) {
		this.tokenAssociationService = Objects.requireNonNull(tokenAssociationService, "tokenAssociationService");
		this.options = Objects.requireNonNull(options, "options");
	}

	public AnnotatorOptions getOptions() {
		return options;
	}

	public void annotate(ModuleNode tree, String sourceCode) {
		annotate(tree, sourceCode, options.getDeclarationKinds(), options.getSourceId());
	}

	public void annotate(ModuleNode tree, String sourceCode, Map<String, String> declarationKinds) {
		annotate(tree, sourceCode, declarationKinds, options.getSourceId());
	}

	/**
	 * Annotates one module in place.
	 *
	 * @param tree             the parsed module
	 * @param sourceCode       the text the module was parsed from
	 * @param declarationKinds class simple name to semantic kind; may be
	 *                         {@code null}
	 * @param sourceId         id embedded in every span
	 * @throws UnsupportedLiteralKindException if a constant holds a value of
	 *                                         no supported literal kind
	 */
	public void annotate(ModuleNode tree, String sourceCode, Map<String, String> declarationKinds, int sourceId) {
		Objects.requireNonNull(tree, "tree");
		Objects.requireNonNull(sourceCode, "sourceCode");

		long start = System.nanoTime();
		int nodeCount = new IdentityAndClassificationVisitor(sourceCode, declarationKinds).decorate(tree);
		int foldCount = new UnaryLiteralFoldTransformer().fold(tree);
		TokenAssociation association = tokenAssociationService.associate(sourceCode, tree);
		int spanCount = new SourceSpanVisitor(association, sourceId).attachSpans(tree);
		if (logger.isDebugEnabled()) {
			logger.debug("Annotated {} (source {}): {} nodes, {} folds, {} spans in {}ms",
					tree.getDescription(), sourceId, nodeCount, foldCount, spanCount,
					(System.nanoTime() - start) / 1_000_000);
		}
	}

	/**
	 * Annotates the module of a source unit that has been compiled to at
	 * least the conversion phase, reading its text back from the unit.
	 *
	 * @throws IOException if the unit's source text cannot be read
	 */
	public void annotate(SourceUnit unit, int sourceId) throws IOException {
		Objects.requireNonNull(unit, "unit");
		ModuleNode module = unit.getAST();
		if (module == null) {
			throw new IllegalStateException("Source unit " + unit.getName() + " has not been parsed");
		}
		annotate(module, readSource(unit), options.getDeclarationKinds(), sourceId);
	}

	/**
	 * Annotates every source unit of a compilation, giving them source ids
	 * 0, 1, 2, ... in the order the compilation iterates them.
	 *
	 * @return the source id assigned to each unit, keyed by the unit's URI
	 * @throws IOException if a unit's source text cannot be read
	 */
	public Map<URI, Integer> annotate(CompilationUnit compilationUnit) throws IOException {
		Objects.requireNonNull(compilationUnit, "compilationUnit");
		Map<URI, Integer> sourceIds = new LinkedHashMap<>();
		int nextSourceId = 0;
		Iterator<SourceUnit> units = compilationUnit.iterator();
		while (units.hasNext()) {
			SourceUnit unit = units.next();
			int sourceId = nextSourceId++;
			annotate(unit, sourceId);
			sourceIds.put(unit.getSource().getURI(), sourceId);
		}
		logger.debug("Annotated {} source units", sourceIds.size());
		return sourceIds;
	}

	private static String readSource(SourceUnit unit) throws IOException {
		try (Reader reader = unit.getSource().getReader()) {
			return IOGroovyMethods.getText(reader);
		}
	}
}
