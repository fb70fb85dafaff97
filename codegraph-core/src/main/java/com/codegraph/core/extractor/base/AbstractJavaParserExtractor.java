package com.codegraph.core.extractor.base;

import com.codegraph.core.extractor.ConfidenceLevel;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.javadoc.Javadoc;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Abstract base class for extractors that parse Java source code with JavaParser.
 *
 * <p>Parsing works in two tiers:
 * <ol>
 *   <li>Full AST parsing; facts are reported with {@link ConfidenceLevel#HIGH}.</li>
 *   <li>When JavaParser reports problems, every problem becomes a syntax
 *       {@link com.codegraph.core.model.ParseError} and a {@link FallbackParsingStrategy}
 *       recovers what it can with {@link ConfidenceLevel#MEDIUM}.</li>
 * </ol>
 *
 * @see AbstractExtractor
 */
public abstract class AbstractJavaParserExtractor extends AbstractExtractor {

    /**
     * JavaParser instances are not thread-safe; extraction runs on a worker pool.
     */
    private final ThreadLocal<JavaParser> javaParser;

    protected AbstractJavaParserExtractor() {
        super();
        this.javaParser = ThreadLocal.withInitial(() -> new JavaParser(
            new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)));
    }

    @Override
    public ConfidenceLevel getConfidence() {
        return ConfidenceLevel.HIGH;
    }

    /**
     * Parses Java source, handing the AST to {@code astExtractor} or, when parsing fails,
     * the raw content to {@code fallback}.
     *
     * @param content Java source
     * @param context file state
     * @param astExtractor consumer of a successfully parsed compilation unit
     * @param fallback recovery strategy for unparseable content
     * @return true if the AST tier succeeded
     */
    protected boolean parseWithFallback(String content, FileContext context,
                                        Consumer<CompilationUnit> astExtractor,
                                        FallbackParsingStrategy fallback) {
        ParseResult<CompilationUnit> result = javaParser.get().parse(content);

        if (result.isSuccessful() && result.getResult().isPresent()) {
            astExtractor.accept(result.getResult().get());
            return true;
        }

        log.debug("AST parsing failed for {}, attempting fallback", context.filePath());
        List<Problem> problems = result.getProblems();
        if (problems.isEmpty()) {
            context.result().addSyntaxError(0, "Java source could not be parsed");
        }
        for (Problem problem : problems) {
            log.debug("  - {}", problem.getVerboseMessage());
            context.result().addSyntaxError(problemLine(problem), problem.getMessage());
        }
        context.result().confidence(ConfidenceLevel.MEDIUM);
        fallback.parse(content, context);
        return false;
    }

    private static int problemLine(Problem problem) {
        return problem.getLocation()
            .flatMap(tokenRange -> tokenRange.getBegin().getRange())
            .map(range -> range.begin.line)
            .orElse(0);
    }

    // ==================== Node Utilities ====================

    protected int beginLine(Node node) {
        return node.getBegin().map(position -> position.line).orElse(1);
    }

    protected int endLine(Node node) {
        return node.getEnd().map(position -> position.line).orElse(beginLine(node));
    }

    protected List<String> annotationNames(NodeWithAnnotations<?> node) {
        return node.getAnnotations().stream()
            .map(annotation -> annotation.getNameAsString())
            .toList();
    }

    protected List<String> modifierNames(NodeWithModifiers<?> node) {
        return node.getModifiers().stream()
            .map(modifier -> modifier.getKeyword().asString())
            .toList();
    }

    /**
     * Returns the description of a node's Javadoc, if any.
     */
    protected Optional<String> javadocText(NodeWithJavadoc<?> node) {
        return node.getJavadoc()
            .map(Javadoc::getDescription)
            .map(description -> description.toText())
            .filter(text -> !text.isBlank());
    }

    protected String packageName(CompilationUnit cu) {
        return cu.getPackageDeclaration()
            .map(pd -> pd.getNameAsString())
            .orElse("");
    }
}
