package com.codegraph.core.extractor.impl.python;

import com.codegraph.core.extractor.ConfidenceLevel;
import com.codegraph.core.extractor.ExtractionResult;
import com.codegraph.core.extractor.Extractor;
import com.codegraph.core.extractor.ExtractorTestBase;
import com.codegraph.core.extractor.RawEntity;
import com.codegraph.core.extractor.RawRelation;
import com.codegraph.core.model.Language;
import com.codegraph.core.model.ParseErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link PythonExtractor}.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Classes, methods, functions and class attributes</li>
 *   <li>Imports with aliases and relative modules</li>
 *   <li>Call resolution through self, aliases and builtins</li>
 *   <li>Recovery from malformed input</li>
 * </ul>
 */
class PythonExtractorTest extends ExtractorTestBase {

    private final PythonExtractor extractor = new PythonExtractor();

    @Override
    protected Extractor extractor() {
        return extractor;
    }

    @Test
    void getSupportedExtensions_includesStubFiles() {
        assertThat(extractor.getSupportedExtensions()).containsExactlyInAnyOrder("py", "pyi");
        assertThat(extractor.getSupportedLanguages()).containsExactly(Language.PYTHON);
        assertThat(extractor.getConfidence()).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Test
    void parse_withClassAndMethods_extractsHierarchy() {
        // Given: A class with a docstring, an attribute and two methods
        String source = """
            class Service(Base):
                \"\"\"Handles users. More text follows here.\"\"\"
                timeout: int = 30

                def load(self, user_id):
                    return self.fetch(user_id)

                async def fetch(self, user_id) -> dict:
                    return {}
            """;

        // When: File is parsed
        ExtractionResult result = parse("app/service.py", source);

        // Then: Module, class, attribute and methods are extracted with their parents
        assertThat(result.errors()).isEmpty();
        RawEntity module = entity(result, "app.service");
        assertThat(module.kind()).isEqualTo("module");
        assertThat(module.name()).isEqualTo("service");

        RawEntity service = entity(result, "app.service.Service");
        assertThat(service.kind()).isEqualTo("class");
        assertThat(service.parentLocalId()).isEqualTo(module.localId());
        assertThat(service.docSummary()).isEqualTo("Handles users.");
        assertThat(service.lineStart()).isEqualTo(1);
        assertThat(service.lineEnd()).isEqualTo(9);

        RawEntity timeout = entity(result, "app.service.Service.timeout");
        assertThat(timeout.kind()).isEqualTo("variable");
        assertThat(timeout.metadata()).containsEntry("type", "int");

        RawEntity load = entity(result, "app.service.Service.load");
        assertThat(load.kind()).isEqualTo("method");
        assertThat(load.parentLocalId()).isEqualTo(service.localId());
        assertThat(load.metadata()).containsEntry("parameters", List.of("self", "user_id"));

        RawEntity fetch = entity(result, "app.service.Service.fetch");
        assertThat(fetch.metadata()).containsEntry("async", true).containsEntry("returnType", "dict");
        assertThat(fetch.signature()).isEqualTo("async fetch(self, user_id) -> dict");

        assertThat(targets(result, "app.service.Service", "inherits")).containsExactly("Base");
        assertThat(targets(result, "app.service.Service.load", "calls"))
            .containsExactly("app.service.Service.fetch");
    }

    @Test
    void parse_withImportAliases_rewritesCallTargets() {
        // Given: Aliased and relative imports used in a function body
        String source = """
            import os.path as osp
            from .models import User, Order as O

            def build(data):
                path = osp.join("a", "b")
                print(path)
                return O(User(data))
            """;

        // When: File is parsed
        ExtractionResult result = parse("app/factory.py", source);

        // Then: Imports point at full module paths and calls go through the aliases
        assertThat(targets(result, "app.factory", "imports"))
            .containsExactly("os.path", "app.models.User", "app.models.Order");
        RawRelation aliased = relationsOfType(result, "imports").get(2);
        assertThat(aliased.metadata()).containsEntry("alias", "O").containsEntry("from", "app.models");

        assertThat(targets(result, "app.factory.build", "calls"))
            .containsExactly("os.path.join", "app.models.Order", "app.models.User");
    }

    @Test
    void parse_withRepeatedCalls_reportsEachTargetOnce() {
        // Given: A function calling the same helper twice
        String source = """
            def run():
                helper()
                helper()

            def helper():
                pass
            """;

        // When: File is parsed
        ExtractionResult result = parse("jobs.py", source);

        // Then: A single call relation is reported
        assertThat(targets(result, "jobs.run", "calls")).containsExactly("helper");
        assertThat(entity(result, "jobs.helper").kind()).isEqualTo("function");
    }

    @Test
    void parse_withMutuallyRecursiveFunctions_reportsBothCalls() {
        // Given: Two module functions calling each other
        String source = """
            def foo():
                bar()

            def bar():
                foo()
            """;

        // When: File is parsed
        ExtractionResult result = parse("a.py", source);

        // Then: Both directions of the cycle are present
        assertThat(targets(result, "a.foo", "calls")).containsExactly("bar");
        assertThat(targets(result, "a.bar", "calls")).containsExactly("foo");
    }

    @Test
    void parse_withCallsInsideStringsAndComments_ignoresThem() {
        // Given: Call-like text inside a comment and a string literal
        String source = """
            def main():
                # cleanup()
                label = "reset()"
                start()
            """;

        // When: File is parsed
        ExtractionResult result = parse("main.py", source);

        // Then: Only the real call is reported
        assertThat(targets(result, "main.main", "calls")).containsExactly("start");
    }

    @Test
    void parse_withDecoratedStaticMethod_recordsDecorators() {
        // Given: A static method with a decorator
        String source = """
            class Util:
                @staticmethod
                def normalize(value):
                    return value
            """;

        // When: File is parsed
        ExtractionResult result = parse("util.py", source);

        // Then: Decorator metadata is kept
        RawEntity normalize = entity(result, "util.Util.normalize");
        assertThat(normalize.metadata())
            .containsEntry("decorators", List.of("staticmethod"))
            .containsEntry("static", true);
    }

    @Test
    void parse_withDefinitionMissingColon_reportsSyntaxErrorAndKeepsRest() {
        // Given: A malformed def followed by a valid function
        String source = """
            def broken(x)
                return x

            def ok():
                return 1
            """;

        // When: File is parsed
        ExtractionResult result = parse("bad.py", source);

        // Then: A syntax error is reported and the valid function is still extracted
        assertThat(hasError(result, ParseErrorKind.SYNTAX, "Malformed definition")).isTrue();
        assertThat(result.errors().get(0).line()).isEqualTo(1);
        assertThat(findEntity(result, "bad.broken")).isEmpty();
        assertThat(findEntity(result, "bad.ok")).isPresent();
    }

    @Test
    void parse_withUnclosedBracket_reportsSyntaxError() {
        // Given: A call whose bracket is never closed
        String source = """
            def main():
                run(1, 2
            """;

        // When: File is parsed
        ExtractionResult result = parse("open.py", source);

        // Then: The error is reported and the function survives
        assertThat(hasError(result, ParseErrorKind.SYNTAX, "Unclosed bracket")).isTrue();
        assertThat(findEntity(result, "open.main")).isPresent();
    }

    @Test
    void parse_withUnterminatedDocstring_reportsSyntaxError() {
        // Given: A docstring that is never closed
        String source = "def main():\n    \"\"\"Never closed\n    return 1\n";

        // When: File is parsed
        ExtractionResult result = parse("doc.py", source);

        // Then: An unterminated literal is reported
        assertThat(hasError(result, ParseErrorKind.SYNTAX, "Unterminated triple-quoted string")).isTrue();
    }

    @Test
    void parse_withEmptyFile_returnsModuleOnly() {
        // When: Empty file is parsed
        ExtractionResult result = parse("pkg/__init__.py", "");

        // Then: Only the module entity exists
        assertThat(result.entities()).hasSize(1);
        assertThat(result.entities().get(0).qualifiedName()).isEqualTo("pkg.__init__");
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    void resolveRelative_withParentPackage_dropsSegments() {
        assertThat(PythonExtractor.resolveRelative("..core", "app.api.views")).isEqualTo("app.core");
        assertThat(PythonExtractor.resolveRelative(".", "app.api.views")).isEqualTo("app.api");
        assertThat(PythonExtractor.resolveRelative("os", "app.api.views")).isEqualTo("os");
    }
}
