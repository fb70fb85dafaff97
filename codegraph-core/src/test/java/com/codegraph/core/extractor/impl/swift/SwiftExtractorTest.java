package com.codegraph.core.extractor.impl.swift;

import com.codegraph.core.extractor.ExtractionResult;
import com.codegraph.core.extractor.Extractor;
import com.codegraph.core.extractor.ExtractorTestBase;
import com.codegraph.core.extractor.RawEntity;
import com.codegraph.core.model.ParseErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link SwiftExtractor}.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Classes, protocols, enums and extensions with inheritance clauses</li>
 *   <li>Properties, initializers and methods with async/throws metadata</li>
 *   <li>Calls through self and instantiations of capitalized types</li>
 *   <li>Bracket errors in malformed files</li>
 * </ul>
 */
class SwiftExtractorTest extends ExtractorTestBase {

    private static final String USER_STORE = """
        import Foundation

        /// Stores users. Keeps them in memory.
        final class UserStore: BaseStore, Loadable {
            private var users: [User] = []
            let cache: Cache

            init(cache: Cache) {
                self.cache = cache
                super.init()
            }

            func load(id: String) async throws -> User? {
                let user = self.find(id)
                log(id)
                return User(id: id)
            }

            func find(_ id: String) -> User? {
                return nil
            }
        }

        protocol Loadable {
            func load(id: String) async throws -> User?
        }

        enum Status: String {
            case active, archived
            case pending
        }

        extension UserStore {
            func reset() {
                self.clear()
            }
        }
        """;

    private static final String FILE = "Sources/App/UserStore.swift";
    private static final String TYPE = "Sources.App.UserStore.UserStore";

    private final SwiftExtractor extractor = new SwiftExtractor();

    @Override
    protected Extractor extractor() {
        return extractor;
    }

    @Test
    void parse_withClass_extractsMembersAndSupertypes() {
        // When: A Swift class is parsed
        ExtractionResult result = parse(FILE, USER_STORE);

        // Then: Class, properties, initializer and methods are nested under the class
        assertThat(result.errors()).isEmpty();
        assertThat(targets(result, "Sources.App.UserStore", "imports")).containsExactly("Foundation");

        RawEntity type = entity(result, TYPE);
        assertThat(type.kind()).isEqualTo("class");
        assertThat(type.docSummary()).isEqualTo("Stores users.");
        assertThat(type.metadata()).containsEntry("modifiers", List.of("final"));
        assertThat(targets(result, TYPE, "inherits")).containsExactly("BaseStore");
        assertThat(targets(result, TYPE, "conforms")).containsExactly("Loadable");

        RawEntity users = entity(result, TYPE + ".users");
        assertThat(users.kind()).isEqualTo("property");
        assertThat(users.metadata()).containsEntry("mutable", true).containsEntry("type", "[User]");
        assertThat(targets(result, TYPE + ".cache", "references")).containsExactly("Cache");

        assertThat(entity(result, TYPE + ".init").kind()).isEqualTo("init");

        RawEntity load = entity(result, TYPE + ".load");
        assertThat(load.kind()).isEqualTo("method");
        assertThat(load.parentLocalId()).isEqualTo(type.localId());
        assertThat(load.metadata())
            .containsEntry("async", true)
            .containsEntry("throws", true)
            .containsEntry("returnType", "User?")
            .containsEntry("parameters", List.of("id"));
    }

    @Test
    void parse_withCalls_qualifiesSelfCallsAndDetectsInstantiations() {
        // When: Method bodies are parsed
        ExtractionResult result = parse(FILE, USER_STORE);

        // Then: self calls use the enclosing type and capitalized callees are instantiations
        assertThat(targets(result, TYPE + ".load", "calls")).containsExactly(TYPE + ".find", "log");
        assertThat(targets(result, TYPE + ".load", "instantiates")).containsExactly("User");
        assertThat(targets(result, TYPE + ".init", "calls")).isEmpty();
    }

    @Test
    void parse_withProtocolAndEnum_extractsRequirementsAndCases() {
        // When: Protocol and enum declarations are parsed
        ExtractionResult result = parse(FILE, USER_STORE);

        // Then: Requirements carry no body and raw-value types are not reported as conformances
        RawEntity requirement = entity(result, "Sources.App.UserStore.Loadable.load");
        assertThat(requirement.metadata()).containsEntry("requirement", true);
        assertThat(entity(result, "Sources.App.UserStore.Loadable").kind()).isEqualTo("protocol");

        assertThat(entity(result, "Sources.App.UserStore.Status").kind()).isEqualTo("enum");
        assertThat(targets(result, "Sources.App.UserStore.Status", "conforms")).isEmpty();
        assertThat(entity(result, "Sources.App.UserStore.Status.archived").kind()).isEqualTo("enum_constant");
        assertThat(findEntity(result, "Sources.App.UserStore.Status.pending")).isPresent();
    }

    @Test
    void parse_withExtension_qualifiesMembersWithExtendedType() {
        // When: An extension of a type declared in the same file is parsed
        ExtractionResult result = parse(FILE, USER_STORE);

        // Then: The extension links to its type and its members use the type's name
        RawEntity extension = entity(result, TYPE + "+extension");
        assertThat(extension.kind()).isEqualTo("extension");
        assertThat(targets(result, TYPE + "+extension", "extends_type")).containsExactly("UserStore");

        RawEntity reset = entity(result, TYPE + ".reset");
        assertThat(reset.parentLocalId()).isEqualTo(extension.localId());
        assertThat(targets(result, TYPE + ".reset", "calls")).containsExactly(TYPE + ".clear");
    }

    @Test
    void parse_withTopLevelFunction_reportsFunctionKind() {
        // When: A free function is parsed
        ExtractionResult result = parse("main.swift", "func start() {\n    run()\n}\n");

        // Then: It is a function, not a method
        assertThat(entity(result, "main.start").kind()).isEqualTo("function");
        assertThat(targets(result, "main.start", "calls")).containsExactly("run");
    }

    @Test
    void parse_withUnclosedBody_reportsBracketError() {
        // Given: A class whose body is never closed
        String source = """
            class Broken {
                func a() {
            """;

        // When: File is parsed
        ExtractionResult result = parse("Broken.swift", source);

        // Then: The error points at the class and the class is still extracted
        assertThat(hasError(result, ParseErrorKind.SYNTAX, "Unbalanced bracket '{'")).isTrue();
        assertThat(result.errors().get(0).line()).isEqualTo(1);
        assertThat(findEntity(result, "Broken.Broken")).isPresent();
    }
}
