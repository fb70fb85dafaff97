package com.codegraph.core.extractor.impl.swift;

import com.codegraph.core.extractor.base.AbstractPatternExtractor;
import com.codegraph.core.extractor.base.BlockIndex;
import com.codegraph.core.extractor.base.BlockIndex.Block;
import com.codegraph.core.extractor.base.FileContext;
import com.codegraph.core.extractor.base.SourceText;
import com.codegraph.core.model.Language;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic Swift extractor.
 *
 * <p>Recognizes imports, classes, structs, enums, protocols, actors and extensions with their
 * inheritance clauses, stored and computed properties, enum cases, functions, initializers and
 * deinitializers. Protocol requirements are reported without bodies. Calls are attributed to
 * the innermost enclosing function; calls through {@code self} are qualified with the
 * enclosing type and calls to capitalized names are reported as instantiations.
 */
public class SwiftExtractor extends AbstractPatternExtractor {

    private static final String ATTRIBUTES = "((?:@\\w+(?:\\([^)\\n]*\\))?\\s+)*)";

    private static final Pattern IMPORT = Pattern.compile(
        "(?m)^[ \\t]*(?:@\\w+\\s+)*import\\s+(?:(?:typealias|struct|class|enum|protocol|let|var|func)\\s+)?([\\w.]+)");
    private static final Pattern TYPE = Pattern.compile(
        "(?m)^[ \\t]*" + ATTRIBUTES
            + "((?:(?:public|private|fileprivate|internal|open|final|indirect|package)\\s+)*)"
            + "(class|struct|enum|protocol|actor|extension)\\s+(?!func\\b|var\\b|let\\b)([A-Za-z_][\\w.]*)"
            + "(\\s*<[^>{]*>)?\\s*(?::\\s*([^{]+?))?\\s*(?:\\bwhere\\b[^{]*)?\\{");
    private static final Pattern FUNC = Pattern.compile(
        "(?m)^[ \\t]*" + ATTRIBUTES
            + "((?:(?:public|private|fileprivate|internal|open|final|static|class|override|mutating|nonmutating"
            + "|required|convenience|dynamic|nonisolated|package)\\s+)*)"
            + "func\\s+([A-Za-z_]\\w*|[^\\s(<]+)\\s*(<[^>(]*>)?\\s*\\(");
    private static final Pattern INIT = Pattern.compile(
        "(?m)^[ \\t]*" + ATTRIBUTES
            + "((?:(?:public|private|fileprivate|internal|open|override|required|convenience|package)\\s+)*)"
            + "(init[?!]?)\\s*(<[^>(]*>)?\\s*\\(");
    private static final Pattern DEINIT = Pattern.compile("(?m)^[ \\t]*deinit\\s*\\{");
    private static final Pattern PROPERTY = Pattern.compile(
        "(?m)^[ \\t]*" + ATTRIBUTES
            + "((?:(?:public|private|fileprivate|internal|open|final|static|class|override|lazy|weak|unowned"
            + "|nonisolated|package)(?:\\(set\\))?\\s+)*)"
            + "(var|let)\\s+([A-Za-z_]\\w*)\\s*(?::\\s*([^={\\n]+))?");
    private static final Pattern ENUM_CASE = Pattern.compile("(?m)^[ \\t]*(?:indirect\\s+)?case\\s+([^\\n]+)");
    private static final Pattern MEMBER_KEYWORD = Pattern.compile("\\b(?:func|var|let|case|init|subscript|deinit)\\b");
    private static final Pattern LEADING_IDENTIFIER = Pattern.compile("^`?([A-Za-z_]\\w*)");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "guard", "while", "for", "switch", "return", "func", "init", "super", "repeat", "catch",
        "try", "await", "throw", "defer", "case", "let", "var", "in", "where", "is", "as", "else",
        "deinit", "subscript", "some", "any", "inout");

    private static final Set<String> DECLARATION_KEYWORDS = Set.of("func");

    private static final Set<String> BUILTIN_TYPES = Set.of(
        "String", "Int", "Int8", "Int16", "Int32", "Int64", "UInt", "UInt8", "UInt16", "UInt32", "UInt64",
        "Double", "Float", "Bool", "Character", "Void", "Any", "AnyObject", "Array", "Dictionary", "Set",
        "Optional", "Data", "Date", "URL", "Error", "Never", "Self");

    private static final Set<String> TYPE_KINDS = Set.of("class", "struct", "enum", "protocol", "actor", "extension");

    private record Supertype(String name, String relation) {}

    /**
     * A declaration collected in the first pass.
     *
     * @param kind raw kind; {@code func} is refined to method or function once the parent is known
     * @param name simple name
     * @param start offset of the declaration
     * @param bodyOpen offset of the opening brace, or -1
     * @param bodyEnd end of the body or declaration
     * @param signature single-line signature
     * @param metadata extra facts
     * @param supertypes inheritance and conformance references
     * @param typeReference declared type of a property
     */
    private record Declaration(
        String kind,
        String name,
        int start,
        int bodyOpen,
        int bodyEnd,
        String signature,
        Map<String, Object> metadata,
        List<Supertype> supertypes,
        String typeReference
    ) {
        boolean typeLike() {
            return TYPE_KINDS.contains(kind);
        }
    }

    @Override
    public String getId() {
        return "swift-heuristic";
    }

    @Override
    public String getDisplayName() {
        return "Swift Heuristic Extractor";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.SWIFT);
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("swift");
    }

    @Override
    protected void extract(String sourceText, FileContext context) {
        SourceText source = SourceText.of(sourceText, SourceText.Syntax.C_LIKE);
        String masked = source.masked();
        int length = source.length();

        for (MatchResult match : findMatches(IMPORT, masked)) {
            context.result().addRelation(context.moduleLocalId(), match.group(1), "imports",
                source.lineOf(match.start(1)));
        }

        int[] depths = source.braceDepths();
        List<Declaration> declarations = new ArrayList<>();
        collectTypes(source, declarations);
        List<Declaration> types = List.copyOf(declarations);
        collectFunctions(source, types, declarations);
        collectProperties(source, depths, types, declarations);
        collectEnumCases(source, depths, types, declarations);
        declarations.sort(Comparator.comparingInt(Declaration::start));

        BlockIndex blocks = new BlockIndex();
        for (Declaration declaration : declarations) {
            materialize(source, declaration, context, blocks);
        }
        collectCalls(source, context, blocks);
        reportSyntaxErrors(source, 0, length, context);
    }

    // ==================== Declarations ====================

    private void collectTypes(SourceText source, List<Declaration> declarations) {
        String masked = source.masked();
        for (MatchResult match : findMatches(TYPE, masked)) {
            int open = match.end() - 1;
            String keyword = match.group(3);
            String name = match.group(4);
            List<String> inherited = splitTopLevel(match.group(6)).stream()
                .map(this::baseTypeName)
                .filter(type -> !type.isEmpty())
                .toList();

            List<Supertype> supertypes = new ArrayList<>();
            for (int i = 0; i < inherited.size(); i++) {
                String type = inherited.get(i);
                if (("enum".equals(keyword) || "struct".equals(keyword)) && BUILTIN_TYPES.contains(type)) {
                    continue;
                }
                String relation = switch (keyword) {
                    case "class", "actor" -> i == 0 ? "inherits" : "conforms";
                    case "protocol" -> "inherits";
                    default -> "conforms";
                };
                supertypes.add(new Supertype(type, relation));
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            putList(metadata, "attributes", match.group(1));
            putList(metadata, "modifiers", match.group(2));
            if (match.group(5) != null) {
                metadata.put("typeParameters", compact(match.group(5)));
            }
            if ("extension".equals(keyword)) {
                supertypes.add(0, new Supertype(name, "extends_type"));
                metadata.put("extendedType", name);
            }
            int start = skipWhitespace(masked, match.start());
            declarations.add(new Declaration(keyword, name, start, open, closingOrEnd(source, open, masked.length()),
                compact(masked.substring(start, open)), metadata, supertypes, null));
        }
    }

    private void collectFunctions(SourceText source, List<Declaration> types, List<Declaration> declarations) {
        String masked = source.masked();
        for (MatchResult match : findMatches(FUNC, masked)) {
            addCallable(source, types, declarations, match, "func", match.group(3));
        }
        for (MatchResult match : findMatches(INIT, masked)) {
            addCallable(source, types, declarations, match, "init", match.group(3));
        }
        for (MatchResult match : findMatches(DEINIT, masked)) {
            int open = match.end() - 1;
            int start = skipWhitespace(masked, match.start());
            declarations.add(new Declaration("deinit", "deinit", start, open,
                closingOrEnd(source, open, masked.length()), "deinit", new LinkedHashMap<>(), List.of(), null));
        }
    }

    private void addCallable(SourceText source, List<Declaration> types, List<Declaration> declarations,
                             MatchResult match, String kind, String name) {
        String masked = source.masked();
        int paramsOpen = match.end() - 1;
        int paramsClose = source.findClosing(paramsOpen);
        if (paramsClose < 0) {
            return;
        }
        int start = skipWhitespace(masked, match.start());
        Optional<Declaration> owner = enclosingType(types, start);
        boolean requirement = owner.map(type -> "protocol".equals(type.kind())).orElse(false);

        int open = -1;
        int end = lineEnd(masked, paramsClose);
        if (!requirement) {
            int brace = indexOfAny(masked, paramsClose + 1, "{}");
            if (brace >= 0 && masked.charAt(brace) == '{'
                && !MEMBER_KEYWORD.matcher(masked.substring(paramsClose + 1, brace)).find()) {
                open = brace;
                end = closingOrEnd(source, open, masked.length());
            }
        }
        String tail = compact(masked.substring(paramsClose + 1, open >= 0 ? open : end));
        String params = masked.substring(paramsOpen + 1, paramsClose);

        Map<String, Object> metadata = new LinkedHashMap<>();
        putList(metadata, "attributes", match.group(1));
        putList(metadata, "modifiers", match.group(2));
        metadata.put("parameters", parameterLabels(params));
        if (tail.contains("async")) {
            metadata.put("async", true);
        }
        if (tail.matches(".*\\b(re)?throws\\b.*")) {
            metadata.put("throws", true);
        }
        int arrow = tail.indexOf("->");
        if (arrow >= 0) {
            String returnType = tail.substring(arrow + 2).replaceFirst("\\bwhere\\b.*$", "").trim();
            metadata.put("returnType", returnType);
        }
        if (requirement) {
            metadata.put("requirement", true);
        }
        String modifiers = compact(match.group(2));
        String signature = (modifiers.isEmpty() ? "" : modifiers + " ") + ("func".equals(kind) ? "func " : "")
            + name + (match.group(4) != null ? compact(match.group(4)) : "") + "(" + compact(params) + ")"
            + (tail.isEmpty() ? "" : " " + tail);
        declarations.add(new Declaration(kind, name, start, open, end, signature, metadata, List.of(), null));
    }

    private void collectProperties(SourceText source, int[] depths, List<Declaration> types,
                                   List<Declaration> declarations) {
        String masked = source.masked();
        for (MatchResult match : findMatches(PROPERTY, masked)) {
            int nameStart = match.start(4);
            Optional<Declaration> owner = enclosingType(types, nameStart);
            if (owner.isEmpty() || depths[nameStart] != depths[owner.get().bodyOpen()] + 1) {
                continue;
            }
            String type = match.group(5) != null ? match.group(5).trim() : null;
            Map<String, Object> metadata = new LinkedHashMap<>();
            putList(metadata, "attributes", match.group(1));
            putList(metadata, "modifiers", match.group(2));
            metadata.put("mutable", "var".equals(match.group(3)));
            if (type != null) {
                metadata.put("type", compact(type));
            }

            int after = skipSpaces(masked, match.end());
            int open = -1;
            int end = lineEnd(masked, match.end());
            if (after < masked.length() && masked.charAt(after) == '{') {
                open = after;
                end = closingOrEnd(source, open, masked.length());
                metadata.put("computed", true);
            }
            int start = skipWhitespace(masked, match.start());
            String signature = match.group(3) + " " + match.group(4) + (type != null ? ": " + compact(type) : "");
            declarations.add(new Declaration("property", match.group(4), start, open, end, signature, metadata,
                List.of(), type));
        }
    }

    private void collectEnumCases(SourceText source, int[] depths, List<Declaration> types,
                                  List<Declaration> declarations) {
        String masked = source.masked();
        for (MatchResult match : findMatches(ENUM_CASE, masked)) {
            Optional<Declaration> owner = enclosingType(types, match.start(1));
            if (owner.isEmpty() || !"enum".equals(owner.get().kind())
                || depths[match.start(1)] != depths[owner.get().bodyOpen()] + 1) {
                continue;
            }
            int start = skipWhitespace(masked, match.start());
            for (String part : splitTopLevel(match.group(1))) {
                Matcher identifier = LEADING_IDENTIFIER.matcher(part.trim());
                if (identifier.find()) {
                    declarations.add(new Declaration("enum_constant", identifier.group(1), start, -1,
                        lineEnd(masked, start), "case " + compact(part), new LinkedHashMap<>(), List.of(), null));
                }
            }
        }
    }

    private void materialize(SourceText source, Declaration declaration, FileContext context, BlockIndex blocks) {
        Optional<Block> parent = blocks.innermost(declaration.start());
        int parentId = parent.map(Block::localId).orElse(context.moduleLocalId());
        String parentQn = parent.map(Block::qualifiedName).orElse(context.moduleName());
        String scopeName = parentQn.isEmpty() ? declaration.name() : parentQn + "." + declaration.name();

        String kind = declaration.kind();
        String name = declaration.name();
        String qualifiedName = scopeName;
        if ("func".equals(kind)) {
            kind = parent.map(Block::typeLike).orElse(false) ? "method" : "function";
        } else if ("extension".equals(kind)) {
            name = declaration.name() + "+extension";
            qualifiedName = scopeName + "+extension";
        }

        int lineStart = source.lineOf(declaration.start());
        int lineEnd = source.lineOf(Math.max(declaration.start(), Math.min(declaration.bodyEnd(), source.length() - 1)));
        String doc = precedingLineComment(source, lineStart, "///");
        if (doc == null) {
            doc = precedingBlockComment(source, declaration.start());
        }

        int localId = context.result().addEntity(parentId, name, qualifiedName, kind, lineStart, lineEnd,
            declaration.signature(), docSummary(doc), declaration.metadata());
        if (declaration.bodyOpen() >= 0) {
            // Members of an extension are qualified with the extended type.
            blocks.add(new Block(localId, scopeName, declaration.typeLike(), declaration.start(),
                declaration.bodyOpen(), declaration.bodyEnd()));
        }
        for (Supertype supertype : declaration.supertypes()) {
            context.result().addRelation(localId, supertype.name(), supertype.relation(), lineStart);
        }
        if (declaration.typeReference() != null) {
            String type = baseTypeName(declaration.typeReference());
            if (!type.isEmpty() && Character.isUpperCase(type.charAt(0)) && !BUILTIN_TYPES.contains(type)) {
                context.result().addRelation(localId, type, "references", lineStart);
            }
        }
    }

    // ==================== Calls ====================

    private void collectCalls(SourceText source, FileContext context, BlockIndex blocks) {
        String masked = source.masked();
        Map<Integer, Set<String>> seen = new HashMap<>();
        for (CallSite call : findCallSites(source, 0, source.length(), KEYWORDS, DECLARATION_KEYWORDS)) {
            int offset = call.offset();
            if (offset > 0 && (masked.charAt(offset - 1) == '@' || masked.charAt(offset - 1) == '#')) {
                continue;
            }
            Optional<Block> owner = blocks.innermost(offset);
            if (owner.isPresent() && owner.get().typeLike()) {
                continue;
            }
            int sourceId = owner.map(Block::localId).orElse(context.moduleLocalId());
            String target = call.name();
            if (target.startsWith("self.")) {
                String member = target.substring("self.".length());
                if ("init".equals(member)) {
                    continue;
                }
                target = member.contains(".")
                    ? member
                    : blocks.innermost(offset, Block::typeLike).map(type -> type.qualifiedName() + "." + member)
                        .orElse(member);
            } else if ("self".equals(target)) {
                continue;
            }
            String last = target.substring(target.lastIndexOf('.') + 1);
            boolean instantiation = !last.isEmpty() && Character.isUpperCase(last.charAt(0));
            String type = instantiation ? "instantiates" : "calls";
            if (seen.computeIfAbsent(sourceId, id -> new HashSet<>()).add(type + ":" + target)) {
                context.result().addRelation(sourceId, target, type, source.lineOf(offset));
            }
        }
    }

    // ==================== Helpers ====================

    private static Optional<Declaration> enclosingType(List<Declaration> types, int offset) {
        return types.stream()
            .filter(type -> offset > type.bodyOpen() && offset < type.bodyEnd())
            .min(Comparator.comparingInt(type -> type.bodyEnd() - type.bodyOpen()));
    }

    private List<String> parameterLabels(String params) {
        List<String> labels = new ArrayList<>();
        for (String part : splitTopLevel(params)) {
            int colon = part.indexOf(':');
            String head = (colon >= 0 ? part.substring(0, colon) : part).trim();
            String[] names = head.split("\\s+");
            String label = names[names.length - 1];
            if (!label.isEmpty()) {
                labels.add(label);
            }
        }
        return labels;
    }

    private static void putList(Map<String, Object> metadata, String key, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        metadata.put(key, List.of(text.trim().split("\\s+")));
    }

    private static int indexOfAny(String text, int from, String chars) {
        for (int i = from; i < text.length(); i++) {
            if (chars.indexOf(text.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    private static int lineEnd(String text, int from) {
        int newline = text.indexOf('\n', from);
        return newline < 0 ? Math.max(0, text.length() - 1) : newline;
    }

    private static int skipSpaces(String text, int from) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
