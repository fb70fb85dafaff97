package com.codegraph.core.extractor.impl.javascript;

import com.codegraph.core.extractor.base.AbstractPatternExtractor;
import com.codegraph.core.extractor.base.BlockIndex;
import com.codegraph.core.extractor.base.BlockIndex.Block;
import com.codegraph.core.extractor.base.FileContext;
import com.codegraph.core.extractor.base.SourceText;
import com.codegraph.core.model.Language;
import com.codegraph.core.util.FileUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Heuristic extractor for JavaScript and TypeScript, including JSX/TSX.
 *
 * <p>Works on the masked source (comments and string contents blanked) and recognizes:
 * <ul>
 *   <li>ES module imports, re-exports and CommonJS {@code require}, with alias tracking</li>
 *   <li>Classes with {@code extends}/{@code implements}, their methods and properties</li>
 *   <li>Function declarations and arrow functions bound to variables</li>
 *   <li>TypeScript interfaces, type aliases and enums</li>
 *   <li>React function components, class components and hooks</li>
 *   <li>Call expressions, {@code new} expressions and JSX element usage</li>
 * </ul>
 *
 * <p>Module specifiers are resolved to dotted module names: {@code ./util/format} imported
 * from {@code src/app.ts} becomes {@code src.util.format}.
 */
public class JavaScriptExtractor extends AbstractPatternExtractor {

    private static final String IDENT = "[A-Za-z_$][\\w$]*";

    private static final Pattern IMPORT_FROM = Pattern.compile(
        "\\bimport\\s+(type\\s+)?([\\w$*{}\\s,]+?)\\s+from\\s*(['\"])([^'\"\\n]*)\\3");
    private static final Pattern IMPORT_SIDE_EFFECT = Pattern.compile(
        "\\bimport\\s*(['\"])([^'\"\\n]+)\\1");
    private static final Pattern REQUIRE = Pattern.compile(
        "(?:\\b(?:const|let|var)\\s+(" + IDENT + "|\\{[^}]*\\})\\s*=\\s*)?\\brequire\\s*\\(\\s*(['\"])([^'\"\\n]+)\\2\\s*\\)");
    private static final Pattern EXPORT_FROM = Pattern.compile(
        "\\bexport\\s+(?:type\\s+)?(?:\\*(?:\\s+as\\s+" + IDENT + ")?|\\{[^}]*\\})\\s*from\\s*(['\"])([^'\"\\n]+)\\1");

    private static final Pattern CLASS = Pattern.compile(
        "\\b(export\\s+)?(default\\s+)?(abstract\\s+)?class\\s+(" + IDENT + ")(?:\\s*<[^{]*?>)?"
            + "(?:\\s+extends\\s+([\\w$.]+)(?:\\s*<[^{]*?>)?)?"
            + "(?:\\s+implements\\s+([\\w$.,\\s<>]+?))?\\s*\\{");
    private static final Pattern INTERFACE = Pattern.compile(
        "\\b(export\\s+)?interface\\s+(" + IDENT + ")(?:\\s*<[^{]*?>)?(?:\\s+extends\\s+([\\w$.,\\s<>]+?))?\\s*\\{");
    private static final Pattern TYPE_ALIAS = Pattern.compile(
        "(?m)^[ \\t]*(export\\s+)?type\\s+(" + IDENT + ")(?:\\s*<[^=]*?>)?\\s*=");
    private static final Pattern ENUM = Pattern.compile(
        "\\b(export\\s+)?(?:const\\s+)?enum\\s+(" + IDENT + ")\\s*\\{");
    private static final Pattern FUNCTION = Pattern.compile(
        "\\b(export\\s+)?(default\\s+)?(async\\s+)?function\\s*(\\*?)\\s*(" + IDENT + ")\\s*(?:<[^>(]*>)?\\s*\\(");
    private static final Pattern ARROW = Pattern.compile(
        "\\b(export\\s+)?(?:const|let|var)\\s+(" + IDENT + ")\\s*(?::\\s*([^=]+?))?\\s*=\\s*(async\\s+)?(?:(\\()|(" + IDENT + ")\\s*=>)");
    private static final Pattern MEMBER_METHOD = Pattern.compile(
        "(?m)^[ \\t]*((?:(?:public|private|protected|static|async|readonly|abstract|override|get|set|declare)\\s+)*)"
            + "(\\*\\s*)?(#?" + IDENT + ")\\s*[?!]?\\s*(?:<[^>(]*>)?\\s*\\(");
    private static final Pattern MEMBER_PROPERTY = Pattern.compile(
        "(?m)^[ \\t]*((?:(?:public|private|protected|static|readonly|declare|override)\\s+)*)"
            + "(#?" + IDENT + ")\\s*[?!]?\\s*(?::\\s*([^=;\\n]+?))?\\s*(?:=\\s*([^;\\n]*?))?\\s*;?[ \\t]*$");
    private static final Pattern ARROW_INITIALIZER = Pattern.compile("^(async\\s+)?(?:\\([^)]*\\)|" + IDENT + ")\\s*(?::[^=]+)?=>");
    private static final Pattern JSX_RETURN = Pattern.compile("(?:\\breturn|=>)\\s*\\(?\\s*<[A-Za-z>]");
    private static final Pattern JSX_ELEMENT = Pattern.compile("(?<![\\w$.<])<([A-Z][\\w$]*(?:\\.[A-Z][\\w$]*)*)");
    private static final Pattern RETURN_TYPE_THEN_BODY = Pattern.compile(":[ \\t]*[\\w$.<>\\[\\]|, ]+\\s*\\{");
    private static final Pattern HOOK_NAME = Pattern.compile("^use[A-Z0-9]\\w*$");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "return", "typeof", "function", "super", "import",
        "require", "else", "do", "try", "yield", "await", "delete", "void", "in", "of", "instanceof",
        "case", "throw", "with", "constructor", "async", "get", "set", "static");

    private static final Set<String> DECLARATION_KEYWORDS = Set.of("function", "class", "interface");

    private static final Set<String> MEMBER_EXCLUSIONS = Set.of(
        "if", "for", "while", "switch", "catch", "return", "else", "do", "try", "new", "throw", "await");

    private static final Set<String> BUILTIN_TYPES = Set.of(
        "string", "number", "boolean", "any", "unknown", "void", "never", "object", "null", "undefined",
        "String", "Number", "Boolean", "Object", "Array", "Map", "Set", "Promise", "Record", "Date",
        "Partial", "Readonly", "Function", "Error", "RegExp", "bigint", "symbol");

    private static final Set<String> COMPONENT_BASES = Set.of(
        "Component", "PureComponent", "React.Component", "React.PureComponent");

    private static final Set<String> SCRIPT_EXTENSIONS = Set.of("js", "jsx", "mjs", "cjs", "ts", "tsx", "mts", "cts", "vue");

    /**
     * A supertype reference of a declaration.
     *
     * @param name referenced name as written
     * @param relation raw relation type ({@code extends} or {@code implements})
     */
    public record Supertype(String name, String relation) {}

    /**
     * A declaration found in the first pass, before parents are known.
     *
     * @param kind raw entity kind
     * @param name simple name
     * @param start offset where the declaration starts
     * @param bodyOpen offset of the opening brace, or -1 if the declaration has no body
     * @param bodyEnd offset of the closing brace, or the end of the declaration
     * @param typeLike true for classes, interfaces and enums
     * @param signature single-line signature
     * @param metadata extra facts
     * @param supertypes extended or implemented types
     * @param typeReference type annotation of a property, may be null
     */
    public record Declaration(
        String kind,
        String name,
        int start,
        int bodyOpen,
        int bodyEnd,
        boolean typeLike,
        String signature,
        Map<String, Object> metadata,
        List<Supertype> supertypes,
        String typeReference
    ) {}

    /**
     * Outcome of analyzing one script region.
     *
     * @param aliases local names bound by imports, mapped to their qualified targets
     * @param blocks declarations with bodies inside the region
     */
    public record ScriptAnalysis(Map<String, String> aliases, BlockIndex blocks) {}

    @Override
    public String getId() {
        return "javascript-heuristic";
    }

    @Override
    public String getDisplayName() {
        return "JavaScript/TypeScript Heuristic Extractor";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.JAVASCRIPT, Language.TYPESCRIPT);
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("js", "jsx", "mjs", "cjs", "ts", "tsx", "mts", "cts");
    }

    @Override
    public Language languageOf(String filePath) {
        return switch (FileUtils.getExtension(filePath)) {
            case "ts", "tsx", "mts", "cts" -> Language.TYPESCRIPT;
            default -> Language.JAVASCRIPT;
        };
    }

    @Override
    protected void extract(String sourceText, FileContext context) {
        SourceText source = SourceText.of(sourceText, SourceText.Syntax.C_LIKE);
        boolean jsx = !"ts".equals(FileUtils.getExtension(context.filePath()));
        analyzeScript(source, 0, source.length(), context, context.moduleLocalId(), context.moduleName(), jsx);
        reportSyntaxErrors(source, 0, source.length(), context);
    }

    /**
     * Runs all passes over the script between two offsets.
     *
     * @param source masked source of the whole file
     * @param from start of the script (inclusive)
     * @param to end of the script (exclusive)
     * @param context file context
     * @param rootId entity that owns top-level declarations, imports and calls
     * @param rootQn qualified name used as prefix for top-level declarations
     * @param jsx whether JSX element usage should be reported
     * @return aliases and blocks found in the region
     */
    protected ScriptAnalysis analyzeScript(SourceText source, int from, int to, FileContext context,
                                           int rootId, String rootQn, boolean jsx) {
        Map<String, String> aliases = collectImports(source, from, to, context);

        List<Declaration> declarations = new ArrayList<>();
        collectTypes(source, from, to, declarations);
        collectFunctions(source, from, to, declarations);
        for (Declaration declaration : List.copyOf(declarations)) {
            if ("class".equals(declaration.kind()) || "component".equals(declaration.kind())) {
                collectClassMembers(source, declaration, declarations);
            }
        }
        collectFrameworkDeclarations(source, from, to, declarations);
        declarations.sort(Comparator.comparingInt(Declaration::start));

        BlockIndex blocks = new BlockIndex();
        for (Declaration declaration : declarations) {
            materialize(source, declaration, context, rootId, rootQn, blocks, aliases);
        }

        collectCalls(source, from, to, context, rootId, rootQn, blocks, aliases);
        if (jsx) {
            collectElementUsages(source, from, to, context, rootId, blocks, aliases);
        }
        return new ScriptAnalysis(aliases, blocks);
    }

    // ==================== Imports ====================

    private Map<String, String> collectImports(SourceText source, int from, int to, FileContext context) {
        Map<String, String> aliases = new LinkedHashMap<>();
        String content = source.content();
        Set<Integer> consumed = new HashSet<>();

        for (MatchResult match : findMatches(IMPORT_FROM, content, from, to)) {
            if (!source.isCode(match.start())) {
                continue;
            }
            consumed.add(match.start());
            String module = resolveModuleSpecifier(match.group(4), context.filePath());
            int line = source.lineOf(match.start());
            boolean typeOnly = match.group(1) != null;
            addImportClause(match.group(2), module, typeOnly, line, context, aliases);
        }
        for (MatchResult match : findMatches(IMPORT_SIDE_EFFECT, content, from, to)) {
            if (!source.isCode(match.start()) || consumed.contains(match.start())) {
                continue;
            }
            String module = resolveModuleSpecifier(match.group(2), context.filePath());
            context.result().addRelation(context.moduleLocalId(), module, "imports",
                source.lineOf(match.start()), Map.of("sideEffect", true));
        }
        for (MatchResult match : findMatches(REQUIRE, content, from, to)) {
            int requireAt = content.indexOf("require", match.start());
            if (!source.isCode(requireAt)) {
                continue;
            }
            String module = resolveModuleSpecifier(match.group(3), context.filePath());
            int line = source.lineOf(requireAt);
            String binding = match.group(1);
            if (binding != null && binding.startsWith("{")) {
                for (String part : splitTopLevel(binding.substring(1, binding.length() - 1))) {
                    String[] names = part.split(":");
                    String imported = names[0].trim();
                    String local = names.length > 1 ? names[1].trim() : imported;
                    aliases.put(local, module + "." + imported);
                    context.result().addRelation(context.moduleLocalId(), module + "." + imported, "requires",
                        line, Map.of("alias", local));
                }
                continue;
            }
            if (binding != null) {
                aliases.put(binding, module);
            }
            context.result().addRelation(context.moduleLocalId(), module, "requires", line,
                binding != null ? Map.of("alias", binding) : Map.of());
        }
        for (MatchResult match : findMatches(EXPORT_FROM, content, from, to)) {
            if (!source.isCode(match.start())) {
                continue;
            }
            String module = resolveModuleSpecifier(match.group(2), context.filePath());
            context.result().addRelation(context.moduleLocalId(), module, "imports",
                source.lineOf(match.start()), Map.of("reexport", true));
        }
        return aliases;
    }

    private void addImportClause(String clause, String module, boolean typeOnly, int line,
                                 FileContext context, Map<String, String> aliases) {
        String text = clause.trim();
        int brace = text.indexOf('{');
        String head = brace >= 0 ? text.substring(0, brace) : text;
        String named = brace >= 0 ? text.substring(brace + 1, Math.max(brace + 1, text.lastIndexOf('}'))) : "";

        boolean anyBinding = false;
        for (String part : splitTopLevel(head)) {
            if (part.startsWith("*")) {
                String alias = part.replaceFirst("^\\*\\s*as\\s+", "").trim();
                aliases.put(alias, module);
                context.result().addRelation(context.moduleLocalId(), module, "imports", line,
                    Map.of("namespace", alias));
            } else {
                // Default import: the binding usually carries the exported name.
                aliases.put(part, module + "." + part);
                context.result().addRelation(context.moduleLocalId(), module + "." + part, "imports", line,
                    Map.of("default", true, "alias", part));
            }
            anyBinding = true;
        }
        for (String part : splitTopLevel(named)) {
            String cleaned = part.replaceFirst("^type\\s+", "");
            String[] names = cleaned.split("\\s+as\\s+");
            String imported = names[0].trim();
            String local = names.length > 1 ? names[1].trim() : imported;
            if (imported.isEmpty()) {
                continue;
            }
            aliases.put(local, module + "." + imported);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("alias", local);
            if (typeOnly || !cleaned.equals(part)) {
                metadata.put("typeOnly", true);
            }
            context.result().addRelation(context.moduleLocalId(), module + "." + imported, "imports", line, metadata);
            anyBinding = true;
        }
        if (!anyBinding) {
            context.result().addRelation(context.moduleLocalId(), module, "imports", line);
        }
    }

    /**
     * Resolves an import specifier to a dotted module name.
     *
     * <p>Relative specifiers are resolved against the importing file's directory and lose
     * their script extension; {@code @/} is treated as the conventional alias for {@code src/};
     * package specifiers keep their name with {@code /} replaced by dots.
     *
     * @param specifier specifier as written in the import
     * @param importingFile project-relative path of the importing file
     * @return dotted module name
     */
    static String resolveModuleSpecifier(String specifier, String importingFile) {
        String spec = specifier.trim();
        String path;
        if (spec.startsWith("./") || spec.startsWith("../") || ".".equals(spec) || "..".equals(spec)) {
            String directory = FileUtils.directoryOf(importingFile);
            path = normalizePath(".".equals(directory) ? spec : directory + "/" + spec);
        } else if (spec.startsWith("@/")) {
            path = "src/" + spec.substring(2);
        } else {
            path = spec;
        }
        String extension = FileUtils.getExtension(path);
        if (SCRIPT_EXTENSIONS.contains(extension)) {
            path = path.substring(0, path.length() - extension.length() - 1);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.replace('/', '.');
    }

    private static String normalizePath(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty()) {
                    segments.removeLast();
                }
                continue;
            }
            segments.addLast(segment);
        }
        return String.join("/", segments);
    }

    // ==================== Declarations ====================

    private void collectTypes(SourceText source, int from, int to, List<Declaration> declarations) {
        String masked = source.masked();
        for (MatchResult match : findMatches(CLASS, masked, from, to)) {
            int open = match.end() - 1;
            String name = match.group(4);
            String base = match.group(5);
            List<Supertype> supertypes = new ArrayList<>();
            if (base != null) {
                supertypes.add(new Supertype(base, "extends"));
            }
            for (String implemented : splitTopLevel(match.group(6))) {
                supertypes.add(new Supertype(baseTypeName(implemented), "implements"));
            }
            Map<String, Object> metadata = exportMetadata(match.group(1), match.group(2));
            if (match.group(3) != null) {
                metadata.put("abstract", true);
            }
            String kind = base != null && COMPONENT_BASES.contains(base) ? "component" : "class";
            declarations.add(new Declaration(kind, name, match.start(), open, closingOrEnd(source, open, to),
                true, compact(masked.substring(match.start(), open)), metadata, supertypes, null));
        }
        for (MatchResult match : findMatches(INTERFACE, masked, from, to)) {
            int open = match.end() - 1;
            List<Supertype> supertypes = new ArrayList<>();
            for (String parent : splitTopLevel(match.group(3))) {
                supertypes.add(new Supertype(baseTypeName(parent), "extends"));
            }
            declarations.add(new Declaration("interface", match.group(2), match.start(), open,
                closingOrEnd(source, open, to), true, compact(masked.substring(match.start(), open)),
                exportMetadata(match.group(1), null), supertypes, null));
        }
        for (MatchResult match : findMatches(TYPE_ALIAS, masked, from, to)) {
            int start = skipWhitespace(masked, match.start());
            int end = statementEnd(masked, match.end(), to);
            declarations.add(new Declaration("type_alias", match.group(2), start, -1, end, false,
                compact(masked.substring(start, Math.min(end, match.end() + 80))),
                exportMetadata(match.group(1), null), List.of(), null));
        }
        for (MatchResult match : findMatches(ENUM, masked, from, to)) {
            int open = match.end() - 1;
            declarations.add(new Declaration("enum", match.group(2), match.start(), open,
                closingOrEnd(source, open, to), true, compact(masked.substring(match.start(), open)),
                exportMetadata(match.group(1), null), List.of(), null));
        }
    }

    private void collectFunctions(SourceText source, int from, int to, List<Declaration> declarations) {
        String masked = source.masked();
        for (MatchResult match : findMatches(FUNCTION, masked, from, to)) {
            int paramsOpen = match.end() - 1;
            int paramsClose = source.findClosing(paramsOpen);
            if (paramsClose < 0) {
                continue;
            }
            int open = masked.indexOf('{', paramsClose);
            if (open < 0 || open >= to) {
                continue;
            }
            String name = match.group(5);
            boolean async = match.group(3) != null;
            Map<String, Object> metadata = exportMetadata(match.group(1), match.group(2));
            metadata.put("async", async);
            if (!match.group(4).isEmpty()) {
                metadata.put("generator", true);
            }
            String params = masked.substring(paramsOpen + 1, paramsClose);
            metadata.put("parameters", parameterNames(params));
            String returnType = returnAnnotation(masked, paramsClose + 1, open);
            String signature = (async ? "async " : "") + name + "(" + compact(params) + ")"
                + (returnType != null ? ": " + returnType : "");
            int end = closingOrEnd(source, open, to);
            declarations.add(new Declaration(functionKind(name, masked, open, end), name, match.start(), open, end,
                false, signature, metadata, List.of(), null));
        }
        for (MatchResult match : findMatches(ARROW, masked, from, to)) {
            int arrowEnd;
            String params;
            String returnType = null;
            if (match.group(5) != null) {
                int paramsOpen = match.start(5);
                int paramsClose = source.findClosing(paramsOpen);
                if (paramsClose < 0) {
                    continue;
                }
                int arrow = masked.indexOf("=>", paramsClose);
                if (arrow < 0 || arrow >= to || !masked.substring(paramsClose + 1, arrow).trim().matches("(:.*)?")) {
                    continue;
                }
                params = masked.substring(paramsOpen + 1, paramsClose);
                returnType = returnAnnotation(masked, paramsClose + 1, arrow);
                arrowEnd = arrow + 2;
            } else {
                params = match.group(6);
                arrowEnd = match.end();
            }
            int bodyStart = skipWhitespace(masked, arrowEnd);
            int open;
            int end;
            if (bodyStart < to && masked.charAt(bodyStart) == '{') {
                open = bodyStart;
                end = closingOrEnd(source, open, to);
            } else if (bodyStart < to && masked.charAt(bodyStart) == '(') {
                open = bodyStart;
                end = closingOrEnd(source, open, to);
            } else {
                open = -1;
                end = statementEnd(masked, bodyStart, to);
            }
            String name = match.group(2);
            boolean async = match.group(4) != null;
            Map<String, Object> metadata = exportMetadata(match.group(1), null);
            metadata.put("async", async);
            metadata.put("arrow", true);
            metadata.put("parameters", parameterNames(params));
            String annotation = match.group(3);
            String kind = functionKind(name, masked, open >= 0 ? open : bodyStart, end);
            if (annotation != null && annotation.matches(".*\\b(?:React\\.)?(?:FC|FunctionComponent|VFC)\\b.*")) {
                kind = "react_component";
            }
            String signature = (async ? "async " : "") + name + " = (" + compact(params) + ")"
                + (returnType != null ? ": " + returnType : "") + " =>";
            declarations.add(new Declaration(kind, name, match.start(), open, end, false, signature,
                metadata, List.of(), null));
        }
    }

    private void collectClassMembers(SourceText source, Declaration type, List<Declaration> declarations) {
        String masked = source.masked();
        int[] depths = source.braceDepths();
        int memberDepth = depths[type.bodyOpen()] + 1;
        int from = type.bodyOpen() + 1;
        int to = type.bodyEnd();

        Set<Integer> memberLines = new HashSet<>();
        for (MatchResult match : findMatches(MEMBER_METHOD, masked, from, to)) {
            int nameStart = match.start(3);
            String name = match.group(3);
            if (depths[nameStart] != memberDepth || MEMBER_EXCLUSIONS.contains(name)) {
                continue;
            }
            int paramsOpen = match.end() - 1;
            int paramsClose = source.findClosing(paramsOpen);
            if (paramsClose < 0 || paramsClose > to) {
                continue;
            }
            int next = nextCodeChar(masked, paramsClose + 1, to, "{;");
            boolean hasBody = next >= 0 && masked.charAt(next) == '{';
            String returnType = returnAnnotation(masked, paramsClose + 1, next >= 0 ? next : paramsClose + 1);
            String modifiers = match.group(1).trim();
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (!modifiers.isEmpty()) {
                metadata.put("modifiers", List.of(modifiers.split("\\s+")));
            }
            String params = masked.substring(paramsOpen + 1, paramsClose);
            metadata.put("parameters", parameterNames(params));
            if (!hasBody) {
                metadata.put("abstract", true);
            }
            int start = nameStart - match.group(1).length() - (match.group(2) != null ? match.group(2).length() : 0);
            int end = hasBody ? closingOrEnd(source, next, to) : (next >= 0 ? next : paramsClose);
            String kind = "constructor".equals(name) ? "constructor" : "method";
            String signature = (modifiers.isEmpty() ? "" : modifiers + " ") + name + "(" + compact(params) + ")"
                + (returnType != null ? ": " + returnType : "");
            declarations.add(new Declaration(kind, name, Math.max(from, start), hasBody ? next : -1, end,
                false, signature, metadata, List.of(), null));
            memberLines.add(source.lineOf(nameStart));
        }
        for (MatchResult match : findMatches(MEMBER_PROPERTY, masked, from, to)) {
            int nameStart = match.start(2);
            String name = match.group(2);
            if (depths[nameStart] != memberDepth || memberLines.contains(source.lineOf(nameStart))
                || MEMBER_EXCLUSIONS.contains(name)) {
                continue;
            }
            String typeAnnotation = match.group(3) != null ? match.group(3).trim() : null;
            String initializer = match.group(4) != null ? match.group(4).trim() : "";
            String modifiers = match.group(1).trim();
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (!modifiers.isEmpty()) {
                metadata.put("modifiers", List.of(modifiers.split("\\s+")));
            }
            if (ARROW_INITIALIZER.matcher(initializer).find()) {
                int arrow = masked.indexOf("=>", match.start(4));
                int bodyStart = skipWhitespace(masked, arrow + 2);
                boolean block = bodyStart < masked.length() && masked.charAt(bodyStart) == '{';
                int end = block ? closingOrEnd(source, bodyStart, to) : statementEnd(masked, bodyStart, to);
                metadata.put("arrow", true);
                declarations.add(new Declaration("method", name, nameStart - match.group(1).length(),
                    block ? bodyStart : -1, end, false, name + " = " + compact(initializer), metadata, List.of(), null));
                continue;
            }
            if (typeAnnotation == null && initializer.isEmpty() && !match.group(0).trim().endsWith(";")) {
                continue;
            }
            String signature = name + (typeAnnotation != null ? ": " + compact(typeAnnotation) : "");
            if (typeAnnotation != null) {
                metadata.put("type", compact(typeAnnotation));
            }
            declarations.add(new Declaration("property", name, nameStart - match.group(1).length(), -1,
                match.end(), false, signature, metadata, List.of(), typeAnnotation));
        }
    }

    private void materialize(SourceText source, Declaration declaration, FileContext context, int rootId,
                             String rootQn, BlockIndex blocks, Map<String, String> aliases) {
        Optional<Block> parent = blocks.innermost(declaration.start());
        int parentId = parent.map(Block::localId).orElse(rootId);
        String parentQn = parent.map(Block::qualifiedName).orElse(rootQn);
        String qualifiedName = parentQn.isEmpty() ? declaration.name() : parentQn + "." + declaration.name();
        int lineStart = source.lineOf(declaration.start());
        int lineEnd = source.lineOf(Math.max(declaration.start(), Math.min(declaration.bodyEnd(), source.length() - 1)));
        String doc = docSummary(precedingBlockComment(source, declaration.start()));

        int localId = context.result().addEntity(parentId, declaration.name(), qualifiedName, declaration.kind(),
            lineStart, lineEnd, declaration.signature(), doc, declaration.metadata());
        if (declaration.bodyOpen() >= 0) {
            blocks.add(new Block(localId, qualifiedName, declaration.typeLike(), declaration.start(),
                declaration.bodyOpen(), declaration.bodyEnd()));
        }
        for (Supertype supertype : declaration.supertypes()) {
            context.result().addRelation(localId, resolveAlias(supertype.name(), aliases), supertype.relation(),
                lineStart);
        }
        String typeReference = declaration.typeReference();
        if (typeReference != null) {
            String type = baseTypeName(typeReference);
            if (!type.isEmpty() && Character.isUpperCase(type.charAt(0)) && !BUILTIN_TYPES.contains(type)) {
                context.result().addRelation(localId, resolveAlias(type, aliases), "references", lineStart);
            }
        }
    }

    /**
     * Adds declarations that only a framework-aware subclass recognizes, such as members of a
     * component options object. Called before parents are assigned.
     *
     * @param source masked source
     * @param from start of the script (inclusive)
     * @param to end of the script (exclusive)
     * @param declarations declarations collected so far
     */
    protected void collectFrameworkDeclarations(SourceText source, int from, int to, List<Declaration> declarations) {
    }

    // ==================== Calls and Usages ====================

    private void collectCalls(SourceText source, int from, int to, FileContext context, int rootId,
                              String rootQn, BlockIndex blocks, Map<String, String> aliases) {
        Map<Integer, Set<String>> seen = new HashMap<>();
        for (CallSite call : findCallSites(source, from, to, KEYWORDS, DECLARATION_KEYWORDS)) {
            Optional<Block> owner = blocks.innermost(call.offset());
            if (owner.isPresent() && owner.get().typeLike() || isDefinitionHeader(source, call)) {
                continue;
            }
            int sourceId = owner.map(Block::localId).orElse(rootId);
            String target = callTarget(call.name(), call.offset(), rootQn, blocks, aliases);
            if (target == null) {
                continue;
            }
            String type = call.instantiation() ? "instantiates" : "calls";
            if (seen.computeIfAbsent(sourceId, id -> new HashSet<>()).add(type + ":" + target)) {
                context.result().addRelation(sourceId, target, type, source.lineOf(call.offset()),
                    call.name().equals(target) ? Map.of() : Map.of("callee", call.name()));
            }
        }
    }

    /**
     * Detects method shorthand such as {@code save(user) {} } that the call scanner reports
     * as a call: the parameter list is followed by a body, possibly after a return type.
     */
    private boolean isDefinitionHeader(SourceText source, CallSite call) {
        String masked = source.masked();
        int open = masked.indexOf('(', call.offset());
        int close = source.findClosing(open);
        if (close < 0) {
            return false;
        }
        int next = skipWhitespace(masked, close + 1);
        if (next >= masked.length()) {
            return false;
        }
        if (masked.charAt(next) == '{') {
            return true;
        }
        return masked.charAt(next) == ':' && RETURN_TYPE_THEN_BODY.matcher(masked).region(next, masked.length()).lookingAt();
    }

    private String callTarget(String name, int offset, String rootQn, BlockIndex blocks, Map<String, String> aliases) {
        if (name.startsWith("this.")) {
            String member = name.substring("this.".length());
            if (member.contains(".")) {
                return member;
            }
            return blocks.innermost(offset, Block::typeLike)
                .map(type -> type.qualifiedName() + "." + member)
                .orElse(rootQn.isEmpty() ? member : rootQn + "." + member);
        }
        if (name.startsWith("super.")) {
            return name.substring("super.".length());
        }
        if ("this".equals(name)) {
            return null;
        }
        return resolveAlias(name, aliases);
    }

    private void collectElementUsages(SourceText source, int from, int to, FileContext context, int rootId,
                                      BlockIndex blocks, Map<String, String> aliases) {
        Map<Integer, Set<String>> seen = new HashMap<>();
        for (MatchResult match : findMatches(JSX_ELEMENT, source.masked(), from, to)) {
            Optional<Block> owner = blocks.innermost(match.start(), block -> !block.typeLike());
            int sourceId = owner.map(Block::localId).orElse(rootId);
            String target = resolveAlias(match.group(1), aliases);
            if (seen.computeIfAbsent(sourceId, id -> new HashSet<>()).add(target)) {
                context.result().addRelation(sourceId, target, "template_usage", source.lineOf(match.start()),
                    Map.of("element", match.group(1)));
            }
        }
    }

    /**
     * Rewrites the first segment of a dotted name through the import aliases.
     */
    protected String resolveAlias(String name, Map<String, String> aliases) {
        int dot = name.indexOf('.');
        String first = dot >= 0 ? name.substring(0, dot) : name;
        String target = aliases.get(first);
        if (target == null) {
            return name;
        }
        return dot >= 0 ? target + name.substring(dot) : target;
    }

    // ==================== Helpers ====================

    private String functionKind(String name, String masked, int bodyStart, int bodyEnd) {
        if (HOOK_NAME.matcher(name).matches()) {
            return "hook";
        }
        if (Character.isUpperCase(name.charAt(0))
            && JSX_RETURN.matcher(safeSubstring(masked, Math.max(0, bodyStart - 4), Math.min(masked.length(), bodyEnd + 1))).find()) {
            return "react_component";
        }
        return "function";
    }

    private static Map<String, Object> exportMetadata(String export, String defaultExport) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (export != null) {
            metadata.put("exported", true);
        }
        if (defaultExport != null) {
            metadata.put("defaultExport", true);
        }
        return metadata;
    }

    protected List<String> parameterNames(String params) {
        List<String> names = new ArrayList<>();
        for (String part : splitTopLevel(params)) {
            String name = part.replaceFirst("^(?:public|private|protected|readonly)\\s+", "")
                .replaceFirst("^\\.\\.\\.", "");
            int cut = name.length();
            for (char delimiter : new char[] {':', '=', '?'}) {
                int index = name.indexOf(delimiter);
                if (index >= 0 && index < cut) {
                    cut = index;
                }
            }
            name = name.substring(0, cut).trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private String returnAnnotation(String masked, int from, int to) {
        String between = safeSubstring(masked, from, to).trim();
        if (between.startsWith(":")) {
            String type = compact(between.substring(1));
            return type.isEmpty() ? null : type;
        }
        return null;
    }

    private static int nextCodeChar(String masked, int from, int to, String wanted) {
        for (int i = from; i < Math.min(to, masked.length()); i++) {
            if (wanted.indexOf(masked.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Finds the end of an expression statement: a semicolon or line break outside brackets.
     */
    protected static int statementEnd(String masked, int from, int to) {
        int depth = 0;
        int limit = Math.min(to, masked.length());
        for (int i = from; i < limit; i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if ((c == ';' || c == '\n') && depth == 0) {
                return i;
            }
        }
        return Math.max(from, limit - 1);
    }
}
