package com.codegraph.core.extractor.impl.python;

import com.codegraph.core.extractor.base.AbstractPatternExtractor;
import com.codegraph.core.extractor.base.FileContext;
import com.codegraph.core.extractor.base.SourceText;
import com.codegraph.core.model.Language;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic Python extractor based on an indentation-aware statement scanner.
 *
 * <p>Comments and string contents are masked first, then physical lines are joined into
 * logical statements (open brackets and backslash continuations). A stack of open
 * {@code class}/{@code def} blocks, keyed by indentation, gives every statement its
 * enclosing scope.
 *
 * <p>Reports imports (with alias tracking), classes with their bases, functions, methods
 * and nested functions (async, decorators, type-hinted signatures, docstrings), class
 * attributes, and call expressions inside bodies. Calls through {@code self}/{@code cls}
 * are qualified with the enclosing class; calls through imported names are rewritten to the
 * imported module.
 */
public class PythonExtractor extends AbstractPatternExtractor {

    private static final Pattern DECORATOR = Pattern.compile("^@\\s*([\\w.]+)");
    private static final Pattern CLASS_DEF = Pattern.compile("^class\\s+(\\w+)\\s*(?:\\((.*)\\))?\\s*:");
    private static final Pattern FUNCTION_DEF = Pattern.compile(
        "^(async\\s+)?def\\s+(\\w+)\\s*(?:\\[[^\\]]*\\])?\\s*\\((.*)\\)\\s*(?:->\\s*(.+?))?\\s*:");
    private static final Pattern DEFINITION_START = Pattern.compile("^(?:async\\s+def|def|class)\\b");
    private static final Pattern IMPORT = Pattern.compile("^import\\s+(.+)$");
    private static final Pattern FROM_IMPORT = Pattern.compile("^from\\s+(\\.*[\\w.]*)\\s+import\\s+(.+)$");
    private static final Pattern ATTRIBUTE = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?::\\s*([^=]+?))?\\s*=(?!=)");
    private static final Pattern ANNOTATED_FIELD = Pattern.compile("^([A-Za-z_]\\w*)\\s*:\\s*(\\S.*)$");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "elif", "else", "while", "for", "return", "and", "or", "not", "in", "is", "lambda",
        "with", "assert", "del", "yield", "await", "except", "raise", "class", "def", "import",
        "from", "as", "global", "nonlocal", "pass", "try", "finally", "async", "match", "case");

    private static final Set<String> BUILTINS = Set.of(
        "print", "len", "range", "str", "int", "float", "bool", "list", "dict", "set", "tuple",
        "frozenset", "bytes", "isinstance", "issubclass", "super", "open", "enumerate", "zip", "map",
        "filter", "sorted", "reversed", "min", "max", "sum", "any", "all", "abs", "getattr", "setattr",
        "hasattr", "delattr", "type", "id", "repr", "iter", "next", "round", "format", "vars", "callable",
        "hash", "object", "property", "staticmethod", "classmethod", "Exception", "ValueError",
        "TypeError", "KeyError", "IndexError", "RuntimeError", "NotImplementedError", "AttributeError",
        "StopIteration");

    private static final Set<String> DECLARATION_KEYWORDS = Set.of("def", "class");

    @Override
    public String getId() {
        return "python-heuristic";
    }

    @Override
    public String getDisplayName() {
        return "Python Heuristic Extractor";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.PYTHON);
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("py", "pyi");
    }

    /**
     * An open class or function block.
     */
    private static final class Scope {
        final int indent;
        final int localId;
        final String qualifiedName;
        final boolean isClass;
        int lastLine;
        final Set<String> calledTargets = new HashSet<>();

        Scope(int indent, int localId, String qualifiedName, boolean isClass, int lastLine) {
            this.indent = indent;
            this.localId = localId;
            this.qualifiedName = qualifiedName;
            this.isClass = isClass;
            this.lastLine = lastLine;
        }
    }

    @Override
    protected void extract(String sourceText, FileContext context) {
        SourceText source = SourceText.of(sourceText, SourceText.Syntax.HASH);
        String[] lines = source.masked().split("\n", -1);
        Deque<Scope> stack = new ArrayDeque<>();
        Map<String, String> aliases = new HashMap<>();
        Set<String> moduleCalls = new HashSet<>();
        List<String> decorators = new ArrayList<>();

        int i = 0;
        while (i < lines.length) {
            String line = stripCarriageReturn(lines[i]);
            if (line.isBlank()) {
                i++;
                continue;
            }
            int startLine = i + 1;
            StringBuilder statement = new StringBuilder(line.trim());
            int depth = bracketDelta(line);
            int j = i;
            while ((depth > 0 || statement.toString().endsWith("\\")) && j + 1 < lines.length) {
                j++;
                if (statement.toString().endsWith("\\")) {
                    statement.setLength(statement.length() - 1);
                }
                statement.append(' ').append(stripCarriageReturn(lines[j]).trim());
                depth += bracketDelta(lines[j]);
            }
            if (depth > 0) {
                context.result().addSyntaxError(startLine, "Unclosed bracket");
            } else if (depth < 0) {
                context.result().addSyntaxError(startLine, "Unmatched closing bracket");
            }
            int endLine = j + 1;
            i = j + 1;

            int indent = indentOf(line);
            while (!stack.isEmpty() && indent <= stack.peek().indent) {
                close(context, stack.pop());
            }
            for (Scope scope : stack) {
                scope.lastLine = endLine;
            }

            String text = statement.toString().trim();
            Scope owner = stack.peek();

            Matcher decorator = DECORATOR.matcher(text);
            if (decorator.find()) {
                decorators.add(decorator.group(1));
                continue;
            }

            Matcher classDef = CLASS_DEF.matcher(text);
            Matcher functionDef = FUNCTION_DEF.matcher(text);
            if (classDef.find()) {
                stack.push(addClass(context, source, classDef, owner, indent, startLine, endLine, decorators, aliases));
            } else if (functionDef.find()) {
                stack.push(addFunction(context, source, functionDef, stack, indent, startLine, endLine, decorators));
            } else if (DEFINITION_START.matcher(text).find()) {
                context.result().addSyntaxError(startLine, "Malformed definition: expected ':'");
            } else if (text.startsWith("import ") || text.startsWith("from ")) {
                addImports(context, text, startLine, aliases);
            } else {
                if (owner != null && owner.isClass) {
                    addClassAttribute(context, text, owner, startLine, endLine);
                }
                addCalls(context, source, startLine, endLine, stack, aliases, moduleCalls);
            }
            decorators.clear();
        }
        while (!stack.isEmpty()) {
            close(context, stack.pop());
        }

        if (source.hasUnterminatedLiteral()) {
            context.result().addSyntaxError(source.unterminatedLine(),
                "Unterminated " + source.unterminatedDescription());
        }
    }

    private Scope addClass(FileContext context, SourceText source, Matcher match, Scope owner, int indent,
                           int startLine, int endLine, List<String> decorators, Map<String, String> aliases) {
        String name = match.group(1);
        String prefix = owner == null ? context.moduleName() : owner.qualifiedName;
        int parentId = owner == null ? context.moduleLocalId() : owner.localId;
        List<String> bases = new ArrayList<>();
        for (String base : splitTopLevel(match.group(2))) {
            if (!base.contains("=")) {
                bases.add(base);
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("decorators", List.copyOf(decorators));
        metadata.put("bases", bases);
        String signature = "class " + name + (bases.isEmpty() ? "" : "(" + String.join(", ", bases) + ")");

        int classId = context.result().addEntity(parentId, name, prefix + "." + name, "class",
            startLine, endLine, signature, docSummary(docstring(source, endLine)), metadata);
        for (String base : bases) {
            String baseName = baseTypeName(base);
            if (!baseName.isEmpty() && !"object".equals(baseName)) {
                context.result().addRelation(classId, resolveAlias(baseName, aliases), "inherits", startLine);
            }
        }
        return new Scope(indent, classId, prefix + "." + name, true, endLine);
    }

    private Scope addFunction(FileContext context, SourceText source, Matcher match, Deque<Scope> stack,
                              int indent, int startLine, int endLine, List<String> decorators) {
        Scope owner = stack.peek();
        boolean isAsync = match.group(1) != null;
        String name = match.group(2);
        String parameters = compact(match.group(3));
        String returnType = match.group(4) == null ? null : compact(match.group(4));
        String prefix = owner == null ? context.moduleName() : owner.qualifiedName;
        int parentId = owner == null ? context.moduleLocalId() : owner.localId;
        String kind = owner != null && owner.isClass ? "method" : "function";

        List<String> parameterNames = new ArrayList<>();
        for (String parameter : splitTopLevel(parameters)) {
            String parameterName = parameter.split("[:=]", 2)[0].replace("*", "").trim();
            if (!parameterName.isEmpty() && !"/".equals(parameterName)) {
                parameterNames.add(parameterName);
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("async", isAsync);
        metadata.put("decorators", List.copyOf(decorators));
        metadata.put("parameters", parameterNames);
        if (returnType != null) {
            metadata.put("returnType", returnType);
        }
        if (decorators.contains("staticmethod")) {
            metadata.put("static", true);
        }
        if (decorators.contains("classmethod")) {
            metadata.put("classmethod", true);
        }
        if (decorators.contains("property")) {
            metadata.put("property", true);
        }

        String signature = (isAsync ? "async " : "") + name + "(" + parameters + ")"
            + (returnType != null ? " -> " + returnType : "");
        int functionId = context.result().addEntity(parentId, name, prefix + "." + name, kind,
            startLine, endLine, signature, docSummary(docstring(source, endLine)), metadata);
        return new Scope(indent, functionId, prefix + "." + name, false, endLine);
    }

    private void addImports(FileContext context, String text, int line, Map<String, String> aliases) {
        Matcher from = FROM_IMPORT.matcher(text);
        if (from.find()) {
            String module = resolveRelative(from.group(1), context.moduleName());
            String names = from.group(2).replace("(", "").replace(")", "");
            for (String part : splitTopLevel(names)) {
                String[] aliasParts = part.split("\\s+as\\s+");
                String imported = aliasParts[0].trim();
                if ("*".equals(imported)) {
                    context.result().addRelation(context.moduleLocalId(), module, "imports", line,
                        Map.of("wildcard", true));
                    continue;
                }
                String target = module.isEmpty() ? imported : module + "." + imported;
                String alias = aliasParts.length > 1 ? aliasParts[1].trim() : imported;
                aliases.put(alias, target);
                context.result().addRelation(context.moduleLocalId(), target, "imports", line,
                    Map.of("alias", alias, "from", module));
            }
            return;
        }
        Matcher plain = IMPORT.matcher(text);
        if (plain.find()) {
            for (String part : splitTopLevel(plain.group(1))) {
                String[] aliasParts = part.split("\\s+as\\s+");
                String module = aliasParts[0].trim();
                if (aliasParts.length > 1) {
                    aliases.put(aliasParts[1].trim(), module);
                } else {
                    String root = module.contains(".") ? module.substring(0, module.indexOf('.')) : module;
                    aliases.putIfAbsent(root, root);
                }
                context.result().addRelation(context.moduleLocalId(), module, "imports", line,
                    aliasParts.length > 1 ? Map.of("alias", aliasParts[1].trim()) : Map.of());
            }
        }
    }

    /**
     * Resolves {@code from .x import y} style module references against the current module.
     */
    static String resolveRelative(String module, String currentModule) {
        if (!module.startsWith(".")) {
            return module;
        }
        int dots = 0;
        while (dots < module.length() && module.charAt(dots) == '.') {
            dots++;
        }
        String rest = module.substring(dots);
        List<String> packageParts = new ArrayList<>(List.of(currentModule.split("\\.")));
        for (int k = 0; k < dots && !packageParts.isEmpty(); k++) {
            packageParts.remove(packageParts.size() - 1);
        }
        String base = String.join(".", packageParts);
        if (rest.isEmpty()) {
            return base;
        }
        return base.isEmpty() ? rest : base + "." + rest;
    }

    private void addClassAttribute(FileContext context, String text, Scope owner, int startLine, int endLine) {
        Matcher attribute = ATTRIBUTE.matcher(text);
        String name = null;
        String type = null;
        if (attribute.find()) {
            name = attribute.group(1);
            type = attribute.group(2);
        } else {
            Matcher field = ANNOTATED_FIELD.matcher(text);
            if (field.find()) {
                name = field.group(1);
                type = field.group(2);
            }
        }
        if (name == null || KEYWORDS.contains(name)) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (type != null) {
            metadata.put("type", type.trim());
        }
        context.result().addEntity(owner.localId, name, owner.qualifiedName + "." + name, "variable",
            startLine, endLine, type != null ? name + ": " + type.trim() : name, null, metadata);
    }

    private void addCalls(FileContext context, SourceText source, int startLine, int endLine,
                          Deque<Scope> stack, Map<String, String> aliases, Set<String> moduleCalls) {
        Scope caller = null;
        Scope enclosingClass = null;
        for (Scope scope : stack) {
            if (!scope.isClass && caller == null) {
                caller = scope;
            }
            if (scope.isClass && enclosingClass == null) {
                enclosingClass = scope;
            }
        }
        int from = source.offsetOfLine(startLine);
        int to = source.offsetOfLine(endLine + 1);
        for (CallSite call : findCallSites(source, from, to, KEYWORDS, DECLARATION_KEYWORDS)) {
            String target = callTarget(call.name(), enclosingClass, aliases);
            if (target == null) {
                continue;
            }
            int sourceId = caller != null ? caller.localId
                : stack.isEmpty() ? context.moduleLocalId() : stack.peek().localId;
            Set<String> seen = caller != null ? caller.calledTargets
                : stack.isEmpty() ? moduleCalls : stack.peek().calledTargets;
            if (seen.add(target)) {
                context.result().addRelation(sourceId, target, "calls", source.lineOf(call.offset()));
            }
        }
    }

    private String callTarget(String name, Scope enclosingClass, Map<String, String> aliases) {
        String[] segments = name.split("\\.");
        String first = segments[0];
        if (("self".equals(first) || "cls".equals(first)) && segments.length > 1) {
            if (enclosingClass == null) {
                return null;
            }
            if (segments.length == 2) {
                return enclosingClass.qualifiedName + "." + segments[1];
            }
            return name.substring(first.length() + 1);
        }
        if (segments.length == 1 && BUILTINS.contains(first)) {
            return null;
        }
        return resolveAlias(name, aliases);
    }

    private String resolveAlias(String name, Map<String, String> aliases) {
        String first = name.contains(".") ? name.substring(0, name.indexOf('.')) : name;
        String target = aliases.get(first);
        if (target == null) {
            return name;
        }
        return name.contains(".") ? target + name.substring(first.length()) : target;
    }

    /**
     * Reads the docstring of a block whose header ends on {@code headerEndLine}.
     */
    private String docstring(SourceText source, int headerEndLine) {
        String content = source.content();
        int offset = source.offsetOfLine(headerEndLine + 1);
        while (offset < content.length() && Character.isWhitespace(content.charAt(offset))) {
            offset++;
        }
        if (offset < content.length() && "rRuU".indexOf(content.charAt(offset)) >= 0) {
            offset++;
        }
        for (String quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (content.startsWith(quote, offset)) {
                int end = content.indexOf(quote, offset + quote.length());
                if (end < 0) {
                    return null;
                }
                return content.substring(offset + quote.length(), end);
            }
        }
        return null;
    }

    private void close(FileContext context, Scope scope) {
        context.result().closeEntity(scope.localId, scope.lastLine);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static int bracketDelta(String line) {
        int delta = 0;
        for (int k = 0; k < line.length(); k++) {
            char c = line.charAt(k);
            if (c == '(' || c == '[' || c == '{') {
                delta++;
            } else if (c == ')' || c == ']' || c == '}') {
                delta--;
            }
        }
        return delta;
    }

    private static int indentOf(String line) {
        int width = 0;
        for (int k = 0; k < line.length(); k++) {
            char c = line.charAt(k);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else {
                break;
            }
        }
        return width;
    }
}
