package com.codegraph.core.extractor.impl.java;

import com.codegraph.core.extractor.base.BlockIndex;
import com.codegraph.core.extractor.base.FallbackParsingStrategy;
import com.codegraph.core.extractor.base.FileContext;
import com.codegraph.core.extractor.base.RegexPatterns;
import com.codegraph.core.extractor.base.SourceText;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Pattern-based recovery for Java files JavaParser rejects.
 *
 * <p>Recovers the package, imports, type declarations (with nesting and supertypes) and
 * method declarations directly inside type bodies. Calls are not recovered.
 */
class JavaFallbackParser implements FallbackParsingStrategy {

    private static final Set<String> NOT_A_TYPE = Set.of("new", "return", "else", "throw", "case");

    @Override
    public void parse(String content, FileContext context) {
        SourceText source = SourceText.of(content, SourceText.Syntax.C_LIKE);
        String masked = source.masked();
        String packageName = RegexPatterns.extractPackageName(masked);

        Matcher imports = RegexPatterns.IMPORT_PATTERN.matcher(masked);
        while (imports.find()) {
            boolean isStatic = imports.group(1) != null;
            boolean wildcard = imports.group(3) != null;
            String name = imports.group(2);
            String target = isStatic && !wildcard && name.contains(".")
                ? name.substring(0, name.lastIndexOf('.'))
                : name;
            context.result().addRelation(context.moduleLocalId(), target, "imports",
                source.lineOf(imports.start()), Map.of("static", isStatic, "wildcard", wildcard, "recovered", true));
        }

        BlockIndex types = new BlockIndex();
        Matcher declarations = RegexPatterns.TYPE_DECLARATION_PATTERN.matcher(masked);
        while (declarations.find()) {
            int open = declarations.end() - 1;
            int close = source.findClosing(open);
            int bodyEnd = close < 0 ? masked.length() : close;
            String name = declarations.group(2);

            Optional<BlockIndex.Block> enclosing = types.innermost(declarations.start());
            int parentId = enclosing.map(BlockIndex.Block::localId).orElse(context.moduleLocalId());
            String prefix = enclosing.map(BlockIndex.Block::qualifiedName).orElse(packageName);
            String qualifiedName = RegexPatterns.buildFullyQualifiedName(prefix, name);

            int typeId = context.result().addEntity(parentId, name, qualifiedName, declarations.group(1),
                source.lineOf(declarations.start()), source.lineOf(bodyEnd),
                declarations.group(0).replace("{", "").replaceAll("\\s+", " ").trim(), null,
                Map.of("recovered", true));
            types.add(new BlockIndex.Block(typeId, qualifiedName, true, declarations.start(), open, bodyEnd));

            addSupertypes(context, typeId, declarations.group(3), "extends", source.lineOf(declarations.start()));
            addSupertypes(context, typeId, declarations.group(4), "implements", source.lineOf(declarations.start()));
        }

        int[] depths = source.braceDepths();
        for (BlockIndex.Block type : types.blocks()) {
            int memberDepth = depths[type.bodyStart()] + 1;
            Matcher methods = RegexPatterns.METHOD_PATTERN.matcher(masked);
            methods.region(type.bodyStart() + 1, Math.max(type.bodyStart() + 1, type.bodyEnd()));
            while (methods.find()) {
                String returnType = methods.group(1).trim();
                String name = methods.group(2);
                if (depths[methods.start(2)] != memberDepth || NOT_A_TYPE.contains(returnType)) {
                    continue;
                }
                int open = methods.end() - 1;
                int close = source.findClosing(open);
                String typeName = type.qualifiedName().substring(type.qualifiedName().lastIndexOf('.') + 1);
                String kind = name.equals(typeName) ? "constructor" : "method";
                context.result().addEntity(type.localId(), name, type.qualifiedName() + "." + name, kind,
                    source.lineOf(methods.start(2)), source.lineOf(close < 0 ? masked.length() : close),
                    returnType + " " + name + "(" + methods.group(3).replaceAll("\\s+", " ").trim() + ")", null,
                    Map.of("recovered", true));
            }
        }
    }

    private void addSupertypes(FileContext context, int typeId, String list, String relation, int line) {
        if (list == null) {
            return;
        }
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : (list + ",").toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                String type = current.toString().trim();
                if (!type.isEmpty()) {
                    context.result().addRelation(typeId, type, relation, line);
                }
                current.setLength(0);
            } else if (depth == 0) {
                current.append(c);
            }
        }
    }
}
