package com.codegraph.core.extractor.impl.java;

import com.codegraph.core.extractor.base.AbstractJavaParserExtractor;
import com.codegraph.core.extractor.base.FileContext;
import com.codegraph.core.model.Language;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts Java structure from a full JavaParser syntax tree.
 *
 * <p>Reports the package, imports (single-type, wildcard and static), classes, interfaces,
 * enums, records and annotation types including nested and local classes, fields, methods
 * and constructors with annotations and modifiers as metadata, {@code extends}/{@code implements}
 * edges, method calls and object creations. Call targets are qualified through the import
 * table and the declared types of fields, parameters and locals when possible.
 *
 * <p>Unparseable files fall back to {@link JavaFallbackParser}.
 */
public class JavaExtractor extends AbstractJavaParserExtractor {

    private static final Set<String> LANG_TYPES = Set.of(
        "String", "Object", "Integer", "Long", "Short", "Byte", "Double", "Float", "Boolean",
        "Character", "Number", "Void", "Class", "StringBuilder", "Math", "System", "Thread",
        "Exception", "RuntimeException", "Throwable", "Error", "Iterable", "Comparable", "Enum",
        "Record", "Override", "Deprecated", "FunctionalInterface", "SuppressWarnings");

    private final JavaFallbackParser fallbackParser = new JavaFallbackParser();

    @Override
    public String getId() {
        return "java-ast";
    }

    @Override
    public String getDisplayName() {
        return "Java AST Extractor";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.JAVA);
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("java");
    }

    @Override
    protected void extract(String sourceText, FileContext context) {
        parseWithFallback(sourceText, context, cu -> new CompilationUnitWalker(cu, context).walk(), fallbackParser);
    }

    /**
     * Walks one compilation unit. Holds the import table used to qualify type names.
     */
    private final class CompilationUnitWalker {
        private final CompilationUnit cu;
        private final FileContext context;
        private final String packageName;
        private final Map<String, String> importedTypes = new HashMap<>();

        CompilationUnitWalker(CompilationUnit cu, FileContext context) {
            this.cu = cu;
            this.context = context;
            this.packageName = packageName(cu);
        }

        void walk() {
            for (ImportDeclaration importDeclaration : cu.getImports()) {
                addImport(importDeclaration);
            }
            for (TypeDeclaration<?> type : cu.getTypes()) {
                addType(type, context.moduleLocalId(), packageName);
            }
        }

        private void addImport(ImportDeclaration importDeclaration) {
            String name = importDeclaration.getNameAsString();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("static", importDeclaration.isStatic());
            metadata.put("wildcard", importDeclaration.isAsterisk());

            String target = name;
            if (importDeclaration.isStatic() && !importDeclaration.isAsterisk() && name.contains(".")) {
                metadata.put("member", name.substring(name.lastIndexOf('.') + 1));
                target = name.substring(0, name.lastIndexOf('.'));
            }
            if (!importDeclaration.isAsterisk() && !importDeclaration.isStatic()) {
                importedTypes.put(name.substring(name.lastIndexOf('.') + 1), name);
            }
            context.result().addRelation(context.moduleLocalId(), target, "imports",
                beginLine(importDeclaration), metadata);
        }

        private void addType(TypeDeclaration<?> type, int parentId, String prefix) {
            String name = type.getNameAsString();
            String qualifiedName = prefix.isEmpty() ? name : prefix + "." + name;
            String kind = kindOf(type);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("modifiers", modifierNames(type));
            metadata.put("annotations", annotationNames(type));
            if (type instanceof ClassOrInterfaceDeclaration declaration && !declaration.getTypeParameters().isEmpty()) {
                metadata.put("typeParameters", declaration.getTypeParameters().stream()
                    .map(Node::toString).toList());
            }

            int typeId = context.result().addEntity(parentId, name, qualifiedName, kind,
                beginLine(type), endLine(type), typeSignature(type, kind),
                javadocText(type).map(JavaExtractor.this::docSummary).orElse(null), metadata);

            addSupertypes(type, typeId);

            if (type instanceof EnumDeclaration enumDeclaration) {
                for (EnumConstantDeclaration constant : enumDeclaration.getEntries()) {
                    context.result().addEntity(typeId, constant.getNameAsString(),
                        qualifiedName + "." + constant.getNameAsString(), "enum_constant",
                        beginLine(constant), endLine(constant), constant.getNameAsString(), null, Map.of());
                }
            }
            if (type instanceof RecordDeclaration record) {
                for (Parameter component : record.getParameters()) {
                    context.result().addEntity(typeId, component.getNameAsString(),
                        qualifiedName + "." + component.getNameAsString(), "record_component",
                        beginLine(component), endLine(component),
                        component.getType().asString() + " " + component.getNameAsString(), null, Map.of());
                }
            }

            Map<String, String> fieldTypes = new HashMap<>();
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member instanceof FieldDeclaration field) {
                    addField(field, typeId, qualifiedName, fieldTypes);
                }
            }
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member instanceof MethodDeclaration method) {
                    addCallable(method, typeId, qualifiedName, method.getNameAsString(), "method", fieldTypes);
                } else if (member instanceof ConstructorDeclaration constructor) {
                    addCallable(constructor, typeId, qualifiedName, constructor.getNameAsString(), "constructor", fieldTypes);
                } else if (member instanceof TypeDeclaration<?> nested) {
                    addType(nested, typeId, qualifiedName);
                }
            }
        }

        private String kindOf(TypeDeclaration<?> type) {
            if (type instanceof ClassOrInterfaceDeclaration declaration) {
                return declaration.isInterface() ? "interface" : "class";
            }
            if (type instanceof EnumDeclaration) {
                return "enum";
            }
            if (type instanceof RecordDeclaration) {
                return "record";
            }
            if (type instanceof AnnotationDeclaration) {
                return "annotation";
            }
            return "class";
        }

        private String typeSignature(TypeDeclaration<?> type, String kind) {
            StringBuilder signature = new StringBuilder();
            List<String> modifiers = modifierNames(type);
            if (!modifiers.isEmpty()) {
                signature.append(String.join(" ", modifiers)).append(' ');
            }
            signature.append(kind).append(' ').append(type.getNameAsString());
            if (type instanceof ClassOrInterfaceDeclaration declaration) {
                if (!declaration.getTypeParameters().isEmpty()) {
                    signature.append(declaration.getTypeParameters().stream()
                        .map(Node::toString).collect(Collectors.joining(", ", "<", ">")));
                }
                appendTypeList(signature, " extends ", declaration.getExtendedTypes());
                appendTypeList(signature, " implements ", declaration.getImplementedTypes());
            } else if (type instanceof EnumDeclaration enumDeclaration) {
                appendTypeList(signature, " implements ", enumDeclaration.getImplementedTypes());
            } else if (type instanceof RecordDeclaration record) {
                signature.append(record.getParameters().stream()
                    .map(Node::toString).collect(Collectors.joining(", ", "(", ")")));
                appendTypeList(signature, " implements ", record.getImplementedTypes());
            }
            return signature.toString();
        }

        private void appendTypeList(StringBuilder signature, String keyword, NodeList<ClassOrInterfaceType> types) {
            if (!types.isEmpty()) {
                signature.append(keyword).append(types.stream()
                    .map(ClassOrInterfaceType::asString).collect(Collectors.joining(", ")));
            }
        }

        private void addSupertypes(TypeDeclaration<?> type, int typeId) {
            if (type instanceof ClassOrInterfaceDeclaration declaration) {
                for (ClassOrInterfaceType extended : declaration.getExtendedTypes()) {
                    context.result().addRelation(typeId, qualifyType(extended.getNameWithScope()), "extends",
                        beginLine(extended));
                }
                for (ClassOrInterfaceType implemented : declaration.getImplementedTypes()) {
                    context.result().addRelation(typeId, qualifyType(implemented.getNameWithScope()), "implements",
                        beginLine(implemented));
                }
            } else if (type instanceof EnumDeclaration enumDeclaration) {
                for (ClassOrInterfaceType implemented : enumDeclaration.getImplementedTypes()) {
                    context.result().addRelation(typeId, qualifyType(implemented.getNameWithScope()), "implements",
                        beginLine(implemented));
                }
            } else if (type instanceof RecordDeclaration record) {
                for (ClassOrInterfaceType implemented : record.getImplementedTypes()) {
                    context.result().addRelation(typeId, qualifyType(implemented.getNameWithScope()), "implements",
                        beginLine(implemented));
                }
            }
        }

        private void addField(FieldDeclaration field, int typeId, String typeName, Map<String, String> fieldTypes) {
            for (VariableDeclarator variable : field.getVariables()) {
                String name = variable.getNameAsString();
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("modifiers", modifierNames(field));
                metadata.put("annotations", annotationNames(field));
                metadata.put("type", variable.getType().asString());

                int fieldId = context.result().addEntity(typeId, name, typeName + "." + name, "field",
                    beginLine(variable), endLine(field), variable.getType().asString() + " " + name,
                    javadocText(field).map(JavaExtractor.this::docSummary).orElse(null), metadata);

                String referenced = referencedType(variable.getType());
                if (referenced != null) {
                    fieldTypes.put(name, referenced);
                    context.result().addRelation(fieldId, referenced, "references", beginLine(variable));
                }
            }
        }

        private void addCallable(CallableDeclaration<?> callable, int typeId, String typeName, String name,
                                 String kind, Map<String, String> fieldTypes) {
            String qualifiedName = typeName + "." + name;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("modifiers", modifierNames(callable));
            metadata.put("annotations", annotationNames(callable));
            metadata.put("parameters", callable.getParameters().stream()
                .map(parameter -> parameter.getNameAsString()).toList());
            if (!callable.getThrownExceptions().isEmpty()) {
                metadata.put("throws", callable.getThrownExceptions().stream()
                    .map(Type::asString).toList());
            }
            String returnType = null;
            if (callable instanceof MethodDeclaration method) {
                returnType = method.getType().asString();
                metadata.put("returnType", returnType);
            }

            int callableId = context.result().addEntity(typeId, name, qualifiedName, kind,
                beginLine(callable), endLine(callable), callableSignature(callable, returnType),
                javadocText(callable).map(JavaExtractor.this::docSummary).orElse(null), metadata);

            Map<String, String> variableTypes = new HashMap<>(fieldTypes);
            for (Parameter parameter : callable.getParameters()) {
                String referenced = referencedType(parameter.getType());
                if (referenced != null) {
                    variableTypes.put(parameter.getNameAsString(), referenced);
                }
            }
            callable.findAll(VariableDeclarator.class).forEach(local -> {
                String referenced = referencedType(local.getType());
                if (referenced != null) {
                    variableTypes.put(local.getNameAsString(), referenced);
                }
            });

            for (MethodCallExpr call : callable.findAll(MethodCallExpr.class)) {
                if (isInsideLocalType(call, callable)) {
                    continue;
                }
                Map<String, Object> callMetadata = new LinkedHashMap<>();
                call.getScope().ifPresent(scope -> callMetadata.put("receiver", scope.toString()));
                context.result().addRelation(callableId, callTarget(call, typeName, variableTypes), "calls",
                    beginLine(call), callMetadata);
            }
            for (ObjectCreationExpr creation : callable.findAll(ObjectCreationExpr.class)) {
                if (isInsideLocalType(creation, callable)) {
                    continue;
                }
                context.result().addRelation(callableId, qualifyType(creation.getType().getNameWithScope()),
                    "instantiates", beginLine(creation));
            }
            for (LocalClassDeclarationStmt local : callable.findAll(LocalClassDeclarationStmt.class)) {
                addType(local.getClassDeclaration(), callableId, qualifiedName);
            }
        }

        private boolean isInsideLocalType(Node node, Node callable) {
            Node current = node.getParentNode().orElse(null);
            while (current != null && current != callable) {
                if (current instanceof LocalClassDeclarationStmt) {
                    return true;
                }
                current = current.getParentNode().orElse(null);
            }
            return false;
        }

        private String callableSignature(CallableDeclaration<?> callable, String returnType) {
            String parameters = callable.getParameters().stream()
                .map(parameter -> parameter.getType().asString() + " " + parameter.getNameAsString())
                .collect(Collectors.joining(", "));
            StringBuilder signature = new StringBuilder();
            if (returnType != null) {
                signature.append(returnType).append(' ');
            }
            signature.append(callable.getNameAsString()).append('(').append(parameters).append(')');
            if (!callable.getThrownExceptions().isEmpty()) {
                signature.append(" throws ").append(callable.getThrownExceptions().stream()
                    .map(Type::asString).collect(Collectors.joining(", ")));
            }
            return signature.toString();
        }

        /**
         * Qualifies a call: {@code this.x()} and {@code x()} stay in the declaring type,
         * calls on typed variables or imported types are qualified with that type.
         */
        private String callTarget(MethodCallExpr call, String typeName, Map<String, String> variableTypes) {
            String method = call.getNameAsString();
            if (call.getScope().isEmpty()) {
                return typeName + "." + method;
            }
            Expression scope = call.getScope().get();
            if (scope.isThisExpr()) {
                return typeName + "." + method;
            }
            if (scope.isNameExpr()) {
                String variable = scope.asNameExpr().getNameAsString();
                if (variableTypes.containsKey(variable)) {
                    return variableTypes.get(variable) + "." + method;
                }
                if (Character.isUpperCase(variable.charAt(0))) {
                    return qualifyType(variable) + "." + method;
                }
                return variable + "." + method;
            }
            if (scope.isFieldAccessExpr() && scope.asFieldAccessExpr().getScope().isThisExpr()) {
                String field = scope.asFieldAccessExpr().getNameAsString();
                if (variableTypes.containsKey(field)) {
                    return variableTypes.get(field) + "." + method;
                }
            }
            return method;
        }

        private String referencedType(Type type) {
            Type element = type.getElementType();
            if (!element.isClassOrInterfaceType()) {
                return null;
            }
            String name = element.asClassOrInterfaceType().getNameWithScope();
            if (LANG_TYPES.contains(name)) {
                return null;
            }
            return qualifyType(name);
        }

        private String qualifyType(String name) {
            String first = name.contains(".") ? name.substring(0, name.indexOf('.')) : name;
            String imported = importedTypes.get(first);
            if (imported != null) {
                return name.contains(".") ? imported + name.substring(first.length()) : imported;
            }
            return name;
        }
    }
}
