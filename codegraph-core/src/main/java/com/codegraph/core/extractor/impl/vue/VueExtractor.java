package com.codegraph.core.extractor.impl.vue;

import com.codegraph.core.extractor.base.FileContext;
import com.codegraph.core.extractor.base.SourceText;
import com.codegraph.core.extractor.impl.javascript.JavaScriptExtractor;
import com.codegraph.core.model.Language;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Vue single-file components.
 *
 * <p>Each {@code .vue} file yields one component entity named after its {@code name} option
 * or, failing that, the file name in PascalCase. Script blocks are analyzed like JavaScript,
 * with top-level declarations owned by the component. On top of that the extractor reads:
 * <ul>
 *   <li>Options API members: props, data, computed, methods, lifecycle hooks, setup</li>
 *   <li>Locally registered components</li>
 *   <li>Composition API state ({@code ref}, {@code reactive}, {@code computed}) and {@code defineProps}</li>
 *   <li>Template usage of components (kebab-case tags map to PascalCase names)</li>
 *   <li>Template event handlers and interpolation calls</li>
 * </ul>
 */
public class VueExtractor extends JavaScriptExtractor {

    private static final Pattern TEMPLATE_OPEN = Pattern.compile("<template\\b[^>]*>");
    private static final Pattern SCRIPT_OPEN = Pattern.compile("<script\\b([^>]*)>");
    private static final Pattern OPTIONS_OBJECT = Pattern.compile(
        "\\bexport\\s+default\\s+(?:defineComponent\\s*\\(\\s*)?\\{|\\bdefineComponent\\s*\\(\\s*\\{");
    private static final Pattern MEMBER_KEY = Pattern.compile("^(async\\s+)?(?:get\\s+|set\\s+)?([A-Za-z_$][\\w$]*)");
    private static final Pattern QUOTED_KEY = Pattern.compile("^['\"]([^'\"]+)['\"]");
    private static final Pattern COMPOSITION_STATE = Pattern.compile(
        "\\b(?:const|let)\\s+([A-Za-z_$][\\w$]*)\\s*=\\s*(ref|shallowRef|reactive|shallowReactive|computed|toRef|toRefs)\\s*[(<]");
    private static final Pattern DEFINE_PROPS = Pattern.compile("\\bdefineProps\\s*(<|\\()");
    private static final Pattern TAG = Pattern.compile("<([A-Za-z][\\w-]*(?:\\.[A-Za-z][\\w-]*)?)");
    private static final Pattern EVENT_HANDLER = Pattern.compile(
        "(?:@|v-on:)[\\w.:-]+\\s*=\\s*\"\\s*([A-Za-z_$][\\w$]*)\\s*(?:\\(|\")");
    private static final Pattern INTERPOLATION = Pattern.compile("\\{\\{(.*?)}}", Pattern.DOTALL);
    private static final Pattern CALL_IN_EXPRESSION = Pattern.compile("(?<![\\w$.])([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern FUNCTION_VALUE = Pattern.compile("^(?:async\\s+)?function\\s*[\\w$]*\\s*\\(");
    private static final Pattern COMPONENT_NAME = Pattern.compile("^\\s*name\\s*:\\s*['\"]([^'\"]+)['\"]");

    private static final Set<String> LIFECYCLE_HOOKS = Set.of(
        "beforeCreate", "created", "beforeMount", "mounted", "beforeUpdate", "updated", "activated",
        "deactivated", "beforeUnmount", "unmounted", "beforeDestroy", "destroyed", "errorCaptured");

    private static final Set<String> BUILTIN_TAGS = Set.of(
        "template", "slot", "component", "transition", "transition-group", "keep-alive", "teleport", "suspense",
        "Transition", "TransitionGroup", "KeepAlive", "Teleport", "Suspense", "Component");

    /**
     * A member of an object literal.
     *
     * @param key member name
     * @param offset offset of the member's first character
     * @param end offset just past the member
     * @param bodyOpen opening brace of a function body or nested object, or -1
     * @param bodyEnd closing brace of that body, or the member end
     * @param parameters parameter text of a function value, or null
     */
    private record ObjectMember(String key, int offset, int end, int bodyOpen, int bodyEnd, String parameters) {
        boolean callable() {
            return parameters != null;
        }
    }

    @Override
    public String getId() {
        return "vue-sfc";
    }

    @Override
    public String getDisplayName() {
        return "Vue Single-File Component Extractor";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.VUE);
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("vue");
    }

    @Override
    public Language languageOf(String filePath) {
        return Language.VUE;
    }

    @Override
    protected void extract(String sourceText, FileContext context) {
        SourceText source = SourceText.of(sourceText, SourceText.Syntax.C_LIKE);
        String content = source.content();

        String componentName = findComponentName(content)
            .orElseGet(() -> pascalCase(simpleFileName(context.filePath())));
        String componentQn = context.qualify(componentName);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("framework", "vue");

        List<int[]> scripts = new ArrayList<>();
        Matcher scriptMatcher = SCRIPT_OPEN.matcher(content);
        while (scriptMatcher.find()) {
            int close = content.indexOf("</script>", scriptMatcher.end());
            if (close < 0) {
                context.result().addSyntaxError(source.lineOf(scriptMatcher.start()), "Missing closing </script> tag");
                close = content.length();
            }
            scripts.add(new int[] {scriptMatcher.end(), close});
            String attributes = scriptMatcher.group(1);
            if (attributes.matches("(?s).*\\bsetup\\b.*")) {
                metadata.put("scriptSetup", true);
            }
            if (attributes.matches("(?s).*\\blang\\s*=\\s*[\"']ts[\"'].*")) {
                metadata.put("scriptLang", "ts");
            }
        }

        int componentId = context.result().addEntity(context.moduleLocalId(), componentName, componentQn,
            "vue_component", 1, source.lineCount(), "<" + componentName + ">", null, metadata);

        Map<String, String> aliases = new LinkedHashMap<>();
        for (int[] script : scripts) {
            ScriptAnalysis analysis = analyzeScript(source, script[0], script[1], context, componentId, componentQn, false);
            aliases.putAll(analysis.aliases());
            collectRegisteredComponents(source, script[0], script[1], context, componentId, aliases);
            reportSyntaxErrors(source, script[0], script[1], context);
        }

        Matcher templateMatcher = TEMPLATE_OPEN.matcher(content);
        if (templateMatcher.find()) {
            int close = content.lastIndexOf("</template>");
            if (close < templateMatcher.end()) {
                context.result().addSyntaxError(source.lineOf(templateMatcher.start()), "Missing closing </template> tag");
                close = content.length();
            }
            collectTemplateUsages(source, templateMatcher.end(), close, context, componentId, componentQn, aliases);
        }
    }

    // ==================== Options and Composition API ====================

    @Override
    protected void collectFrameworkDeclarations(SourceText source, int from, int to, List<Declaration> declarations) {
        String masked = source.masked();
        Matcher options = OPTIONS_OBJECT.matcher(masked);
        options.region(from, to);
        if (options.find()) {
            int open = options.end() - 1;
            int close = source.findClosing(open);
            if (close > 0) {
                for (ObjectMember member : objectMembers(source, open, close)) {
                    collectOption(source, member, declarations);
                }
            }
        }

        for (MatchResult match : findMatches(COMPOSITION_STATE, masked, from, to)) {
            String api = match.group(2);
            String kind = "computed".equals(api) ? "computed" : "ref";
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("api", api);
            declarations.add(new Declaration(kind, match.group(1), match.start(), -1,
                statementEnd(masked, match.end(), to), false, match.group(1) + " = " + api + "()", metadata,
                List.of(), null));
        }

        for (MatchResult match : findMatches(DEFINE_PROPS, masked, from, to)) {
            int open = masked.indexOf('{', match.end() - 1);
            int arrayOpen = masked.indexOf('[', match.end() - 1);
            if (arrayOpen >= 0 && (open < 0 || arrayOpen < open) && "(".equals(match.group(1))) {
                open = arrayOpen;
            }
            if (open < 0 || open >= to) {
                continue;
            }
            int close = source.findClosing(open);
            if (close > 0) {
                addProps(source, open, close, declarations);
            }
        }
    }

    private void collectOption(SourceText source, ObjectMember member, List<Declaration> declarations) {
        String masked = source.masked();
        switch (member.key()) {
            case "props" -> {
                if (member.bodyOpen() >= 0) {
                    addProps(source, member.bodyOpen(), member.bodyEnd(), declarations);
                } else {
                    int arrayOpen = masked.indexOf('[', member.offset());
                    if (arrayOpen >= 0 && arrayOpen < member.end()) {
                        addProps(source, arrayOpen, source.findClosing(arrayOpen), declarations);
                    }
                }
            }
            case "data" -> {
                if (member.bodyOpen() < 0) {
                    return;
                }
                int returnAt = masked.indexOf("return", member.bodyOpen());
                int objectOpen = returnAt < 0 ? -1 : masked.indexOf('{', returnAt);
                if (objectOpen < 0 || objectOpen > member.bodyEnd()) {
                    objectOpen = masked.charAt(member.bodyOpen()) == '(' ? masked.indexOf('{', member.bodyOpen()) : -1;
                }
                if (objectOpen < 0) {
                    return;
                }
                for (ObjectMember field : objectMembers(source, objectOpen, source.findClosing(objectOpen))) {
                    declarations.add(new Declaration("data", field.key(), field.offset(), -1, field.end(), false,
                        field.key(), new LinkedHashMap<>(), List.of(), null));
                }
            }
            case "computed", "methods" -> {
                if (member.bodyOpen() < 0) {
                    return;
                }
                String kind = "computed".equals(member.key()) ? "computed" : "method";
                for (ObjectMember entry : objectMembers(source, member.bodyOpen(), member.bodyEnd())) {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    if (entry.callable()) {
                        metadata.put("parameters", parameterNames(entry.parameters()));
                    }
                    String signature = entry.key() + (entry.callable() ? "(" + compact(entry.parameters()) + ")" : "");
                    declarations.add(new Declaration(kind, entry.key(), entry.offset(), entry.bodyOpen(),
                        entry.bodyEnd(), false, signature, metadata, List.of(), null));
                }
            }
            default -> {
                if (!member.callable()) {
                    return;
                }
                boolean lifecycle = LIFECYCLE_HOOKS.contains(member.key());
                if (!lifecycle && !"setup".equals(member.key())) {
                    return;
                }
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("parameters", parameterNames(member.parameters()));
                if (lifecycle) {
                    metadata.put("lifecycle", true);
                }
                declarations.add(new Declaration("method", member.key(), member.offset(), member.bodyOpen(),
                    member.bodyEnd(), false, member.key() + "(" + compact(member.parameters()) + ")", metadata,
                    List.of(), null));
            }
        }
    }

    private void addProps(SourceText source, int open, int close, List<Declaration> declarations) {
        if (close < 0) {
            return;
        }
        String content = source.content();
        boolean array = source.masked().charAt(open) == '[';
        for (ObjectMember prop : objectMembers(source, open, close)) {
            String name = array ? cleanQuotes(content.substring(prop.offset(), prop.end()).trim()) : prop.key();
            if (name.isEmpty()) {
                continue;
            }
            declarations.add(new Declaration("prop", name, prop.offset(), -1, prop.end(), false, name,
                new LinkedHashMap<>(), List.of(), null));
        }
    }

    private void collectRegisteredComponents(SourceText source, int from, int to, FileContext context,
                                             int componentId, Map<String, String> aliases) {
        String masked = source.masked();
        Matcher options = OPTIONS_OBJECT.matcher(masked);
        options.region(from, to);
        if (!options.find()) {
            return;
        }
        int open = options.end() - 1;
        int close = source.findClosing(open);
        if (close < 0) {
            return;
        }
        for (ObjectMember member : objectMembers(source, open, close)) {
            if (!"components".equals(member.key()) || member.bodyOpen() < 0) {
                continue;
            }
            for (ObjectMember registration : objectMembers(source, member.bodyOpen(), member.bodyEnd())) {
                String text = masked.substring(registration.offset(), registration.end());
                int colon = text.indexOf(':');
                String value = colon >= 0 ? text.substring(colon + 1).trim() : registration.key();
                if (value.isEmpty()) {
                    continue;
                }
                context.result().addRelation(componentId, resolveAlias(value, aliases), "references",
                    source.lineOf(registration.offset()), Map.of("registeredAs", registration.key()));
            }
        }
    }

    // ==================== Template ====================

    private void collectTemplateUsages(SourceText source, int from, int to, FileContext context, int componentId,
                                       String componentQn, Map<String, String> aliases) {
        String content = source.content();
        Set<String> seen = new HashSet<>();
        for (MatchResult match : findMatches(TAG, content, from, to)) {
            String tag = match.group(1);
            if (BUILTIN_TAGS.contains(tag) || !(tag.contains("-") || Character.isUpperCase(tag.charAt(0)))) {
                continue;
            }
            String name = pascalCase(tag);
            String target = resolveAlias(name, aliases);
            if (seen.add("usage:" + target)) {
                context.result().addRelation(componentId, target, "template_usage", source.lineOf(match.start()),
                    Map.of("element", tag));
            }
        }

        List<MatchResult> handlerCalls = new ArrayList<>(findMatches(EVENT_HANDLER, content, from, to));
        for (MatchResult match : handlerCalls) {
            addTemplateCall(source, match.group(1), match.start(1), context, componentId, componentQn, aliases, seen);
        }
        for (MatchResult interpolation : findMatches(INTERPOLATION, content, from, to)) {
            Matcher call = CALL_IN_EXPRESSION.matcher(interpolation.group(1));
            while (call.find()) {
                addTemplateCall(source, call.group(1), interpolation.start(1) + call.start(1), context, componentId,
                    componentQn, aliases, seen);
            }
        }
    }

    private void addTemplateCall(SourceText source, String name, int offset, FileContext context, int componentId,
                                 String componentQn, Map<String, String> aliases, Set<String> seen) {
        String target = aliases.containsKey(name) ? resolveAlias(name, aliases) : componentQn + "." + name;
        if (seen.add("call:" + target)) {
            context.result().addRelation(componentId, target, "calls", source.lineOf(offset),
                Map.of("template", true));
        }
    }

    // ==================== Helpers ====================

    /**
     * Splits an object or array literal into its top-level members.
     */
    private List<ObjectMember> objectMembers(SourceText source, int open, int close) {
        List<ObjectMember> members = new ArrayList<>();
        if (open < 0 || close <= open) {
            return members;
        }
        String masked = source.masked();
        int depth = 0;
        int memberStart = open + 1;
        for (int i = open + 1; i <= close; i++) {
            char c = i == close ? ',' : masked.charAt(i);
            if (i < close && (c == '(' || c == '[' || c == '{')) {
                depth++;
            } else if (i < close && (c == ')' || c == ']' || c == '}')) {
                depth--;
            } else if (c == ',' && depth == 0) {
                int start = skipWhitespace(masked, memberStart);
                if (start < i) {
                    members.add(member(source, start, i));
                }
                memberStart = i + 1;
            }
        }
        return members;
    }

    private ObjectMember member(SourceText source, int start, int end) {
        String masked = source.masked();
        String text = masked.substring(start, end);
        String key = "";
        int keyEnd = start;
        Matcher keyMatcher = MEMBER_KEY.matcher(text);
        if (keyMatcher.find()) {
            key = keyMatcher.group(2);
            keyEnd = start + keyMatcher.end();
        } else {
            Matcher quoted = QUOTED_KEY.matcher(source.content().substring(start, end));
            if (quoted.find()) {
                key = quoted.group(1);
                keyEnd = start + quoted.end();
            }
        }

        int cursor = skipWhitespace(masked, keyEnd);
        if (cursor < end && masked.charAt(cursor) == '(') {
            return callableMember(source, key, start, end, cursor);
        }
        if (cursor < end && masked.charAt(cursor) == ':') {
            int value = skipWhitespace(masked, cursor + 1);
            String rest = masked.substring(value, end);
            if (rest.startsWith("{")) {
                return new ObjectMember(key, start, end, value, closingOrEnd(source, value, end + 1), null);
            }
            Matcher function = FUNCTION_VALUE.matcher(rest);
            if (function.find()) {
                return callableMember(source, key, start, end, value + function.end() - 1);
            }
            int arrow = rest.indexOf("=>");
            if (arrow >= 0 && rest.substring(0, arrow).trim().matches("(?:async\\s+)?(?:\\([^)]*\\)|[A-Za-z_$][\\w$]*)")) {
                String head = rest.substring(0, arrow).trim().replaceFirst("^async\\s+", "");
                String params = head.startsWith("(") ? head.substring(1, head.length() - 1) : head;
                int body = skipWhitespace(masked, value + arrow + 2);
                int bodyOpen = body < end && masked.charAt(body) == '{' ? body : -1;
                int bodyEnd = bodyOpen >= 0 ? closingOrEnd(source, bodyOpen, end + 1) : end;
                return new ObjectMember(key, start, end, bodyOpen, bodyEnd, params);
            }
        }
        return new ObjectMember(key, start, end, -1, end, null);
    }

    private ObjectMember callableMember(SourceText source, String key, int start, int end, int paramsOpen) {
        String masked = source.masked();
        int paramsClose = source.findClosing(paramsOpen);
        if (paramsClose < 0 || paramsClose > end) {
            return new ObjectMember(key, start, end, -1, end, "");
        }
        int bodyOpen = masked.indexOf('{', paramsClose);
        if (bodyOpen < 0 || bodyOpen >= end) {
            return new ObjectMember(key, start, end, -1, end, masked.substring(paramsOpen + 1, paramsClose));
        }
        return new ObjectMember(key, start, end, bodyOpen, closingOrEnd(source, bodyOpen, end + 1),
            masked.substring(paramsOpen + 1, paramsClose));
    }

    private static Optional<String> findComponentName(String content) {
        Matcher options = OPTIONS_OBJECT.matcher(content);
        if (!options.find()) {
            return Optional.empty();
        }
        for (String line : content.substring(options.end()).split("\n")) {
            Matcher name = COMPONENT_NAME.matcher(line);
            if (name.find()) {
                return Optional.of(pascalCase(name.group(1)));
            }
            if (line.trim().startsWith("}")) {
                break;
            }
        }
        return Optional.empty();
    }

    private static String simpleFileName(String filePath) {
        String name = filePath.substring(filePath.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Converts {@code user-card} or {@code user_card} to {@code UserCard}; names that are
     * already PascalCase are returned unchanged.
     */
    static String pascalCase(String name) {
        StringBuilder result = new StringBuilder();
        for (String part : name.split("[-_\\s]+")) {
            if (part.isEmpty()) {
                continue;
            }
            result.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
        }
        return result.toString();
    }
}
