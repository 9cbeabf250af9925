package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.core.CodeEntity;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.FileExtraction;
import com.purchasingpower.codegraph.exception.FileParsingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Python entity extractor built on tree-sitter.
 *
 * <p>Walks top-level statements only. Class bodies are walked with the class name
 * pushed on a stack so methods (and methods of nested classes) record the right
 * {@code parentClass}. Statements nested under {@code if}/{@code try} blocks are not entities.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class PythonSourceParser implements SourceParser {

    private static final String LANGUAGE = "python";
    private static final Set<String> PARAMETER_NODE_TYPES = Set.of(
            "identifier", "typed_parameter", "default_parameter", "typed_default_parameter");

    private final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        return parser;
    });

    @Override
    public String getLanguage() {
        return LANGUAGE;
    }

    @Override
    public boolean supports(String relativePath) {
        return relativePath.endsWith(".py");
    }

    @Override
    public FileExtraction parse(SourceFile file) {
        String path = ModulePaths.normalize(file.relativePath());
        String content = file.content() == null ? "" : file.content();

        TSTree tree = threadLocalParser.get().parseString(null, content);
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new FileParsingException(path, "parser returned no syntax tree");
        }
        if (root.hasError()) {
            throw new FileParsingException(path, "syntax error near line " + firstErrorLine(root));
        }

        FileWalk walk = new FileWalk(path, content);
        walk.walkModule(root);

        log.debug("🐍 Parsed {}: {} entities, {} imports", path, walk.entities.size(), walk.imports.size());

        return FileExtraction.builder()
                .filePath(path)
                .qualifiedModule(walk.module)
                .packageName(ModulePaths.packageOf(path))
                .language(LANGUAGE)
                .content(content)
                .entities(walk.entities)
                .imports(walk.imports)
                .build();
    }

    private int firstErrorLine(TSNode node) {
        if ("ERROR".equals(node.getType()) || node.isMissing()) {
            return node.getStartPoint().getRow() + 1;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.hasError() || child.isMissing()) {
                return firstErrorLine(child);
            }
        }
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Per-file walk state. Lives for a single {@link #parse(SourceFile)} call.
     */
    private static final class FileWalk {

        private final String filePath;
        private final String module;
        private final byte[] source;
        private final Deque<String> classStack = new ArrayDeque<>();
        private final Map<String, String> instanceMap = new HashMap<>();
        private final List<CodeEntity> entities = new ArrayList<>();
        private final Set<String> imports = new LinkedHashSet<>();

        private FileWalk(String filePath, String content) {
            this.filePath = filePath;
            this.module = ModulePaths.moduleOf(filePath);
            this.source = content.getBytes(StandardCharsets.UTF_8);
        }

        void walkModule(TSNode root) {
            String moduleDoc = docstringOf(root);
            if (moduleDoc != null) {
                entities.add(docstringEntity(module + "::docstring", "module", module, moduleDoc));
            }

            for (int i = 0; i < root.getNamedChildCount(); i++) {
                TSNode stmt = root.getNamedChild(i);
                switch (stmt.getType()) {
                    case "import_statement" -> handleImport(stmt);
                    case "import_from_statement" -> handleImportFrom(stmt);
                    case "expression_statement" -> handleAssignment(stmt);
                    case "class_definition" -> handleClass(stmt, List.of());
                    case "function_definition" -> handleFunction(stmt, List.of());
                    case "decorated_definition" -> handleDecorated(stmt);
                    default -> {
                        // other top-level statements carry no entities
                    }
                }
            }
        }

        private void handleDecorated(TSNode node) {
            List<String> decorators = new ArrayList<>();
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if ("decorator".equals(child.getType())) {
                    decorators.add(stripAt(text(child)));
                }
            }
            TSNode definition = node.getChildByFieldName("definition");
            if (definition == null || definition.isNull()) {
                return;
            }
            if ("class_definition".equals(definition.getType())) {
                handleClass(definition, decorators);
            } else if ("function_definition".equals(definition.getType())) {
                handleFunction(definition, decorators);
            }
        }

        private void handleClass(TSNode node, List<String> decorators) {
            String name = text(node.getChildByFieldName("name"));
            TSNode body = node.getChildByFieldName("body");
            String docstring = docstringOf(body);
            String ownerPath = ownerPath(name);

            if (docstring != null) {
                entities.add(docstringEntity(module + "::" + ownerPath + "::docstring", "class", ownerPath, docstring));
            }

            entities.add(CodeEntity.builder()
                    .kind(EntityKind.CLASS)
                    .name(name)
                    .qualifiedModule(module)
                    .filePath(filePath)
                    .lineNumber(lineOf(node))
                    .docstring(docstring)
                    .decorators(decorators)
                    .bases(basesOf(node))
                    .parentClass(classStack.peek())
                    .build());

            classStack.push(name);
            try {
                if (body != null && !body.isNull()) {
                    for (int i = 0; i < body.getNamedChildCount(); i++) {
                        TSNode member = body.getNamedChild(i);
                        switch (member.getType()) {
                            case "function_definition" -> handleFunction(member, List.of());
                            case "class_definition" -> handleClass(member, List.of());
                            case "decorated_definition" -> handleDecorated(member);
                            default -> {
                                // class attributes are not entities
                            }
                        }
                    }
                }
            } finally {
                classStack.pop();
            }
        }

        private void handleFunction(TSNode node, List<String> decorators) {
            String name = text(node.getChildByFieldName("name"));
            TSNode body = node.getChildByFieldName("body");
            String docstring = docstringOf(body);
            String parentClass = classStack.peek();
            EntityKind kind = parentClass != null ? EntityKind.METHOD : EntityKind.FUNCTION;
            String ownerPath = ownerPath(name);

            List<String> params = parametersOf(node.getChildByFieldName("parameters"));
            TSNode returnNode = node.getChildByFieldName("return_type");
            String returnType = returnNode == null || returnNode.isNull() ? null : text(returnNode);

            Set<String> calls = new LinkedHashSet<>();
            if (body != null && !body.isNull()) {
                collectCalls(body, calls);
            }

            if (docstring != null) {
                entities.add(docstringEntity(module + "::" + ownerPath + "::docstring", "function", ownerPath, docstring));
            }
            for (String param : params) {
                entities.add(CodeEntity.builder()
                        .kind(EntityKind.PARAMETER)
                        .name(name + "." + param)
                        .qualifiedModule(module)
                        .filePath(filePath)
                        .lineNumber(lineOf(node))
                        .owner(ownerPath)
                        .build());
            }
            if (returnType != null) {
                entities.add(CodeEntity.builder()
                        .kind(EntityKind.RETURN_TYPE)
                        .name(returnType)
                        .qualifiedModule(module)
                        .filePath(filePath)
                        .lineNumber(lineOf(node))
                        .owner(ownerPath)
                        .build());
            }

            entities.add(CodeEntity.builder()
                    .kind(kind)
                    .name(name)
                    .qualifiedModule(module)
                    .filePath(filePath)
                    .lineNumber(lineOf(node))
                    .docstring(docstring)
                    .decorators(decorators)
                    .parameters(params)
                    .returnType(returnType)
                    .async(isAsync(node))
                    .parentClass(parentClass)
                    .calls(calls)
                    .build());
        }

        /**
         * Collects directly invoked names: {@code foo()} gives foo, {@code obj.bar()} gives bar.
         * Does not enter nested function or class bodies.
         */
        private void collectCalls(TSNode node, Set<String> calls) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                String type = child.getType();
                if ("function_definition".equals(type) || "class_definition".equals(type)) {
                    continue;
                }
                if ("call".equals(type)) {
                    TSNode function = child.getChildByFieldName("function");
                    if (function != null && !function.isNull()) {
                        addCallName(function, calls);
                    }
                }
                collectCalls(child, calls);
            }
        }

        private void addCallName(TSNode function, Set<String> calls) {
            if ("identifier".equals(function.getType())) {
                calls.add(text(function));
            } else if ("attribute".equals(function.getType())) {
                TSNode attribute = function.getChildByFieldName("attribute");
                if (attribute != null && !attribute.isNull()) {
                    calls.add(text(attribute));
                }
                TSNode object = function.getChildByFieldName("object");
                if (object != null && !object.isNull() && "identifier".equals(object.getType())) {
                    String className = instanceMap.get(text(object));
                    if (className != null) {
                        calls.add(className);
                    }
                }
            }
        }

        private void handleImport(TSNode node) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if ("dotted_name".equals(child.getType())) {
                    imports.add(text(child));
                } else if ("aliased_import".equals(child.getType())) {
                    TSNode name = child.getChildByFieldName("name");
                    if (name != null && !name.isNull()) {
                        imports.add(text(name));
                    }
                }
            }
        }

        private void handleImportFrom(TSNode node) {
            TSNode moduleName = node.getChildByFieldName("module_name");
            if (moduleName == null || moduleName.isNull()) {
                return;
            }
            String name = text(moduleName).replaceFirst("^\\.+", "");
            if (!name.isEmpty()) {
                imports.add(name);
            }
        }

        /**
         * Tracks {@code app = FastAPI()} so later {@code app.get()} calls also record FastAPI.
         */
        private void handleAssignment(TSNode stmt) {
            if (stmt.getNamedChildCount() == 0) {
                return;
            }
            TSNode assignment = stmt.getNamedChild(0);
            if (!"assignment".equals(assignment.getType())) {
                return;
            }
            TSNode left = assignment.getChildByFieldName("left");
            TSNode right = assignment.getChildByFieldName("right");
            if (left == null || left.isNull() || right == null || right.isNull()) {
                return;
            }
            if ("identifier".equals(left.getType()) && "call".equals(right.getType())) {
                TSNode function = right.getChildByFieldName("function");
                if (function != null && !function.isNull() && "identifier".equals(function.getType())) {
                    instanceMap.put(text(left), text(function));
                }
            }
        }

        private List<String> basesOf(TSNode classNode) {
            List<String> bases = new ArrayList<>();
            TSNode superclasses = classNode.getChildByFieldName("superclasses");
            if (superclasses == null || superclasses.isNull()) {
                return bases;
            }
            for (int i = 0; i < superclasses.getNamedChildCount(); i++) {
                TSNode base = superclasses.getNamedChild(i);
                // metaclass=... and other keyword arguments are not bases
                if (!"keyword_argument".equals(base.getType()) && !"comment".equals(base.getType())) {
                    bases.add(text(base));
                }
            }
            return bases;
        }

        private List<String> parametersOf(TSNode parameters) {
            List<String> names = new ArrayList<>();
            if (parameters == null || parameters.isNull()) {
                return names;
            }
            for (int i = 0; i < parameters.getNamedChildCount(); i++) {
                TSNode param = parameters.getNamedChild(i);
                String type = param.getType();
                if (!PARAMETER_NODE_TYPES.contains(type)) {
                    continue;
                }
                if ("identifier".equals(type)) {
                    names.add(text(param));
                } else if ("typed_parameter".equals(type)) {
                    TSNode first = param.getNamedChild(0);
                    if (first != null && !first.isNull() && "identifier".equals(first.getType())) {
                        names.add(text(first));
                    }
                } else {
                    TSNode name = param.getChildByFieldName("name");
                    if (name != null && !name.isNull()) {
                        names.add(text(name));
                    }
                }
            }
            return names;
        }

        private boolean isAsync(TSNode functionNode) {
            for (int i = 0; i < functionNode.getChildCount(); i++) {
                TSNode child = functionNode.getChild(i);
                if ("async".equals(child.getType())) {
                    return true;
                }
                if ("def".equals(child.getType())) {
                    return false;
                }
            }
            return false;
        }

        /**
         * The docstring of a module or block: a string literal as its first statement.
         */
        private String docstringOf(TSNode block) {
            if (block == null || block.isNull() || block.getNamedChildCount() == 0) {
                return null;
            }
            TSNode first = block.getNamedChild(0);
            if (!"expression_statement".equals(first.getType()) || first.getNamedChildCount() == 0) {
                return null;
            }
            TSNode literal = first.getNamedChild(0);
            if (!"string".equals(literal.getType())) {
                return null;
            }
            return cleanDocstring(text(literal));
        }

        private CodeEntity docstringEntity(String name, String scope, String owner, String content) {
            return CodeEntity.builder()
                    .kind(EntityKind.DOCSTRING)
                    .name(name)
                    .qualifiedModule(module)
                    .filePath(filePath)
                    .docstring(content)
                    .docstringScope(scope)
                    .owner(owner)
                    .build();
        }

        private String ownerPath(String name) {
            if (classStack.isEmpty()) {
                return name;
            }
            List<String> path = new ArrayList<>(classStack);
            Collections.reverse(path);
            path.add(name);
            return String.join(".", path);
        }

        private String text(TSNode node) {
            if (node == null || node.isNull()) {
                return "";
            }
            int start = node.getStartByte();
            int end = Math.min(node.getEndByte(), source.length);
            return new String(source, start, end - start, StandardCharsets.UTF_8);
        }

        private int lineOf(TSNode node) {
            return node.getStartPoint().getRow() + 1;
        }

        private static String stripAt(String decorator) {
            String trimmed = decorator.strip();
            return trimmed.startsWith("@") ? trimmed.substring(1).strip() : trimmed;
        }
    }

    /**
     * Strips string prefixes and quotes, then removes common indentation of the
     * continuation lines.
     */
    static String cleanDocstring(String literal) {
        String body = literal.replaceFirst("^[rRbBuUfF]+", "");
        if (body.startsWith("\"\"\"") || body.startsWith("'''")) {
            body = body.substring(3, Math.max(3, body.length() - 3));
        } else if (body.length() >= 2 && (body.startsWith("\"") || body.startsWith("'"))) {
            body = body.substring(1, body.length() - 1);
        }

        String[] lines = body.split("\n", -1);
        int indent = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (!line.isBlank()) {
                indent = Math.min(indent, line.length() - line.stripLeading().length());
            }
        }
        StringBuilder cleaned = new StringBuilder(lines[0].strip());
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            cleaned.append('\n').append(line.isBlank() ? "" : line.substring(Math.min(indent, line.length())).stripTrailing());
        }
        return cleaned.toString().strip();
    }
}
