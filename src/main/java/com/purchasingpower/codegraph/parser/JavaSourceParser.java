package com.purchasingpower.codegraph.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithImplements;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.purchasingpower.codegraph.core.CodeEntity;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.FileExtraction;
import com.purchasingpower.codegraph.exception.FileParsingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Java entity extractor built on JavaParser.
 *
 * <p>Every type declaration (class, interface, enum, record, nested or not) becomes a Class entity
 * and every method a Method entity. Annotations are recorded as decorators and Javadoc as the docstring.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class JavaSourceParser implements SourceParser {

    private static final String LANGUAGE = "java";
    private static final Set<String> ASYNC_RETURN_TYPES = Set.of("CompletableFuture", "CompletionStage", "Future", "Mono", "Flux");

    private final ThreadLocal<JavaParser> threadLocalParser = ThreadLocal.withInitial(() ->
            new JavaParser(new ParserConfiguration()
                    .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)));

    @Override
    public String getLanguage() {
        return LANGUAGE;
    }

    @Override
    public boolean supports(String relativePath) {
        return relativePath.endsWith(".java");
    }

    @Override
    public FileExtraction parse(SourceFile file) {
        String path = ModulePaths.normalize(file.relativePath());
        String content = file.content() == null ? "" : file.content();

        ParseResult<CompilationUnit> result = threadLocalParser.get().parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String detail = result.getProblems().stream()
                    .findFirst()
                    .map(Problem::getVerboseMessage)
                    .orElse("unparseable compilation unit");
            throw new FileParsingException(path, detail);
        }
        CompilationUnit cu = result.getResult().get();

        TypeWalk walk = new TypeWalk(path);
        for (TypeDeclaration<?> type : cu.getTypes()) {
            walk.handleType(type);
        }

        Set<String> imports = cu.getImports().stream()
                .filter(imp -> !imp.isStatic())
                .map(ImportDeclaration::getNameAsString)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        log.debug("☕ Parsed {}: {} entities, {} imports", path, walk.entities.size(), imports.size());

        return FileExtraction.builder()
                .filePath(path)
                .qualifiedModule(walk.module)
                .packageName(ModulePaths.packageOf(path))
                .language(LANGUAGE)
                .content(content)
                .entities(walk.entities)
                .imports(imports)
                .build();
    }

    private static final class TypeWalk {

        private final String filePath;
        private final String module;
        private final Deque<String> classStack = new ArrayDeque<>();
        private final List<CodeEntity> entities = new ArrayList<>();

        private TypeWalk(String filePath) {
            this.filePath = filePath;
            this.module = ModulePaths.moduleOf(filePath);
        }

        void handleType(TypeDeclaration<?> type) {
            String name = type.getNameAsString();
            String ownerPath = ownerPath(name);
            String docstring = javadocOf(type);
            int line = lineOf(type);

            if (docstring != null) {
                entities.add(docstringEntity(module + "::" + ownerPath + "::docstring", "class", ownerPath, docstring));
            }

            entities.add(CodeEntity.builder()
                    .kind(EntityKind.CLASS)
                    .name(name)
                    .qualifiedModule(module)
                    .filePath(filePath)
                    .lineNumber(line)
                    .docstring(docstring)
                    .decorators(decoratorsOf(type.getAnnotations()))
                    .bases(basesOf(type))
                    .parentClass(classStack.peek())
                    .build());

            classStack.push(name);
            try {
                for (BodyDeclaration<?> member : type.getMembers()) {
                    if (member instanceof MethodDeclaration method) {
                        handleMethod(method);
                    } else if (member instanceof TypeDeclaration<?> nested) {
                        handleType(nested);
                    }
                }
            } finally {
                classStack.pop();
            }
        }

        private void handleMethod(MethodDeclaration method) {
            String name = method.getNameAsString();
            String ownerPath = ownerPath(name);
            String docstring = javadocOf(method);
            int line = lineOf(method);
            List<String> params = method.getParameters().stream()
                    .map(p -> p.getNameAsString())
                    .collect(Collectors.toList());
            String returnType = method.getType().isVoidType() ? null : method.getTypeAsString();
            List<String> decorators = decoratorsOf(method.getAnnotations());

            if (docstring != null) {
                entities.add(docstringEntity(module + "::" + ownerPath + "::docstring", "function", ownerPath, docstring));
            }
            for (String param : params) {
                entities.add(CodeEntity.builder()
                        .kind(EntityKind.PARAMETER)
                        .name(name + "." + param)
                        .qualifiedModule(module)
                        .filePath(filePath)
                        .lineNumber(line)
                        .owner(ownerPath)
                        .build());
            }
            if (returnType != null) {
                entities.add(CodeEntity.builder()
                        .kind(EntityKind.RETURN_TYPE)
                        .name(returnType)
                        .qualifiedModule(module)
                        .filePath(filePath)
                        .lineNumber(line)
                        .owner(ownerPath)
                        .build());
            }

            entities.add(CodeEntity.builder()
                    .kind(EntityKind.METHOD)
                    .name(name)
                    .qualifiedModule(module)
                    .filePath(filePath)
                    .lineNumber(line)
                    .docstring(docstring)
                    .decorators(decorators)
                    .parameters(params)
                    .returnType(returnType)
                    .async(isAsync(method, decorators))
                    .parentClass(classStack.peek())
                    .calls(callsOf(method))
                    .build());
        }

        private Set<String> callsOf(MethodDeclaration method) {
            Set<String> calls = new LinkedHashSet<>();
            method.findAll(MethodCallExpr.class).forEach(call -> calls.add(call.getNameAsString()));
            // new Foo() counts as a call to Foo
            method.findAll(ObjectCreationExpr.class).forEach(creation -> calls.add(creation.getType().getNameAsString()));
            return calls;
        }

        private boolean isAsync(MethodDeclaration method, List<String> decorators) {
            if (decorators.stream().anyMatch(d -> d.equals("Async") || d.startsWith("Async("))) {
                return true;
            }
            if (method.getType().isClassOrInterfaceType()) {
                return ASYNC_RETURN_TYPES.contains(method.getType().asClassOrInterfaceType().getNameAsString());
            }
            return false;
        }

        private List<String> basesOf(TypeDeclaration<?> type) {
            List<String> bases = new ArrayList<>();
            if (type instanceof ClassOrInterfaceDeclaration cls) {
                cls.getExtendedTypes().forEach(t -> bases.add(t.toString()));
            }
            if (type instanceof NodeWithImplements<?> implementing) {
                for (ClassOrInterfaceType t : implementing.getImplementedTypes()) {
                    bases.add(t.toString());
                }
            }
            return bases;
        }

        private List<String> decoratorsOf(List<AnnotationExpr> annotations) {
            return annotations.stream()
                    .map(ann -> ann.toString().substring(1))
                    .collect(Collectors.toList());
        }

        private String javadocOf(NodeWithJavadoc<?> node) {
            return node.getJavadoc()
                    .map(javadoc -> javadoc.getDescription().toText().strip())
                    .filter(text -> !text.isEmpty())
                    .orElse(null);
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
            List<String> path = new ArrayList<>(classStack);
            Collections.reverse(path);
            path.add(name);
            return String.join(".", path);
        }

        private static int lineOf(com.github.javaparser.ast.Node node) {
            return node.getBegin().map(pos -> pos.line).orElse(0);
        }
    }
}
