package com.cpparchitect.core.extractor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.model.ClassKind;
import com.cpparchitect.core.model.ControlFlowNode;
import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.LineRange;
import com.cpparchitect.core.syntax.SourceText;
import com.cpparchitect.core.syntax.SyntaxNode;

import static com.cpparchitect.core.syntax.CppNodeTypes.*;

/**
 * Extracts function and class definitions from one C++ syntax tree.
 *
 * <p>The tree is walked once in pre-order with an explicit stack, so deeply nested source
 * cannot exhaust the call stack. Each stack frame carries the enclosing scope
 * (namespaces and classes joined with {@value #SCOPE_SEPARATOR}) and the owning class.
 *
 * <p><b>Recognized definitions:</b>
 * <ul>
 *   <li>Function definitions, including out-of-line member definitions such as
 *       {@code void Shape::draw() {}} whose scope names the owning class</li>
 *   <li>Class and struct definitions with a body; inline member function definitions
 *       become methods of the class and are listed as functions as well</li>
 *   <li>Namespaces (named, nested {@code a::b} and anonymous), {@code extern "C"} blocks
 *       and templates are traversed transparently</li>
 * </ul>
 *
 * <p>A definition that lacks a name or body is skipped and counted; the walk continues
 * with its siblings and children. Forward declarations are not definitions and are
 * ignored without counting.
 */
public class EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    /** Separator between scope components of qualified names */
    public static final String SCOPE_SEPARATOR = "::";

    // Skip reasons
    public static final String SKIP_MISSING_DECLARATOR = "missing-declarator";
    public static final String SKIP_MISSING_NAME = "missing-name";
    public static final String SKIP_MISSING_BODY = "missing-body";

    private static final String DEFAULT_RETURN_TYPE = "void";
    private static final int MAX_DECLARATOR_NESTING = 8;

    private final ControlFlowBuilder controlFlowBuilder;

    public EntityExtractor() {
        this(new ControlFlowBuilder());
    }

    public EntityExtractor(ControlFlowBuilder controlFlowBuilder) {
        this.controlFlowBuilder = Objects.requireNonNull(controlFlowBuilder, "controlFlowBuilder must not be null");
    }

    /**
     * Extracts all definitions of one file.
     *
     * @param root root of the file's syntax tree
     * @param source source text the tree was parsed from
     * @param fileId identifier recorded on every entity
     * @return functions and classes in pre-order, plus skip counts
     */
    public FileExtraction extract(SyntaxNode root, SourceText source, String fileId) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(fileId, "fileId must not be null");

        Walk walk = new Walk(source, fileId);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, "", null));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            SyntaxNode node = frame.node();

            switch (node.type()) {
                case FUNCTION_DEFINITION -> {
                    walk.visitFunction(frame);
                    pushChildren(stack, node.children(), frame.scope(), null);
                }
                case CLASS_SPECIFIER, STRUCT_SPECIFIER -> walk.visitClass(frame, stack);
                case NAMESPACE_DEFINITION -> visitNamespace(frame, source, stack);
                default -> pushChildren(stack, node.children(), frame.scope(), frame.owningClass());
            }
        }

        log.debug("Extracted {} functions and {} classes from {}", walk.functions.size(), walk.classes.size(), fileId);
        return new FileExtraction(fileId, walk.functions, walk.classes, walk.skipped, walk.errors);
    }

    private void visitNamespace(Frame frame, SourceText source, Deque<Frame> stack) {
        SyntaxNode node = frame.node();
        String scope = node.childByField(FIELD_NAME)
            .map(name -> qualify(frame.scope(), SourceText.condense(source.of(name)).replace(" ", "")))
            .orElse(frame.scope());
        node.childByField(FIELD_BODY)
            .ifPresent(body -> pushChildren(stack, body.children(), scope, null));
    }

    /**
     * Pushes named children in reverse so that they pop in source order.
     */
    private static void pushChildren(Deque<Frame> stack, List<SyntaxNode> children, String scope, String owningClass) {
        for (int i = children.size() - 1; i >= 0; i--) {
            SyntaxNode child = children.get(i);
            if (child.isNamed()) {
                stack.push(new Frame(child, scope, owningClass));
            }
        }
    }

    static String qualify(String scope, String name) {
        return scope.isEmpty() ? name : scope + SCOPE_SEPARATOR + name;
    }

    /**
     * Stack frame of the pre-order walk.
     */
    private record Frame(SyntaxNode node, String scope, String owningClass) {}

    /**
     * Byte span used to recognize method nodes already parsed with their class.
     */
    private record Span(int startByte, int endByte) {
        static Span of(SyntaxNode node) {
            return new Span(node.startByte(), node.endByte());
        }
    }

    /**
     * Mutable state of one extraction.
     */
    private final class Walk {

        private final SourceText source;
        private final String fileId;
        private final List<CppFunction> functions = new ArrayList<>();
        private final List<CppClass> classes = new ArrayList<>();
        private final Map<String, Integer> skipped = new LinkedHashMap<>();
        private final List<String> errors = new ArrayList<>();
        private final Map<Span, CppFunction> parsedMethods = new HashMap<>();

        private Walk(SourceText source, String fileId) {
            this.source = source;
            this.fileId = fileId;
        }

        private void visitFunction(Frame frame) {
            CppFunction method = parsedMethods.remove(Span.of(frame.node()));
            if (method != null) {
                functions.add(method);
                return;
            }
            parseFunction(frame.node(), frame.scope(), frame.owningClass(), true).ifPresent(functions::add);
        }

        private void visitClass(Frame frame, Deque<Frame> stack) {
            SyntaxNode node = frame.node();
            Optional<SyntaxNode> body = node.childByField(FIELD_BODY);
            if (body.isEmpty()) {
                // Forward declaration or elaborated type
                return;
            }
            Optional<SyntaxNode> nameNode = node.childByField(FIELD_NAME);
            if (nameNode.isEmpty()) {
                skip(SKIP_MISSING_NAME, node, "class without name");
                pushChildren(stack, body.get().children(), frame.scope(), frame.owningClass());
                return;
            }

            String name = SourceText.condense(source.of(nameNode.get()));
            String qualifiedName = qualify(frame.scope(), name);

            List<CppFunction> methods = new ArrayList<>();
            for (SyntaxNode member : body.get().children()) {
                memberDefinition(member).ifPresent(definition ->
                    parseFunction(definition, qualifiedName, name, false).ifPresent(method -> {
                        methods.add(method);
                        parsedMethods.put(Span.of(definition), method);
                    }));
            }

            classes.add(new CppClass(
                name,
                qualifiedName,
                node.is(STRUCT_SPECIFIER) ? ClassKind.STRUCT : ClassKind.CLASS,
                baseClasses(node),
                methods,
                fileId,
                lineRange(node)
            ));
            pushChildren(stack, body.get().children(), qualifiedName, name);
        }

        private Optional<SyntaxNode> memberDefinition(SyntaxNode member) {
            if (member.is(FUNCTION_DEFINITION)) {
                return Optional.of(member);
            }
            if (member.is(TEMPLATE_DECLARATION)) {
                return member.firstChildOfType(FUNCTION_DEFINITION);
            }
            return Optional.empty();
        }

        private List<String> baseClasses(SyntaxNode classNode) {
            List<String> bases = new ArrayList<>();
            for (SyntaxNode clause : classNode.childrenOfType(BASE_CLASS_CLAUSE)) {
                for (SyntaxNode base : clause.childrenOfType(TYPE_IDENTIFIER, QUALIFIED_IDENTIFIER, TEMPLATE_TYPE)) {
                    bases.add(SourceText.condense(source.of(base)));
                }
            }
            return bases;
        }

        /**
         * Parses a function definition.
         *
         * @param node the definition
         * @param scope enclosing scope
         * @param owningClass enclosing class name, or null
         * @param countSkips whether a failed parse is counted; methods are parsed twice on failure
         * @return the function, or empty if the definition has an unexpected shape
         */
        private Optional<CppFunction> parseFunction(SyntaxNode node, String scope, String owningClass, boolean countSkips) {
            Optional<SyntaxNode> declarator = functionDeclarator(node);
            if (declarator.isEmpty()) {
                return skipIf(countSkips, SKIP_MISSING_DECLARATOR, node, "function definition without declarator");
            }
            Optional<SyntaxNode> nameNode = declarator.get().childByField(FIELD_DECLARATOR)
                .or(() -> declarator.get().firstChildOfType(IDENTIFIER, FIELD_IDENTIFIER, QUALIFIED_IDENTIFIER,
                    DESTRUCTOR_NAME, OPERATOR_NAME));
            if (nameNode.isEmpty() || !isNameNode(nameNode.get())) {
                return skipIf(countSkips, SKIP_MISSING_NAME, node, "function definition without name");
            }
            Optional<SyntaxNode> body = node.childByField(FIELD_BODY);
            if (body.isEmpty()) {
                return skipIf(countSkips, SKIP_MISSING_BODY, node, "function definition without body");
            }

            String name;
            String qualifiedName;
            String owner = owningClass;
            SyntaxNode nameSyntax = nameNode.get();
            if (nameSyntax.is(QUALIFIED_IDENTIFIER)) {
                SyntaxNode innermost = innermostName(nameSyntax);
                name = SourceText.condense(source.of(innermost));
                String prefix = SourceText.condense(source.slice(nameSyntax.startByte(), innermost.startByte()));
                prefix = prefix.endsWith(SCOPE_SEPARATOR) ? prefix.substring(0, prefix.length() - 2) : prefix;
                qualifiedName = qualify(scope, prefix.isEmpty() ? name : prefix + SCOPE_SEPARATOR + name);
                if (owner == null && !prefix.isEmpty()) {
                    int last = prefix.lastIndexOf(SCOPE_SEPARATOR);
                    owner = last < 0 ? prefix : prefix.substring(last + 2);
                }
            } else {
                name = SourceText.condense(source.of(nameSyntax));
                qualifiedName = qualify(scope, name);
            }

            String returnType = node.childByField(FIELD_TYPE)
                .map(type -> SourceText.condense(source.of(type)))
                .orElse(DEFAULT_RETURN_TYPE);
            List<ControlFlowNode> controlFlow = controlFlowBuilder.build(body.get(), source);

            return Optional.of(new CppFunction(
                name,
                qualifiedName,
                returnType,
                parameters(declarator.get()),
                fileId,
                lineRange(node),
                owner,
                callees(body.get()),
                controlFlow
            ));
        }

        private boolean isNameNode(SyntaxNode node) {
            return node.is(IDENTIFIER) || node.is(FIELD_IDENTIFIER) || node.is(QUALIFIED_IDENTIFIER)
                || node.is(DESTRUCTOR_NAME) || node.is(OPERATOR_NAME);
        }

        private SyntaxNode innermostName(SyntaxNode qualified) {
            SyntaxNode current = qualified;
            while (current.is(QUALIFIED_IDENTIFIER)) {
                Optional<SyntaxNode> next = current.childByField(FIELD_NAME);
                if (next.isEmpty()) {
                    break;
                }
                current = next.get();
            }
            return current;
        }

        /**
         * Unwraps pointer and reference declarators down to the function declarator.
         */
        private Optional<SyntaxNode> functionDeclarator(SyntaxNode definition) {
            Optional<SyntaxNode> current = definition.childByField(FIELD_DECLARATOR);
            for (int i = 0; i < MAX_DECLARATOR_NESTING && current.isPresent(); i++) {
                SyntaxNode node = current.get();
                if (node.is(FUNCTION_DECLARATOR)) {
                    return current;
                }
                current = node.childByField(FIELD_DECLARATOR)
                    .or(() -> node.children().stream()
                        .filter(child -> child.isNamed() && child.type().endsWith("declarator"))
                        .findFirst());
            }
            return Optional.empty();
        }

        private List<String> parameters(SyntaxNode declarator) {
            List<String> parameters = new ArrayList<>();
            declarator.childByField(FIELD_PARAMETERS).ifPresent(list -> {
                for (SyntaxNode parameter : list.childrenOfType(PARAMETER_DECLARATION,
                        OPTIONAL_PARAMETER_DECLARATION, VARIADIC_PARAMETER_DECLARATION)) {
                    parameters.add(source.of(parameter));
                }
            });
            return parameters;
        }

        /**
         * Collects callee texts of all call expressions in the body, in pre-order.
         */
        private List<String> callees(SyntaxNode body) {
            List<String> callees = new ArrayList<>();
            Deque<SyntaxNode> stack = new ArrayDeque<>();
            stack.push(body);
            while (!stack.isEmpty()) {
                SyntaxNode node = stack.pop();
                if (node.is(CALL_EXPRESSION)) {
                    node.childByField(FIELD_FUNCTION)
                        .map(function -> SourceText.condense(source.of(function)))
                        .filter(text -> !text.isEmpty())
                        .ifPresent(callees::add);
                }
                List<SyntaxNode> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    if (children.get(i).isNamed()) {
                        stack.push(children.get(i));
                    }
                }
            }
            return callees;
        }

        private LineRange lineRange(SyntaxNode node) {
            return new LineRange(node.startLine(), node.endLine());
        }

        private Optional<CppFunction> skipIf(boolean count, String reason, SyntaxNode node, String message) {
            if (count) {
                skip(reason, node, message);
            }
            return Optional.empty();
        }

        private void skip(String reason, SyntaxNode node, String message) {
            skipped.merge(reason, 1, Integer::sum);
            String error = fileId + ":" + node.startLine() + ": " + message;
            log.debug("Skipping entity: {}", error);
            if (errors.size() < 10) {
                errors.add(error);
            }
        }
    }
}
