package com.cpparchitect.core.generator.impl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.cpparchitect.core.generator.TextSanitizer;
import com.cpparchitect.core.graph.CallGraph;
import com.cpparchitect.core.graph.FlowchartAssembler;
import com.cpparchitect.core.graph.InheritanceGraph;
import com.cpparchitect.core.model.CallEdge;
import com.cpparchitect.core.model.ClassKind;
import com.cpparchitect.core.model.ControlFlowNode;
import com.cpparchitect.core.model.ControlFlowNode.Call;
import com.cpparchitect.core.model.ControlFlowNode.Conditional;
import com.cpparchitect.core.model.ControlFlowNode.Loop;
import com.cpparchitect.core.model.ControlFlowNode.LoopKind;
import com.cpparchitect.core.model.ControlFlowNode.Return;
import com.cpparchitect.core.model.ControlFlowNode.Statement;
import com.cpparchitect.core.model.ControlFlowNode.Switch;
import com.cpparchitect.core.model.ControlFlowNode.SwitchCase;
import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityId;
import com.cpparchitect.core.model.InheritanceEdge;
import com.cpparchitect.core.model.SourceUnit;

/**
 * Writes activity-flow (PlantUML) documents.
 *
 * <p>Every source-derived text passes through the sanitizer; constructs are emitted in
 * open/close pairs with two-space indentation per nesting level.
 */
final class ActivityDocumentWriter {

    // Document frame
    private static final String START_UML = "@startuml";
    private static final String END_UML = "@enduml";
    private static final String INDENT = "  ";

    // Branch labels
    private static final String YES = "yes";
    private static final String NO = "no";
    private static final String DONE = "done";

    // Placeholder activities
    private static final String LOOP_BODY = "loop body";
    private static final String CASE_BODY = "handle case";
    private static final String NO_FUNCTIONS = "No functions found";
    private static final String NO_FILES = "No source files found";
    private static final String NO_CLASSES = "No classes found";

    /** Methods listed per class before the rest is summarized */
    static final int MAX_METHODS_PER_CLASS = 10;

    /** Callees listed in a call-graph note */
    static final int MAX_CALLEES_PER_NOTE = 5;

    private final TextSanitizer sanitizer;

    ActivityDocumentWriter(TextSanitizer sanitizer) {
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
    }

    /**
     * Writes the control-flow diagram of one function.
     */
    String functionFlow(CppFunction function) {
        Document doc = new Document();
        doc.open("Function Flow - " + function.qualifiedName());
        appendSkin(doc);
        doc.line("start");
        doc.activity(sanitizer.label(function.qualifiedName()));
        doc.line("note right");
        doc.indented(() -> {
            doc.line("Returns " + sanitizer.label(function.returnType()));
            doc.line(function.parameters().size() + " parameter(s)");
        });
        doc.line("end note");
        if (function.controlFlow().isEmpty()) {
            doc.activity(sanitizer.label(FlowchartAssembler.EMPTY_BODY_LABEL));
        } else {
            appendFlow(doc, function.controlFlow());
        }
        doc.line("stop");
        return doc.close();
    }

    /**
     * Writes a call-graph overview: up to {@code maxSideBySide} functions as parallel
     * fork branches, each with its resolved callees and control flow.
     */
    String callGraph(CallGraph callGraph, int maxSideBySide) {
        Document doc = new Document();
        doc.open(callGraph.isReachability() ? "Call Graph from " + callGraph.entryPoint() : "Call Graph");
        appendSkin(doc);
        doc.line("start");

        List<CppFunction> candidates = overviewCandidates(callGraph);
        List<CppFunction> shown = candidates.subList(0, Math.min(maxSideBySide, candidates.size()));
        Map<EntityId, Set<String>> callees = resolvedCallees(callGraph);

        if (shown.isEmpty()) {
            doc.activity(sanitizer.label(NO_FUNCTIONS));
        } else if (shown.size() == 1) {
            appendOverviewBranch(doc, shown.get(0), callees);
        } else {
            doc.line("fork");
            for (int i = 0; i < shown.size(); i++) {
                if (i > 0) {
                    doc.line("fork again");
                }
                CppFunction function = shown.get(i);
                doc.indented(() -> appendOverviewBranch(doc, function, callees));
            }
            doc.line("end fork");
        }
        int hidden = candidates.size() - shown.size();
        if (hidden > 0) {
            doc.activity(sanitizer.label("+" + hidden + " more functions"));
        }
        doc.line("stop");
        return doc.close();
    }

    /**
     * Writes the module structure: one partition per directory listing its files.
     */
    String moduleStructure(Map<String, List<SourceUnit>> filesByDirectory) {
        Document doc = new Document();
        doc.open("Module Structure");
        doc.line("start");
        if (filesByDirectory.isEmpty()) {
            doc.activity(sanitizer.label(NO_FILES));
        }
        for (Map.Entry<String, List<SourceUnit>> entry : filesByDirectory.entrySet()) {
            doc.line("partition \"" + sanitizer.label(entry.getKey()) + "\" {");
            doc.indented(() -> entry.getValue().forEach(unit -> doc.activity(sanitizer.label(unit.fileName()))));
            doc.line("}");
        }
        doc.line("stop");
        return doc.close();
    }

    /**
     * Writes a class diagram with inheritance arrows for resolved base classes.
     */
    String classDiagram(InheritanceGraph inheritance) {
        Document doc = new Document();
        doc.open("Class Hierarchy");
        doc.line("skinparam classAttributeIconSize 0");
        if (inheritance.classes().isEmpty()) {
            doc.line("note \"" + sanitizer.label(NO_CLASSES) + "\" as N1");
            return doc.close();
        }

        NodeIdAllocator ids = new NodeIdAllocator();
        for (CppClass cppClass : inheritance.classes()) {
            String id = ids.idFor(cppClass.id().toString());
            String stereotype = cppClass.kind() == ClassKind.STRUCT ? " <<struct>>" : "";
            doc.line("class \"" + sanitizer.label(cppClass.qualifiedName()) + "\" as " + id + stereotype + " {");
            doc.indented(() -> appendMembers(doc, cppClass));
            doc.line("}");
        }
        for (InheritanceEdge edge : inheritance.edges()) {
            doc.line(ids.idFor(edge.sourceId().toString()) + " <|-- " + ids.idFor(edge.targetId().toString()));
        }
        return doc.close();
    }

    /**
     * Writes the minimal fallback document: one activity between start and stop.
     */
    String singleActivity(String title, String label) {
        Document doc = new Document();
        doc.open(title);
        doc.line("start");
        doc.activity(sanitizer.label(label));
        doc.line("stop");
        return doc.close();
    }

    private void appendMembers(Document doc, CppClass cppClass) {
        List<CppFunction> methods = cppClass.methods();
        for (CppFunction method : methods.subList(0, Math.min(MAX_METHODS_PER_CLASS, methods.size()))) {
            String signature = method.name() + "(" + String.join(", ", method.parameters()) + ")";
            doc.line("+" + sanitizer.label(signature) + " : " + sanitizer.label(method.returnType()));
        }
        int remaining = methods.size() - MAX_METHODS_PER_CLASS;
        if (remaining > 0) {
            doc.line(".. " + remaining + " more methods ..");
        }
    }

    private List<CppFunction> overviewCandidates(CallGraph callGraph) {
        if (callGraph.isReachability()) {
            return callGraph.functions();
        }
        List<CppFunction> withFlow = callGraph.functions().stream()
            .filter(function -> !function.controlFlow().isEmpty())
            .toList();
        return withFlow.isEmpty() ? callGraph.functions() : withFlow;
    }

    private static Map<EntityId, Set<String>> resolvedCallees(CallGraph callGraph) {
        Map<EntityId, String> names = new LinkedHashMap<>();
        callGraph.functions().forEach(function -> names.put(function.id(), function.qualifiedName()));
        Map<EntityId, Set<String>> callees = new LinkedHashMap<>();
        for (CallEdge edge : callGraph.edges()) {
            String target = names.getOrDefault(edge.targetId(), edge.targetId().qualifiedName());
            callees.computeIfAbsent(edge.sourceId(), k -> new LinkedHashSet<>()).add(target);
        }
        return callees;
    }

    private void appendOverviewBranch(Document doc, CppFunction function, Map<EntityId, Set<String>> callees) {
        doc.activity(sanitizer.label(function.qualifiedName()));
        Set<String> targets = callees.getOrDefault(function.id(), Set.of());
        if (!targets.isEmpty()) {
            List<String> listed = new ArrayList<>(targets);
            StringBuilder text = new StringBuilder("calls ")
                .append(String.join(", ", listed.subList(0, Math.min(MAX_CALLEES_PER_NOTE, listed.size()))));
            if (listed.size() > MAX_CALLEES_PER_NOTE) {
                text.append(" and ").append(listed.size() - MAX_CALLEES_PER_NOTE).append(" more");
            }
            String note = sanitizer.label(text.toString());
            doc.line("note right");
            doc.indented(() -> doc.line(note));
            doc.line("end note");
        }
        appendFlow(doc, function.controlFlow());
    }

    private void appendFlow(Document doc, List<ControlFlowNode> nodes) {
        for (ControlFlowNode node : nodes) {
            appendNode(doc, node);
        }
    }

    private void appendNode(Document doc, ControlFlowNode node) {
        if (node instanceof Conditional conditional) {
            doc.line("if (" + sanitizer.condition(conditional.condition()) + ") then (" + YES + ")");
            doc.indented(() -> appendFlow(doc, conditional.thenBranch()));
            if (conditional.hasElse()) {
                doc.line("else (" + NO + ")");
                doc.indented(() -> appendFlow(doc, conditional.elseBranch()));
            }
            doc.line("endif");
        } else if (node instanceof Loop loop) {
            appendLoop(doc, loop);
        } else if (node instanceof Switch switchNode) {
            appendSwitch(doc, switchNode);
        } else if (node instanceof Return ret) {
            String text = ret.expression().isEmpty() ? "return" : "return " + ret.expression();
            doc.activity(sanitizer.label(text));
        } else if (node instanceof Call call) {
            doc.activity(sanitizer.label(call.callee() + "()"));
        } else if (node instanceof Statement statement) {
            doc.activity(sanitizer.label(statement.excerpt()));
        }
    }

    private void appendLoop(Document doc, Loop loop) {
        String condition = sanitizer.condition(loop.condition());
        if (loop.kind() == LoopKind.DO_WHILE) {
            doc.line("repeat");
            doc.indented(() -> appendBodyOrPlaceholder(doc, loop.body(), LOOP_BODY));
            doc.line("repeat while (" + condition + ") is (" + YES + ")");
        } else {
            doc.line("while (" + condition + ") is (" + YES + ")");
            doc.indented(() -> appendBodyOrPlaceholder(doc, loop.body(), LOOP_BODY));
            doc.line("endwhile (" + DONE + ")");
        }
    }

    private void appendSwitch(Document doc, Switch switchNode) {
        String selector = sanitizer.condition(switchNode.selector());
        if (switchNode.cases().isEmpty()) {
            doc.activity(sanitizer.label("switch " + selector));
            return;
        }
        doc.line("switch (" + selector + ")");
        for (SwitchCase switchCase : switchNode.cases()) {
            doc.line("case (" + sanitizer.label(caseText(switchCase.label())) + ")");
            doc.indented(() -> appendBodyOrPlaceholder(doc, switchCase.body(), CASE_BODY));
        }
        doc.line("endswitch");
    }

    private static String caseText(String label) {
        return label.startsWith("case ") ? label.substring("case ".length()) : label;
    }

    private void appendBodyOrPlaceholder(Document doc, List<ControlFlowNode> body, String placeholder) {
        if (body.isEmpty()) {
            doc.activity(sanitizer.label(placeholder));
        } else {
            appendFlow(doc, body);
        }
    }

    private void appendSkin(Document doc) {
        doc.line("skinparam activity {");
        doc.indented(() -> {
            doc.line("BackgroundColor #B4E7CE");
            doc.line("BorderColor #2C5F2D");
            doc.line("DiamondBackgroundColor #FFD966");
            doc.line("DiamondBorderColor #CC9900");
            doc.line("StartColor #4A90E2");
            doc.line("EndColor #E74C3C");
        });
        doc.line("}");
    }

    /**
     * Line buffer with nesting-aware indentation.
     */
    private final class Document {
        private final StringBuilder sb = new StringBuilder();
        private int depth;

        void open(String title) {
            sb.append(START_UML).append('\n');
            sb.append("title ").append(sanitizer.label(title)).append('\n');
        }

        void line(String text) {
            sb.append(INDENT.repeat(depth)).append(text).append('\n');
        }

        void activity(String sanitizedLabel) {
            line(":" + sanitizedLabel + ";");
        }

        void indented(Runnable body) {
            depth++;
            try {
                body.run();
            } finally {
                depth--;
            }
        }

        String close() {
            sb.append(END_UML).append('\n');
            return sb.toString();
        }
    }
}
