package com.cpparchitect.core.index;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.graph.CallGraph;
import com.cpparchitect.core.graph.GraphAssembler;
import com.cpparchitect.core.model.CallEdge;
import com.cpparchitect.core.model.ControlFlowNode;
import com.cpparchitect.core.model.ControlFlowNode.Call;
import com.cpparchitect.core.model.ControlFlowNode.Conditional;
import com.cpparchitect.core.model.ControlFlowNode.Loop;
import com.cpparchitect.core.model.ControlFlowNode.Return;
import com.cpparchitect.core.model.ControlFlowNode.Statement;
import com.cpparchitect.core.model.ControlFlowNode.Switch;
import com.cpparchitect.core.model.ControlFlowNode.SwitchCase;
import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.ExtractionStatistics;
import com.cpparchitect.core.model.RegisterStatistics;
import com.cpparchitect.core.model.SourceUnit;
import com.cpparchitect.core.model.UnresolvedReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Exports an entity register as a JSON document.
 *
 * <p>The document lists files, functions with their control-flow trees, classes, the
 * resolved whole-program call edges, unresolved references and statistics. Field order
 * is fixed, so identical registers export identical text.
 */
public class RegisterExporter {

    private static final Logger log = LoggerFactory.getLogger(RegisterExporter.class);

    /** Default export file name */
    public static final String DEFAULT_FILE_NAME = "entities.json";

    private final ObjectMapper objectMapper;
    private final GraphAssembler graphAssembler = new GraphAssembler();

    public RegisterExporter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Builds the JSON tree of a register.
     *
     * @param register the entity register
     * @return root object
     */
    public ObjectNode toTree(EntityRegister register) {
        Objects.requireNonNull(register, "register must not be null");
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode files = root.putArray("files");
        register.sourceUnits().stream().map(SourceUnit::fileId).forEach(files::add);

        ArrayNode functions = root.putArray("functions");
        register.functions().forEach(function -> functions.add(functionNode(function)));

        ArrayNode classes = root.putArray("classes");
        for (CppClass cppClass : register.classes()) {
            ObjectNode node = classes.addObject();
            node.put("name", cppClass.name());
            node.put("qualifiedName", cppClass.qualifiedName());
            node.put("kind", cppClass.kind().name());
            node.put("file", cppClass.fileId());
            node.put("startLine", cppClass.lines().startLine());
            node.put("endLine", cppClass.lines().endLine());
            ArrayNode bases = node.putArray("baseClasses");
            cppClass.baseClasses().forEach(bases::add);
            ArrayNode methods = node.putArray("methods");
            cppClass.methods().forEach(method -> methods.add(method.qualifiedName()));
        }

        CallGraph callGraph = graphAssembler.callGraph(register);
        ArrayNode callEdges = root.putArray("callEdges");
        for (CallEdge edge : callGraph.edges()) {
            ObjectNode node = callEdges.addObject();
            node.put("source", edge.sourceId().toString());
            node.put("target", edge.targetId().toString());
        }
        ArrayNode unresolved = root.putArray("unresolved");
        for (UnresolvedReference reference : callGraph.unresolved()) {
            ObjectNode node = unresolved.addObject();
            node.put("source", reference.sourceId() != null ? reference.sourceId().toString() : null);
            node.put("target", reference.targetName());
            node.put("kind", reference.kind().name());
            node.put("reason", reference.reason().name());
        }

        root.set("statistics", statisticsNode(RegisterStatistics.of(register)));
        return root;
    }

    /**
     * Serializes a register to JSON text.
     *
     * @param register the entity register
     * @return pretty-printed JSON
     */
    public String toJson(EntityRegister register) {
        try {
            return objectMapper.writeValueAsString(toTree(register));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize entity register", e);
        }
    }

    /**
     * Writes the JSON export to a file, creating parent directories.
     *
     * @param register the entity register
     * @param target output file
     * @throws IllegalStateException if the file cannot be written
     */
    public void export(EntityRegister register, Path target) {
        Objects.requireNonNull(target, "target must not be null");
        String json = toJson(register);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json, StandardCharsets.UTF_8);
            log.info("Exported entity register to {}", target);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write export: " + target, e);
        }
    }

    private ObjectNode functionNode(CppFunction function) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", function.name());
        node.put("qualifiedName", function.qualifiedName());
        node.put("returnType", function.returnType());
        ArrayNode parameters = node.putArray("parameters");
        function.parameters().forEach(parameters::add);
        node.put("file", function.fileId());
        node.put("startLine", function.lines().startLine());
        node.put("endLine", function.lines().endLine());
        node.put("owningClass", function.owningClass());
        ArrayNode calls = node.putArray("calls");
        function.calls().forEach(calls::add);
        node.set("controlFlow", flowArray(function.controlFlow()));
        return node;
    }

    private ArrayNode flowArray(List<ControlFlowNode> nodes) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ControlFlowNode flowNode : nodes) {
            array.add(flowNode(flowNode));
        }
        return array;
    }

    private ObjectNode flowNode(ControlFlowNode flowNode) {
        ObjectNode node = objectMapper.createObjectNode();
        if (flowNode instanceof Conditional conditional) {
            node.put("type", "conditional");
            node.put("condition", conditional.condition());
            node.set("then", flowArray(conditional.thenBranch()));
            node.set("else", flowArray(conditional.elseBranch()));
        } else if (flowNode instanceof Loop loop) {
            node.put("type", "loop");
            node.put("kind", loop.kind().name());
            node.put("condition", loop.condition());
            node.set("body", flowArray(loop.body()));
        } else if (flowNode instanceof Switch switchNode) {
            node.put("type", "switch");
            node.put("selector", switchNode.selector());
            ArrayNode cases = node.putArray("cases");
            for (SwitchCase switchCase : switchNode.cases()) {
                ObjectNode caseNode = cases.addObject();
                caseNode.put("label", switchCase.label());
                caseNode.set("body", flowArray(switchCase.body()));
            }
        } else if (flowNode instanceof Return ret) {
            node.put("type", "return");
            node.put("expression", ret.expression());
        } else if (flowNode instanceof Call call) {
            node.put("type", "call");
            node.put("callee", call.callee());
        } else if (flowNode instanceof Statement statement) {
            node.put("type", "statement");
            node.put("excerpt", statement.excerpt());
        }
        return node;
    }

    private ObjectNode statisticsNode(RegisterStatistics statistics) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("totalFunctions", statistics.totalFunctions());
        node.put("totalClasses", statistics.totalClasses());
        node.put("totalMethods", statistics.totalMethods());
        node.put("avgMethodsPerClass", statistics.avgMethodsPerClass());
        node.set("functionsByFile", countsNode(statistics.functionsByFile()));
        node.set("classesByFile", countsNode(statistics.classesByFile()));

        ExtractionStatistics extraction = statistics.extraction();
        ObjectNode extractionNode = node.putObject("extraction");
        extractionNode.put("filesDiscovered", extraction.filesDiscovered());
        extractionNode.put("filesParsed", extraction.filesParsed());
        extractionNode.set("filesSkipped", countsNode(extraction.filesSkipped()));
        extractionNode.set("entitiesSkipped", countsNode(extraction.entitiesSkipped()));
        ArrayNode errors = extractionNode.putArray("topErrors");
        extraction.topErrors().forEach(errors::add);
        return node;
    }

    private ObjectNode countsNode(Map<String, Integer> counts) {
        ObjectNode node = objectMapper.createObjectNode();
        counts.forEach(node::put);
        return node;
    }
}
