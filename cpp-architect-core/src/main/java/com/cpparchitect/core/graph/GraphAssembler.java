package com.cpparchitect.core.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.graph.Graph.Direction;
import com.cpparchitect.core.graph.NameIndex.Resolution;
import com.cpparchitect.core.model.CallEdge;
import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityId;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.InheritanceEdge;
import com.cpparchitect.core.model.ReferenceKind;
import com.cpparchitect.core.model.SourceUnit;
import com.cpparchitect.core.model.UnresolvedReference;

/**
 * Builds call, inheritance and containment graphs from an entity register.
 *
 * <p>Name resolution is exact and open-world: a callee or base class becomes an edge only
 * when it names exactly one register entity. Everything else is reported as an
 * {@link UnresolvedReference} and never turned into a guessed edge.
 *
 * <p>All methods are pure functions of their inputs.
 */
public class GraphAssembler {

    private static final Logger log = LoggerFactory.getLogger(GraphAssembler.class);

    // Edge labels
    private static final String CALLS_LABEL = "calls";
    private static final String INHERITS_LABEL = "inherits";

    /** Methods listed in a class node before the rest is summarized */
    public static final int MAX_METHODS_PER_CLASS_NODE = 5;

    /**
     * Builds the whole-program call graph.
     *
     * @param register the entity register
     * @return one node per function, edges for resolved calls
     */
    public CallGraph callGraph(EntityRegister register) {
        Objects.requireNonNull(register, "register must not be null");
        NameIndex<CppFunction> index = functionIndex(register);

        Set<CallEdge> edges = new LinkedHashSet<>();
        Set<UnresolvedReference> unresolved = new LinkedHashSet<>();
        for (CppFunction caller : register.functions()) {
            for (String callee : caller.calls()) {
                Resolution<CppFunction> resolution = index.resolve(callee);
                if (resolution.isResolved()) {
                    edges.add(new CallEdge(caller.id(), resolution.target().id()));
                } else {
                    unresolved.add(new UnresolvedReference(caller.id(), callee, ReferenceKind.CALL, resolution.reason()));
                }
            }
        }

        log.debug("Call graph: {} functions, {} edges, {} unresolved calls",
            register.functions().size(), edges.size(), unresolved.size());
        return new CallGraph(register.functions(), new ArrayList<>(edges), new ArrayList<>(unresolved), null);
    }

    /**
     * Builds the call graph reachable from an entry point.
     *
     * <p>Depth-first from the entry with a visited set: each function is expanded at most
     * once, so recursion and call cycles terminate. A function at depth {@code d} has its
     * callees added only while {@code d < maxDepth}. An entry point that does not resolve
     * to exactly one function falls back to the whole-program graph, with the entry point
     * recorded as unresolved.
     *
     * @param register the entity register
     * @param entryPoint simple or qualified name of the entry function
     * @param maxDepth maximum call depth below the entry
     * @return reachable functions and the edges between them
     */
    public CallGraph reachableFrom(EntityRegister register, String entryPoint, int maxDepth) {
        Objects.requireNonNull(register, "register must not be null");
        Objects.requireNonNull(entryPoint, "entryPoint must not be null");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }

        NameIndex<CppFunction> index = functionIndex(register);
        Resolution<CppFunction> entry = index.resolve(entryPoint);
        if (!entry.isResolved()) {
            log.warn("Entry point '{}' not resolved ({}), using whole-program call graph", entryPoint, entry.reason());
            CallGraph whole = callGraph(register);
            List<UnresolvedReference> unresolved = new ArrayList<>();
            unresolved.add(new UnresolvedReference(null, entryPoint, ReferenceKind.ENTRY_POINT, entry.reason()));
            unresolved.addAll(whole.unresolved());
            return new CallGraph(whole.functions(), whole.edges(), unresolved, null);
        }

        Reachability walk = new Reachability(index, maxDepth);
        walk.visit(entry.target(), 0);

        log.debug("Reachability from {}: {} functions, {} edges", entryPoint, walk.nodes.size(), walk.edges.size());
        return new CallGraph(new ArrayList<>(walk.nodes.values()), new ArrayList<>(walk.edges),
            new ArrayList<>(walk.unresolved), entryPoint);
    }

    /**
     * Builds the inheritance graph.
     *
     * @param register the entity register
     * @return one node per class, base to derived edges for resolved bases
     */
    public InheritanceGraph inheritanceGraph(EntityRegister register) {
        Objects.requireNonNull(register, "register must not be null");
        NameIndex<CppClass> index = new NameIndex<>(register.classes(), CppClass::name, CppClass::qualifiedName);

        Set<InheritanceEdge> edges = new LinkedHashSet<>();
        Set<UnresolvedReference> unresolved = new LinkedHashSet<>();
        for (CppClass derived : register.classes()) {
            for (String base : derived.baseClasses()) {
                Resolution<CppClass> resolution = index.resolve(base);
                if (resolution.isResolved()) {
                    edges.add(new InheritanceEdge(resolution.target().id(), derived.id()));
                } else {
                    unresolved.add(new UnresolvedReference(derived.id(), base, ReferenceKind.BASE_CLASS, resolution.reason()));
                }
            }
        }
        return new InheritanceGraph(register.classes(), new ArrayList<>(edges), new ArrayList<>(unresolved));
    }

    /**
     * Builds the directory-owns-file containment graph.
     *
     * @param register the entity register
     * @return directories and files in path order
     */
    public Graph containmentGraph(EntityRegister register) {
        Objects.requireNonNull(register, "register must not be null");
        Map<String, List<SourceUnit>> byDirectory = groupByDirectory(register);

        Graph.Builder builder = new Graph.Builder("Module Structure", Direction.TOP_BOTTOM);
        for (Map.Entry<String, List<SourceUnit>> entry : byDirectory.entrySet()) {
            String directoryKey = "dir:" + entry.getKey();
            List<SourceUnit> files = entry.getValue();
            builder.node(GraphNode.of(directoryKey, NodeKind.DIRECTORY,
                directoryName(entry.getKey()), files.size() + " files"));
            for (SourceUnit file : files) {
                String fileKey = "file:" + file.fileId();
                builder.node(GraphNode.of(fileKey, NodeKind.FILE, file.fileName()));
                builder.edge(new GraphEdge(directoryKey, fileKey, null));
            }
        }
        return builder.build();
    }

    /**
     * Groups source units by parent directory; directories and files sorted by path.
     *
     * @param register the entity register
     * @return directory to files map in path order
     */
    public Map<String, List<SourceUnit>> groupByDirectory(EntityRegister register) {
        Map<String, List<SourceUnit>> byDirectory = new TreeMap<>();
        register.sourceUnits().stream()
            .sorted(Comparator.comparing(SourceUnit::fileId))
            .forEach(unit -> byDirectory.computeIfAbsent(unit.directory(), k -> new ArrayList<>()).add(unit));
        return byDirectory;
    }

    /**
     * Converts a call graph into a renderable graph.
     *
     * @param callGraph the call graph
     * @return graph with one node per function and "calls" edges
     */
    public Graph toGraph(CallGraph callGraph) {
        String title = callGraph.isReachability()
            ? "Call Graph from " + callGraph.entryPoint()
            : "Function Call Graph";
        Graph.Builder builder = new Graph.Builder(title, Direction.LEFT_RIGHT);
        for (CppFunction function : callGraph.functions()) {
            builder.node(GraphNode.of(function.id().toString(), NodeKind.FUNCTION, function.qualifiedName()));
        }
        for (CallEdge edge : callGraph.edges()) {
            builder.edge(new GraphEdge(edge.sourceId().toString(), edge.targetId().toString(), CALLS_LABEL));
        }
        return builder.build();
    }

    /**
     * Converts an inheritance graph into a renderable graph.
     *
     * @param inheritance the inheritance graph
     * @return graph with one node per class, listing up to {@value #MAX_METHODS_PER_CLASS_NODE} methods
     */
    public Graph toGraph(InheritanceGraph inheritance) {
        Graph.Builder builder = new Graph.Builder("Class Hierarchy", Direction.TOP_BOTTOM);
        for (CppClass cppClass : inheritance.classes()) {
            builder.node(new GraphNode(cppClass.id().toString(), classLabel(cppClass), NodeKind.CLASS));
        }
        for (InheritanceEdge edge : inheritance.edges()) {
            builder.edge(new GraphEdge(edge.sourceId().toString(), edge.targetId().toString(), INHERITS_LABEL));
        }
        return builder.build();
    }

    private List<String> classLabel(CppClass cppClass) {
        List<String> lines = new ArrayList<>();
        lines.add(cppClass.qualifiedName());
        cppClass.methods().stream()
            .limit(MAX_METHODS_PER_CLASS_NODE)
            .forEach(method -> lines.add("+ " + method.name() + "()"));
        int remaining = cppClass.methods().size() - MAX_METHODS_PER_CLASS_NODE;
        if (remaining > 0) {
            lines.add("... (" + remaining + " more)");
        }
        return lines;
    }

    private static String directoryName(String directory) {
        int slash = directory.lastIndexOf('/');
        return slash < 0 ? directory : directory.substring(slash + 1);
    }

    private static NameIndex<CppFunction> functionIndex(EntityRegister register) {
        return new NameIndex<>(register.functions(), CppFunction::name, CppFunction::qualifiedName);
    }

    /**
     * State of one bounded depth-first traversal.
     */
    private static final class Reachability {
        private final NameIndex<CppFunction> index;
        private final int maxDepth;
        private final Set<EntityId> visited = new HashSet<>();
        private final Map<EntityId, CppFunction> nodes = new LinkedHashMap<>();
        private final Set<CallEdge> edges = new LinkedHashSet<>();
        private final Set<UnresolvedReference> unresolved = new LinkedHashSet<>();

        private Reachability(NameIndex<CppFunction> index, int maxDepth) {
            this.index = index;
            this.maxDepth = maxDepth;
        }

        /**
         * Recursion is bounded twice: by the visited set and by {@code maxDepth}.
         */
        private void visit(CppFunction function, int depth) {
            if (!visited.add(function.id())) {
                return;
            }
            nodes.putIfAbsent(function.id(), function);
            if (depth >= maxDepth) {
                return;
            }
            for (String callee : function.calls()) {
                Resolution<CppFunction> resolution = index.resolve(callee);
                if (!resolution.isResolved()) {
                    unresolved.add(new UnresolvedReference(function.id(), callee, ReferenceKind.CALL, resolution.reason()));
                    continue;
                }
                CppFunction target = resolution.target();
                nodes.putIfAbsent(target.id(), target);
                edges.add(new CallEdge(function.id(), target.id()));
                visit(target, depth + 1);
            }
        }
    }
}
