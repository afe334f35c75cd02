package com.cpparchitect.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.cpparchitect.core.graph.Graph.Direction;
import com.cpparchitect.core.model.ControlFlowNode;
import com.cpparchitect.core.model.ControlFlowNode.Call;
import com.cpparchitect.core.model.ControlFlowNode.Conditional;
import com.cpparchitect.core.model.ControlFlowNode.Loop;
import com.cpparchitect.core.model.ControlFlowNode.LoopKind;
import com.cpparchitect.core.model.ControlFlowNode.Return;
import com.cpparchitect.core.model.ControlFlowNode.Statement;
import com.cpparchitect.core.model.ControlFlowNode.Switch;
import com.cpparchitect.core.model.ControlFlowNode.SwitchCase;
import com.cpparchitect.core.model.CppFunction;

/**
 * Lays out a function's control-flow forest as a flowchart graph, for dialects that
 * describe explicit nodes and edges.
 *
 * <p>Flow is threaded through a list of open exits: edges still waiting for the next
 * node. Conditionals and switches fan exits out, loops add a back edge to their test,
 * returns close their path by linking to the end node.
 */
public class FlowchartAssembler {

    /** Label of the single activity shown for functions without recognized flow */
    public static final String EMPTY_BODY_LABEL = "execute function body";

    private static final String START_KEY = "start";
    private static final String END_KEY = "end";

    /**
     * Builds the flowchart of a function.
     *
     * @param function the function
     * @return graph from a start node through the flow to an end node
     */
    public Graph assemble(CppFunction function) {
        Objects.requireNonNull(function, "function must not be null");
        Layout layout = new Layout("Function Flow - " + function.qualifiedName());

        layout.builder.node(GraphNode.of(START_KEY, NodeKind.START, function.qualifiedName()));
        layout.builder.node(GraphNode.of(END_KEY, NodeKind.END, "end"));

        List<Exit> exits = List.of(new Exit(START_KEY, null));
        if (function.controlFlow().isEmpty()) {
            exits = layout.action(exits, EMPTY_BODY_LABEL);
        } else {
            exits = layout.sequence(function.controlFlow(), exits);
        }
        layout.connect(exits, END_KEY);
        return layout.builder.build();
    }

    /**
     * A pending edge from {@code sourceKey}, labelled when it leaves a branch point.
     */
    private record Exit(String sourceKey, String label) {}

    private static final class Layout {
        private final Graph.Builder builder;
        private int counter;

        private Layout(String title) {
            this.builder = new Graph.Builder(title, Direction.TOP_BOTTOM);
        }

        private List<Exit> sequence(List<ControlFlowNode> nodes, List<Exit> exits) {
            List<Exit> current = exits;
            for (ControlFlowNode node : nodes) {
                current = step(node, current);
            }
            return current;
        }

        private List<Exit> step(ControlFlowNode node, List<Exit> exits) {
            if (node instanceof Conditional conditional) {
                return conditional(conditional, exits);
            }
            if (node instanceof Loop loop) {
                return loop(loop, exits);
            }
            if (node instanceof Switch switchNode) {
                return switchArms(switchNode, exits);
            }
            if (node instanceof Return returnNode) {
                String key = add(NodeKind.RETURN, returnNode.expression().isEmpty()
                    ? "return" : "return " + returnNode.expression());
                connect(exits, key);
                builder.edge(new GraphEdge(key, END_KEY, null));
                return List.of();
            }
            if (node instanceof Call call) {
                return action(exits, call.callee() + "()");
            }
            if (node instanceof Statement statement) {
                return action(exits, statement.excerpt());
            }
            throw new IllegalArgumentException("Unknown control-flow node: " + node);
        }

        private List<Exit> action(List<Exit> exits, String label) {
            String key = add(NodeKind.ACTION, label);
            connect(exits, key);
            return List.of(new Exit(key, null));
        }

        private List<Exit> conditional(Conditional conditional, List<Exit> exits) {
            String key = add(NodeKind.DECISION, conditional.condition());
            connect(exits, key);
            List<Exit> result = new ArrayList<>(sequence(conditional.thenBranch(), List.of(new Exit(key, "yes"))));
            result.addAll(sequence(conditional.elseBranch(), List.of(new Exit(key, "no"))));
            return result;
        }

        private List<Exit> loop(Loop loop, List<Exit> exits) {
            if (loop.kind() == LoopKind.DO_WHILE) {
                // Body runs before the test
                String bodyEntry = add(NodeKind.ACTION, "do");
                connect(exits, bodyEntry);
                List<Exit> bodyExits = sequence(loop.body(), List.of(new Exit(bodyEntry, null)));
                String test = add(NodeKind.DECISION, loop.condition());
                connect(bodyExits, test);
                builder.edge(new GraphEdge(test, bodyEntry, "repeat"));
                return List.of(new Exit(test, "done"));
            }
            String test = add(NodeKind.DECISION, loop.condition());
            connect(exits, test);
            List<Exit> bodyExits = sequence(loop.body(), List.of(new Exit(test, "loop")));
            connect(bodyExits, test);
            return List.of(new Exit(test, "done"));
        }

        private List<Exit> switchArms(Switch switchNode, List<Exit> exits) {
            String key = add(NodeKind.DECISION, "switch " + switchNode.selector());
            connect(exits, key);
            List<Exit> result = new ArrayList<>();
            boolean hasDefault = false;
            for (SwitchCase arm : switchNode.cases()) {
                hasDefault |= "default".equals(arm.label());
                result.addAll(sequence(arm.body(), List.of(new Exit(key, arm.label()))));
            }
            if (!hasDefault) {
                result.add(new Exit(key, "no match"));
            }
            return result;
        }

        private String add(NodeKind kind, String label) {
            String key = "n" + (++counter);
            builder.node(GraphNode.of(key, kind, label));
            return key;
        }

        private void connect(List<Exit> exits, String targetKey) {
            for (Exit exit : exits) {
                builder.edge(new GraphEdge(exit.sourceKey(), targetKey, exit.label()));
            }
        }
    }
}
