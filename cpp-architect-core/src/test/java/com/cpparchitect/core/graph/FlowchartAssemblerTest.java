package com.cpparchitect.core.graph;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.cpparchitect.core.model.ControlFlowNode.Call;
import com.cpparchitect.core.model.ControlFlowNode.Conditional;
import com.cpparchitect.core.model.ControlFlowNode.Loop;
import com.cpparchitect.core.model.ControlFlowNode.LoopKind;
import com.cpparchitect.core.model.ControlFlowNode.Return;
import com.cpparchitect.core.model.ControlFlowNode.Switch;
import com.cpparchitect.core.model.ControlFlowNode.SwitchCase;
import com.cpparchitect.core.model.CppFunction;

import static com.cpparchitect.core.CppFixtures.function;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FlowchartAssembler}.
 */
class FlowchartAssemblerTest {

    private final FlowchartAssembler assembler = new FlowchartAssembler();

    @Test
    void assemble_emptyFlow_yieldsSingleExecuteBodyAction() {
        // Given
        CppFunction function = function("noop", List.of(), List.of());

        // When
        Graph graph = assembler.assemble(function);

        // Then
        assertThat(graph.nodes()).extracting(GraphNode::kind)
            .containsExactly(NodeKind.START, NodeKind.END, NodeKind.ACTION);
        assertThat(graph.nodes().get(2).labelLines()).containsExactly(FlowchartAssembler.EMPTY_BODY_LABEL);
        assertThat(graph.edges()).containsExactly(
            new GraphEdge("start", "n1", null),
            new GraphEdge("n1", "end", null));
    }

    @Test
    void assemble_conditionalWithReturns_linksBranchesToEnd() {
        // Given
        CppFunction function = function("f", List.of(), List.of(
            new Conditional("(a>0)", List.of(new Return("a")), List.of(new Return("0")))));

        // When
        Graph graph = assembler.assemble(function);

        // Then
        assertThat(graph.nodes()).filteredOn(node -> node.kind() == NodeKind.DECISION).hasSize(1);
        assertThat(graph.nodes()).filteredOn(node -> node.kind() == NodeKind.RETURN).hasSize(2);
        assertThat(graph.edges()).contains(
            new GraphEdge("n1", "n2", "yes"),
            new GraphEdge("n1", "n3", "no"),
            new GraphEdge("n2", "end", null),
            new GraphEdge("n3", "end", null));
    }

    @Test
    void assemble_conditionalWithoutElse_fallsThroughOnNo() {
        CppFunction function = function("f", List.of(), List.of(
            new Conditional("c", List.of(new Call("work")), List.of())));

        Graph graph = assembler.assemble(function);

        assertThat(graph.edges()).contains(
            new GraphEdge("n1", "end", "no"),
            new GraphEdge("n2", "end", null));
    }

    @Test
    void assemble_whileLoop_addsBackEdgeAndDoneExit() {
        CppFunction function = function("f", List.of(), List.of(
            new Loop(LoopKind.WHILE, "(n > 0)", List.of(new Call("step")))));

        Graph graph = assembler.assemble(function);

        assertThat(graph.edges()).contains(
            new GraphEdge("n1", "n2", "loop"),
            new GraphEdge("n2", "n1", null),
            new GraphEdge("n1", "end", "done"));
    }

    @Test
    void assemble_doWhile_testsAfterBody() {
        CppFunction function = function("f", List.of(), List.of(
            new Loop(LoopKind.DO_WHILE, "(busy())", List.of(new Call("poll")))));

        Graph graph = assembler.assemble(function);

        // n1 = do, n2 = poll(), n3 = test
        assertThat(graph.edges()).contains(
            new GraphEdge("n1", "n2", null),
            new GraphEdge("n2", "n3", null),
            new GraphEdge("n3", "n1", "repeat"),
            new GraphEdge("n3", "end", "done"));
    }

    @Test
    void assemble_switchWithoutDefault_addsNoMatchExit() {
        CppFunction function = function("f", List.of(), List.of(
            new Switch("(c)", List.of(new SwitchCase("case 1", List.of(new Call("one")))))));

        Graph graph = assembler.assemble(function);

        assertThat(graph.nodes().get(2).labelLines()).containsExactly("switch (c)");
        assertThat(graph.edges()).contains(
            new GraphEdge("n1", "n2", "case 1"),
            new GraphEdge("n1", "end", "no match"));
    }

    @Test
    void assemble_everyEdgeReferencesKnownNodes() {
        CppFunction function = function("f", List.of(), List.of(
            new Loop(LoopKind.FOR, "(;;)", List.of(
                new Conditional("x", List.of(new Return("1")), List.of(new Call("g"))))),
            new Return("")));

        Graph graph = assembler.assemble(function);

        List<String> keys = graph.nodes().stream().map(GraphNode::key).toList();
        assertThat(graph.edges()).allSatisfy(edge -> {
            assertThat(keys).contains(edge.sourceKey());
            assertThat(keys).contains(edge.targetKey());
        });
    }
}
