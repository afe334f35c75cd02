package com.cpparchitect.core.extractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.model.ControlFlowNode;
import com.cpparchitect.core.model.ControlFlowNode.Call;
import com.cpparchitect.core.model.ControlFlowNode.Conditional;
import com.cpparchitect.core.model.ControlFlowNode.Loop;
import com.cpparchitect.core.model.ControlFlowNode.LoopKind;
import com.cpparchitect.core.model.ControlFlowNode.Return;
import com.cpparchitect.core.model.ControlFlowNode.Statement;
import com.cpparchitect.core.model.ControlFlowNode.Switch;
import com.cpparchitect.core.model.ControlFlowNode.SwitchCase;
import com.cpparchitect.core.syntax.SourceText;
import com.cpparchitect.core.syntax.SyntaxNode;

import static com.cpparchitect.core.syntax.CppNodeTypes.*;

/**
 * Builds the control-flow forest of a function body.
 *
 * <p>The builder recognizes a small vocabulary of statements:
 * <ul>
 *   <li><b>if/else:</b> {@link Conditional}, else-if chains nest in the else branch</li>
 *   <li><b>for, range-for, while, do-while:</b> {@link Loop}</li>
 *   <li><b>switch:</b> {@link Switch} with one {@link SwitchCase} per case/default arm</li>
 *   <li><b>return:</b> {@link Return}</li>
 *   <li><b>call statements:</b> {@link Call}</li>
 *   <li><b>other short statements:</b> {@link Statement}, dropped at {@value #STATEMENT_THRESHOLD} chars or more</li>
 * </ul>
 *
 * <p>Nested blocks and try bodies are inlined. Recursion is bounded by {@code maxDepth}:
 * blocks nested deeper than the cap contribute no nodes. This truncation is silent.
 *
 * <p>Instances are stateless and may be shared between threads.
 */
public class ControlFlowBuilder {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowBuilder.class);

    /** Default nesting cap */
    public static final int DEFAULT_MAX_DEPTH = 10;

    /** Display budget for condition, header and selector texts */
    public static final int CONDITION_BUDGET = 80;

    /** Statements at least this long are not recorded */
    public static final int STATEMENT_THRESHOLD = 100;

    private static final String ELLIPSIS = "...";
    private static final String CONDITION_FALLBACK = "condition";
    private static final String DEFAULT_LABEL = "default";

    private final int maxDepth;

    public ControlFlowBuilder() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ControlFlowBuilder(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Builds the forest for a function body.
     *
     * @param body the body node, usually a compound statement
     * @param source source text the body was parsed from
     * @return control-flow nodes in source order, empty when nothing is recognized
     */
    public List<ControlFlowNode> build(SyntaxNode body, SourceText source) {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(source, "source must not be null");
        return buildBlock(body, source, 0);
    }

    private List<ControlFlowNode> buildBlock(SyntaxNode block, SourceText source, int depth) {
        if (depth > maxDepth) {
            log.debug("Control-flow depth cap {} reached at line {}", maxDepth, block.startLine());
            return List.of();
        }
        List<ControlFlowNode> nodes = new ArrayList<>();
        for (SyntaxNode statement : statementsOf(block)) {
            appendStatement(nodes, statement, source, depth);
        }
        return nodes;
    }

    /**
     * A compound statement contributes its children, a single-statement branch itself.
     */
    private List<SyntaxNode> statementsOf(SyntaxNode block) {
        if (block.is(COMPOUND_STATEMENT)) {
            return block.children();
        }
        return List.of(block);
    }

    private void appendStatement(List<ControlFlowNode> nodes, SyntaxNode statement, SourceText source, int depth) {
        switch (statement.type()) {
            case IF_STATEMENT -> nodes.add(buildConditional(statement, source, depth));
            case FOR_STATEMENT, FOR_RANGE_LOOP -> nodes.add(buildLoop(LoopKind.FOR, loopHeader(statement, source), statement, source, depth));
            case WHILE_STATEMENT -> nodes.add(buildLoop(LoopKind.WHILE, conditionOf(statement, source), statement, source, depth));
            case DO_STATEMENT -> nodes.add(buildLoop(LoopKind.DO_WHILE, conditionOf(statement, source), statement, source, depth));
            case SWITCH_STATEMENT -> nodes.add(buildSwitch(statement, source, depth));
            case RETURN_STATEMENT -> nodes.add(new Return(returnExpression(statement, source)));
            case CALL_EXPRESSION -> nodes.add(new Call(calleeOf(statement, source)));
            case EXPRESSION_STATEMENT -> appendExpression(nodes, statement, source);
            case COMPOUND_STATEMENT -> nodes.addAll(buildBlock(statement, source, depth + 1));
            case TRY_STATEMENT -> statement.childByField(FIELD_BODY)
                .ifPresent(body -> nodes.addAll(buildBlock(body, source, depth + 1)));
            case DECLARATION, THROW_STATEMENT, CONTINUE_STATEMENT, GOTO_STATEMENT -> appendExcerpt(nodes, statement, source);
            default -> {
                // Comments, punctuation, break and unrecognized statements carry no flow
            }
        }
    }

    private Conditional buildConditional(SyntaxNode ifStatement, SourceText source, int depth) {
        String condition = conditionOf(ifStatement, source);
        List<ControlFlowNode> thenBranch = ifStatement.childByField(FIELD_CONSEQUENCE)
            .map(consequence -> buildBlock(consequence, source, depth + 1))
            .orElse(List.of());
        List<ControlFlowNode> elseBranch = elseStatement(ifStatement)
            .map(alternative -> buildBlock(alternative, source, depth + 1))
            .orElse(List.of());
        return new Conditional(condition, thenBranch, elseBranch);
    }

    /**
     * Newer grammars wrap the else branch in an {@code else_clause}, older ones store the
     * statement directly in the {@code alternative} field.
     */
    private Optional<SyntaxNode> elseStatement(SyntaxNode ifStatement) {
        Optional<SyntaxNode> alternative = ifStatement.childByField(FIELD_ALTERNATIVE)
            .or(() -> ifStatement.firstChildOfType(ELSE_CLAUSE));
        if (alternative.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode node = alternative.get();
        if (!node.is(ELSE_CLAUSE)) {
            return Optional.of(node);
        }
        return node.children().stream()
            .filter(SyntaxNode::isNamed)
            .filter(child -> !child.is(COMMENT))
            .findFirst();
    }

    private Loop buildLoop(LoopKind kind, String condition, SyntaxNode loop, SourceText source, int depth) {
        List<ControlFlowNode> body = loop.childByField(FIELD_BODY)
            .map(node -> buildBlock(node, source, depth + 1))
            .orElse(List.of());
        return new Loop(kind, condition, body);
    }

    private Switch buildSwitch(SyntaxNode switchStatement, SourceText source, int depth) {
        String selector = conditionOf(switchStatement, source);
        List<SwitchCase> cases = new ArrayList<>();
        Optional<SyntaxNode> body = switchStatement.childByField(FIELD_BODY);
        if (body.isPresent() && depth < maxDepth) {
            for (SyntaxNode arm : body.get().childrenOfType(CASE_STATEMENT)) {
                cases.add(buildCase(arm, source, depth + 1));
            }
        }
        return new Switch(selector, cases);
    }

    private SwitchCase buildCase(SyntaxNode arm, SourceText source, int depth) {
        String label = arm.childByField(FIELD_VALUE)
            .map(value -> "case " + condensed(value, source))
            .orElse(DEFAULT_LABEL);
        List<ControlFlowNode> body = new ArrayList<>();
        for (SyntaxNode child : arm.children()) {
            if (child.isNamed() && !FIELD_VALUE.equals(child.fieldName())) {
                appendStatement(body, child, source, depth);
            }
        }
        return new SwitchCase(label, body);
    }

    private void appendExpression(List<ControlFlowNode> nodes, SyntaxNode statement, SourceText source) {
        Optional<SyntaxNode> expression = statement.children().stream()
            .filter(SyntaxNode::isNamed)
            .filter(child -> !child.is(COMMENT))
            .findFirst();
        if (expression.isEmpty()) {
            // Empty statement
            return;
        }
        if (expression.get().is(CALL_EXPRESSION)) {
            nodes.add(new Call(calleeOf(expression.get(), source)));
        } else {
            appendExcerpt(nodes, statement, source);
        }
    }

    private void appendExcerpt(List<ControlFlowNode> nodes, SyntaxNode statement, SourceText source) {
        String excerpt = source.condensed(statement);
        // Terminators are not part of the statement text
        while (excerpt.endsWith(";")) {
            excerpt = excerpt.substring(0, excerpt.length() - 1).trim();
        }
        if (!excerpt.isEmpty() && excerpt.length() < STATEMENT_THRESHOLD) {
            nodes.add(new Statement(excerpt));
        }
    }

    private String conditionOf(SyntaxNode statement, SourceText source) {
        return statement.childByField(FIELD_CONDITION)
            .map(condition -> condensed(condition, source))
            .filter(text -> !text.isEmpty())
            .orElse(CONDITION_FALLBACK);
    }

    /**
     * For loops have no single condition node: the header spans from the keyword to the body.
     */
    private String loopHeader(SyntaxNode loop, SourceText source) {
        int end = loop.childByField(FIELD_BODY).map(SyntaxNode::startByte).orElse(loop.endByte());
        String header = SourceText.condense(source.slice(loop.startByte(), end));
        if (header.startsWith("for")) {
            header = header.substring(3).trim();
        }
        return header.isEmpty() ? CONDITION_FALLBACK : truncate(header);
    }

    private String returnExpression(SyntaxNode statement, SourceText source) {
        String text = source.condensed(statement);
        if (text.startsWith("co_return")) {
            text = text.substring("co_return".length());
        } else if (text.startsWith("return")) {
            text = text.substring("return".length());
        }
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1);
        }
        return truncate(text.trim());
    }

    private String calleeOf(SyntaxNode call, SourceText source) {
        return call.childByField(FIELD_FUNCTION)
            .or(() -> call.children().stream().findFirst())
            .map(function -> condensed(function, source))
            .orElse("call");
    }

    private String condensed(SyntaxNode node, SourceText source) {
        return truncate(source.condensed(node));
    }

    private static String truncate(String text) {
        if (text.length() <= CONDITION_BUDGET) {
            return text;
        }
        return text.substring(0, CONDITION_BUDGET - ELLIPSIS.length()) + ELLIPSIS;
    }
}
