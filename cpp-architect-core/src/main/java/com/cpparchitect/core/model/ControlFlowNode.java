package com.cpparchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One structural unit of a function's simplified control flow.
 *
 * <p>Nodes form a finite acyclic forest: every node is built from a distinct syntax
 * subtree and children are copied into immutable lists. Texts are display strings and
 * are never evaluated.
 */
public interface ControlFlowNode {

    /**
     * Loop flavours.
     */
    enum LoopKind {
        /** {@code for} and range-based {@code for} */
        FOR,

        /** {@code while (cond) body} */
        WHILE,

        /** {@code do body while (cond);} */
        DO_WHILE
    }

    /**
     * An if statement with optional else branch.
     *
     * @param condition condensed condition text
     * @param thenBranch nodes of the then branch
     * @param elseBranch nodes of the else branch, empty when absent
     */
    record Conditional(String condition, List<ControlFlowNode> thenBranch, List<ControlFlowNode> elseBranch)
        implements ControlFlowNode {
        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            thenBranch = thenBranch == null ? List.of() : List.copyOf(thenBranch);
            elseBranch = elseBranch == null ? List.of() : List.copyOf(elseBranch);
        }

        public boolean hasElse() {
            return !elseBranch.isEmpty();
        }
    }

    /**
     * A loop.
     *
     * @param kind loop flavour
     * @param condition condensed condition or header text
     * @param body nodes of the loop body
     */
    record Loop(LoopKind kind, String condition, List<ControlFlowNode> body) implements ControlFlowNode {
        public Loop {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
            body = body == null ? List.of() : List.copyOf(body);
        }
    }

    /**
     * A switch statement.
     *
     * @param selector condensed selector text
     * @param cases case arms in source order
     */
    record Switch(String selector, List<SwitchCase> cases) implements ControlFlowNode {
        public Switch {
            Objects.requireNonNull(selector, "selector must not be null");
            cases = cases == null ? List.of() : List.copyOf(cases);
        }
    }

    /**
     * One case or default arm of a switch. Not a node on its own.
     *
     * @param label {@code case X} or {@code default}
     * @param body statements of the arm
     */
    record SwitchCase(String label, List<ControlFlowNode> body) {
        public SwitchCase {
            Objects.requireNonNull(label, "label must not be null");
            body = body == null ? List.of() : List.copyOf(body);
        }
    }

    /**
     * A return statement.
     *
     * @param expression trimmed return expression, empty for {@code return;}
     */
    record Return(String expression) implements ControlFlowNode {
        public Return {
            expression = expression == null ? "" : expression;
        }
    }

    /**
     * A call statement.
     *
     * @param callee callee text as written
     */
    record Call(String callee) implements ControlFlowNode {
        public Call {
            Objects.requireNonNull(callee, "callee must not be null");
        }
    }

    /**
     * Any other short statement.
     *
     * @param excerpt whitespace-normalized source excerpt
     */
    record Statement(String excerpt) implements ControlFlowNode {
        public Statement {
            Objects.requireNonNull(excerpt, "excerpt must not be null");
        }
    }
}
