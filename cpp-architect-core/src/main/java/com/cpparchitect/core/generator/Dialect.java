package com.cpparchitect.core.generator;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.cpparchitect.core.graph.NodeKind;

/**
 * Description of an output dialect: escape rules, keyword vocabulary and truncation widths.
 *
 * <p>A single generator is parameterized with one dialect value at construction. Three
 * dialects ship:
 * <ul>
 *   <li>{@link #PLANTUML}: activity-flow notation ({@code start}/{@code stop}, activities,
 *       decisions, loops, switches, forks)</li>
 *   <li>{@link #DOT}: Graphviz graph description with explicit node and edge lists</li>
 *   <li>{@link #MERMAID}: Mermaid flowcharts embedded in Markdown</li>
 * </ul>
 *
 * <p>Replacement tables are applied in order. No replacement value may contain a
 * replaced key, which keeps sanitization idempotent.
 *
 * @param id dialect identifier used in configuration
 * @param displayName human-readable name
 * @param fileExtension extension of generated files, without dot
 * @param family notation family
 * @param labelReplacements replacements for node labels
 * @param conditionReplacements replacements for branch conditions
 * @param labelWidth maximum label length, ellipsis included
 * @param conditionWidth maximum condition length, ellipsis included
 * @param filenameWidth maximum file name length
 * @param lineBreak token joining multi-line labels
 * @param startMarker line that opens a document, exactly once
 * @param endMarker line that closes a document, exactly once
 * @param graphSyntax node and edge templates, null for activity-flow dialects
 */
public record Dialect(
    String id,
    String displayName,
    String fileExtension,
    Family family,
    List<Replacement> labelReplacements,
    List<Replacement> conditionReplacements,
    int labelWidth,
    int conditionWidth,
    int filenameWidth,
    String lineBreak,
    String startMarker,
    String endMarker,
    GraphSyntax graphSyntax
) {
    /** Smallest accepted width; leaves room for text before the ellipsis */
    public static final int MIN_WIDTH = 10;

    /**
     * Notation families.
     */
    public enum Family {
        /** Explicit node and edge lists with shape and color attributes */
        GRAPH_DESCRIPTION,

        /** Sequential activities with structured control constructs */
        ACTIVITY_FLOW
    }

    /**
     * One text replacement.
     *
     * @param from text to replace
     * @param to replacement
     */
    public record Replacement(String from, String to) {
        public Replacement {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
            if (from.isEmpty()) {
                throw new IllegalArgumentException("from must not be empty");
            }
        }
    }

    /**
     * Templates of a graph-description dialect, in {@link String#format} syntax.
     *
     * @param header document start; {@code %1$s} title, {@code %2$s} direction
     * @param footer document end
     * @param leftRight direction token for left-to-right layouts
     * @param topBottom direction token for top-to-bottom layouts
     * @param nodeTemplates per node kind; {@code %1$s} id, {@code %2$s} label
     * @param edgeTemplate unlabelled edge; {@code %1$s} source id, {@code %2$s} target id
     * @param labelledEdgeTemplate labelled edge; additionally {@code %3$s} label
     */
    public record GraphSyntax(
        String header,
        String footer,
        String leftRight,
        String topBottom,
        Map<NodeKind, String> nodeTemplates,
        String edgeTemplate,
        String labelledEdgeTemplate
    ) {
        public GraphSyntax {
            Objects.requireNonNull(header, "header must not be null");
            Objects.requireNonNull(footer, "footer must not be null");
            Objects.requireNonNull(edgeTemplate, "edgeTemplate must not be null");
            Objects.requireNonNull(labelledEdgeTemplate, "labelledEdgeTemplate must not be null");
            nodeTemplates = Map.copyOf(nodeTemplates);
            for (NodeKind kind : NodeKind.values()) {
                if (!nodeTemplates.containsKey(kind)) {
                    throw new IllegalArgumentException("Missing node template for " + kind);
                }
            }
        }
    }

    /**
     * Compact constructor with validation.
     */
    public Dialect {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(lineBreak, "lineBreak must not be null");
        Objects.requireNonNull(startMarker, "startMarker must not be null");
        Objects.requireNonNull(endMarker, "endMarker must not be null");
        labelReplacements = List.copyOf(labelReplacements);
        conditionReplacements = List.copyOf(conditionReplacements);
        if (labelWidth < MIN_WIDTH || conditionWidth < MIN_WIDTH || filenameWidth < MIN_WIDTH) {
            throw new IllegalArgumentException("Widths must be at least " + MIN_WIDTH);
        }
        if (family == Family.GRAPH_DESCRIPTION && graphSyntax == null) {
            throw new IllegalArgumentException("Graph-description dialect " + id + " needs a graph syntax");
        }
        requireStableReplacements(labelReplacements);
        requireStableReplacements(conditionReplacements);
    }

    private static void requireStableReplacements(List<Replacement> replacements) {
        for (Replacement replacement : replacements) {
            for (Replacement other : replacements) {
                if (replacement.to().contains(other.from())) {
                    throw new IllegalArgumentException("Replacement for '" + replacement.from()
                        + "' reintroduces '" + other.from() + "'");
                }
            }
        }
    }

    /**
     * Returns a copy with other label and condition widths.
     *
     * @param newLabelWidth label width, or null to keep
     * @param newConditionWidth condition width, or null to keep
     * @return dialect with the widths applied
     */
    public Dialect withWidths(Integer newLabelWidth, Integer newConditionWidth) {
        return new Dialect(id, displayName, fileExtension, family, labelReplacements, conditionReplacements,
            newLabelWidth != null ? newLabelWidth : labelWidth,
            newConditionWidth != null ? newConditionWidth : conditionWidth,
            filenameWidth, lineBreak, startMarker, endMarker, graphSyntax);
    }

    /**
     * Looks up a shipped dialect by id.
     *
     * @param id dialect id, case-insensitive
     * @return the dialect
     * @throws IllegalArgumentException if no dialect has this id
     */
    public static Dialect fromId(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return switch (id.trim().toLowerCase(Locale.ROOT)) {
            case "plantuml", "puml" -> PLANTUML;
            case "dot", "graphviz" -> DOT;
            case "mermaid" -> MERMAID;
            default -> throw new IllegalArgumentException("Unknown dialect: " + id);
        };
    }

    // PlantUML treats ':' ';' '|' as activity syntax, brackets as notes/stereotypes, '~' as escape
    private static final List<Replacement> PLANTUML_LABEL = List.of(
        new Replacement("::", "."),
        new Replacement(":", " "),
        new Replacement(";", ","),
        new Replacement("|", "/"),
        new Replacement("\"", "'"),
        new Replacement("\\", "/"),
        new Replacement("`", "'"),
        new Replacement("[", "("),
        new Replacement("]", ")"),
        new Replacement("{", "("),
        new Replacement("}", ")"),
        new Replacement("~", "-"),
        new Replacement("@", " at ")
    );

    private static final List<Replacement> PLANTUML_CONDITION = List.of(
        new Replacement("::", "."),
        new Replacement(":", " "),
        new Replacement(";", ","),
        new Replacement("||", " or "),
        new Replacement("|", "/"),
        new Replacement("\"", "'"),
        new Replacement("\\", "/"),
        new Replacement("`", "'"),
        new Replacement("[", "("),
        new Replacement("]", ")"),
        new Replacement("{", "("),
        new Replacement("}", ")"),
        new Replacement("~", "-"),
        new Replacement("@", " at ")
    );

    // DOT labels are double-quoted strings
    private static final List<Replacement> DOT_TEXT = List.of(
        new Replacement("\"", "'"),
        new Replacement("\\", "/")
    );

    // Mermaid labels are quoted; '#' starts entity codes, '<' '>' start HTML, '|' delimits edge text
    private static final List<Replacement> MERMAID_TEXT = List.of(
        new Replacement("\"", "'"),
        new Replacement("`", "'"),
        new Replacement("#", " "),
        new Replacement(";", ","),
        new Replacement("|", "/"),
        new Replacement("<", "‹"),
        new Replacement(">", "›")
    );

    /** Activity-flow dialect */
    public static final Dialect PLANTUML = new Dialect(
        "plantuml", "PlantUML Activity Diagrams", "puml", Family.ACTIVITY_FLOW,
        PLANTUML_LABEL, PLANTUML_CONDITION,
        50, 40, 60,
        "\\n", "@startuml", "@enduml",
        null
    );

    /** Graphviz graph-description dialect */
    public static final Dialect DOT = new Dialect(
        "dot", "Graphviz DOT Graphs", "dot", Family.GRAPH_DESCRIPTION,
        DOT_TEXT, DOT_TEXT,
        60, 50, 60,
        "\\n", "digraph G {", "}",
        new GraphSyntax(
            "digraph G {\n"
                + "  label=\"%1$s\";\n"
                + "  labelloc=t;\n"
                + "  rankdir=%2$s;\n"
                + "  node [style=filled, fontname=\"Helvetica\"];\n"
                + "  edge [fontname=\"Helvetica\"];\n",
            "}\n",
            "LR",
            "TB",
            Map.of(
                NodeKind.FUNCTION, "  %1$s [label=\"%2$s\", shape=box, fillcolor=lightblue];",
                NodeKind.CLASS, "  %1$s [label=\"%2$s\", shape=box, fillcolor=lightgreen];",
                NodeKind.DIRECTORY, "  %1$s [label=\"%2$s\", shape=folder, fillcolor=lightyellow];",
                NodeKind.FILE, "  %1$s [label=\"%2$s\", shape=note, fillcolor=white];",
                NodeKind.START, "  %1$s [label=\"%2$s\", shape=oval, fillcolor=\"#4A90E2\", fontcolor=white];",
                NodeKind.END, "  %1$s [label=\"%2$s\", shape=oval, fillcolor=\"#E74C3C\", fontcolor=white];",
                NodeKind.ACTION, "  %1$s [label=\"%2$s\", shape=box, fillcolor=\"#B4E7CE\"];",
                NodeKind.DECISION, "  %1$s [label=\"%2$s\", shape=diamond, fillcolor=\"#FFD966\"];",
                NodeKind.RETURN, "  %1$s [label=\"%2$s\", shape=box, style=\"rounded,filled\", fillcolor=\"#F5B7B1\"];"
            ),
            "  %1$s -> %2$s;",
            "  %1$s -> %2$s [label=\"%3$s\"];"
        )
    );

    /** Mermaid flowchart dialect */
    public static final Dialect MERMAID = new Dialect(
        "mermaid", "Mermaid Flowcharts", "md", Family.GRAPH_DESCRIPTION,
        MERMAID_TEXT, MERMAID_TEXT,
        50, 40, 60,
        "<br/>", "```mermaid", "```",
        new GraphSyntax(
            "# %1$s\n\n```mermaid\ngraph %2$s\n",
            "```\n",
            "LR",
            "TD",
            Map.of(
                NodeKind.FUNCTION, "  %1$s[\"%2$s\"]\n  style %1$s fill:#add8e6",
                NodeKind.CLASS, "  %1$s[[\"%2$s\"]]\n  style %1$s fill:#90ee90",
                NodeKind.DIRECTORY, "  %1$s[/\"%2$s\"/]\n  style %1$s fill:#ffffe0",
                NodeKind.FILE, "  %1$s[\"%2$s\"]",
                NodeKind.START, "  %1$s([\"%2$s\"])\n  style %1$s fill:#4A90E2,color:#fff",
                NodeKind.END, "  %1$s([\"%2$s\"])\n  style %1$s fill:#E74C3C,color:#fff",
                NodeKind.ACTION, "  %1$s[\"%2$s\"]\n  style %1$s fill:#B4E7CE",
                NodeKind.DECISION, "  %1$s{\"%2$s\"}\n  style %1$s fill:#FFD966",
                NodeKind.RETURN, "  %1$s(\"%2$s\")\n  style %1$s fill:#F5B7B1"
            ),
            "  %1$s --> %2$s",
            "  %1$s -->|\"%3$s\"| %2$s"
        )
    );
}
