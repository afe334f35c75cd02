package com.cpparchitect.core.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.LineRange;
import com.cpparchitect.core.model.SourceUnit;

/**
 * Turns an entity register into text chunks for a downstream retrieval index.
 *
 * <p>One chunk per function (methods included) followed by one chunk per class, in
 * register order. Content starts with a descriptive header and ends with the entity's
 * source lines.
 */
public class EntityChunker {

    private static final Logger log = LoggerFactory.getLogger(EntityChunker.class);

    // Metadata keys
    public static final String KEY_TYPE = "chunk_type";
    public static final String KEY_NAME = "name";
    public static final String KEY_QUALIFIED_NAME = "qualified_name";
    public static final String KEY_FILE = "file_path";
    public static final String KEY_LINE_START = "line_start";
    public static final String KEY_LINE_END = "line_end";
    public static final String KEY_RETURN_TYPE = "return_type";
    public static final String KEY_PARAMETERS = "parameters";
    public static final String KEY_CLASS_NAME = "class_name";
    public static final String KEY_IS_METHOD = "is_method";
    public static final String KEY_CALLS = "calls";
    public static final String KEY_KIND = "kind";
    public static final String KEY_BASE_CLASSES = "base_classes";
    public static final String KEY_METHOD_COUNT = "method_count";

    /**
     * Chunks every function and class of the register.
     *
     * @param register the entity register
     * @return chunks in register order, functions first
     */
    public List<CodeChunk> chunk(EntityRegister register) {
        Objects.requireNonNull(register, "register must not be null");
        Map<String, String[]> linesByFile = new HashMap<>();
        for (SourceUnit unit : register.sourceUnits()) {
            linesByFile.put(unit.fileId(), unit.text().split("\n", -1));
        }

        List<CodeChunk> chunks = new ArrayList<>();
        for (CppFunction function : register.functions()) {
            chunks.add(functionChunk(function, linesByFile.get(function.fileId())));
        }
        for (CppClass cppClass : register.classes()) {
            chunks.add(classChunk(cppClass, linesByFile.get(cppClass.fileId())));
        }

        log.debug("Created {} chunks from {} functions and {} classes",
            chunks.size(), register.functions().size(), register.classes().size());
        return chunks;
    }

    private CodeChunk functionChunk(CppFunction function, String[] fileLines) {
        StringBuilder sb = new StringBuilder();
        sb.append("Function: ").append(function.qualifiedName()).append('\n');
        sb.append("Return Type: ").append(function.returnType()).append('\n');
        sb.append("Parameters: ").append(String.join(", ", function.parameters())).append('\n');
        if (function.isMethod()) {
            sb.append("Class: ").append(function.owningClass()).append('\n');
        }
        sb.append("File: ").append(function.fileId()).append('\n');
        sb.append("Line: ").append(function.lines().startLine()).append('\n');
        sb.append('\n');
        sb.append(excerpt(fileLines, function.lines()));

        Map<String, Object> metadata = baseMetadata(CodeChunk.ChunkType.FUNCTION, function.name(),
            function.qualifiedName(), function.fileId(), function.lines());
        metadata.put(KEY_RETURN_TYPE, function.returnType());
        metadata.put(KEY_PARAMETERS, function.parameters());
        metadata.put(KEY_CLASS_NAME, function.owningClass() != null ? function.owningClass() : "");
        metadata.put(KEY_IS_METHOD, function.isMethod());
        metadata.put(KEY_CALLS, function.calls().stream().distinct().toList());
        return new CodeChunk(CodeChunk.ChunkType.FUNCTION, function.qualifiedName(), sb.toString(), metadata);
    }

    private CodeChunk classChunk(CppClass cppClass, String[] fileLines) {
        StringBuilder sb = new StringBuilder();
        sb.append("Class: ").append(cppClass.qualifiedName()).append('\n');
        sb.append("Kind: ").append(cppClass.kind().name().toLowerCase(Locale.ROOT)).append('\n');
        sb.append("Base Classes: ")
            .append(cppClass.baseClasses().isEmpty() ? "None" : String.join(", ", cppClass.baseClasses()))
            .append('\n');
        sb.append("File: ").append(cppClass.fileId()).append('\n');
        sb.append("Line: ").append(cppClass.lines().startLine()).append('\n');
        sb.append("Methods:\n");
        for (CppFunction method : cppClass.methods()) {
            sb.append("  - ").append(method.signature()).append('\n');
        }
        sb.append('\n');
        sb.append(excerpt(fileLines, cppClass.lines()));

        Map<String, Object> metadata = baseMetadata(CodeChunk.ChunkType.CLASS, cppClass.name(),
            cppClass.qualifiedName(), cppClass.fileId(), cppClass.lines());
        metadata.put(KEY_KIND, cppClass.kind().name().toLowerCase(Locale.ROOT));
        metadata.put(KEY_BASE_CLASSES, cppClass.baseClasses());
        metadata.put(KEY_METHOD_COUNT, cppClass.methods().size());
        return new CodeChunk(CodeChunk.ChunkType.CLASS, cppClass.qualifiedName(), sb.toString(), metadata);
    }

    private static Map<String, Object> baseMetadata(CodeChunk.ChunkType type, String name, String qualifiedName,
                                                    String fileId, LineRange lines) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(KEY_TYPE, type.name().toLowerCase(Locale.ROOT));
        metadata.put(KEY_NAME, name);
        metadata.put(KEY_QUALIFIED_NAME, qualifiedName);
        metadata.put(KEY_FILE, fileId);
        metadata.put(KEY_LINE_START, lines.startLine());
        metadata.put(KEY_LINE_END, lines.endLine());
        return metadata;
    }

    /**
     * Source lines of a range, clamped to the file.
     */
    static String excerpt(String[] fileLines, LineRange range) {
        if (fileLines == null) {
            return "";
        }
        int from = Math.min(range.startLine() - 1, fileLines.length);
        int to = Math.min(range.endLine(), fileLines.length);
        if (from >= to) {
            return "";
        }
        return String.join("\n", Arrays.copyOfRange(fileLines, from, to));
    }
}
