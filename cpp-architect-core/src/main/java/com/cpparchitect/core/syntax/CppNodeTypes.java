package com.cpparchitect.core.syntax;

/**
 * Node type tags and field names of the tree-sitter C++ grammar used by extraction.
 */
public final class CppNodeTypes {

    // Definitions
    public static final String TRANSLATION_UNIT = "translation_unit";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String CLASS_SPECIFIER = "class_specifier";
    public static final String STRUCT_SPECIFIER = "struct_specifier";
    public static final String NAMESPACE_DEFINITION = "namespace_definition";
    public static final String TEMPLATE_DECLARATION = "template_declaration";
    public static final String LINKAGE_SPECIFICATION = "linkage_specification";
    public static final String FIELD_DECLARATION_LIST = "field_declaration_list";
    public static final String DECLARATION_LIST = "declaration_list";
    public static final String BASE_CLASS_CLAUSE = "base_class_clause";

    // Declarators and names
    public static final String FUNCTION_DECLARATOR = "function_declarator";
    public static final String POINTER_DECLARATOR = "pointer_declarator";
    public static final String REFERENCE_DECLARATOR = "reference_declarator";
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER_DECLARATION = "parameter_declaration";
    public static final String OPTIONAL_PARAMETER_DECLARATION = "optional_parameter_declaration";
    public static final String VARIADIC_PARAMETER_DECLARATION = "variadic_parameter_declaration";
    public static final String IDENTIFIER = "identifier";
    public static final String FIELD_IDENTIFIER = "field_identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String QUALIFIED_IDENTIFIER = "qualified_identifier";
    public static final String DESTRUCTOR_NAME = "destructor_name";
    public static final String OPERATOR_NAME = "operator_name";
    public static final String TEMPLATE_TYPE = "template_type";
    public static final String NAMESPACE_IDENTIFIER = "namespace_identifier";

    // Statements
    public static final String COMPOUND_STATEMENT = "compound_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String FOR_RANGE_LOOP = "for_range_loop";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String CASE_STATEMENT = "case_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String DECLARATION = "declaration";
    public static final String THROW_STATEMENT = "throw_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String GOTO_STATEMENT = "goto_statement";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String COMMENT = "comment";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_DECLARATOR = "declarator";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_CONDITION = "condition";
    public static final String FIELD_CONSEQUENCE = "consequence";
    public static final String FIELD_ALTERNATIVE = "alternative";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_SCOPE = "scope";

    private CppNodeTypes() {
        // Constants holder
    }
}
