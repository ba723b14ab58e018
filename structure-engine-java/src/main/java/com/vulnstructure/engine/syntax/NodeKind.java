package com.vulnstructure.engine.syntax;

import java.util.EnumSet;
import java.util.Set;

/**
 * Node kinds of the syntax tree, named after the usual C grammar node types
 * ("function_definition", "call_expression", ...).
 * {@link #TOKEN} covers keywords and punctuation; its type string is the token text.
 */
public enum NodeKind {

    TRANSLATION_UNIT("translation_unit"),
    FUNCTION_DEFINITION("function_definition"),
    DECLARATION("declaration"),
    PARAMETER_LIST("parameter_list"),
    PARAMETER_DECLARATION("parameter_declaration"),
    FIELD_DECLARATION_LIST("field_declaration_list"),
    FIELD_DECLARATION("field_declaration"),
    STRUCT_SPECIFIER("struct_specifier"),
    UNION_SPECIFIER("union_specifier"),
    ENUM_SPECIFIER("enum_specifier"),
    ENUMERATOR("enumerator"),
    PRIMITIVE_TYPE("primitive_type"),
    SIZED_TYPE_SPECIFIER("sized_type_specifier"),
    TYPE_IDENTIFIER("type_identifier"),
    TYPE_QUALIFIER("type_qualifier"),
    STORAGE_CLASS_SPECIFIER("storage_class_specifier"),
    ATTRIBUTE_SPECIFIER("attribute_specifier"),
    TYPE_DESCRIPTOR("type_descriptor"),
    ABSTRACT_DECLARATOR("abstract_declarator"),
    INIT_DECLARATOR("init_declarator"),
    POINTER_DECLARATOR("pointer_declarator"),
    ARRAY_DECLARATOR("array_declarator"),
    FUNCTION_DECLARATOR("function_declarator"),
    PARENTHESIZED_DECLARATOR("parenthesized_declarator"),
    INITIALIZER_LIST("initializer_list"),
    INITIALIZER_PAIR("initializer_pair"),

    COMPOUND_STATEMENT("compound_statement"),
    LABELED_STATEMENT("labeled_statement"),
    CASE_STATEMENT("case_statement"),
    IF_STATEMENT("if_statement"),
    ELSE_CLAUSE("else_clause"),
    SWITCH_STATEMENT("switch_statement"),
    WHILE_STATEMENT("while_statement"),
    DO_STATEMENT("do_statement"),
    FOR_STATEMENT("for_statement"),
    RETURN_STATEMENT("return_statement"),
    BREAK_STATEMENT("break_statement"),
    CONTINUE_STATEMENT("continue_statement"),
    GOTO_STATEMENT("goto_statement"),
    EXPRESSION_STATEMENT("expression_statement"),

    COMMA_EXPRESSION("comma_expression"),
    SUBSCRIPT_EXPRESSION("subscript_expression"),
    CALL_EXPRESSION("call_expression"),
    ARGUMENT_LIST("argument_list"),
    FIELD_EXPRESSION("field_expression"),
    UPDATE_EXPRESSION("update_expression"),
    COMPOUND_LITERAL_EXPRESSION("compound_literal_expression"),
    POINTER_EXPRESSION("pointer_expression"),
    UNARY_EXPRESSION("unary_expression"),
    SIZEOF_EXPRESSION("sizeof_expression"),
    CAST_EXPRESSION("cast_expression"),
    BINARY_EXPRESSION("binary_expression"),
    CONDITIONAL_EXPRESSION("conditional_expression"),
    ASSIGNMENT_EXPRESSION("assignment_expression"),
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    CONCATENATED_STRING("concatenated_string"),

    IDENTIFIER("identifier"),
    FIELD_IDENTIFIER("field_identifier"),
    STATEMENT_IDENTIFIER("statement_identifier"),
    NUMBER_LITERAL("number_literal"),
    CHAR_LITERAL("char_literal"),
    STRING_LITERAL("string_literal"),

    ERROR("ERROR"),
    TOKEN(null);

    private static final Set<NodeKind> TYPE_SPECIFIERS = EnumSet.of(
            PRIMITIVE_TYPE, SIZED_TYPE_SPECIFIER, TYPE_IDENTIFIER,
            STRUCT_SPECIFIER, UNION_SPECIFIER, ENUM_SPECIFIER);

    private final String typeName;

    NodeKind(String typeName) {
        this.typeName = typeName;
    }

    /** Grammar type string, or null for {@link #TOKEN}. */
    public String typeName() { return typeName; }

    public boolean isNamed() { return this != TOKEN; }

    public boolean isTypeSpecifier() { return TYPE_SPECIFIERS.contains(this); }
}
