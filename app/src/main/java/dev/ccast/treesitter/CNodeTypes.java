package dev.ccast.treesitter;

import java.util.Set;

/** Tree-sitter node type names shared by the C and C++ grammars. */
public final class CNodeTypes {

    // Root and error recovery
    public static final String TRANSLATION_UNIT = "translation_unit";
    public static final String ERROR = "ERROR";

    // Definitions
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String NAMESPACE_DEFINITION = "namespace_definition";
    public static final String TYPE_DEFINITION = "type_definition";
    public static final String PREPROC_DEF = "preproc_def";
    public static final String PREPROC_FUNCTION_DEF = "preproc_function_def";

    // Specifiers
    public static final String STRUCT_SPECIFIER = "struct_specifier";
    public static final String UNION_SPECIFIER = "union_specifier";
    public static final String ENUM_SPECIFIER = "enum_specifier";
    public static final String CLASS_SPECIFIER = "class_specifier";

    // Other nodes
    public static final String ENUMERATOR = "enumerator";
    public static final String CALL_EXPRESSION = "call_expression";

    // Names
    public static final String IDENTIFIER = "identifier";
    public static final String FIELD_IDENTIFIER = "field_identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String NAMESPACE_IDENTIFIER = "namespace_identifier";
    public static final String QUALIFIED_IDENTIFIER = "qualified_identifier";
    public static final String DESTRUCTOR_NAME = "destructor_name";
    public static final String OPERATOR_NAME = "operator_name";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_DECLARATOR = "declarator";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_FUNCTION = "function";

    /** Node types whose text is the name they declare or reference. */
    public static final Set<String> NAME_TYPES = Set.of(
            IDENTIFIER,
            FIELD_IDENTIFIER,
            TYPE_IDENTIFIER,
            NAMESPACE_IDENTIFIER,
            QUALIFIED_IDENTIFIER,
            DESTRUCTOR_NAME,
            OPERATOR_NAME);

    /** Specifiers that are definitions only when they carry a body. */
    public static final Set<String> TAG_SPECIFIERS =
            Set.of(STRUCT_SPECIFIER, UNION_SPECIFIER, ENUM_SPECIFIER, CLASS_SPECIFIER);

    /** Node types that always define the name they carry. */
    public static final Set<String> DEFINITION_TYPES = Set.of(
            FUNCTION_DEFINITION, NAMESPACE_DEFINITION, TYPE_DEFINITION, ENUMERATOR, PREPROC_DEF, PREPROC_FUNCTION_DEF);

    private CNodeTypes() {}
}
