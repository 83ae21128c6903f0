package com.usageprofile.counter.static_analysis;

/**
 * Node type names of the tree-sitter Python grammar used by the analysis.
 */
final class PythonNodeTypes {

    private PythonNodeTypes() {}

    static final String ERROR = "ERROR";

    // Statements
    static final String IMPORT = "import_statement";
    static final String IMPORT_FROM = "import_from_statement";
    static final String FUTURE_IMPORT = "future_import_statement";
    static final String FUNCTION_DEFINITION = "function_definition";
    static final String CLASS_DEFINITION = "class_definition";
    static final String IF = "if_statement";
    static final String ELIF = "elif_clause";
    static final String ELSE = "else_clause";
    static final String FOR = "for_statement";
    static final String WHILE = "while_statement";
    static final String TRY = "try_statement";
    static final String EXCEPT = "except_clause";
    static final String EXCEPT_GROUP = "except_group_clause";
    static final String FINALLY = "finally_clause";
    static final String WITH = "with_statement";
    static final String WITH_CLAUSE = "with_clause";
    static final String WITH_ITEM = "with_item";
    static final String MATCH = "match_statement";
    static final String CASE = "case_clause";
    static final String GLOBAL = "global_statement";
    static final String NONLOCAL = "nonlocal_statement";
    static final String DELETE = "delete_statement";

    // Import parts
    static final String DOTTED_NAME = "dotted_name";
    static final String ALIASED_IMPORT = "aliased_import";
    static final String RELATIVE_IMPORT = "relative_import";
    static final String IMPORT_PREFIX = "import_prefix";
    static final String WILDCARD_IMPORT = "wildcard_import";

    // Assignment forms
    static final String ASSIGNMENT = "assignment";
    static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    static final String NAMED_EXPRESSION = "named_expression";
    static final String AS_PATTERN = "as_pattern";
    static final String AS_PATTERN_TARGET = "as_pattern_target";

    // Expressions
    static final String CALL = "call";
    static final String IDENTIFIER = "identifier";
    static final String ATTRIBUTE = "attribute";
    static final String KEYWORD_ARGUMENT = "keyword_argument";
    static final String LIST_SPLAT = "list_splat";
    static final String DICTIONARY_SPLAT = "dictionary_splat";
    static final String PARENTHESIZED = "parenthesized_expression";
    static final String LAMBDA = "lambda";
    static final String STRING = "string";
    static final String STRING_START = "string_start";
    static final String STRING_END = "string_end";
    static final String INTERPOLATION = "interpolation";
    static final String CONCATENATED_STRING = "concatenated_string";
    static final String INTEGER = "integer";
    static final String FLOAT = "float";
    static final String TRUE = "true";
    static final String FALSE = "false";
    static final String NONE = "none";
    static final String ELLIPSIS = "ellipsis";
    static final String UNARY_OPERATOR = "unary_operator";
    static final String LIST = "list";
    static final String TUPLE = "tuple";
    static final String DICTIONARY = "dictionary";
    static final String SET = "set";
    static final String LIST_COMPREHENSION = "list_comprehension";
    static final String DICTIONARY_COMPREHENSION = "dictionary_comprehension";
    static final String SET_COMPREHENSION = "set_comprehension";
    static final String GENERATOR_EXPRESSION = "generator_expression";
    static final String FOR_IN_CLAUSE = "for_in_clause";
    static final String IF_CLAUSE = "if_clause";

    // Parameters
    static final String TYPED_PARAMETER = "typed_parameter";
    static final String DEFAULT_PARAMETER = "default_parameter";
    static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";
}
