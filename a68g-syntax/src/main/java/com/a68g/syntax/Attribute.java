package com.a68g.syntax;

/**
 * 语法树节点属性（文法产生式）。
 * 只列出优化器会检查的产生式，其余统一为 {@link #OTHER}。
 */
public enum Attribute {
    // 包装层
    UNIT, TERTIARY, SECONDARY, PRIMARY, ENCLOSED_CLAUSE, VOIDING,

    // 子句
    CLOSED_CLAUSE, COLLATERAL_CLAUSE, CONDITIONAL_CLAUSE, CASE_CLAUSE, LOOP_CLAUSE,
    CODE_CLAUSE, SERIAL_CLAUSE, DECLARATION_LIST, INITIALISER_SERIES,

    // 单元
    ASSIGNATION, IDENTIFIER, DEREFERENCING, SLICE, SELECTION, SELECTOR, FIELD_IDENTIFIER,
    WIDENING, CAST, DENOTATION, SHORTETY, LONGETY, MONADIC_FORMULA, FORMULA, OPERATOR,
    CALL, DEPROCEDURING, IDENTITY_RELATION, IS_SYMBOL, ISNT_SYMBOL, UNITING, NIHIL,
    ROUTINE_TEXT, FORMAT_TEXT, DECLARER,

    // 实参与下标
    ARGUMENT_LIST, ARGUMENT, GENERIC_ARGUMENT_LIST, GENERIC_ARGUMENT, TRIMMER, INDEXER,

    // 代码子句文本
    ROW_CHAR_DENOTATION,

    // 条件子句
    IF_PART, OPEN_PART, THEN_PART, ELSE_PART, ELIF_PART, ELIF_IF_PART, ELSE_OPEN_PART,
    BRIEF_ELIF_PART, CHOICE, FI_SYMBOL,

    // 分情形子句
    CASE_PART, CASE_IN_PART, OUT_PART, ESAC_SYMBOL,

    // 循环子句
    FOR_PART, FROM_PART, BY_PART, TO_PART, TO_SYMBOL, DOWNTO_SYMBOL, WHILE_PART,
    DO_PART, ALT_DO_PART, UNTIL_PART,

    // 符号
    OPEN_SYMBOL, CLOSE_SYMBOL, SEMI_SYMBOL, COMMA_SYMBOL, EQUALS_SYMBOL, ASSIGN_SYMBOL,
    BEGIN_SYMBOL, END_SYMBOL,

    // 声明
    IDENTITY_DECLARATION, VARIABLE_DECLARATION, PROCEDURE_DECLARATION,
    PROCEDURE_VARIABLE_DECLARATION, OPERATOR_DECLARATION, BRIEF_OPERATOR_DECLARATION,
    MODE_DECLARATION, PRIORITY_DECLARATION, DEFINING_IDENTIFIER,

    OTHER
}
