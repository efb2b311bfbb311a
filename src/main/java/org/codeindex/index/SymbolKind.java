package org.codeindex.index;

import java.util.Locale;

/**
 * 符号种类（沿用 libclang cursor kind 的拼写）。
 * <p>
 * {@link #isContainer()} 为 true 的种类可以“包含”其他符号，例如函数、方法、类、命名空间；
 * 计算“所在函数”（containing function）时只考虑这类符号的定义。
 */
public enum SymbolKind {
    NAMESPACE("Namespace", true),
    CLASS_DECL("ClassDecl", true),
    STRUCT_DECL("StructDecl", true),
    UNION_DECL("UnionDecl", true),
    CLASS_TEMPLATE("ClassTemplate", true),
    FUNCTION_DECL("FunctionDecl", true),
    FUNCTION_TEMPLATE("FunctionTemplate", true),
    CXX_METHOD("CXXMethod", true),
    CONSTRUCTOR("CXXConstructor", true),
    DESTRUCTOR("CXXDestructor", true),
    CONVERSION_FUNCTION("CXXConversion", true),
    LAMBDA_EXPR("LambdaExpr", true),
    ENUM_DECL("EnumDecl", false),
    ENUM_CONSTANT_DECL("EnumConstantDecl", false),
    FIELD_DECL("FieldDecl", false),
    VAR_DECL("VarDecl", false),
    PARM_DECL("ParmDecl", false),
    TYPEDEF_DECL("TypedefDecl", false),
    MACRO_DEFINITION("macro definition", false),
    MACRO_EXPANSION("macro expansion", false),
    INCLUSION_DIRECTIVE("inclusion directive", false),
    CALL_EXPR("CallExpr", false),
    DECL_REF_EXPR("DeclRefExpr", false),
    MEMBER_REF_EXPR("MemberRefExpr", false),
    TYPE_REF("TypeRef", false),
    UNKNOWN("Unknown", false);

    private final String spelling;
    private final boolean container;

    SymbolKind(String spelling, boolean container) {
        this.spelling = spelling;
        this.container = container;
    }

    public String spelling() {
        return spelling;
    }

    public boolean isContainer() {
        return container;
    }

    /**
     * 解析种类：同时接受枚举名（{@code FUNCTION_DECL}，大小写不敏感）与拼写（{@code FunctionDecl}）。
     * 无法识别时返回 {@link #UNKNOWN}。
     */
    public static SymbolKind parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = value.trim();
        for (SymbolKind kind : values()) {
            if (kind.spelling.equals(trimmed) || kind.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
