package org.dxworks.typfmt.syntax;

/**
 * Closed set of node kinds produced by {@link TypstParser}.
 * Every kind belongs to one {@link Category}; converters switch over the kinds exhaustively.
 */
public enum SyntaxKind {
    // markup
    MARKUP(Category.NODE),
    TEXT(Category.EXPR),
    SPACE(Category.TRIVIA),
    LINEBREAK(Category.EXPR),
    PARBREAK(Category.TRIVIA),
    ESCAPE(Category.EXPR),
    SHORTHAND(Category.EXPR),
    SMART_QUOTE(Category.EXPR),
    STRONG(Category.EXPR),
    EMPH(Category.EXPR),
    RAW(Category.EXPR),
    RAW_LANG(Category.TOKEN),
    RAW_DELIM(Category.TOKEN),
    RAW_TRIMMED(Category.TOKEN),
    LINK(Category.EXPR),
    LABEL(Category.EXPR),
    REF(Category.EXPR),
    REF_MARKER(Category.TOKEN),
    HEADING(Category.EXPR),
    HEADING_MARKER(Category.TOKEN),
    LIST_ITEM(Category.EXPR),
    LIST_MARKER(Category.TOKEN),
    ENUM_ITEM(Category.EXPR),
    ENUM_MARKER(Category.TOKEN),
    TERM_ITEM(Category.EXPR),
    TERM_MARKER(Category.TOKEN),
    EQUATION(Category.EXPR),

    // math
    MATH(Category.EXPR),
    MATH_IDENT(Category.EXPR),
    MATH_SHORTHAND(Category.EXPR),
    MATH_ALIGN_POINT(Category.EXPR),
    MATH_DELIMITED(Category.EXPR),
    MATH_ATTACH(Category.EXPR),
    MATH_PRIMES(Category.EXPR),
    MATH_FRAC(Category.EXPR),
    MATH_ROOT(Category.EXPR),

    // punctuation
    HASH(Category.TOKEN),
    LEFT_BRACE(Category.TOKEN),
    RIGHT_BRACE(Category.TOKEN),
    LEFT_BRACKET(Category.TOKEN),
    RIGHT_BRACKET(Category.TOKEN),
    LEFT_PAREN(Category.TOKEN),
    RIGHT_PAREN(Category.TOKEN),
    COMMA(Category.TOKEN),
    SEMICOLON(Category.TOKEN),
    COLON(Category.TOKEN),
    STAR(Category.TOKEN),
    UNDERSCORE(Category.TOKEN),
    DOLLAR(Category.TOKEN),
    PLUS(Category.TOKEN),
    MINUS(Category.TOKEN),
    SLASH(Category.TOKEN),
    HAT(Category.TOKEN),
    PRIME(Category.TOKEN),
    DOT(Category.TOKEN),
    EQ(Category.TOKEN),
    EQ_EQ(Category.TOKEN),
    EXCL_EQ(Category.TOKEN),
    LT(Category.TOKEN),
    LT_EQ(Category.TOKEN),
    GT(Category.TOKEN),
    GT_EQ(Category.TOKEN),
    PLUS_EQ(Category.TOKEN),
    HYPH_EQ(Category.TOKEN),
    STAR_EQ(Category.TOKEN),
    SLASH_EQ(Category.TOKEN),
    DOTS(Category.TOKEN),
    ARROW(Category.TOKEN),
    ROOT(Category.TOKEN),

    // keywords
    NOT(Category.KEYWORD),
    AND(Category.KEYWORD),
    OR(Category.KEYWORD),
    LET(Category.KEYWORD),
    SET(Category.KEYWORD),
    SHOW(Category.KEYWORD),
    CONTEXT(Category.KEYWORD),
    IF(Category.KEYWORD),
    ELSE(Category.KEYWORD),
    FOR(Category.KEYWORD),
    IN(Category.KEYWORD),
    WHILE(Category.KEYWORD),
    BREAK(Category.KEYWORD),
    CONTINUE(Category.KEYWORD),
    RETURN(Category.KEYWORD),
    IMPORT(Category.KEYWORD),
    INCLUDE(Category.KEYWORD),
    AS(Category.KEYWORD),

    // code
    CODE(Category.NODE),
    IDENT(Category.EXPR),
    NONE(Category.EXPR),
    AUTO(Category.EXPR),
    BOOL(Category.EXPR),
    INT(Category.EXPR),
    FLOAT(Category.EXPR),
    NUMERIC(Category.EXPR),
    STR(Category.EXPR),
    CODE_BLOCK(Category.EXPR),
    CONTENT_BLOCK(Category.EXPR),
    PARENTHESIZED(Category.EXPR),
    ARRAY(Category.EXPR),
    DICT(Category.EXPR),
    NAMED(Category.NODE),
    KEYED(Category.NODE),
    UNARY(Category.EXPR),
    BINARY(Category.EXPR),
    FIELD_ACCESS(Category.EXPR),
    FUNC_CALL(Category.EXPR),
    ARGS(Category.NODE),
    SPREAD(Category.NODE),
    CLOSURE(Category.EXPR),
    PARAMS(Category.NODE),
    LET_BINDING(Category.EXPR),
    SET_RULE(Category.EXPR),
    SHOW_RULE(Category.EXPR),
    CONTEXTUAL(Category.EXPR),
    CONDITIONAL(Category.EXPR),
    WHILE_LOOP(Category.EXPR),
    FOR_LOOP(Category.EXPR),
    MODULE_IMPORT(Category.EXPR),
    IMPORT_ITEMS(Category.NODE),
    RENAMED_IMPORT_ITEM(Category.NODE),
    MODULE_INCLUDE(Category.EXPR),
    LOOP_BREAK(Category.EXPR),
    LOOP_CONTINUE(Category.EXPR),
    FUNC_RETURN(Category.EXPR),
    DESTRUCTURING(Category.NODE),
    DESTRUCT_ASSIGNMENT(Category.EXPR),

    LINE_COMMENT(Category.TRIVIA),
    BLOCK_COMMENT(Category.TRIVIA),
    ERROR(Category.ERROR);

    public enum Category {
        /** Fixed punctuation or marker token. */
        TOKEN,
        KEYWORD,
        /** Whitespace and comments. */
        TRIVIA,
        /** Node that can stand as an expression in markup, code or math. */
        EXPR,
        /** Structural node that only appears inside a specific parent. */
        NODE,
        ERROR
    }

    private final Category category;

    SyntaxKind(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isExpr() {
        return category == Category.EXPR;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    public boolean isTrivia() {
        return category == Category.TRIVIA;
    }

    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }

    /** Statements end a markup line when embedded with {@code #}. */
    public boolean isStmt() {
        return this == LET_BINDING || this == SET_RULE || this == SHOW_RULE
                || this == MODULE_IMPORT || this == MODULE_INCLUDE;
    }

    public boolean isBinaryOp() {
        switch (this) {
            case PLUS, MINUS, STAR, SLASH, EQ_EQ, EXCL_EQ, LT, LT_EQ, GT, GT_EQ,
                    AND, OR, IN, EQ, PLUS_EQ, HYPH_EQ, STAR_EQ, SLASH_EQ:
                return true;
            default:
                return false;
        }
    }

    public boolean isUnaryOp() {
        return this == PLUS || this == MINUS || this == NOT;
    }
}
