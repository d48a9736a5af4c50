package com.gaming.loyalty.engine.formula;

record FormulaToken(Kind kind, String text, int position) {

    enum Kind {
        NUMBER,
        IDENTIFIER,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        LEFT_PAREN,
        RIGHT_PAREN,
        END
    }
}
