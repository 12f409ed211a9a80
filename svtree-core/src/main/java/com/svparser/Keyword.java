package com.svparser;

import java.util.HashMap;
import java.util.Map;

/**
 * Reserved words the structural parser dispatches on. Any other identifier-shaped word,
 * including language keywords the grammar does not model, lexes as an identifier.
 */
public enum Keyword {
    CLASS("class", Category.DECLARATION),
    ENDCLASS("endclass", Category.DECLARATION),
    MODULE("module", Category.DECLARATION),
    ENDMODULE("endmodule", Category.DECLARATION),
    FUNCTION("function", Category.DECLARATION),
    ENDFUNCTION("endfunction", Category.DECLARATION),

    ALWAYS("always", Category.PROCESS),
    ALWAYS_FF("always_ff", Category.PROCESS),
    ALWAYS_COMB("always_comb", Category.PROCESS),
    ALWAYS_LATCH("always_latch", Category.PROCESS),

    INPUT("input", Category.DIRECTION),
    OUTPUT("output", Category.DIRECTION),
    INOUT("inout", Category.DIRECTION),

    LOGIC("logic", Category.DATA_TYPE),
    WIRE("wire", Category.DATA_TYPE),
    REG("reg", Category.DATA_TYPE),
    BIT("bit", Category.DATA_TYPE),
    BYTE("byte", Category.DATA_TYPE),
    INT("int", Category.DATA_TYPE),
    INTEGER("integer", Category.DATA_TYPE),
    SHORTINT("shortint", Category.DATA_TYPE),
    LONGINT("longint", Category.DATA_TYPE),
    REAL("real", Category.DATA_TYPE),
    STRING("string", Category.DATA_TYPE),

    IF("if", Category.CONTROL),
    ELSE("else", Category.CONTROL),
    CASE("case", Category.CONTROL),
    ENDCASE("endcase", Category.CONTROL),
    BEGIN("begin", Category.CONTROL),
    END("end", Category.CONTROL);

    public enum Category {
        DECLARATION,
        PROCESS,
        DIRECTION,
        DATA_TYPE,
        CONTROL
    }

    private static final Map<String, Keyword> BY_TEXT = new HashMap<>();

    static {
        for (Keyword kw : values()) {
            BY_TEXT.put(kw.text, kw);
        }
    }

    private final String text;
    private final Category category;

    Keyword(String text, Category category) {
        this.text = text;
        this.category = category;
    }

    public String text() {
        return text;
    }

    public Category category() {
        return category;
    }

    public boolean isDataType() {
        return category == Category.DATA_TYPE;
    }

    public boolean isProcess() {
        return category == Category.PROCESS;
    }

    /**
     * Exact, case-sensitive lookup.
     *
     * @return the keyword spelled {@code word}, or null if the word is not reserved
     */
    public static Keyword lookup(String word) {
        return BY_TEXT.get(word);
    }
}
