package com.svparser;

import com.svparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static ModuleDeclaration onlyModule(String source) {
        Source ast = Parser.parse(source);
        assertEquals(1, ast.items().size(), "expected exactly one top-level declaration");
        return assertInstanceOf(ModuleDeclaration.class, ast.items().get(0));
    }

    private static ClassDeclaration onlyClass(String source) {
        Source ast = Parser.parse(source);
        assertEquals(1, ast.items().size(), "expected exactly one top-level declaration");
        return assertInstanceOf(ClassDeclaration.class, ast.items().get(0));
    }

    // ========== Declarations ==========

    @Test
    void testModuleWithPorts() {
        String source = "module m(input a, output b); endmodule";
        ModuleDeclaration module = onlyModule(source);

        assertEquals("m", module.name());
        assertEquals(List.of("input", "a", "output", "b"), module.ports());
        assertEquals(List.of(), module.parameters());
        assertEquals(0, module.body().size());
        assertTrue(module.terminated());

        assertEquals(0, module.start());
        assertEquals(source.length(), module.end());
        assertEquals(new SourceLocation.Position(1, 0), module.loc().start());
        assertEquals(new SourceLocation.Position(1, source.length()), module.loc().end());
    }

    @Test
    void testClassWithFunction() {
        ClassDeclaration cls = onlyClass(
            "class c extends base; function void f(int x); x; endfunction endclass");

        assertEquals("c", cls.name());
        assertEquals("base", cls.superClass());
        assertTrue(cls.terminated());
        assertEquals(1, cls.members().size());

        FunctionDeclaration f = cls.members().get(0);
        assertEquals("f", f.name());
        assertEquals("void", f.returnType());
        assertEquals(List.of("int", "x"), f.args());
        assertTrue(f.terminated());
        assertEquals(1, f.body().size());
        GenericStatement stmt = assertInstanceOf(GenericStatement.class, f.body().get(0));
        assertEquals("x", stmt.code());
    }

    @Test
    void testSignalDeclaration() {
        ModuleDeclaration module = onlyModule("module m; logic [7:0] a, b; endmodule");

        assertEquals(1, module.body().size());
        SignalDeclaration signal = assertInstanceOf(SignalDeclaration.class, module.body().get(0));
        assertEquals("logic", signal.dataType());
        assertEquals("[7:0]", signal.width());
        assertEquals(List.of("a", "b"), signal.names());
    }

    @Test
    void testSignalWithoutWidthAndMultipleDimensions() {
        ModuleDeclaration module = onlyModule("module m; int count; reg [3:0][7:0] mem [0:15]; endmodule");

        SignalDeclaration count = assertInstanceOf(SignalDeclaration.class, module.body().get(0));
        assertEquals("int", count.dataType());
        assertNull(count.width());
        assertEquals(List.of("count"), count.names());

        SignalDeclaration mem = assertInstanceOf(SignalDeclaration.class, module.body().get(1));
        assertEquals("[3:0][7:0]", mem.width());
        assertEquals(List.of("mem[0:15]"), mem.names());
    }

    @Test
    void testAlwaysWithIf() {
        ModuleDeclaration module = onlyModule("module m; always_ff @(posedge clk) if (rst) a <= 0; endmodule");

        assertEquals(1, module.body().size());
        AlwaysBlock always = assertInstanceOf(AlwaysBlock.class, module.body().get(0));
        assertEquals("always_ff", always.kind());
        assertEquals("@(posedge clk)", always.sensitivity());

        assertEquals(1, always.body().size());
        IfStatement ifStmt = assertInstanceOf(IfStatement.class, always.body().get(0));
        assertEquals("rst", ifStmt.condition());
        assertNull(ifStmt.alternate());
        assertEquals(1, ifStmt.consequent().size());
        GenericStatement stmt = assertInstanceOf(GenericStatement.class, ifStmt.consequent().get(0));
        assertEquals("a<=0", stmt.code());
        assertTrue(module.terminated());
    }

    @Test
    void testMisspelledTerminator() {
        ModuleDeclaration module = onlyModule("module m; endmodul");

        assertEquals("m", module.name());
        assertFalse(module.terminated());
        assertEquals(1, module.body().size());
        GenericStatement stmt = assertInstanceOf(GenericStatement.class, module.body().get(0));
        assertEquals("endmodul", stmt.code());
    }

    @Test
    void testModuleParameters() {
        ModuleDeclaration module = onlyModule(
            "module fifo #(parameter W = 8, D = 4) (input [W-1:0] d, output q); endmodule");

        assertEquals("fifo", module.name());
        assertEquals(List.of("parameter", "W", "=", "8", "D", "=", "4"), module.parameters());
        assertEquals(List.of("input", "[", "W", "-", "1", ":", "0", "]", "d", "output", "q"), module.ports());
    }

    @Test
    void testClassSkipsNonFunctionMembers() {
        ClassDeclaration cls = onlyClass(
            "class counter; int x; function int get(); return x; endfunction task t; endtask endclass");

        assertNull(cls.superClass());
        assertEquals(1, cls.members().size());
        FunctionDeclaration get = cls.members().get(0);
        assertEquals("get", get.name());
        assertEquals("int", get.returnType());
        assertEquals(List.of(), get.args());
        GenericStatement stmt = assertInstanceOf(GenericStatement.class, get.body().get(0));
        assertEquals("return x", stmt.code());
    }

    @Test
    void testConstructorHasNoReturnType() {
        FunctionDeclaration ctor = onlyClass("class c; function new(); endfunction endclass").members().get(0);
        assertEquals("new", ctor.name());
        assertNull(ctor.returnType());
        assertEquals(0, ctor.body().size());
        assertTrue(ctor.terminated());
    }

    @Test
    void testMultiWordReturnType() {
        FunctionDeclaration f = onlyClass(
            "class c; function automatic logic [3:0] pick(input int i); endfunction endclass").members().get(0);
        assertEquals("pick", f.name());
        assertEquals("automatic logic[3:0]", f.returnType());
        assertEquals(List.of("input", "int", "i"), f.args());
    }

    // ========== Statements ==========

    @Test
    void testElseIfChain() {
        ModuleDeclaration module = onlyModule(
            "module m; always_comb if (a) x = 1; else if (b) x = 2; else x = 3; endmodule");

        AlwaysBlock always = assertInstanceOf(AlwaysBlock.class, module.body().get(0));
        assertNull(always.sensitivity());
        IfStatement outer = assertInstanceOf(IfStatement.class, always.body().get(0));
        assertEquals("a", outer.condition());
        assertNotNull(outer.alternate());
        IfStatement inner = assertInstanceOf(IfStatement.class, outer.alternate().get(0));
        assertEquals("b", inner.condition());
        assertEquals("x=2", ((GenericStatement) inner.consequent().get(0)).code());
        assertEquals("x=3", ((GenericStatement) inner.alternate().get(0)).code());
        assertEquals(1, module.body().size());
    }

    @Test
    void testCaseStatement() {
        ModuleDeclaration module = onlyModule(
            "module m; always @* case (sel) 0: y = a; default: y = b; endcase endmodule");

        AlwaysBlock always = assertInstanceOf(AlwaysBlock.class, module.body().get(0));
        assertEquals("always", always.kind());
        assertEquals("@*", always.sensitivity());
        CaseStatement cs = assertInstanceOf(CaseStatement.class, always.body().get(0));
        assertEquals("sel", cs.expression());
        assertTrue(cs.terminated());
        assertEquals(2, cs.body().size());
        assertEquals("0:y=a", ((GenericStatement) cs.body().get(0)).code());
        assertEquals("default:y=b", ((GenericStatement) cs.body().get(1)).code());
        assertTrue(module.terminated());
    }

    @Test
    void testLabeledBeginEnd() {
        ModuleDeclaration module = onlyModule(
            "module m; always @(posedge clk) begin : seq a <= b; c <= d; end : seq endmodule : m");

        AlwaysBlock always = assertInstanceOf(AlwaysBlock.class, module.body().get(0));
        NestedBlock block = assertInstanceOf(NestedBlock.class, always.body().get(0));
        assertEquals("seq", block.label());
        assertTrue(block.terminated());
        assertEquals(2, block.body().size());
        assertEquals("c<=d", ((GenericStatement) block.body().get(1)).code());
        assertEquals(1, module.body().size());
        assertTrue(module.terminated());
    }

    @Test
    void testFunctionInsideModule() {
        ModuleDeclaration module = onlyModule(
            "module m; function int add(int a, int b); return a + b; endfunction assign y = add(1, 2); endmodule");

        assertEquals(2, module.body().size());
        FunctionDeclaration add = assertInstanceOf(FunctionDeclaration.class, module.body().get(0));
        assertEquals(List.of("int", "a", "int", "b"), add.args());
        assertEquals("return a+b", ((GenericStatement) add.body().get(0)).code());
        assertEquals("assign y=add(1,2)", ((GenericStatement) module.body().get(1)).code());
    }

    @Test
    void testStrayTerminatorsProduceNoItems() {
        ModuleDeclaration module = onlyModule("module m; ; ; logic a;; endmodule");
        assertEquals(1, module.body().size());
        assertInstanceOf(SignalDeclaration.class, module.body().get(0));
    }

    // ========== Termination and recovery ==========

    @Test
    void testTerminatorIsConsumedOnce() {
        Parser parser = new Parser("module a; endmodule : a class b; endclass module c; endmodule");
        Source ast = parser.parse();

        assertEquals(3, ast.items().size());
        assertEquals("a", ((ModuleDeclaration) ast.items().get(0)).name());
        assertEquals("b", ((ClassDeclaration) ast.items().get(1)).name());
        assertEquals("c", ((ModuleDeclaration) ast.items().get(2)).name());
        assertTrue(((ModuleDeclaration) ast.items().get(0)).terminated());
        assertEquals(parser.tokens().size() - 1, parser.position());
    }

    @Test
    void testMissingEndmoduleKeepsSameBody() {
        List<String> bodies = List.of(
            "logic [7:0] a, b; wire c;",
            "always_ff @(posedge clk) if (rst) q <= 0; else q <= d;",
            "function int inc(int v); return v + 1; endfunction",
            "always_comb case (sel) 0: y = a; default: y = b; endcase",
            "initial begin : init x = 0; y = 1; end",
            "assign y = a & b"
        );
        for (String body : bodies) {
            ModuleDeclaration closed = onlyModule("module m; " + body + " endmodule");
            ModuleDeclaration open = onlyModule("module m; " + body);

            assertTrue(closed.terminated(), body);
            assertFalse(open.terminated(), body);
            assertEquals(closed.body(), open.body(), body);
        }
    }

    @Test
    void testTruncatedInputLeavesConstructsUnterminated() {
        ModuleDeclaration module = onlyModule("module m; always @(posedge clk) begin if (a) b = 1;");

        assertFalse(module.terminated());
        AlwaysBlock always = assertInstanceOf(AlwaysBlock.class, module.body().get(0));
        NestedBlock block = assertInstanceOf(NestedBlock.class, always.body().get(0));
        assertFalse(block.terminated());
        IfStatement ifStmt = assertInstanceOf(IfStatement.class, block.body().get(0));
        assertEquals("b=1", ((GenericStatement) ifStmt.consequent().get(0)).code());
    }

    @Test
    void testMissingInnerTerminatorRecoversAtEnclosing() {
        ModuleDeclaration module = onlyModule("module m; function f; x = 1; endmodule");

        assertTrue(module.terminated());
        FunctionDeclaration f = assertInstanceOf(FunctionDeclaration.class, module.body().get(0));
        assertEquals("f", f.name());
        assertFalse(f.terminated());
        assertEquals(1, f.body().size());
    }

    @Test
    void testNextModuleStartsNewDeclaration() {
        Source ast = Parser.parse("module a; logic x; module b; endmodule");
        assertEquals(2, ast.items().size());
        assertFalse(((ModuleDeclaration) ast.items().get(0)).terminated());
        assertTrue(((ModuleDeclaration) ast.items().get(1)).terminated());
    }

    @Test
    void testTopLevelNoiseIsIgnored() {
        Source ast = Parser.parse("`timescale 1ns/1ps\nimport pkg::*;\nmodule m; endmodule\nendmodule");
        assertEquals(1, ast.items().size());
    }

    @Test
    void testDeclarationKeywordAtEndOfInput() {
        ModuleDeclaration module = onlyModule("module");
        assertEquals("", module.name());
        assertFalse(module.terminated());
        assertEquals(0, module.body().size());
    }

    // ========== Nesting ==========

    @Test
    void testNestingIsPreserved() {
        ModuleDeclaration module = onlyModule(
            "module m; always @(posedge clk) begin if (en) logic [1:0] t; end endmodule");

        AlwaysBlock always = assertInstanceOf(AlwaysBlock.class, module.body().get(0));
        NestedBlock block = assertInstanceOf(NestedBlock.class, always.body().get(0));
        IfStatement ifStmt = assertInstanceOf(IfStatement.class, block.body().get(0));
        SignalDeclaration signal = assertInstanceOf(SignalDeclaration.class, ifStmt.consequent().get(0));
        assertEquals("[1:0]", signal.width());
        assertEquals(List.of("t"), signal.names());
        assertTrue(block.terminated());
        assertTrue(module.terminated());
    }

    @Test
    void testNestingBeyondLimitBecomesGenericText() {
        ParserOptions options = ParserOptions.defaults().withMaxNestingDepth(2);
        Source ast = Parser.parse("module m; begin begin begin x; end end end endmodule", options);

        ModuleDeclaration module = (ModuleDeclaration) ast.items().get(0);
        assertEquals(2, module.body().size());
        NestedBlock outer = assertInstanceOf(NestedBlock.class, module.body().get(0));
        NestedBlock inner = assertInstanceOf(NestedBlock.class, outer.body().get(0));
        assertEquals("begin x", ((GenericStatement) inner.body().get(0)).code());
        assertEquals("end", ((GenericStatement) module.body().get(1)).code());
        assertTrue(module.terminated());
    }

    @Test
    void testDeepNestingDoesNotOverflow() {
        int levels = 5000;
        String source = "module m; " + "begin ".repeat(levels) + "x; " + "end ".repeat(levels) + "endmodule";
        Source ast = assertDoesNotThrow(() -> Parser.parse(source));
        assertEquals(1, ast.items().size());
    }

    // ========== Locations and options ==========

    @Test
    void testMultiLineLocations() {
        String source = "module m;\n  logic a;\nendmodule\n";
        Source ast = Parser.parse(source);
        ModuleDeclaration module = (ModuleDeclaration) ast.items().get(0);
        SignalDeclaration signal = (SignalDeclaration) module.body().get(0);

        assertEquals(new SourceLocation.Position(2, 2), signal.loc().start());
        assertEquals(new SourceLocation.Position(2, 10), signal.loc().end());
        assertEquals(new SourceLocation.Position(3, 9), module.loc().end());
        assertEquals(source.length(), ast.end());
        assertEquals(new SourceLocation.Position(4, 0), ast.loc().end());
    }

    @Test
    void testParseFromTokens() {
        List<Token> tokens = new Lexer("module m; logic a; endmodule").tokenize();
        List<Token> withoutEof = tokens.subList(0, tokens.size() - 1);

        Source ast = new Parser(withoutEof).parse();
        ModuleDeclaration module = (ModuleDeclaration) ast.items().get(0);
        assertTrue(module.terminated());
        assertEquals(1, module.body().size());
    }

    @Test
    void testCustomStatementTerminator() {
        ParserOptions options = ParserOptions.defaults().withStatementTerminators(Set.of(";", ","));
        ModuleDeclaration module = (ModuleDeclaration) Parser.parse("module m; a = 1, b = 2; endmodule", options)
            .items().get(0);
        assertEquals(2, module.body().size());
        assertEquals("a=1", ((GenericStatement) module.body().get(0)).code());
        assertEquals("b=2", ((GenericStatement) module.body().get(1)).code());
    }

    @Test
    void testParseIsRepeatable() {
        Parser parser = new Parser("module m; logic a; endmodule class c; endclass");
        assertEquals(parser.parse(), parser.parse());
    }

    @Test
    void testNullSourceRejected() {
        assertThrows(NullPointerException.class, () -> Parser.parse(null));
    }

    @Test
    void testJoinTokens() {
        List<Token> tokens = new Lexer("@ ( posedge clk or negedge rst_n )").tokenize();
        assertEquals("@(posedge clk or negedge rst_n)", Parser.joinTokens(tokens.subList(0, tokens.size() - 1)));
    }
}
