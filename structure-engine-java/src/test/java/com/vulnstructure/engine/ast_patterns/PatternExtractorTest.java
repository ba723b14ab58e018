package com.vulnstructure.engine.ast_patterns;

import com.vulnstructure.engine.config.EngineConfig;
import com.vulnstructure.engine.model.StructureModel.*;
import com.vulnstructure.engine.syntax.CSourceParser;
import com.vulnstructure.engine.syntax.SyntaxTree;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternExtractorTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/c-snippets");

    private static PatternSummary bufferCopy;

    @BeforeAll
    static void extractFixture() throws IOException {
        bufferCopy = extract(Files.readString(FIXTURES.resolve("buffer_copy.c")), EngineConfig.defaults());
    }

    private static PatternSummary extract(String code, EngineConfig config) {
        SyntaxTree tree = new CSourceParser().parse(code).tree();
        return new PatternExtractor(config).extract(tree);
    }

    @Test
    void functionSignature() {
        assertTrue(bufferCopy.success);
        assertEquals(0, bufferCopy.syntaxErrorCount);
        assertEquals(1, bufferCopy.functions.size());
        FunctionPattern f = bufferCopy.functions.get(0);
        assertEquals("copy_input", f.name);
        assertEquals("void", f.returnType);
        assertEquals(List.of("char *dst", "const char *src", "size_t n"), f.params);
        assertEquals(9, f.line);
    }

    @Test
    void callsInSourceOrder() {
        assertEquals(List.of("malloc", "strcpy", "memcpy", "free"),
                bufferCopy.calls.stream().map(c -> c.functionName).toList());
        CallPattern memcpy = bufferCopy.calls.get(2);
        assertEquals(List.of("dst", "buf", "n"), memcpy.args);
        assertEquals(14, memcpy.line);
        assertEquals(List.of("sizeof(struct packet)"), bufferCopy.calls.get(0).args);
    }

    @Test
    void declaredVariablesWithFlags() {
        assertEquals(List.of("dst", "src", "n", "buf", "pkt"),
                bufferCopy.variables.stream().map(v -> v.name).toList());

        VariablePattern src = bufferCopy.variables.get(1);
        assertEquals("char", src.type);
        assertTrue(src.isPointer);
        assertEquals(9, src.line);
        VariablePattern n = bufferCopy.variables.get(2);
        assertEquals("size_t", n.type);
        assertFalse(n.isPointer);

        VariablePattern buf = bufferCopy.variables.get(3);
        assertEquals("buf", buf.name);
        assertEquals("char", buf.type);
        assertTrue(buf.isArray);
        assertFalse(buf.isPointer);
        VariablePattern pkt = bufferCopy.variables.get(4);
        assertEquals("pkt", pkt.name);
        assertEquals("struct packet", pkt.type);
        assertTrue(pkt.isPointer);
        assertEquals(12, pkt.line);
    }

    @Test
    void parametersAreVariables() {
        PatternSummary summary = extract("int f(char *buf, int n) { int k = n; return k; }",
                EngineConfig.defaults());
        assertEquals(List.of("buf", "n", "k"), summary.variables.stream().map(v -> v.name).toList());
        assertTrue(summary.variables.get(0).isPointer);
        assertEquals("int", summary.variables.get(1).type);
    }

    @Test
    void unnamedParametersAreNotVariables() {
        PatternSummary summary = extract("void f(void) { }\nint g(char *, int);", EngineConfig.defaults());
        assertTrue(summary.variables.isEmpty());
    }

    @Test
    void pointerAndArrayOperations() {
        assertEquals(List.of("pkt->len", "pkt->data"),
                bufferCopy.pointers.stream().map(p -> p.operation).toList());
        assertEquals("field_expression", bufferCopy.pointers.get(0).type);
        assertEquals(List.of("buf[0]", "pkt->data[0]"),
                bufferCopy.arrays.stream().map(a -> a.operation).toList());
        assertEquals(16, bufferCopy.arrays.get(0).line);
    }

    @Test
    void conditionsAndLoops() {
        String code = "int f(int a, int *p) {\n"
                + "    if (a) a = 1;\n"
                + "    switch (a) { case 1: a = *p; break; default: break; }\n"
                + "    while (a--) { }\n"
                + "    do { a++; } while (a < 3);\n"
                + "    for (;;) break;\n"
                + "    return a ? 1 : 0;\n"
                + "}\n";
        PatternSummary summary = extract(code, EngineConfig.defaults());
        assertEquals(List.of("if_statement", "switch_statement", "conditional_expression"),
                summary.conditions.stream().map(c -> c.type).toList());
        assertEquals(List.of("while_statement", "do_statement", "for_statement"),
                summary.loops.stream().map(l -> l.type).toList());
        assertEquals(5, summary.loops.get(1).line);
        assertEquals(1, summary.pointers.size());
        assertEquals("pointer_expression", summary.pointers.get(0).type);
        assertEquals("*p", summary.pointers.get(0).operation);
    }

    @Test
    void nodeCountStopsAtDepthCeilingButDepthDoesNot() {
        // translation_unit > declaration > {primitive_type, identifier, ";"}
        PatternSummary full = extract("int x;", EngineConfig.defaults());
        assertEquals(5, full.nodeCount);
        assertEquals(2, full.depth);

        PatternSummary capped = extract("int x;", EngineConfig.builder().astMaxDepth(0).build());
        assertEquals(2, capped.nodeCount);
        assertEquals(2, capped.depth);
    }

    @Test
    void emptySnippet() {
        PatternSummary summary = extract("", EngineConfig.defaults());
        assertTrue(summary.success);
        assertEquals(1, summary.nodeCount);
        assertEquals(0, summary.depth);
        assertTrue(summary.functions.isEmpty());
        assertTrue(summary.calls.isEmpty());
    }

    @Test
    void operationTextIsCapped() {
        String name = "a_really_long_pointer_name_that_goes_on";
        PatternSummary summary = extract("x = *" + name + ";",
                EngineConfig.builder().operationTextLength(10).build());
        assertEquals(("*" + name).substring(0, 10), summary.pointers.get(0).operation);
    }

    @Test
    void indirectCallIsNotListed() {
        PatternSummary summary = extract("ops->handler(ctx); run(ctx);", EngineConfig.defaults());
        assertEquals(List.of("run"), summary.calls.stream().map(c -> c.functionName).toList());
    }

    @Test
    void syntaxErrorsAreCounted() {
        PatternSummary summary = extract("int f( { return 1; }", EngineConfig.defaults());
        assertTrue(summary.success);
        assertTrue(summary.syntaxErrorCount > 0);
    }

    @Test
    void typeNameMacroArgumentsParseCleanly() {
        String code = "static ssize_t show(struct device *dev, struct device_attribute *attr, char *buf)\n"
                + "{\n"
                + "    struct foo *f = container_of(attr, struct foo, member);\n"
                + "    size_t off = offsetof(struct foo, value);\n"
                + "    return sprintf(buf, \"%d\\n\", f->value + (int) off);\n"
                + "}\n";
        PatternSummary summary = extract(code, EngineConfig.defaults());
        assertEquals(0, summary.syntaxErrorCount);
        assertEquals(List.of("container_of", "offsetof", "sprintf"),
                summary.calls.stream().map(c -> c.functionName).toList());
        assertEquals(List.of("attr", "struct foo", "member"), summary.calls.get(0).args);
    }

    @Test
    void ambiguousArgumentsStayExpressions() {
        PatternSummary summary = extract("use(g(x), a[3], b * c);", EngineConfig.defaults());
        assertEquals(List.of("use", "g"), summary.calls.stream().map(c -> c.functionName).toList());
        assertEquals(List.of("g(x)", "a[3]", "b * c"), summary.calls.get(0).args);
        assertEquals(1, summary.arrays.size());
    }
}
