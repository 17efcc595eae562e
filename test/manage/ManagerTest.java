package manage;

import exception.LexicalException;
import exception.SemanticException;
import exception.SyntaxException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ManagerTest {

    private static final String SAMPLE = "int a;\nint b;\na = 5;\nb = a + 10 * (2 - 1);\nprint b;\n";

    private static String pad(String s, int spaces) {
        return s + " ".repeat(spaces);
    }

    @Test
    void reportHasThreeSectionsInOrder() {
        CompileResult result = new Manager().compile("int a;");
        assertTrue(result.isOk());
        assertEquals(0, result.getExitCode());
        String expected = "TOKENS:\n"
                + pad("int", 8) + "KEYWORD\n"
                + pad("a", 10) + "IDENTIFIER\n"
                + pad(";", 10) + "SYMBOL\n"
                + "\n"
                + "SYMBOL TABLE:\n"
                + pad("Name", 6) + "Type\n"
                + pad("a", 9) + "int\n"
                + "\n"
                + "INTERMEDIATE CODE (TAC):\n"
                + "\n";
        assertEquals(expected, result.getStdout());
        assertEquals("", result.getStderr());
    }

    @Test
    void sampleProgramEndToEnd() {
        CompileResult result = new Manager().compile(SAMPLE);
        assertTrue(result.isOk());
        assertEquals("SYMBOL TABLE:\n" + pad("Name", 6) + "Type\n" + pad("a", 9) + "int\n" + pad("b", 9) + "int\n\n",
                result.getSymbolTable());
        assertEquals("INTERMEDIATE CODE (TAC):\na = 5\nt1 = 2 - 1\nt2 = 10 * t1\nt3 = a + t2\nb = t3\nprint b\n\n",
                result.getTac());
        String stdout = result.getStdout();
        int tokens = stdout.indexOf(Report.TOKENS_HEADER);
        int symbols = stdout.indexOf(Report.SYMBOL_TABLE_HEADER);
        int tac = stdout.indexOf(Report.TAC_HEADER);
        assertEquals(0, tokens);
        assertTrue(tokens < symbols && symbols < tac);
        assertEquals(stdout, result.getTokens() + result.getSymbolTable() + result.getTac());
        assertTrue(result.getTokens().contains(pad("print", 6) + "KEYWORD\n"));
        assertTrue(result.getTokens().contains(pad("10", 9) + "NUMBER\n"));
        assertTrue(result.getTokens().contains(pad("*", 10) + "OPERATOR\n"));
        assertFalse(result.getTokens().contains("EOF"));
    }

    @Test
    void longNamesStillSeparateFromTheirType() {
        CompileResult result = new Manager().compile("int abcdefghij;");
        assertTrue(result.getTokens().contains("abcdefghij IDENTIFIER\n"));
        assertTrue(result.getSymbolTable().contains("abcdefghij int\n"));
    }

    @Test
    void semanticErrorKeepsOnlyTokenSection() {
        CompileResult result = new Manager().compile("b = 1;");
        assertFalse(result.isOk());
        assertEquals(1, result.getExitCode());
        assertInstanceOf(SemanticException.class, result.getError().orElseThrow());
        assertEquals("SemanticError at 1:1 near 'b': assignment to undeclared variable 'b'\n", result.getStderr());
        assertTrue(result.getStdout().startsWith(Report.TOKENS_HEADER));
        assertFalse(result.getStdout().contains(Report.SYMBOL_TABLE_HEADER));
        assertFalse(result.getStdout().contains(Report.TAC_HEADER));
        assertNull(result.getSymTable());
        assertNull(result.getIr());
    }

    @Test
    void duplicateDeclarationReported() {
        CompileResult result = new Manager().compile("int a;\nint a;");
        assertEquals("SemanticError at 2:5 near 'a': duplicate declaration of 'a'\n", result.getStderr());
    }

    @Test
    void syntaxErrorKeepsOnlyTokenSection() {
        CompileResult result = new Manager().compile("int a;\na = (1 + 2;");
        assertInstanceOf(SyntaxException.class, result.getError().orElseThrow());
        assertEquals("SyntaxError at 2:11 near ';': expected ')' to close '('\n", result.getStderr());
        assertEquals(result.getTokens(), result.getStdout());
        assertEquals("", result.getSymbolTable());
    }

    @Test
    void lexicalErrorProducesNoSections() {
        CompileResult result = new Manager().compile("1 $ 2");
        assertInstanceOf(LexicalException.class, result.getError().orElseThrow());
        assertEquals("", result.getStdout());
        assertEquals("LexicalError at 1:3 near '$': unexpected character '$'\n", result.getStderr());
        assertNull(result.getTokenList());
    }

    @Test
    void useBeforeDeclarationIsNeverLexicalOrSyntactic() {
        for (String src : List.of("print x;", "x = 1; int x;", "int a; a = a + q;", "print -(y);")) {
            CompileResult result = new Manager().compile(src);
            assertInstanceOf(SemanticException.class, result.getError().orElseThrow(), src);
        }
    }

    @Test
    void compilationIsDeterministic() {
        Manager manager = new Manager();
        CompileResult first = manager.compile(SAMPLE);
        CompileResult second = manager.compile(SAMPLE);
        assertEquals(first.getStdout(), second.getStdout());
        assertEquals(first.getStderr(), second.getStderr());
    }

    @Test
    void concurrentCompilationsDoNotInterfere() throws Exception {
        List<String> sources = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            StringBuilder sb = new StringBuilder("int v;\n");
            for (int j = 0; j <= i % 7; j++) {
                sb.append("v = ").append(i).append(" + ").append(j).append(" * 2;\n");
            }
            sb.append(i % 5 == 0 ? "print w;\n" : "print v;\n");
            sources.add(sb.toString());
        }
        List<String> expected = new ArrayList<>();
        for (String source : sources) {
            CompileResult result = new Manager().compile(source);
            expected.add(result.getStdout() + result.getStderr());
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            Manager shared = new Manager();
            for (String source : sources) {
                futures.add(pool.submit(() -> {
                    CompileResult result = shared.compile(source);
                    return result.getStdout() + result.getStderr();
                }));
            }
            for (int i = 0; i < sources.size(); i++) {
                assertEquals(expected.get(i), futures.get(i).get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void verboseTraceNamesEachPhase() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream trace = new PrintStream(buf, true, StandardCharsets.UTF_8);
        new Manager(true, trace).compile(SAMPLE);
        String out = buf.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("[trace] lexer: 25 tokens"), out);
        assertTrue(out.contains("[trace] parser: 5 statements"), out);
        assertTrue(out.contains("[trace] checker: 2 symbols"), out);
        assertTrue(out.contains("[trace] tac: 6 instructions, 3 temporaries"), out);
    }

    @Test
    void quietByDefault() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        new Manager(false, new PrintStream(buf, true, StandardCharsets.UTF_8)).compile("b = 1;");
        assertEquals(0, buf.size());
    }
}
