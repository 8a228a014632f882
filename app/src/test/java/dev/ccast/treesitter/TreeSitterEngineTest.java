package dev.ccast.treesitter;

import static org.junit.jupiter.api.Assertions.*;

import dev.ccast.CcAstSettings;
import dev.ccast.CcParser;
import dev.ccast.engine.ChildVisitResult;
import dev.ccast.engine.ParseFailureException;
import dev.ccast.tree.FingerprintStrategy;
import dev.ccast.tree.Node;
import dev.ccast.tree.SessionClosedException;
import dev.ccast.tree.TreePrinter;
import dev.ccast.tree.TreeWalker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TreeSitterEngineTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        var file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static CcParser parser() {
        return new CcParser(new TreeSitterEngine(), CcAstSettings.defaults());
    }

    private static Node findKind(Node root, String kind, String spelling) {
        return TreeWalker.find(root, n -> n.kind().equals(kind) && n.spelling().equals(spelling))
                .orElseThrow(() -> new AssertionError("No " + kind + " '" + spelling + "' in\n"
                        + TreePrinter.render(root, true)));
    }

    @Test
    void testMinimalFunction() throws Exception {
        var file = write("main.c", "int main(){return 0;}");

        var result = parser().parseFile(file);
        var root = result.root();

        assertFalse(result.hasDiagnostics(), () -> result.error().orElseThrow().getMessage());
        assertEquals("translation_unit", root.kind());
        assertEquals(file.toString(), root.spelling());
        assertEquals(1, root.children().size());

        var function = root.children().get(0);
        assertEquals("function_definition", function.kind());
        assertEquals("main", function.spelling());
        assertEquals(1, function.location().line());
        assertEquals(1, function.location().column());
        assertTrue(TreeWalker.find(function, n -> n.kind().equals("return_statement")).isPresent());
        assertEquals("0", findKind(root, "number_literal", "0").spelling());
    }

    @Test
    void testEachMissingTokenIsOneDiagnostic() throws Exception {
        var file = write("broken.c", "int a(void){return 0}\nint b(void){return 1}\nint ok(void){return 2;}\n");

        var result = parser().parseFile(file);
        var error = result.error().orElseThrow();

        assertEquals(2, error.size());
        assertEquals(List.of("expected ';'", "expected ';'"), error.messages());
        assertEquals(1, error.getDiagnostics().get(0).location().line());
        assertEquals(2, error.getDiagnostics().get(1).location().line());
        assertTrue(error.getMessage().startsWith("2 errors occurred:\n"));
        // recovery still yields the rest of the file
        findKind(result.root(), "function_definition", "ok");
    }

    @Test
    void testUnterminatedStringLiteral() throws Exception {
        var file = write("string.c", "int ok(void){return 0;}\nconst char *s = \"abc;\n");

        var result = parser().parseFile(file);
        var error = result.error().orElseThrow();

        assertEquals("translation_unit", result.root().kind());
        assertFalse(error.getDiagnostics().isEmpty());
        error.getDiagnostics().forEach(d -> {
            assertEquals(file.toString(), d.location().file());
            assertTrue(d.location().line() >= 2, d::toString);
        });
        // the clean function before the literal is untouched and reports nothing
        findKind(result.root(), "function_definition", "ok");
    }

    @Test
    void testMissingFileFails() {
        var missing = tempDir.resolve("nope.c");

        var e = assertThrows(ParseFailureException.class, () -> parser().parseFile(missing));
        assertEquals(missing, e.getPath());
        assertTrue(e.getMessage().startsWith("Unable to parse " + missing));
    }

    @Test
    void testCppConstructs() throws Exception {
        var file = write(
                "point.cpp",
                """
                namespace geo {
                class Point {
                public:
                    int x;
                    int y;
                };
                }
                """);

        var result = parser().parseFile(file);

        assertFalse(result.hasDiagnostics());
        var namespace = findKind(result.root(), "namespace_definition", "geo");
        var clazz = findKind(namespace, "class_specifier", "Point");
        assertEquals(2, clazz.location().line());
        assertEquals(2, TreeWalker.findAll(clazz, n -> n.kind().equals("field_declaration")).size());
    }

    @Test
    void testDeclarationSpellings() throws Exception {
        var file = write(
                "types.c",
                """
                struct point { int x; int y; };
                typedef struct point point_t;
                enum color { RED, GREEN };
                static int *counter = 0;
                """);

        var root = parser().parseFile(file).root();

        findKind(root, "struct_specifier", "point");
        findKind(root, "type_definition", "point_t");
        findKind(root, "enum_specifier", "color");
        findKind(root, "enumerator", "GREEN");
        findKind(root, "declaration", "counter");
    }

    @Test
    void testHandleReadsWhileOpen() throws Exception {
        var file = write("main.c", "int main(){return 0;}");

        Node function;
        try (var parsed = parser().open(file)) {
            assertEquals("TranslationUnit", parsed.root().handle().prettyKind());
            function = parsed.root().children().get(0);
            assertEquals("FunctionDefinition", function.handle().prettyKind());
            assertEquals("int main(){return 0;}", function.handle().sourceText());
        }
        assertThrows(SessionClosedException.class, () -> function.handle().sourceText());
        assertEquals("main", function.spelling());
    }

    @Test
    void testDefinitionOfCall() throws Exception {
        var file = write(
                "calls.c",
                """
                int add(int a, int b) { return a + b; }
                int main(void) { return add(1, 2); }
                """);

        try (var parsed = parser().open(file)) {
            var call = findKind(parsed.root(), "call_expression", "add");
            var definition = parsed.definitionOf(call).orElseThrow();

            assertEquals("function_definition", definition.kind());
            assertEquals("add", definition.spelling());
            assertEquals(1, definition.location().line());
            assertSame(parsed.root().children().get(0), definition);
        }
    }

    @Test
    void testVisitorControl() throws Exception {
        var file = write("two.c", "int a(void){return 1;}\nint b(void){return 2;}\n");
        var engine = new TreeSitterEngine();

        try (var session = engine.open(file, List.of())) {
            var kinds = new ArrayList<String>();
            session.rootCursor().visitChildren((cursor, parent) -> {
                kinds.add(cursor.kind());
                return ChildVisitResult.BREAK;
            });
            assertEquals(List.of("function_definition"), kinds);

            var spellings = new ArrayList<String>();
            session.rootCursor().visitChildren((cursor, parent) -> {
                spellings.add(cursor.spelling());
                return ChildVisitResult.CONTINUE;
            });
            assertEquals(List.of("a", "b"), spellings);
        }
    }

    @Test
    void testCursorsFailAfterEngineSessionCloses() throws Exception {
        var file = write("main.c", "int main(){return 0;}");
        var session = new TreeSitterEngine().open(file, List.of());
        var root = session.rootCursor();
        session.close();

        assertThrows(IllegalStateException.class, root::kind);
        assertThrows(IllegalStateException.class, session::rootCursor);
    }

    @Test
    void testEngineHashBuildsSameTree() throws Exception {
        var file = write(
                "calls.c",
                """
                int add(int a, int b) { return a + b + 1; }
                int main(void) { return add(1, 2); }
                """);
        var hashed = CcAstSettings.defaults().withFingerprintStrategy(FingerprintStrategy.ENGINE_HASH);

        var structural = parser().parseFile(file).root();
        var byHash = new CcParser(new TreeSitterEngine(), hashed).parseFile(file).root();

        assertEquals(TreePrinter.render(structural, true), TreePrinter.render(byHash, true));
    }

    @Test
    void testLatin1BytesDoNotShiftSpellings() throws Exception {
        var file = tempDir.resolve("latin1.c");
        Files.write(
                file,
                "/* caf\u00e9 na\u00efve */\nint add(int a, int b){return a+b;}\nint main(){return add(1, 2);}\n"
                        .getBytes(StandardCharsets.ISO_8859_1));

        try (var parsed = parser().open(file)) {
            var main = findKind(parsed.root(), "function_definition", "main");
            assertEquals(3, main.location().line());
            assertEquals("int main(){return add(1, 2);}", main.handle().sourceText());

            var call = findKind(parsed.root(), "call_expression", "add");
            var definition = parsed.definitionOf(call).orElseThrow();
            assertEquals("add", definition.spelling());
            assertEquals(2, definition.location().line());
        }
    }

    @Test
    void testDeeplyNestedExpression() throws Exception {
        int terms = 20_000;
        var file = write("deep.c", "int x = " + "1+".repeat(terms - 1) + "1;\n");

        try (var parsed = parser().open(file)) {
            var root = parsed.root();

            assertTrue(parsed.error().isEmpty());
            assertEquals(terms - 1, TreeWalker.findAll(root, n -> n.kind().equals("binary_expression")).size());
            assertEquals(terms, TreeWalker.findAll(root, n -> n.kind().equals("number_literal")).size());
            assertEquals(TreeWalker.count(root), TreePrinter.render(root).lines().count());

            int[] deepest = {0};
            TreeWalker.walkWithDepth(root, (n, depth) -> deepest[0] = Math.max(deepest[0], depth));
            assertTrue(deepest[0] >= terms, "depth " + deepest[0]);
        }
    }

    @Test
    void testByteOrderMarkIsIgnored() throws Exception {
        var file = tempDir.resolve("bom.c");
        var text = "int main(){return 0;}".getBytes(StandardCharsets.UTF_8);
        var bytes = new byte[text.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(text, 0, bytes, 3, text.length);
        Files.write(file, bytes);

        var result = parser().parseFile(file);

        assertFalse(result.hasDiagnostics());
        assertEquals(1, result.root().children().get(0).location().column());
    }
}
