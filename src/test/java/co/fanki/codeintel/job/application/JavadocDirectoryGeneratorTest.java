package co.fanki.codeintel.job.application;

import co.fanki.codeintel.job.domain.CancellationToken;
import co.fanki.codeintel.job.domain.GenerationSummary;
import co.fanki.codeintel.job.domain.JavadocWriter;
import co.fanki.codeintel.job.domain.JobAuditLog;
import co.fanki.codeintel.job.domain.JobOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link JavadocDirectoryGenerator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class JavadocDirectoryGeneratorTest {

    private static final String GREETER = """
            package demo;

            public class Greeter {

                private final String name;

                public Greeter(final String theName) {
                    this.name = theName;
                }

                public String greet() {
                    if (name.isEmpty()) {
                        return "Hello";
                    }
                    return "Hello " + name;
                }

                /** Already documented. */
                public int size() {
                    return name.length();
                }

                @Override
                public String toString() {
                    return name;
                }
            }
            """;

    @TempDir
    Path tempDir;

    private Path root;
    private JobAuditLog auditLog;
    private RecordingWriter writer;
    private JavadocDirectoryGenerator generator;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createDirectories(tempDir.resolve("repo"));
        auditLog = JobAuditLog.create(tempDir.resolve("logs"), "job1");
        writer = new RecordingWriter("Sure:\n/** Doc. */\nanything else");
        generator = new JavadocDirectoryGenerator();
    }

    @Test
    void whenGenerating_givenUndocumentedMembers_shouldInsertIndentedBlocks()
            throws Exception {
        final Path file = write("src/demo/Greeter.java", GREETER);

        final GenerationSummary summary = generator.generate(root, auditLog,
                JobOptions.of(1), writer, new CancellationToken());

        final String result = Files.readString(file);
        assertEquals(1, summary.filesScanned());
        assertEquals(1, summary.filesModified());
        assertEquals(4, summary.membersDocumented());
        assertEquals(auditLog.path(), summary.logFile());

        assertTrue(result.contains("/** Doc. */\npublic class Greeter {"));
        assertTrue(result.contains(
                "    /** Doc. */\n    public Greeter(final String theName) {"));
        assertTrue(result.contains(
                "    /** Doc. */\n    public String greet() {"));
        assertTrue(result.contains(
                "    /** Doc. */\n    @Override\n    public String toString()"));
        assertTrue(result.contains(
                "    /** Already documented. */\n    public int size() {"));
        assertEquals(6, result.split("/\\*\\*", -1).length);
    }

    @Test
    void whenGenerating_givenUndocumentedMembers_shouldPassSignatures()
            throws Exception {
        write("Greeter.java", GREETER);

        generator.generate(root, auditLog, JobOptions.of(1), writer,
                new CancellationToken());

        assertEquals(List.of("public class Greeter",
                "public Greeter(final String theName)",
                "public String greet()",
                "public String toString()"), writer.signatures);
        assertEquals(List.of("class", "constructor", "method", "method"),
                writer.memberTypes);
    }

    @Test
    void whenGenerating_givenThreshold_shouldSkipShortMembers()
            throws Exception {
        final Path file = write("Greeter.java", GREETER);

        final GenerationSummary summary = generator.generate(root, auditLog,
                JobOptions.of(3), writer, new CancellationToken());

        assertEquals(2, summary.membersDocumented());
        final String result = Files.readString(file);
        assertTrue(result.contains("    /** Doc. */\n    public String greet()"));
        assertFalse(result.contains("/** Doc. */\n    @Override"));
    }

    @Test
    void whenGenerating_givenChanges_shouldAppendAuditLines()
            throws Exception {
        write("Greeter.java", GREETER);

        generator.generate(root, auditLog, JobOptions.of(1), writer,
                new CancellationToken());

        final List<String> changes = Files.readAllLines(auditLog.path())
                .stream()
                .filter(line -> line.contains("\tUPDATED_JAVADOC\t"))
                .toList();
        assertEquals(4, changes.size());
        assertTrue(changes.stream().allMatch(
                line -> line.endsWith("\treason=missing_javadoc")));
        assertTrue(changes.stream().anyMatch(
                line -> line.contains("\tsignature=public String greet()\t")));
    }

    @Test
    void whenGenerating_givenCrlfFile_shouldKeepCrlfLineEndings()
            throws Exception {
        final Path file = write("Greeter.java",
                GREETER.replace("\n", "\r\n"));

        generator.generate(root, auditLog, JobOptions.of(1), writer,
                new CancellationToken());

        final String result = Files.readString(file);
        assertTrue(result.contains("/** Doc. */\r\npublic class Greeter {"));
        assertFalse(result.replace("\r\n", "").contains("\n"));
    }

    @Test
    void whenGenerating_givenBuildOutputDirectory_shouldSkipIt()
            throws Exception {
        write("target/generated/Greeter.java", GREETER);
        write("node_modules/x/Greeter.java", GREETER);
        write("Main.java", "public class Main {\n    int x;\n}\n");

        final GenerationSummary summary = generator.generate(root, auditLog,
                JobOptions.of(1), writer, new CancellationToken());

        assertEquals(1, summary.filesScanned());
        assertEquals(GREETER, Files.readString(
                root.resolve("target/generated/Greeter.java")));
    }

    @Test
    void whenGenerating_givenCancelledToken_shouldLeaveFilesUntouched()
            throws Exception {
        final Path file = write("Greeter.java", GREETER);
        final CancellationToken token = new CancellationToken();
        token.cancel();

        final GenerationSummary summary = generator.generate(root, auditLog,
                JobOptions.of(1), writer, token);

        assertEquals(0, summary.filesModified());
        assertEquals(GREETER, Files.readString(file));
        assertTrue(writer.signatures.isEmpty());
    }

    @Test
    void whenGenerating_givenReplyWithoutBlock_shouldNotModifyFile()
            throws Exception {
        final Path file = write("Greeter.java", GREETER);

        final GenerationSummary summary = generator.generate(root, auditLog,
                JobOptions.of(1), new RecordingWriter("no idea"),
                new CancellationToken());

        assertEquals(0, summary.membersDocumented());
        assertEquals(GREETER, Files.readString(file));
    }

    @Test
    void whenFindingDeclarations_givenStatementsAndFields_shouldIgnoreThem() {
        final String code = """
                class Box {
                    private int size = compute(3);

                    void run() {
                        helper(1);
                        return;
                    }

                    abstract void later();
                }
                """;

        final List<JavadocDirectoryGenerator.Declaration> found =
                JavadocDirectoryGenerator.findDeclarations(code);

        assertEquals(List.of("class Box", "void run()", "abstract void later()"),
                found.stream()
                        .map(JavadocDirectoryGenerator.Declaration::signature)
                        .toList());
        assertEquals("", found.get(2).body());
    }

    @Test
    void whenCountingLines_givenCommentsAndBraces_shouldCountCodeOnly() {
        final String body = """

                    // comment
                    int a = 1;
                    }
                    /* block */
                    return a;
                """;

        assertEquals(2, JavadocDirectoryGenerator.meaningfulLines(body));
    }

    @Test
    void whenExtractingJavadoc_givenSurroundingText_shouldKeepBlockOnly() {
        assertEquals("/**\n * Runs.\n */", JavadocDirectoryGenerator
                .extractJavadoc("Here you go:\n/**\n * Runs.\n */\nDone."));
        assertNull(JavadocDirectoryGenerator.extractJavadoc("nothing"));
        assertNull(JavadocDirectoryGenerator.extractJavadoc(null));
    }

    @Test
    void whenIndenting_givenBlankLine_shouldNotAddTrailingSpaces() {
        assertEquals("  /**\n\n   */", JavadocDirectoryGenerator
                .indent("/**\n\n */", "  "));
    }

    private Path write(final String relative, final String content)
            throws Exception {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /** Writer replying with a fixed text and recording its calls. */
    private static final class RecordingWriter implements JavadocWriter {

        private final String reply;
        private final List<String> signatures = new ArrayList<>();
        private final List<String> memberTypes = new ArrayList<>();

        private RecordingWriter(final String theReply) {
            reply = theReply;
        }

        @Override
        public String write(final String signature, final String memberType,
                final String code) {
            signatures.add(signature);
            memberTypes.add(memberType);
            return reply;
        }
    }

}
