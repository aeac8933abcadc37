package co.fanki.codeintel.job.application;

import co.fanki.codeintel.job.domain.CancellationToken;
import co.fanki.codeintel.job.domain.DocumentationGenerator;
import co.fanki.codeintel.job.domain.GenerationSummary;
import co.fanki.codeintel.job.domain.JavadocWriter;
import co.fanki.codeintel.job.domain.JobAuditLog;
import co.fanki.codeintel.job.domain.JobOptions;
import co.fanki.codeintel.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds missing JavaDoc to every Java source file under a directory.
 *
 * <p>Declarations are found line by line: a line declaring a type, a
 * method or a constructor (with its annotations, possibly on the lines
 * above) that is not preceded by a {@code /**} comment gets a block from
 * the {@link JavadocWriter}. Members whose body has fewer meaningful lines
 * than the job threshold are left alone.</p>
 *
 * <p>Blocks are inserted from the bottom of the file up so the offsets
 * computed on the original text stay valid. Files written with CRLF line
 * endings keep them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class JavadocDirectoryGenerator implements DocumentationGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            JavadocDirectoryGenerator.class);

    /** Directories never descended into. */
    static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            "target", "build", ".git", "node_modules");

    static final String REASON = "missing_javadoc";

    private static final int MAX_CODE_CHARS = 4000;

    private static final String ANNOTATIONS =
            "((?:@[\\w.]+(?:\\([^)]*\\))?\\s+)*)";

    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "^([\\t ]*)" + ANNOTATIONS
            + "((?:(?:public|protected|private|abstract|static|final|sealed"
            + "|non-sealed|strictfp)\\s+)*)"
            + "(class|interface|enum|record|@interface)\\s+(\\w+)");

    private static final Pattern METHOD_DECLARATION = Pattern.compile(
            "^([\\t ]*)" + ANNOTATIONS
            + "((?:(?:public|protected|private|abstract|static|final"
            + "|synchronized|native|default|strictfp)\\s+)*)"
            + "(<[^(]*>\\s+)?"
            + "([\\w.$<>\\[\\],?& ]+?\\s+)?"
            + "(\\w+)\\s*\\(");

    private static final Set<String> KEYWORDS = Set.of(
            "return", "new", "throw", "else", "case", "yield", "assert",
            "package", "import", "if", "for", "while", "switch", "catch",
            "synchronized", "super", "this", "do", "try", "instanceof");

    @Override
    public GenerationSummary generate(final Path rootDir,
            final JobAuditLog auditLog, final JobOptions options,
            final JavadocWriter writer, final CancellationToken token) {

        Preconditions.requireNonNull(rootDir, "Root directory is required");
        Preconditions.requireNonNull(auditLog, "Audit log is required");
        Preconditions.requireNonNull(options, "Options are required");
        Preconditions.requireNonNull(writer, "Writer is required");
        Preconditions.requireNonNull(token, "Cancellation token is required");

        final List<Path> files = javaFiles(rootDir);
        LOG.info("Found {} Java files under {}", files.size(), rootDir);

        int filesModified = 0;
        int membersDocumented = 0;

        for (final Path file : files) {
            if (token.isCancellationRequested()) {
                LOG.info("Documentation of {} cancelled", rootDir);
                break;
            }
            final int inserted = documentFile(file, auditLog, options,
                    writer, token);
            if (inserted > 0) {
                filesModified++;
                membersDocumented += inserted;
            }
        }

        return new GenerationSummary(rootDir, files.size(), filesModified,
                membersDocumented, auditLog.path());
    }

    /**
     * Lists the Java files under a directory, skipping build output and
     * tool directories.
     *
     * @param rootDir the directory
     * @return the files, sorted by path
     */
    static List<Path> javaFiles(final Path rootDir) {
        final List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(rootDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(final Path dir,
                        final BasicFileAttributes attrs) {
                    final Path name = dir.getFileName();
                    if (!dir.equals(rootDir) && name != null
                            && SKIPPED_DIRECTORIES.contains(name.toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(final Path file,
                        final BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()
                            && file.getFileName().toString().endsWith(".java")) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot walk " + rootDir, e);
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }

    private int documentFile(final Path file, final JobAuditLog auditLog,
            final JobOptions options, final JavadocWriter writer,
            final CancellationToken token) {

        final String original;
        try {
            original = Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }

        final String code = normalizeLineEndings(original);
        final List<Edit> edits = new ArrayList<>();

        for (final Declaration declaration : findDeclarations(code)) {
            if (token.isCancellationRequested()) {
                break;
            }
            if (declaration.documented()) {
                continue;
            }
            if (meaningfulLines(declaration.body())
                    < options.minMeaningfulLines()) {
                LOG.debug("Skipping short {} {}", declaration.memberType(),
                        declaration.signature());
                continue;
            }

            final String javadoc = extractJavadoc(writer.write(
                    declaration.signature(), declaration.memberType(),
                    truncate(declaration.source())));
            if (javadoc == null) {
                LOG.warn("Writer returned no JavaDoc block for {} in {}",
                        declaration.signature(), file);
                continue;
            }

            edits.add(new Edit(declaration.insertAt(),
                    indent(javadoc, declaration.indent()) + "\n",
                    declaration.memberType(), declaration.signature()));
        }

        if (edits.isEmpty()) {
            return 0;
        }

        edits.sort(Comparator.comparingInt(Edit::insertAt).reversed());
        final StringBuilder updated = new StringBuilder(code);
        for (final Edit edit : edits) {
            updated.insert(edit.insertAt(), edit.block());
            auditLog.appendChange(file, edit.memberType(), edit.signature(),
                    REASON);
        }

        String text = updated.toString();
        if (original.contains("\r\n")) {
            text = text.replace("\n", "\r\n");
        }
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }

        LOG.debug("Documented {} members in {}", edits.size(), file);
        return edits.size();
    }

    /**
     * Finds the type, method and constructor declarations of a source.
     *
     * @param code the source with LF line endings
     * @return the declarations in source order
     */
    static List<Declaration> findDeclarations(final String code) {
        final String[] lines = code.split("\n", -1);
        final int[] lineStarts = new int[lines.length];
        for (int i = 1; i < lines.length; i++) {
            lineStarts[i] = lineStarts[i - 1] + lines[i - 1].length() + 1;
        }

        final Set<String> typeNames = new HashSet<>();
        for (final String line : lines) {
            final Matcher type = TYPE_DECLARATION.matcher(line);
            if (type.find()) {
                typeNames.add(type.group(5));
            }
        }

        final List<Declaration> declarations = new ArrayList<>();
        boolean inBlockComment = false;

        for (int i = 0; i < lines.length; i++) {
            final String trimmed = lines[i].trim();
            if (inBlockComment) {
                inBlockComment = !trimmed.contains("*/");
                continue;
            }
            if (trimmed.startsWith("/*")) {
                inBlockComment = !trimmed.contains("*/");
                continue;
            }
            if (trimmed.isEmpty() || trimmed.startsWith("//")
                    || trimmed.startsWith("*")) {
                continue;
            }

            final Declaration declaration = matchDeclaration(code, lines,
                    lineStarts, i, typeNames);
            if (declaration != null) {
                declarations.add(declaration);
            }
        }
        return declarations;
    }

    private static Declaration matchDeclaration(final String code,
            final String[] lines, final int[] lineStarts, final int index,
            final Set<String> typeNames) {

        final String line = lines[index];
        final int lineStart = lineStarts[index];

        final Matcher type = TYPE_DECLARATION.matcher(line);
        if (type.find()) {
            final String kind = "@interface".equals(type.group(4))
                    ? "annotation" : type.group(4);
            final String signature = collapse(type.group(3)
                    + type.group(4) + " " + type.group(5));
            final int open = code.indexOf('{', lineStart + type.end());
            if (open < 0) {
                return null;
            }
            final String body = bodyOf(code, open);
            return declaration(code, lines, lineStarts, index,
                    type.group(1), kind, signature, body,
                    open + body.length() + 2);
        }

        final Matcher method = METHOD_DECLARATION.matcher(line);
        if (!method.find()) {
            return null;
        }
        final String name = method.group(7);
        final String returnType = method.group(6);
        if (KEYWORDS.contains(name)) {
            return null;
        }

        final String memberType;
        if (returnType == null) {
            if (!typeNames.contains(name)) {
                return null;
            }
            memberType = "constructor";
        } else {
            final String firstWord = returnType.trim().split("[\\s<\\[]", 2)[0];
            if (KEYWORDS.contains(firstWord) || returnType.contains("=")) {
                return null;
            }
            memberType = "method";
        }

        final int paramsOpen = lineStart + method.end() - 1;
        final int paramsClose = matching(code, paramsOpen, '(', ')');
        if (paramsClose < 0) {
            return null;
        }

        final int terminator = firstOf(code, paramsClose + 1);
        if (terminator < 0) {
            return null;
        }
        final boolean hasBody = code.charAt(terminator) == '{';
        final String body = hasBody ? bodyOf(code, terminator) : "";
        final String signature = collapse(code.substring(
                lineStart + method.start(3), paramsClose + 1));
        final int sourceEnd = hasBody
                ? terminator + body.length() + 2 : terminator + 1;

        return declaration(code, lines, lineStarts, index, method.group(1),
                memberType, signature, body, sourceEnd);
    }

    private static Declaration declaration(final String code,
            final String[] lines, final int[] lineStarts, final int index,
            final String indent, final String memberType,
            final String signature, final String body, final int sourceEnd) {

        int first = index;
        while (first > 0 && lines[first - 1].trim().startsWith("@")) {
            first--;
        }

        final String source = code.substring(lineStarts[first],
                Math.min(code.length(), sourceEnd));

        return new Declaration(lineStarts[first], indent, memberType,
                signature, body, source, hasJavadocAbove(lines, first));
    }

    private static boolean hasJavadocAbove(final String[] lines,
            final int index) {
        int i = index - 1;
        while (i >= 0 && lines[i].isBlank()) {
            i--;
        }
        if (i < 0 || !lines[i].trim().endsWith("*/")) {
            return false;
        }
        while (i >= 0 && !lines[i].contains("/*")) {
            i--;
        }
        return i >= 0 && lines[i].trim().startsWith("/**");
    }

    /** Returns the text between a brace and its matching close. */
    private static String bodyOf(final String code, final int open) {
        final int close = matching(code, open, '{', '}');
        return close < 0 ? code.substring(open + 1)
                : code.substring(open + 1, close);
    }

    /**
     * Finds the bracket closing the one at {@code open}, skipping string
     * and character literals and comments.
     */
    private static int matching(final String code, final int open,
            final char opening, final char closing) {
        int depth = 0;
        int i = open;
        while (i < code.length()) {
            final char c = code.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipLiteral(code, i, c);
                continue;
            }
            if (c == '/' && i + 1 < code.length()) {
                final char next = code.charAt(i + 1);
                if (next == '/') {
                    final int eol = code.indexOf('\n', i);
                    i = eol < 0 ? code.length() : eol;
                    continue;
                }
                if (next == '*') {
                    final int end = code.indexOf("*/", i + 2);
                    i = end < 0 ? code.length() : end + 2;
                    continue;
                }
            }
            if (c == opening) {
                depth++;
            } else if (c == closing) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    private static int skipLiteral(final String code, final int start,
            final char quote) {
        if (quote == '"' && code.startsWith("\"\"\"", start)) {
            final int end = code.indexOf("\"\"\"", start + 3);
            return end < 0 ? code.length() : end + 3;
        }
        int i = start + 1;
        while (i < code.length()) {
            final char c = code.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote || c == '\n') {
                return i + 1;
            }
            i++;
        }
        return code.length();
    }

    /** Position of the first body brace or semicolon after a header. */
    private static int firstOf(final String code, final int from) {
        for (int i = from; i < code.length(); i++) {
            final char c = code.charAt(i);
            if (c == '{' || c == ';') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Counts the lines of a body that carry code.
     *
     * <p>Blank lines, comment lines and lines holding only braces or
     * parentheses do not count.</p>
     *
     * @param body the text between the body braces
     * @return the number of meaningful lines
     */
    static int meaningfulLines(final String body) {
        int count = 0;
        for (final String line : body.split("\n")) {
            final String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("//")
                    || trimmed.startsWith("/*") || trimmed.startsWith("*")
                    || trimmed.matches("[{}();]+")) {
                continue;
            }
            count++;
        }
        return count;
    }

    /**
     * Cuts a writer reply down to its JavaDoc block.
     *
     * @param reply the raw reply
     * @return the block, or null when the reply holds none
     */
    static String extractJavadoc(final String reply) {
        if (reply == null) {
            return null;
        }
        String text = reply.strip();
        final int start = text.indexOf("/**");
        if (start < 0) {
            return null;
        }
        text = text.substring(start);
        final int end = text.lastIndexOf("*/");
        if (end < 3) {
            return null;
        }
        return text.substring(0, end + 2).strip();
    }

    /**
     * Indents every line of a block; blank lines carry no trailing
     * whitespace.
     */
    static String indent(final String block, final String indent) {
        final String[] lines = normalizeLineEndings(block).split("\n", -1);
        final StringBuilder out = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(lines[i].isEmpty() ? "" : indent + lines[i]);
        }
        return out.toString();
    }

    private static String truncate(final String source) {
        if (source.length() <= MAX_CODE_CHARS) {
            return source;
        }
        return source.substring(0, MAX_CODE_CHARS) + "\n// ... truncated ...\n";
    }

    private static String normalizeLineEndings(final String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static String collapse(final String text) {
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * A declaration found in a source file.
     *
     * @param insertAt the offset of the first line of the declaration,
     *                 annotations included
     * @param indent the leading whitespace of the declaration line
     * @param memberType the declaration kind
     * @param signature the collapsed declaration header
     * @param body the text between the body braces, empty when bodiless
     * @param source the declaration text handed to the writer
     * @param documented whether a JavaDoc block already precedes it
     */
    record Declaration(int insertAt, String indent, String memberType,
            String signature, String body, String source,
            boolean documented) {
    }

    private record Edit(int insertAt, String block, String memberType,
            String signature) {
    }

}
