package org.filest.filesystem;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SandboxPathResolverTest {

    @TempDir
    Path tmp;

    private SandboxPathResolver resolver;
    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        resolver = new SandboxPathResolver(Files.createDirectories(tmp.resolve("root")), true);
        root = resolver.root();
    }

    @Test
    void resolve_blankOrSlashIsRoot() {
        for (String input : new String[]{null, "", "/", "///", ".", "./"}) {
            SandboxedPath resolved = resolver.resolve(input);
            assertThat(resolved.logical()).isEqualTo(root);
            assertThat(resolved.actual()).isEqualTo(root);
            assertThat(resolved.displayPath()).isEqualTo("/");
        }
    }

    @Test
    void resolve_ignoresEmptyAndDotSegments() {
        SandboxedPath resolved = resolver.resolve("/a//./b/");

        assertThat(resolved.logical()).isEqualTo(root.resolve("a").resolve("b"));
        assertThat(resolved.actual()).isEqualTo(resolved.logical());
        assertThat(resolved.displayPath()).isEqualTo("/a/b");
        assertThat(resolved.fileName()).isEqualTo("b");
    }

    @Test
    void resolve_popsWithinRoot() {
        assertThat(resolver.resolve("a/b/../c").displayPath()).isEqualTo("/a/c");
        assertThat(resolver.resolve("a/..").logical()).isEqualTo(root);
    }

    @Test
    void resolve_rejectsPoppingAboveRoot() {
        assertDenied(() -> resolver.resolve(".."));
        assertDenied(() -> resolver.resolve("/../etc/passwd"));
        assertDenied(() -> resolver.resolve("a/../../a"));
        assertDenied(() -> resolver.resolve("a/b/../../../root"));
    }

    @Test
    void resolve_neverLeavesRootForGeneratedInputs() {
        String[] parts = {"..", ".", "", "a", "b", "..", "c d"};
        Random random = new Random(42);
        int accepted = 0;
        for (int i = 0; i < 2_000; i++) {
            int length = 1 + random.nextInt(8);
            List<String> segments = new ArrayList<>();
            for (int j = 0; j < length; j++) {
                segments.add(parts[random.nextInt(parts.length)]);
            }
            String input = (random.nextBoolean() ? "/" : "") + String.join("/", segments);
            try {
                SandboxedPath resolved = resolver.resolve(input);
                assertThat(resolved.logical()).startsWith(root);
                assertThat(resolved.actual()).startsWith(root);
                accepted++;
            } catch (TransferException e) {
                assertThat(e.getCode()).isEqualTo(ErrorCode.ACCESS_DENIED);
            }
        }
        assertThat(accepted).isPositive();
    }

    @Test
    void resolve_followsSymlinkInsideRoot() throws IOException {
        Path real = Files.createDirectories(root.resolve("real"));
        Files.writeString(real.resolve("f.txt"), "x");
        symlink(root.resolve("link"), real);

        SandboxedPath existing = resolver.resolve("link/f.txt");
        assertThat(existing.logical()).isEqualTo(root.resolve("link").resolve("f.txt"));
        assertThat(existing.actual()).isEqualTo(real.resolve("f.txt"));
        assertThat(existing.displayPath()).isEqualTo("/link/f.txt");

        SandboxedPath missing = resolver.resolve("/link/new/file.bin");
        assertThat(missing.actual()).isEqualTo(real.resolve("new").resolve("file.bin"));
        assertThat(missing.displayPath()).isEqualTo("/link/new/file.bin");
    }

    @Test
    void resolve_rejectsSymlinkEscapingRoot() throws IOException {
        Path outside = Files.createDirectories(tmp.resolve("outside"));
        symlink(root.resolve("escape"), outside);

        assertDenied(() -> resolver.resolve("escape"));
        assertDenied(() -> resolver.resolve("escape/new.txt"));
        assertDenied(() -> resolver.resolveFile("escape", "new.txt"));
    }

    @Test
    void resolve_rejectsDanglingSymlink() throws IOException {
        symlink(root.resolve("dangling"), tmp.resolve("does-not-exist"));

        assertDenied(() -> resolver.resolve("dangling"));
    }

    @Test
    void resolve_rejectsAnySymlinkWhenDisabled() throws IOException {
        Path real = Files.createDirectories(root.resolve("real"));
        symlink(root.resolve("link"), real);
        SandboxPathResolver strict = new SandboxPathResolver(root, false);

        assertThat(strict.resolve("real").actual()).isEqualTo(real);
        assertDenied(() -> strict.resolve("link/a.txt"));
    }

    @Test
    void resolve_deniedMessageDoesNotRevealCause() throws IOException {
        symlink(root.resolve("escape"), Files.createDirectories(tmp.resolve("outside")));

        String traversal = deniedMessage(() -> resolver.resolve("../x"));
        String escape = deniedMessage(() -> resolver.resolve("escape/x"));

        assertThat(traversal).isEqualTo(escape);
    }

    @Test
    void resolveFile_acceptsPlainNameOnly() {
        SandboxedPath file = resolver.resolveFile("docs", "report.pdf");
        assertThat(file.displayPath()).isEqualTo("/docs/report.pdf");
        assertThat(file.fileName()).isEqualTo("report.pdf");

        assertDenied(() -> resolver.resolveFile("docs", ".."));
        assertDenied(() -> resolver.resolveFile("docs", "."));
        assertDenied(() -> resolver.resolveFile("docs", "a/b.txt"));
        assertDenied(() -> resolver.resolveFile("docs", " "));
        assertDenied(() -> resolver.resolveFile("../docs", "a.txt"));
    }

    @Test
    void backslash_isOrdinaryCharacterOnPosix() {
        assumeTrue("/".equals(FileSystems.getDefault().getSeparator()), "仅适用于以 / 为分隔符的平台");

        SandboxedPath literal = resolver.resolve("..\\..\\windows");
        assertThat(literal.logical()).isEqualTo(root.resolve("..\\..\\windows"));
        assertThat(literal.logical().getParent()).isEqualTo(root);

        SandboxedPath file = resolver.resolveFile("docs", "a\\b.txt");
        assertThat(file.fileName()).isEqualTo("a\\b.txt");
        assertThat(file.logical().getParent()).isEqualTo(root.resolve("docs"));
        assertThat(SandboxPathResolver.isPlainFileName("..\\b.txt")).isTrue();
    }

    @Test
    void constructor_createsMissingRoot() {
        FileServerProperties properties = new FileServerProperties();
        properties.setRoot(tmp.resolve("fresh/files").toString());

        SandboxPathResolver created = new SandboxPathResolver(properties);

        assertThat(created.root()).isDirectory();
    }

    private static void symlink(Path link, Path target) {
        try {
            Files.createSymbolicLink(link, target);
        } catch (IOException | UnsupportedOperationException e) {
            assumeTrue(false, "当前文件系统不支持符号链接：" + e.getMessage());
        }
    }

    private static void assertDenied(ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOf(TransferException.class)
                .extracting(e -> ((TransferException) e).getCode())
                .isEqualTo(ErrorCode.ACCESS_DENIED);
    }

    private static String deniedMessage(ThrowingCallable call) {
        try {
            call.call();
        } catch (TransferException e) {
            return e.getMessage();
        } catch (Throwable t) {
            throw new AssertionError(t);
        }
        throw new AssertionError("expected ACCESS_DENIED");
    }
}
