package com.example.downloadgateway.service;

import com.example.downloadgateway.exception.DownloadErrorCode;
import com.example.downloadgateway.exception.DownloadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PathResolverTest {

    @TempDir
    Path tempDir;

    private Path root;
    private PathResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectory(tempDir.resolve("files"));
        Files.writeString(root.resolve("report.pdf"), "pdf");
        Files.createDirectories(root.resolve("nested/dir"));
        Files.writeString(root.resolve("nested/dir/data.bin"), "data");

        Path sibling = Files.createDirectory(tempDir.resolve("files2"));
        Files.writeString(sibling.resolve("x"), "secret");
        Files.createDirectory(tempDir.resolve("files-secret"));
        Files.writeString(tempDir.resolve("secret.txt"), "secret");

        resolver = new PathResolver(root);
    }

    @Test
    void resolvesPlainName() throws IOException {
        Path resolved = resolver.resolve("report.pdf");

        assertEquals(root.toRealPath().resolve("report.pdf"), resolved);
        assertEquals("report.pdf", resolved.getFileName().toString());
    }

    @Test
    void resolvesNestedNameAndInnerTraversal() throws IOException {
        assertEquals(root.toRealPath().resolve("nested/dir/data.bin"), resolver.resolve("nested/dir/data.bin"));
        assertEquals(root.toRealPath().resolve("nested/dir/data.bin"),
                resolver.resolve("nested/other/../dir/./data.bin"));
    }

    @Test
    void leadingSeparatorsStayUnderRoot() throws IOException {
        assertEquals(root.toRealPath().resolve("report.pdf"), resolver.resolve("/report.pdf"));
        assertEquals(root.toRealPath().resolve("etc/passwd"), resolver.resolve("/etc/passwd"));
    }

    @Test
    void missingFileStillResolves() throws IOException {
        assertEquals(root.toRealPath().resolve("missing.txt"), resolver.resolve("missing.txt"));
    }

    @Test
    void emptyOrMissingNameIsInvalidInput() {
        assertEquals(DownloadErrorCode.INVALID_INPUT,
                assertThrows(DownloadException.class, () -> resolver.resolve("")).getCode());
        assertEquals(DownloadErrorCode.INVALID_INPUT,
                assertThrows(DownloadException.class, () -> resolver.resolve(null)).getCode());
    }

    @Test
    void nulByteIsInvalidInput() {
        DownloadException e = assertThrows(DownloadException.class, () -> resolver.resolve("report\0.pdf"));
        assertEquals(DownloadErrorCode.INVALID_INPUT, e.getCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "../secret.txt",
            "../../etc/passwd",
            "..",
            "nested/../../secret.txt",
            "../files2/x",
            "nested/dir/../../../files2/x",
            "../files-secret",
            "./../files/../files2/x"
    })
    void traversalOutOfRootIsRejected(String name) {
        DownloadException e = assertThrows(DownloadException.class, () -> resolver.resolve(name));
        assertEquals(DownloadErrorCode.PATH_ESCAPE, e.getCode());
    }

    @Test
    void siblingWithSharedPrefixIsNotInsideRoot() {
        // files2 shares the string prefix "files" with the root
        PathResolver prefixResolver = new PathResolver(root);
        DownloadException e = assertThrows(DownloadException.class,
                () -> prefixResolver.resolve("../files2/x"));
        assertEquals(DownloadErrorCode.PATH_ESCAPE, e.getCode());
    }

    @Test
    void symlinkLeadingOutOfRootIsRejected() throws IOException {
        Path link = root.resolve("escape");
        try {
            Files.createSymbolicLink(link, tempDir.resolve("secret.txt"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported here");
        }

        DownloadException e = assertThrows(DownloadException.class, () -> resolver.resolve("escape"));
        assertEquals(DownloadErrorCode.PATH_ESCAPE, e.getCode());
    }

    @Test
    void rootGivenWithTraversalIsCanonicalized() throws IOException {
        PathResolver viaDots = new PathResolver(root.resolve("nested/.."));

        assertEquals(root.toRealPath(), viaDots.getRoot());
        assertEquals(root.toRealPath().resolve("report.pdf"), viaDots.resolve("report.pdf"));
        assertThrows(DownloadException.class, () -> viaDots.resolve("../files2/x"));
    }

    @Test
    void missingRootFailsConstruction() {
        assertThrows(IllegalStateException.class, () -> new PathResolver(tempDir.resolve("does-not-exist")));
    }
}
