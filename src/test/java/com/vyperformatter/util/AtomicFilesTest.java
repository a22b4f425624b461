package com.vyperformatter.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void createsNewFile() throws IOException {
        Path target = tempDir.resolve("token.vy");

        AtomicFiles.writeString(target, "x: uint256\n");

        assertEquals("x: uint256\n", Files.readString(target));
    }

    @Test
    void replacesContentWithoutLeavingTemporaryFiles() throws IOException {
        Path target = tempDir.resolve("token.vy");
        Files.writeString(target, "x:uint256\n");

        AtomicFiles.writeString(target, "x: uint256\n");

        assertEquals("x: uint256\n", Files.readString(target));
        assertEquals(List.of(target), _list(tempDir));
    }

    @Test
    void keepsPermissionsOfReplacedFile() throws IOException {
        Path target = tempDir.resolve("token.vy");
        Files.writeString(target, "x:uint256\n");
        assumeTrue(Files.getFileAttributeView(target, PosixFileAttributeView.class) != null);
        Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rw-r--r--"));

        AtomicFiles.writeString(target, "x: uint256\n");

        assertEquals("rw-r--r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(target)));
    }

    @Test
    void missingDirectoryFails() {
        Path target = tempDir.resolve("absent").resolve("token.vy");

        assertThrows(IOException.class, () -> AtomicFiles.writeString(target, "x: uint256\n"));
    }

    private static List<Path> _list(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.collect(Collectors.toList());
        }
    }
}
