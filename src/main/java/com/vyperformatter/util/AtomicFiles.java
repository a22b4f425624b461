package com.vyperformatter.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replaces file contents through a temporary sibling and a rename, so readers never
 * observe a half written file.
 */
public class AtomicFiles {
    private static final Logger logger = LoggerUtil.getLogger(AtomicFiles.class);

    private AtomicFiles() {
    }

    public static void writeString(Path target, String content) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            _copyPermissions(absolute, temp);
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.fine("Atomic move not supported in " + directory + ", replacing instead");
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                logger.log(Level.FINE, "Could not remove temporary file " + temp, cleanup);
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * The temporary file is created owner-only; the replaced file keeps its own mode.
     */
    private static void _copyPermissions(Path source, Path target) throws IOException {
        if (!Files.exists(source)
                || Files.getFileAttributeView(source, PosixFileAttributeView.class) == null) {
            return;
        }
        Files.setPosixFilePermissions(target, Files.getPosixFilePermissions(source));
    }
}
