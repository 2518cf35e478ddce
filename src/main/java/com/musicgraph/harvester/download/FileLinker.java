package com.musicgraph.harvester.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Materializes a logical output location as a hard link to a canonical file.
 * <p>
 * An existing entry at the target is unlinked first; removing a hard link only drops that
 * directory entry, never the canonical data. Where the filesystem refuses hard links
 * (another device, no support) the bytes are copied instead.
 */
public final class FileLinker {
    private static final Logger logger = LoggerFactory.getLogger(FileLinker.class);

    private FileLinker() {
    }

    /**
     * @param canonical existing canonical file
     * @param target requested output path
     * @return true if the target is a hard link (or the canonical file itself), false if it was copied
     * @throws IOException if neither linking nor copying succeeded
     */
    public static boolean linkOrCopy(Path canonical, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (Files.exists(target) && Files.isSameFile(canonical, target)) {
            return true;
        }
        Files.deleteIfExists(target);
        try {
            Files.createLink(target, canonical);
            logger.debug("Linked {} -> {}", target, canonical);
            return true;
        } catch (UnsupportedOperationException | IOException e) {
            logger.warn("Hard link failed for {}, falling back to copy: {}", target, e.getMessage());
        }
        Files.copy(canonical, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return false;
    }
}
