package com.musicgraph.harvester;

import com.musicgraph.harvester.error.FileStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Output-directory post-processing after all downloads finished.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #shuffleAndRenumber(Path)} gathers every audio file below the output directory,
 *       shuffles them and moves them to the top level with {@code 001_}-style prefixes. Emptied
 *       artist directories are removed.</li>
 *   <li>{@link #archive(Path, Path)} packs the output directory into a ZIP file.</li>
 * </ul>
 * Moving a file only renames its directory entry, so hard links into the track cache survive.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class PostProcessor {
    private static final Logger logger = LoggerFactory.getLogger(PostProcessor.class);

    static final Set<String> AUDIO_EXTENSIONS = Set.of(".mp3", ".flac", ".m4a", ".aac", ".ogg");
    private static final String SHUFFLE_TEMP_DIR = "_shuffled_temp";

    private final Random random;

    public PostProcessor() {
        this(new Random());
    }

    public PostProcessor(Random random) {
        this.random = random;
    }

    /**
     * @param outputDir directory holding the downloaded tracks
     * @return number of renumbered files
     * @throws FileStorageException if a file cannot be moved
     */
    public int shuffleAndRenumber(Path outputDir) {
        logger.info("Shuffling tracks and adding numeric prefixes...");
        List<Path> files;
        try (Stream<Path> walk = Files.walk(outputDir)) {
            files = walk.filter(Files::isRegularFile)
                .filter(p -> !p.getParent().getFileName().toString().equals(SHUFFLE_TEMP_DIR))
                .filter(PostProcessor::isAudio)
                .sorted()
                .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new FileStorageException("Failed to list tracks in " + outputDir, outputDir, e);
        }
        if (files.isEmpty()) {
            logger.warn("No tracks found to shuffle");
            return 0;
        }
        Collections.shuffle(files, random);

        Path tempDir = outputDir.resolve(SHUFFLE_TEMP_DIR);
        try {
            Files.createDirectories(tempDir);
            int width = Math.max(3, Integer.toString(files.size()).length());
            for (int i = 0; i < files.size(); i++) {
                Path file = files.get(i);
                String prefix = String.format("%0" + width + "d_", i + 1);
                Files.move(file, tempDir.resolve(prefix + file.getFileName()));
            }
            removeEmptyDirectories(outputDir, tempDir);
            try (Stream<Path> moved = Files.list(tempDir)) {
                for (Path file : moved.collect(Collectors.toList())) {
                    Files.move(file, outputDir.resolve(file.getFileName()));
                }
            }
            Files.delete(tempDir);
        } catch (IOException e) {
            throw new FileStorageException("Failed to renumber tracks in " + outputDir, outputDir, e);
        }
        logger.info("Shuffled and renumbered {} tracks", files.size());
        return files.size();
    }

    /**
     * Packs every regular file below {@code sourceDir} into {@code zipFile}, using paths relative
     * to {@code sourceDir}. The ZIP file must lie outside {@code sourceDir}.
     * @return the written archive
     * @throws FileStorageException if reading or writing fails
     */
    public Path archive(Path sourceDir, Path zipFile) {
        if (zipFile.toAbsolutePath().normalize().startsWith(sourceDir.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Archive " + zipFile + " must not be inside " + sourceDir);
        }
        int count = 0;
        try {
            Path parent = zipFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            List<Path> files;
            try (Stream<Path> walk = Files.walk(sourceDir)) {
                files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            }
            try (OutputStream out = Files.newOutputStream(zipFile); ZipOutputStream zip = new ZipOutputStream(out)) {
                for (Path file : files) {
                    String entryName = sourceDir.relativize(file).toString().replace('\\', '/');
                    zip.putNextEntry(new ZipEntry(entryName));
                    Files.copy(file, zip);
                    zip.closeEntry();
                    count++;
                }
            }
        } catch (IOException e) {
            throw new FileStorageException("Failed to create archive " + zipFile, zipFile, e);
        }
        logger.info("Archived {} files into {}", count, zipFile);
        return zipFile;
    }

    static boolean isAudio(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && AUDIO_EXTENSIONS.contains(name.substring(dot));
    }

    private static void removeEmptyDirectories(Path root, Path keep) throws IOException {
        List<Path> dirs;
        try (Stream<Path> walk = Files.walk(root)) {
            dirs = walk.filter(Files::isDirectory)
                .filter(d -> !d.equals(root) && !d.startsWith(keep))
                .sorted(Comparator.comparingInt(Path::getNameCount).reversed())
                .collect(Collectors.toList());
        }
        for (Path dir : dirs) {
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isPresent()) continue;
            }
            Files.delete(dir);
        }
    }
}
