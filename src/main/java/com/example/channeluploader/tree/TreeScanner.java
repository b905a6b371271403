package com.example.channeluploader.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a local folder depth-first and builds the {@link TreeNode} to upload.
 * <p>
 * Entries at each level are visited in case-insensitive name order. Bad folder names
 * and unreadable folders are recorded as errors and their subtree is left out; bad file
 * names, empty files and files above the size ceiling are recorded as warnings. Neither
 * stops the scan.
 */
public final class TreeScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeScanner.class);
    private static final Comparator<Path> NAME_ORDER = Comparator
            .comparing((Path path) -> path.getFileName().toString(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(path -> path.getFileName().toString());

    private final long maxObjectSize;
    private final boolean followLinks;
    private final List<PathMatcher> excludeFiles;
    private final List<PathMatcher> excludeDirectories;
    private final ProgressListener listener;
    private Tally tally = new Tally();

    public TreeScanner(long maxObjectSize) {
        this(maxObjectSize, false, List.of(), List.of(), ProgressListener.NONE);
    }

    public TreeScanner(long maxObjectSize,
                       boolean followLinks,
                       List<String> excludeFilePatterns,
                       List<String> excludeDirectoryPatterns,
                       ProgressListener listener) {
        this.maxObjectSize = maxObjectSize;
        this.followLinks = followLinks;
        this.excludeFiles = matchers(excludeFilePatterns);
        this.excludeDirectories = matchers(excludeDirectoryPatterns);
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    /**
     * Scans {@code root}. Returns empty when the root is missing or is not a directory;
     * the reason is then in {@link #summary()}.
     */
    public Optional<TreeNode> scan(Path root) {
        tally = new Tally();
        if (!Files.exists(root)) {
            tally.errors.add("Directory not found: " + root);
            return Optional.empty();
        }
        if (!Files.isDirectory(root)) {
            tally.errors.add("Not a directory: " + root);
            return Optional.empty();
        }
        tally.totalEntries = countEntries(root);
        TreeNode tree = new TreeNode();
        scanFolder(root, tree, 0);
        LOGGER.debug("Scanned {}: {} files, {} folders, {} bytes", root, tally.totalFiles, tally.totalFolders, tally.totalBytes);
        return Optional.of(tree);
    }

    public ScanSummary summary() {
        return new ScanSummary(
                tally.totalFiles,
                tally.totalFolders,
                tally.totalBytes,
                tally.skippedFiles,
                tally.errors,
                tally.warnings
        );
    }

    private void scanFolder(Path folder, TreeNode node, int depth) {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            stream.forEach(entries::add);
        } catch (AccessDeniedException ex) {
            tally.errors.add("Permission denied: " + folder);
            return;
        } catch (IOException ex) {
            LOGGER.warn("Failed to list directory {}", folder, ex);
            tally.errors.add("Error reading " + folder + ": " + ex.getMessage());
            return;
        }
        entries.sort(NAME_ORDER);

        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            reportProgress("Scanning: " + name);

            if (!followLinks && Files.isSymbolicLink(entry)) {
                tally.warnings.add("Skipping symbolic link: " + name);
                tally.skippedFiles++;
                continue;
            }
            if (Files.isDirectory(entry, linkOptions())) {
                if (matches(excludeDirectories, entry)) {
                    LOGGER.debug("Excluded directory {}", entry);
                    continue;
                }
                Optional<String> problem = NameValidator.validateFolderName(name);
                if (problem.isPresent()) {
                    tally.errors.add("Invalid folder '" + name + "': " + problem.get());
                    continue;
                }
                if (depth + 1 > TreeCodec.MAX_DEPTH) {
                    tally.errors.add("Folder '" + name + "' exceeds maximum depth of " + TreeCodec.MAX_DEPTH);
                    continue;
                }
                tally.totalFolders++;
                TreeNode child = new TreeNode();
                scanFolder(entry, child, depth + 1);
                node.putSubfolder(name, child);
            } else if (Files.isRegularFile(entry, linkOptions())) {
                scanFile(entry, name).ifPresent(node::addFile);
            }
        }
    }

    private Optional<FileEntry> scanFile(Path file, String name) {
        if (matches(excludeFiles, file)) {
            LOGGER.debug("Excluded file {}", file);
            tally.skippedFiles++;
            return Optional.empty();
        }
        Optional<String> problem = NameValidator.validateFileName(name);
        if (problem.isPresent()) {
            return skip("Skipping file '" + name + "': " + problem.get());
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException ex) {
            LOGGER.warn("Failed to read size for {}", file, ex);
            return skip("Cannot read file size: " + name);
        }
        if (size > maxObjectSize) {
            return skip(String.format(Locale.ROOT, "Skipping '%s': exceeds %s limit (%s)", name, humanSize(maxObjectSize), humanSize(size)));
        }
        if (size == 0) {
            return skip("Skipping empty file: " + name);
        }
        tally.totalFiles++;
        tally.totalBytes += size;
        return Optional.of(new FileEntry(name, size, file));
    }

    private Optional<FileEntry> skip(String warning) {
        tally.warnings.add(warning);
        tally.skippedFiles++;
        return Optional.empty();
    }

    private void reportProgress(String label) {
        tally.processed++;
        if (tally.totalEntries > 0) {
            listener.onProgress(Math.min(tally.processed, tally.totalEntries), tally.totalEntries, label);
        }
    }

    private long countEntries(Path root) {
        long[] count = {0};
        Set<FileVisitOption> options = followLinks ? EnumSet.of(FileVisitOption.FOLLOW_LINKS) : EnumSet.noneOf(FileVisitOption.class);
        try {
            Files.walkFileTree(root, options, Integer.MAX_VALUE, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    count[0]++;
                    // Folders the scan will not enter count once, without their contents.
                    if (matches(excludeDirectories, dir)
                            || NameValidator.validateFolderName(dir.getFileName().toString()).isPresent()
                            || root.relativize(dir).getNameCount() > TreeCodec.MAX_DEPTH) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    count[0]++;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    count[0]++;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            LOGGER.warn("Failed to pre-count entries under {}", root, ex);
        }
        return count[0];
    }

    private LinkOption[] linkOptions() {
        return followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }

    private static boolean matches(List<PathMatcher> matchers, Path path) {
        Path name = path.getFileName();
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        if (patterns != null) {
            for (String pattern : patterns) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            }
        }
        return List.copyOf(matchers);
    }

    static String humanSize(long bytes) {
        if (bytes >= 1024L * 1024 * 1024) {
            return String.format(Locale.ROOT, "%.2fGB", bytes / 1024.0 / 1024.0 / 1024.0);
        }
        if (bytes >= 1024L * 1024) {
            return String.format(Locale.ROOT, "%.2fMB", bytes / 1024.0 / 1024.0);
        }
        return bytes + "B";
    }

    private static final class Tally {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private long totalFiles;
        private long totalFolders;
        private long totalBytes;
        private long skippedFiles;
        private long processed;
        private long totalEntries;
    }
}
