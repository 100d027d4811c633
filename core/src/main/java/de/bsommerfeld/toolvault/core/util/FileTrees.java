package de.bsommerfeld.toolvault.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Directory tree operations used by hydration, launching, and sealing.
 *
 * <p>
 * All traversals are iterative with an explicit work stack or queue, so tree
 * depth is bounded only by the filesystem. Symbolic links are never followed
 * into directories; a link is treated as a leaf. The first I/O error aborts the
 * whole operation.
 */
public final class FileTrees {

    private FileTrees() {
    }

    /**
     * Copies {@code source} (a directory) to {@code target}, creating
     * {@code target} and all intermediate directories.
     *
     * @throws IOException on the first file that cannot be copied
     */
    public static void copyTree(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new IOException("Not a directory: " + source);
        }

        Deque<Path> pending = new ArrayDeque<>();
        pending.push(source);
        while (!pending.isEmpty()) {
            Path dir = pending.pop();
            Path targetDir = target.resolve(relativeString(source, dir));
            Files.createDirectories(targetDir);

            for (Path child : sortedChildren(dir)) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    pending.push(child);
                } else {
                    Files.copy(child, targetDir.resolve(child.getFileName().toString()),
                            StandardCopyOption.COPY_ATTRIBUTES,
                            StandardCopyOption.REPLACE_EXISTING,
                            LinkOption.NOFOLLOW_LINKS);
                }
            }
        }
    }

    /**
     * Deletes {@code root} and everything below it. Missing roots are a no-op.
     */
    public static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }

        // Collect pre-order, delete in reverse so children go before parents
        List<Path> order = new ArrayList<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Path current = pending.pop();
            order.add(current);
            if (Files.isDirectory(current, LinkOption.NOFOLLOW_LINKS)) {
                for (Path child : sortedChildren(current)) {
                    pending.push(child);
                }
            }
        }
        for (int i = order.size() - 1; i >= 0; i--) {
            Files.deleteIfExists(order.get(i));
        }
    }

    /** Sum of all regular file sizes below {@code root}. */
    public static long sizeOf(Path root) throws IOException {
        long total = 0;
        for (Path path : listRecursive(root)) {
            if (Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
                total += Files.size(path);
            }
        }
        return total;
    }

    /**
     * Lists every file and directory below {@code root} (excluding the root
     * itself), sorted by their forward-slash relative path. The ordering is
     * stable across platforms and runs.
     */
    public static List<Path> listRecursive(Path root) throws IOException {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            return result;
        }

        Deque<Path> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Path dir = pending.pop();
            for (Path child : sortedChildren(dir)) {
                result.add(child);
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    pending.push(child);
                }
            }
        }

        result.sort(Comparator.comparing(p -> relativeString(root, p)));
        return result;
    }

    /**
     * Breadth-first search for the first regular file matching the predicate.
     * Shallower matches win; siblings are visited in name order.
     */
    public static Optional<Path> findFirst(Path root, Predicate<Path> matcher) throws IOException {
        if (!Files.isDirectory(root)) {
            return Optional.empty();
        }

        Deque<Path> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Path dir = queue.poll();
            List<Path> subdirs = new ArrayList<>();
            for (Path child : sortedChildren(dir)) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    subdirs.add(child);
                } else if (Files.isRegularFile(child) && matcher.test(child)) {
                    return Optional.of(child);
                }
            }
            queue.addAll(subdirs);
        }
        return Optional.empty();
    }

    public static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return false;
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findFirst().isEmpty();
        }
    }

    /**
     * Relative path of {@code path} under {@code root}, always with forward
     * slashes. Used for archive entry names and manifest-style comparisons.
     */
    public static String relativeString(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private static List<Path> sortedChildren(Path dir) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }
}
