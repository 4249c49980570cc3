package info.isaksson.erland.reacttoangular.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic discovery of syntax-tree JSON files with exclude rules.
 *
 * The scanner returns a stable, sorted list of {@code .json} files under a source root. IR snapshots
 * ({@code *.ir.json}) written by earlier runs are never picked up as inputs.
 */
public final class SourceScanner {

    public static final String TREE_SUFFIX = ".json";
    public static final String IR_SUFFIX = ".ir.json";

    private SourceScanner() {}

    /**
     * Scan for syntax-tree files under {@code sourceRoot}.
     *
     * @param sourceRoot root folder to scan
     * @param excludeGlobs list of glob patterns (matched against the path relative to sourceRoot, using '/' separators)
     */
    public static List<Path> scan(Path sourceRoot, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");

        final List<Predicate<Path>> excludeMatchers = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(sourceRoot)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(SourceScanner::isTreeFile)
                .filter(p -> !isInCommonBuildDir(sourceRoot, p))
                .filter(p -> !matchesAny(sourceRoot, p, excludeMatchers))
                .forEach(out::add);

            out.sort(Comparator.comparing(p -> normalizeRel(sourceRoot, p)));
            return out;
        }
    }

    static boolean isTreeFile(Path p) {
        String name = p.getFileName().toString().toLowerCase();
        return name.endsWith(TREE_SUFFIX) && !name.endsWith(IR_SUFFIX) && !name.equals("package.json");
    }

    /**
     * Component name derived from a syntax-tree file name: {@code Counter.jsx.json} and
     * {@code Counter.ast.json} both give {@code Counter}.
     */
    public static String componentNameOf(Path file) {
        String name = file.getFileName().toString();
        String lower = name.toLowerCase();
        if (lower.endsWith(IR_SUFFIX)) {
            name = name.substring(0, name.length() - IR_SUFFIX.length());
        } else if (lower.endsWith(TREE_SUFFIX)) {
            name = name.substring(0, name.length() - TREE_SUFFIX.length());
        }
        for (String ext : List.of(".ast", ".jsx", ".tsx", ".js")) {
            if (name.toLowerCase().endsWith(ext)) {
                name = name.substring(0, name.length() - ext.length());
                break;
            }
        }
        return name;
    }

    private static boolean matchesAny(Path root, Path absolutePath, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        final Path rel = root.relativize(absolutePath);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim();
            if (pattern.isEmpty()) continue;

            pattern = pattern.replace("\\", "/");

            // A plain directory name excludes everything below it.
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith("/")) {
                pattern = pattern + "/**";
            }

            final var matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(p -> matcher.matches(Path.of(normalizePathString(p))));
        }
        return out;
    }

    private static boolean isInCommonBuildDir(Path root, Path absolutePath) {
        String rel = normalizeRel(root, absolutePath);
        return rel.startsWith("target/")
                || rel.startsWith("build/")
                || rel.startsWith("dist/")
                || rel.startsWith(".git/")
                || rel.startsWith(".idea/")
                || rel.startsWith("node_modules/")
                || rel.contains("/node_modules/");
    }

    private static String normalizeRel(Path root, Path p) {
        return normalizePathString(root.relativize(p));
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
