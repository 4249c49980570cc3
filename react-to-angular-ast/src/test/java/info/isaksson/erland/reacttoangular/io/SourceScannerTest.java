package info.isaksson.erland.reacttoangular.io;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SourceScannerTest {

    @Test
    void scanIsSortedAndSkipsIrSnapshotsAndBuildDirs() throws Exception {
        Path root = Files.createTempDirectory("r2a-scan-");
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("node_modules/x"));
        Files.createDirectories(root.resolve("generated"));
        Files.writeString(root.resolve("b/Zeta.json"), "{}");
        Files.writeString(root.resolve("Alpha.jsx.json"), "{}");
        Files.writeString(root.resolve("Alpha.ir.json"), "{}");
        Files.writeString(root.resolve("notes.txt"), "x");
        Files.writeString(root.resolve("node_modules/x/pkg.json"), "{}");
        Files.writeString(root.resolve("generated/Gen.json"), "{}");

        List<Path> files = SourceScanner.scan(root, List.of("generated"));

        List<String> rel = files.stream()
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .collect(Collectors.toList());
        assertEquals(List.of("Alpha.jsx.json", "b/Zeta.json"), rel);
    }

    @Test
    void componentNameStripsJsonAndSourceExtensions() {
        assertEquals("Counter", SourceScanner.componentNameOf(Path.of("Counter.json")));
        assertEquals("Counter", SourceScanner.componentNameOf(Path.of("dir/Counter.jsx.json")));
        assertEquals("TodoList", SourceScanner.componentNameOf(Path.of("TodoList.ast.json")));
        assertEquals("Form", SourceScanner.componentNameOf(Path.of("Form.ir.json")));
    }
}
