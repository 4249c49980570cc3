package info.isaksson.erland.reacttoangular.core;

import info.isaksson.erland.reacttoangular.emitter.ComponentNames;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.transform.TransformWarning;

import java.nio.file.Path;
import java.util.List;

/** Conversion result container for programmatic usage. */
public final class ConversionResult {
    /** Name the artifacts were generated for (file base name {@code <componentName>.component}). */
    public final String componentName;

    public final ComponentIr ir;

    /** {@code <Name>.component.ts} */
    public final String typescript;

    /** {@code <Name>.component.html} */
    public final String html;

    /** {@code <Name>.component.css} */
    public final String css;

    /** Sorted by code, message and context. Empty for IR mode. */
    public final List<TransformWarning> warnings;

    /** Present when the input was read from a file. */
    public final Path sourceFile;

    ConversionResult(
            String componentName,
            ComponentIr ir,
            String typescript,
            String html,
            String css,
            List<TransformWarning> warnings,
            Path sourceFile
    ) {
        this.componentName = componentName;
        this.ir = ir;
        this.typescript = typescript;
        this.html = html;
        this.css = css;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.sourceFile = sourceFile;
    }

    public boolean isMissingComponent() {
        return warnings.stream().anyMatch(w -> TransformWarning.MISSING_COMPONENT.equals(w.code));
    }

    public String typescriptFileName() {
        return ComponentNames.fileBaseName(componentName) + ".ts";
    }

    public String htmlFileName() {
        return ComponentNames.fileBaseName(componentName) + ".html";
    }

    public String cssFileName() {
        return ComponentNames.fileBaseName(componentName) + ".css";
    }

    public String irFileName() {
        return componentName + ".ir.json";
    }
}
