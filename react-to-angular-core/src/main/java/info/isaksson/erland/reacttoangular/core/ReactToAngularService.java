package info.isaksson.erland.reacttoangular.core;

import info.isaksson.erland.reacttoangular.ast.JsTreeReader;
import info.isaksson.erland.reacttoangular.ast.Program;
import info.isaksson.erland.reacttoangular.ast.UnparsableInputException;
import info.isaksson.erland.reacttoangular.emitter.ClassGenerator;
import info.isaksson.erland.reacttoangular.emitter.ComponentNames;
import info.isaksson.erland.reacttoangular.emitter.GeneratorOptions;
import info.isaksson.erland.reacttoangular.emitter.StyleGenerator;
import info.isaksson.erland.reacttoangular.emitter.TemplateGenerator;
import info.isaksson.erland.reacttoangular.io.SourceScanner;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.IrJson;
import info.isaksson.erland.reacttoangular.transform.ReactToAngularTransformer;
import info.isaksson.erland.reacttoangular.transform.TransformWarning;
import info.isaksson.erland.reacttoangular.transform.TransformWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Core (server-friendly) API for converting React components to Angular artifacts.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline. Each call
 * builds its own IR; the service itself holds no per-call state.</p>
 */
public final class ReactToAngularService {

    private static final Logger LOG = LoggerFactory.getLogger(ReactToAngularService.class);

    private final ReactToAngularTransformer transformer;

    public ReactToAngularService() {
        this(new ReactToAngularTransformer());
    }

    public ReactToAngularService(ReactToAngularTransformer transformer) {
        if (transformer == null) throw new IllegalArgumentException("transformer must not be null");
        this.transformer = transformer;
    }

    /**
     * Convert a parsed module.
     *
     * @param componentName explicit name; null or blank uses the component's own name
     */
    public ConversionResult convert(Program program, String componentName, ReactToAngularOptions options) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        return convert(program, componentName, options, null);
    }

    /** Convert a JSON syntax tree held in memory. */
    public ConversionResult convertJson(String json, String componentName, ReactToAngularOptions options)
            throws UnparsableInputException {
        return convert(JsTreeReader.readFromString(json), componentName, options, null);
    }

    /**
     * Convert a JSON syntax tree file. Without an explicit name the file name is used
     * ({@code Counter.jsx.json} gives {@code Counter}).
     */
    public ConversionResult convertFile(Path file, String componentName, ReactToAngularOptions options) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        Program program = JsTreeReader.read(file);
        String name = isBlank(componentName) ? SourceScanner.componentNameOf(file) : componentName;
        return convert(program, name, options, file);
    }

    /** Generate artifacts from an IR document that was produced earlier (or by another tool). */
    public ConversionResult generateFromIr(ComponentIr ir, String componentName, ReactToAngularOptions options) {
        if (ir == null) throw new IllegalArgumentException("ir must not be null");
        return render(ir, componentName, options, List.of(), null);
    }

    /** Read an IR JSON file and generate artifacts from it. Without an explicit name the file name is used. */
    public ConversionResult generateFromIrFile(Path irFile, String componentName, ReactToAngularOptions options) throws IOException {
        if (irFile == null) throw new IllegalArgumentException("irFile must not be null");
        ComponentIr ir = IrJson.read(irFile);
        String name = isBlank(componentName) ? SourceScanner.componentNameOf(irFile) : componentName;
        return render(ir, name, options, List.of(), irFile);
    }

    private ConversionResult convert(Program program, String componentName, ReactToAngularOptions options, Path sourceFile) {
        TransformWarnings warnings = new TransformWarnings();
        ComponentIr ir = transformer.transform(program, warnings);
        return render(ir, componentName, options, warnings.toDeterministicList(), sourceFile);
    }

    private static ConversionResult render(
            ComponentIr ir,
            String componentName,
            ReactToAngularOptions options,
            List<TransformWarning> warnings,
            Path sourceFile
    ) {
        if (options == null) options = new ReactToAngularOptions();
        GeneratorOptions generatorOptions = options.toGeneratorOptions();
        String name = ComponentNames.resolve(componentName, ir);

        String ts = new ClassGenerator(generatorOptions).generate(ir, name);
        String html = new TemplateGenerator().generate(ir, name);
        String css = new StyleGenerator().generate(ir, name);

        LOG.debug("Generated {} ({} warnings)", ComponentNames.className(name), warnings.size());
        return new ConversionResult(name, ir, ts, html, css, warnings, sourceFile);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
