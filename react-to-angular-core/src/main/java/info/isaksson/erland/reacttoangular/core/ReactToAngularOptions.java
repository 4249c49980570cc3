package info.isaksson.erland.reacttoangular.core;

import info.isaksson.erland.reacttoangular.emitter.GeneratorOptions;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Angular;

/**
 * Core (server-friendly) options for react-to-angular conversion.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class ReactToAngularOptions {
    /** Prefix of the generated component selector ({@code app-counter}). */
    public String selectorPrefix = Angular.DEFAULT_SELECTOR_PREFIX;

    /** Emit the FormsModule reminder when the template uses {@code [(ngModel)]}. */
    public boolean formsNote = true;

    /** Emit stub methods for handlers the template calls but the component never declared. */
    public boolean handlerStubs = true;

    public boolean inferredProperties = true;

    /**
     * If true, callers may treat an input without a component as an error condition.
     * (Core never throws for it; this is for upstream policy.)
     */
    public boolean failOnMissingComponent = false;

    public GeneratorOptions toGeneratorOptions() {
        return GeneratorOptions.defaults()
                .withSelectorPrefix(selectorPrefix)
                .withFormsNote(formsNote)
                .withHandlerStubs(handlerStubs)
                .withInferredProperties(inferredProperties);
    }
}
