package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Angular;

/** Options for rendering a component IR into TypeScript, HTML and CSS. */
public final class GeneratorOptions {

    /** Selector prefix: {@code app} gives {@code app-todo-box}. */
    public final String selectorPrefix;

    /** When true, the class file carries a FormsModule note if the template uses {@code [(ngModel)]}. */
    public final boolean formsNote;

    /** When true, handler names the template calls but the class does not declare get stub methods. */
    public final boolean handlerStubs;

    /**
     * When true, two-way bound names and repeated arrays that no property declares are added as
     * properties ({@code string = ''} and {@code any[] = []}).
     */
    public final boolean inferredProperties;

    public GeneratorOptions(String selectorPrefix, boolean formsNote, boolean handlerStubs, boolean inferredProperties) {
        this.selectorPrefix = (selectorPrefix == null || selectorPrefix.isBlank())
                ? Angular.DEFAULT_SELECTOR_PREFIX
                : selectorPrefix.trim();
        this.formsNote = formsNote;
        this.handlerStubs = handlerStubs;
        this.inferredProperties = inferredProperties;
    }

    public static GeneratorOptions defaults() {
        return new GeneratorOptions(Angular.DEFAULT_SELECTOR_PREFIX, true, true, true);
    }

    public GeneratorOptions withSelectorPrefix(String prefix) {
        return new GeneratorOptions(prefix, formsNote, handlerStubs, inferredProperties);
    }

    public GeneratorOptions withFormsNote(boolean include) {
        return new GeneratorOptions(selectorPrefix, include, handlerStubs, inferredProperties);
    }

    public GeneratorOptions withHandlerStubs(boolean include) {
        return new GeneratorOptions(selectorPrefix, formsNote, include, inferredProperties);
    }

    public GeneratorOptions withInferredProperties(boolean include) {
        return new GeneratorOptions(selectorPrefix, formsNote, handlerStubs, include);
    }

    @Override
    public String toString() {
        return "GeneratorOptions{" +
                "selectorPrefix='" + selectorPrefix + '\'' +
                ", formsNote=" + formsNote +
                ", handlerStubs=" + handlerStubs +
                ", inferredProperties=" + inferredProperties +
                '}';
    }
}
