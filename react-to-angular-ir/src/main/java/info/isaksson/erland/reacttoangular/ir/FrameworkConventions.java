package info.isaksson.erland.reacttoangular.ir;

import java.util.Map;
import java.util.Set;

/**
 * Framework vocabulary shared by the transformer and the generators.
 *
 * <p>String constants only; the React to Angular name mappings themselves live in the transformer's
 * mapping tables.</p>
 */
public final class FrameworkConventions {

    private FrameworkConventions() {}

    public static final class React {
        private React() {}

        public static final String NAMESPACE = "React";
        public static final String USE_STATE = "useState";
        public static final String USE_EFFECT = "useEffect";

        public static final String KEY_ATTRIBUTE = "key";
        public static final String STYLE_ATTRIBUTE = "style";
        public static final String VALUE_ATTRIBUTE = "value";
        public static final String CHANGE_ATTRIBUTE = "onChange";
        public static final String EVENT_PREFIX = "on";

        /** Lifecycle names an effect maps onto: the effect body and its returned cleanup. */
        public static final String MOUNT = "componentDidMount";
        public static final String UNMOUNT = "componentWillUnmount";

        public static final String DEFAULT_COMPONENT_NAME = "MyComponent";

        /** {@code onClick}, {@code onMouseEnter}: "on" followed by an upper-case letter. */
        public static boolean isEventAttribute(String name) {
            return name != null
                    && name.length() > EVENT_PREFIX.length()
                    && name.startsWith(EVENT_PREFIX)
                    && Character.isUpperCase(name.charAt(EVENT_PREFIX.length()));
        }
    }

    public static final class Angular {
        private Angular() {}

        public static final String CORE_MODULE = "@angular/core";
        public static final String DECORATOR_INPUT = "@Input()";
        public static final String DECORATOR_OUTPUT = "@Output()";
        public static final String DEFAULT_SELECTOR_PREFIX = "app";

        public static final String EVENT_ARG = "$event";
        public static final String NG_FOR = "*ngFor";
        public static final String NG_IF = "*ngIf";
        public static final String NG_MODEL = "ngModel";
        public static final String NG_STYLE = "ngStyle";
        public static final String NG_CONTAINER = "ng-container";

        public static final String NG_ON_INIT = "ngOnInit";
        public static final String NG_ON_DESTROY = "ngOnDestroy";

        public static final String FORMS_MODULE_NOTE = "// NOTE: Add FormsModule to your module imports for [(ngModel)]";

        /** Lifecycle hook method to the interface a class implements for it. */
        public static final Map<String, String> LIFECYCLE_INTERFACES = Map.of(
                "ngOnChanges", "OnChanges",
                "ngOnInit", "OnInit",
                "ngDoCheck", "DoCheck",
                "ngAfterContentInit", "AfterContentInit",
                "ngAfterContentChecked", "AfterContentChecked",
                "ngAfterViewInit", "AfterViewInit",
                "ngAfterViewChecked", "AfterViewChecked",
                "ngOnDestroy", "OnDestroy"
        );
    }

    public static final class Html {
        private Html() {}

        /** Elements without content or closing tag. */
        public static final Set<String> VOID_TAGS = Set.of(
                "area", "base", "br", "col", "embed", "hr", "img", "input",
                "link", "meta", "param", "source", "track", "wbr"
        );

        public static boolean isVoid(String tag) {
            return tag != null && VOID_TAGS.contains(tag.toLowerCase());
        }
    }
}
