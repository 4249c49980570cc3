package info.isaksson.erland.reacttoangular.transform;

import info.isaksson.erland.reacttoangular.ast.ExportDeclaration;
import info.isaksson.erland.reacttoangular.ast.FunctionNode;
import info.isaksson.erland.reacttoangular.ast.JsNode;
import info.isaksson.erland.reacttoangular.ast.JsNodeKind;
import info.isaksson.erland.reacttoangular.ast.JsTrees;
import info.isaksson.erland.reacttoangular.ast.Program;
import info.isaksson.erland.reacttoangular.ast.VariableDeclaration;
import info.isaksson.erland.reacttoangular.ast.VariableDeclarator;

import java.util.Optional;

/**
 * Finds the component function of a module.
 *
 * <p>Search order: the first top-level function declaration (also behind {@code export}); then the
 * first top-level variable with a capitalised name bound to an arrow or function expression; then an
 * anonymous {@code export default} function.</p>
 */
final class ComponentLocator {

    /** A located component: the function and the name it was declared under (may be null). */
    static final class Located {
        final FunctionNode function;
        final String name;

        Located(FunctionNode function, String name) {
            this.function = function;
            this.name = name;
        }
    }

    private ComponentLocator() {}

    static Optional<Located> locate(Program program) {
        for (JsNode stmt : program.body) {
            JsNode node = JsTrees.unwrapExport(stmt);
            if (node != null && node.is(JsNodeKind.FUNCTION_DECLARATION)) {
                FunctionNode fn = (FunctionNode) node;
                return Optional.of(new Located(fn, fn.name()));
            }
        }
        for (JsNode stmt : program.body) {
            JsNode node = JsTrees.unwrapExport(stmt);
            if (!(node instanceof VariableDeclaration)) continue;
            for (VariableDeclarator d : ((VariableDeclaration) node).declarations) {
                String name = d.boundName();
                if (name != null && !name.isEmpty() && Character.isUpperCase(name.charAt(0))
                        && d.init instanceof FunctionNode) {
                    return Optional.of(new Located((FunctionNode) d.init, name));
                }
            }
        }
        for (JsNode stmt : program.body) {
            if (stmt instanceof ExportDeclaration && ((ExportDeclaration) stmt).isDefault
                    && ((ExportDeclaration) stmt).declaration instanceof FunctionNode) {
                FunctionNode fn = (FunctionNode) ((ExportDeclaration) stmt).declaration;
                return Optional.of(new Located(fn, fn.name()));
            }
        }
        return Optional.empty();
    }
}
