package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** Content of {@code {}} or {@code {/* comment *&#47;}} in JSX. */
public final class JsxEmptyExpression extends JsNode {

    @Override public JsNodeKind kind() { return JsNodeKind.JSX_EMPTY_EXPRESSION; }

    @Override public List<JsNode> children() { return List.of(); }
}
