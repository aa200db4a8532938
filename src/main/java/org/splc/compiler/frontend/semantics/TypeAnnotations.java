package org.splc.compiler.frontend.semantics;

import org.splc.compiler.frontend.ast.AstNode;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The per-node types computed by the {@link TypeChecker}, keyed by node identity.
 */
public class TypeAnnotations {

    private final Map<AstNode, Type> types = new IdentityHashMap<>();

    void annotate(AstNode node, Type type) {
        types.put(node, type);
    }

    public Optional<Type> typeOf(AstNode node) {
        return Optional.ofNullable(types.get(node));
    }

    public int size() {
        return types.size();
    }
}
