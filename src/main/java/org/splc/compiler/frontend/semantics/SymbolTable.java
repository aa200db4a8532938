package org.splc.compiler.frontend.semantics;

import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.frontend.ast.AstNode;
import org.splc.compiler.frontend.ast.Identifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The scope tree and symbol table of one compilation.
 * <p>
 * The fixed scopes are created up front: Everywhere is the root, Global hangs below it, and
 * the procedure group, function group and Main scope hang below Global. Each procedure and
 * function gets its own Local scope below its group scope. Name uses are bound to their
 * symbols through an identity map, so the AST itself stays untouched.
 */
public class SymbolTable {

    /**
     * Represents a single scope in the symbol table.
     */
    public static class Scope {
        private final ScopeKind kind;
        private final Scope parent;
        private final Identifier owner;
        private final List<Scope> children = new ArrayList<>();
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(ScopeKind kind, Scope parent, Identifier owner) {
            this.kind = kind;
            this.parent = parent;
            this.owner = owner;
            if (parent != null) {
                parent.children.add(this);
            }
        }

        public ScopeKind kind() {
            return kind;
        }

        public Optional<Scope> parent() {
            return Optional.ofNullable(parent);
        }

        public Map<String, Symbol> symbols() {
            return Collections.unmodifiableMap(symbols);
        }

        public Optional<Symbol> lookupLocal(String name) {
            return Optional.ofNullable(symbols.get(name));
        }

        @Override
        public String toString() {
            return owner == null ? kind.name() : kind.name() + "(" + owner.text() + ")";
        }
    }

    private final DiagnosticsEngine diagnostics;
    private final Scope everywhere;
    private final Scope global;
    private final Scope procGroup;
    private final Scope funcGroup;
    private final Scope main;
    private final Map<AstNode, Scope> scopeMap = new IdentityHashMap<>();
    private final Map<AstNode, Symbol> bindings = new IdentityHashMap<>();

    /**
     * Constructs a new symbol table with its fixed scopes.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.everywhere = new Scope(ScopeKind.EVERYWHERE, null, null);
        this.global = new Scope(ScopeKind.GLOBAL, everywhere, null);
        this.procGroup = new Scope(ScopeKind.PROC_GROUP, global, null);
        this.funcGroup = new Scope(ScopeKind.FUNC_GROUP, global, null);
        this.main = new Scope(ScopeKind.MAIN, global, null);
    }

    public Scope global() {
        return global;
    }

    public Scope procGroup() {
        return procGroup;
    }

    public Scope funcGroup() {
        return funcGroup;
    }

    public Scope main() {
        return main;
    }

    /**
     * Creates the Local scope of a procedure or function.
     * @param group The procedure or function group scope.
     * @param owner The name of the defined routine.
     * @param definition The definition node, used to find the scope again.
     * @return The new scope.
     */
    public Scope enterLocal(Scope group, Identifier owner, AstNode definition) {
        Scope local = new Scope(ScopeKind.LOCAL, group, owner);
        scopeMap.put(definition, local);
        return local;
    }

    /**
     * Associates a node (a routine definition or main) with the scope its body is analyzed in.
     */
    public void registerScope(AstNode node, Scope scope) {
        scopeMap.put(node, scope);
    }

    /**
     * @return The scope a routine definition or main body is analyzed in.
     */
    public Optional<Scope> scopeOf(AstNode node) {
        return Optional.ofNullable(scopeMap.get(node));
    }

    /**
     * Defines a new symbol in the given scope.
     * Reports a name rule violation if the name is already defined in that scope.
     * @param scope The scope to define the symbol in.
     * @param symbol The symbol to define.
     * @return {@code true} if the symbol was added.
     */
    public boolean define(Scope scope, Symbol symbol) {
        String name = symbol.name().text();
        if (scope.symbols.containsKey(name)) {
            diagnostics.reportError(
                    CompilerErrorCode.NAME_RULE_VIOLATION,
                    "Duplicate " + symbol.category() + " name '" + name + "' in " + scope + " scope",
                    symbol.name().line()
            );
            return false;
        }
        scope.symbols.put(name, symbol);
        return true;
    }

    /**
     * Resolves a variable name from the given scope upwards to the root. Scopes that only
     * hold procedure or function names are passed over.
     * @param from The scope of the use.
     * @param name The variable name.
     * @return The variable symbol, or empty if the name is not a declared variable.
     */
    public Optional<Symbol> resolveVariable(Scope from, String name) {
        for (Scope scope = from; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null && symbol.category() == Symbol.Category.VARIABLE) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The procedure of that name, if declared.
     */
    public Optional<Symbol> resolveProcedure(String name) {
        return procGroup.lookupLocal(name);
    }

    /**
     * @return The function of that name, if declared.
     */
    public Optional<Symbol> resolveFunction(String name) {
        return funcGroup.lookupLocal(name);
    }

    /**
     * Records that a name use resolves to a symbol.
     */
    public void bind(AstNode use, Symbol symbol) {
        bindings.put(use, symbol);
    }

    /**
     * @return The symbol a name use was bound to during scope resolution.
     */
    public Optional<Symbol> symbolOf(AstNode use) {
        return Optional.ofNullable(bindings.get(use));
    }

    /**
     * @return All symbols of the program, in scope-tree order.
     */
    public List<Symbol> allSymbols() {
        List<Symbol> out = new ArrayList<>();
        collect(everywhere, out);
        return out;
    }

    private void collect(Scope scope, List<Symbol> out) {
        out.addAll(scope.symbols.values());
        for (Scope child : scope.children) {
            collect(child, out);
        }
    }
}
