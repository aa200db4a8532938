package org.splc.compiler.frontend.semantics;

import org.splc.compiler.frontend.ast.AstNode;
import org.splc.compiler.frontend.ast.Identifier;
import org.splc.compiler.frontend.ast.RoutineDef;

import java.util.List;

/**
 * Represents a single symbol (a variable, procedure or function) in the symbol table.
 *
 * @param name The declaring identifier, containing name and line.
 * @param category The category of the symbol.
 * @param scope The scope the symbol is declared in.
 * @param declaration The AST node that declares the symbol (a VarDecl or a routine definition).
 */
public record Symbol(Identifier name, Category category, SymbolTable.Scope scope, AstNode declaration) {

    /**
     * The category of a symbol in the symbol table.
     */
    public enum Category {
        /** A global, main, parameter or local variable. */
        VARIABLE("variable"),
        /** A procedure defined in the proc section. */
        PROCEDURE("procedure"),
        /** A function defined in the func section. */
        FUNCTION("function");

        private final String displayName;

        Category(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    /**
     * @return The parameter names of a procedure or function, or an empty list for variables.
     */
    public List<String> parameterNames() {
        if (declaration instanceof RoutineDef routine) {
            return routine.parameters().stream().map(p -> p.name().text()).toList();
        }
        return List.of();
    }

    /**
     * @return The number of declared parameters.
     */
    public int arity() {
        return parameterNames().size();
    }
}
