package org.splc.compiler.frontend.irgen;

import org.splc.compiler.frontend.ast.AssignNode;
import org.splc.compiler.frontend.ast.DoUntilNode;
import org.splc.compiler.frontend.ast.FunctionCallAssignNode;
import org.splc.compiler.frontend.ast.HaltNode;
import org.splc.compiler.frontend.ast.IfElseNode;
import org.splc.compiler.frontend.ast.IfNode;
import org.splc.compiler.frontend.ast.InstructionNode;
import org.splc.compiler.frontend.ast.PrintNode;
import org.splc.compiler.frontend.ast.ProcedureCallNode;
import org.splc.compiler.frontend.ast.WhileNode;
import org.splc.compiler.frontend.irgen.converters.AssignNodeConverter;
import org.splc.compiler.frontend.irgen.converters.DoUntilNodeConverter;
import org.splc.compiler.frontend.irgen.converters.FunctionCallAssignNodeConverter;
import org.splc.compiler.frontend.irgen.converters.HaltNodeConverter;
import org.splc.compiler.frontend.irgen.converters.IfElseNodeConverter;
import org.splc.compiler.frontend.irgen.converters.IfNodeConverter;
import org.splc.compiler.frontend.irgen.converters.PrintNodeConverter;
import org.splc.compiler.frontend.irgen.converters.ProcedureCallNodeConverter;
import org.splc.compiler.frontend.irgen.converters.WhileNodeConverter;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry mapping instruction node classes to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback. Instruction variants are
 * records, so lookup is by exact class.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends InstructionNode>, IAstNodeToIrConverter<? extends InstructionNode>> byClass = new HashMap<>();
	private final IAstNodeToIrConverter<InstructionNode> defaultConverter;

	private IrConverterRegistry(IAstNodeToIrConverter<InstructionNode> defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter for the given instruction node class.
	 *
	 * @param nodeType  The concrete node class.
	 * @param converter The converter instance handling that class.
	 * @param <T>       Concrete node type parameter.
	 */
	public <T extends InstructionNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * Resolves the converter for the given node, falling back to the default converter.
	 *
	 * @param node The node instance to resolve a converter for.
	 * @return A non-null converter to handle the node.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToIrConverter<InstructionNode> resolve(InstructionNode node) {
		IAstNodeToIrConverter<?> found = byClass.get(node.getClass());
		if (found != null) return (IAstNodeToIrConverter<InstructionNode>) found;
		return defaultConverter;
	}

	/**
	 * Creates a registry instance with the given default converter and no registrations.
	 *
	 * @param defaultConverter The fallback converter used for unknown node types.
	 * @return A new registry instance.
	 */
	public static IrConverterRegistry initialize(IAstNodeToIrConverter<InstructionNode> defaultConverter) {
		return new IrConverterRegistry(defaultConverter);
	}

	/**
	 * Initializes a registry with the default converter and registers all built-in converters.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
		reg.register(HaltNode.class, new HaltNodeConverter());
		reg.register(PrintNode.class, new PrintNodeConverter());
		reg.register(AssignNode.class, new AssignNodeConverter());
		reg.register(ProcedureCallNode.class, new ProcedureCallNodeConverter());
		reg.register(FunctionCallAssignNode.class, new FunctionCallAssignNodeConverter());
		reg.register(IfNode.class, new IfNodeConverter());
		reg.register(IfElseNode.class, new IfElseNodeConverter());
		reg.register(WhileNode.class, new WhileNodeConverter());
		reg.register(DoUntilNode.class, new DoUntilNodeConverter());
		return reg;
	}
}
