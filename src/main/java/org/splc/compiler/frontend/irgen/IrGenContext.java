package org.splc.compiler.frontend.irgen;

import org.splc.compiler.api.SourceInfo;
import org.splc.compiler.frontend.ast.Algorithm;
import org.splc.compiler.frontend.ast.InstructionNode;
import org.splc.compiler.ir.IrGoto;
import org.splc.compiler.ir.IrItem;
import org.splc.compiler.ir.IrLabelDef;
import org.splc.compiler.ir.IrLabelRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context passed to converters while one instruction list (main or a routine body)
 * is generated. Provides emission utilities, fresh labels and SourceInfo construction.
 */
public final class IrGenContext {

	private final String programName;
	private final IrConverterRegistry registry;
	private final NameSupply names;
	private final ConditionLowering conditions;
	private final List<IrItem> out = new ArrayList<>();

	/**
	 * Constructs a new IR generation context.
	 * @param programName The name of the program being compiled.
	 * @param registry The registry for resolving converters.
	 * @param names The name supply of the current compilation.
	 */
	public IrGenContext(String programName, IrConverterRegistry registry, NameSupply names) {
		this.programName = programName;
		this.registry = registry;
		this.names = names;
		this.conditions = new ConditionLowering(this);
	}

	/**
	 * Emits a new IR item.
	 * @param item The item to append.
	 */
	public void emit(IrItem item) {
		out.add(item);
	}

	public void emitLabel(String label, SourceInfo source) {
		emit(new IrLabelDef(label, source));
	}

	public void emitGoto(String label, SourceInfo source) {
		emit(new IrGoto(new IrLabelRef(label), source));
	}

	/**
	 * Converts the given node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 */
	public void convert(InstructionNode node) {
		registry.resolve(node).convert(node, this);
	}

	/**
	 * Converts every instruction of a nested algorithm in order.
	 * @param algorithm The algorithm to convert.
	 */
	public void convertAll(Algorithm algorithm) {
		algorithm.instructions().forEach(this::convert);
	}

	public String freshLabel(String prefix) {
		return names.freshLabel(prefix);
	}

	/**
	 * @return The lowering of boolean conditions into jumps, bound to this context.
	 */
	public ConditionLowering conditions() {
		return conditions;
	}

	public SourceInfo sourceOf(InstructionNode node) {
		return new SourceInfo(programName, node.line(), node.construct());
	}

	/**
	 * @return The items emitted so far.
	 */
	public List<IrItem> build() {
		return List.copyOf(out);
	}
}
