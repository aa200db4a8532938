package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.PrintNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.frontend.ast.AtomOutput;
import org.splc.compiler.frontend.ast.StringOutput;
import org.splc.compiler.frontend.irgen.TermLowering;
import org.splc.compiler.ir.IrPrint;
import org.splc.compiler.ir.IrPrintable;
import org.splc.compiler.ir.IrString;

/**
 * Converts {@link PrintNode} into {@link IrPrint} of an atom or a string literal.
 */
public final class PrintNodeConverter implements IAstNodeToIrConverter<PrintNode> {

	@Override
	public void convert(PrintNode node, IrGenContext ctx) {
		IrPrintable value;
		if (node.output() instanceof AtomOutput atomOutput) {
			value = TermLowering.lowerAtom(atomOutput.atom());
		} else {
			value = new IrString(((StringOutput) node.output()).text());
		}
		ctx.emit(new IrPrint(value, ctx.sourceOf(node)));
	}
}
