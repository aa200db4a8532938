package org.splc.compiler.backend.link;

import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.api.SourceInfo;
import org.splc.compiler.backend.layout.LayoutEngine;
import org.splc.compiler.backend.layout.LayoutResult;
import org.splc.compiler.backend.layout.PlacedItem;
import org.splc.compiler.diagnostics.Diagnostic;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.ir.IrAddress;
import org.splc.compiler.ir.IrCondition;
import org.splc.compiler.ir.IrGoto;
import org.splc.compiler.ir.IrHalt;
import org.splc.compiler.ir.IrIfGoto;
import org.splc.compiler.ir.IrItem;
import org.splc.compiler.ir.IrLabelDef;
import org.splc.compiler.ir.IrLabelRef;
import org.splc.compiler.ir.IrNum;
import org.splc.compiler.ir.IrProgram;
import org.splc.junit.extensions.logging.ExpectLog;
import org.splc.junit.extensions.logging.LogLevel;
import org.splc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class LinkerTest {

    private static final SourceInfo SRC = new SourceInfo("main.spl", 3, "");

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine("main.spl");
    }

    private static LayoutResult layout(IrItem... items) {
        return new LayoutEngine(10, 10).layout(new IrProgram("main.spl", List.of(items), Map.of()));
    }

    private LayoutResult link(LayoutResult layout, boolean strict) {
        return new Linker(LinkingRegistry.initializeWithDefaults(), diagnostics, strict).link(layout);
    }

    @Test
    void resolvesEveryJumpToItsLabelAddress() {
        // Arrange
        LayoutResult layout = layout(
                new IrIfGoto(new IrCondition(new IrNum(1), IrCondition.Comparison.GT, new IrNum(0)), new IrLabelRef("T1"), SRC),
                new IrGoto(new IrLabelRef("X2"), SRC),
                new IrLabelDef("T1", SRC),
                new IrLabelDef("X2", SRC),
                new IrHalt(SRC));

        // Act
        LayoutResult linked = link(layout, true);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(((IrIfGoto) linked.placed().get(0).item()).target()).isEqualTo(new IrAddress(30));
        assertThat(((IrGoto) linked.placed().get(1).item()).target()).isEqualTo(new IrAddress(40));
        assertThat(linked.placed()).extracting(PlacedItem::address).containsExactly(10, 20, 30, 40, 50);
        assertThat(linked.labelToAddress()).isEqualTo(layout.labelToAddress());
    }

    @Test
    void strictModeReportsUnknownLabel() {
        // Arrange
        LayoutResult layout = layout(new IrHalt(SRC), new IrGoto(new IrLabelRef("NOWHERE"), SRC));

        // Act
        LayoutResult linked = link(layout, true);

        // Assert
        assertThat(diagnostics.errorsWithCode(CompilerErrorCode.LABEL_NOT_FOUND))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.message()).isEqualTo("Jump target 'NOWHERE' at address 20 is not defined");
                    assertThat(d.lineNumber()).isEqualTo(3);
                });
        assertThat(((IrGoto) linked.placed().get(1).item()).target()).isEqualTo(new IrLabelRef("NOWHERE"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Linker", messagePattern = "Jump target 'NOWHERE'.*")
    void lenientModeKeepsTheSymbolicName() {
        // Arrange
        LayoutResult layout = layout(new IrGoto(new IrLabelRef("NOWHERE"), SRC));

        // Act
        LayoutResult linked = link(layout, false);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::type).containsExactly(Diagnostic.Type.WARNING);
        assertThat(((IrGoto) linked.placed().get(0).item()).target()).isEqualTo(new IrLabelRef("NOWHERE"));
    }

    @Test
    void alreadyNumericTargetsAreKept() {
        // Arrange
        LayoutResult layout = layout(new IrGoto(new IrAddress(10), SRC));

        // Act
        LayoutResult linked = link(layout, true);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(((IrGoto) linked.placed().get(0).item()).target()).isEqualTo(new IrAddress(10));
    }
}
