package org.bhavforge.analysis.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Contains unit tests for {@link Diagnostic} and {@link Severity}.
 */
@Tag("unit")
class DiagnosticTest {

    @Test
    void format_includesPositionAndSuggestion() {
        Diagnostic diagnostic = Diagnostic.error(DiagnosticCategory.INVALID_BRANCH_TARGET, 3, "true exit 9 is out of range")
                .withSuggestion("point it at an existing instruction");

        assertThat(diagnostic.format()).isEqualTo(
                "[ERROR] #3 INVALID_BRANCH_TARGET: true exit 9 is out of range (point it at an existing instruction)");
    }

    @Test
    void format_namesGraphLevelFindings() {
        Diagnostic diagnostic = Diagnostic.info(DiagnosticCategory.COMPLEX_LOGIC, Diagnostic.GRAPH_LEVEL, "complex");

        assertThat(diagnostic.isGraphLevel()).isTrue();
        assertThat(diagnostic.suggestion()).isEmpty();
        assertThat(diagnostic.format()).isEqualTo("[INFO] graph COMPLEX_LOGIC: complex");
    }

    @Test
    void severity_isOrdered() {
        assertThat(Severity.ERROR.isAtLeast(Severity.WARNING)).isTrue();
        assertThat(Severity.WARNING.isAtLeast(Severity.WARNING)).isTrue();
        assertThat(Severity.INFO.isAtLeast(Severity.WARNING)).isFalse();
    }

    @Test
    void category_belongsToGroup() {
        assertThat(DiagnosticCategory.STACK_UNDERFLOW.group()).isEqualTo(DiagnosticCategory.Group.STACK);
        assertThat(DiagnosticCategory.DEAD_CODE.group()).isEqualTo(DiagnosticCategory.Group.FLOW);
    }
}
