package org.bhavforge.analysis.diagnostics;

/**
 * What kind of problem a {@link Diagnostic} reports.
 * <p>
 * Each category belongs to a {@link Group} used for report summaries.
 */
public enum DiagnosticCategory {
    TYPE_MISMATCH(Group.TYPE),
    INVALID_OPERAND(Group.TYPE),
    STACK_UNDERFLOW(Group.STACK),
    STACK_OVERFLOW(Group.STACK),
    VARIABLE_UNINITIALIZED(Group.VARIABLE),
    VARIABLE_OUT_OF_BOUNDS(Group.VARIABLE),
    INVALID_BRANCH_TARGET(Group.CONTROL_FLOW),
    MISSING_RETURN(Group.CONTROL_FLOW),
    LOGIC_ERROR(Group.LOGIC),
    DEAD_CODE(Group.FLOW),
    INFINITE_LOOP(Group.FLOW),
    HOT_SPOT(Group.FLOW),
    DEEP_NESTING(Group.FLOW),
    COMPLEX_LOGIC(Group.FLOW);

    /**
     * Report section a category is listed under.
     */
    public enum Group {
        TYPE,
        STACK,
        VARIABLE,
        CONTROL_FLOW,
        LOGIC,
        FLOW
    }

    private final Group group;

    DiagnosticCategory(Group group) {
        this.group = group;
    }

    public Group group() {
        return group;
    }
}
