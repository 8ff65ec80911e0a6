package com.a68g.optimiser;

import java.util.Collections;
import java.util.List;

/**
 * 一次优化的结果：C 文本、诊断与统计。节点上的标注直接写在语法树里。
 */
public final class OptimiserResult {

    private final String code;
    private final List<OptimiserDiagnostic> diagnostics;
    private final int procedures;
    private final int uniqueNames;
    private final String option;

    public OptimiserResult(String code, List<OptimiserDiagnostic> diagnostics, int procedures,
                           int uniqueNames, String option) {
        this.code = code;
        this.diagnostics = diagnostics;
        this.procedures = procedures;
        this.uniqueNames = uniqueNames;
        this.option = option;
    }

    public String getCode() { return code; }
    public List<OptimiserDiagnostic> getDiagnostics() { return Collections.unmodifiableList(diagnostics); }
    public int getProcedures() { return procedures; }
    public int getUniqueNames() { return uniqueNames; }

    /** 交给 C 编译器的优化选项，例如 -O2 */
    public String getOption() { return option; }

    public boolean hasErrors() {
        for (OptimiserDiagnostic d : diagnostics) {
            if (d.getSeverity() == OptimiserDiagnostic.Severity.ERROR) {
                return true;
            }
        }
        return false;
    }
}
