package com.a68g.optimiser;

import com.a68g.syntax.Node;
import com.a68g.syntax.SourceLocation;

/**
 * 优化器诊断信息（常量折叠产生的溢出、未初始化等）。
 */
public final class OptimiserDiagnostic {

    public enum Severity { ERROR, WARNING, INFO }

    private final Severity severity;
    private final String message;
    private final SourceLocation location;
    private final int nodeNumber;

    public OptimiserDiagnostic(Severity severity, String message, Node node) {
        this.severity = severity;
        this.message = message;
        this.location = node != null ? node.getLocation() : SourceLocation.UNKNOWN;
        this.nodeNumber = node != null ? node.getNumber() : 0;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }
    public int getNodeNumber() { return nodeNumber; }

    /** 格式：file:line: severity: message */
    @Override
    public String toString() {
        return location.getFile() + ":" + location.getLine() + ": "
                + severity.name().toLowerCase() + ": " + message;
    }
}
