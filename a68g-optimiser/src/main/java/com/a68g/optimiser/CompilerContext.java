package com.a68g.optimiser;

import com.a68g.optimiser.analysis.EligibilityClassifier;
import com.a68g.optimiser.emit.BookingTable;
import com.a68g.optimiser.emit.CodeWriter;
import com.a68g.optimiser.emit.DeclarationSet;
import com.a68g.optimiser.emit.StagedEmitter;
import com.a68g.optimiser.emit.UniqueNames;
import com.a68g.optimiser.fold.ConstantFolder;
import com.a68g.syntax.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一次编译的全部可变状态。
 * <p>
 * 输出缓冲、缩进计数、声明集合与预订表都挂在这里，由各生成调用显式传递。
 * 声明集合与预订表在每个顶层生成函数开始和结束时清空。
 */
public final class CompilerContext {

    /** 快速级别的代码级别，开启全局帧的直接访问 */
    public static final int FAST_CODE_LEVEL = 9;

    private final OptimiserOptions options;
    private final int codeLevel;
    private final EligibilityClassifier classifier;
    private final ConstantFolder folder;
    private final CodeWriter out = new CodeWriter();
    private final DeclarationSet declarations = new DeclarationSet();
    private final BookingTable booking;
    private final UniqueNames uniqueNames;
    private final StagedEmitter emitter;
    private final Set<String> diagnosticKeys = new LinkedHashSet<>();
    private final List<OptimiserDiagnostic> diagnostics = new ArrayList<>();

    private int globalLevel;
    private int procedures;
    private int codeErrors;
    private int depth;
    private int depthFallbacks;

    public CompilerContext(OptimiserOptions options) {
        this.options = options;
        this.codeLevel = codeLevel(options.getLevel());
        this.classifier = new EligibilityClassifier(codeLevel, options.isLongModes());
        this.folder = new ConstantFolder(classifier);
        this.booking = new BookingTable(options.getBookCapacity());
        this.uniqueNames = new UniqueNames(options.getUniqueCapacity());
        this.emitter = new StagedEmitter(this);
    }

    /**
     * 优化级别对应的代码级别：0 与 1 只有级别 1 的规则（0 另走只编译基本单元的路径），
     * 2、3 同名，快速级别为 {@value #FAST_CODE_LEVEL}。
     */
    public static int codeLevel(OptimisationLevel level) {
        switch (level) {
            case OPTIMISE_0:
            case OPTIMISE_1:
                return 1;
            case OPTIMISE_2:
                return 2;
            case OPTIMISE_3:
                return 3;
            default:
                return FAST_CODE_LEVEL;
        }
    }

    public OptimiserOptions getOptions() { return options; }
    public int getCodeLevel() { return codeLevel; }
    public EligibilityClassifier getClassifier() { return classifier; }
    public ConstantFolder getFolder() { return folder; }
    public StagedEmitter getEmitter() { return emitter; }

    /** 生成运行时检查 */
    public boolean isCheck() {
        return options.isCompileCheck();
    }

    public CodeWriter out() { return out; }
    public DeclarationSet declarations() { return declarations; }
    public BookingTable booking() { return booking; }
    public UniqueNames uniqueNames() { return uniqueNames; }

    /** 程序中最浅的词法层级 */
    public int getGlobalLevel() { return globalLevel; }
    public void setGlobalLevel(int globalLevel) { this.globalLevel = globalLevel; }

    // ---- 诊断 ----

    /** 同一节点上的同一消息只记录一次 */
    public void report(OptimiserDiagnostic.Severity severity, String message, Node node) {
        String key = severity + "|" + message + "|" + (node != null ? node.getNumber() : 0);
        if (diagnosticKeys.add(key)) {
            diagnostics.add(new OptimiserDiagnostic(severity, message, node));
        }
    }

    public List<OptimiserDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /** 折叠出错：记录并计数，之后的串行子句不再编译 */
    public void codeError() {
        codeErrors++;
    }

    public int getCodeErrors() { return codeErrors; }

    // ---- 统计 ----

    public void procedureWritten() {
        procedures++;
    }

    public int getProcedures() { return procedures; }

    // ---- 递归深度 ----

    /**
     * 进入一层递归。
     *
     * @return 超过上限时返回 false，调用方放弃编译该子树
     */
    public boolean enter() {
        if (depth >= options.getMaxDepth()) {
            depthFallbacks++;
            return false;
        }
        depth++;
        return true;
    }

    public void leave() {
        depth--;
    }

    public int getDepthFallbacks() { return depthFallbacks; }

    /** 清空一个生成函数的作用域状态 */
    public void resetScope() {
        declarations.clear();
        booking.clear();
    }
}
