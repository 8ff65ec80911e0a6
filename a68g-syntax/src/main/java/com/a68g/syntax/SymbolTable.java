package com.a68g.syntax;

/**
 * 符号表（一个词法范围）。
 * 优化器只读取层级、帧大小以及决定帧是否需要初始化的信息。
 */
public final class SymbolTable {
    private final int number;
    private final int level;
    private final SymbolTable previous;
    private int apIncrement;
    private boolean labels;
    private boolean anonymousTexts;
    private int procOpDeclarations;

    public SymbolTable(int number, int level, SymbolTable previous) {
        this.number = number;
        this.level = level;
        this.previous = previous;
    }

    public int getNumber() { return number; }
    public int getLevel() { return level; }
    public SymbolTable getPrevious() { return previous; }

    /** 帧中本范围对象占用的字节数 */
    public int getApIncrement() { return apIncrement; }
    public void setApIncrement(int apIncrement) { this.apIncrement = apIncrement; }

    /** 范围内是否声明了标号 */
    public boolean hasLabels() { return labels; }
    public void setLabels(boolean labels) { this.labels = labels; }

    /** 范围内是否有匿名的例程文本或格式文本 */
    public boolean hasAnonymousTexts() { return anonymousTexts; }
    public void setAnonymousTexts(boolean anonymousTexts) { this.anonymousTexts = anonymousTexts; }

    /** 范围内需要在帧初始化时建立的过程/运算符声明个数 */
    public int getProcOpDeclarations() { return procOpDeclarations; }
    public void setProcOpDeclarations(int procOpDeclarations) { this.procOpDeclarations = procOpDeclarations; }

    @Override
    public String toString() {
        return "table#" + number + "@" + level;
    }
}
