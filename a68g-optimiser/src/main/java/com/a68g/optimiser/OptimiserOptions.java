package com.a68g.optimiser;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * 优化器配置（不可变）。
 * <p>
 * 使用方式：
 * <pre>
 * OptimiserOptions options = OptimiserOptions.builder()
 *     .level(OptimisationLevel.OPTIMISE_2)
 *     .compileCheck(true)
 *     .build();
 * </pre>
 */
public final class OptimiserOptions {

    public static final int DEFAULT_BOOK_CAPACITY = 1024;
    public static final int DEFAULT_UNIQUE_CAPACITY = 2048;
    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final DateTimeFormatter STAMP_FORMAT =
            DateTimeFormatter.ofPattern("MMM dd yyyy HH:mm:ss", Locale.ROOT);

    private final OptimisationLevel level;
    private final boolean compileCheck;
    private final boolean longModes;
    private final int bookCapacity;
    private final int uniqueCapacity;
    private final int maxDepth;
    private final String objectFile;
    private final String packageName;
    private final String packageString;
    private final String stamp;

    private OptimiserOptions(Builder builder) {
        this.level = builder.level;
        this.compileCheck = builder.compileCheck;
        this.longModes = builder.longModes;
        this.bookCapacity = builder.bookCapacity;
        this.uniqueCapacity = builder.uniqueCapacity;
        this.maxDepth = builder.maxDepth;
        this.objectFile = builder.objectFile;
        this.packageName = builder.packageName;
        this.packageString = builder.packageString;
        this.stamp = builder.stamp != null ? builder.stamp : LocalDateTime.now().format(STAMP_FORMAT);
    }

    /** 默认配置：级别 2，不做运行时检查 */
    public static OptimiserOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptimisationLevel getLevel() { return level; }

    /** 生成运行时检查（未初始化值、数学错误），并使用带溢出检查的原语 */
    public boolean isCompileCheck() { return compileCheck; }

    /** 是否编译 LONG INT / LONG REAL */
    public boolean isLongModes() { return longModes; }

    public int getBookCapacity() { return bookCapacity; }
    public int getUniqueCapacity() { return uniqueCapacity; }

    /** 编译递归深度上限，超出后该子树交给解释器 */
    public int getMaxDepth() { return maxDepth; }

    public String getObjectFile() { return objectFile; }

    /** 运行时头文件所在目录，用于 #include */
    public String getPackageName() { return packageName; }

    public String getPackageString() { return packageString; }

    /** 前言中的日期行 */
    public String getStamp() { return stamp; }

    public Builder toBuilder() {
        return new Builder()
                .level(level)
                .compileCheck(compileCheck)
                .longModes(longModes)
                .bookCapacity(bookCapacity)
                .uniqueCapacity(uniqueCapacity)
                .maxDepth(maxDepth)
                .objectFile(objectFile)
                .packageName(packageName)
                .packageString(packageString)
                .stamp(stamp);
    }

    // ============ Builder ============

    public static final class Builder {
        private OptimisationLevel level = OptimisationLevel.OPTIMISE_2;
        private boolean compileCheck;
        private boolean longModes;
        private int bookCapacity = DEFAULT_BOOK_CAPACITY;
        private int uniqueCapacity = DEFAULT_UNIQUE_CAPACITY;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private String objectFile = "a68g-optimiser.c";
        private String packageName = "algol68g";
        private String packageString = "Algol 68 Genie optimiser 0.1.0";
        private String stamp;

        Builder() {
        }

        public Builder level(OptimisationLevel level) {
            this.level = Objects.requireNonNull(level, "level");
            return this;
        }

        public Builder compileCheck(boolean compileCheck) {
            this.compileCheck = compileCheck;
            return this;
        }

        public Builder longModes(boolean longModes) {
            this.longModes = longModes;
            return this;
        }

        public Builder bookCapacity(int bookCapacity) {
            if (bookCapacity < 0) throw new IllegalArgumentException("bookCapacity < 0");
            this.bookCapacity = bookCapacity;
            return this;
        }

        public Builder uniqueCapacity(int uniqueCapacity) {
            if (uniqueCapacity < 0) throw new IllegalArgumentException("uniqueCapacity < 0");
            this.uniqueCapacity = uniqueCapacity;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth <= 0");
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder objectFile(String objectFile) {
            this.objectFile = Objects.requireNonNull(objectFile, "objectFile");
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = Objects.requireNonNull(packageName, "packageName");
            return this;
        }

        public Builder packageString(String packageString) {
            this.packageString = Objects.requireNonNull(packageString, "packageString");
            return this;
        }

        /** 固定前言日期行；null 表示使用当前时间 */
        public Builder stamp(String stamp) {
            this.stamp = stamp;
            return this;
        }

        public OptimiserOptions build() {
            return new OptimiserOptions(this);
        }
    }
}
