package com.a68g.cli;

import com.a68g.optimiser.OptimisationLevel;
import com.a68g.optimiser.OptimiserOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * a68g-opt 命令行入口（picocli）
 */
@Command(name = "a68g-opt", version = "a68g-opt 0.1.0",
         mixinStandardHelpOptions = true,
         description = "把检查过的 Algol 68 语法树编译为 C 文本")
public class Main implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    @Option(names = "-O", defaultValue = "2", description = "优化级别（0, 1, 2, 3, fast），默认 2")
    String level;

    @Option(names = "--check", description = "生成运行时检查")
    boolean check;

    @Option(names = "--long-modes", description = "编译 LONG INT 与 LONG REAL")
    boolean longModes;

    @Option(names = "--book-capacity", defaultValue = "1024", description = "预订表容量")
    int bookCapacity;

    @Option(names = "--max-depth", defaultValue = "512", description = "最大递归深度")
    int maxDepth;

    @Option(names = {"-o", "--output"}, description = "C 输出文件（默认与输入同名的 .c）")
    Path output;

    @Option(names = {"-m", "--manifest"}, description = "标注清单 JSON 文件")
    Path manifest;

    @Option(names = {"-v", "--verbose"}, description = "输出统计信息")
    boolean verbose;

    @Parameters(index = "0", description = "语法树 JSON 文件")
    Path input;

    @Override
    public Integer call() {
        OptimiserOptions options;
        try {
            options = OptimiserOptions.builder()
                    .level(OptimisationLevel.parse(level))
                    .compileCheck(check)
                    .longModes(longModes)
                    .bookCapacity(bookCapacity)
                    .maxDepth(maxDepth)
                    .build();
        } catch (IllegalArgumentException e) {
            System.err.println("错误: " + e.getMessage());
            return 1;
        }
        if (verbose) {
            Logger.getLogger("com.a68g").setLevel(Level.FINE);
        }
        return new OptimiseRunner(options, verbose, System.out, System.err).run(input, output, manifest);
    }

    /** 读取类路径上的 logging.properties */
    static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "无法读取 logging.properties", e);
        }
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
