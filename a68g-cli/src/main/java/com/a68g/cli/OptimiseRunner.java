package com.a68g.cli;

import com.a68g.optimiser.CodegenException;
import com.a68g.optimiser.OptimiserDiagnostic;
import com.a68g.optimiser.OptimiserDriver;
import com.a68g.optimiser.OptimiserOptions;
import com.a68g.optimiser.OptimiserResult;
import com.a68g.syntax.SyntaxTree;
import com.a68g.syntax.io.TreeFormatException;
import com.a68g.syntax.io.TreeReader;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 读取语法树、运行优化器、写出 C 文本与标注清单。
 * <p>
 * 不调用 System.exit，返回进程退出码：0 成功，1 输入错误或内部错误。
 */
public class OptimiseRunner {

    private static final Logger LOG = Logger.getLogger(OptimiseRunner.class.getName());

    private final OptimiserOptions options;
    private final boolean verbose;
    private final PrintStream out;
    private final PrintStream err;

    public OptimiseRunner(OptimiserOptions options, boolean verbose, PrintStream out, PrintStream err) {
        this.options = options;
        this.verbose = verbose;
        this.out = out;
        this.err = err;
    }

    /**
     * @param input    语法树文件
     * @param output   C 输出，null 时为与输入同名的 .c 文件
     * @param manifest 标注清单，null 时不写
     */
    public int run(Path input, Path output, Path manifest) {
        if (!Files.exists(input)) {
            err.println("错误: 文件不存在 - " + input);
            return 1;
        }
        Path cFile = output != null ? output : defaultOutput(input);
        try {
            SyntaxTree tree;
            try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
                tree = new TreeReader().read(reader);
            }
            OptimiserOptions effective = options.toBuilder()
                    .objectFile(cFile.getFileName().toString())
                    .build();
            OptimiserResult result = new OptimiserDriver(effective).run(tree);
            for (OptimiserDiagnostic d : result.getDiagnostics()) {
                err.println(d);
            }
            Files.write(cFile, result.getCode().getBytes(StandardCharsets.UTF_8));
            if (manifest != null) {
                Files.write(manifest, Manifest.toJson(result, tree).getBytes(StandardCharsets.UTF_8));
            }
            if (verbose) {
                out.printf("%s: procedures=%d unique-names=%d%n", input.getFileName(),
                        result.getProcedures(), result.getUniqueNames());
            }
            return 0;
        } catch (TreeFormatException e) {
            LOG.log(Level.SEVERE, "语法树格式错误", e);
            err.println("格式错误: " + e.getMessage());
            return 1;
        } catch (CodegenException e) {
            LOG.log(Level.SEVERE, "内部一致性错误", e);
            err.println("内部错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "读写失败", e);
            err.println("IO 错误: " + e.getMessage());
            return 1;
        }
    }

    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + ".c");
    }
}
