package com.a68g.optimiser;

import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;
import com.a68g.syntax.SymbolTable;
import com.a68g.syntax.SyntaxTree;
import com.a68g.syntax.Tag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OptimiserDriver 单元测试
 */
class OptimiserDriverTest {

    private static final String STAMP = "Jan 01 2026 00:00:00";

    /** 按节点号命名的局部变量 */
    private static final Pattern LOCAL = Pattern.compile("\\bgenie_[a-z]+_\\d+\\b");

    private SymbolTable main;
    private TreeBuilder b;

    @BeforeEach
    void setUp() {
        main = new SymbolTable(1, 1, null);
        b = new TreeBuilder(main);
    }

    /** 以给定级别运行 */
    private OptimiserResult run(Node root, OptimisationLevel level) {
        return run(root, OptimiserOptions.builder().level(level).stamp(STAMP).build());
    }

    private OptimiserResult run(Node root, OptimiserOptions options) {
        return new OptimiserDriver(options).run(new SyntaxTree(root, TreeBuilder.SOURCE));
    }

    /** 子串出现的次数 */
    private static int count(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) {
            n++;
        }
        return n;
    }

    /** 声明行中出现的局部变量，例如 {@code A68_INT * genie_x_11, * genie_y_14;} */
    private static Set<String> declaredLocals(String code) {
        Set<String> names = new HashSet<>();
        for (String line : code.split("\n")) {
            String t = line.trim();
            if (t.matches("[A-Z][A-Z0-9_]* .*;") && !t.contains("(") && !t.contains("=")) {
                Matcher m = LOCAL.matcher(t);
                while (m.find()) {
                    names.add(m.group());
                }
            }
        }
        return names;
    }

    /** x := x + 1，x 为 REF INT */
    private Node incrementX(Tag x) {
        Mode refInt = Mode.ref(Mode.INT);
        Node lhs = b.node(13, Attribute.TERTIARY, refInt, b.identifier(14, "x", refInt, x));
        Node sum = b.formula(17, Mode.INT,
                b.deref(18, b.identifier(19, "x", refInt, x)),
                b.operator(20, "+", "genie_add_int"),
                b.denotation(21, Mode.INT, "1"));
        Node assignation = b.node(12, Attribute.ASSIGNATION, refInt,
                lhs, b.leaf(15, Attribute.ASSIGN_SYMBOL, ":=", null), b.unit(16, sum));
        return b.unit(10, b.node(11, Attribute.VOIDING, Mode.VOID, assignation));
    }

    /** IF cond THEN 1 ELSE 2 FI，cond 为条件单元的内容 */
    private Node ifThenElse(Node cond) {
        Node ifPart = b.node(3, Attribute.IF_PART, null,
                b.symbol(4, "IF"), b.node(5, Attribute.SERIAL_CLAUSE, Mode.BOOL, b.unit(6, cond)));
        Node thenPart = b.node(8, Attribute.THEN_PART, null,
                b.symbol(9, "THEN"), b.node(10, Attribute.SERIAL_CLAUSE, Mode.INT,
                        b.unit(11, b.denotation(12, Mode.INT, "1"))));
        Node elsePart = b.node(13, Attribute.ELSE_PART, null,
                b.symbol(14, "ELSE"), b.node(15, Attribute.SERIAL_CLAUSE, Mode.INT,
                        b.unit(16, b.denotation(17, Mode.INT, "2"))));
        Node fi = b.leaf(18, Attribute.FI_SYMBOL, "FI", null);
        return b.unit(1, b.node(2, Attribute.CONDITIONAL_CLAUSE, Mode.INT, ifPart, thenPart, elsePart, fi));
    }

    /** FOR i FROM 1 TO n DO SKIP OD */
    private Node countedLoop(Tag n) {
        SymbolTable loopTable = new SymbolTable(2, 2, main);
        Node forPart = b.node(4, Attribute.FOR_PART, null,
                b.symbol(5, "FOR"), b.leaf(6, Attribute.DEFINING_IDENTIFIER, "i", Mode.INT));
        Node fromPart = b.node(7, Attribute.FROM_PART, null,
                b.symbol(8, "FROM"), b.unit(9, b.denotation(10, Mode.INT, "1")));
        Node toPart = b.node(11, Attribute.TO_PART, null,
                b.leaf(12, Attribute.TO_SYMBOL, "TO", null), b.unit(13, b.identifier(14, "n", Mode.INT, n)));
        b.within(loopTable);
        Node serial = b.node(16, Attribute.SERIAL_CLAUSE, Mode.VOID,
                b.node(17, Attribute.UNIT, Mode.VOID, b.symbol(18, "SKIP")));
        b.within(main);
        Node doPart = b.node(15, Attribute.DO_PART, null, b.symbol(19, "DO"), serial, b.symbol(20, "OD"));
        return b.node(1, Attribute.UNIT, Mode.VOID,
                b.node(2, Attribute.ENCLOSED_CLAUSE, Mode.VOID,
                        b.node(3, Attribute.LOOP_CLAUSE, Mode.VOID, forPart, fromPart, toPart, doPart)));
    }

    // ================================================================
    // 文件头
    // ================================================================

    @Nested
    @DisplayName("文件头")
    class PreludeTests {

        @Test
        @DisplayName("空树只有文件头")
        void emptyTreeHasOnlyPrelude() {
            OptimiserResult result = run(b.symbol(1, "SKIP"), OptimisationLevel.OPTIMISE_2);
            String code = result.getCode();
            assertTrue(code.startsWith("// \"a68g-optimiser.c\" Algol 68 Genie optimiser 0.1.0\n"
                    + "// optimiser_level=2 code_level=2\n"
                    + "// " + STAMP + "\n"));
            assertTrue(code.contains("#include <algol68g/a68g-config.h>"));
            assertTrue(code.contains("#define _NODE_(n) (A68 (node_register)[n])"));
            assertFalse(code.contains("PROP_T"));
            assertEquals(0, result.getProcedures());
        }

        @Test
        @DisplayName("快速级别的代码级别为 9")
        void fastCodeLevel() {
            OptimiserResult result = run(b.symbol(1, "SKIP"), OptimisationLevel.FAST);
            assertTrue(result.getCode().contains("// optimiser_level=3 code_level=9\n"));
            assertEquals("-Ofast", result.getOption());
        }

        @Test
        @DisplayName("优化选项随级别变化")
        void optionFollowsLevel() {
            assertEquals("-Og", run(b.symbol(1, "SKIP"), OptimisationLevel.OPTIMISE_0).getOption());
            assertEquals("-O1", run(b.symbol(1, "SKIP"), OptimisationLevel.OPTIMISE_1).getOption());
            assertEquals("-O3", run(b.symbol(1, "SKIP"), OptimisationLevel.OPTIMISE_3).getOption());
        }
    }

    // ================================================================
    // 全局层级
    // ================================================================

    @Nested
    @DisplayName("全局层级")
    class GlobalLevelTests {

        @Test
        @DisplayName("取源码中单元的最小层级")
        void minimumOverSourceUnits() {
            SymbolTable inner = new SymbolTable(2, 3, main);
            Node deep = b.within(inner).line(4).unit(3, b.denotation(4, Mode.INT, "1"));
            Node shallow = b.within(main).line(2).unit(1, b.node(2, Attribute.CLOSED_CLAUSE, Mode.INT, deep));
            assertEquals(1, OptimiserDriver.globalLevel(shallow));
        }

        @Test
        @DisplayName("行号为 0 的单元不计")
        void skipsUnitsOutsideSource() {
            SymbolTable inner = new SymbolTable(2, 3, main);
            Node deep = b.within(inner).line(4).unit(3, b.denotation(4, Mode.INT, "1"));
            Node prelude = b.within(main).line(0).unit(1, b.node(2, Attribute.CLOSED_CLAUSE, Mode.INT, deep));
            assertEquals(3, OptimiserDriver.globalLevel(prelude));
        }

        @Test
        @DisplayName("没有源码单元时为 0")
        void noSourceUnits() {
            Node root = b.line(0).unit(1, b.denotation(2, Mode.INT, "1"));
            assertEquals(0, OptimiserDriver.globalLevel(root));
        }
    }

    // ================================================================
    // 场景：x := x + 1
    // ================================================================

    @Nested
    @DisplayName("变量自增")
    class IncrementTests {

        @Test
        @DisplayName("只取一次帧，一次加法，一次写回")
        void singleFetchSharedByBothOccurrences() {
            Tag x = TreeBuilder.frame(main, 16);
            Node root = incrementX(x);
            String code = run(root, OptimisationLevel.OPTIMISE_2).getCode();

            assertEquals(1, count(code, "GET_FRAME ("));
            assertTrue(code.contains("GET_FRAME (genie_x_14, A68_REF, 1, 16);"));
            assertEquals(1, count(code, "DEREF (A68_INT, "));
            assertTrue(code.contains("genie_x_11 = DEREF (A68_INT, genie_x_14);"));
            assertTrue(code.contains("_STATUS_ (genie_x_11) = INIT_MASK;"));
            assertTrue(code.contains("_VALUE_ (genie_x_11) = (_VALUE_ (genie_x_11) + 1);"));
        }

        @Test
        @DisplayName("单元与赋值都标注同一个函数")
        void annotatesUnitAndVoiding() {
            Node root = incrementX(TreeBuilder.frame(main, 16));
            run(root, OptimisationLevel.OPTIMISE_2);
            assertEquals("genie_void_REF_INT_assign_11", root.getCompileName());
            assertEquals(11, root.getCompileNode());
            assertEquals("genie_void_REF_INT_assign_11", root.getSub().getCompileName());
        }

        @Test
        @DisplayName("函数有入口、声明与出口")
        void functionShape() {
            String code = run(incrementX(TreeBuilder.frame(main, 16)), OptimisationLevel.OPTIMISE_2).getCode();
            assertTrue(code.contains("// test.a68: 1: x := x + 1\n"));
            assertTrue(code.contains("\nPROP_T genie_void_REF_INT_assign_11 (NODE_T *p) {\n"));
            assertTrue(code.contains("  SOURCE (&self) = _NODE_ (11);\n"));
            assertTrue(code.contains("  A68_INT * genie_x_11;\n  A68_REF * genie_x_14;\n  ADDR_T genie_pop_11;\n"));
            assertTrue(code.contains("  genie_pop_11 = A68_SP;\n"));
            assertTrue(code.contains("  A68_SP = genie_pop_11;\n  return (self);\n}\n"));
        }

        @Test
        @DisplayName("局部变量用 LOCAL_ADDRESS")
        void localVariable() {
            Tag x = TreeBuilder.frame(main, 16);
            x.setLocal(true);
            String code = run(incrementX(x), OptimisationLevel.OPTIMISE_2).getCode();
            assertTrue(code.contains("genie_x_11 = (A68_INT *) LOCAL_ADDRESS (genie_x_14);"));
        }

        @Test
        @DisplayName("快速级别下全局变量直接寻址")
        void fastGlobalAccess() {
            String code = run(incrementX(TreeBuilder.frame(main, 16)), OptimisationLevel.FAST).getCode();
            assertTrue(code.contains("GET_GLOBAL (genie_x_14, A68_REF, 16);"));
            assertFalse(code.contains("GET_FRAME"));
        }

        @Test
        @DisplayName("级别 1 没有赋值规则")
        void levelOneLeavesAssignation() {
            Node root = incrementX(TreeBuilder.frame(main, 16));
            run(root, OptimisationLevel.OPTIMISE_1);
            assertNull(root.getCompileName());
        }
    }

    // ================================================================
    // 场景：IF TRUE THEN 1 ELSE 2 FI
    // ================================================================

    @Nested
    @DisplayName("条件表达式")
    class ConditionalTests {

        @Test
        @DisplayName("常量分支压入三元表达式")
        void ternary() {
            Node root = ifThenElse(b.denotation(7, Mode.BOOL, "TRUE"));
            String code = run(root, OptimisationLevel.OPTIMISE_3).getCode();
            assertTrue(code.contains("PUSH_VALUE (p, ((BOOL_T) A68_TRUE ? 1 : 2), A68_INT);"));
            assertFalse(code.contains("EXECUTE_UNIT"));
            assertEquals("genie_conditional_3", root.getCompileName());
        }

        @Test
        @DisplayName("常量条件在编译时折叠")
        void foldedCondition() {
            Node cond = b.formula(7, Mode.BOOL,
                    b.denotation(19, Mode.INT, "1"),
                    b.operator(20, "<", "genie_lt_int"),
                    b.denotation(21, Mode.INT, "2"));
            String code = run(ifThenElse(cond), OptimisationLevel.OPTIMISE_3).getCode();
            assertTrue(code.contains("PUSH_VALUE (p, (A68_TRUE ? 1 : 2), A68_INT);"));
            assertFalse(code.contains("(1 < 2)"));
        }

        @Test
        @DisplayName("级别 2 只编译分支中的指称")
        void levelTwoCompilesBranchesOnly() {
            Node root = ifThenElse(b.denotation(7, Mode.BOOL, "TRUE"));
            run(root, OptimisationLevel.OPTIMISE_2);
            assertNull(root.getCompileName());
            Node thenUnit = root.getSub().getSub().getNext().nextSub().getSub();
            assertEquals("genie_INT_denotation_1_", thenUnit.getCompileName());
        }
    }

    // ================================================================
    // 场景：计数循环
    // ================================================================

    @Nested
    @DisplayName("计数循环")
    class LoopTests {

        @Test
        @DisplayName("界限在循环前求值一次")
        void boundsEvaluatedOnce() {
            Node root = countedLoop(TreeBuilder.frame(main, 32));
            String code = run(root, OptimisationLevel.OPTIMISE_3).getCode();

            assertEquals(1, count(code, "GET_FRAME (genie_n_14, A68_INT, 1, 32);"));
            int bound = code.indexOf("genie_to_3 = _VALUE_ (genie_n_14);");
            int loop = code.indexOf("for (genie_k_3 = 1; genie_k_3 <= genie_to_3; genie_k_3 ++) {");
            assertTrue(bound > 0);
            assertTrue(loop > bound);
            assertEquals(1, count(code, "_VALUE_ (genie_n_14)"));
        }

        @Test
        @DisplayName("循环变量写入帧，循环体交给解释器")
        void loopBody() {
            String code = run(countedLoop(TreeBuilder.frame(main, 32)), OptimisationLevel.OPTIMISE_3).getCode();
            assertTrue(code.contains("OPEN_STATIC_FRAME (_NODE_ (16));"));
            assertTrue(code.contains("genie_z_3 = (A68_INT *) (FRAME_OBJECT (OFFSET (TAX (_NODE_ (6)))));"));
            assertTrue(code.contains("_VALUE_ (genie_z_3) = genie_k_3;"));
            assertTrue(code.contains("EXECUTE_UNIT_TRACE (_NODE_ (17)); // SKIP"));
            assertTrue(code.contains("CLOSE_FRAME;\n  A68_SP = genie_pop_3;\n"));
        }

        @Test
        @DisplayName("循环子句的标注上溯到单元")
        void annotation() {
            Node root = countedLoop(TreeBuilder.frame(main, 32));
            run(root, OptimisationLevel.OPTIMISE_3);
            assertEquals("genie_loop_3", root.getCompileName());
            assertEquals(3, root.getCompileNode());
        }
    }

    // ================================================================
    // 场景：不认识的过程
    // ================================================================

    @Nested
    @DisplayName("不能编译的调用")
    class UnknownCallTests {

        private Node callOf(Tag f) {
            Mode procInt = Mode.proc(List.of(Mode.INT), Mode.INT);
            Node call = b.node(2, Attribute.CALL, Mode.INT,
                    b.node(3, Attribute.PRIMARY, procInt, b.identifier(4, "f", procInt, f)),
                    b.node(5, Attribute.ARGUMENT_LIST, null, b.unit(6, b.denotation(7, Mode.INT, "3"))));
            return b.unit(1, call);
        }

        @Test
        @DisplayName("过程变量的调用没有标注")
        void procedureVariable() {
            Node root = callOf(TreeBuilder.frame(main, 48));
            run(root, OptimisationLevel.OPTIMISE_3);
            assertNull(root.getCompileName());
            assertNull(root.getSub().getCompileName());
            assertEquals(0, root.getSub().getCompileNode());
        }

        @Test
        @DisplayName("不在原语表中的标准环境过程没有标注")
        void unknownPrimitive() {
            Node root = callOf(TreeBuilder.standenv("genie_whole"));
            run(root, OptimisationLevel.OPTIMISE_3);
            assertNull(root.getCompileName());
            assertNull(root.getSub().getCompileName());
        }

        @Test
        @DisplayName("实参仍单独编译")
        void argumentsStillCompiled() {
            Node root = callOf(TreeBuilder.frame(main, 48));
            OptimiserResult result = run(root, OptimisationLevel.OPTIMISE_3);
            Node arg = root.getSub().getSub().getNext().getSub();
            assertEquals("genie_INT_denotation_3_", arg.getCompileName());
            assertEquals(1, result.getProcedures());
        }
    }

    // ================================================================
    // 共享函数与确定性
    // ================================================================

    @Nested
    @DisplayName("共享与确定性")
    class SharingTests {

        @Test
        @DisplayName("同值指称只生成一个函数")
        void equalDenotationsShareFunction() {
            Node first = b.unit(1, b.denotation(2, Mode.INT, "42"));
            Node second = b.unit(3, b.denotation(4, Mode.INT, "42"));
            first.setNext(second);
            OptimiserResult result = run(first, OptimisationLevel.OPTIMISE_2);
            assertEquals("genie_INT_denotation_2a_", first.getCompileName());
            assertEquals("genie_INT_denotation_2a_", second.getCompileName());
            assertEquals(1, count(result.getCode(), "PROP_T genie_INT_denotation_2a_ (NODE_T *p)"));
            assertEquals(1, result.getProcedures());
            assertEquals(1, result.getUniqueNames());
        }

        @Test
        @DisplayName("同一棵树两次生成的文本相同")
        void deterministic() {
            String a = run(incrementX(TreeBuilder.frame(main, 16)), OptimisationLevel.OPTIMISE_3).getCode();
            String c = run(incrementX(TreeBuilder.frame(main, 16)), OptimisationLevel.OPTIMISE_3).getCode();
            assertEquals(a, c);
        }

        @Test
        @DisplayName("共享名登记表满时用按节点号的备用名")
        void uniqueTableFull() {
            Node first = b.unit(1, b.denotation(2, Mode.INT, "1"));
            Node second = b.unit(3, b.denotation(4, Mode.INT, "2"));
            first.setNext(second);
            OptimiserOptions options = OptimiserOptions.builder().uniqueCapacity(1).stamp(STAMP).build();
            run(first, options);
            assertEquals("genie_INT_denotation_1_", first.getCompileName());
            assertEquals("genie_INT_denotation_alt_4", second.getCompileName());
        }
    }

    // ================================================================
    // 预订表容量
    // ================================================================

    @Nested
    @DisplayName("预订表容量")
    class BookCapacityTests {

        @Test
        @DisplayName("任意容量下引用的局部变量都已声明")
        void everyLocalDeclared() {
            for (int cap = 0; cap <= 6; cap++) {
                Node root = incrementX(TreeBuilder.frame(main, 16));
                OptimiserOptions options = OptimiserOptions.builder()
                        .level(OptimisationLevel.OPTIMISE_2).bookCapacity(cap).stamp(STAMP).build();
                String code = run(root, options).getCode();
                assertEquals("genie_void_REF_INT_assign_11", root.getCompileName(), "capacity " + cap);
                Set<String> declared = declaredLocals(code);
                Matcher m = LOCAL.matcher(code);
                while (m.find()) {
                    assertTrue(declared.contains(m.group()), m.group() + " undeclared, capacity " + cap);
                }
                assertTrue(code.contains("_VALUE_ (genie_x_11) = "), "capacity " + cap);
            }
        }

        @Test
        @DisplayName("容量为 0 时每次出现各取一次")
        void zeroCapacityFetchesEachOccurrence() {
            OptimiserOptions options = OptimiserOptions.builder()
                    .level(OptimisationLevel.OPTIMISE_2).bookCapacity(0).stamp(STAMP).build();
            String code = run(incrementX(TreeBuilder.frame(main, 16)), options).getCode();
            assertTrue(code.contains("GET_FRAME (genie_x_14, A68_REF, 1, 16);"));
            assertTrue(code.contains("GET_FRAME (genie_x_19, A68_REF, 1, 16);"));
            assertTrue(code.contains("genie_x_18 = DEREF (A68_INT, genie_x_19);"));
            assertTrue(code.contains("_VALUE_ (genie_x_11) = (_VALUE_ (genie_x_18) + 1);"));
        }
    }

    // ================================================================
    // 函数间隔离
    // ================================================================

    @Nested
    @DisplayName("函数间隔离")
    class IsolationTests {

        @Test
        @DisplayName("后一个函数不继承前一个函数的声明与预订")
        void sequentialFunctions() {
            Tag x = TreeBuilder.frame(main, 16);
            Node first = incrementX(x);
            Mode refInt = Mode.ref(Mode.INT);
            Node second = b.unit(30, b.formula(31, Mode.INT,
                    b.deref(32, b.identifier(33, "x", refInt, x)),
                    b.operator(34, "*", "genie_mul_int"),
                    b.denotation(35, Mode.INT, "2")));
            first.setNext(second);
            String code = run(first, OptimisationLevel.OPTIMISE_2).getCode();

            assertEquals("genie_void_REF_INT_assign_11", first.getCompileName());
            assertEquals("genie_INT_formula_31", second.getCompileName());
            int start = code.indexOf("PROP_T genie_INT_formula_31 (NODE_T *p) {");
            assertTrue(start > code.indexOf("PROP_T genie_void_REF_INT_assign_11 (NODE_T *p) {"));
            String tail = code.substring(start);
            assertFalse(tail.contains("genie_x_11"));
            assertFalse(tail.contains("genie_x_14"));
            assertFalse(tail.contains("genie_pop_11"));
            assertTrue(tail.contains("  A68_INT * genie_x_32;\n  A68_REF * genie_x_33;\n"));
            assertTrue(tail.contains("  GET_FRAME (genie_x_33, A68_REF, 1, 16);\n"
                    + "  genie_x_32 = DEREF (A68_INT, genie_x_33);\n"
                    + "  PUSH_VALUE (p, (_VALUE_ (genie_x_32) * 2), A68_INT);\n"));
        }
    }

    // ================================================================
    // 诊断与降级
    // ================================================================

    @Nested
    @DisplayName("诊断")
    class DiagnosticTests {

        @Test
        @DisplayName("折叠溢出报错并以零代替")
        void foldingOverflow() {
            Node sum = b.formula(2, Mode.INT,
                    b.denotation(3, Mode.INT, "9223372036854775807"),
                    b.operator(4, "+", "genie_add_int"),
                    b.denotation(5, Mode.INT, "1"));
            OptimiserResult result = run(b.unit(1, sum), OptimisationLevel.OPTIMISE_2);
            assertTrue(result.hasErrors());
            assertTrue(result.getDiagnostics().get(0).getMessage().startsWith("constant folding"));
            assertEquals(2, result.getDiagnostics().get(0).getNodeNumber());
            assertTrue(result.getCode().contains("PUSH_VALUE (p, 0, A68_INT);"));
        }

        @Test
        @DisplayName("常量公式直接压入折叠后的值")
        void foldedFormula() {
            Node product = b.formula(2, Mode.INT,
                    b.denotation(3, Mode.INT, "6"),
                    b.operator(4, "*", "genie_mul_int"),
                    b.denotation(5, Mode.INT, "7"));
            OptimiserResult result = run(b.unit(1, product), OptimisationLevel.OPTIMISE_2);
            assertFalse(result.hasErrors());
            assertTrue(result.getCode().contains("PUSH_VALUE (p, 42, A68_INT);"));
        }

        @Test
        @DisplayName("递归过深时放弃编译而不报错")
        void depthLimit() {
            Node root = incrementX(TreeBuilder.frame(main, 16));
            OptimiserOptions options = OptimiserOptions.builder().maxDepth(1).stamp(STAMP).build();
            OptimiserResult result = run(root, options);
            assertNull(root.getCompileName());
            assertEquals(0, result.getProcedures());
        }
    }
}
