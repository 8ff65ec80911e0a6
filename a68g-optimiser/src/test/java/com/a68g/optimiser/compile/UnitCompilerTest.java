package com.a68g.optimiser.compile;

import com.a68g.optimiser.CompilerContext;
import com.a68g.optimiser.OptimisationLevel;
import com.a68g.optimiser.OptimiserOptions;
import com.a68g.optimiser.TreeBuilder;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;
import com.a68g.syntax.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * UnitCompiler 单元测试
 */
class UnitCompilerTest {

    private TreeBuilder b;

    @BeforeEach
    void setUp() {
        b = new TreeBuilder(new SymbolTable(1, 1, null));
    }

    /** 给定级别的上下文 */
    private static CompilerContext context(OptimisationLevel level) {
        return new CompilerContext(OptimiserOptions.builder().level(level).stamp("Jan 01 2026 00:00:00").build());
    }

    /** 按属性匹配、返回固定名称的规则 */
    private static final class FixedRule implements CompileRule {
        private final String name;
        private final int tier;
        private final Attribute attribute;
        private final String result;
        private final boolean compilesSub;
        int calls;

        FixedRule(String name, int tier, Attribute attribute, String result) {
            this(name, tier, attribute, result, false);
        }

        FixedRule(String name, int tier, Attribute attribute, String result, boolean compilesSub) {
            this.name = name;
            this.tier = tier;
            this.attribute = attribute;
            this.result = result;
            this.compilesSub = compilesSub;
        }

        @Override
        public String getName() { return name; }

        @Override
        public int getTier() { return tier; }

        @Override
        public boolean matches(Node p) {
            return p.is(attribute);
        }

        @Override
        public Node subject(Node p) {
            return compilesSub ? p.getSub() : p;
        }

        @Override
        public String compile(Node p, CompileMode mode, UnitCompiler units) {
            calls++;
            return result;
        }
    }

    private Node unitOfDenotation() {
        return b.unit(1, b.denotation(2, Mode.INT, "1"));
    }

    // ================================================================
    // 规则分派
    // ================================================================

    @Nested
    @DisplayName("规则分派")
    class DispatchTests {

        @Test
        @DisplayName("第一个匹配的规则决定结果，即使它不能编译")
        void firstMatchIsFinal() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            FixedRule refuses = new FixedRule("refuses", 1, Attribute.DENOTATION, null);
            FixedRule accepts = new FixedRule("accepts", 1, Attribute.DENOTATION, "genie_fn_2");
            units.addRule(refuses);
            units.addRule(accepts);

            assertNull(units.compile(unitOfDenotation(), CompileMode.FUNCTION));
            assertEquals(1, refuses.calls);
            assertEquals(0, accepts.calls);
        }

        @Test
        @DisplayName("级别不够的规则被跳过")
        void tierGating() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_2));
            FixedRule level3 = new FixedRule("level3", 3, Attribute.DENOTATION, "genie_three_2");
            FixedRule level1 = new FixedRule("level1", 1, Attribute.DENOTATION, "genie_one_2");
            units.addRule(level3);
            units.addRule(level1);

            assertEquals("genie_one_2", units.compile(unitOfDenotation(), CompileMode.FUNCTION));
            assertEquals(0, level3.calls);
        }

        @Test
        @DisplayName("没有匹配的规则时返回 null")
        void noRule() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            assertNull(units.compile(unitOfDenotation(), CompileMode.FUNCTION));
            assertNull(units.compile(null, CompileMode.FUNCTION));
        }
    }

    // ================================================================
    // 标注
    // ================================================================

    @Nested
    @DisplayName("标注")
    class AnnotationTests {

        @Test
        @DisplayName("包装节点带上子节点的函数与编译节点号")
        void wrapperAnnotated() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            units.addRule(new FixedRule("den", 1, Attribute.DENOTATION, "genie_fn_2"));
            Node unit = unitOfDenotation();

            assertEquals("genie_fn_2", units.compile(unit, CompileMode.FUNCTION));
            assertEquals("genie_fn_2", unit.getCompileName());
            assertEquals(2, unit.getCompileNode());
            assertEquals("genie_fn_2", unit.getSub().getCompileName());
            assertEquals(2, unit.getSub().getCompileNode());
        }

        @Test
        @DisplayName("DRY 方式不标注")
        void dryDoesNotAnnotate() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            units.addRule(new FixedRule("den", 1, Attribute.DENOTATION, "genie_fn_2"));
            Node unit = unitOfDenotation();

            assertEquals("genie_fn_2", units.compile(unit, CompileMode.DRY));
            assertNull(unit.getCompileName());
            assertNull(unit.getSub().getCompileName());
        }

        @Test
        @DisplayName("已编译的节点不再编译")
        void alreadyCompiled() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            FixedRule rule = new FixedRule("den", 1, Attribute.DENOTATION, "genie_fn_2");
            units.addRule(rule);
            Node unit = unitOfDenotation();
            unit.getSub().setCompileName("genie_earlier_2");

            assertNull(units.compile(unit, CompileMode.FUNCTION));
            assertEquals(0, rule.calls);
        }

        @Test
        @DisplayName("规则编译子节点时两者都标注")
        void subjectIsSub() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            units.addRule(new FixedRule("voiding", 1, Attribute.VOIDING, "genie_fn_3", true));
            Node unit = b.unit(1, b.node(2, Attribute.VOIDING, Mode.VOID, b.denotation(3, Mode.INT, "1")));

            units.compile(unit, CompileMode.FUNCTION);
            Node voiding = unit.getSub();
            assertEquals("genie_fn_3", voiding.getCompileName());
            assertEquals("genie_fn_3", voiding.getSub().getCompileName());
            assertEquals(3, voiding.getCompileNode());
            assertEquals(3, unit.getCompileNode());
        }

        @Test
        @DisplayName("递归过深时放弃")
        void depthLimit() {
            CompilerContext ctx = new CompilerContext(OptimiserOptions.builder()
                    .level(OptimisationLevel.OPTIMISE_3).maxDepth(1).stamp("x").build());
            UnitCompiler units = new UnitCompiler(ctx);
            units.addRule(new FixedRule("den", 1, Attribute.DENOTATION, "genie_fn_2"));

            assertNull(units.compile(unitOfDenotation(), CompileMode.FUNCTION));
            assertEquals(1, ctx.getDepthFallbacks());
        }
    }

    // ================================================================
    // 遍历
    // ================================================================

    @Nested
    @DisplayName("遍历")
    class TraversalTests {

        @Test
        @DisplayName("外层单元不能编译时进入子树")
        void descendsOnFailure() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            units.addRule(new FixedRule("den", 1, Attribute.DENOTATION, "genie_fn_4"));
            Node inner = b.unit(3, b.denotation(4, Mode.INT, "1"));
            Node outer = b.unit(1, b.node(2, Attribute.CLOSED_CLAUSE, Mode.INT, inner));

            units.compileUnits(outer);
            assertNull(outer.getCompileName());
            assertEquals(0, outer.getCompileNode());
            assertEquals("genie_fn_4", inner.getCompileName());
        }

        @Test
        @DisplayName("兄弟单元依次编译")
        void siblings() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            units.addRule(new FixedRule("den", 1, Attribute.DENOTATION, "genie_fn"));
            Node first = b.unit(1, b.denotation(2, Mode.INT, "1"));
            Node second = b.unit(3, b.denotation(4, Mode.INT, "2"));
            first.setNext(second);

            units.compileUnits(first);
            assertEquals(2, first.getCompileNode());
            assertEquals(4, second.getCompileNode());
        }
    }

    // ================================================================
    // 规则链
    // ================================================================

    @Nested
    @DisplayName("规则链")
    class ChainTests {

        private List<String> names(UnitCompiler units) {
            return units.getRules().stream().map(CompileRule::getName).collect(Collectors.toList());
        }

        @Test
        @DisplayName("完整规则链以控制结构开头，以代码子句结尾")
        void defaultChain() {
            List<String> names = names(UnitCompiler.createDefault(context(OptimisationLevel.OPTIMISE_3)));
            assertEquals("closed-clause", names.get(0));
            assertEquals("code-clause", names.get(names.size() - 1));
            assertTrue(names.indexOf("voiding-assignation") < names.indexOf("voiding"));
            assertTrue(names.indexOf("denotation") < names.indexOf("formula"));
        }

        @Test
        @DisplayName("基本规则链只有六条")
        void basicChain() {
            List<String> names = names(UnitCompiler.createBasic(context(OptimisationLevel.OPTIMISE_0)));
            assertEquals(List.of("voiding", "denotation", "cast", "identifier", "basic-formula", "call"), names);
        }

        @Test
        @DisplayName("规则列表不可修改")
        void unmodifiable() {
            UnitCompiler units = new UnitCompiler(context(OptimisationLevel.OPTIMISE_3));
            assertThrows(UnsupportedOperationException.class, () -> units.getRules().clear());
        }
    }
}
