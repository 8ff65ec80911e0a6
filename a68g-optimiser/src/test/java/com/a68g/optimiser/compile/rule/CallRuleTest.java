package com.a68g.optimiser.compile.rule;

import com.a68g.optimiser.OptimisationLevel;
import com.a68g.optimiser.OptimiserDriver;
import com.a68g.optimiser.OptimiserOptions;
import com.a68g.optimiser.TreeBuilder;
import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;
import com.a68g.syntax.SymbolTable;
import com.a68g.syntax.Tag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CallRule 单元测试
 */
class CallRuleTest {

    private static final Mode PROC_INT_INT = Mode.proc(List.of(Mode.INT), Mode.INT);

    private SymbolTable main;
    private TreeBuilder b;

    @BeforeEach
    void setUp() {
        main = new SymbolTable(1, 1, null);
        b = new TreeBuilder(main);
    }

    private String run(Node root) {
        return new OptimiserDriver(OptimiserOptions.builder()
                .level(OptimisationLevel.OPTIMISE_2)
                .stamp("Jan 01 2026 00:00:00")
                .build()).run(root).getCode();
    }

    /** 由过程声明定义的过程 */
    private Tag procedure(int offset) {
        Tag f = TreeBuilder.frame(main, offset);
        f.setProcDeclaration(true);
        return f;
    }

    /** f (3) */
    private Node callOf(Tag f) {
        return b.node(2, Attribute.CALL, Mode.INT,
                b.node(3, Attribute.PRIMARY, PROC_INT_INT, b.identifier(4, "f", PROC_INT_INT, f)),
                b.node(5, Attribute.ARGUMENT_LIST, null, b.unit(6, b.denotation(7, Mode.INT, "3"))));
    }

    // ================================================================
    // 用户过程
    // ================================================================

    @Nested
    @DisplayName("用户过程")
    class UserProcedureTests {

        @Test
        @DisplayName("实参写入新帧后执行过程体")
        void callingConvention() {
            Node root = b.unit(1, callOf(procedure(48)));
            String code = run(root);

            assertEquals("genie_INT_call_2", root.getCompileName());
            assertTrue(code.contains("  A68_INT * genie_arg_6;\n"
                    + "  A68_PROCEDURE * genie_function_3;\n"
                    + "  ADDR_T genie_pop_2;\n"
                    + "  NODE_T * body;\n"
                    + "  genie_pop_2 = A68_SP;\n"
                    + "  GET_FRAME (genie_function_3, A68_PROCEDURE, 1, 48);\n"
                    + "  body = SUB (NODE (&BODY (genie_function_3)));\n"
                    + "  OPEN_PROC_FRAME (body, ENVIRON (genie_function_3));\n"
                    + "  INIT_STATIC_FRAME (body);\n"
                    + "  genie_arg_6 = (A68_INT *) FRAME_OBJECT (0);\n"
                    + "  _STATUS_ (genie_arg_6) = INIT_MASK;\n"
                    + "  _VALUE_ (genie_arg_6) = 3;\n"
                    + "  A68_SP = genie_pop_2;\n"
                    + "  EXECUTE_UNIT_TRACE (NEXT_NEXT_NEXT (body));\n"
                    + "  if (A68_FP == A68_MON (finish_frame_pointer)) {\n"
                    + "    change_masks (TOP_NODE (&A68_JOB), BREAKPOINT_INTERRUPT_MASK, A68_TRUE);\n"
                    + "  }\n"
                    + "  CLOSE_FRAME;\n"
                    + "  return (self);\n"));
        }

        @Test
        @DisplayName("后续实参的帧偏移累加")
        void argumentOffsetsAccumulate() {
            Mode proc2 = Mode.proc(List.of(Mode.INT, Mode.INT), Mode.INT);
            Node call = b.node(2, Attribute.CALL, Mode.INT,
                    b.node(3, Attribute.PRIMARY, proc2, b.identifier(4, "f", proc2, procedure(48))),
                    b.node(5, Attribute.ARGUMENT_LIST, null,
                            b.unit(6, b.denotation(7, Mode.INT, "3")),
                            b.leaf(8, Attribute.COMMA_SYMBOL, ",", null),
                            b.unit(9, b.denotation(10, Mode.INT, "4"))));
            String code = run(b.unit(1, call));
            assertTrue(code.contains("  genie_arg_6 = (A68_INT *) FRAME_OBJECT (0);\n"
                    + "  genie_arg_9 = (A68_INT *) FRAME_OBJECT (" + Mode.INT.getSize() + ");\n"));
            assertTrue(code.contains("  _VALUE_ (genie_arg_9) = 4;\n"));
        }

        @Test
        @DisplayName("丢弃结果时恢复栈指针")
        void voidingCall() {
            Node root = b.unit(1, b.node(8, Attribute.VOIDING, Mode.VOID, callOf(procedure(48))));
            String code = run(root);

            assertEquals("genie_void_INT_call_8", root.getCompileName());
            assertTrue(code.contains("  CLOSE_FRAME;\n  A68_SP = genie_pop_2;\n  return (self);\n"));
        }
    }

    // ================================================================
    // 去过程化
    // ================================================================

    @Nested
    @DisplayName("去过程化")
    class DeproceduringTests {

        @Test
        @DisplayName("无参过程直接执行过程体")
        void parameterless() {
            Mode procInt = Mode.proc(List.of(), Mode.INT);
            Node root = b.unit(1, b.node(2, Attribute.DEPROCEDURING, Mode.INT,
                    b.identifier(3, "g", procInt, procedure(56))));
            String code = run(root);

            assertEquals("genie_INT_deproc_2", root.getCompileName());
            assertTrue(code.contains("  A68_PROCEDURE * genie_function_3;\n"
                    + "  NODE_T * body;\n"
                    + "  GET_FRAME (genie_function_3, A68_PROCEDURE, 1, 56);\n"
                    + "  body = SUB (NODE (&BODY (genie_function_3)));\n"
                    + "  OPEN_PROC_FRAME (body, ENVIRON (genie_function_3));\n"
                    + "  INIT_STATIC_FRAME (body);\n"
                    + "  EXECUTE_UNIT_TRACE (NEXT_NEXT (body));\n"));
            assertFalse(code.contains("genie_pop_"));
        }
    }
}
