package com.a68g.optimiser.emit;

import com.a68g.optimiser.CodegenException;
import com.a68g.syntax.Mode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Names 单元测试
 */
class NamesTest {

    // ================================================================
    // 名称构造
    // ================================================================

    @Nested
    @DisplayName("名称构造")
    class MakeTests {

        @Test
        @DisplayName("角色加节点号")
        void roleAndNumber() {
            assertEquals("genie_pop_12", Names.make(Names.PUP, 12));
            assertEquals("genie_deref_x_7", Names.make(Names.DRF, "x", 7));
        }

        @Test
        @DisplayName("共享名以扩展结尾")
        void uniqueName() {
            assertEquals("genie_INT_denotation_2a_", Names.unique("INT_denotation", "", "2a_"));
            assertEquals("genie_INT_identifier_1_1_16", Names.unique("INT_identifier", null, "1_1_16"));
        }

        @Test
        @DisplayName("过长的名称是内部错误")
        void tooLong() {
            String longName = "x".repeat(Names.NAME_SIZE);
            assertThrows(CodegenException.class, () -> Names.make(longName, 1));
        }

        @Test
        @DisplayName("源符号中的非法字符替换为下划线")
        void sanitise() {
            assertEquals("max_int", Names.sanitise("max int"));
            assertEquals("a_b", Names.sanitise("a+b"));
            assertEquals("x_", Names.sanitise("xé"));
        }
    }

    // ================================================================
    // 模式
    // ================================================================

    @Nested
    @DisplayName("模式")
    class ModeTests {

        @Test
        @DisplayName("带模式的角色名")
        void withMode() {
            assertEquals("deref_REF_INT_identifier", Names.withMode("deref_", Mode.ref(Mode.INT), "_identifier"));
            assertEquals("LONG_REAL_formula", Names.withMode("", Mode.LONG_REAL, "_formula"));
            assertEquals("MODE_call", Names.withMode("", Mode.COMPLEX, "_call"));
            assertEquals("void_VOID_call", Names.withMode("void_", Mode.VOID, "_call"));
        }

        @Test
        @DisplayName("运行时 C 类型")
        void inlineMode() {
            assertEquals("A68_INT", Names.inlineMode(Mode.INT));
            assertEquals("A68_COMPLEX", Names.inlineMode(Mode.COMPLEX));
            assertEquals("A68_LONG", Names.inlineMode(Mode.LONG_INT));
            assertEquals("A68_REF", Names.inlineMode(Mode.ref(Mode.REAL)));
            assertEquals("A68_ROW", Names.inlineMode(Mode.row(Mode.INT, 1)));
            assertEquals("A68_PROCEDURE", Names.inlineMode(Mode.proc(List.of(), Mode.VOID)));
            assertEquals("A68_ERROR", Names.inlineMode(null));
        }

        @Test
        @DisplayName("诊断用的模式常量")
        void internalMode() {
            assertEquals("M_REAL", Names.internalMode(Mode.REAL));
            assertEquals("M_LONG_INT", Names.internalMode(Mode.LONG_INT));
            assertEquals("M_ERROR", Names.internalMode(Mode.VOID));
        }
    }
}
