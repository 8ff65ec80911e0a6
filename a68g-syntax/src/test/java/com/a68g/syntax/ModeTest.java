package com.a68g.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mode 与 Node 单元测试
 */
class ModeTest {

    // ================================================================
    // 模式
    // ================================================================

    @Nested
    @DisplayName("模式")
    class ModeTests {

        @Test
        @DisplayName("复合模式按结构相等")
        void structuralEquality() {
            assertEquals(Mode.ref(Mode.INT), Mode.ref(Mode.INT));
            assertEquals(Mode.row(Mode.REAL, 2), Mode.row(Mode.REAL, 2));
            assertNotEquals(Mode.row(Mode.REAL, 1), Mode.row(Mode.REAL, 2));
            assertNotEquals(Mode.ref(Mode.INT), Mode.ref(Mode.REAL));
            assertEquals(Mode.ref(Mode.INT).hashCode(), Mode.ref(Mode.INT).hashCode());
        }

        @Test
        @DisplayName("大小不参与比较")
        void sizeIgnored() {
            Mode s = Mode.struct(List.of(new Field("a", Mode.INT, 0)));
            assertEquals(s, s.withSize(64));
            assertEquals(64, s.withSize(64).getSize());
            assertSame(Mode.INT, Mode.INT.withSize(64));
        }

        @Test
        @DisplayName("结构的大小取最远字段的末尾")
        void structSize() {
            Mode s = Mode.struct(List.of(new Field("a", Mode.INT, 0), new Field("b", Mode.REAL, 16)));
            assertEquals(32, s.getSize());
            assertNotEquals(Mode.COMPLEX, Mode.struct(Mode.COMPLEX.getFields()));
        }

        @Test
        @DisplayName("按名称查找标准模式")
        void standardLookup() {
            assertSame(Mode.LONG_REAL, Mode.standard("LONG REAL"));
            assertSame(Mode.COMPLEX, Mode.standard("COMPLEX"));
            assertNull(Mode.standard("SHORT INT"));
            assertTrue(Mode.LONG_INT.isLong());
            assertFalse(Mode.INT.isLong());
        }

        @Test
        @DisplayName("模式名称")
        void names() {
            assertEquals("REF INT", Mode.ref(Mode.INT).toString());
            assertEquals("[,] REAL", Mode.row(Mode.REAL, 2).toString());
            assertEquals("PROC (REAL, INT) REAL", Mode.proc(List.of(Mode.REAL, Mode.INT), Mode.REAL).toString());
            assertEquals("PROC VOID", Mode.proc(List.of(), Mode.VOID).toString());
            assertEquals("STRUCT (INT a, REAL b)",
                    Mode.struct(List.of(new Field("a", Mode.INT, 0), new Field("b", Mode.REAL, 16))).toString());
        }
    }

    // ================================================================
    // 节点
    // ================================================================

    @Nested
    @DisplayName("节点")
    class NodeTests {

        /** a + b 的公式节点 */
        private Node formula() {
            Node f = new Node(Attribute.FORMULA, "", 1);
            return f.setChildren(List.of(new Node(Attribute.IDENTIFIER, "a", 2),
                    new Node(Attribute.OPERATOR, "+", 3), new Node(Attribute.IDENTIFIER, "b", 4)));
        }

        @Test
        @DisplayName("子节点串成 sub/next 链")
        void children() {
            Node f = formula();
            assertEquals(2, f.getSub().getNumber());
            assertEquals(3, f.nextSub().getNumber());
            assertEquals(4, f.getSub().nextNext().getNumber());
            assertNull(f.getSub().nextNextNext());
        }

        @Test
        @DisplayName("没有符号表时词法层级为 0")
        void lexLevel() {
            Node f = formula();
            assertEquals(0, f.getLexLevel());
            f.setTable(new SymbolTable(1, 3, null));
            assertEquals(3, f.getLexLevel());
        }

        @Test
        @DisplayName("新节点没有标注")
        void noAnnotation() {
            Node f = formula();
            assertNull(f.getCompileName());
            assertEquals(0, f.getCompileNode());
            assertEquals("FORMULA#1", f.toString());
            assertEquals("OPERATOR#3 '+'", f.nextSub().toString());
        }
    }
}
