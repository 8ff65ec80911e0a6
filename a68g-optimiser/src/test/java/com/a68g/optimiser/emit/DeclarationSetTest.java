package com.a68g.optimiser.emit;

import com.a68g.optimiser.CodegenException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeclarationSet 单元测试
 */
class DeclarationSetTest {

    @Test
    @DisplayName("按类型分行，类型与标识符都排序")
    void sortedByTypeThenName() {
        DeclarationSet set = new DeclarationSet();
        set.declare("INT_T", 0, "genie_k_3");
        set.declare("A68_INT", 1, "genie_y_14");
        set.declare("A68_INT", 1, "genie_x_12");
        set.declare("ADDR_T", 0, "genie_pop_3");
        assertEquals("A68_INT * genie_x_12, * genie_y_14;\n"
                + "ADDR_T genie_pop_3;\n"
                + "INT_T genie_k_3;\n", set.toString());
    }

    @Test
    @DisplayName("多级指针")
    void pointerLevels() {
        DeclarationSet set = new DeclarationSet();
        set.declare("A68_REF", 2, "genie_r_1");
        assertEquals("A68_REF ** genie_r_1;\n", set.toString());
    }

    @Test
    @DisplayName("同类型重复声明是内部错误")
    void duplicateThrows() {
        DeclarationSet set = new DeclarationSet();
        set.declare("A68_INT", 1, "genie_x_12");
        assertThrows(CodegenException.class, () -> set.declare("A68_INT", 1, "genie_x_12"));
    }

    @Test
    @DisplayName("按标识符查询")
    void contains() {
        DeclarationSet set = new DeclarationSet();
        set.declare("ADDR_T", 0, "genie_pop_3");
        assertTrue(set.contains("genie_pop_3"));
        assertFalse(set.contains("genie_pop_4"));
        set.clear();
        assertTrue(set.isEmpty());
    }

    @Test
    @DisplayName("渲染带当前缩进")
    void rendersIndented() {
        DeclarationSet set = new DeclarationSet();
        set.declare("ADDR_T", 0, "genie_pop_3");
        CodeWriter out = new CodeWriter();
        out.in();
        set.render(out);
        assertEquals("  ADDR_T genie_pop_3;\n", out.text());
    }
}
