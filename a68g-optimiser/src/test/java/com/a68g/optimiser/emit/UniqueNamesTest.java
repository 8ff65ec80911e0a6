package com.a68g.optimiser.emit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * UniqueNames 单元测试
 */
class UniqueNamesTest {

    @Test
    @DisplayName("第一次登记需要生成，之后直接引用")
    void signInTwice() {
        UniqueNames names = new UniqueNames(4);
        assertEquals(UniqueNames.Result.MAKE_NEW, names.signIn("genie_INT_denotation_1_"));
        assertEquals(UniqueNames.Result.EXISTS, names.signIn("genie_INT_denotation_1_"));
        assertEquals(1, names.size());
    }

    @Test
    @DisplayName("表满后要求备用函数")
    void full() {
        UniqueNames names = new UniqueNames(1);
        names.signIn("a");
        assertEquals(UniqueNames.Result.MAKE_ALT, names.signIn("b"));
        assertEquals(UniqueNames.Result.EXISTS, names.signIn("a"));
    }

    @Test
    @DisplayName("容量为 0 时总是备用")
    void zeroCapacity() {
        UniqueNames names = new UniqueNames(0);
        assertEquals(UniqueNames.Result.MAKE_ALT, names.signIn("a"));
        assertEquals(0, names.size());
    }
}
