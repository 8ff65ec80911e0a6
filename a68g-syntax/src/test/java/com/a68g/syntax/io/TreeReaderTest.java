package com.a68g.syntax.io;

import com.a68g.syntax.Attribute;
import com.a68g.syntax.Mode;
import com.a68g.syntax.Node;
import com.a68g.syntax.SymbolTable;
import com.a68g.syntax.SyntaxTree;
import com.a68g.syntax.Tag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TreeReader 单元测试
 */
class TreeReaderTest {

    /** 单引号写的 JSON，便于在 Java 字符串中书写 */
    private static SyntaxTree read(String json) throws IOException, TreeFormatException {
        return new TreeReader().read(new StringReader(json.replace('\'', '"')));
    }

    /** 读取并期望格式错误 */
    private static TreeFormatException fails(String json) {
        return assertThrows(TreeFormatException.class, () -> read(json));
    }

    /** x := x + 1 的树，x 为 REF INT 帧变量 */
    private static final String INCREMENT = "{"
            + "'source': 'prog.a68',"
            + "'modes': [{'id': 'm1', 'kind': 'REF', 'sub': 'INT'}],"
            + "'tables': [{'id': 't0', 'number': 0, 'level': 0},"
            + "           {'id': 't1', 'number': 1, 'level': 1, 'previous': 't0', 'apIncrement': 24}],"
            + "'tags': [{'id': 'x', 'table': 't1', 'offset': 16, 'node': 12},"
            + "         {'id': 'plus', 'table': 't0', 'procedure': 'genie_add_int'}],"
            + "'root': {'attribute': 'UNIT', 'number': 10, 'mode': 'VOID', 'file': 'prog.a68', 'line': 3, 'table': 't1',"
            + "  'sub': [{'attribute': 'ASSIGNATION', 'number': 11, 'mode': 'm1', 'sub': ["
            + "    {'attribute': 'IDENTIFIER', 'number': 12, 'symbol': 'x', 'mode': 'm1', 'tag': 'x'},"
            + "    {'attribute': 'ASSIGN_SYMBOL', 'number': 13, 'symbol': ':='},"
            + "    {'attribute': 'FORMULA', 'number': 14, 'mode': 'INT', 'sub': ["
            + "      {'attribute': 'IDENTIFIER', 'number': 15, 'symbol': 'x', 'mode': 'm1', 'tag': 'x'},"
            + "      {'attribute': 'OPERATOR', 'number': 16, 'symbol': '+', 'tag': 'plus'},"
            + "      {'attribute': 'DENOTATION', 'number': 17, 'symbol': '1', 'mode': 'INT'}]}]}]}"
            + "}";

    // ================================================================
    // 正常读取
    // ================================================================

    @Nested
    @DisplayName("正常读取")
    class ReadTests {

        @Test
        @DisplayName("节点、模式与源码位置")
        void nodes() throws Exception {
            SyntaxTree tree = read(INCREMENT);
            Node root = tree.getRoot();
            assertEquals("prog.a68", tree.getSourceName());
            assertEquals(Attribute.UNIT, root.getAttribute());
            assertEquals(Mode.VOID, root.getMode());
            assertEquals(3, root.getLocation().getLine());
            assertEquals("prog.a68", root.getLocation().getFile());

            Node assignation = root.getSub();
            assertEquals(Mode.ref(Mode.INT), assignation.getMode());
            assertEquals(":=", assignation.getSub().getNext().getSymbol());
            assertEquals(8, tree.nodes().size());
        }

        @Test
        @DisplayName("符号表链与标签")
        void tablesAndTags() throws Exception {
            Node root = read(INCREMENT).getRoot();
            SymbolTable t1 = root.getTable();
            assertEquals(1, t1.getLevel());
            assertEquals(24, t1.getApIncrement());
            assertEquals(0, t1.getPrevious().getLevel());

            Node x = root.getSub().getSub();
            Tag tag = x.getTag();
            assertEquals(16, tag.getOffset());
            assertEquals(1, tag.getLevel());
            assertFalse(tag.isStandenv());
            assertSame(x, tag.getNode());
        }

        @Test
        @DisplayName("标准环境标签带原语身份")
        void standenvTag() throws Exception {
            Node formula = read(INCREMENT).getRoot().getSub().getSub().getNext().getNext();
            Tag plus = formula.getSub().getNext().getTag();
            assertTrue(plus.isStandenv());
            assertEquals("genie_add_int", plus.getProcedure());
        }

        @Test
        @DisplayName("未知属性读作 OTHER")
        void unknownAttribute() throws Exception {
            Node root = read("{'root': {'attribute': 'SOMETHING_NEW', 'number': 1, 'symbol': 'SKIP'}}").getRoot();
            assertEquals(Attribute.OTHER, root.getAttribute());
            assertEquals("SKIP", root.getSymbol());
        }

        @Test
        @DisplayName("结构与过程模式")
        void compositeModes() throws Exception {
            SyntaxTree tree = read("{"
                    + "'modes': [{'id': 'pt', 'kind': 'STRUCT', 'fields': ["
                    + "             {'name': 'x', 'mode': 'REAL'}, {'name': 'y', 'mode': 'REAL'}]},"
                    + "          {'id': 'f', 'kind': 'PROC', 'params': ['INT', 'pt'], 'sub': 'BOOL'}],"
                    + "'root': {'attribute': 'IDENTIFIER', 'number': 1, 'mode': 'f'}}");
            Mode f = tree.getRoot().getMode();
            assertTrue(f.isProc());
            assertEquals(2, f.getDim());
            assertEquals(Mode.BOOL, f.getSub());
            Mode pt = f.getParameters().get(1);
            assertEquals(2, pt.getFields().size());
            assertEquals(Mode.REAL.getSize(), pt.getFields().get(1).getOffset());
        }
    }

    // ================================================================
    // 格式错误
    // ================================================================

    @Nested
    @DisplayName("格式错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少根节点")
        void missingRoot() {
            assertEquals("root", fails("{'modes': []}").getPath());
        }

        @Test
        @DisplayName("错误路径指向出错的节点")
        void unknownModePath() {
            TreeFormatException e = fails("{'root': {'attribute': 'UNIT', 'number': 1,"
                    + " 'sub': [{'attribute': 'DENOTATION', 'number': 2, 'mode': 'QUATERNION'}]}}");
            assertEquals("root.sub[0].mode", e.getPath());
            assertTrue(e.getMessage().contains("QUATERNION"));
        }

        @Test
        @DisplayName("重复的节点号")
        void duplicateNumber() {
            TreeFormatException e = fails("{'root': {'attribute': 'UNIT', 'number': 1,"
                    + " 'sub': [{'attribute': 'UNIT', 'number': 1}]}}");
            assertEquals("root.sub[0]", e.getPath());
        }

        @Test
        @DisplayName("模式循环引用")
        void cyclicMode() {
            TreeFormatException e = fails("{'modes': [{'id': 'a', 'kind': 'REF', 'sub': 'b'},"
                    + " {'id': 'b', 'kind': 'REF', 'sub': 'a'}],"
                    + " 'root': {'attribute': 'UNIT', 'number': 1}}");
            assertTrue(e.getMessage().contains("循环引用"));
        }

        @Test
        @DisplayName("未知标签与未知符号表")
        void unknownReferences() {
            assertEquals("root.tag", fails("{'root': {'attribute': 'IDENTIFIER', 'number': 1, 'tag': 'nope'}}").getPath());
            assertEquals("tags[0].table", fails("{'tags': [{'id': 'x', 'table': 'nope'}],"
                    + " 'root': {'attribute': 'UNIT', 'number': 1}}").getPath());
        }

        @Test
        @DisplayName("标签指向不存在的节点")
        void danglingTagNode() {
            TreeFormatException e = fails("{'tables': [{'id': 't'}],"
                    + " 'tags': [{'id': 'x', 'table': 't', 'node': 99}],"
                    + " 'root': {'attribute': 'UNIT', 'number': 1}}");
            assertEquals("tags", e.getPath());
        }

        @Test
        @DisplayName("JSON 语法错误")
        void malformedJson() {
            assertEquals("$", fails("{'root': ").getPath());
        }
    }
}
