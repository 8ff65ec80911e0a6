package com.a68g.optimiser.emit;

import com.a68g.syntax.Attribute;
import com.a68g.syntax.Node;

/**
 * 把源码片段写成 C 注释。
 * <p>
 * 只打印节点自身的子树，记号之间按原样补空格，超过上限时以 {@code ...} 截断。
 */
public final class SourceComments {

    /** 生成函数前的注释最多打印的记号数 */
    public static final int MAX_PRINT = 16;
    /** 行尾注释最多打印的记号数 */
    public static final int MAX_INLINE_PRINT = 8;

    private SourceComments() {
    }

    /** 函数前的注释行：{@code // file: line: tokens} */
    public static void comment(Node p, CodeWriter out) {
        out.undent("\n// " + p.getLocation().getFile() + ": " + p.getLocation().getLine() + ": ");
        out.undent(tokens(p, MAX_PRINT));
        out.undent("\n");
    }

    /** 行尾注释，不换行 */
    public static void inline(Node p, CodeWriter out) {
        out.undent(" // ");
        out.undent(tokens(p, MAX_INLINE_PRINT));
    }

    /** 子树的记号文本 */
    public static String tokens(Node p, int maxPrint) {
        Printer printer = new Printer(maxPrint);
        printer.node(p);
        return printer.sb.toString();
    }

    private static final class Printer {
        private final StringBuilder sb = new StringBuilder();
        // 0：不要空格，1：字母数字之间要空格，2：总要空格
        private int wantSpace;
        private int maxPrint;

        Printer(int maxPrint) {
            this.maxPrint = maxPrint;
        }

        void chain(Node p) {
            for (; p != null && maxPrint >= 0; p = p.getNext()) {
                node(p);
            }
        }

        void node(Node p) {
            if (maxPrint < 0) {
                return;
            }
            String s = p.getSymbol();
            if (p.is(Attribute.ROW_CHAR_DENOTATION)) {
                if (wantSpace != 0) {
                    put(" ");
                }
                put("\"" + s + "\"");
                wantSpace = 2;
            } else if (p.getSub() != null) {
                chain(p.getSub());
            } else if (s.isEmpty()) {
                return;
            } else if (s.charAt(0) == '(' || s.charAt(0) == '[' || s.charAt(0) == '{') {
                if (wantSpace == 2) {
                    put(" ");
                }
                put(s);
                wantSpace = 0;
            } else if (s.charAt(0) == ')' || s.charAt(0) == ']' || s.charAt(0) == '}') {
                put(s);
                wantSpace = 1;
            } else if (s.charAt(0) == ';' || s.charAt(0) == ',') {
                put(s);
                wantSpace = 2;
            } else if (s.equals(".") || s.equals(":")) {
                put(s);
                wantSpace = 2;
            } else {
                if (wantSpace != 0) {
                    put(" ");
                }
                if (maxPrint > 0) {
                    put(s);
                } else if (maxPrint == 0) {
                    if (wantSpace == 0) {
                        put(" ");
                    }
                    put("...");
                }
                maxPrint--;
                char c = s.charAt(0);
                if (Character.isUpperCase(c) || !Character.isLetterOrDigit(c)) {
                    wantSpace = 2;
                } else {
                    wantSpace = 1;
                }
            }
        }

        // 不能在注释里生成注释的开闭记号
        private void put(String s) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                char d = i + 1 < s.length() ? s.charAt(i + 1) : 0;
                if (c == '*' && d == '/') {
                    sb.append("\\*\\/");
                    i++;
                } else if (c == '/' && d == '*') {
                    sb.append("\\/\\*");
                    i++;
                } else {
                    sb.append(c);
                }
            }
        }
    }
}
