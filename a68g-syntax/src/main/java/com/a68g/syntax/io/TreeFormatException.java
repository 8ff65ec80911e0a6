package com.a68g.syntax.io;

/**
 * 语法树交换格式错误。
 */
public class TreeFormatException extends Exception {
    private final String path;

    public TreeFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public TreeFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /** 出错位置，如 "root.sub[2].mode" */
    public String getPath() {
        return path;
    }
}
