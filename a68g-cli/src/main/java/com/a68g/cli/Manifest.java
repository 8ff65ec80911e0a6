package com.a68g.cli;

import com.a68g.optimiser.OptimiserResult;
import com.a68g.syntax.Node;
import com.a68g.syntax.SyntaxTree;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * 标注清单：交给工具链的优化选项与每个带编译函数的节点。
 */
final class Manifest {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private Manifest() {
    }

    static JsonObject build(OptimiserResult result, SyntaxTree tree) {
        JsonObject doc = new JsonObject();
        doc.addProperty("option", result.getOption());
        JsonArray functions = new JsonArray();
        for (Node n : tree.annotatedNodes()) {
            JsonObject f = new JsonObject();
            f.addProperty("node", n.getNumber());
            f.addProperty("name", n.getCompileName());
            f.addProperty("compiledNode", n.getCompileNode());
            functions.add(f);
        }
        doc.add("functions", functions);
        return doc;
    }

    static String toJson(OptimiserResult result, SyntaxTree tree) {
        return GSON.toJson(build(result, tree));
    }
}
