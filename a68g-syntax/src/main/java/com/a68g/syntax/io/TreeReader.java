package com.a68g.syntax.io;

import com.a68g.syntax.*;
import com.google.gson.*;

import java.io.IOException;
import java.io.Reader;
import java.util.*;

/**
 * 读取 JSON 格式的语法树（由解析/检查器导出）。
 * <p>
 * 顶层字段：modes、tables、tags、root、source。
 * 标准模式可直接用名称引用（"INT"、"LONG REAL" 等），无需在 modes 中列出。
 */
public class TreeReader {

    private final Gson gson = new GsonBuilder().create();

    private final Map<String, JsonObject> modeDefs = new HashMap<>();
    private final Map<String, Mode> modes = new HashMap<>();
    private final Set<String> resolving = new HashSet<>();
    private final Map<String, SymbolTable> tables = new HashMap<>();
    private final Map<String, Tag> tags = new HashMap<>();
    private final Map<Tag, Integer> tagNodes = new HashMap<>();
    private final Map<Integer, Node> nodesByNumber = new HashMap<>();

    public SyntaxTree read(Reader reader) throws IOException, TreeFormatException {
        JsonObject doc;
        try {
            doc = gson.fromJson(reader, JsonObject.class);
        } catch (JsonIOException e) {
            throw new IOException(e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new TreeFormatException("$", "JSON 语法错误: " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new TreeFormatException("$", "空文档");
        }
        readModes(doc);
        readTables(doc);
        readTags(doc);
        if (!doc.has("root") || !doc.get("root").isJsonObject()) {
            throw new TreeFormatException("root", "缺少根节点");
        }
        Node root = readNode(doc.getAsJsonObject("root"), "root");
        bindTagNodes();
        String source = doc.has("source") ? doc.get("source").getAsString() : null;
        return new SyntaxTree(root, source);
    }

    // ---- 模式 ----

    private void readModes(JsonObject doc) throws TreeFormatException {
        if (!doc.has("modes")) return;
        JsonArray arr = doc.getAsJsonArray("modes");
        for (int i = 0; i < arr.size(); i++) {
            JsonObject m = arr.get(i).getAsJsonObject();
            String id = requireString(m, "id", "modes[" + i + "]");
            modeDefs.put(id, m);
        }
        for (String id : modeDefs.keySet()) {
            resolveMode(id, "modes." + id);
        }
    }

    private Mode resolveMode(String id, String path) throws TreeFormatException {
        Mode known = modes.get(id);
        if (known != null) return known;
        Mode std = Mode.standard(id);
        JsonObject def = modeDefs.get(id);
        if (def == null) {
            if (std != null) return std;
            throw new TreeFormatException(path, "未知模式 '" + id + "'");
        }
        if (!resolving.add(id)) {
            throw new TreeFormatException(path, "模式循环引用 '" + id + "'");
        }
        String kind = requireString(def, "kind", path);
        Mode mode;
        switch (kind) {
            case "STANDARD": {
                String name = def.has("name") ? def.get("name").getAsString() : id;
                mode = Mode.standard(name);
                if (mode == null) throw new TreeFormatException(path, "未知标准模式 '" + name + "'");
                break;
            }
            case "REF":
                mode = Mode.ref(resolveMode(requireString(def, "sub", path), path + ".sub"));
                break;
            case "ROW":
                mode = Mode.row(resolveMode(requireString(def, "sub", path), path + ".sub"),
                        def.has("dim") ? def.get("dim").getAsInt() : 1);
                break;
            case "STRUCT": {
                List<Field> fields = new ArrayList<>();
                JsonArray arr = def.getAsJsonArray("fields");
                int offset = 0;
                for (int i = 0; arr != null && i < arr.size(); i++) {
                    JsonObject f = arr.get(i).getAsJsonObject();
                    String fpath = path + ".fields[" + i + "]";
                    Mode fm = resolveMode(requireString(f, "mode", fpath), fpath + ".mode");
                    int off = f.has("offset") ? f.get("offset").getAsInt() : offset;
                    fields.add(new Field(requireString(f, "name", fpath), fm, off));
                    offset = off + fm.getSize();
                }
                mode = Mode.struct(fields);
                break;
            }
            case "PROC": {
                List<Mode> params = new ArrayList<>();
                JsonArray arr = def.getAsJsonArray("params");
                for (int i = 0; arr != null && i < arr.size(); i++) {
                    params.add(resolveMode(arr.get(i).getAsString(), path + ".params[" + i + "]"));
                }
                mode = Mode.proc(params, resolveMode(requireString(def, "sub", path), path + ".sub"));
                break;
            }
            case "UNION": {
                List<Mode> alts = new ArrayList<>();
                JsonArray arr = def.getAsJsonArray("params");
                for (int i = 0; arr != null && i < arr.size(); i++) {
                    alts.add(resolveMode(arr.get(i).getAsString(), path + ".params[" + i + "]"));
                }
                mode = Mode.union(alts, 0);
                break;
            }
            case "VOID":
                mode = Mode.VOID;
                break;
            default:
                throw new TreeFormatException(path, "未知模式种类 '" + kind + "'");
        }
        if (def.has("size")) {
            mode = mode.withSize(def.get("size").getAsInt());
        }
        resolving.remove(id);
        modes.put(id, mode);
        return mode;
    }

    // ---- 符号表与标签 ----

    private void readTables(JsonObject doc) throws TreeFormatException {
        if (!doc.has("tables")) return;
        JsonArray arr = doc.getAsJsonArray("tables");
        // 先建立全部表，再连接 previous
        Map<String, String> previous = new HashMap<>();
        List<JsonObject> defs = new ArrayList<>();
        for (int i = 0; i < arr.size(); i++) {
            JsonObject t = arr.get(i).getAsJsonObject();
            String path = "tables[" + i + "]";
            String id = requireString(t, "id", path);
            if (t.has("previous")) previous.put(id, t.get("previous").getAsString());
            defs.add(t);
        }
        Map<String, SymbolTable> built = new LinkedHashMap<>();
        for (int i = 0; i < defs.size(); i++) {
            buildTable(defs.get(i).get("id").getAsString(), defs, previous, built, "tables[" + i + "]");
        }
        tables.putAll(built);
    }

    private SymbolTable buildTable(String id, List<JsonObject> defs, Map<String, String> previous,
                                   Map<String, SymbolTable> built, String path) throws TreeFormatException {
        SymbolTable done = built.get(id);
        if (done != null) return done;
        JsonObject def = null;
        for (JsonObject d : defs) {
            if (d.get("id").getAsString().equals(id)) def = d;
        }
        if (def == null) throw new TreeFormatException(path, "未知符号表 '" + id + "'");
        SymbolTable prev = null;
        String prevId = previous.get(id);
        if (prevId != null) {
            if (prevId.equals(id)) throw new TreeFormatException(path, "符号表自引用 '" + id + "'");
            prev = buildTable(prevId, defs, previous, built, path + ".previous");
        }
        int level = def.has("level") ? def.get("level").getAsInt() : 0;
        int number = def.has("number") ? def.get("number").getAsInt() : built.size();
        SymbolTable t = new SymbolTable(number, level, prev);
        if (def.has("apIncrement")) t.setApIncrement(def.get("apIncrement").getAsInt());
        if (def.has("labels")) t.setLabels(def.get("labels").getAsBoolean());
        if (def.has("anonymousTexts")) t.setAnonymousTexts(def.get("anonymousTexts").getAsBoolean());
        if (def.has("procOpDeclarations")) t.setProcOpDeclarations(def.get("procOpDeclarations").getAsInt());
        built.put(id, t);
        return t;
    }

    private void readTags(JsonObject doc) throws TreeFormatException {
        if (!doc.has("tags")) return;
        JsonArray arr = doc.getAsJsonArray("tags");
        for (int i = 0; i < arr.size(); i++) {
            JsonObject t = arr.get(i).getAsJsonObject();
            String path = "tags[" + i + "]";
            String id = requireString(t, "id", path);
            SymbolTable table = table(requireString(t, "table", path), path + ".table");
            Tag tag = new Tag(table, t.has("offset") ? t.get("offset").getAsInt() : 0);
            if (t.has("procedure")) tag.setProcedure(t.get("procedure").getAsString());
            if (t.has("local")) tag.setLocal(t.get("local").getAsBoolean());
            if (t.has("procDeclaration")) tag.setProcDeclaration(t.get("procDeclaration").getAsBoolean());
            if (t.has("node")) tagNodes.put(tag, t.get("node").getAsInt());
            tags.put(id, tag);
        }
    }

    private SymbolTable table(String id, String path) throws TreeFormatException {
        SymbolTable t = tables.get(id);
        if (t == null) throw new TreeFormatException(path, "未知符号表 '" + id + "'");
        return t;
    }

    private void bindTagNodes() throws TreeFormatException {
        for (Map.Entry<Tag, Integer> e : tagNodes.entrySet()) {
            Node n = nodesByNumber.get(e.getValue());
            if (n == null) {
                throw new TreeFormatException("tags", "标签指向不存在的节点 " + e.getValue());
            }
            e.getKey().setNode(n);
        }
    }

    // ---- 节点 ----

    private Node readNode(JsonObject obj, String path) throws TreeFormatException {
        String attr = requireString(obj, "attribute", path);
        Attribute attribute;
        try {
            attribute = Attribute.valueOf(attr);
        } catch (IllegalArgumentException e) {
            attribute = Attribute.OTHER;
        }
        if (!obj.has("number")) throw new TreeFormatException(path, "缺少字段 'number'");
        int number = obj.get("number").getAsInt();
        Node node = new Node(attribute, obj.has("symbol") ? obj.get("symbol").getAsString() : "", number);
        if (nodesByNumber.put(number, node) != null) {
            throw new TreeFormatException(path, "重复的节点号 " + number);
        }
        if (obj.has("mode")) node.setMode(resolveMode(obj.get("mode").getAsString(), path + ".mode"));
        if (obj.has("line")) {
            String file = obj.has("file") ? obj.get("file").getAsString() : null;
            node.setLocation(new SourceLocation(file, obj.get("line").getAsInt()));
        }
        if (obj.has("table")) node.setTable(table(obj.get("table").getAsString(), path + ".table"));
        if (obj.has("tag")) {
            String id = obj.get("tag").getAsString();
            Tag tag = tags.get(id);
            if (tag == null) throw new TreeFormatException(path + ".tag", "未知标签 '" + id + "'");
            node.setTag(tag);
        }
        if (obj.has("pack")) {
            JsonObject p = obj.getAsJsonObject("pack");
            String ppath = path + ".pack";
            node.setPack(new Field(requireString(p, "name", ppath),
                    resolveMode(requireString(p, "mode", ppath), ppath + ".mode"),
                    p.has("offset") ? p.get("offset").getAsInt() : 0));
        }
        if (obj.has("partialProc")) {
            node.setPartialProc(resolveMode(obj.get("partialProc").getAsString(), path + ".partialProc"));
        }
        if (obj.has("sub")) {
            JsonArray arr = obj.getAsJsonArray("sub");
            List<Node> children = new ArrayList<>();
            for (int i = 0; i < arr.size(); i++) {
                children.add(readNode(arr.get(i).getAsJsonObject(), path + ".sub[" + i + "]"));
            }
            node.setChildren(children);
        }
        return node;
    }

    private static String requireString(JsonObject obj, String key, String path) throws TreeFormatException {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) {
            throw new TreeFormatException(path, "缺少字段 '" + key + "'");
        }
        return e.getAsString();
    }
}
