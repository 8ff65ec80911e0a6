package com.a68g.optimiser.emit;

import com.a68g.optimiser.analysis.Trees;
import com.a68g.syntax.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 一个生成函数内的公共子表达式缓存。
 * <p>
 * 每个 (动作, 键, 负载) 只有一个条目，后续阶段的登记就地提升它的阶段，序号不变。
 * 查找时登记阶段不低于请求阶段即命中。
 * 容量固定：表满后新键被丢弃，该键在所有阶段都查不到，只会生成冗余但正确的代码。
 */
public final class BookingTable {

    private static final Logger LOG = Logger.getLogger(BookingTable.class.getName());

    public static final class Entry {
        private final BookAction action;
        private Phase phase;
        private final Object key;
        private final Object payload;
        private final int number;

        Entry(BookAction action, Phase phase, Object key, Object payload, int number) {
            this.action = action;
            this.phase = phase;
            this.key = key;
            this.payload = payload;
            this.number = number;
        }

        public BookAction getAction() { return action; }
        public Phase getPhase() { return phase; }
        public Object getKey() { return key; }
        public Object getPayload() { return payload; }

        /** 局部变量名中使用的序号 */
        public int getNumber() { return number; }

        @Override
        public String toString() {
            return action + "/" + phase + " " + key + " #" + number;
        }
    }

    /** 登记记录，回退时按相反顺序撤销 */
    private static final class Change {
        final Entry entry;
        final Phase previous;

        Change(Entry entry, Phase previous) {
            this.entry = entry;
            this.previous = previous;
        }
    }

    private final int capacity;
    private final List<Entry> entries = new ArrayList<>();
    private final List<Change> journal = new ArrayList<>();
    private int dropped;

    public BookingTable(int capacity) {
        this.capacity = capacity;
    }

    /** 登记；键已存在时只提升阶段 */
    public void remember(BookAction action, Phase phase, Object key, Object payload, int number) {
        for (Entry e : entries) {
            if (e.action == action && e.key.equals(key) && samePayload(e.payload, payload)) {
                if (!e.phase.covers(phase)) {
                    journal.add(new Change(e, e.phase));
                    e.phase = phase;
                }
                return;
            }
        }
        if (entries.size() >= capacity) {
            dropped++;
            LOG.fine("预订表已满，丢弃 " + action + " " + key);
            return;
        }
        Entry e = new Entry(action, phase, Objects.requireNonNull(key), payload, number);
        entries.add(e);
        journal.add(new Change(e, null));
    }

    /** 忽略负载查找 */
    public Entry lookup(BookAction action, Phase phase, Object key) {
        for (Entry e : entries) {
            if (e.action == action && e.phase.covers(phase) && e.key.equals(key)) {
                return e;
            }
        }
        return null;
    }

    /** 负载也须相同；节点负载按结构比较 */
    public Entry lookup(BookAction action, Phase phase, Object key, Object payload) {
        for (Entry e : entries) {
            if (e.action == action && e.phase.covers(phase) && e.key.equals(key)
                    && samePayload(e.payload, payload)) {
                return e;
            }
        }
        return null;
    }

    private static boolean samePayload(Object a, Object b) {
        if (a instanceof Node && b instanceof Node) {
            Node l = (Node) a;
            Node r = (Node) b;
            return l.getAttribute() == r.getAttribute()
                    && l.getSymbol().equals(r.getSymbol())
                    && Trees.sameTree(l.getSub(), r.getSub());
        }
        return Objects.equals(a, b);
    }

    /** 当前位置，供 {@link #truncate(int)} 回退 */
    public int mark() {
        return journal.size();
    }

    /** 撤销 mark 之后的登记：新条目删除，提升过的阶段恢复 */
    public void truncate(int mark) {
        while (journal.size() > mark) {
            Change c = journal.remove(journal.size() - 1);
            if (c.previous == null) {
                entries.remove(c.entry);
            } else {
                c.entry.phase = c.previous;
            }
        }
    }

    public void clear() {
        entries.clear();
        journal.clear();
    }

    public int size() {
        return entries.size();
    }

    /** 因容量不足被丢弃的条目数 */
    public int getDropped() {
        return dropped;
    }
}
