package org.fol.sexp;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * S 表达式：要么是原子，要么是 S 表达式的列表。
 * 作为项、集合与映射的持久化及调试文本格式。
 * 此类是不可变的。
 */
public abstract class Sexp {

    private static final Logger logger = LoggerFactory.getLogger(Sexp.class);

    // 除空白外需要加引号的字符
    private static final String SPECIAL_CHARS = "()\";\\";

    Sexp() {
    }

    public static Sexp atom(String value) {
        return new Atom(value);
    }

    public static Sexp atom(Object value) {
        return new Atom(String.valueOf(value));
    }

    public static Sexp list(Sexp... items) {
        return new SList(Arrays.asList(items));
    }

    public static Sexp list(List<Sexp> items) {
        return new SList(items);
    }

    /**
     * 记录字段 (name value)。
     */
    public static Sexp field(String name, Sexp value) {
        return list(atom(name), value);
    }

    /**
     * 变体标签 (Tag payload)。
     */
    public static Sexp tagged(String tag, Sexp payload) {
        return list(atom(tag), payload);
    }

    public abstract boolean isAtom();

    /**
     * @return 原子的值
     * @throws SexpParseException 如果不是原子
     */
    public String getAtomValue() {
        throw new SexpParseException("期望原子，实际为列表: " + this);
    }

    /**
     * @return 列表元素
     * @throws SexpParseException 如果不是列表
     */
    public List<Sexp> getItems() {
        throw new SexpParseException("期望列表，实际为原子: " + this);
    }

    /**
     * 检查这是一个恰好有 size 个元素的列表。
     */
    public List<Sexp> expectList(int size) {
        List<Sexp> items = getItems();
        if (items.size() != size) {
            logger.error("S 表达式 {} 应有 {} 个元素，实际 {} 个", this, size, items.size());
            throw new SexpParseException("期望 " + size + " 元列表: " + this);
        }
        return items;
    }

    /**
     * 解开 (Tag payload)，检查标签。
     */
    public Sexp expectTagged(String tag) {
        List<Sexp> items = expectList(2);
        String actual = items.get(0).getAtomValue();
        if (!actual.equals(tag)) {
            throw new SexpParseException("期望标签 " + tag + "，实际为 " + actual);
        }
        return items.get(1);
    }

    /**
     * 在记录 ((name1 v1) (name2 v2) ...) 中查找字段。
     * @throws SexpParseException 如果字段不存在
     */
    public Sexp getField(String name) {
        for (Sexp entry : getItems()) {
            List<Sexp> pair = entry.expectList(2);
            if (pair.get(0).isAtom() && pair.get(0).getAtomValue().equals(name)) {
                return pair.get(1);
            }
        }
        logger.error("记录 {} 中缺少字段 {}", this, name);
        throw new SexpParseException("缺少字段 " + name + ": " + this);
    }

    @Getter
    public static final class Atom extends Sexp {
        private final String value;

        private Atom(String value) {
            this.value = Objects.requireNonNull(value, "Sexp.Atom: value 不能为 null");
        }

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public String getAtomValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return value.equals(((Atom) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            if (needsQuotes(value)) {
                return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
            }
            return value;
        }
    }

    /**
     * 解析器在任意空白字符处断开原子，因此所有空白字符都需要加引号。
     */
    private static boolean needsQuotes(String value) {
        if (value.isEmpty() || StringUtils.containsAny(value, SPECIAL_CHARS)) {
            return true;
        }
        return value.chars().anyMatch(ch -> Character.isWhitespace((char) ch));
    }

    public static final class SList extends Sexp {
        private final List<Sexp> items;

        private SList(List<Sexp> items) {
            Objects.requireNonNull(items, "Sexp.SList: items 不能为 null");
            this.items = Collections.unmodifiableList(List.copyOf(items));
        }

        @Override
        public boolean isAtom() {
            return false;
        }

        @Override
        public List<Sexp> getItems() {
            return items;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return items.equals(((SList) o).items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return items.stream().map(Sexp::toString).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
