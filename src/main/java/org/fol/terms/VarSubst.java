package org.fol.terms;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 变量到变量的有限单射替换。不在定义域中的变量映射到自身。
 * 此类是不可变的。
 */
@Getter
public final class VarSubst {

    private static final Logger logger = LoggerFactory.getLogger(VarSubst.class);

    public static final VarSubst EMPTY = new VarSubst(Collections.emptyMap());

    private final SortedMap<Var, Var> mapping;

    private final int hashCode;

    /**
     * 私有构造函数。恒等映射的条目会被丢弃。
     * @throws IllegalArgumentException 如果映射不是单射
     */
    private VarSubst(Map<Var, Var> mapping) {
        Objects.requireNonNull(mapping, "VarSubst: 映射不能为 null");
        SortedMap<Var, Var> temp = new TreeMap<>();
        Set<Var> seen = new HashSet<>();
        for (Map.Entry<Var, Var> entry : mapping.entrySet()) {
            Var from = Objects.requireNonNull(entry.getKey(), "VarSubst: 变量不能为 null");
            Var to = Objects.requireNonNull(entry.getValue(), "VarSubst: 变量不能为 null");
            if (!seen.add(to)) {
                logger.error("替换 {} 不是单射: {} 被多次作为像", mapping, to);
                throw new IllegalArgumentException("VarSubst: 替换不是单射，" + to + " 出现多次");
            }
            if (!from.equals(to)) {
                temp.put(from, to);
            }
        }
        this.mapping = Collections.unmodifiableSortedMap(temp);
        this.hashCode = this.mapping.hashCode();
    }

    public static VarSubst empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException 如果映射不是单射
     */
    public static VarSubst of(Map<Var, Var> mapping) {
        return new VarSubst(mapping);
    }

    /**
     * 把 vs 中与 wrt 冲突的变量改名为相对于 wrt ∪ vs 新鲜的变量。
     * @return 改名替换，以及加入新变量后的 wrt
     */
    public static Pair<VarSubst, VarSet> freshen(VarSet vs, VarSet wrt) {
        VarSet clash = vs.inter(wrt);
        if (clash.isEmpty()) {
            return Pair.of(EMPTY, wrt);
        }
        VarSet avoid = wrt.union(vs);
        Map<Var, Var> renaming = new TreeMap<>();
        for (Var v : clash) {
            Pair<Var, VarSet> fresh = Var.fresh(v.getName(), avoid);
            renaming.put(v, fresh.getLeft());
            avoid = fresh.getRight();
        }
        VarSubst subst = new VarSubst(renaming);
        logger.debug("相对于 {} 改名 {}: {}", wrt, vs, subst);
        return Pair.of(subst, wrt.union(VarSet.of(renaming.values())));
    }

    public VarSubst invert() {
        Map<Var, Var> inverse = new TreeMap<>();
        mapping.forEach((from, to) -> inverse.put(to, from));
        return new VarSubst(inverse);
    }

    public VarSubst restrictDom(VarSet vs) {
        Map<Var, Var> restricted = new TreeMap<>();
        mapping.forEach((from, to) -> {
            if (vs.contains(from)) {
                restricted.put(from, to);
            }
        });
        return new VarSubst(restricted);
    }

    public VarSet domain() {
        return VarSet.of(mapping.keySet());
    }

    public VarSet range() {
        return VarSet.of(mapping.values());
    }

    public boolean isEmpty() {
        return mapping.isEmpty();
    }

    public Var apply(Var v) {
        return mapping.getOrDefault(v, v);
    }

    /**
     * 对项中的每个变量应用替换。
     */
    public Term applyTo(Term t) {
        if (mapping.isEmpty()) {
            return t;
        }
        return t.mapVars(this::apply);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VarSubst that = (VarSubst) o;
        return mapping.equals(that.mapping);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return mapping.entrySet().stream()
                .map(e -> e.getKey() + " ↦ " + e.getValue())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
