package org.fol.terms;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.fol.sexp.Sexp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * 变量，项的子类型。
 * 相等、比较与哈希只看 id，name 只用于打印。
 */
@Getter
public final class Var extends Term {

    private static final Logger logger = LoggerFactory.getLogger(Var.class);

    // createNewVar 分配的 id 从 1 开始
    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final String name;

    private final int hashCode;

    private Var(long id, String name) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "Var: name 不能为 null");
        this.hashCode = Long.hashCode(id);
    }

    /**
     * 用给定的 id 创建变量。同一 id 的变量彼此相等，不论名字是否相同。
     */
    public static Var identified(String name, long id) {
        return new Var(id, name);
    }

    /**
     * 创建一个全局唯一 id 的新变量。
     */
    public static Var createNewVar(String name) {
        long id = NEXT_ID.getAndIncrement();
        logger.debug("创建了一个新的Var: {} with id {}", name, id);
        return new Var(id, name);
    }

    /**
     * 创建一个 id 大于 wrt 中所有变量的新变量。
     * @return 新变量，以及加入新变量后的 wrt
     */
    public static Pair<Var, VarSet> fresh(String name, VarSet wrt) {
        long id = Math.max(wrt.maxId(), 0L) + 1;
        Var v = new Var(id, name);
        logger.debug("相对于{}创建了新鲜变量{}", wrt, v);
        return Pair.of(v, wrt.add(v));
    }

    public static Optional<Var> ofTrm(Term t) {
        if (t instanceof Var v) {
            return Optional.of(v);
        }
        return Optional.empty();
    }

    @Override
    public TermShape getShape() {
        return TermShape.VAR;
    }

    @Override
    public TermKind classify() {
        return TermKind.NON_INTERP_ATOM;
    }

    @Override
    public Stream<Term> trms() {
        return Stream.empty();
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public Term mapVars(UnaryOperator<Var> f) {
        return f.apply(this);
    }

    @Override
    int compareSameShape(Term other) {
        return Long.compare(this.id, ((Var) other).id);
    }

    @Override
    <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        return Pair.of(this, init);
    }

    @Override
    String format(Function<? super Var, Optional<VarStrength>> strength) {
        String base = "%" + name + "_" + id;
        return strength.apply(this)
                .map(s -> switch (s) {
                    case UNIVERSAL -> "∀" + base;
                    case EXISTENTIAL -> "∃" + base;
                    case ANONYMOUS -> "_";
                })
                .orElse(base);
    }

    @Override
    void checkNode() {
        // 变量没有结构不变式
    }

    @Override
    public Sexp toSexp() {
        return Sexp.tagged(TermShape.VAR.getTag(), Sexp.list(
                Sexp.field("id", Sexp.atom(id)),
                Sexp.field("name", Sexp.atom(name))));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id == ((Var) o).id;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
