package org.fol.utils;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 任意精度的有理数，始终以约分后的形式 numerator / denominator 存储，分母恒为正。
 * 作为 Q 字面量的载荷以及多项式的系数使用。
 * 此类是不可变的。
 */
@Getter
public final class Rational implements Comparable<Rational> {

    private static final Logger logger = LoggerFactory.getLogger(Rational.class);

    /** 小整数表覆盖的范围 [-SMALL_BOUND, SMALL_BOUND] */
    private static final int SMALL_BOUND = 16;

    private static final Rational[] SMALL_INTEGERS = new Rational[2 * SMALL_BOUND + 1];

    private static final ConcurrentHashMap<Pair<BigInteger, BigInteger>, Rational> FRACTIONS = new ConcurrentHashMap<>(256);

    private static final int MAX_CACHED_FRACTIONS = 65536;

    static {
        for (int i = -SMALL_BOUND; i <= SMALL_BOUND; i++) {
            SMALL_INTEGERS[i + SMALL_BOUND] = new Rational(BigInteger.valueOf(i), BigInteger.ONE);
        }
    }

    public static final Rational ZERO = SMALL_INTEGERS[SMALL_BOUND];
    public static final Rational ONE = SMALL_INTEGERS[SMALL_BOUND + 1];
    public static final Rational MINUS_ONE = SMALL_INTEGERS[SMALL_BOUND - 1];
    public static final Rational HALF = valueOf(BigInteger.ONE, BigInteger.TWO);

    private final BigInteger numerator;

    private final BigInteger denominator;

    private final int hashCode;

    /**
     * 私有构造函数，参数必须已经约分且分母为正。
     */
    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
        this.hashCode = 31 * numerator.hashCode() + denominator.hashCode();
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        Objects.requireNonNull(numerator, "Rational: numerator 不能为 null");
        return ofNormalized(numerator, BigInteger.ONE);
    }

    public static Rational valueOf(long numerator) {
        if (numerator >= -SMALL_BOUND && numerator <= SMALL_BOUND) {
            return SMALL_INTEGERS[(int) numerator + SMALL_BOUND];
        }
        return new Rational(BigInteger.valueOf(numerator), BigInteger.ONE);
    }

    public static Rational valueOf(int numerator) {
        return valueOf((long) numerator);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(int numerator, int denominator) {
        return valueOf((long) numerator, (long) denominator);
    }

    /**
     * 创建 numerator / denominator，自动约分并把符号移到分子上。
     * @throws ArithmeticException 如果分母为零
     */
    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Rational: numerator 不能为 null");
        Objects.requireNonNull(denominator, "Rational: denominator 不能为 null");
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为零的 Rational: {} / 0", numerator);
            throw new ArithmeticException("Rational: 分母为零 (" + numerator + "/0)");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        return ofNormalized(numerator, denominator);
    }

    /**
     * 解析 S 表达式中的数字："n"、"n/d"，也接受十进制小数 "1.25"。
     * @throws NumberFormatException 如果格式非法或分母为零
     */
    public static Rational valueOf(String text) {
        String s = StringUtils.trimToEmpty(text);
        if (s.isEmpty()) {
            throw new NumberFormatException("Rational: 空的数字");
        }
        if (s.indexOf('/') >= 0) {
            BigInteger num = parseInteger(StringUtils.substringBefore(s, "/"), s);
            BigInteger den = parseInteger(StringUtils.substringAfter(s, "/"), s);
            if (den.signum() == 0) {
                throw new NumberFormatException("Rational: 分数 " + s + " 的分母为零");
            }
            return valueOf(num, den);
        }
        if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) {
            return valueOf(parseInteger(s, s));
        }
        BigDecimal decimal;
        try {
            decimal = new BigDecimal(s);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Rational: 无效数字 " + s);
        }
        if (decimal.scale() <= 0) {
            return valueOf(decimal.toBigIntegerExact());
        }
        return valueOf(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
    }

    private static BigInteger parseInteger(String part, String whole) {
        try {
            return new BigInteger(part.trim());
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Rational: " + whole + " 中的整数 \"" + part + "\" 无效");
        }
    }

    /**
     * 小整数取自常量表，小分数取自缓存。
     */
    private static Rational ofNormalized(BigInteger numerator, BigInteger denominator) {
        if (denominator.equals(BigInteger.ONE) && numerator.bitLength() < 63) {
            return valueOf(numerator.longValue());
        }
        if (numerator.bitLength() + denominator.bitLength() >= 32) {
            return new Rational(numerator, denominator);
        }
        Pair<BigInteger, BigInteger> key = Pair.of(numerator, denominator);
        Rational cached = FRACTIONS.get(key);
        if (cached != null) {
            return cached;
        }
        Rational fresh = new Rational(numerator, denominator);
        if (FRACTIONS.size() < MAX_CACHED_FRACTIONS) {
            Rational raced = FRACTIONS.putIfAbsent(key, fresh);
            return raced != null ? raced : fresh;
        }
        return fresh;
    }

    // ========== 运算 ==========

    public Rational add(Rational other) {
        if (isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        if (isInteger() && other.isInteger()) {
            return valueOf(numerator.add(other.numerator));
        }
        return valueOf(
                numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    /**
     * 先交叉约分再相乘，结果无需再次约分。
     */
    public Rational multiply(Rational other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        if (isOne()) {
            return other;
        }
        if (other.isOne()) {
            return this;
        }
        BigInteger g1 = numerator.gcd(other.denominator);
        BigInteger g2 = other.numerator.gcd(denominator);
        BigInteger num = numerator.divide(g1).multiply(other.numerator.divide(g2));
        BigInteger den = denominator.divide(g2).multiply(other.denominator.divide(g1));
        return ofNormalized(num, den);
    }

    /**
     * @throws ArithmeticException 如果除数为零
     */
    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("Rational 除零: {} / 0", this);
            throw new ArithmeticException("Rational: 除数为零 (" + this + " / 0)");
        }
        return multiply(other.reciprocal());
    }

    /**
     * @throws ArithmeticException 如果为零
     */
    public Rational reciprocal() {
        if (isZero()) {
            logger.error("尝试求零的倒数");
            throw new ArithmeticException("Rational: 零没有倒数");
        }
        if (numerator.signum() < 0) {
            return ofNormalized(denominator.negate(), numerator.negate());
        }
        return ofNormalized(denominator, numerator);
    }

    public Rational negate() {
        return ofNormalized(numerator.negate(), denominator);
    }

    public Rational abs() {
        return signum() >= 0 ? this : negate();
    }

    /**
     * 整数次幂，负指数取倒数。
     * @throws ArithmeticException 如果对零求负次幂
     */
    public Rational pow(int exponent) {
        if (exponent < 0) {
            return reciprocal().pow(-exponent);
        }
        return ofNormalized(numerator.pow(exponent), denominator.pow(exponent));
    }

    // ========== 查询 ==========

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return isInteger() && numerator.equals(BigInteger.ONE);
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    /**
     * @throws ArithmeticException 如果不是整数
     */
    public BigInteger toBigIntegerExact() {
        if (!isInteger()) {
            logger.error("{} 不是整数", this);
            throw new ArithmeticException("Rational 不是整数: " + this);
        }
        return numerator;
    }

    // ========== Object 方法 ==========

    @Override
    public int compareTo(Rational other) {
        if (denominator.equals(other.denominator)) {
            return numerator.compareTo(other.numerator);
        }
        int bySign = Integer.compare(signum(), other.signum());
        if (bySign != 0) {
            return bySign;
        }
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Rational that = (Rational) o;
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
