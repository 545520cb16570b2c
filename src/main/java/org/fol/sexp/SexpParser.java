package org.fol.sexp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * S 表达式文本解析器。支持 ; 行注释与带 \" \\ 转义的双引号原子。
 * 每个实例只解析一段输入，不是线程安全的。
 */
public final class SexpParser {

    private static final Logger logger = LoggerFactory.getLogger(SexpParser.class);

    private final String input;
    private int pos;
    private int line = 1;
    private int column = 1;

    private SexpParser(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * 解析恰好一个 S 表达式。
     * @throws SexpParseException 如果文本不合法或有多余内容
     */
    public static Sexp parse(String text) {
        SexpParser parser = new SexpParser(text);
        parser.skipBlanks();
        Sexp result = parser.parseSexp();
        parser.skipBlanks();
        if (!parser.atEnd()) {
            throw parser.error("多余的输入");
        }
        logger.debug("解析得到 S 表达式: {}", result);
        return result;
    }

    /**
     * 解析由空白分隔的零个或多个 S 表达式。
     */
    public static List<Sexp> parseAll(String text) {
        SexpParser parser = new SexpParser(text);
        List<Sexp> result = new ArrayList<>();
        parser.skipBlanks();
        while (!parser.atEnd()) {
            result.add(parser.parseSexp());
            parser.skipBlanks();
        }
        return result;
    }

    private Sexp parseSexp() {
        if (atEnd()) {
            throw error("意外的输入结束");
        }
        char c = peek();
        if (c == '(') {
            advance();
            List<Sexp> items = new ArrayList<>();
            skipBlanks();
            while (!atEnd() && peek() != ')') {
                items.add(parseSexp());
                skipBlanks();
            }
            if (atEnd()) {
                throw error("缺少右括号");
            }
            advance();
            return Sexp.list(items);
        }
        if (c == ')') {
            throw error("意外的右括号");
        }
        if (c == '"') {
            return Sexp.atom(parseQuoted());
        }
        int start = pos;
        while (!atEnd() && !isDelimiter(peek())) {
            advance();
        }
        return Sexp.atom(input.substring(start, pos));
    }

    private String parseQuoted() {
        advance(); // 开头的引号
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw error("字符串未闭合");
            }
            char c = peek();
            advance();
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                if (atEnd()) {
                    throw error("转义序列不完整");
                }
                char escaped = peek();
                advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '"', '\\' -> sb.append(escaped);
                    default -> throw error("未知的转义字符 \\" + escaped);
                }
            } else {
                sb.append(c);
            }
        }
    }

    private void skipBlanks() {
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == ';') {
                while (!atEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';';
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private void advance() {
        if (input.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private SexpParseException error(String message) {
        String full = "S 表达式语法错误: " + message + " (line " + line + ", column " + column + ")";
        logger.error(full);
        return new SexpParseException(full);
    }
}
