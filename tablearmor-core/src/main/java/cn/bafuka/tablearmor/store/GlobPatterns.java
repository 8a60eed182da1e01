package cn.bafuka.tablearmor.store;

import java.util.regex.Pattern;

/**
 * 通配模式工具
 * 只识别 * 和 ?，其余字符一律按字面匹配
 */
public final class GlobPatterns {

    private GlobPatterns() {
    }

    /**
     * 通配模式转正则（整串匹配，区分大小写）
     *
     * @param glob 通配模式
     * @return 编译后的正则
     */
    public static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        regex.append('^');
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                flushLiteral(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(regex, literal);
        regex.append('$');
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    /**
     * 转成 Redis MATCH 模式，转义 Redis 自带的字符类语法
     *
     * @param glob 通配模式
     * @return Redis 模式
     */
    public static String toRedisPattern(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 4);
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '[' || c == ']' || c == '\\' || c == '^') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
