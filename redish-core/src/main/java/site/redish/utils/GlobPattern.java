package site.redish.utils;

import site.redish.datastructure.RedisBytes;

/**
 * KEYS命令使用的glob匹配
 *
 * <p>支持{@code *}、{@code ?}、{@code [abc]}、{@code [^a-z]}以及{@code \}转义，
 * 按字节匹配。
 *
 * @author redish
 * @since 1.0.0
 */
public final class GlobPattern {

    private GlobPattern() {
    }

    public static boolean matches(final RedisBytes pattern, final RedisBytes subject) {
        return matches(pattern.getBytesUnsafe(), 0, subject.getBytesUnsafe(), 0);
    }

    private static boolean matches(final byte[] p, int pi, final byte[] s, int si) {
        while (pi < p.length) {
            switch (p[pi]) {
                case '*':
                    while (pi + 1 < p.length && p[pi + 1] == '*') {
                        pi++;
                    }
                    if (pi + 1 == p.length) {
                        return true;
                    }
                    for (int start = si; start <= s.length; start++) {
                        if (matches(p, pi + 1, s, start)) {
                            return true;
                        }
                    }
                    return false;
                case '?':
                    if (si >= s.length) {
                        return false;
                    }
                    si++;
                    pi++;
                    break;
                case '[':
                    if (si >= s.length) {
                        return false;
                    }
                    final int end = matchClass(p, pi + 1, s[si]);
                    if (end < 0) {
                        return false;
                    }
                    pi = end;
                    si++;
                    break;
                case '\\':
                    if (pi + 1 < p.length) {
                        pi++;
                    }
                    // fall through
                default:
                    if (si >= s.length || p[pi] != s[si]) {
                        return false;
                    }
                    si++;
                    pi++;
                    break;
            }
        }
        return si == s.length;
    }

    /**
     * 匹配字符类
     *
     * @return 字符类之后的模式下标，不匹配时返回-1
     */
    private static int matchClass(final byte[] p, int pi, final byte c) {
        final boolean negate = pi < p.length && p[pi] == '^';
        if (negate) {
            pi++;
        }
        boolean matched = false;
        while (pi < p.length && p[pi] != ']') {
            if (p[pi] == '\\' && pi + 1 < p.length) {
                pi++;
                if (p[pi] == c) {
                    matched = true;
                }
                pi++;
            } else if (pi + 2 < p.length && p[pi + 1] == '-' && p[pi + 2] != ']') {
                int low = p[pi] & 0xff;
                int high = p[pi + 2] & 0xff;
                if (low > high) {
                    final int tmp = low;
                    low = high;
                    high = tmp;
                }
                final int value = c & 0xff;
                if (value >= low && value <= high) {
                    matched = true;
                }
                pi += 3;
            } else {
                if (p[pi] == c) {
                    matched = true;
                }
                pi++;
            }
        }
        // 未闭合的'['按到模式末尾处理
        if (pi < p.length) {
            pi++;
        }
        return matched != negate ? pi : -1;
    }
}
