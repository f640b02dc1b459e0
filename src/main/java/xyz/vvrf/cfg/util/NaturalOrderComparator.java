package xyz.vvrf.cfg.util;

import java.util.Comparator;

/**
 * 按"自然顺序"比较字符串：数字片段按数值比较，其余片段按字典序比较。
 * 例如 {@code B9 < B10 < B11}，而纯字典序会得到 {@code B10 < B11 < B9}。
 * <p>
 * 数值相等但前导零不同的字符串 (如 {@code B07} 与 {@code B7}) 最终按字典序区分，
 * 保证该比较器与 {@link String#equals(Object)} 一致。
 * </p>
 */
public final class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    private NaturalOrderComparator() {}

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (isDigit(ca) && isDigit(cb)) {
                int endA = digitsEnd(a, i);
                int endB = digitsEnd(b, j);
                int cmp = compareNumeric(a.substring(i, endA), b.substring(j, endB));
                if (cmp != 0) {
                    return cmp;
                }
                i = endA;
                j = endB;
            } else {
                if (ca != cb) {
                    return Character.compare(ca, cb);
                }
                i++;
                j++;
            }
        }
        int remaining = Integer.compare(a.length() - i, b.length() - j);
        if (remaining != 0) {
            return remaining;
        }
        return a.compareTo(b);
    }

    private static int compareNumeric(String x, String y) {
        String tx = stripLeadingZeros(x);
        String ty = stripLeadingZeros(y);
        if (tx.length() != ty.length()) {
            return Integer.compare(tx.length(), ty.length());
        }
        return tx.compareTo(ty);
    }

    private static String stripLeadingZeros(String digits) {
        int k = 0;
        while (k < digits.length() - 1 && digits.charAt(k) == '0') {
            k++;
        }
        return digits.substring(k);
    }

    private static int digitsEnd(String s, int from) {
        int k = from;
        while (k < s.length() && isDigit(s.charAt(k))) {
            k++;
        }
        return k;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
