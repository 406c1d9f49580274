package com.linlay.citygeo.geo;

import java.util.Set;

/**
 * 从多文字形式的地名中挑选简体写法。
 * <p>
 * Nominatim 在 zh 语言下返回的名称可能形如 {@code 大倫敦;大伦敦}、{@code 英格兰;英格蘭}
 * 或 {@code 东京都/東京都}，分号两侧的顺序并不固定。这里只用一小组常见繁体字做计数比较，
 * 属于近似判断，不是完整的繁简转换。
 */
public final class ScriptVariantSelector {

    private static final Set<Integer> TRADITIONAL_GLYPHS = Set.of(
            (int) '倫', (int) '國', (int) '蘭', (int) '東', (int) '會', (int) '爲', (int) '齊', (int) '實',
            (int) '與', (int) '歲', (int) '學', (int) '書', (int) '電', (int) '機', (int) '業', (int) '專',
            (int) '門', (int) '開', (int) '關', (int) '區', (int) '圖', (int) '體', (int) '廣'
    );

    private ScriptVariantSelector() {
    }

    public static String selectPreferredVariant(String label) {
        if (label == null) {
            return "";
        }
        String trimmed = label.trim();

        int semicolon = trimmed.indexOf(';');
        if (semicolon > 0 && semicolon < trimmed.length() - 1) {
            String first = trimmed.substring(0, semicolon).trim();
            String second = trimmed.substring(semicolon + 1).trim();
            // ties go to the second half
            return countTraditional(first) < countTraditional(second) ? first : second;
        }

        int slash = trimmed.indexOf('/');
        if (slash > 0) {
            return trimmed.substring(0, slash).trim();
        }
        return trimmed;
    }

    static int countTraditional(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            if (TRADITIONAL_GLYPHS.contains(codePoint)) {
                count++;
            }
            i += Character.charCount(codePoint);
        }
        return count;
    }
}
