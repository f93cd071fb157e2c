package com.example.reportcard.util.behaviour;

import com.example.reportcard.util.behaviour.dto.Rating;
import com.example.reportcard.util.pattern.PatternLibrary;

import java.util.Locale;

/**
 * 评级词归一化
 *
 * 四级级联：
 * 1. 与规范评级精确匹配（忽略大小写）
 * 2. 查变体/同义词表
 * 3. OCR 字符修复（0→o, 1→l, 5→s, @/4→a, $→s）后重查规范评级与变体表
 * 4. 修复后文本包含某个规范评级（子串）
 *
 * 四级都未命中返回 null，调用方据此丢弃该属性。
 */
public class RatingNormalizer {

    /**
     * 归一化一个评级词
     *
     * @param token 原始评级词（可能是 OCR 变体）
     * @return 规范评级；无法识别返回 null
     */
    public static Rating normalize(String token) {
        if (token == null) {
            return null;
        }
        String t = token.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (t.isEmpty()) {
            return null;
        }

        // 1. 规范评级
        Rating exact = matchCanonical(t);
        if (exact != null) {
            return exact;
        }

        // 2. 变体表
        Rating variant = PatternLibrary.RATING_VARIANTS.get(t);
        if (variant != null) {
            return variant;
        }

        // 3. OCR 字符修复后重查
        String fixed = repairOcrConfusions(t);
        variant = PatternLibrary.RATING_VARIANTS.get(fixed);
        if (variant != null) {
            return variant;
        }
        exact = matchCanonical(fixed);
        if (exact != null) {
            return exact;
        }

        // 4. 子串兜底（按枚举顺序，Very Good 先于 Good）
        for (Rating rating : Rating.values()) {
            if (fixed.contains(rating.getLabel().toLowerCase(Locale.ROOT))) {
                return rating;
            }
        }
        return null;
    }

    /**
     * 应用 OCR 字符替换表
     *
     * @param token 小写评级词
     * @return 替换后的文本
     */
    public static String repairOcrConfusions(String token) {
        StringBuilder sb = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            char ch = token.charAt(i);
            Character replacement = PatternLibrary.OCR_SUBSTITUTIONS.get(ch);
            sb.append(replacement != null ? replacement : ch);
        }
        return sb.toString();
    }

    /**
     * 判断文本本身是否就是一个评级词（规范评级或变体表中的键）
     */
    public static boolean isRatingToken(String text) {
        if (text == null) {
            return false;
        }
        String t = text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return matchCanonical(t) != null || PatternLibrary.RATING_VARIANTS.containsKey(t);
    }

    private static Rating matchCanonical(String lower) {
        for (Rating rating : Rating.values()) {
            if (rating.getLabel().toLowerCase(Locale.ROOT).equals(lower)) {
                return rating;
            }
        }
        return null;
    }
}
