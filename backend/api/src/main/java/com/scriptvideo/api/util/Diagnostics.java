package com.scriptvideo.api.util;

/**
 * 외부 시스템 메시지 자르기
 * 로그에는 앞부분만, 작업 에러에는 더 길게 저장한다.
 */
public final class Diagnostics {

    public static final int LOG_LIMIT = 500;
    public static final int STORE_LIMIT = 4000;

    private Diagnostics() {
    }

    public static String forLog(String text) {
        return truncate(text, LOG_LIMIT);
    }

    public static String forStore(String text) {
        return truncate(text, STORE_LIMIT);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
