package com.devstore.global.common;

import java.math.BigDecimal;

/**
 * 테이블 컬럼 크기와 맞춘 입력 한도 상수 모음.
 *
 * DTO의 Bean Validation 어노테이션과 엔티티 규칙 검사가 같은 값을 사용한다.
 */
public final class ColumnLimits {

    private ColumnLimits() {}

    // ── 문자열 ──────────────────────────────────────
    public static final int PRODUCT_NAME_LENGTH = 200;
    public static final int IMAGE_LENGTH = 500;
    public static final int VOUCHER_CODE_LENGTH = 50;

    // ── 금액 NUMERIC(12,2) / 할인율 NUMERIC(5,2) ──
    public static final int MONEY_INTEGER_DIGITS = 10;
    public static final int PERCENTAGE_INTEGER_DIGITS = 3;
    public static final int FRACTION_DIGITS = 2;

    public static boolean fitsMoney(BigDecimal value) {
        return fits(value, MONEY_INTEGER_DIGITS);
    }

    public static boolean fitsPercentage(BigDecimal value) {
        return fits(value, PERCENTAGE_INTEGER_DIGITS);
    }

    public static boolean exceedsLength(String value, int maxLength) {
        return value != null && value.length() > maxLength;
    }

    /**
     * 반올림 없이 저장 가능한지 본다. 소수 자릿수와 정수 자릿수를 각각 확인한다.
     */
    private static boolean fits(BigDecimal value, int integerDigits) {
        if (value == null) {
            return true;
        }
        BigDecimal normalized = value.stripTrailingZeros();
        int fraction = Math.max(normalized.scale(), 0);
        int integer = normalized.precision() - normalized.scale();
        return fraction <= FRACTION_DIGITS && integer <= integerDigits;
    }
}
