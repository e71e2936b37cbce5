package com.ryuqq.printqueue.core.model;

/**
 * 대기열 내 1-based 위치.
 *
 * <p>1은 현재 자원을 사용 중인 맨 앞 엔트리를 의미합니다.</p>
 *
 * @param value 위치 값 (1 이상)
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public record Position(int value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 1 미만인 경우
     */
    public Position {
        if (value < 1) {
            throw new IllegalArgumentException("Position must be at least 1 (current: " + value + ")");
        }
    }

    /**
     * 0-based 인덱스로부터 Position 생성.
     *
     * @param index 0-based 인덱스
     * @return Position 인스턴스
     * @throws IllegalArgumentException index가 음수인 경우
     */
    public static Position fromIndex(int index) {
        return new Position(index + 1);
    }

    /**
     * 맨 앞 위치인지 확인.
     *
     * @return value가 1이면 true
     */
    public boolean isFront() {
        return value == 1;
    }
}
