package com.ryuqq.printqueue.core.model;

/**
 * 대기열 참가자의 식별자.
 *
 * <p>채팅 플랫폼이 부여한 사용자 ID(예: {@code UA8RXUPSP})를 감싸는 값 객체입니다.
 * 동일한 참가자가 대기열에 여러 슬롯을 가질 수 있으므로, 엔트리의 정체성은
 * ParticipantId가 아니라 위치로 결정됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 및 제어 문자 불가 (스냅샷 파일이 한 줄에 하나씩 기록하기 때문)</li>
 *   <li>서식 문자(BOM, zero-width 등) 및 짝이 맞지 않는 surrogate 불가 (UTF-8로 손실 없이 기록되어야 함)</li>
 *   <li>{@value #RESERVED_PREFIX}로 시작 불가 (스냅샷 파일의 지시어 줄에 예약됨)</li>
 * </ul>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public final class ParticipantId implements Comparable<ParticipantId> {

    private static final int MAX_LENGTH = 255;

    /**
     * 스냅샷 지시어 줄의 접두사.
     */
    public static final char RESERVED_PREFIX = '#';

    private final String value;

    private ParticipantId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ParticipantId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ParticipantId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (value.charAt(0) == RESERVED_PREFIX) {
            throw new IllegalArgumentException("ParticipantId cannot start with '" + RESERVED_PREFIX + "'");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new IllegalArgumentException(
                    "ParticipantId cannot contain whitespace or control characters (index: " + i + ")");
            }
            if (Character.getType(c) == Character.FORMAT) {
                throw new IllegalArgumentException(
                    "ParticipantId cannot contain format characters (index: " + i + ")");
            }
            if (Character.isHighSurrogate(c) && i + 1 < value.length()
                && Character.isLowSurrogate(value.charAt(i + 1))) {
                i++;
                continue;
            }
            if (Character.isSurrogate(c)) {
                throw new IllegalArgumentException(
                    "ParticipantId cannot contain unpaired surrogates (index: " + i + ")");
            }
        }
        this.value = value;
    }

    /**
     * ParticipantId 생성.
     *
     * @param value 참가자 ID 값
     * @return ParticipantId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ParticipantId of(String value) {
        return new ParticipantId(value);
    }

    /**
     * ParticipantId 값 조회.
     *
     * @return 참가자 ID 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ParticipantId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParticipantId that = (ParticipantId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ParticipantId{" + value + '}';
    }
}
