package com.ryuqq.printqueue.application.command;

/**
 * 요청 채널에 게시할 응답.
 *
 * @param text 응답 메시지
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public record Reply(String text) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException text가 null이거나 비어 있는 경우
     */
    public Reply {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text cannot be null or blank");
        }
    }
}
