package com.ryuqq.printqueue.application.command;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 채팅으로 들어오는 대기열 명령.
 *
 * <p>봇을 멘션한 메시지 본문에서 해석됩니다. 대소문자, 앞뒤 공백, 멘션 토큰({@code <@U123>})은 무시합니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public enum QueueCommand {

    /**
     * 대기열 맨 뒤에 추가.
     */
    ADD("add"),

    /**
     * 맨 앞 엔트리 사용 완료.
     */
    DONE("done"),

    /**
     * 맨 앞이 아닌 자기 엔트리 취소.
     */
    CANCEL("cancel"),

    /**
     * 현재 순서 조회.
     */
    SHOW("show");

    private static final Pattern MENTION = Pattern.compile("<@[^>\\s]*>");

    private final String keyword;

    QueueCommand(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * 메시지 본문을 명령으로 해석.
     *
     * @param text 메시지 본문 (null 허용)
     * @return 해석된 명령 또는 null (인식할 수 없는 경우)
     */
    public static QueueCommand parse(String text) {
        if (text == null) {
            return null;
        }
        String normalized = MENTION.matcher(text).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
        for (QueueCommand command : values()) {
            if (command.keyword.equals(normalized)) {
                return command;
            }
        }
        return null;
    }
}
