/**
 * 채팅 명령 처리 계층.
 *
 * <p>채팅 플랫폼 어댑터가 봇 멘션 메시지를 받으면 {@link com.ryuqq.printqueue.application.command.CommandDispatcher}
 * 에 요청자와 본문을 넘기고, 반환된 {@link com.ryuqq.printqueue.application.command.Reply}를 같은 채널에 게시합니다.</p>
 *
 * <p><strong>지원 명령:</strong> add, done, cancel, show</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
package com.ryuqq.printqueue.application.command;
