package com.ryuqq.printqueue.adapter.runner;

import com.ryuqq.printqueue.application.command.ReplyRenderer;
import com.ryuqq.printqueue.core.event.Promoted;
import com.ryuqq.printqueue.core.spi.PromotionNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 채팅 어댑터가 연결되지 않았을 때 쓰는 알림 전달자.
 *
 * <p>사용자에게 보낼 메시지를 INFO 로그로 남깁니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public class LoggingPromotionNotifier implements PromotionNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingPromotionNotifier.class);

    private final ReplyRenderer renderer;

    public LoggingPromotionNotifier() {
        this(new ReplyRenderer());
    }

    public LoggingPromotionNotifier(ReplyRenderer renderer) {
        if (renderer == null) {
            throw new IllegalArgumentException("renderer cannot be null");
        }
        this.renderer = renderer;
    }

    @Override
    public void deliver(Promoted event) {
        log.info("[notify {}] {}", event.participant().getValue(), renderer.promoted(event.participant()));
    }
}
