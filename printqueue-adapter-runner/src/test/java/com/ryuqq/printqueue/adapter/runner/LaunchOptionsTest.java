package com.ryuqq.printqueue.adapter.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LaunchOptions 파싱 테스트.
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
@DisplayName("LaunchOptions 테스트")
class LaunchOptionsTest {

    @Test
    @DisplayName("인자가 없으면 in-memory 모드와 기본 타임아웃을 쓴다")
    void 기본값() {
        // when
        LaunchOptions options = LaunchOptions.parse(new String[0]);

        // then
        assertThat(options.isDurable()).isFalse();
        assertThat(options.queueFileOrNull()).isNull();
        assertThat(options.persistTimeoutMs()).isEqualTo(LaunchOptions.DEFAULT_PERSIST_TIMEOUT_MS);
        assertThat(options.clearQueue()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"--queue-file", "-f"})
    @DisplayName("파일 경로 플래그는 다음 인자를 값으로 쓴다")
    void 파일_경로_분리된_값(String flag) {
        // when
        LaunchOptions options = LaunchOptions.parse(new String[]{flag, "/var/lib/printqueue/queue.txt"});

        // then
        assertThat(options.isDurable()).isTrue();
        assertThat(options.queueFileOrNull()).isEqualTo(Path.of("/var/lib/printqueue/queue.txt"));
    }

    @Test
    @DisplayName("--flag=value 형식도 지원한다")
    void 인라인_값() {
        // when
        LaunchOptions options = LaunchOptions.parse(
            new String[]{"--queue-file=queue.txt", "--persist-timeout-ms=250", "--clear-queue"});

        // then
        assertThat(options.queueFileOrNull()).isEqualTo(Path.of("queue.txt"));
        assertThat(options.persistTimeoutMs()).isEqualTo(250);
        assertThat(options.clearQueue()).isTrue();
    }

    @Test
    @DisplayName("알 수 없는 플래그는 거부된다")
    void 알_수_없는_플래그() {
        assertThatThrownBy(() -> LaunchOptions.parse(new String[]{"--verbose"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown option: --verbose");
    }

    @Test
    @DisplayName("값이 빠진 플래그는 거부된다")
    void 값_누락() {
        assertThatThrownBy(() -> LaunchOptions.parse(new String[]{"--queue-file"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing value for --queue-file");
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "0", "-5"})
    @DisplayName("타임아웃은 양의 정수여야 한다")
    void 잘못된_타임아웃(String value) {
        assertThatThrownBy(() -> LaunchOptions.parse(new String[]{"--persist-timeout-ms", value}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("--persist-timeout-ms");
    }

    @Test
    @DisplayName("--clear-queue는 값을 받지 않는다")
    void clear_queue_값_거부() {
        assertThatThrownBy(() -> LaunchOptions.parse(new String[]{"--clear-queue=yes"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not take a value");
    }

    @Test
    @DisplayName("빈 파일 경로는 거부된다")
    void 빈_파일_경로() {
        assertThatThrownBy(() -> LaunchOptions.parse(new String[]{"--queue-file="}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Empty value");
    }
}
