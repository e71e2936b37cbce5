package com.ryuqq.printqueue.adapter.runner;

import java.nio.file.Path;

/**
 * 프로세스 시작 옵션.
 *
 * <p><strong>지원 플래그:</strong></p>
 * <ul>
 *   <li>{@code --queue-file <path>}, {@code -f <path>}, {@code --queue-file=<path>}: 스냅샷 파일 경로.
 *       없으면 비영속 (in-memory) 모드</li>
 *   <li>{@code --persist-timeout-ms <n>}, {@code --persist-timeout-ms=<n>}: 스냅샷 쓰기 대기 한도 (기본 5000)</li>
 *   <li>{@code --clear-queue}: 시작 전에 스냅샷을 빈 대기열로 교체 (유지보수용)</li>
 * </ul>
 *
 * @author Print Queue Team
 * @since 1.0.0
 * @param queueFileOrNull 스냅샷 파일 경로 (null이면 in-memory 모드)
 * @param persistTimeoutMs 쓰기 대기 한도 (밀리초, 양수여야 함)
 * @param clearQueue 시작 전 스냅샷 초기화 여부
 */
public record LaunchOptions(Path queueFileOrNull, long persistTimeoutMs, boolean clearQueue) {

    static final long DEFAULT_PERSIST_TIMEOUT_MS = 5000;

    private static final String QUEUE_FILE = "--queue-file";
    private static final String QUEUE_FILE_SHORT = "-f";
    private static final String PERSIST_TIMEOUT = "--persist-timeout-ms";
    private static final String CLEAR_QUEUE = "--clear-queue";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException persistTimeoutMs가 양수가 아닌 경우
     */
    public LaunchOptions {
        if (persistTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "persistTimeoutMs must be positive (current: " + persistTimeoutMs + ")"
            );
        }
    }

    /**
     * 명령줄 인자 파싱.
     *
     * @param args 명령줄 인자
     * @return 시작 옵션
     * @throws IllegalArgumentException 알 수 없는 플래그, 값 누락, 잘못된 숫자인 경우
     */
    public static LaunchOptions parse(String[] args) {
        if (args == null) {
            throw new IllegalArgumentException("args cannot be null");
        }

        Path queueFile = null;
        long persistTimeoutMs = DEFAULT_PERSIST_TIMEOUT_MS;
        boolean clearQueue = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                inlineValue = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }

            switch (arg) {
                case QUEUE_FILE, QUEUE_FILE_SHORT -> {
                    String value = inlineValue != null ? inlineValue : valueAfter(args, i++, arg);
                    queueFile = parsePath(value, arg);
                }
                case PERSIST_TIMEOUT -> {
                    String value = inlineValue != null ? inlineValue : valueAfter(args, i++, arg);
                    persistTimeoutMs = parsePositiveLong(value, arg);
                }
                case CLEAR_QUEUE -> {
                    if (inlineValue != null) {
                        throw new IllegalArgumentException(CLEAR_QUEUE + " does not take a value");
                    }
                    clearQueue = true;
                }
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        return new LaunchOptions(queueFile, persistTimeoutMs, clearQueue);
    }

    /**
     * 스냅샷 파일이 지정되었는지 확인.
     *
     * @return 파일이 지정되었으면 true (영속 모드)
     */
    public boolean isDurable() {
        return queueFileOrNull != null;
    }

    private static String valueAfter(String[] args, int index, String flag) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index + 1];
    }

    private static Path parsePath(String value, String flag) {
        if (value.isBlank()) {
            throw new IllegalArgumentException("Empty value for " + flag);
        }
        return Path.of(value);
    }

    private static long parsePositiveLong(String value, String flag) {
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + flag + ": " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(flag + " must be positive (current: " + parsed + ")");
        }
        return parsed;
    }
}
