package com.ryuqq.printqueue.adapter.file;

import com.ryuqq.printqueue.core.exception.MalformedSnapshotException;
import com.ryuqq.printqueue.core.model.ParticipantId;
import com.ryuqq.printqueue.core.waitlist.WaitlistSnapshot;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 대기열 스냅샷의 줄 단위 인코딩.
 *
 * <p><strong>형식:</strong></p>
 * <ul>
 *   <li>UTF-8 텍스트, 모든 줄은 {@code \n}으로 끝남</li>
 *   <li>연속 슬롯 체인이 열려 있으면 첫 줄은 {@code #chain=<참가자 ID>}</li>
 *   <li>이어서 한 줄에 참가자 ID 하나, 맨 앞부터 순서대로</li>
 *   <li>빈 대기열은 빈 파일</li>
 * </ul>
 *
 * <pre>
 * #chain=UA8RXUPSP
 * UA8RXUPSP
 * UA8RXUPSP
 * </pre>
 *
 * <p>디코딩은 엄격합니다. 빈 줄, BOM, 잘못된 UTF-8, 유효하지 않은 ID, 알 수 없는 지시어,
 * 체인 소유자와 다른 엔트리, 마지막 {@code \n}이 없는 내용(중간에 끊긴 쓰기)은 모두
 * {@link MalformedSnapshotException}으로 거부됩니다.</p>
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
public final class LineSnapshotCodec {

    static final String CHAIN_DIRECTIVE = ParticipantId.RESERVED_PREFIX + "chain=";

    private static final byte LINE_FEED = '\n';
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private LineSnapshotCodec() {
    }

    /**
     * 스냅샷을 바이트로 인코딩.
     *
     * @param snapshot 대기열 상태
     * @return UTF-8 바이트
     * @throws IllegalArgumentException snapshot이 null인 경우, 또는 UTF-8로 손실 없이 표현할 수 없는 경우
     */
    public static byte[] encode(WaitlistSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        StringBuilder builder = new StringBuilder();
        if (snapshot.selfChainOpen()) {
            builder.append(CHAIN_DIRECTIVE).append(snapshot.chainOwnerOrNull().getValue()).append('\n');
        }
        for (ParticipantId participant : snapshot.entries()) {
            builder.append(participant.getValue()).append('\n');
        }

        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(builder));
            byte[] content = new byte[encoded.remaining()];
            encoded.get(content);
            return content;
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("snapshot cannot be encoded as UTF-8", e);
        }
    }

    /**
     * 바이트를 스냅샷으로 디코딩.
     *
     * @param content 파일 내용
     * @return 대기열 상태
     * @throws MalformedSnapshotException 형식이 올바르지 않은 경우
     */
    public static WaitlistSnapshot decode(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        List<ParticipantId> entries = new ArrayList<>();
        ParticipantId chainOwner = null;
        int lineStart = 0;
        int lineNumber = 1;

        // \n은 UTF-8 멀티바이트 시퀀스 안에 나타나지 않으므로 바이트 단위로 분리해도 안전
        for (int i = 0; i < content.length; i++) {
            if (content[i] != LINE_FEED) {
                continue;
            }
            String line = decodeLine(content, lineStart, i, lineNumber);

            if (lineNumber == 1 && line.startsWith(CHAIN_DIRECTIVE)) {
                chainOwner = parseParticipant(line.substring(CHAIN_DIRECTIVE.length()), lineNumber);
            } else {
                ParticipantId participant = parseParticipant(line, lineNumber);
                if (chainOwner != null && !participant.equals(chainOwner)) {
                    throw new MalformedSnapshotException(lineNumber,
                        "entry does not belong to self-chain owner " + chainOwner.getValue());
                }
                entries.add(participant);
            }
            lineStart = i + 1;
            lineNumber++;
        }

        if (lineStart < content.length) {
            throw new MalformedSnapshotException(lineNumber, "missing trailing newline (truncated write)");
        }
        if (chainOwner != null && entries.isEmpty()) {
            throw new MalformedSnapshotException(1, "self-chain directive without entries");
        }
        return new WaitlistSnapshot(entries, chainOwner != null);
    }

    private static String decodeLine(byte[] content, int start, int end, int lineNumber) {
        if (start == end) {
            throw new MalformedSnapshotException(lineNumber, "empty line");
        }

        String line;
        try {
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
            line = decoder.decode(ByteBuffer.wrap(content, start, end - start)).toString();
        } catch (CharacterCodingException e) {
            throw new MalformedSnapshotException(lineNumber, "invalid UTF-8", e);
        }

        if (line.charAt(0) == BYTE_ORDER_MARK) {
            throw new MalformedSnapshotException(lineNumber, "byte order mark is not allowed");
        }
        return line;
    }

    private static ParticipantId parseParticipant(String value, int lineNumber) {
        try {
            return ParticipantId.of(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException(lineNumber, e.getMessage(), e);
        }
    }
}
