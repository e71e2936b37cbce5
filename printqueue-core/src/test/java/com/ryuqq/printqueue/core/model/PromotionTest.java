package com.ryuqq.printqueue.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Position, Promotion 테스트.
 *
 * @author Print Queue Team
 * @since 1.0.0
 */
class PromotionTest {

    private static final ParticipantId ALICE = ParticipantId.of("UA8RXUPSP");
    private static final ParticipantId BOB = ParticipantId.of("UNB2LMZRP");

    @Test
    void to_WithNewFront_HasNewFront() {
        // When
        Promotion promotion = Promotion.to(ALICE, BOB);

        // Then
        assertEquals(ALICE, promotion.getFinished());
        assertEquals(BOB, promotion.getNewFrontOrNull());
        assertTrue(promotion.hasNewFront());
    }

    @Test
    void none_HasNoNewFront() {
        // When
        Promotion promotion = Promotion.none(ALICE);

        // Then
        assertFalse(promotion.hasNewFront());
        assertNull(promotion.getNewFrontOrNull());
        assertEquals(Promotion.none(ALICE), promotion);
        assertNotEquals(Promotion.to(ALICE, BOB), promotion);
    }

    @Test
    void to_NullNewFront_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Promotion.to(ALICE, null));
    }

    @Test
    void none_NullFinished_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Promotion.none(null));
    }

    @Test
    void position_FromIndex_IsOneBased() {
        assertEquals(1, Position.fromIndex(0).value());
        assertTrue(Position.fromIndex(0).isFront());
        assertFalse(new Position(2).isFront());
    }

    @Test
    void position_Zero_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Position(0));
        assertThrows(IllegalArgumentException.class, () -> Position.fromIndex(-1));
    }
}
