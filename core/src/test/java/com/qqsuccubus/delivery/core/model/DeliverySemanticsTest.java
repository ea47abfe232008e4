package com.qqsuccubus.delivery.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeliverySemanticsTest {

    @Test
    void testParse_AcceptsCommonSpellings() {
        assertEquals(DeliverySemantics.AT_LEAST_ONCE, DeliverySemantics.parse("AtLeastOnce"));
        assertEquals(DeliverySemantics.AT_MOST_ONCE, DeliverySemantics.parse("at-most-once"));
        assertEquals(DeliverySemantics.EXACTLY_ONCE, DeliverySemantics.parse(" exactly_once "));
        assertEquals(DeliverySemantics.DEAD_LETTER, DeliverySemantics.parse("DeadLetter"));
    }

    @Test
    void testParse_UnknownValueRejected() {
        assertThrows(IllegalArgumentException.class, () -> DeliverySemantics.parse("twice"));
    }

    @Test
    void testEffective_DeadLetterActsAsAtLeastOnce() {
        assertEquals(DeliverySemantics.AT_LEAST_ONCE, DeliverySemantics.DEAD_LETTER.effective());
        assertEquals(DeliverySemantics.EXACTLY_ONCE, DeliverySemantics.EXACTLY_ONCE.effective());
        assertEquals(DeliverySemantics.AT_MOST_ONCE, DeliverySemantics.AT_MOST_ONCE.effective());
    }
}
