package com.pagepilot.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObservationTest {

    private static PageState state() {
        PageState state = new PageState();
        state.setUrl("https://shop.example/list");
        state.setTitle("List");
        state.setViewport(new Viewport(1000, 800));
        return state;
    }

    @Test
    void missingScrollLeavesObservationWithoutScrollData() {
        Observation observation = Observation.from(state(), null, null, 10L);

        assertFalse(observation.hasScroll());
        assertEquals(0.0, observation.getScrollY());
        assertEquals(800, observation.getViewportHeight());
    }

    @Test
    void reportedScrollIsKept() {
        PageState state = state();
        state.setScroll(new ScrollState(0, 2400, true, false));

        Observation observation = Observation.from(state, null, null, 10L);

        assertTrue(observation.hasScroll());
        assertTrue(observation.isAtTop());
        assertEquals(2400.0, observation.getMaxScrollY());
    }

    @Test
    void nonFiniteScrollCountsAsMissing() {
        PageState state = state();
        state.setScroll(new ScrollState(Double.NaN, 2400, false, false));

        assertFalse(Observation.from(state, null, null, 10L).hasScroll());
    }

    @Test
    void elementsAreCappedAndNullsSkipped() {
        PageState state = state();
        List<PageElement> elements = new ArrayList<>();
        elements.add(null);
        for (int i = 1; i <= Observation.MAX_ELEMENTS + 50; i++) {
            elements.add(new PageElement("e_" + i, "button", "Item " + i, "", "#item-" + i));
        }
        state.setElements(elements);

        Observation observation = Observation.from(state, null, null, 10L);

        assertEquals(Observation.MAX_ELEMENTS, observation.getElements().size());
        assertEquals("e_1", observation.getElements().get(0).getId());
        assertEquals("e_" + Observation.MAX_ELEMENTS, observation.getElements().get(Observation.MAX_ELEMENTS - 1).getId());
        assertNull(observation.findElement("e_" + (Observation.MAX_ELEMENTS + 1)));
    }

    @Test
    void fallsBackToGivenUrl() {
        PageState state = state();
        state.setUrl(" ");

        assertEquals("https://shop.example/", Observation.from(state, "https://shop.example/", null, 10L).getUrl());
    }
}
