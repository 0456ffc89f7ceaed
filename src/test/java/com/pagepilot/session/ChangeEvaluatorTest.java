package com.pagepilot.session;

import com.pagepilot.models.ActionType;
import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.Observation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeEvaluatorTest {

    private final ChangeEvaluator evaluator = new ChangeEvaluator();

    private static Observation.Builder page() {
        return Observation.builder()
            .url("https://example.com/list")
            .title("List")
            .viewport(1000, 1000)
            .domSignature("dom-1")
            .screenshot("data:image/png;base64,AAAA", "h1");
    }

    private static BrowserAction scroll(int dy) {
        BrowserAction action = new BrowserAction(ActionType.SCROLL);
        action.getArgs().setDy(dy);
        return action;
    }

    @Test
    void identicalObservationsHaveNoChange() {
        ChangeResult result = evaluator.diff(page().build(), page().build());

        assertFalse(result.isChanged());
        assertEquals("State change: none", result.getSummary());
    }

    @Test
    void reportsEachChangedSignalInOrder() {
        Observation before = page().scroll(0, 3000, true, false).build();
        Observation after = page()
            .url("https://example.com/item?id=7")
            .title("Item")
            .scroll(800, 3000, false, false)
            .domSignature("dom-2")
            .screenshot("data:image/png;base64,BBBB", "h2")
            .build();

        ChangeResult result = evaluator.diff(before, after);

        assertEquals(List.of(
            "URL changed: https://example.com/list -> https://example.com/item",
            "Title changed: \"List\" -> \"Item\"",
            "ScrollY changed: 0 -> 800",
            "DOM signature changed",
            "Screenshot changed"), result.getReasons());
        assertTrue(result.getSummary().startsWith("State change: URL changed"));
        assertTrue(result.getSummary().contains(" / Title changed"));
    }

    @Test
    void missingSignaturesAreNotCompared() {
        Observation before = page().domSignature("").screenshot(null, null).build();
        Observation after = page().domSignature("dom-2").screenshot("data:image/png;base64,BBBB", "h2").build();

        assertFalse(evaluator.diff(before, after).isChanged());
    }

    @Test
    void scrollGuardIgnoresOtherActions() {
        ScrollGuardResult result = evaluator.scrollGuard(new BrowserAction(ActionType.CLICK), page().build(), page().build());
        assertFalse(result.isChecked());
        assertFalse(result.isStuck());
    }

    @Test
    void scrollGuardAcceptsMeaningfulDownwardMove() {
        Observation before = page().scroll(0, 3000, true, false).build();
        Observation after = page().scroll(820, 3000, false, false).build();

        ScrollGuardResult result = evaluator.scrollGuard(scroll(820), before, after);

        assertTrue(result.isChecked());
        assertFalse(result.isStuck());
        assertEquals(820, result.getDeltaY());
    }

    @Test
    void scrollGuardFlagsSmallMoves() {
        Observation before = page().scroll(100, 3000, false, false).build();
        Observation after = page().scroll(130, 3000, false, false).build();

        assertTrue(evaluator.scrollGuard(scroll(820), before, after).isStuck());
    }

    @Test
    void scrollGuardFlagsBoundaryInRequestedDirection() {
        Observation before = page().scroll(2000, 3000, false, false).build();
        Observation atBottom = page().scroll(3000, 3000, false, true).build();
        assertTrue(evaluator.scrollGuard(scroll(820), before, atBottom).isStuck());

        Observation atTop = page().scroll(0, 3000, true, false).build();
        assertFalse(evaluator.scrollGuard(scroll(820), atTop, before).isStuck());
        assertTrue(evaluator.scrollGuard(scroll(-820), before, atTop).isStuck());
    }

    @Test
    void scrollGuardFlagsWrongDirection() {
        Observation before = page().scroll(1000, 3000, false, false).build();
        Observation after = page().scroll(200, 3000, false, false).build();

        assertTrue(evaluator.scrollGuard(scroll(820), before, after).isStuck());
        assertFalse(evaluator.scrollGuard(scroll(-820), before, after).isStuck());
    }

    @Test
    void scrollGuardDoesNotCountMissingScrollAsStall() {
        Observation noScroll = page().build();
        Observation scrolled = page().scroll(0, 3000, true, false).build();

        ScrollGuardResult result = evaluator.scrollGuard(scroll(820), noScroll, noScroll);
        assertTrue(result.isChecked());
        assertFalse(result.isStuck());
        assertEquals(0, result.getDeltaY());
        assertFalse(evaluator.scrollGuard(scroll(820), scrolled, noScroll).isStuck());
        assertFalse(evaluator.scrollGuard(scroll(-820), noScroll, scrolled).isStuck());
    }

    @Test
    void scrollPositionIsComparedOnlyWhenBothSidesReportIt() {
        Observation noScroll = page().build();
        Observation scrolled = page().scroll(600, 3000, false, false).build();

        assertFalse(evaluator.diff(noScroll, scrolled).isChanged());
        assertFalse(evaluator.diff(scrolled, noScroll).isChanged());
    }

    @Test
    void formatsIntegralNumbersWithoutFraction() {
        assertEquals("800", ChangeEvaluator.formatNumber(800.0));
        assertEquals("12.5", ChangeEvaluator.formatNumber(12.5));
    }
}
