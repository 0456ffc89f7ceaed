package com.pagepilot.session;

import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.ActionType;
import com.pagepilot.models.Observation;
import com.pagepilot.util.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares the observations taken before and after an action.
 */
public class ChangeEvaluator {

    public ChangeResult diff(Observation before, Observation after) {
        List<String> reasons = new ArrayList<>();
        if (!Objects.equals(before.getUrl(), after.getUrl())) {
            reasons.add("URL changed: " + Values.safeUrl(before.getUrl()) + " -> " + Values.safeUrl(after.getUrl()));
        }
        if (!Objects.equals(before.getTitle(), after.getTitle())) {
            reasons.add("Title changed: \"" + before.getTitle() + "\" -> \"" + after.getTitle() + "\"");
        }
        if (before.hasScroll() && after.hasScroll() && before.getScrollY() != after.getScrollY()) {
            reasons.add("ScrollY changed: " + formatNumber(before.getScrollY()) + " -> " + formatNumber(after.getScrollY()));
        }
        String beforeDom = before.getDomSignature();
        String afterDom = after.getDomSignature();
        if (!beforeDom.isEmpty() && !afterDom.isEmpty() && !beforeDom.equals(afterDom)) {
            reasons.add("DOM signature changed");
        }
        String beforeShot = before.getScreenshotHash();
        String afterShot = after.getScreenshotHash();
        if (beforeShot != null && !beforeShot.isEmpty() && afterShot != null && !afterShot.isEmpty()
            && !beforeShot.equals(afterShot)) {
            reasons.add("Screenshot changed");
        }
        return new ChangeResult(reasons);
    }

    /**
     * A scroll is stuck when the page moved less than max(18px, 4% of the viewport height),
     * or when it sits at the boundary in the requested direction. Without a scroll position on
     * both sides nothing can be measured, so the scroll never counts as stuck.
     */
    public ScrollGuardResult scrollGuard(BrowserAction action, Observation before, Observation after) {
        if (action == null || !action.is(ActionType.SCROLL)) {
            return ScrollGuardResult.unchecked();
        }
        if (!before.hasScroll() || !after.hasScroll()) {
            return new ScrollGuardResult(true, false, 0, after.isAtTop(), after.isAtBottom());
        }
        long deltaY = Math.round(after.getScrollY() - before.getScrollY());
        int viewportHeight = after.getViewportHeight() > 0 ? after.getViewportHeight() : before.getViewportHeight();
        if (viewportHeight <= 0) {
            viewportHeight = 800;
        }
        long minMeaningfulMove = Math.max(18, Math.round(viewportHeight * 0.04));
        Integer requestedDy = action.getArgs().getDy();
        boolean movingDown = requestedDy == null || requestedDy >= 0;
        boolean movingUp = !movingDown;
        boolean atBottom = after.isAtBottom();
        boolean atTop = after.isAtTop();

        boolean lowProgress = Math.abs(deltaY) < minMeaningfulMove;
        boolean stuckDown = movingDown && (atBottom || deltaY < minMeaningfulMove);
        boolean stuckUp = movingUp && (atTop || -deltaY < minMeaningfulMove);
        return new ScrollGuardResult(true, lowProgress || stuckDown || stuckUp, deltaY, atTop, atBottom);
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
