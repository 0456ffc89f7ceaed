package com.pagepilot.session;

/**
 * Outcome of the scroll-progress check. Unchecked for anything but scroll actions.
 */
public class ScrollGuardResult {

    private static final ScrollGuardResult UNCHECKED = new ScrollGuardResult(false, false, 0, false, false);

    private final boolean checked;
    private final boolean stuck;
    private final long deltaY;
    private final boolean atTop;
    private final boolean atBottom;

    ScrollGuardResult(boolean checked, boolean stuck, long deltaY, boolean atTop, boolean atBottom) {
        this.checked = checked;
        this.stuck = stuck;
        this.deltaY = deltaY;
        this.atTop = atTop;
        this.atBottom = atBottom;
    }

    static ScrollGuardResult unchecked() {
        return UNCHECKED;
    }

    public boolean isChecked() {
        return checked;
    }

    public boolean isStuck() {
        return stuck;
    }

    public long getDeltaY() {
        return deltaY;
    }

    public boolean isAtTop() {
        return atTop;
    }

    public boolean isAtBottom() {
        return atBottom;
    }
}
