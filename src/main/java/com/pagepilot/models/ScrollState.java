package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Scroll position reported by the page executor. {@code maxY} is the largest reachable scrollY.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScrollState {

    private double x;
    private double y;
    private double maxY;
    private boolean atTop;
    private boolean atBottom;

    public ScrollState() {
    }

    public ScrollState(double y, double maxY, boolean atTop, boolean atBottom) {
        this.y = y;
        this.maxY = maxY;
        this.atTop = atTop;
        this.atBottom = atBottom;
    }

    public double getX() {
        return x;
    }

    public void setX(double x) {
        this.x = x;
    }

    public double getY() {
        return y;
    }

    public void setY(double y) {
        this.y = y;
    }

    public double getMaxY() {
        return maxY;
    }

    public void setMaxY(double maxY) {
        this.maxY = maxY;
    }

    public boolean isAtTop() {
        return atTop;
    }

    public void setAtTop(boolean atTop) {
        this.atTop = atTop;
    }

    public boolean isAtBottom() {
        return atBottom;
    }

    public void setAtBottom(boolean atBottom) {
        this.atBottom = atBottom;
    }
}
