package com.pagepilot.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of the page at one instant. Produced before and after each action.
 */
public final class Observation {

    public static final int MAX_ELEMENTS = 200;

    private final String url;
    private final String title;
    private final long timestamp;
    private final int viewportWidth;
    private final int viewportHeight;
    private final double scrollX;
    private final double scrollY;
    private final double maxScrollY;
    private final boolean hasScroll;
    private final boolean atTop;
    private final boolean atBottom;
    private final List<PageElement> elements;
    private final String textSnippet;
    private final String domSignature;
    private final String screenshotDataUrl;
    private final String screenshotHash;

    private Observation(Builder b) {
        this.url = b.url != null ? b.url : "";
        this.title = b.title != null ? b.title : "";
        this.timestamp = b.timestamp;
        this.viewportWidth = b.viewportWidth;
        this.viewportHeight = b.viewportHeight;
        this.scrollX = b.scrollX;
        this.scrollY = b.scrollY;
        this.maxScrollY = b.maxScrollY;
        this.hasScroll = b.hasScroll;
        this.atTop = b.atTop;
        this.atBottom = b.atBottom;
        this.elements = Collections.unmodifiableList(new ArrayList<>(b.elements));
        this.textSnippet = b.textSnippet != null ? b.textSnippet : "";
        this.domSignature = b.domSignature != null ? b.domSignature : "";
        this.screenshotDataUrl = b.screenshotDataUrl;
        this.screenshotHash = b.screenshotHash;
    }

    /**
     * Freeze an executor page state. {@code fallbackUrl} is used when the executor reports no URL.
     * Keeps at most {@link #MAX_ELEMENTS} elements. A missing or non-finite scroll position leaves
     * the observation without scroll data.
     */
    public static Observation from(PageState state, String fallbackUrl, Screenshot screenshot, long timestamp) {
        Builder b = builder()
            .url(state.getUrl() != null && !state.getUrl().isBlank() ? state.getUrl() : fallbackUrl)
            .title(state.getTitle())
            .timestamp(timestamp)
            .textSnippet(state.getTextSnippet())
            .domSignature(state.getDomSignature());
        if (state.getViewport() != null) {
            b.viewport(state.getViewport().getWidth(), state.getViewport().getHeight());
        }
        ScrollState scroll = state.getScroll();
        if (scroll != null && Double.isFinite(scroll.getY())) {
            b.scroll(scroll.getY(), scroll.getMaxY(), scroll.isAtTop(), scroll.isAtBottom());
            b.scrollX(scroll.getX());
        }
        if (state.getElements() != null) {
            int kept = 0;
            for (PageElement element : state.getElements()) {
                if (kept >= MAX_ELEMENTS) {
                    break;
                }
                if (element != null) {
                    b.element(element);
                    kept++;
                }
            }
        }
        if (screenshot != null) {
            b.screenshot(screenshot.getDataUrl(), screenshot.getHash());
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public PageElement findElement(String elementId) {
        if (elementId == null) {
            return null;
        }
        for (PageElement element : elements) {
            if (elementId.equals(element.getId())) {
                return element;
            }
        }
        return null;
    }

    public String getUrl() {
        return url;
    }

    public String getTitle() {
        return title;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getViewportWidth() {
        return viewportWidth;
    }

    public int getViewportHeight() {
        return viewportHeight;
    }

    public double getScrollX() {
        return scrollX;
    }

    public double getScrollY() {
        return scrollY;
    }

    public double getMaxScrollY() {
        return maxScrollY;
    }

    /**
     * False when the page reported no usable scroll position; scroll fields are then zero.
     */
    public boolean hasScroll() {
        return hasScroll;
    }

    public boolean isAtTop() {
        return atTop;
    }

    public boolean isAtBottom() {
        return atBottom;
    }

    public List<PageElement> getElements() {
        return elements;
    }

    public String getTextSnippet() {
        return textSnippet;
    }

    public String getDomSignature() {
        return domSignature;
    }

    public String getScreenshotDataUrl() {
        return screenshotDataUrl;
    }

    public String getScreenshotHash() {
        return screenshotHash;
    }

    public boolean hasScreenshot() {
        return screenshotDataUrl != null && !screenshotDataUrl.isBlank();
    }

    public static final class Builder {
        private String url;
        private String title;
        private long timestamp = System.currentTimeMillis();
        private int viewportWidth;
        private int viewportHeight;
        private double scrollX;
        private double scrollY;
        private double maxScrollY;
        private boolean hasScroll;
        private boolean atTop;
        private boolean atBottom;
        private final List<PageElement> elements = new ArrayList<>();
        private String textSnippet;
        private String domSignature;
        private String screenshotDataUrl;
        private String screenshotHash;

        private Builder() {
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder viewport(int width, int height) {
            this.viewportWidth = width;
            this.viewportHeight = height;
            return this;
        }

        public Builder scroll(double y, double maxY, boolean atTop, boolean atBottom) {
            this.scrollY = y;
            this.maxScrollY = maxY;
            this.hasScroll = true;
            this.atTop = atTop;
            this.atBottom = atBottom;
            return this;
        }

        public Builder scrollX(double x) {
            this.scrollX = x;
            return this;
        }

        public Builder element(PageElement element) {
            this.elements.add(element);
            return this;
        }

        public Builder textSnippet(String textSnippet) {
            this.textSnippet = textSnippet;
            return this;
        }

        public Builder domSignature(String domSignature) {
            this.domSignature = domSignature;
            return this;
        }

        public Builder screenshot(String dataUrl, String hash) {
            this.screenshotDataUrl = dataUrl;
            this.screenshotHash = hash;
            return this;
        }

        public Observation build() {
            return new Observation(this);
        }
    }
}
