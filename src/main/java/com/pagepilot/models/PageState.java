package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw page snapshot as reported by the page executor, before it is frozen into an {@link Observation}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PageState {

    private String url;
    private String title;
    private Viewport viewport;
    private ScrollState scroll;
    private List<PageElement> elements = new ArrayList<>();
    private String textSnippet;
    private String domSignature;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Viewport getViewport() {
        return viewport;
    }

    public void setViewport(Viewport viewport) {
        this.viewport = viewport;
    }

    public ScrollState getScroll() {
        return scroll;
    }

    public void setScroll(ScrollState scroll) {
        this.scroll = scroll;
    }

    public List<PageElement> getElements() {
        return elements;
    }

    public void setElements(List<PageElement> elements) {
        this.elements = elements;
    }

    public String getTextSnippet() {
        return textSnippet;
    }

    public void setTextSnippet(String textSnippet) {
        this.textSnippet = textSnippet;
    }

    public String getDomSignature() {
        return domSignature;
    }

    public void setDomSignature(String domSignature) {
        this.domSignature = domSignature;
    }
}
