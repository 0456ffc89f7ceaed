package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionTarget {

    @JsonProperty("element_id")
    private String elementId;
    private String selector;

    public ActionTarget() {
    }

    public ActionTarget(String elementId, String selector) {
        this.elementId = elementId;
        this.selector = selector;
    }

    public String getElementId() {
        return elementId;
    }

    public void setElementId(String elementId) {
        this.elementId = elementId;
    }

    public String getSelector() {
        return selector;
    }

    public void setSelector(String selector) {
        this.selector = selector;
    }

    public boolean hasSelector() {
        return selector != null && !selector.isBlank();
    }
}
