package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-type action arguments. Only the fields a given {@link ActionType} needs are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionArgs {

    private String text;
    private Boolean pressEnter;
    private String key;
    private Integer dx;
    private Integer dy;
    private String url;
    private Integer ms;
    private Double x;
    private Double y;
    private Boolean normalized;
    private Integer moveMs;
    private Integer moveSteps;

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public Boolean getPressEnter() {
        return pressEnter;
    }

    public void setPressEnter(Boolean pressEnter) {
        this.pressEnter = pressEnter;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public Integer getDx() {
        return dx;
    }

    public void setDx(Integer dx) {
        this.dx = dx;
    }

    public Integer getDy() {
        return dy;
    }

    public void setDy(Integer dy) {
        this.dy = dy;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public Integer getMs() {
        return ms;
    }

    public void setMs(Integer ms) {
        this.ms = ms;
    }

    public Double getX() {
        return x;
    }

    public void setX(Double x) {
        this.x = x;
    }

    public Double getY() {
        return y;
    }

    public void setY(Double y) {
        this.y = y;
    }

    public Boolean getNormalized() {
        return normalized;
    }

    public void setNormalized(Boolean normalized) {
        this.normalized = normalized;
    }

    public Integer getMoveMs() {
        return moveMs;
    }

    public void setMoveMs(Integer moveMs) {
        this.moveMs = moveMs;
    }

    public Integer getMoveSteps() {
        return moveSteps;
    }

    public void setMoveSteps(Integer moveSteps) {
        this.moveSteps = moveSteps;
    }
}
